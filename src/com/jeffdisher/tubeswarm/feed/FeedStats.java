package com.jeffdisher.tubeswarm.feed;


public record FeedStats(int totalEntries, int hiddenCount, int peerCount)
{
}
