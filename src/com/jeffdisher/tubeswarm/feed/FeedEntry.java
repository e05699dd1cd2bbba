package com.jeffdisher.tubeswarm.feed;

import com.jeffdisher.tubeswarm.types.ContentKey;
import com.jeffdisher.tubeswarm.types.FeedOrigin;


/**
 * One content key known to exist somewhere in the swarm.
 * 
 * @param key The content key.
 * @param discoveredMillis When this node first learned of it, in milliseconds since the epoch.
 * @param origin Whether it was learned from a peer or submitted locally.
 */
public record FeedEntry(ContentKey key, long discoveredMillis, FeedOrigin origin)
{
}
