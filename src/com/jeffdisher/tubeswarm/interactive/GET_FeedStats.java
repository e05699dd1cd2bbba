package com.jeffdisher.tubeswarm.interactive;

import com.jeffdisher.tubeswarm.feed.PublicFeedDirectory;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Returns the feed stats as a JSON struct:
 * -"totalEntries" (int)
 * -"hiddenCount" (int)
 * -"peerCount" (int)
 */
public class GET_FeedStats implements ValidatedEntryPoints.GET
{
	private final PublicFeedDirectory _feed;

	public GET_FeedStats(PublicFeedDirectory feed)
	{
		_feed = feed;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		JsonGenerationHelpers.writeJson(response, JsonGenerationHelpers.feedStats(_feed.getStats()));
	}
}
