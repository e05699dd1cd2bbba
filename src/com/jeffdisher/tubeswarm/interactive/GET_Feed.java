package com.jeffdisher.tubeswarm.interactive;

import com.jeffdisher.tubeswarm.feed.PublicFeedDirectory;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Returns the public feed, newest first, as a JSON array of objects:
 * -"driveKey" (string)
 * -"addedAt" (long, millis)
 * -"source" ("local" or "peer")
 */
public class GET_Feed implements ValidatedEntryPoints.GET
{
	private final PublicFeedDirectory _feed;

	public GET_Feed(PublicFeedDirectory feed)
	{
		_feed = feed;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		JsonGenerationHelpers.writeJson(response, JsonGenerationHelpers.feed(_feed.listFeed()));
	}
}
