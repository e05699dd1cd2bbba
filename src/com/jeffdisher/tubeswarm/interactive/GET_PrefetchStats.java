package com.jeffdisher.tubeswarm.interactive;

import com.jeffdisher.tubeswarm.prefetch.PrefetchTracker;
import com.jeffdisher.tubeswarm.types.ContentKey;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Returns the download session snapshot for an item (status "unknown" if there is no session).
 */
public class GET_PrefetchStats implements ValidatedEntryPoints.GET
{
	private final PrefetchTracker _tracker;

	public GET_PrefetchStats(PrefetchTracker tracker)
	{
		_tracker = tracker;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		ContentKey key = (ContentKey)path[0];
		String itemPath = (String)path[1];
		JsonGenerationHelpers.writeJson(response, JsonGenerationHelpers.prefetchStats(_tracker.getStats(key, itemPath)));
	}
}
