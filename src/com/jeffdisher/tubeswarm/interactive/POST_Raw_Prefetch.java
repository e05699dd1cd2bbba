package com.jeffdisher.tubeswarm.interactive;

import com.jeffdisher.tubeswarm.prefetch.PrefetchResult;
import com.jeffdisher.tubeswarm.prefetch.PrefetchTracker;
import com.jeffdisher.tubeswarm.types.ContentKey;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Starts prefetching an item, waiting until the download has started (or was found to be unnecessary or impossible).
 * Returns the start result as a JSON struct ("success" is false if the item couldn't be resolved).
 */
public class POST_Raw_Prefetch implements ValidatedEntryPoints.POST_Raw
{
	private final PrefetchTracker _tracker;

	public POST_Raw_Prefetch(PrefetchTracker tracker)
	{
		_tracker = tracker;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		ContentKey key = (ContentKey)path[0];
		String itemPath = (String)path[1];
		PrefetchResult result = _tracker.start(key, itemPath).get();
		JsonGenerationHelpers.writeJson(response, JsonGenerationHelpers.prefetchResult(result));
	}
}
