package com.jeffdisher.tubeswarm.interactive;

import com.jeffdisher.tubeswarm.prefetch.PrefetchTracker;
import com.jeffdisher.tubeswarm.types.ContentKey;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Forgets the download session for an item (the download itself isn't cancelled).
 * Returns 200 on success or 404 if there was no session.
 */
public class DELETE_PrefetchStats implements ValidatedEntryPoints.DELETE
{
	private final PrefetchTracker _tracker;

	public DELETE_PrefetchStats(PrefetchTracker tracker)
	{
		_tracker = tracker;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		boolean didRemove = _tracker.removeStats((ContentKey)path[0], (String)path[1]);
		response.setStatus(didRemove ? HttpServletResponse.SC_OK : HttpServletResponse.SC_NOT_FOUND);
	}
}
