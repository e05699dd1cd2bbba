package com.jeffdisher.tubeswarm.interactive;

import com.jeffdisher.tubeswarm.feed.PublicFeedDirectory;
import com.jeffdisher.tubeswarm.types.ContentKey;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Hides a channel from the public feed.
 * Returns nothing.
 */
public class POST_Raw_HideFeed implements ValidatedEntryPoints.POST_Raw
{
	private final PublicFeedDirectory _feed;

	public POST_Raw_HideFeed(PublicFeedDirectory feed)
	{
		_feed = feed;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		_feed.hide((ContentKey)path[0]);
		response.setStatus(HttpServletResponse.SC_OK);
	}
}
