package com.jeffdisher.tubeswarm.interactive;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.tubeswarm.feed.PublicFeedDirectory;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Asks the connected peers to merge our full set (and answer with anything new).
 * Returns {"peers": int}, the number of peers contacted.
 */
public class POST_Raw_RefreshFeed implements ValidatedEntryPoints.POST_Raw
{
	private final PublicFeedDirectory _feed;

	public POST_Raw_RefreshFeed(PublicFeedDirectory feed)
	{
		_feed = feed;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		JsonObject result = new JsonObject();
		result.set("peers", _feed.requestRefresh());
		JsonGenerationHelpers.writeJson(response, result);
	}
}
