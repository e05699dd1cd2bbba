package com.jeffdisher.tubeswarm.interactive;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.tubeswarm.feed.PublicFeedDirectory;
import com.jeffdisher.tubeswarm.types.ContentKey;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Publishes a channel to the public feed and announces it to all peers.
 * Returns {"peers": int}, the number of peers it was announced to.
 */
public class POST_Raw_SubmitFeed implements ValidatedEntryPoints.POST_Raw
{
	private final PublicFeedDirectory _feed;

	public POST_Raw_SubmitFeed(PublicFeedDirectory feed)
	{
		_feed = feed;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		ContentKey key = (ContentKey)path[0];
		int peers = _feed.submit(key);
		JsonObject result = new JsonObject();
		result.set("peers", peers);
		JsonGenerationHelpers.writeJson(response, result);
	}
}
