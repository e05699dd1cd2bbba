package com.jeffdisher.tubeswarm.interactive;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.tubeswarm.seeding.SeedingCache;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Drops every seed which isn't pinned.
 * Returns {"bytesCleared": long}.
 */
public class POST_Raw_ClearCache implements ValidatedEntryPoints.POST_Raw
{
	private final SeedingCache _seeding;

	public POST_Raw_ClearCache(SeedingCache seeding)
	{
		_seeding = seeding;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		long bytesCleared = _seeding.clearCache();
		JsonObject result = new JsonObject();
		result.set("bytesCleared", bytesCleared);
		JsonGenerationHelpers.writeJson(response, result);
	}
}
