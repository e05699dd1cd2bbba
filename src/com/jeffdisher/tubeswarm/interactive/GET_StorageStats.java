package com.jeffdisher.tubeswarm.interactive;

import com.jeffdisher.tubeswarm.seeding.SeedingCache;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Returns the storage usage against the budget as a JSON struct:
 * -"usedBytes" (long)
 * -"maxBytes" (long)
 * -"usedGB" (double)
 * -"maxGB" (double)
 * -"seedCount" (int)
 * -"pinnedCount" (int)
 */
public class GET_StorageStats implements ValidatedEntryPoints.GET
{
	private final SeedingCache _seeding;

	public GET_StorageStats(SeedingCache seeding)
	{
		_seeding = seeding;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		JsonGenerationHelpers.writeJson(response, JsonGenerationHelpers.storageStats(_seeding.getStorageStats()));
	}
}
