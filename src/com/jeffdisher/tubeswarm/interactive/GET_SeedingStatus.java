package com.jeffdisher.tubeswarm.interactive;

import com.jeffdisher.tubeswarm.seeding.SeedingCache;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Returns the seeding status as a JSON struct:
 * -"activeSeeds" (int)
 * -"pinnedChannels" (int)
 * -"storageUsedBytes" (long)
 * -"maxStorageBytes" (long)
 * -"config" (object)
 * -"seeds" (array of objects)
 */
public class GET_SeedingStatus implements ValidatedEntryPoints.GET
{
	private final SeedingCache _seeding;

	public GET_SeedingStatus(SeedingCache seeding)
	{
		_seeding = seeding;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		JsonGenerationHelpers.writeJson(response, JsonGenerationHelpers.seedingStatus(_seeding.getStatus()));
	}
}
