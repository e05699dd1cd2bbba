package com.jeffdisher.tubeswarm.interactive;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.tubeswarm.seeding.SeedingCache;
import com.jeffdisher.tubeswarm.types.UsageException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Sets the seeding storage budget, in GiB (clamped to the allowed range).
 * Returns {"maxStorageBytes": long}, the budget actually applied.
 */
public class POST_Raw_MaxStorage implements ValidatedEntryPoints.POST_Raw
{
	private final SeedingCache _seeding;

	public POST_Raw_MaxStorage(SeedingCache seeding)
	{
		_seeding = seeding;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		double gib = (Double)path[0];
		if (Double.isNaN(gib) || Double.isInfinite(gib))
		{
			throw new UsageException("Invalid storage size");
		}
		long applied = _seeding.setMaxStorage(gib);
		JsonObject result = new JsonObject();
		result.set("maxStorageBytes", applied);
		JsonGenerationHelpers.writeJson(response, result);
	}
}
