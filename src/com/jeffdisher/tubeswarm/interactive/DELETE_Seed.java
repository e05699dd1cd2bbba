package com.jeffdisher.tubeswarm.interactive;

import com.jeffdisher.tubeswarm.seeding.SeedingCache;
import com.jeffdisher.tubeswarm.types.ContentKey;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Stops seeding one item.
 * Returns 200 on success or 404 if the item wasn't being seeded.
 */
public class DELETE_Seed implements ValidatedEntryPoints.DELETE
{
	private final SeedingCache _seeding;

	public DELETE_Seed(SeedingCache seeding)
	{
		_seeding = seeding;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		ContentKey key = (ContentKey)path[0];
		String itemPath = (String)path[1];
		boolean didRemove = _seeding.removeSeed(key, itemPath);
		response.setStatus(didRemove ? HttpServletResponse.SC_OK : HttpServletResponse.SC_NOT_FOUND);
	}
}
