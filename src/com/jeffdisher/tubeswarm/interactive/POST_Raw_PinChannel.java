package com.jeffdisher.tubeswarm.interactive;

import com.jeffdisher.tubeswarm.seeding.SeedingCache;
import com.jeffdisher.tubeswarm.types.ContentKey;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Pins a channel.
 * Returns nothing.
 */
public class POST_Raw_PinChannel implements ValidatedEntryPoints.POST_Raw
{
	private final SeedingCache _seeding;

	public POST_Raw_PinChannel(SeedingCache seeding)
	{
		_seeding = seeding;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		_seeding.pinChannel((ContentKey)path[0]);
		response.setStatus(HttpServletResponse.SC_OK);
	}
}
