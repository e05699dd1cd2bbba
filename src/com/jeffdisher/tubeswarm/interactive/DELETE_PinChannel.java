package com.jeffdisher.tubeswarm.interactive;

import com.jeffdisher.tubeswarm.seeding.SeedingCache;
import com.jeffdisher.tubeswarm.types.ContentKey;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Unpins a channel.
 * Returns 200 on success or 404 if the channel wasn't pinned.
 */
public class DELETE_PinChannel implements ValidatedEntryPoints.DELETE
{
	private final SeedingCache _seeding;

	public DELETE_PinChannel(SeedingCache seeding)
	{
		_seeding = seeding;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable
	{
		boolean didUnpin = _seeding.unpinChannel((ContentKey)path[0]);
		response.setStatus(didUnpin ? HttpServletResponse.SC_OK : HttpServletResponse.SC_NOT_FOUND);
	}
}
