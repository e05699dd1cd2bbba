package com.jeffdisher.tubeswarm.testutils;

import java.util.function.LongSupplier;


/**
 * A clock the test advances explicitly.
 */
public class MockTimeGenerator implements LongSupplier
{
	public long currentTimeMillis = 1000L;

	@Override
	public synchronized long getAsLong()
	{
		return this.currentTimeMillis;
	}

	public synchronized void advance(long millis)
	{
		this.currentTimeMillis += millis;
	}
}
