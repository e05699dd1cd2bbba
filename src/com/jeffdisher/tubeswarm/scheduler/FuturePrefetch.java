package com.jeffdisher.tubeswarm.scheduler;

import com.jeffdisher.tubeswarm.prefetch.PrefetchResult;
import com.jeffdisher.tubeswarm.utils.Assert;


/**
 * The asynchronously-returned result of starting a prefetch.  Failures are described inside the PrefetchResult, since
 * they are also visible as the session's ERROR status, so this future has no failure path.
 */
public class FuturePrefetch
{
	private PrefetchResult _result;

	/**
	 * Creates a future which has already completed.
	 * 
	 * @param result The result.
	 * @return The completed future.
	 */
	public static FuturePrefetch completed(PrefetchResult result)
	{
		FuturePrefetch future = new FuturePrefetch();
		future.success(result);
		return future;
	}

	/**
	 * Blocks until the prefetch has either started downloading, been found to be cached, or failed.
	 * 
	 * @return The result (never null).
	 */
	public synchronized PrefetchResult get()
	{
		while (null == _result)
		{
			try
			{
				this.wait();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption in this system.
				throw Assert.unexpected(e);
			}
		}
		return _result;
	}

	/**
	 * @return True if the result is available (get() won't block).
	 */
	public synchronized boolean isDone()
	{
		return (null != _result);
	}

	/**
	 * Sets the result.
	 * 
	 * @param result The result.
	 */
	public synchronized void success(PrefetchResult result)
	{
		Assert.assertTrue(null != result);
		Assert.assertTrue(null == _result);
		_result = result;
		this.notifyAll();
	}
}
