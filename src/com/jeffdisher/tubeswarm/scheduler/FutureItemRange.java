package com.jeffdisher.tubeswarm.scheduler;

import com.jeffdisher.tubeswarm.types.BlockRange;
import com.jeffdisher.tubeswarm.types.ContentLookupException;
import com.jeffdisher.tubeswarm.utils.Assert;


/**
 * The asynchronously-returned result of resolving an item to its block range in the content store.
 */
public class FutureItemRange
{
	private BlockRange _range;
	private ContentLookupException _exception;
	private Runnable _onComplete;

	/**
	 * Blocks for the asynchronous operation to complete.
	 * 
	 * @return The resolved range (never null).
	 * @throws ContentLookupException The item couldn't be resolved.
	 */
	public synchronized BlockRange get() throws ContentLookupException
	{
		while ((null == _range) && (null == _exception))
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
		if (null != _exception)
		{
			throw _exception;
		}
		return _range;
	}

	/**
	 * Called to set the resolved range on success.
	 * 
	 * @param range The range to return.
	 */
	public void success(BlockRange range)
	{
		Assert.assertTrue(null != range);
		Runnable callback;
		synchronized (this)
		{
			Assert.assertTrue(!_isDone());
			_range = range;
			callback = _takeCallback();
		}
		_run(callback);
	}

	/**
	 * Called to notify the future that the resolve failed.
	 * 
	 * @param exception The failure.
	 */
	public void failure(ContentLookupException exception)
	{
		Assert.assertTrue(null != exception);
		Runnable callback;
		synchronized (this)
		{
			Assert.assertTrue(!_isDone());
			_exception = exception;
			callback = _takeCallback();
		}
		_run(callback);
	}

	/**
	 * Registers a callback to run once the future completes, on the completing thread.  If it has already completed,
	 * the callback is run immediately on the calling thread.  The callback can call get() without blocking.
	 * Only one callback can be registered.
	 * 
	 * @param onComplete The callback.
	 */
	public void registerOnComplete(Runnable onComplete)
	{
		Assert.assertTrue(null != onComplete);
		boolean runNow;
		synchronized (this)
		{
			Assert.assertTrue(null == _onComplete);
			runNow = _isDone();
			if (!runNow)
			{
				_onComplete = onComplete;
			}
		}
		if (runNow)
		{
			onComplete.run();
		}
	}


	private boolean _isDone()
	{
		return (null != _range) || (null != _exception);
	}

	private Runnable _takeCallback()
	{
		this.notifyAll();
		Runnable callback = _onComplete;
		_onComplete = null;
		return callback;
	}

	private static void _run(Runnable callback)
	{
		// Callbacks are always run outside of our monitor.
		if (null != callback)
		{
			callback.run();
		}
	}
}
