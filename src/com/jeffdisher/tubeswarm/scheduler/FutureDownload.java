package com.jeffdisher.tubeswarm.scheduler;

import com.jeffdisher.tubeswarm.types.TransferException;
import com.jeffdisher.tubeswarm.utils.Assert;


/**
 * The asynchronously-returned result of a bulk block-range download, which has no returned data.
 * Note that this resolves when the whole range is locally available, independently of any monitor ticks.
 */
public class FutureDownload
{
	private boolean _didSucceed;
	private TransferException _exception;
	private Runnable _onComplete;

	/**
	 * Blocks for the asynchronous operation to complete.
	 * 
	 * @throws TransferException The exception which caused the download to fail.
	 */
	public synchronized void get() throws TransferException
	{
		while (!_didSucceed && (null == _exception))
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
	}

	/**
	 * Called to say that the download completed successfully.
	 */
	public void success()
	{
		Runnable callback;
		synchronized (this)
		{
			Assert.assertTrue(!_isDone());
			_didSucceed = true;
			callback = _takeCallback();
		}
		if (null != callback)
		{
			callback.run();
		}
	}

	/**
	 * Called to set the exception which caused the failure.
	 * 
	 * @param exception The exception to throw.
	 */
	public void failure(TransferException exception)
	{
		Assert.assertTrue(null != exception);
		Runnable callback;
		synchronized (this)
		{
			Assert.assertTrue(!_isDone());
			_exception = exception;
			callback = _takeCallback();
		}
		if (null != callback)
		{
			callback.run();
		}
	}

	/**
	 * Registers a callback to run once the future completes, on the completing thread (or immediately, on the calling
	 * thread, if it already completed).  Only one callback can be registered.
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
		return _didSucceed || (null != _exception);
	}

	private Runnable _takeCallback()
	{
		this.notifyAll();
		Runnable callback = _onComplete;
		_onComplete = null;
		return callback;
	}
}
