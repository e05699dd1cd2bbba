package com.jeffdisher.tubeswarm.logic;

import java.util.LinkedList;
import java.util.Queue;
import java.util.function.Consumer;

import com.jeffdisher.tubeswarm.utils.Assert;
import com.jeffdisher.tubeswarm.utils.MiscHelpers;


/**
 * Hands listener notifications (feed updated, stats updated) off to a dedicated thread so that they are never run on a
 * peer channel thread or a download monitor thread, and never while a component holds its lock.
 * Notifications are run in the order they were accepted.
 */
public class CallbackDispatcher implements Consumer<Runnable>
{
	private final Thread _backgroundThread;
	private final Queue<Runnable> _pending;
	private boolean _keepRunning;

	public CallbackDispatcher()
	{
		_backgroundThread = MiscHelpers.createThread(() -> _backgroundMain(), "CallbackDispatcher");
		_pending = new LinkedList<>();
	}

	public void start()
	{
		synchronized (this)
		{
			_keepRunning = true;
		}
		_backgroundThread.start();
	}

	/**
	 * Stops accepting new notifications, runs the ones already accepted, and waits for the thread to exit.
	 */
	public void shutdown()
	{
		synchronized (this)
		{
			_keepRunning = false;
			this.notifyAll();
		}
		try
		{
			_backgroundThread.join();
		}
		catch (InterruptedException e)
		{
			// We don't expect the calling thread to be one which uses interrupts.
			throw Assert.unexpected(e);
		}
	}

	@Override
	public synchronized void accept(Runnable task)
	{
		Assert.assertTrue(null != task);
		// Notifications after shutdown are dropped:  nobody is listening anymore.
		if (_keepRunning)
		{
			_pending.add(task);
			this.notifyAll();
		}
	}


	private void _backgroundMain()
	{
		Runnable toRun = _backgroundGetNextTask();
		while (null != toRun)
		{
			toRun.run();
			toRun = _backgroundGetNextTask();
		}
	}

	private synchronized Runnable _backgroundGetNextTask()
	{
		while (_keepRunning && _pending.isEmpty())
		{
			try
			{
				this.wait();
			}
			catch (InterruptedException e)
			{
				// This thread doesn't use interruption.
				throw Assert.unexpected(e);
			}
		}
		// We still drain what was accepted before shutdown so tests see deterministic delivery.
		return _pending.poll();
	}
}
