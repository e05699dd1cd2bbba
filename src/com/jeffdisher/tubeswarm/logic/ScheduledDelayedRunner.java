package com.jeffdisher.tubeswarm.logic;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.jeffdisher.tubeswarm.utils.MiscHelpers;


/**
 * The real IDelayedRunner, backed by a single scheduler thread.  Tasks are expected to be short (they just tear down
 * monitors or write small metadata values).
 */
public class ScheduledDelayedRunner implements IDelayedRunner
{
	private final ScheduledExecutorService _executor;

	public ScheduledDelayedRunner()
	{
		_executor = new ScheduledThreadPoolExecutor(1, (Runnable r) -> MiscHelpers.createThread(r, "ScheduledDelayedRunner"));
	}

	@Override
	public void runAfterDelay(Runnable task, long delayMillis)
	{
		_executor.schedule(task, delayMillis, TimeUnit.MILLISECONDS);
	}

	/**
	 * Drops any tasks which haven't run yet and stops the thread.
	 */
	public void shutdown()
	{
		_executor.shutdownNow();
	}
}
