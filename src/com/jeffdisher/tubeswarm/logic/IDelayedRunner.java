package com.jeffdisher.tubeswarm.logic;


/**
 * Runs deferred work:  the completion grace period of download sessions and coalesced feed persistence.
 * Abstracted so that tests can run the deferred work explicitly instead of waiting on real time.
 */
public interface IDelayedRunner
{
	/**
	 * Schedules the task to run once, on some background thread, after at least delayMillis.
	 * 
	 * @param task The task to run.
	 * @param delayMillis The minimum delay before running it, in milliseconds.
	 */
	void runAfterDelay(Runnable task, long delayMillis);
}
