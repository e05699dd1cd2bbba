package com.jeffdisher.tubeswarm.prefetch;


/**
 * Watches the arrival of an item's blocks in the content store.
 */
public interface IBlockMonitor
{
	/**
	 * The monitor's cumulative accounting.
	 * 
	 * @param blocks The number of blocks received since the monitor was created.
	 * @param peers The number of peers blocks are currently arriving from (0 if unknown).
	 */
	public static record Stats(long blocks, int peers)
	{
	}

	/**
	 * Sets the listener called, on some store thread, whenever new blocks of the item arrive.  Calls for one monitor
	 * are made sequentially.
	 * 
	 * @param listener The listener.
	 */
	void setUpdateListener(Runnable listener);

	/**
	 * @return The cumulative accounting since the monitor was created.
	 */
	Stats downloadStats();

	/**
	 * @return The current download speed, in bytes per second.
	 */
	double downloadSpeed();

	/**
	 * Detaches the listener and releases the monitor.  No listener calls start after this returns.
	 */
	void close();
}
