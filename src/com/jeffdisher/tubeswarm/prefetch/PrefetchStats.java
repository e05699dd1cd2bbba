package com.jeffdisher.tubeswarm.prefetch;

import com.jeffdisher.tubeswarm.types.PrefetchStatus;


/**
 * An immutable snapshot of a download session.
 * 
 * @param status The session state (UNKNOWN if there is no session).
 * @param progress The percentage of the item's blocks which are local (0-100).
 * @param totalBlocks The number of blocks in the item.
 * @param downloadedBlocks The number of blocks which are local, including those which were already local at start.
 * @param totalBytes The size of the item.
 * @param downloadedBytes The estimated number of local bytes (proportional to the blocks).
 * @param peerCount The number of peers we are downloading from (or connected to, if the monitor doesn't know).
 * @param speedBytesPerSecond The current download speed reported by the monitor.
 * @param elapsedMillis The time since the session started (frozen once it finished).
 * @param isComplete True if all blocks are local.
 * @param error The failure message, if the session is in ERROR (null otherwise).
 */
public record PrefetchStats(PrefetchStatus status
		, int progress
		, long totalBlocks
		, long downloadedBlocks
		, long totalBytes
		, long downloadedBytes
		, int peerCount
		, double speedBytesPerSecond
		, long elapsedMillis
		, boolean isComplete
		, String error
)
{
	private static final PrefetchStats UNKNOWN = new PrefetchStats(PrefetchStatus.UNKNOWN, 0, 0L, 0L, 0L, 0L, 0, 0.0, 0L, false, null);

	/**
	 * @return The snapshot returned for items with no session.
	 */
	public static PrefetchStats unknown()
	{
		return UNKNOWN;
	}
}
