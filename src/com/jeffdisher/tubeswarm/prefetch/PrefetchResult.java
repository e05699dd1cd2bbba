package com.jeffdisher.tubeswarm.prefetch;


/**
 * The outcome of starting a prefetch:  either the download was started, the item was found to already be local, a
 * session for the item was already running, or the item couldn't be resolved.
 * Note that a successful result only means the download was started.  Its eventual completion or failure is visible
 * through the session's stats.
 */
public record PrefetchResult(boolean success
		, boolean cached
		, boolean alreadyActive
		, long totalBlocks
		, long totalBytes
		, int peerCount
		, long initialBlocks
		, String error
)
{
	public static PrefetchResult started(long totalBlocks, long totalBytes, int peerCount, long initialBlocks)
	{
		return new PrefetchResult(true, false, false, totalBlocks, totalBytes, peerCount, initialBlocks, null);
	}

	public static PrefetchResult cached(long totalBlocks, long totalBytes, int peerCount)
	{
		return new PrefetchResult(true, true, false, totalBlocks, totalBytes, peerCount, totalBlocks, null);
	}

	public static PrefetchResult alreadyActive(PrefetchStats current)
	{
		return new PrefetchResult(true, false, true, current.totalBlocks(), current.totalBytes(), current.peerCount(), 0L, null);
	}

	public static PrefetchResult failure(String error)
	{
		return new PrefetchResult(false, false, false, 0L, 0L, 0, 0L, error);
	}
}
