package com.jeffdisher.tubeswarm.prefetch;

import com.jeffdisher.tubeswarm.types.ItemRef;


/**
 * Notified of every download session change.  Called from the callback dispatcher, never while the tracker holds a
 * lock.
 */
public interface IStatsListener
{
	void statsUpdated(ItemRef item, PrefetchStats stats);
}
