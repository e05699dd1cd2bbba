package com.jeffdisher.tubeswarm.prefetch;

import com.jeffdisher.tubeswarm.scheduler.FutureDownload;
import com.jeffdisher.tubeswarm.scheduler.FutureItemRange;
import com.jeffdisher.tubeswarm.types.BlockRange;
import com.jeffdisher.tubeswarm.types.ContentKey;
import com.jeffdisher.tubeswarm.types.ItemRef;


/**
 * The block store and transport the tracker downloads through.  The asynchronous calls must not block the caller.
 */
public interface IContentStore
{
	/**
	 * @return The number of peers currently connected.
	 */
	int currentPeerCount();

	/**
	 * Looks up where an item's blocks are in its content's block log.
	 * 
	 * @param item The item.
	 * @return The future range (fails with ContentLookupException if the item doesn't exist or can't be read).
	 */
	FutureItemRange resolveItem(ItemRef item);

	/**
	 * @param contentKey The content holding the blocks.
	 * @param range The range to check.
	 * @return The number of blocks in the range which are already stored locally.
	 */
	long localBlockCount(ContentKey contentKey, BlockRange range);

	/**
	 * Requests that all blocks of the range be fetched from peers.
	 * 
	 * @param contentKey The content holding the blocks.
	 * @param range The range to fetch.
	 * @return The future completing when the whole range is local (fails with TransferException).
	 */
	FutureDownload downloadRange(ContentKey contentKey, BlockRange range);

	/**
	 * @param contentKey The content holding the item.
	 * @param itemPath The item.
	 * @return A new monitor of the item's block arrivals.
	 */
	IBlockMonitor monitor(ContentKey contentKey, String itemPath);
}
