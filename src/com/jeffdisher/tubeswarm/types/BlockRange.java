package com.jeffdisher.tubeswarm.types;

import com.jeffdisher.tubeswarm.utils.Assert;


/**
 * The location of an item's blocks within its content's block log.
 * 
 * @param startBlock The first block of the item (inclusive).
 * @param endBlock The end of the item's blocks (exclusive).
 * @param totalBytes The byte length of the item.
 */
public record BlockRange(long startBlock, long endBlock, long totalBytes)
{
	public BlockRange
	{
		Assert.assertTrue(startBlock >= 0L);
		Assert.assertTrue(endBlock >= startBlock);
		Assert.assertTrue(totalBytes >= 0L);
	}

	/**
	 * @return The number of blocks in the range.
	 */
	public long totalBlocks()
	{
		return this.endBlock - this.startBlock;
	}
}
