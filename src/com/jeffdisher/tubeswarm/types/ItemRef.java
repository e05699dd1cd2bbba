package com.jeffdisher.tubeswarm.types;

import com.jeffdisher.tubeswarm.utils.Assert;


/**
 * Names one item (a video, typically) within the content published under a content key.
 * 
 * @param contentKey The key of the channel or drive holding the item.
 * @param itemPath The path (or id) of the item within that content.
 */
public record ItemRef(ContentKey contentKey, String itemPath)
{
	public ItemRef
	{
		Assert.assertTrue(null != contentKey);
		Assert.assertTrue(null != itemPath);
	}

	/**
	 * @return The "key:path" string used when storing this reference.
	 */
	public String toStorageKey()
	{
		return this.contentKey.toHex() + ":" + this.itemPath;
	}

	@Override
	public String toString()
	{
		return this.contentKey.shortForm() + ":" + this.itemPath;
	}
}
