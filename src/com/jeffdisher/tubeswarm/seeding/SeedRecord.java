package com.jeffdisher.tubeswarm.seeding;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.tubeswarm.types.ContentKey;
import com.jeffdisher.tubeswarm.types.ItemRef;
import com.jeffdisher.tubeswarm.types.SeedReason;


/**
 * One locally-retained item which this node keeps serving to other peers.
 * 
 * @param item The content key and item path of the seeded item.
 * @param reason Why we are keeping it (determines eviction priority).
 * @param addedMillis When it was added, in milliseconds since the epoch.
 * @param blockCount The number of blocks of the item.
 * @param byteSize The size of the item, in bytes (this is what counts against the storage budget).
 */
public record SeedRecord(ItemRef item, SeedReason reason, long addedMillis, long blockCount, long byteSize)
{
	private static final String FIELD_CONTENT_KEY = "contentKey";
	private static final String FIELD_ITEM_PATH = "itemPath";
	private static final String FIELD_REASON = "reason";
	private static final String FIELD_ADDED_AT = "addedAt";
	private static final String FIELD_BLOCKS = "blocks";
	private static final String FIELD_BYTES = "bytes";

	/**
	 * Reads a record from its stored form.
	 * 
	 * @param json The stored object.
	 * @return The record or null if the stored object was missing required fields, had a field of the wrong type, or
	 * had an invalid key or reason.
	 */
	public static SeedRecord fromJson(JsonObject json)
	{
		ContentKey key = ContentKey.fromHex(StoredFields.readString(json, FIELD_CONTENT_KEY));
		String itemPath = StoredFields.readString(json, FIELD_ITEM_PATH);
		SeedReason reason = SeedReason.fromName(StoredFields.readString(json, FIELD_REASON));
		Long addedMillis = StoredFields.readLong(json, FIELD_ADDED_AT, 0L);
		Long blockCount = StoredFields.readLong(json, FIELD_BLOCKS, 0L);
		Long byteSize = StoredFields.readLong(json, FIELD_BYTES, 0L);
		boolean isValid = (null != key)
				&& (null != itemPath)
				&& (null != reason)
				&& (null != addedMillis)
				&& (null != blockCount)
				&& (null != byteSize)
				&& (blockCount >= 0L)
				&& (byteSize >= 0L)
		;
		return isValid
				? new SeedRecord(new ItemRef(key, itemPath), reason, addedMillis, blockCount, byteSize)
				: null
		;
	}

	public JsonObject toJson()
	{
		JsonObject json = new JsonObject();
		json.add(FIELD_CONTENT_KEY, this.item.contentKey().toHex());
		json.add(FIELD_ITEM_PATH, this.item.itemPath());
		json.add(FIELD_REASON, this.reason.storedName);
		json.add(FIELD_ADDED_AT, this.addedMillis);
		json.add(FIELD_BLOCKS, this.blockCount);
		json.add(FIELD_BYTES, this.byteSize);
		return json;
	}
}
