package com.jeffdisher.tubeswarm.seeding;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.tubeswarm.utils.MiscHelpers;


/**
 * The process-wide seeding preferences, persisted under "seeding-config".
 */
public class SeedingConfig
{
	public static final String FIELD_MAX_STORAGE_BYTES = "maxStorageBytes";
	public static final String FIELD_AUTO_SEED_WATCHED = "autoSeedWatched";
	public static final String FIELD_AUTO_SEED_SUBSCRIBED = "autoSeedSubscribed";
	public static final String FIELD_MAX_ITEMS_PER_CHANNEL = "maxItemsPerChannel";

	// 5 GiB is small enough to not surprise anyone but still holds a handful of videos.
	public static final long DEFAULT_MAX_STORAGE_BYTES = 5L * MiscHelpers.BYTES_PER_GIB;
	// Viewers become seeders by default.
	public static final boolean DEFAULT_AUTO_SEED_WATCHED = true;
	// Seeding whole subscriptions is opt-in since it can use a lot of bandwidth.
	public static final boolean DEFAULT_AUTO_SEED_SUBSCRIBED = false;
	public static final int DEFAULT_MAX_ITEMS_PER_CHANNEL = 10;


	public static SeedingConfig defaultConfig()
	{
		SeedingConfig config = new SeedingConfig();
		config.maxStorageBytes = DEFAULT_MAX_STORAGE_BYTES;
		config.autoSeedWatched = DEFAULT_AUTO_SEED_WATCHED;
		config.autoSeedSubscribed = DEFAULT_AUTO_SEED_SUBSCRIBED;
		config.maxItemsPerChannel = DEFAULT_MAX_ITEMS_PER_CHANNEL;
		return config;
	}

	/**
	 * Reads the stored config over top of the defaults, so fields missing from older stored versions (or stored with
	 * the wrong type) keep their default values.
	 * 
	 * @param json The stored object.
	 * @return The config.
	 */
	public static SeedingConfig fromJson(JsonObject json)
	{
		SeedingConfig config = defaultConfig();
		Long maxStorageBytes = StoredFields.readLong(json, FIELD_MAX_STORAGE_BYTES, config.maxStorageBytes);
		if ((null != maxStorageBytes) && (maxStorageBytes > 0L))
		{
			config.maxStorageBytes = maxStorageBytes;
		}
		Boolean autoSeedWatched = StoredFields.readBoolean(json, FIELD_AUTO_SEED_WATCHED, config.autoSeedWatched);
		if (null != autoSeedWatched)
		{
			config.autoSeedWatched = autoSeedWatched;
		}
		Boolean autoSeedSubscribed = StoredFields.readBoolean(json, FIELD_AUTO_SEED_SUBSCRIBED, config.autoSeedSubscribed);
		if (null != autoSeedSubscribed)
		{
			config.autoSeedSubscribed = autoSeedSubscribed;
		}
		Integer maxItemsPerChannel = StoredFields.readInt(json, FIELD_MAX_ITEMS_PER_CHANNEL, config.maxItemsPerChannel);
		if (null != maxItemsPerChannel)
		{
			config.maxItemsPerChannel = maxItemsPerChannel;
		}
		return config;
	}


	// These are exposed just as public fields since this is effectively a mutable struct.
	/**
	 * The storage budget for seeds.  Quota enforcement evicts non-pinned seeds until usage is at or below this.
	 */
	public long maxStorageBytes;
	/**
	 * If false, WATCHED seeds are refused.
	 */
	public boolean autoSeedWatched;
	/**
	 * If true, items from subscribed channels may be seeded (up to maxItemsPerChannel per channel).
	 */
	public boolean autoSeedSubscribed;
	/**
	 * The maximum number of SUBSCRIBED seeds kept for any one channel.
	 */
	public int maxItemsPerChannel;

	// We keep this private just so the factory is used to explicitly create the defaults.
	private SeedingConfig()
	{
	}

	/**
	 * @return A copy of the receiver, so callers outside the cache can't mutate its state.
	 */
	public SeedingConfig copy()
	{
		SeedingConfig copy = new SeedingConfig();
		copy.maxStorageBytes = this.maxStorageBytes;
		copy.autoSeedWatched = this.autoSeedWatched;
		copy.autoSeedSubscribed = this.autoSeedSubscribed;
		copy.maxItemsPerChannel = this.maxItemsPerChannel;
		return copy;
	}

	/**
	 * Merges the non-null fields of the update into the receiver.
	 * 
	 * @param update The partial update.
	 */
	public void merge(ConfigUpdate update)
	{
		if (null != update.maxStorageBytes())
		{
			this.maxStorageBytes = update.maxStorageBytes();
		}
		if (null != update.autoSeedWatched())
		{
			this.autoSeedWatched = update.autoSeedWatched();
		}
		if (null != update.autoSeedSubscribed())
		{
			this.autoSeedSubscribed = update.autoSeedSubscribed();
		}
		if (null != update.maxItemsPerChannel())
		{
			this.maxItemsPerChannel = update.maxItemsPerChannel();
		}
	}

	public JsonObject toJson()
	{
		JsonObject json = new JsonObject();
		json.add(FIELD_MAX_STORAGE_BYTES, this.maxStorageBytes);
		json.add(FIELD_AUTO_SEED_WATCHED, this.autoSeedWatched);
		json.add(FIELD_AUTO_SEED_SUBSCRIBED, this.autoSeedSubscribed);
		json.add(FIELD_MAX_ITEMS_PER_CHANNEL, this.maxItemsPerChannel);
		return json;
	}


	/**
	 * A partial config change:  null fields are left as they are.
	 */
	public static record ConfigUpdate(Long maxStorageBytes
			, Boolean autoSeedWatched
			, Boolean autoSeedSubscribed
			, Integer maxItemsPerChannel
	)
	{
		public static ConfigUpdate maxStorage(long bytes)
		{
			return new ConfigUpdate(bytes, null, null, null);
		}
	}
}
