package com.jeffdisher.tubeswarm.seeding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;

import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.tubeswarm.logic.ILogger;
import com.jeffdisher.tubeswarm.logic.IMetaStore;
import com.jeffdisher.tubeswarm.types.ContentKey;
import com.jeffdisher.tubeswarm.types.ItemRef;
import com.jeffdisher.tubeswarm.types.PersistenceException;
import com.jeffdisher.tubeswarm.types.SeedReason;
import com.jeffdisher.tubeswarm.utils.Assert;
import com.jeffdisher.tubeswarm.utils.MiscHelpers;


/**
 * The set of items this node keeps serving to other peers, along with the pinned channels and the storage budget.
 * The seed table (and config) and the pinned set each have their own lock and are persisted independently.
 * Every mutation is applied in memory before it is persisted, so a PersistenceException thrown from a mutating call
 * means the change happened but may not survive a restart.
 */
public class SeedingCache
{
	public static final String KEY_CONFIG = "seeding-config";
	public static final String KEY_PINNED = "pinned-channels";
	public static final String KEY_SEEDS = "active-seeds";
	public static final int MIN_STORAGE_GIB = 1;
	public static final int MAX_STORAGE_GIB = 100;

	private final IMetaStore _store;
	private final ILogger _logger;
	private final LongSupplier _currentTimeMillisGenerator;

	private final Object _seedLock = new Object();
	// Guarded by _seedLock.
	private SeedingConfig _config;
	private final Map<ItemRef, SeedRecord> _seeds;
	private boolean _isInitialized;

	private final Object _pinnedLock = new Object();
	// Guarded by _pinnedLock.
	private final Set<ContentKey> _pinnedChannels;

	public SeedingCache(IMetaStore store, ILogger logger, LongSupplier currentTimeMillisGenerator)
	{
		_store = store;
		_logger = logger;
		_currentTimeMillisGenerator = currentTimeMillisGenerator;
		_config = SeedingConfig.defaultConfig();
		_seeds = new LinkedHashMap<>();
		_pinnedChannels = new LinkedHashSet<>();
	}

	/**
	 * Loads the config, the pinned channels, and the seed table from the metadata store.  Must be called once, before
	 * any other method.
	 * Stored entries which can't be interpreted are logged and skipped.
	 * 
	 * @throws PersistenceException The store couldn't be read.
	 */
	public void init() throws PersistenceException
	{
		ILogger log = _logger.logStart("Loading seeding state...");
		JsonValue rawConfig = _store.get(KEY_CONFIG);
		JsonValue rawPinned = _store.get(KEY_PINNED);
		JsonValue rawSeeds = _store.get(KEY_SEEDS);
		synchronized (_pinnedLock)
		{
			if ((null != rawPinned) && rawPinned.isArray())
			{
				for (JsonValue element : rawPinned.asArray())
				{
					ContentKey key = element.isString() ? ContentKey.fromHex(element.asString()) : null;
					if (null != key)
					{
						_pinnedChannels.add(key);
					}
					else
					{
						log.logError("Skipping invalid pinned channel: " + element);
					}
				}
			}
		}
		synchronized (_seedLock)
		{
			Assert.assertTrue(!_isInitialized);
			if ((null != rawConfig) && rawConfig.isObject())
			{
				_config = SeedingConfig.fromJson(rawConfig.asObject());
			}
			if ((null != rawSeeds) && rawSeeds.isObject())
			{
				for (JsonObject.Member member : rawSeeds.asObject())
				{
					SeedRecord record = member.getValue().isObject()
							? SeedRecord.fromJson(member.getValue().asObject())
							: null
					;
					if (null != record)
					{
						_seeds.put(record.item(), record);
					}
					else
					{
						log.logError("Skipping invalid seed entry: " + member.getName());
					}
				}
			}
			_isInitialized = true;
			log.logFinish("Loaded " + _seeds.size() + " seeds and " + _pinnedChannels.size() + " pinned channels (budget " + MiscHelpers.humanReadableBytes(_config.maxStorageBytes) + ")");
		}
	}

	/**
	 * Starts seeding an item.
	 * 
	 * @param contentKey The key of the content holding the item.
	 * @param itemPath The item within that content.
	 * @param reason Why we are seeding it.
	 * @param blockCount The number of blocks in the item.
	 * @param byteSize The size of the item, in bytes.
	 * @return True if the seed was added, false if it was refused (already seeded or WATCHED seeding is disabled).
	 * @throws PersistenceException The seed was added in memory but the seed table couldn't be persisted.
	 */
	public boolean addSeed(ContentKey contentKey, String itemPath, SeedReason reason, long blockCount, long byteSize) throws PersistenceException
	{
		ItemRef item = new ItemRef(contentKey, itemPath);
		synchronized (_seedLock)
		{
			Assert.assertTrue(_isInitialized);
			boolean didAdd;
			if ((SeedReason.WATCHED == reason) && !_config.autoSeedWatched)
			{
				_logger.logVerbose("Not seeding watched item " + item + " since auto-seeding watched items is disabled");
				didAdd = false;
			}
			else if (_seeds.containsKey(item))
			{
				didAdd = false;
			}
			else
			{
				SeedRecord record = new SeedRecord(item, reason, _currentTimeMillisGenerator.getAsLong(), blockCount, byteSize);
				_seeds.put(item, record);
				_logger.logOperation("Seeding " + item + " (" + reason.storedName + ", " + MiscHelpers.humanReadableBytes(byteSize) + ")");
				PersistenceException failure = null;
				try
				{
					_persistSeeds();
				}
				catch (PersistenceException e)
				{
					failure = e;
				}
				try
				{
					_enforceQuota();
				}
				catch (PersistenceException e)
				{
					if (null == failure)
					{
						failure = e;
					}
				}
				if (null != failure)
				{
					throw failure;
				}
				didAdd = true;
			}
			return didAdd;
		}
	}

	/**
	 * Stops seeding an item.
	 * 
	 * @param contentKey The key of the content holding the item.
	 * @param itemPath The item within that content.
	 * @return True if the item was being seeded.
	 * @throws PersistenceException The seed was removed in memory but the seed table couldn't be persisted.
	 */
	public boolean removeSeed(ContentKey contentKey, String itemPath) throws PersistenceException
	{
		ItemRef item = new ItemRef(contentKey, itemPath);
		synchronized (_seedLock)
		{
			Assert.assertTrue(_isInitialized);
			boolean didRemove = (null != _seeds.remove(item));
			if (didRemove)
			{
				_logger.logOperation("Stopped seeding " + item);
				_persistSeeds();
			}
			return didRemove;
		}
	}

	/**
	 * Marks a channel as one the user wants to keep available.
	 * 
	 * @param channelKey The channel.
	 * @return True if this changed the pinned set.
	 * @throws PersistenceException The pinned set changed in memory but couldn't be persisted.
	 */
	public boolean pinChannel(ContentKey channelKey) throws PersistenceException
	{
		synchronized (_pinnedLock)
		{
			boolean didChange = _pinnedChannels.add(channelKey);
			if (didChange)
			{
				_persistPinned();
			}
			return didChange;
		}
	}

	/**
	 * @param channelKey The channel.
	 * @return True if this changed the pinned set.
	 * @throws PersistenceException The pinned set changed in memory but couldn't be persisted.
	 */
	public boolean unpinChannel(ContentKey channelKey) throws PersistenceException
	{
		synchronized (_pinnedLock)
		{
			boolean didChange = _pinnedChannels.remove(channelKey);
			if (didChange)
			{
				_persistPinned();
			}
			return didChange;
		}
	}

	public boolean isChannelPinned(ContentKey channelKey)
	{
		synchronized (_pinnedLock)
		{
			return _pinnedChannels.contains(channelKey);
		}
	}

	public List<ContentKey> getPinnedChannels()
	{
		synchronized (_pinnedLock)
		{
			return List.copyOf(_pinnedChannels);
		}
	}

	/**
	 * Merges a partial config change, persists it, and enforces the (possibly changed) storage budget.
	 * 
	 * @param update The fields to change (null fields are left as they are).
	 * @throws PersistenceException The change was applied in memory but couldn't be persisted.
	 */
	public void setConfig(SeedingConfig.ConfigUpdate update) throws PersistenceException
	{
		synchronized (_seedLock)
		{
			Assert.assertTrue(_isInitialized);
			_config.merge(update);
			PersistenceException failure = null;
			try
			{
				_store.put(KEY_CONFIG, _config.toJson());
			}
			catch (PersistenceException e)
			{
				failure = e;
			}
			try
			{
				_enforceQuota();
			}
			catch (PersistenceException e)
			{
				if (null == failure)
				{
					failure = e;
				}
			}
			if (null != failure)
			{
				throw failure;
			}
		}
	}

	/**
	 * Sets the storage budget, clamped to the range [MIN_STORAGE_GIB, MAX_STORAGE_GIB].
	 * 
	 * @param gib The requested budget, in GiB (must not be NaN).
	 * @return The budget actually applied, in bytes.
	 * @throws PersistenceException The change was applied in memory but couldn't be persisted.
	 */
	public long setMaxStorage(double gib) throws PersistenceException
	{
		Assert.assertTrue(!Double.isNaN(gib));
		double clamped = Math.max(MIN_STORAGE_GIB, Math.min(MAX_STORAGE_GIB, gib));
		long bytes = (long)(clamped * MiscHelpers.BYTES_PER_GIB);
		_logger.logOperation("Setting seeding storage budget to " + MiscHelpers.humanReadableBytes(bytes));
		setConfig(SeedingConfig.ConfigUpdate.maxStorage(bytes));
		return bytes;
	}

	public long getMaxStorageBytes()
	{
		synchronized (_seedLock)
		{
			return _config.maxStorageBytes;
		}
	}

	/**
	 * @return A copy of the current config.
	 */
	public SeedingConfig getConfig()
	{
		synchronized (_seedLock)
		{
			return _config.copy();
		}
	}

	/**
	 * Removes every seed which isn't PINNED.
	 * 
	 * @return The number of bytes no longer counted against the budget.
	 * @throws PersistenceException The seeds were removed in memory but the seed table couldn't be persisted.
	 */
	public long clearCache() throws PersistenceException
	{
		synchronized (_seedLock)
		{
			Assert.assertTrue(_isInitialized);
			long bytesCleared = 0L;
			int count = 0;
			for (SeedRecord record : new ArrayList<>(_seeds.values()))
			{
				if (SeedReason.PINNED != record.reason())
				{
					_seeds.remove(record.item());
					bytesCleared += record.byteSize();
					count += 1;
				}
			}
			_logger.logOperation("Cleared " + count + " seeds (" + MiscHelpers.humanReadableBytes(bytesCleared) + ")");
			_persistSeeds();
			return bytesCleared;
		}
	}

	/**
	 * @return The active seeds, in insertion order.
	 */
	public List<SeedRecord> getActiveSeeds()
	{
		synchronized (_seedLock)
		{
			return List.copyOf(_seeds.values());
		}
	}

	/**
	 * Checks whether one more SUBSCRIBED seed for the given channel would be allowed by the current config.
	 * 
	 * @param channelKey The channel.
	 * @return True if subscribed seeding is enabled and the channel is below its per-channel limit.
	 */
	public boolean shouldAutoSeedSubscribed(ContentKey channelKey)
	{
		synchronized (_seedLock)
		{
			boolean allowed = false;
			if (_config.autoSeedSubscribed)
			{
				long existing = _seeds.values().stream()
						.filter((SeedRecord record) -> (SeedReason.SUBSCRIBED == record.reason()) && channelKey.equals(record.item().contentKey()))
						.count();
				allowed = (existing < _config.maxItemsPerChannel);
			}
			return allowed;
		}
	}

	public SeedingStatus getStatus()
	{
		int pinnedCount = _getPinnedCount();
		synchronized (_seedLock)
		{
			return new SeedingStatus(_seeds.size()
					, pinnedCount
					, _usedBytes()
					, _config.maxStorageBytes
					, _config.copy()
					, List.copyOf(_seeds.values())
			);
		}
	}

	public StorageStats getStorageStats()
	{
		int pinnedCount = _getPinnedCount();
		synchronized (_seedLock)
		{
			return new StorageStats(_usedBytes(), _config.maxStorageBytes, _seeds.size(), pinnedCount);
		}
	}


	private int _getPinnedCount()
	{
		synchronized (_pinnedLock)
		{
			return _pinnedChannels.size();
		}
	}

	// Requires _seedLock.
	private long _usedBytes()
	{
		return _seeds.values().stream().mapToLong((SeedRecord record) -> record.byteSize()).sum();
	}

	// Requires _seedLock.
	private void _enforceQuota() throws PersistenceException
	{
		EvictionAlgorithm algorithm = new EvictionAlgorithm(_config.maxStorageBytes, _usedBytes());
		if (algorithm.isOverflowing())
		{
			List<EvictionAlgorithm.Candidate<ItemRef>> candidates = new ArrayList<>();
			for (SeedRecord record : _seeds.values())
			{
				if (SeedReason.PINNED != record.reason())
				{
					candidates.add(new EvictionAlgorithm.Candidate<>(record.byteSize(), record.reason().priorityRank, record.addedMillis(), record.item()));
				}
			}
			List<EvictionAlgorithm.Candidate<ItemRef>> evictions = algorithm.toRemoveInResize(candidates);
			for (EvictionAlgorithm.Candidate<ItemRef> eviction : evictions)
			{
				_seeds.remove(eviction.data());
				_logger.logOperation("Evicted seed " + eviction.data() + " (" + MiscHelpers.humanReadableBytes(eviction.byteSize()) + ")");
			}
			if (algorithm.isOverflowing())
			{
				_logger.logVerbose("Pinned seeds alone exceed the storage budget by " + MiscHelpers.humanReadableBytes(-algorithm.getBytesAvailable()));
			}
			if (!evictions.isEmpty())
			{
				_persistSeeds();
			}
		}
	}

	// Requires _seedLock.
	private void _persistSeeds() throws PersistenceException
	{
		JsonObject json = new JsonObject();
		for (SeedRecord record : _seeds.values())
		{
			json.add(record.item().toStorageKey(), record.toJson());
		}
		_store.put(KEY_SEEDS, json);
	}

	// Requires _pinnedLock.
	private void _persistPinned() throws PersistenceException
	{
		JsonArray array = new JsonArray();
		for (ContentKey key : _pinnedChannels)
		{
			array.add(key.toHex());
		}
		_store.put(KEY_PINNED, array);
	}
}
