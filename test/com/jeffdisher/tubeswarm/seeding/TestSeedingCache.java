package com.jeffdisher.tubeswarm.seeding;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.jeffdisher.tubeswarm.testutils.MemoryMetaStore;
import com.jeffdisher.tubeswarm.testutils.MockKeys;
import com.jeffdisher.tubeswarm.testutils.MockTimeGenerator;
import com.jeffdisher.tubeswarm.testutils.SilentLogger;
import com.jeffdisher.tubeswarm.types.ItemRef;
import com.jeffdisher.tubeswarm.types.PersistenceException;
import com.jeffdisher.tubeswarm.types.SeedReason;
import com.jeffdisher.tubeswarm.utils.MiscHelpers;


public class TestSeedingCache
{
	private static final long GIB = MiscHelpers.BYTES_PER_GIB;
	private static final long MIB = 1024L * 1024L;

	@Test
	public void testEmpty() throws Throwable
	{
		SeedingCache cache = _createCache(new MemoryMetaStore(), new MockTimeGenerator());
		StorageStats stats = cache.getStorageStats();
		Assert.assertEquals(0L, stats.usedBytes());
		Assert.assertEquals(SeedingConfig.DEFAULT_MAX_STORAGE_BYTES, stats.maxBytes());
		Assert.assertEquals(0, stats.seedCount());
		Assert.assertEquals(0, stats.pinnedCount());
		Assert.assertTrue(cache.getConfig().autoSeedWatched);
	}

	@Test(expected = AssertionError.class)
	public void testUseBeforeInit() throws Throwable
	{
		SeedingCache cache = new SeedingCache(new MemoryMetaStore(), new SilentLogger(), new MockTimeGenerator());
		cache.addSeed(MockKeys.K1, "a", SeedReason.WATCHED, 1L, 1L);
	}

	@Test
	public void testAddAndRemove() throws Throwable
	{
		MemoryMetaStore store = new MemoryMetaStore();
		SeedingCache cache = _createCache(store, new MockTimeGenerator());
		Assert.assertTrue(cache.addSeed(MockKeys.K1, "a", SeedReason.WATCHED, 10L, 100L));
		// Duplicates are refused, whatever the reason.
		Assert.assertFalse(cache.addSeed(MockKeys.K1, "a", SeedReason.PINNED, 10L, 100L));
		Assert.assertTrue(cache.addSeed(MockKeys.K1, "b", SeedReason.SUBSCRIBED, 20L, 200L));
		Assert.assertEquals(300L, cache.getStorageStats().usedBytes());
		Assert.assertEquals(2, store.get(SeedingCache.KEY_SEEDS).asObject().size());
		
		Assert.assertTrue(cache.removeSeed(MockKeys.K1, "a"));
		Assert.assertFalse(cache.removeSeed(MockKeys.K1, "a"));
		List<SeedRecord> seeds = cache.getActiveSeeds();
		Assert.assertEquals(1, seeds.size());
		Assert.assertEquals(new ItemRef(MockKeys.K1, "b"), seeds.get(0).item());
		Assert.assertEquals(SeedReason.SUBSCRIBED, seeds.get(0).reason());
		Assert.assertEquals(1, store.get(SeedingCache.KEY_SEEDS).asObject().size());
	}

	@Test
	public void testWatchedDisabled() throws Throwable
	{
		SeedingCache cache = _createCache(new MemoryMetaStore(), new MockTimeGenerator());
		cache.setConfig(new SeedingConfig.ConfigUpdate(null, false, null, null));
		Assert.assertFalse(cache.addSeed(MockKeys.K1, "a", SeedReason.WATCHED, 10L, 100L));
		Assert.assertTrue(cache.addSeed(MockKeys.K1, "a", SeedReason.SUBSCRIBED, 10L, 100L));
		Assert.assertEquals(1, cache.getStatus().activeSeeds());
	}

	@Test
	public void testPinnedOverBudget() throws Throwable
	{
		SeedingCache cache = _createCache(new MemoryMetaStore(), new MockTimeGenerator());
		Assert.assertEquals(GIB, cache.setMaxStorage(1.0));
		Assert.assertTrue(cache.addSeed(MockKeys.K1, "big", SeedReason.PINNED, 100L, 2L * GIB));
		// Pinned seeds are never evicted, even when they alone exceed the budget.
		Assert.assertEquals(1, cache.getActiveSeeds().size());
		Assert.assertEquals(2L * GIB, cache.getStorageStats().usedBytes());
		
		// Anything else added is evicted immediately.
		Assert.assertTrue(cache.addSeed(MockKeys.K2, "small", SeedReason.SUBSCRIBED, 1L, MIB));
		Assert.assertEquals(1, cache.getActiveSeeds().size());
		Assert.assertEquals(SeedReason.PINNED, cache.getActiveSeeds().get(0).reason());
	}

	@Test
	public void testEvictionOrder() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		SeedingCache cache = _createCache(new MemoryMetaStore(), time);
		cache.setMaxStorage(1.0);
		cache.addSeed(MockKeys.K1, "s1", SeedReason.SUBSCRIBED, 1L, 400L * MIB);
		time.advance(10L);
		cache.addSeed(MockKeys.K1, "w1", SeedReason.WATCHED, 1L, 400L * MIB);
		time.advance(10L);
		// Over budget:  the oldest watched seed goes first.
		cache.addSeed(MockKeys.K1, "w2", SeedReason.WATCHED, 1L, 400L * MIB);
		Assert.assertEquals(List.of("s1", "w2"), _paths(cache));
		
		time.advance(10L);
		cache.addSeed(MockKeys.K1, "s2", SeedReason.SUBSCRIBED, 1L, 400L * MIB);
		Assert.assertEquals(List.of("s1", "s2"), _paths(cache));
		
		// With no watched seeds left, the oldest subscribed seed goes.
		time.advance(10L);
		cache.addSeed(MockKeys.K1, "p1", SeedReason.PINNED, 1L, 400L * MIB);
		Assert.assertEquals(List.of("s2", "p1"), _paths(cache));
		Assert.assertEquals(800L * MIB, cache.getStorageStats().usedBytes());
	}

	@Test
	public void testLoweringBudgetEvicts() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		SeedingCache cache = _createCache(new MemoryMetaStore(), time);
		cache.addSeed(MockKeys.K1, "a", SeedReason.WATCHED, 1L, GIB);
		time.advance(1L);
		cache.addSeed(MockKeys.K1, "b", SeedReason.WATCHED, 1L, GIB);
		time.advance(1L);
		cache.addSeed(MockKeys.K1, "c", SeedReason.WATCHED, 1L, GIB);
		Assert.assertEquals(3, cache.getActiveSeeds().size());
		
		cache.setMaxStorage(2.0);
		Assert.assertEquals(List.of("b", "c"), _paths(cache));
	}

	@Test
	public void testMaxStorageClamped() throws Throwable
	{
		MemoryMetaStore store = new MemoryMetaStore();
		SeedingCache cache = _createCache(store, new MockTimeGenerator());
		Assert.assertEquals(GIB, cache.setMaxStorage(0.5));
		Assert.assertEquals(GIB, cache.getMaxStorageBytes());
		Assert.assertEquals(100L * GIB, cache.setMaxStorage(500.0));
		Assert.assertEquals(100L * GIB, cache.getMaxStorageBytes());
		Assert.assertEquals(GIB + (GIB / 2L), cache.setMaxStorage(1.5));
		Assert.assertEquals(GIB + (GIB / 2L), store.get(SeedingCache.KEY_CONFIG).asObject().getLong(SeedingConfig.FIELD_MAX_STORAGE_BYTES, 0L));
	}

	@Test
	public void testNaNMaxStorageRejected() throws Throwable
	{
		SeedingCache cache = _createCache(new MemoryMetaStore(), new MockTimeGenerator());
		cache.addSeed(MockKeys.K1, "a", SeedReason.SUBSCRIBED, 1L, 100L);
		cache.addSeed(MockKeys.K1, "b", SeedReason.WATCHED, 1L, 100L);
		boolean didFail = false;
		try
		{
			cache.setMaxStorage(Double.NaN);
		}
		catch (AssertionError e)
		{
			didFail = true;
		}
		Assert.assertTrue(didFail);
		Assert.assertEquals(SeedingConfig.DEFAULT_MAX_STORAGE_BYTES, cache.getMaxStorageBytes());
		Assert.assertEquals(List.of("a", "b"), _paths(cache));
	}

	@Test
	public void testClearCacheKeepsPinned() throws Throwable
	{
		SeedingCache cache = _createCache(new MemoryMetaStore(), new MockTimeGenerator());
		cache.addSeed(MockKeys.K1, "a", SeedReason.WATCHED, 1L, 100L);
		cache.addSeed(MockKeys.K1, "b", SeedReason.SUBSCRIBED, 1L, 200L);
		cache.addSeed(MockKeys.K1, "c", SeedReason.PINNED, 1L, 400L);
		Assert.assertEquals(300L, cache.clearCache());
		Assert.assertEquals(List.of("c"), _paths(cache));
		Assert.assertEquals(0L, cache.clearCache());
	}

	@Test
	public void testPinnedChannels() throws Throwable
	{
		MemoryMetaStore store = new MemoryMetaStore();
		SeedingCache cache = _createCache(store, new MockTimeGenerator());
		Assert.assertTrue(cache.pinChannel(MockKeys.K1));
		Assert.assertFalse(cache.pinChannel(MockKeys.K1));
		Assert.assertTrue(cache.pinChannel(MockKeys.K2));
		Assert.assertTrue(cache.isChannelPinned(MockKeys.K1));
		Assert.assertEquals(2, cache.getStatus().pinnedChannels());
		Assert.assertTrue(cache.unpinChannel(MockKeys.K1));
		Assert.assertFalse(cache.unpinChannel(MockKeys.K1));
		Assert.assertEquals(List.of(MockKeys.K2), cache.getPinnedChannels());
		Assert.assertEquals(1, store.get(SeedingCache.KEY_PINNED).asArray().size());
	}

	@Test
	public void testPersistenceFailure() throws Throwable
	{
		MemoryMetaStore store = new MemoryMetaStore();
		SeedingCache cache = _createCache(store, new MockTimeGenerator());
		store.setFailWrites(true);
		boolean didFail = false;
		try
		{
			cache.addSeed(MockKeys.K1, "a", SeedReason.WATCHED, 1L, 100L);
		}
		catch (PersistenceException e)
		{
			didFail = true;
		}
		Assert.assertTrue(didFail);
		// The in-memory change stays.
		Assert.assertEquals(1, cache.getActiveSeeds().size());
		
		didFail = false;
		try
		{
			cache.pinChannel(MockKeys.K2);
		}
		catch (PersistenceException e)
		{
			didFail = true;
		}
		Assert.assertTrue(didFail);
		Assert.assertTrue(cache.isChannelPinned(MockKeys.K2));
		Assert.assertEquals(0, store.getWriteCount());
	}

	@Test
	public void testRestart() throws Throwable
	{
		MemoryMetaStore store = new MemoryMetaStore();
		SeedingCache cache = _createCache(store, new MockTimeGenerator());
		cache.setConfig(new SeedingConfig.ConfigUpdate(2L * GIB, false, true, 3));
		cache.pinChannel(MockKeys.K3);
		cache.addSeed(MockKeys.K1, "a", SeedReason.SUBSCRIBED, 5L, 500L);
		cache.addSeed(MockKeys.K2, "b", SeedReason.PINNED, 6L, 600L);
		
		SeedingCache restarted = _createCache(store, new MockTimeGenerator());
		SeedingConfig config = restarted.getConfig();
		Assert.assertEquals(2L * GIB, config.maxStorageBytes);
		Assert.assertFalse(config.autoSeedWatched);
		Assert.assertTrue(config.autoSeedSubscribed);
		Assert.assertEquals(3, config.maxItemsPerChannel);
		Assert.assertEquals(List.of(MockKeys.K3), restarted.getPinnedChannels());
		List<SeedRecord> seeds = restarted.getActiveSeeds();
		Assert.assertEquals(2, seeds.size());
		Assert.assertEquals(new ItemRef(MockKeys.K2, "b"), seeds.get(1).item());
		Assert.assertEquals(600L, seeds.get(1).byteSize());
		Assert.assertEquals(6L, seeds.get(1).blockCount());
	}

	@Test
	public void testInvalidStoredEntriesSkipped() throws Throwable
	{
		MemoryMetaStore store = new MemoryMetaStore();
		store.put(SeedingCache.KEY_PINNED, new JsonArray().add(MockKeys.K1.toHex()).add("bad").add(5));
		JsonObject seeds = new JsonObject();
		seeds.add("good", new JsonObject()
				.add("contentKey", MockKeys.K2.toHex())
				.add("itemPath", "x")
				.add("reason", "watched")
				.add("addedAt", 5L)
				.add("blocks", 1L)
				.add("bytes", 10L)
		);
		seeds.add("unknownReason", new JsonObject()
				.add("contentKey", MockKeys.K2.toHex())
				.add("itemPath", "y")
				.add("reason", "forever")
		);
		seeds.add("notAnObject", 7);
		seeds.add("keyNotString", new JsonObject()
				.add("contentKey", 5)
				.add("itemPath", "z")
				.add("reason", "watched")
		);
		seeds.add("fractionalBytes", new JsonObject()
				.add("contentKey", MockKeys.K3.toHex())
				.add("itemPath", "w")
				.add("reason", "watched")
				.add("bytes", 1.5)
		);
		store.put(SeedingCache.KEY_SEEDS, seeds);
		// A partial config is merged over the defaults and wrong-typed fields are ignored.
		store.put(SeedingCache.KEY_CONFIG, new JsonObject()
				.add(SeedingConfig.FIELD_MAX_ITEMS_PER_CHANNEL, 4)
				.add(SeedingConfig.FIELD_AUTO_SEED_WATCHED, "no")
				.add(SeedingConfig.FIELD_MAX_STORAGE_BYTES, "lots")
		);
		
		SilentLogger logger = new SilentLogger();
		SeedingCache cache = new SeedingCache(store, logger, new MockTimeGenerator());
		cache.init();
		Assert.assertEquals(6, logger.getErrorCount());
		Assert.assertEquals(List.of(MockKeys.K1), cache.getPinnedChannels());
		Assert.assertEquals(List.of("x"), _paths(cache));
		Assert.assertEquals(5L, cache.getActiveSeeds().get(0).addedMillis());
		Assert.assertEquals(4, cache.getConfig().maxItemsPerChannel);
		Assert.assertEquals(SeedingConfig.DEFAULT_MAX_STORAGE_BYTES, cache.getMaxStorageBytes());
		Assert.assertEquals(SeedingConfig.DEFAULT_AUTO_SEED_WATCHED, cache.getConfig().autoSeedWatched);
	}

	@Test
	public void testAutoSeedSubscribed() throws Throwable
	{
		SeedingCache cache = _createCache(new MemoryMetaStore(), new MockTimeGenerator());
		Assert.assertFalse(cache.shouldAutoSeedSubscribed(MockKeys.K1));
		cache.setConfig(new SeedingConfig.ConfigUpdate(null, null, true, 2));
		Assert.assertTrue(cache.shouldAutoSeedSubscribed(MockKeys.K1));
		cache.addSeed(MockKeys.K1, "a", SeedReason.SUBSCRIBED, 1L, 1L);
		// Other reasons don't count against the limit.
		cache.addSeed(MockKeys.K1, "b", SeedReason.WATCHED, 1L, 1L);
		Assert.assertTrue(cache.shouldAutoSeedSubscribed(MockKeys.K1));
		cache.addSeed(MockKeys.K1, "c", SeedReason.SUBSCRIBED, 1L, 1L);
		Assert.assertFalse(cache.shouldAutoSeedSubscribed(MockKeys.K1));
		Assert.assertTrue(cache.shouldAutoSeedSubscribed(MockKeys.K2));
	}

	@Test
	public void testConfigCopyIsDetached() throws Throwable
	{
		SeedingCache cache = _createCache(new MemoryMetaStore(), new MockTimeGenerator());
		SeedingConfig copy = cache.getConfig();
		copy.maxStorageBytes = 1L;
		Assert.assertEquals(SeedingConfig.DEFAULT_MAX_STORAGE_BYTES, cache.getMaxStorageBytes());
	}


	private static SeedingCache _createCache(MemoryMetaStore store, MockTimeGenerator time) throws PersistenceException
	{
		SeedingCache cache = new SeedingCache(store, new SilentLogger(), time);
		cache.init();
		return cache;
	}

	private static List<String> _paths(SeedingCache cache)
	{
		return cache.getActiveSeeds().stream().map((SeedRecord record) -> record.item().itemPath()).toList();
	}
}
