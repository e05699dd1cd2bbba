package com.jeffdisher.tubeswarm.types;

import org.junit.Assert;
import org.junit.Test;


public class TestTypes
{
	private static final String HEX = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";

	@Test
	public void testContentKeyParsing()
	{
		ContentKey key = ContentKey.fromHex(HEX);
		Assert.assertNotNull(key);
		Assert.assertEquals(HEX, key.toHex());
		Assert.assertEquals("0123456789abcdef", key.shortForm());
	}

	@Test
	public void testContentKeyCanonicalCase()
	{
		ContentKey upper = ContentKey.fromHex(HEX.toUpperCase());
		ContentKey lower = ContentKey.fromHex(HEX);
		Assert.assertEquals(lower, upper);
		Assert.assertEquals(lower.hashCode(), upper.hashCode());
		Assert.assertEquals(HEX, upper.toHex());
	}

	@Test
	public void testContentKeyInvalid()
	{
		Assert.assertNull(ContentKey.fromHex(null));
		Assert.assertNull(ContentKey.fromHex(""));
		Assert.assertNull(ContentKey.fromHex(HEX.substring(1)));
		Assert.assertNull(ContentKey.fromHex(HEX + "0"));
		Assert.assertNull(ContentKey.fromHex(HEX.substring(1) + "g"));
		// Non-ASCII digits aren't hex.
		Assert.assertNull(ContentKey.fromHex(HEX.substring(1) + "١"));
	}

	@Test
	public void testItemRef()
	{
		ContentKey key = ContentKey.fromHex(HEX);
		ItemRef item = new ItemRef(key, "videos/a.mp4");
		Assert.assertEquals(HEX + ":videos/a.mp4", item.toStorageKey());
		Assert.assertEquals("0123456789abcdef:videos/a.mp4", item.toString());
		Assert.assertEquals(new ItemRef(ContentKey.fromHex(HEX.toUpperCase()), "videos/a.mp4"), item);
	}

	@Test
	public void testSeedReasonNames()
	{
		Assert.assertEquals(SeedReason.WATCHED, SeedReason.fromName("watched"));
		Assert.assertEquals(SeedReason.SUBSCRIBED, SeedReason.fromName("subscribed"));
		Assert.assertEquals(SeedReason.PINNED, SeedReason.fromName("pinned"));
		Assert.assertNull(SeedReason.fromName("WATCHED"));
		Assert.assertNull(SeedReason.fromName(null));
		Assert.assertTrue(SeedReason.WATCHED.priorityRank < SeedReason.SUBSCRIBED.priorityRank);
		Assert.assertTrue(SeedReason.SUBSCRIBED.priorityRank < SeedReason.PINNED.priorityRank);
	}

	@Test
	public void testBlockRange()
	{
		BlockRange range = new BlockRange(100L, 250L, 4096L);
		Assert.assertEquals(150L, range.totalBlocks());
		Assert.assertEquals(0L, new BlockRange(7L, 7L, 0L).totalBlocks());
	}

	@Test
	public void testTerminalStatus()
	{
		Assert.assertTrue(PrefetchStatus.COMPLETE.isTerminal());
		Assert.assertTrue(PrefetchStatus.ERROR.isTerminal());
		Assert.assertFalse(PrefetchStatus.DOWNLOADING.isTerminal());
		Assert.assertFalse(PrefetchStatus.UNKNOWN.isTerminal());
	}
}
