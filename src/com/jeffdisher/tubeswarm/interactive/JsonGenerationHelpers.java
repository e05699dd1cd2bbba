package com.jeffdisher.tubeswarm.interactive;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.tubeswarm.feed.FeedEntry;
import com.jeffdisher.tubeswarm.feed.FeedStats;
import com.jeffdisher.tubeswarm.prefetch.PrefetchResult;
import com.jeffdisher.tubeswarm.prefetch.PrefetchStats;
import com.jeffdisher.tubeswarm.seeding.SeedRecord;
import com.jeffdisher.tubeswarm.seeding.SeedingStatus;
import com.jeffdisher.tubeswarm.seeding.StorageStats;
import com.jeffdisher.tubeswarm.types.FeedOrigin;
import com.jeffdisher.tubeswarm.utils.MiscHelpers;

import jakarta.servlet.http.HttpServletResponse;


/**
 * Helpers related to generated JSON snippets for use in the REST interface.
 * The field names are the ones the existing front-ends read.
 */
public class JsonGenerationHelpers
{
	public static JsonArray feed(List<FeedEntry> entries)
	{
		JsonArray array = new JsonArray();
		for (FeedEntry entry : entries)
		{
			JsonObject object = new JsonObject();
			object.set("driveKey", entry.key().toHex());
			object.set("addedAt", entry.discoveredMillis());
			object.set("source", (FeedOrigin.LOCAL == entry.origin()) ? "local" : "peer");
			array.add(object);
		}
		return array;
	}

	public static JsonObject feedStats(FeedStats stats)
	{
		JsonObject object = new JsonObject();
		object.set("totalEntries", stats.totalEntries());
		object.set("hiddenCount", stats.hiddenCount());
		object.set("peerCount", stats.peerCount());
		return object;
	}

	/**
	 * Encodes the seeding status, including the config and every seed.
	 * 
	 * @param status The status.
	 * @return The status, encoded as JSON.
	 */
	public static JsonObject seedingStatus(SeedingStatus status)
	{
		JsonObject object = new JsonObject();
		object.set("activeSeeds", status.activeSeeds());
		object.set("pinnedChannels", status.pinnedChannels());
		object.set("storageUsedBytes", status.storageUsedBytes());
		object.set("maxStorageBytes", status.maxStorageBytes());
		object.set("config", status.config().toJson());
		JsonArray seeds = new JsonArray();
		for (SeedRecord record : status.seeds())
		{
			seeds.add(record.toJson());
		}
		object.set("seeds", seeds);
		return object;
	}

	public static JsonObject storageStats(StorageStats stats)
	{
		JsonObject object = new JsonObject();
		object.set("usedBytes", stats.usedBytes());
		object.set("maxBytes", stats.maxBytes());
		object.set("usedGB", _toGib(stats.usedBytes()));
		object.set("maxGB", _toGib(stats.maxBytes()));
		object.set("seedCount", stats.seedCount());
		object.set("pinnedCount", stats.pinnedCount());
		return object;
	}

	public static JsonObject prefetchResult(PrefetchResult result)
	{
		JsonObject object = new JsonObject();
		object.set("success", result.success());
		if (result.success())
		{
			object.set("cached", result.cached());
			object.set("alreadyActive", result.alreadyActive());
			object.set("totalBlocks", result.totalBlocks());
			object.set("totalBytes", result.totalBytes());
			object.set("peerCount", result.peerCount());
			object.set("initialBlocks", result.initialBlocks());
		}
		else
		{
			object.set("error", result.error());
		}
		return object;
	}

	/**
	 * Encodes a download session snapshot.  The speed is given in MB/s, formatted with 2 decimal places.
	 * 
	 * @param stats The snapshot.
	 * @return The snapshot, encoded as JSON.
	 */
	public static JsonObject prefetchStats(PrefetchStats stats)
	{
		JsonObject object = new JsonObject();
		object.set("status", stats.status().name().toLowerCase(Locale.ROOT));
		object.set("progress", stats.progress());
		object.set("totalBlocks", stats.totalBlocks());
		object.set("downloadedBlocks", stats.downloadedBlocks());
		object.set("totalBytes", stats.totalBytes());
		object.set("downloadedBytes", stats.downloadedBytes());
		object.set("peerCount", stats.peerCount());
		object.set("speedMBps", MiscHelpers.humanReadableSpeed(stats.speedBytesPerSecond()).replace(" MB/s", ""));
		object.set("elapsed", Math.round(stats.elapsedMillis() / 1000.0));
		object.set("isComplete", stats.isComplete());
		object.set("error", (null != stats.error()) ? Json.value(stats.error()) : JsonValue.NULL);
		return object;
	}

	/**
	 * Writes the given JSON as a 200 response.
	 * 
	 * @param response The response.
	 * @param json The body.
	 * @throws IOException There was a problem writing the response.
	 */
	public static void writeJson(HttpServletResponse response, JsonValue json) throws IOException
	{
		response.setContentType("application/json");
		response.setStatus(HttpServletResponse.SC_OK);
		response.getWriter().print(json.toString());
	}


	private static double _toGib(long bytes)
	{
		return Math.round(((double) bytes / MiscHelpers.BYTES_PER_GIB) * 100.0) / 100.0;
	}
}
