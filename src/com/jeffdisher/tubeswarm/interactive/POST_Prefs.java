package com.jeffdisher.tubeswarm.interactive;

import java.util.Map;

import com.jeffdisher.tubeswarm.seeding.SeedingCache;
import com.jeffdisher.tubeswarm.seeding.SeedingConfig;
import com.jeffdisher.tubeswarm.types.UsageException;
import com.jeffdisher.tubeswarm.utils.MiscHelpers;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * Updates the seeding config.
 * Every field is optional, so this can change one setting at a time:  fields not in the form are left as they are.
 * Returns the resulting config as a JSON struct.
 */
public class POST_Prefs implements ValidatedEntryPoints.POST_Form
{
	private final SeedingCache _seeding;

	public POST_Prefs(SeedingCache seeding)
	{
		_seeding = seeding;
	}

	@Override
	public void handle(HttpServletRequest request, HttpServletResponse response, Object[] path, Map<String, String> formVariables) throws Throwable
	{
		Long maxStorageBytes = _parseLong(formVariables, SeedingConfig.FIELD_MAX_STORAGE_BYTES);
		Boolean autoSeedWatched = _parseBoolean(formVariables, SeedingConfig.FIELD_AUTO_SEED_WATCHED);
		Boolean autoSeedSubscribed = _parseBoolean(formVariables, SeedingConfig.FIELD_AUTO_SEED_SUBSCRIBED);
		Long maxItemsPerChannel = _parseLong(formVariables, SeedingConfig.FIELD_MAX_ITEMS_PER_CHANNEL);
		// Check parameters.
		if (((null != maxStorageBytes) && ((maxStorageBytes < (SeedingCache.MIN_STORAGE_GIB * MiscHelpers.BYTES_PER_GIB)) || (maxStorageBytes > (SeedingCache.MAX_STORAGE_GIB * MiscHelpers.BYTES_PER_GIB))))
				|| ((null != maxItemsPerChannel) && ((maxItemsPerChannel < 1L) || (maxItemsPerChannel > Integer.MAX_VALUE)))
		)
		{
			throw new UsageException("Invalid parameter");
		}
		_seeding.setConfig(new SeedingConfig.ConfigUpdate(maxStorageBytes
				, autoSeedWatched
				, autoSeedSubscribed
				, (null != maxItemsPerChannel) ? maxItemsPerChannel.intValue() : null
		));
		JsonGenerationHelpers.writeJson(response, _seeding.getConfig().toJson());
	}


	private static Long _parseLong(Map<String, String> formVariables, String key) throws UsageException
	{
		String value = formVariables.get(key);
		try
		{
			return (null != value) ? Long.valueOf(value) : null;
		}
		catch (NumberFormatException e)
		{
			throw new UsageException("Invalid parameter for: \"" + key + "\"");
		}
	}

	private static Boolean _parseBoolean(Map<String, String> formVariables, String key) throws UsageException
	{
		String value = formVariables.get(key);
		Boolean result;
		if (null == value)
		{
			result = null;
		}
		else if ("true".equals(value))
		{
			result = Boolean.TRUE;
		}
		else if ("false".equals(value))
		{
			result = Boolean.FALSE;
		}
		else
		{
			throw new UsageException("Invalid parameter for: \"" + key + "\"");
		}
		return result;
	}
}
