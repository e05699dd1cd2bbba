package com.jeffdisher.tubeswarm.seeding;

import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;


/**
 * Type-checked reads of fields from stored JSON objects.  Each helper returns the default when the field is absent
 * and null when it is present but has the wrong type, so callers can decide whether that invalidates the entry.
 */
final class StoredFields
{
	private StoredFields()
	{
	}

	public static String readString(JsonObject json, String name)
	{
		JsonValue value = json.get(name);
		return ((null != value) && value.isString()) ? value.asString() : null;
	}

	public static Long readLong(JsonObject json, String name, long defaultValue)
	{
		JsonValue value = json.get(name);
		Long result;
		if (null == value)
		{
			result = defaultValue;
		}
		else if (value.isNumber())
		{
			try
			{
				result = value.asLong();
			}
			catch (NumberFormatException e)
			{
				// Fractional or out of range.
				result = null;
			}
		}
		else
		{
			result = null;
		}
		return result;
	}

	public static Integer readInt(JsonObject json, String name, int defaultValue)
	{
		Long value = readLong(json, name, defaultValue);
		return ((null != value) && (value >= Integer.MIN_VALUE) && (value <= Integer.MAX_VALUE))
				? Integer.valueOf(value.intValue())
				: null
		;
	}

	public static Boolean readBoolean(JsonObject json, String name, boolean defaultValue)
	{
		JsonValue value = json.get(name);
		Boolean result;
		if (null == value)
		{
			result = defaultValue;
		}
		else if (value.isBoolean())
		{
			result = value.asBoolean();
		}
		else
		{
			result = null;
		}
		return result;
	}
}
