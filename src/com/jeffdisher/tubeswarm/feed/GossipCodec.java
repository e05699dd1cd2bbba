package com.jeffdisher.tubeswarm.feed;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;
import com.jeffdisher.tubeswarm.utils.Assert;


/**
 * Converts gossip messages to and from their wire form:  a UTF-8 JSON object tagged by its "type" field.
 * The wire tags are the ones existing peers use, which differ from our message type names.
 */
public class GossipCodec
{
	public static final String FIELD_TYPE = "type";
	public static final String FIELD_KEYS = "keys";
	public static final String FIELD_KEY = "key";
	public static final String FIELD_ENTRIES = "entries";
	public static final String FIELD_DRIVE_KEY = "driveKey";

	public static final String TAG_HAVE_FULL_SET = "HAVE_FEED";
	public static final String TAG_ANNOUNCE = "SUBMIT_CHANNEL";
	public static final String TAG_NEED_SET = "NEED_FEED";
	public static final String TAG_SET_RESPONSE = "FEED_RESPONSE";

	public static byte[] encode(GossipMessage message)
	{
		JsonObject json = new JsonObject();
		switch (message.type())
		{
		case HAVE_FULL_SET:
			json.add(FIELD_TYPE, TAG_HAVE_FULL_SET);
			json.add(FIELD_KEYS, _toArray(message.keys()));
			break;
		case ANNOUNCE:
			json.add(FIELD_TYPE, TAG_ANNOUNCE);
			json.add(FIELD_KEY, message.key());
			break;
		case NEED_SET:
			json.add(FIELD_TYPE, TAG_NEED_SET);
			break;
		case SET_RESPONSE:
			json.add(FIELD_TYPE, TAG_SET_RESPONSE);
			json.add(FIELD_KEYS, _toArray(message.keys()));
			break;
		default:
			throw Assert.unreachable();
		}
		return json.toString().getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * Decodes a message received from a peer.
	 * A HAVE_FEED may carry an "entries" list of objects with a "driveKey" field instead of (or as well as) the "keys"
	 * list.  When both are present, the entries win.
	 * 
	 * @param payload The raw bytes received.
	 * @return The message or null if the payload wasn't a message we understand.
	 */
	public static GossipMessage decode(byte[] payload)
	{
		JsonValue value;
		try
		{
			value = Json.parse(new String(payload, StandardCharsets.UTF_8));
		}
		catch (ParseException e)
		{
			value = null;
		}
		GossipMessage message = null;
		if ((null != value) && value.isObject())
		{
			JsonObject json = value.asObject();
			JsonValue rawType = json.get(FIELD_TYPE);
			String type = ((null != rawType) && rawType.isString()) ? rawType.asString() : "";
			switch (type)
			{
			case TAG_HAVE_FULL_SET: {
				List<String> keys = _readEntries(json.get(FIELD_ENTRIES));
				if (null == keys)
				{
					keys = _readKeys(json.get(FIELD_KEYS));
				}
				message = (null != keys) ? GossipMessage.haveFullSet(keys) : null;
				break;
			}
			case TAG_ANNOUNCE: {
				JsonValue key = json.get(FIELD_KEY);
				message = ((null != key) && key.isString()) ? GossipMessage.announce(key.asString()) : null;
				break;
			}
			case TAG_NEED_SET:
				message = GossipMessage.needSet();
				break;
			case TAG_SET_RESPONSE: {
				List<String> keys = _readKeys(json.get(FIELD_KEYS));
				message = (null != keys) ? GossipMessage.setResponse(keys) : null;
				break;
			}
			default:
				message = null;
			}
		}
		return message;
	}


	private static JsonArray _toArray(List<String> keys)
	{
		JsonArray array = new JsonArray();
		for (String key : keys)
		{
			array.add(key);
		}
		return array;
	}

	private static List<String> _readKeys(JsonValue value)
	{
		List<String> keys = null;
		if ((null != value) && value.isArray())
		{
			keys = new ArrayList<>();
			for (JsonValue element : value.asArray())
			{
				// Non-string elements are dropped here, bad strings are rejected by the directory.
				if (element.isString())
				{
					keys.add(element.asString());
				}
			}
		}
		return keys;
	}

	private static List<String> _readEntries(JsonValue value)
	{
		List<String> keys = null;
		if ((null != value) && value.isArray())
		{
			keys = new ArrayList<>();
			for (JsonValue element : value.asArray())
			{
				if (element.isObject())
				{
					JsonValue driveKey = element.asObject().get(FIELD_DRIVE_KEY);
					if ((null != driveKey) && driveKey.isString())
					{
						keys.add(driveKey.asString());
					}
				}
			}
		}
		return keys;
	}
}
