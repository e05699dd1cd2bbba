package com.jeffdisher.tubeswarm.testutils;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.tubeswarm.logic.IMetaStore;
import com.jeffdisher.tubeswarm.types.PersistenceException;
import com.jeffdisher.tubeswarm.utils.Assert;


/**
 * An in-memory implementation of the metadata store.  Values are stored as their serialized text so that later changes
 * to the caller's JSON objects can't leak into the "stored" copy.
 * It can also be told to fail writes, to exercise the durability error paths.
 */
public class MemoryMetaStore implements IMetaStore
{
	private final Map<String, String> _data = new HashMap<>();
	private boolean _failWrites;
	private int _writeCount;

	@Override
	public synchronized JsonValue get(String key) throws PersistenceException
	{
		String text = _data.get(key);
		return (null != text)
				? Json.parse(text)
				: null
		;
	}

	@Override
	public synchronized void put(String key, JsonValue value) throws PersistenceException
	{
		Assert.assertTrue(null != value);
		if (_failWrites)
		{
			throw new PersistenceException(key, new IOException("Simulated write failure"));
		}
		_data.put(key, value.toString());
		_writeCount += 1;
	}

	/**
	 * @param failWrites True if all following put() calls should fail.
	 */
	public synchronized void setFailWrites(boolean failWrites)
	{
		_failWrites = failWrites;
	}

	/**
	 * @return The number of successful put() calls so far.
	 */
	public synchronized int getWriteCount()
	{
		return _writeCount;
	}
}
