package com.jeffdisher.tubeswarm.logic;

import com.eclipsesource.json.JsonValue;
import com.jeffdisher.tubeswarm.types.PersistenceException;


/**
 * An abstract interface over the key-value metadata store where the core keeps its small durable state (seeding
 * config, pinned channels, active seeds, published and discovered feed keys).
 * The entire reason why this exists is to allow test coverage of the components' persistence without requiring a real
 * disk.
 */
public interface IMetaStore
{
	/**
	 * Reads the value stored under key.
	 * 
	 * @param key The name of the value.
	 * @return The value, null if nothing is stored under this key.
	 * @throws PersistenceException The store couldn't be read or the stored data was corrupt.
	 */
	JsonValue get(String key) throws PersistenceException;

	/**
	 * Replaces the value stored under key.  Once this returns, the value is durable.
	 * 
	 * @param key The name of the value.
	 * @param value The value to store (cannot be null).
	 * @throws PersistenceException The store couldn't be written.
	 */
	void put(String key, JsonValue value) throws PersistenceException;
}
