package com.jeffdisher.tubeswarm.types;


/**
 * Thrown when the metadata store fails to read or write a value.
 * Note that the in-memory state of the caller has usually already changed when this is thrown, so it describes a
 * durability problem, not a rejected operation.
 */
public class PersistenceException extends TubeswarmException
{
	private static final long serialVersionUID = 1L;

	public PersistenceException(String key, Exception underlyingException)
	{
		super("Metadata store failure on key: " + key, underlyingException);
	}
}
