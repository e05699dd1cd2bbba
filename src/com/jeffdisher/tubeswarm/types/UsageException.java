package com.jeffdisher.tubeswarm.types;


/**
 * Thrown when a request's arguments can't be used (a malformed form value or a storage size which isn't a number, for
 * example).  The REST layer reports these as a 400.
 */
public class UsageException extends TubeswarmException
{
	private static final long serialVersionUID = 1L;

	public UsageException(String message)
	{
		super(message);
	}
}
