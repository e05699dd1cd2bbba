package com.jeffdisher.tubeswarm.types;


/**
 * Superclass of all Tubeswarm's internal exceptions.
 */
public class TubeswarmException extends Exception
{
	private static final long serialVersionUID = 1L;

	public TubeswarmException(String message)
	{
		super(message);
	}

	public TubeswarmException(String message, Exception exception)
	{
		super(message, exception);
	}
}
