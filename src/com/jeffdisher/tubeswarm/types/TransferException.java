package com.jeffdisher.tubeswarm.types;


/**
 * Thrown when a bulk block download fails part-way.  This is never retried by the core.
 */
public class TransferException extends TubeswarmException
{
	private static final long serialVersionUID = 1L;

	public TransferException(String message)
	{
		super(message);
	}

	public TransferException(String message, Exception cause)
	{
		super(message, cause);
	}
}
