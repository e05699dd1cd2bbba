package com.jeffdisher.tubeswarm.types;


/**
 * Thrown when the content store can't find an item (or its block range) under a content key.
 */
public class ContentLookupException extends TubeswarmException
{
	private static final long serialVersionUID = 1L;

	public ContentLookupException(ItemRef item, String reason)
	{
		super("Could not resolve " + item + ": " + reason);
	}

	public ContentLookupException(ItemRef item, Exception cause)
	{
		super("Could not resolve " + item, cause);
	}
}
