package com.jeffdisher.tubeswarm.types;

import java.util.Locale;


/**
 * The fixed-length identifier of a piece of shared content (a channel or drive root).
 * Keys are 32 bytes, always written as 64 hex characters.  We accept either case but canonically use lower-case.
 */
public class ContentKey
{
	public static final int KEY_BYTES = 32;
	public static final int HEX_LENGTH = 2 * KEY_BYTES;
	// The length of the prefix we show in logs.
	private static final int SHORT_FORM_LENGTH = 16;

	/**
	 * Parses a content key.  This never throws since keys often come from remote peers which could send anything.
	 * 
	 * @param hex The hex encoding of the key (exactly 64 hex characters).
	 * @return The key or null if the encoding was invalid.
	 */
	public static ContentKey fromHex(String hex)
	{
		ContentKey key = null;
		if ((null != hex) && (HEX_LENGTH == hex.length()))
		{
			boolean isValid = true;
			for (int i = 0; isValid && (i < hex.length()); ++i)
			{
				isValid = _isHexCharacter(hex.charAt(i));
			}
			if (isValid)
			{
				key = new ContentKey(hex.toLowerCase(Locale.ROOT));
			}
		}
		return key;
	}


	private final String _hex;

	private ContentKey(String hex)
	{
		_hex = hex;
	}

	public String toHex()
	{
		return _hex;
	}

	/**
	 * @return A short prefix of the key, only useful for human-readable logs.
	 */
	public String shortForm()
	{
		return _hex.substring(0, SHORT_FORM_LENGTH);
	}

	@Override
	public boolean equals(Object obj)
	{
		boolean isEqual = false;
		if (obj instanceof ContentKey)
		{
			isEqual = _hex.equals(((ContentKey)obj)._hex);
		}
		return isEqual;
	}

	@Override
	public int hashCode()
	{
		return _hex.hashCode();
	}

	@Override
	public String toString()
	{
		return "ContentKey(" + _hex + ")";
	}


	private static boolean _isHexCharacter(char c)
	{
		// Character.digit() accepts non-ASCII digits so we check the ranges directly.
		return ((c >= '0') && (c <= '9'))
				|| ((c >= 'a') && (c <= 'f'))
				|| ((c >= 'A') && (c <= 'F'))
		;
	}
}
