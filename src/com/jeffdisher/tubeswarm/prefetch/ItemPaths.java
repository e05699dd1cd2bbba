package com.jeffdisher.tubeswarm.prefetch;

import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * Helpers for the item paths passed in by callers, which may be full paths, URLs with queries, or bare ids.
 */
public class ItemPaths
{
	private static final Pattern VIDEOS_PATH = Pattern.compile("(?:^|/)videos/([^./]+)(?:\\.[^/]+)?$");
	private static final Pattern EXTENSION = Pattern.compile("\\.[^./]+$");

	/**
	 * Reduces an item path to the id used to key its download session, so that "/videos/abc.mp4",
	 * "videos/abc.mp4?t=10", and "abc" all name the same session.
	 * 
	 * @param itemPath The path as given by the caller.
	 * @return The normalized id (empty if the path was null or empty).
	 */
	public static String normalize(String itemPath)
	{
		String normalized = "";
		if (null != itemPath)
		{
			String cleaned = _cutAt(_cutAt(itemPath, '?'), '#');
			Matcher matcher = VIDEOS_PATH.matcher(cleaned);
			if (matcher.find())
			{
				normalized = matcher.group(1);
			}
			else
			{
				String base = cleaned.substring(cleaned.lastIndexOf('/') + 1);
				if (base.isEmpty())
				{
					base = cleaned;
				}
				normalized = EXTENSION.matcher(base).replaceFirst("");
			}
		}
		return normalized;
	}


	private static String _cutAt(String input, char delimiter)
	{
		int index = input.indexOf(delimiter);
		return (index >= 0)
				? input.substring(0, index)
				: input
		;
	}
}
