package com.jeffdisher.tubeswarm.utils;

import java.util.Locale;


/**
 * Basic utilities for miscellaneous uses.
 */
public class MiscHelpers
{
	public static final long BYTES_PER_GIB = 1024L * 1024L * 1024L;
	private static final double BYTES_PER_MIB = 1024d * 1024d;

	/**
	 * Converts a given number of bytes into a human-readable string, using binary units since that is how storage
	 * budgets are expressed.
	 * 
	 * @param bytes The raw number of bytes.
	 * @return A human-readable string.
	 */
	public static String humanReadableBytes(long bytes)
	{
		String firstPart = null;
		if (bytes >= BYTES_PER_GIB)
		{
			firstPart = _getMagnitudeString(bytes, (double)BYTES_PER_GIB, "GiB");
		}
		else if (bytes >= (long)BYTES_PER_MIB)
		{
			firstPart = _getMagnitudeString(bytes, BYTES_PER_MIB, "MiB");
		}
		else if (bytes >= 1024L)
		{
			firstPart = _getMagnitudeString(bytes, 1024d, "KiB");
		}
		return (null != firstPart)
				? (firstPart + " (" + bytes + " bytes)")
				: (bytes + " bytes")
		;
	}

	/**
	 * @param bytesPerSecond A transfer speed.
	 * @return The speed as "N.NN MB/s", the way the progress logs show it.
	 */
	public static String humanReadableSpeed(double bytesPerSecond)
	{
		return String.format(Locale.ROOT, "%.2f MB/s", bytesPerSecond / BYTES_PER_MIB);
	}

	/**
	 * Creates a named daemon thread for the given runnable.  The thread is NOT started.
	 * 
	 * @param runnable The thread's main.
	 * @param name The name to use for the thread.
	 * @return The new thread.
	 */
	public static Thread createThread(Runnable runnable, String name)
	{
		Thread thread = new Thread(runnable, name);
		thread.setDaemon(true);
		return thread;
	}


	private static String _getMagnitudeString(long bytes, double magnitude, String suffix)
	{
		double direct = (double)bytes / magnitude;
		return String.format(Locale.ROOT, "%.2f %s", direct, suffix);
	}
}
