package com.jeffdisher.tubeswarm.utils;


/**
 * Assertion helpers which can't be disabled by JVM flags.  These are for states we consider impossible, not for
 * validating untrusted input (peer data is validated at the boundary and rejected, never asserted).
 */
public class Assert
{
	/**
	 * Called when an exception was statically not expected.
	 * 
	 * @param e The unexpected exception.
	 * @return Does not return - this is only here so the caller can throw this to satisfy the compiler.
	 */
	public static AssertionError unexpected(Exception e)
	{
		throw new AssertionError("Unexpected exception", e);
	}

	/**
	 * States that something must be true, failing if it isn't.
	 * 
	 * @param flag The statement which must be true.
	 */
	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Expected true");
		}
	}

	/**
	 * Called when a code path which should be unreachable is executed.
	 * 
	 * @return Does not return - this is only here so the caller can throw this to satisfy the compiler.
	 */
	public static AssertionError unreachable()
	{
		throw new AssertionError("Unreachable code path hit");
	}
}
