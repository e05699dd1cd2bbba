package com.jeffdisher.tubeswarm;


/**
 * Just contains the environment variables the system checks.
 */
public class EnvVars
{
	/**
	 * If set, this directory path will be used for the node's metadata (seeds, pinned channels, feed cache).  Defaults
	 * to "~/.tubeswarm" if not set.
	 */
	public static final String ENV_VAR_TUBESWARM_STORAGE = "TUBESWARM_STORAGE";

	/**
	 * Enables verbose console logging.  If not set, verbose logs will not be written to the console.
	 */
	public static final String ENV_VAR_TUBESWARM_VERBOSE = "TUBESWARM_VERBOSE";

	/**
	 * The port the local interactive server listens on.  Defaults to 8000 if not set.
	 */
	public static final String ENV_VAR_TUBESWARM_PORT = "TUBESWARM_PORT";
}
