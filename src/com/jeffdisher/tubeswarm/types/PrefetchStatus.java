package com.jeffdisher.tubeswarm.types;


/**
 * The states of a download session.  UNKNOWN is only used for snapshots of sessions which don't exist.
 */
public enum PrefetchStatus
{
	UNKNOWN,
	CONNECTING,
	RESOLVING,
	DOWNLOADING,
	COMPLETE,
	ERROR,
	;

	/**
	 * @return True if no further transitions are possible from this state.
	 */
	public boolean isTerminal()
	{
		return (COMPLETE == this) || (ERROR == this);
	}
}
