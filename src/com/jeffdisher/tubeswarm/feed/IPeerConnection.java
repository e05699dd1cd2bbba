package com.jeffdisher.tubeswarm.feed;


/**
 * An established transport connection to one remote peer.  Instances are compared by identity.
 */
public interface IPeerConnection
{
	/**
	 * @return A short description of the remote peer, for logs.
	 */
	String remoteName();
}
