package com.jeffdisher.tubeswarm.types;


/**
 * How a feed entry was first seen by this node.
 */
public enum FeedOrigin
{
	/**
	 * Learned from another node over gossip.
	 */
	PEER,
	/**
	 * Submitted by the local user.
	 */
	LOCAL,
}
