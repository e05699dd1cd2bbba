package com.jeffdisher.tubeswarm.feed;

import java.util.List;

import com.jeffdisher.tubeswarm.utils.Assert;


/**
 * A decoded gossip message.  Keys are kept as the raw strings received since each one is validated individually when
 * it is added to the feed (one bad key in a peer's list doesn't invalidate the others).
 * 
 * @param type The message type.
 * @param keys The key list (HAVE_FULL_SET and SET_RESPONSE only, empty otherwise).
 * @param key The single key (ANNOUNCE only, null otherwise).
 */
public record GossipMessage(Type type, List<String> keys, String key)
{
	public enum Type
	{
		/**
		 * A full snapshot of the sender's known keys.
		 */
		HAVE_FULL_SET,
		/**
		 * A single new key being flooded through the swarm.
		 */
		ANNOUNCE,
		/**
		 * Legacy request for the receiver's full set.
		 */
		NEED_SET,
		/**
		 * Legacy reply to NEED_SET.
		 */
		SET_RESPONSE,
	}

	public GossipMessage
	{
		Assert.assertTrue(null != type);
		Assert.assertTrue(null != keys);
		Assert.assertTrue((Type.ANNOUNCE == type) == (null != key));
	}

	public static GossipMessage haveFullSet(List<String> keys)
	{
		return new GossipMessage(Type.HAVE_FULL_SET, List.copyOf(keys), null);
	}

	public static GossipMessage announce(String key)
	{
		return new GossipMessage(Type.ANNOUNCE, List.of(), key);
	}

	public static GossipMessage needSet()
	{
		return new GossipMessage(Type.NEED_SET, List.of(), null);
	}

	public static GossipMessage setResponse(List<String> keys)
	{
		return new GossipMessage(Type.SET_RESPONSE, List.copyOf(keys), null);
	}
}
