package com.jeffdisher.tubeswarm.feed;

import java.io.IOException;


/**
 * A message sub-channel multiplexed over a peer connection.
 */
public interface IGossipChannel
{
	/**
	 * Sends one message.
	 * 
	 * @param payload The message bytes.
	 * @throws IOException The channel is closed or the connection failed.
	 */
	void send(byte[] payload) throws IOException;

	/**
	 * The events of one channel, called sequentially on some transport thread.
	 */
	public interface IListener
	{
		void onOpen(IGossipChannel channel);
		void onMessage(IGossipChannel channel, byte[] payload);
		void onClose(IGossipChannel channel);
	}
}
