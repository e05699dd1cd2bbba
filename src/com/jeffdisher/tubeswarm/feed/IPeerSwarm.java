package com.jeffdisher.tubeswarm.feed;

import java.io.IOException;
import java.util.List;


/**
 * The peer-to-peer transport:  topic discovery, the connections it produces, and the protocol channels opened over
 * them.
 */
public interface IPeerSwarm
{
	/**
	 * Starts discovering (and connecting to) peers on the given topic.
	 */
	void joinTopic(String topic);

	void leaveTopic(String topic);

	/**
	 * @return The connections which are currently established.
	 */
	List<IPeerConnection> currentConnections();

	/**
	 * Opens (or accepts, if the remote side already requested it) the channel for the given protocol on a connection.
	 * The listener's onOpen is called once the channel is paired with the remote side.
	 * 
	 * @param connection The connection.
	 * @param protocol The protocol name both sides use.
	 * @param listener The listener for the channel's events.
	 * @return The channel or null if a channel for this protocol is already open on the connection.
	 */
	IGossipChannel openChannel(IPeerConnection connection, String protocol, IGossipChannel.IListener listener);

	/**
	 * Sets the single listener told about connection changes (null to detach).
	 */
	void setConnectionListener(IConnectionListener listener);


	/**
	 * Connection events, called on some transport thread.
	 */
	public interface IConnectionListener
	{
		void connectionEstablished(IPeerConnection connection);
		/**
		 * The remote side opened a channel for the given protocol and is waiting for us to pair it.
		 */
		void channelRequested(IPeerConnection connection, String protocol);
		/**
		 * @param error The error which closed the connection (null if it closed normally).
		 */
		void connectionClosed(IPeerConnection connection, IOException error);
	}
}
