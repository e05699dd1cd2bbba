package com.jeffdisher.tubeswarm.feed;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.tubeswarm.logic.IDelayedRunner;
import com.jeffdisher.tubeswarm.logic.ILogger;
import com.jeffdisher.tubeswarm.logic.IMetaStore;
import com.jeffdisher.tubeswarm.types.ContentKey;
import com.jeffdisher.tubeswarm.types.FeedOrigin;
import com.jeffdisher.tubeswarm.types.PersistenceException;
import com.jeffdisher.tubeswarm.utils.Assert;


/**
 * The local view of every content key known to exist in the swarm, kept up to date by flood-gossip with the connected
 * peers.
 * Each connection gets exactly one gossip channel.  When a channel opens, we send it our full set.  A full set
 * received from a peer is merged without being re-broadcast, while a newly-seen announcement is forwarded to every
 * other peer.  Since adding a key is idempotent, each distinct key is forwarded at most once per node.
 * Peer input is validated when it is added:  malformed keys are dropped without affecting anything else.
 * 
 * The feed table, hidden set, and published set are guarded by this.  The channel table has its own lock.  Messages
 * are never sent and listeners are never called while holding either.
 */
public class PublicFeedDirectory
{
	public static final String TOPIC = "tubeswarm-public-feed-v1";
	public static final String PROTOCOL = "tubeswarm-feed";
	public static final String KEY_PUBLISHED = "published-channels";
	public static final String KEY_DISCOVERED = "discovered-channels";
	public static final long PERSIST_DELAY_MILLIS = 1500L;
	public static final int PERSIST_MAX_ENTRIES = 500;

	private final IPeerSwarm _swarm;
	private final IMetaStore _store;
	private final ILogger _logger;
	private final LongSupplier _currentTimeMillisGenerator;
	private final IDelayedRunner _delayedRunner;
	private final Consumer<Runnable> _callbackDispatcher;

	// Guarded by this.
	private final Map<ContentKey, FeedEntry> _entries;
	private final Set<ContentKey> _hidden;
	private final Set<ContentKey> _published;
	private final List<Runnable> _feedListeners;
	private boolean _isPersistScheduled;

	private final Object _channelLock = new Object();
	// Guarded by _channelLock.
	private final Set<IPeerConnection> _attached;
	private final Map<IPeerConnection, IGossipChannel> _openChannels;
	private boolean _isRunning;

	public PublicFeedDirectory(IPeerSwarm swarm
			, IMetaStore store
			, ILogger logger
			, LongSupplier currentTimeMillisGenerator
			, IDelayedRunner delayedRunner
			, Consumer<Runnable> callbackDispatcher
	)
	{
		_swarm = swarm;
		_store = store;
		_logger = logger;
		_currentTimeMillisGenerator = currentTimeMillisGenerator;
		_delayedRunner = delayedRunner;
		_callbackDispatcher = callbackDispatcher;
		_entries = new LinkedHashMap<>();
		_hidden = new HashSet<>();
		_published = new LinkedHashSet<>();
		_feedListeners = new ArrayList<>();
		_attached = new HashSet<>();
		_openChannels = new LinkedHashMap<>();
	}

	/**
	 * Restores the published and previously-discovered keys, joins the discovery topic, and attaches to every
	 * connection which is already established.
	 * 
	 * @throws PersistenceException The stored keys couldn't be read.
	 */
	public void start() throws PersistenceException
	{
		ILogger log = _logger.logStart("Starting public feed on topic " + TOPIC);
		JsonValue published = _store.get(KEY_PUBLISHED);
		JsonValue discovered = _store.get(KEY_DISCOVERED);
		int restored = 0;
		long now = _currentTimeMillisGenerator.getAsLong();
		synchronized (this)
		{
			for (ContentKey key : _readKeys(log, published))
			{
				_published.add(key);
				if (_addEntryLocked(key, FeedOrigin.LOCAL, now))
				{
					restored += 1;
				}
			}
			for (ContentKey key : _readKeys(log, discovered))
			{
				if (_addEntryLocked(key, FeedOrigin.PEER, now))
				{
					restored += 1;
				}
			}
		}
		if (restored > 0)
		{
			log.logOperation("Restored " + restored + " entries");
			_fireFeedUpdated();
		}
		synchronized (_channelLock)
		{
			Assert.assertTrue(!_isRunning);
			_isRunning = true;
		}
		_swarm.setConnectionListener(new IPeerSwarm.IConnectionListener() {
			@Override
			public void connectionEstablished(IPeerConnection connection)
			{
				handleConnection(connection);
			}
			@Override
			public void channelRequested(IPeerConnection connection, String protocol)
			{
				if (PROTOCOL.equals(protocol))
				{
					handleConnection(connection);
				}
			}
			@Override
			public void connectionClosed(IPeerConnection connection, IOException error)
			{
				_dropConnection(connection, error);
			}
		});
		_swarm.joinTopic(TOPIC);
		List<IPeerConnection> existing = _swarm.currentConnections();
		for (IPeerConnection connection : existing)
		{
			handleConnection(connection);
		}
		log.logFinish("Public feed started with " + existing.size() + " existing connections");
	}

	/**
	 * Leaves the discovery topic and forgets all channels.
	 */
	public void stop()
	{
		synchronized (_channelLock)
		{
			_isRunning = false;
			_attached.clear();
			_openChannels.clear();
		}
		_swarm.setConnectionListener(null);
		_swarm.leaveTopic(TOPIC);
		_logger.logOperation("Public feed stopped");
	}

	/**
	 * Opens the gossip channel on a connection, unless one is already open or opening.
	 * 
	 * @param connection The connection.
	 */
	public void handleConnection(IPeerConnection connection)
	{
		boolean shouldOpen;
		synchronized (_channelLock)
		{
			shouldOpen = _isRunning && _attached.add(connection);
		}
		if (shouldOpen)
		{
			IGossipChannel channel = _swarm.openChannel(connection, PROTOCOL, new PeerListener(connection));
			if (null == channel)
			{
				// The transport already has our channel on this connection.
				_logger.logVerbose("Gossip channel already open to " + connection.remoteName());
			}
		}
	}

	/**
	 * Adds a key to the feed.
	 * 
	 * @param rawKey The key, as received (validated here).
	 * @param origin Where the key came from.
	 * @return True if the key was new, false if it was malformed, already known, or hidden.
	 */
	public boolean addEntry(String rawKey, FeedOrigin origin)
	{
		ContentKey key = ContentKey.fromHex(rawKey);
		boolean didAdd = false;
		if (null != key)
		{
			synchronized (this)
			{
				didAdd = _addEntryLocked(key, origin, _currentTimeMillisGenerator.getAsLong());
			}
			if (didAdd)
			{
				_schedulePersistDiscovered();
			}
		}
		else
		{
			_logger.logVerbose("Dropping malformed key: " + rawKey);
		}
		return didAdd;
	}

	/**
	 * Publishes a local channel:  adds it to the feed, remembers it as published, and announces it to every peer (even
	 * if it was already known, since some peers may not have heard it).
	 * 
	 * @param key The channel key.
	 * @return The number of peers the announcement was sent to.
	 * @throws PersistenceException The key was published but the published set couldn't be saved.
	 */
	public int submit(ContentKey key) throws PersistenceException
	{
		boolean didAdd;
		JsonArray toPersist;
		synchronized (this)
		{
			didAdd = _addEntryLocked(key, FeedOrigin.LOCAL, _currentTimeMillisGenerator.getAsLong());
			toPersist = _published.add(key) ? _toArray(_published) : null;
		}
		_logger.logOperation("Submitting " + key + " to the public feed");
		if (didAdd)
		{
			_fireFeedUpdated();
			_schedulePersistDiscovered();
		}
		int sent = _broadcast(GossipCodec.encode(GossipMessage.announce(key.toHex())), null);
		if (null != toPersist)
		{
			_store.put(KEY_PUBLISHED, toPersist);
		}
		return sent;
	}

	/**
	 * Stops publishing a local channel and drops it from the feed.  Peers which already know it keep it.
	 * 
	 * @param key The channel key.
	 * @return True if it was published.
	 * @throws PersistenceException The key was unpublished but the published set couldn't be saved.
	 */
	public boolean unpublish(ContentKey key) throws PersistenceException
	{
		boolean wasPublished;
		JsonArray toPersist;
		synchronized (this)
		{
			wasPublished = _published.remove(key);
			if (wasPublished)
			{
				_entries.remove(key);
			}
			toPersist = wasPublished ? _toArray(_published) : null;
		}
		if (wasPublished)
		{
			_logger.logOperation("Unpublished " + key);
			_fireFeedUpdated();
			_schedulePersistDiscovered();
			_store.put(KEY_PUBLISHED, toPersist);
		}
		return wasPublished;
	}

	public synchronized boolean isPublished(ContentKey key)
	{
		return _published.contains(key);
	}

	/**
	 * Removes a key from the feed and stops it from being added again (until restart).
	 * Hiding only filters this node's view:  a key we published stays published (see unpublish()) so it is listed
	 * again after a restart.
	 * 
	 * @param key The key.
	 */
	public void hide(ContentKey key)
	{
		boolean wasListed;
		synchronized (this)
		{
			wasListed = (null != _entries.remove(key));
			_hidden.add(key);
		}
		_logger.logOperation("Hid " + key);
		if (wasListed)
		{
			_fireFeedUpdated();
			_schedulePersistDiscovered();
		}
	}

	/**
	 * Re-sends our full set to every connected peer, prompting them to merge anything they were missing.
	 * 
	 * @return The number of peers contacted.
	 */
	public int requestRefresh()
	{
		int sent = _broadcast(_encodeFullSet(), null);
		_logger.logOperation("Requested feed refresh from " + sent + " peers");
		return sent;
	}

	/**
	 * @return The feed, newest first (ties by most recently added first).
	 */
	public List<FeedEntry> listFeed()
	{
		List<FeedEntry> feed;
		synchronized (this)
		{
			feed = new ArrayList<>(_entries.values());
		}
		// Insertion order is oldest first, so reverse before the stable sort to break timestamp ties newest first.
		Collections.reverse(feed);
		feed.sort((FeedEntry one, FeedEntry two) -> Long.compare(two.discoveredMillis(), one.discoveredMillis()));
		return feed;
	}

	public FeedStats getStats()
	{
		int peerCount;
		synchronized (_channelLock)
		{
			peerCount = _openChannels.size();
		}
		synchronized (this)
		{
			return new FeedStats(_entries.size(), _hidden.size(), peerCount);
		}
	}

	/**
	 * Adds a listener called (through the callback dispatcher) whenever the feed changes.
	 * 
	 * @param listener The listener.
	 */
	public synchronized void registerFeedListener(Runnable listener)
	{
		_feedListeners.add(listener);
	}


	private void _handleMessage(IPeerConnection connection, IGossipChannel channel, byte[] payload)
	{
		GossipMessage message = GossipCodec.decode(payload);
		if (null == message)
		{
			_logger.logError("Dropping undecodable gossip from " + connection.remoteName());
		}
		else
		{
			switch (message.type())
			{
			case HAVE_FULL_SET:
			case SET_RESPONSE: {
				int added = 0;
				for (String key : message.keys())
				{
					if (addEntry(key, FeedOrigin.PEER))
					{
						added += 1;
					}
				}
				if (added > 0)
				{
					_logger.logOperation("Added " + added + " keys from " + connection.remoteName());
					_fireFeedUpdated();
				}
				break;
			}
			case ANNOUNCE:
				if (addEntry(message.key(), FeedOrigin.PEER))
				{
					_logger.logOperation("Learned " + message.key() + " from " + connection.remoteName());
					_fireFeedUpdated();
					String canonical = ContentKey.fromHex(message.key()).toHex();
					_broadcast(GossipCodec.encode(GossipMessage.announce(canonical)), connection);
				}
				break;
			case NEED_SET:
				_send(connection, channel, _encodeFullSet());
				break;
			default:
				throw Assert.unreachable();
			}
		}
	}

	private void _dropConnection(IPeerConnection connection, IOException error)
	{
		boolean wasOpen;
		synchronized (_channelLock)
		{
			_attached.remove(connection);
			wasOpen = (null != _openChannels.remove(connection));
		}
		if (null != error)
		{
			_logger.logVerbose("Connection to " + connection.remoteName() + " failed: " + error.getLocalizedMessage());
		}
		else if (wasOpen)
		{
			_logger.logVerbose("Gossip channel to " + connection.remoteName() + " closed");
		}
	}

	// Requires this.
	private boolean _addEntryLocked(ContentKey key, FeedOrigin origin, long now)
	{
		boolean didAdd = false;
		if (!_entries.containsKey(key) && !_hidden.contains(key))
		{
			_entries.put(key, new FeedEntry(key, now, origin));
			didAdd = true;
		}
		return didAdd;
	}

	private byte[] _encodeFullSet()
	{
		List<String> keys = new ArrayList<>();
		synchronized (this)
		{
			for (ContentKey key : _entries.keySet())
			{
				keys.add(key.toHex());
			}
		}
		return GossipCodec.encode(GossipMessage.haveFullSet(keys));
	}

	private int _broadcast(byte[] payload, IPeerConnection excluded)
	{
		Map<IPeerConnection, IGossipChannel> targets;
		synchronized (_channelLock)
		{
			targets = new HashMap<>(_openChannels);
		}
		targets.remove(excluded);
		int sent = 0;
		for (Map.Entry<IPeerConnection, IGossipChannel> target : targets.entrySet())
		{
			if (_send(target.getKey(), target.getValue(), payload))
			{
				sent += 1;
			}
		}
		return sent;
	}

	private boolean _send(IPeerConnection connection, IGossipChannel channel, byte[] payload)
	{
		boolean didSend;
		try
		{
			channel.send(payload);
			didSend = true;
		}
		catch (IOException e)
		{
			// One stale peer doesn't stop the gossip to the others.
			_logger.logError("Failed to send gossip to " + connection.remoteName() + ": " + e.getLocalizedMessage());
			didSend = false;
		}
		return didSend;
	}

	private void _fireFeedUpdated()
	{
		List<Runnable> listeners;
		synchronized (this)
		{
			listeners = List.copyOf(_feedListeners);
		}
		for (Runnable listener : listeners)
		{
			_callbackDispatcher.accept(listener);
		}
	}

	private void _schedulePersistDiscovered()
	{
		boolean shouldSchedule;
		synchronized (this)
		{
			shouldSchedule = !_isPersistScheduled;
			_isPersistScheduled = true;
		}
		if (shouldSchedule)
		{
			_delayedRunner.runAfterDelay(() -> _persistDiscovered(), PERSIST_DELAY_MILLIS);
		}
	}

	private void _persistDiscovered()
	{
		JsonArray keys = new JsonArray();
		synchronized (this)
		{
			_isPersistScheduled = false;
			int count = 0;
			for (ContentKey key : _entries.keySet())
			{
				if (count >= PERSIST_MAX_ENTRIES)
				{
					break;
				}
				keys.add(key.toHex());
				count += 1;
			}
		}
		try
		{
			_store.put(KEY_DISCOVERED, keys);
		}
		catch (PersistenceException e)
		{
			// This is only a warm-start cache so we just report the failure.
			_logger.logError("Discovered-channel cache not saved: " + e.getLocalizedMessage());
		}
	}

	private static List<ContentKey> _readKeys(ILogger log, JsonValue stored)
	{
		List<ContentKey> keys = new ArrayList<>();
		if ((null != stored) && stored.isArray())
		{
			for (JsonValue element : stored.asArray())
			{
				ContentKey key = element.isString() ? ContentKey.fromHex(element.asString()) : null;
				if (null != key)
				{
					keys.add(key);
				}
				else
				{
					log.logError("Skipping invalid stored key: " + element);
				}
			}
		}
		return keys;
	}

	private static JsonArray _toArray(Set<ContentKey> keys)
	{
		JsonArray array = new JsonArray();
		for (ContentKey key : keys)
		{
			array.add(key.toHex());
		}
		return array;
	}


	private class PeerListener implements IGossipChannel.IListener
	{
		private final IPeerConnection _connection;

		public PeerListener(IPeerConnection connection)
		{
			_connection = connection;
		}

		@Override
		public void onOpen(IGossipChannel channel)
		{
			boolean isRunning;
			synchronized (_channelLock)
			{
				isRunning = _isRunning;
				if (isRunning)
				{
					_openChannels.put(_connection, channel);
				}
			}
			if (isRunning)
			{
				_logger.logVerbose("Gossip channel open to " + _connection.remoteName());
				_send(_connection, channel, _encodeFullSet());
			}
		}

		@Override
		public void onMessage(IGossipChannel channel, byte[] payload)
		{
			_handleMessage(_connection, channel, payload);
		}

		@Override
		public void onClose(IGossipChannel channel)
		{
			_dropConnection(_connection, null);
		}
	}
}
