package com.jeffdisher.tubeswarm.feed;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.junit.Assert;
import org.junit.Test;

import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.tubeswarm.testutils.MemoryMetaStore;
import com.jeffdisher.tubeswarm.testutils.MockDelayedRunner;
import com.jeffdisher.tubeswarm.testutils.MockKeys;
import com.jeffdisher.tubeswarm.testutils.MockNetwork;
import com.jeffdisher.tubeswarm.testutils.MockTimeGenerator;
import com.jeffdisher.tubeswarm.testutils.SilentLogger;
import com.jeffdisher.tubeswarm.types.FeedOrigin;


public class TestPublicFeedDirectory
{
	// The dispatcher is expected to lock-step execution, so we synchronize the call as a simple approach.
	private static final Consumer<Runnable> DISPATCHER = new Consumer<>() {
		@Override
		public void accept(Runnable arg0)
		{
			synchronized (this)
			{
				arg0.run();
			}
		}
	};

	@Test
	public void addEntryIsIdempotent() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer peer = new Peer(network, "A");
		Assert.assertTrue(peer.feed.addEntry(MockKeys.K1.toHex(), FeedOrigin.PEER));
		Assert.assertFalse(peer.feed.addEntry(MockKeys.K1.toHex(), FeedOrigin.PEER));
		// The same key in upper-case is still the same key.
		Assert.assertFalse(peer.feed.addEntry(MockKeys.K1.toHex().toUpperCase(), FeedOrigin.LOCAL));
		Assert.assertEquals(1, peer.feed.listFeed().size());
		Assert.assertEquals(FeedOrigin.PEER, peer.feed.listFeed().get(0).origin());
	}

	@Test
	public void malformedKeysRejected() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer peer = new Peer(network, "A");
		Assert.assertFalse(peer.feed.addEntry(null, FeedOrigin.PEER));
		Assert.assertFalse(peer.feed.addEntry("", FeedOrigin.PEER));
		Assert.assertFalse(peer.feed.addEntry("zz".repeat(32), FeedOrigin.PEER));
		Assert.assertFalse(peer.feed.addEntry(MockKeys.K1.toHex() + "00", FeedOrigin.PEER));
		Assert.assertEquals(0, peer.feed.getStats().totalEntries());
		Assert.assertEquals(0, peer.runner.pendingCount());
	}

	@Test
	public void hiddenKeysStayHidden() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer peer = new Peer(network, "A");
		peer.feed.addEntry(MockKeys.K1.toHex(), FeedOrigin.PEER);
		peer.feed.addEntry(MockKeys.K2.toHex(), FeedOrigin.PEER);
		peer.feed.hide(MockKeys.K1);
		Assert.assertFalse(peer.feed.addEntry(MockKeys.K1.toHex(), FeedOrigin.PEER));
		List<FeedEntry> feed = peer.feed.listFeed();
		Assert.assertEquals(1, feed.size());
		Assert.assertEquals(MockKeys.K2, feed.get(0).key());
		FeedStats stats = peer.feed.getStats();
		Assert.assertEquals(1, stats.totalEntries());
		Assert.assertEquals(1, stats.hiddenCount());
	}

	@Test
	public void listNewestFirst() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer peer = new Peer(network, "A");
		peer.feed.addEntry(MockKeys.K1.toHex(), FeedOrigin.PEER);
		peer.time.advance(10L);
		peer.feed.addEntry(MockKeys.K2.toHex(), FeedOrigin.PEER);
		// Same timestamp as K2:  the one added later is listed first.
		peer.feed.addEntry(MockKeys.K3.toHex(), FeedOrigin.PEER);
		List<FeedEntry> feed = peer.feed.listFeed();
		Assert.assertEquals(MockKeys.K3, feed.get(0).key());
		Assert.assertEquals(MockKeys.K2, feed.get(1).key());
		Assert.assertEquals(MockKeys.K1, feed.get(2).key());
	}

	@Test
	public void fullSetOnConnect() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		Peer b = new Peer(network, "B");
		a.feed.addEntry(MockKeys.K1.toHex(), FeedOrigin.LOCAL);
		a.feed.addEntry(MockKeys.K2.toHex(), FeedOrigin.PEER);
		a.feed.addEntry(MockKeys.K3.toHex(), FeedOrigin.PEER);
		a.start();
		b.start();
		network.connect(a.node, b.node);
		network.deliverAll();
		
		Assert.assertEquals(3, b.feed.listFeed().size());
		// The whole set was merged with a single notification.
		Assert.assertEquals(1, b.updates.size());
		Assert.assertEquals(1, a.feed.getStats().peerCount());
		Assert.assertEquals(1, b.feed.getStats().peerCount());
		// Each side sent exactly one full set.
		Assert.assertEquals(2, network.messagesSent());
	}

	@Test
	public void fullSetNotRebroadcast() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		Peer b = new Peer(network, "B");
		Peer c = new Peer(network, "C");
		a.start();
		b.start();
		c.start();
		network.connect(a.node, b.node);
		network.connect(b.node, c.node);
		network.deliverAll();
		network.resetMessageCount();
		
		a.feed.addEntry(MockKeys.K1.toHex(), FeedOrigin.LOCAL);
		Assert.assertEquals(1, a.feed.requestRefresh());
		network.deliverAll();
		Assert.assertEquals(1, network.messagesSent());
		Assert.assertEquals(1, b.feed.listFeed().size());
		Assert.assertEquals(0, c.feed.listFeed().size());
	}

	@Test
	public void announcePropagatesAlongLine() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		Peer b = new Peer(network, "B");
		Peer c = new Peer(network, "C");
		a.start();
		b.start();
		c.start();
		network.connect(a.node, b.node);
		network.connect(b.node, c.node);
		network.deliverAll();
		network.resetMessageCount();
		
		Assert.assertEquals(1, a.feed.submit(MockKeys.K1));
		network.deliverAll();
		
		Assert.assertEquals(MockKeys.K1, b.feed.listFeed().get(0).key());
		Assert.assertEquals(MockKeys.K1, c.feed.listFeed().get(0).key());
		Assert.assertEquals(FeedOrigin.PEER, c.feed.listFeed().get(0).origin());
		// A->B then B->C:  nothing is echoed back to A and C has nobody else to forward to.
		Assert.assertEquals(2, network.messagesSent());
		Assert.assertEquals(1, a.updates.size());
		Assert.assertEquals(1, b.updates.size());
		Assert.assertEquals(1, c.updates.size());
	}

	@Test
	public void announceFloodTerminatesInCycle() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		Peer b = new Peer(network, "B");
		Peer c = new Peer(network, "C");
		a.start();
		b.start();
		c.start();
		network.connect(a.node, b.node);
		network.connect(b.node, c.node);
		network.connect(c.node, a.node);
		network.deliverAll();
		network.resetMessageCount();
		
		a.feed.submit(MockKeys.K1);
		network.deliverAll();
		Assert.assertEquals(1, b.feed.listFeed().size());
		Assert.assertEquals(1, c.feed.listFeed().size());
		// Each node forwards a key at most once, to at most its other peers.
		Assert.assertTrue(network.messagesSent() <= 4);
	}

	@Test
	public void submitReannouncesKnownKey() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		Peer b = new Peer(network, "B");
		Peer c = new Peer(network, "C");
		a.start();
		b.start();
		c.start();
		network.connect(a.node, b.node);
		network.connect(b.node, c.node);
		network.deliverAll();
		a.feed.submit(MockKeys.K1);
		network.deliverAll();
		network.resetMessageCount();
		
		// B already knows it but a local submission still announces to everyone.
		Assert.assertEquals(2, b.feed.submit(MockKeys.K1));
		network.deliverAll();
		// Neither A nor C learned anything new so they don't forward it.
		Assert.assertEquals(2, network.messagesSent());
		Assert.assertTrue(b.feed.isPublished(MockKeys.K1));
		Assert.assertEquals(FeedOrigin.PEER, b.feed.listFeed().get(0).origin());
	}

	@Test
	public void staleChannelDoesNotStopGossip() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		Peer b = new Peer(network, "B");
		Peer c = new Peer(network, "C");
		a.start();
		b.start();
		c.start();
		network.connect(b.node, a.node);
		network.connect(b.node, c.node);
		network.deliverAll();
		network.breakLink(b.node, a.node);
		
		Assert.assertEquals(1, b.feed.submit(MockKeys.K2));
		network.deliverAll();
		Assert.assertEquals(0, a.feed.listFeed().size());
		Assert.assertEquals(1, c.feed.listFeed().size());
		Assert.assertEquals(1, b.logger.getErrorCount());
	}

	@Test
	public void connectionCloseDropsPeer() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		Peer b = new Peer(network, "B");
		a.start();
		b.start();
		network.connect(a.node, b.node);
		network.deliverAll();
		Assert.assertEquals(1, a.feed.getStats().peerCount());
		
		network.disconnect(a.node, b.node, new IOException("Reset"));
		network.deliverAll();
		Assert.assertEquals(0, a.feed.getStats().peerCount());
		Assert.assertEquals(0, b.feed.getStats().peerCount());
		Assert.assertEquals(0, a.feed.requestRefresh());
		
		// Reconnecting opens a fresh channel.
		network.connect(a.node, b.node);
		network.deliverAll();
		Assert.assertEquals(1, a.feed.getStats().peerCount());
	}

	@Test
	public void attachesToExistingConnectionsOnStart() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		Peer b = new Peer(network, "B");
		b.feed.addEntry(MockKeys.K4.toHex(), FeedOrigin.LOCAL);
		b.start();
		network.connect(a.node, b.node);
		network.deliverAll();
		// A wasn't listening yet, so B's channel request went unanswered.
		Assert.assertEquals(0, b.feed.getStats().peerCount());
		
		a.start();
		network.deliverAll();
		Assert.assertTrue(a.node.isInTopic(PublicFeedDirectory.TOPIC));
		Assert.assertEquals(1, a.feed.getStats().peerCount());
		Assert.assertEquals(MockKeys.K4, a.feed.listFeed().get(0).key());
	}

	@Test
	public void legacyAndVariantMessages() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		a.feed.addEntry(MockKeys.K1.toHex(), FeedOrigin.LOCAL);
		a.start();
		// The raw node has no directory:  we drive its side of the channel by hand.
		MockNetwork.Node raw = network.createNode("raw");
		network.connect(a.node, raw);
		network.deliverAll();
		List<GossipMessage> received = new ArrayList<>();
		IGossipChannel channel = raw.openChannel(raw.currentConnections().get(0), PublicFeedDirectory.PROTOCOL, new IGossipChannel.IListener() {
			@Override
			public void onOpen(IGossipChannel opened)
			{
			}
			@Override
			public void onMessage(IGossipChannel source, byte[] payload)
			{
				received.add(GossipCodec.decode(payload));
			}
			@Override
			public void onClose(IGossipChannel closed)
			{
			}
		});
		network.deliverAll();
		Assert.assertEquals(1, received.size());
		Assert.assertEquals(GossipMessage.Type.HAVE_FULL_SET, received.get(0).type());
		Assert.assertEquals(List.of(MockKeys.K1.toHex()), received.get(0).keys());
		
		// NEED_FEED is answered with our full set.
		channel.send(_bytes("{\"type\":\"NEED_FEED\"}"));
		network.deliverAll();
		Assert.assertEquals(2, received.size());
		Assert.assertEquals(GossipMessage.Type.HAVE_FULL_SET, received.get(1).type());
		
		// FEED_RESPONSE is merged like a full set, ignoring bad keys.
		channel.send(_bytes("{\"type\":\"FEED_RESPONSE\",\"keys\":[\"" + MockKeys.K2.toHex() + "\",\"bogus\"]}"));
		// The newer entries form of HAVE_FEED.
		channel.send(_bytes("{\"type\":\"HAVE_FEED\",\"keys\":[],\"entries\":[{\"driveKey\":\"" + MockKeys.K3.toHex() + "\",\"publicBeeKey\":null}]}"));
		// Garbage is dropped.
		channel.send(_bytes("not json"));
		channel.send(_bytes("{\"type\":\"SOMETHING_NEW\"}"));
		network.deliverAll();
		
		Assert.assertEquals(3, a.feed.listFeed().size());
		Assert.assertEquals(2, a.updates.size());
		Assert.assertEquals(2, a.logger.getErrorCount());
		// None of these were forwarded back.
		Assert.assertEquals(2, received.size());
	}

	@Test
	public void restoreFromStore() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		a.store.put(PublicFeedDirectory.KEY_PUBLISHED, new JsonArray().add(MockKeys.K1.toHex()));
		a.store.put(PublicFeedDirectory.KEY_DISCOVERED, new JsonArray().add(MockKeys.K2.toHex()).add(MockKeys.K1.toHex()).add("bad"));
		a.start();
		
		Assert.assertEquals(2, a.feed.listFeed().size());
		Assert.assertTrue(a.feed.isPublished(MockKeys.K1));
		Assert.assertFalse(a.feed.isPublished(MockKeys.K2));
		Assert.assertEquals(1, a.updates.size());
		Assert.assertEquals(1, a.logger.getErrorCount());
		for (FeedEntry entry : a.feed.listFeed())
		{
			Assert.assertEquals(MockKeys.K1.equals(entry.key()) ? FeedOrigin.LOCAL : FeedOrigin.PEER, entry.origin());
		}
	}

	@Test
	public void discoveredPersistenceIsCoalesced() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		a.feed.addEntry(MockKeys.K1.toHex(), FeedOrigin.PEER);
		a.feed.addEntry(MockKeys.K2.toHex(), FeedOrigin.PEER);
		a.feed.addEntry(MockKeys.K3.toHex(), FeedOrigin.PEER);
		Assert.assertEquals(List.of(PublicFeedDirectory.PERSIST_DELAY_MILLIS), a.runner.pendingDelays());
		Assert.assertEquals(1, a.runner.runAll());
		
		JsonValue stored = a.store.get(PublicFeedDirectory.KEY_DISCOVERED);
		Assert.assertEquals(3, stored.asArray().size());
		Assert.assertEquals(MockKeys.K1.toHex(), stored.asArray().get(0).asString());
		
		// A failed write is only logged.
		a.feed.addEntry(MockKeys.K4.toHex(), FeedOrigin.PEER);
		a.store.setFailWrites(true);
		a.runner.runAll();
		Assert.assertEquals(1, a.logger.getErrorCount());
		Assert.assertEquals(4, a.feed.listFeed().size());
	}

	@Test
	public void unpublish() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		a.start();
		a.feed.submit(MockKeys.K1);
		Assert.assertTrue(a.feed.isPublished(MockKeys.K1));
		Assert.assertEquals(1, a.store.get(PublicFeedDirectory.KEY_PUBLISHED).asArray().size());
		
		Assert.assertTrue(a.feed.unpublish(MockKeys.K1));
		Assert.assertFalse(a.feed.unpublish(MockKeys.K1));
		Assert.assertFalse(a.feed.isPublished(MockKeys.K1));
		Assert.assertEquals(0, a.feed.listFeed().size());
		Assert.assertEquals(0, a.store.get(PublicFeedDirectory.KEY_PUBLISHED).asArray().size());
		Assert.assertEquals(2, a.updates.size());
	}

	@Test
	public void hidingPublishedKeyLastsUntilRestart() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		a.start();
		a.feed.submit(MockKeys.K1);
		a.feed.hide(MockKeys.K1);
		Assert.assertEquals(0, a.feed.listFeed().size());
		Assert.assertTrue(a.feed.isPublished(MockKeys.K1));
		
		Peer restarted = new Peer(network, "A2");
		restarted.store.put(PublicFeedDirectory.KEY_PUBLISHED, a.store.get(PublicFeedDirectory.KEY_PUBLISHED));
		restarted.start();
		List<FeedEntry> feed = restarted.feed.listFeed();
		Assert.assertEquals(1, feed.size());
		Assert.assertEquals(MockKeys.K1, feed.get(0).key());
		Assert.assertEquals(FeedOrigin.LOCAL, feed.get(0).origin());
		Assert.assertEquals(0, restarted.feed.getStats().hiddenCount());
	}

	@Test
	public void stopLeavesTopic() throws Throwable
	{
		MockNetwork network = new MockNetwork();
		Peer a = new Peer(network, "A");
		Peer b = new Peer(network, "B");
		a.start();
		b.start();
		network.connect(a.node, b.node);
		network.deliverAll();
		
		a.feed.stop();
		Assert.assertFalse(a.node.isInTopic(PublicFeedDirectory.TOPIC));
		Assert.assertEquals(0, a.feed.getStats().peerCount());
		Assert.assertEquals(0, a.feed.submit(MockKeys.K5));
	}


	private static byte[] _bytes(String text)
	{
		return text.getBytes(StandardCharsets.UTF_8);
	}


	private static class Peer
	{
		public final MockNetwork.Node node;
		public final MemoryMetaStore store = new MemoryMetaStore();
		public final MockDelayedRunner runner = new MockDelayedRunner();
		public final MockTimeGenerator time = new MockTimeGenerator();
		public final SilentLogger logger = new SilentLogger();
		public final List<Integer> updates = new ArrayList<>();
		public final PublicFeedDirectory feed;

		public Peer(MockNetwork network, String name)
		{
			this.node = network.createNode(name);
			this.feed = new PublicFeedDirectory(this.node, this.store, this.logger, this.time, this.runner, DISPATCHER);
			this.feed.registerFeedListener(() -> this.updates.add(this.feed.listFeed().size()));
		}

		public void start() throws Throwable
		{
			this.feed.start();
		}
	}
}
