package com.jeffdisher.tubeswarm.prefetch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

import com.jeffdisher.tubeswarm.logic.IDelayedRunner;
import com.jeffdisher.tubeswarm.logic.ILogger;
import com.jeffdisher.tubeswarm.scheduler.FutureDownload;
import com.jeffdisher.tubeswarm.scheduler.FutureItemRange;
import com.jeffdisher.tubeswarm.scheduler.FuturePrefetch;
import com.jeffdisher.tubeswarm.seeding.SeedingCache;
import com.jeffdisher.tubeswarm.types.BlockRange;
import com.jeffdisher.tubeswarm.types.ContentKey;
import com.jeffdisher.tubeswarm.types.ContentLookupException;
import com.jeffdisher.tubeswarm.types.ItemRef;
import com.jeffdisher.tubeswarm.types.PersistenceException;
import com.jeffdisher.tubeswarm.types.SeedReason;
import com.jeffdisher.tubeswarm.types.TransferException;
import com.jeffdisher.tubeswarm.utils.MiscHelpers;


/**
 * Drives the prefetch of items from the content store and keeps the per-item download sessions used to report
 * progress.
 * Sessions are keyed by content key and normalized item id.  A session moves CONNECTING -> RESOLVING -> DOWNLOADING
 * -> COMPLETE, or to ERROR from any non-terminal state.  Once an item is fully local, it is registered as a WATCHED
 * seed exactly once.
 * Completed sessions are forgotten after a grace period, so that pollers see a stable COMPLETE snapshot.  Failed
 * sessions stay until replaced by a new start() or removed by removeStats(), so that the error can be read.
 * The tracker never blocks on the content store:  all progress is driven by future callbacks and monitor ticks.
 */
public class PrefetchTracker
{
	public static final long COMPLETION_GRACE_MILLIS = 30_000L;

	private final IContentStore _store;
	private final SeedingCache _seedingCache;
	private final ILogger _logger;
	private final LongSupplier _currentTimeMillisGenerator;
	private final IDelayedRunner _delayedRunner;
	private final Consumer<Runnable> _callbackDispatcher;
	private final long _graceMillis;

	// Guarded by this.
	private final Map<ItemRef, DownloadSession> _sessions;
	private final List<IStatsListener> _listeners;

	public PrefetchTracker(IContentStore store
			, SeedingCache seedingCache
			, ILogger logger
			, LongSupplier currentTimeMillisGenerator
			, IDelayedRunner delayedRunner
			, Consumer<Runnable> callbackDispatcher
	)
	{
		this(store, seedingCache, logger, currentTimeMillisGenerator, delayedRunner, callbackDispatcher, COMPLETION_GRACE_MILLIS);
	}

	public PrefetchTracker(IContentStore store
			, SeedingCache seedingCache
			, ILogger logger
			, LongSupplier currentTimeMillisGenerator
			, IDelayedRunner delayedRunner
			, Consumer<Runnable> callbackDispatcher
			, long graceMillis
	)
	{
		_store = store;
		_seedingCache = seedingCache;
		_logger = logger;
		_currentTimeMillisGenerator = currentTimeMillisGenerator;
		_delayedRunner = delayedRunner;
		_callbackDispatcher = callbackDispatcher;
		_graceMillis = graceMillis;
		_sessions = new HashMap<>();
		_listeners = new ArrayList<>();
	}

	/**
	 * Adds a listener to be told about every session change.
	 * 
	 * @param listener The listener.
	 */
	public synchronized void registerStatsListener(IStatsListener listener)
	{
		_listeners.add(listener);
	}

	/**
	 * Starts prefetching an item.  If a session for the item is still running, nothing new is started.
	 * 
	 * @param contentKey The content holding the item.
	 * @param itemPath The path of the item.
	 * @return The future result, available once the download has been started (or found unnecessary or impossible).
	 */
	public FuturePrefetch start(ContentKey contentKey, String itemPath)
	{
		ItemRef sessionKey = _sessionKey(contentKey, itemPath);
		ItemRef item = new ItemRef(contentKey, itemPath);
		long now = _currentTimeMillisGenerator.getAsLong();
		DownloadSession session;
		DownloadSession replaced;
		PrefetchStats active = null;
		synchronized (this)
		{
			DownloadSession existing = _sessions.get(sessionKey);
			if ((null != existing) && !existing.isTerminal())
			{
				session = null;
				replaced = null;
				active = existing.snapshot(now);
			}
			else
			{
				session = new DownloadSession(item, _logger.logStart("Prefetching " + item), now);
				replaced = existing;
				_sessions.put(sessionKey, session);
			}
		}
		
		FuturePrefetch result;
		if (null != active)
		{
			_logger.logVerbose("Prefetch of " + item + " already in progress");
			result = FuturePrefetch.completed(PrefetchResult.alreadyActive(active));
		}
		else
		{
			if (null != replaced)
			{
				_closeMonitor(replaced.detach());
			}
			int peerCount = _store.currentPeerCount();
			session.log().logVerbose("Active connections: " + peerCount);
			_emit(session.item(), session.resolving(peerCount));
			
			result = new FuturePrefetch();
			FuturePrefetch finalResult = result;
			FutureItemRange range = _store.resolveItem(item);
			range.registerOnComplete(() -> _onResolved(sessionKey, session, range, peerCount, finalResult));
		}
		return result;
	}

	/**
	 * Reads the current state of an item's session.
	 * 
	 * @param contentKey The content holding the item.
	 * @param itemPath The path of the item.
	 * @return The snapshot, or the UNKNOWN snapshot if there is no session (never null).
	 */
	public PrefetchStats getStats(ContentKey contentKey, String itemPath)
	{
		DownloadSession session;
		synchronized (this)
		{
			session = _sessions.get(_sessionKey(contentKey, itemPath));
		}
		return (null != session)
				? session.snapshot(_currentTimeMillisGenerator.getAsLong())
				: PrefetchStats.unknown()
		;
	}

	/**
	 * Forgets an item's session and closes its monitor.  This does NOT cancel a range download already requested from
	 * the store.
	 * 
	 * @param contentKey The content holding the item.
	 * @param itemPath The path of the item.
	 * @return True if there was a session.
	 */
	public boolean removeStats(ContentKey contentKey, String itemPath)
	{
		DownloadSession session;
		synchronized (this)
		{
			session = _sessions.remove(_sessionKey(contentKey, itemPath));
		}
		if (null != session)
		{
			_closeMonitor(session.detach());
		}
		return (null != session);
	}

	/**
	 * Starts prefetching the items which follow the current one in a channel's ordering, so they are local by the time
	 * the user gets to them.
	 * 
	 * @param contentKey The channel holding the items.
	 * @param orderedItems The item paths, in playback order.
	 * @param currentItem The item being watched (if not found, prefetching starts from the first item).
	 * @param count The maximum number of items to prefetch.
	 * @return The number of prefetches started (items which were already being prefetched aren't counted).
	 */
	public int prefetchNext(ContentKey contentKey, List<String> orderedItems, String currentItem, int count)
	{
		String currentId = ItemPaths.normalize(currentItem);
		int currentIndex = -1;
		for (int i = 0; (-1 == currentIndex) && (i < orderedItems.size()); ++i)
		{
			if (ItemPaths.normalize(orderedItems.get(i)).equals(currentId))
			{
				currentIndex = i;
			}
		}
		int started = 0;
		int end = Math.min(orderedItems.size(), currentIndex + 1 + count);
		for (int i = currentIndex + 1; i < end; ++i)
		{
			FuturePrefetch future = start(contentKey, orderedItems.get(i));
			if (!future.isDone() || !future.get().alreadyActive())
			{
				started += 1;
			}
		}
		return started;
	}


	private void _onResolved(ItemRef sessionKey, DownloadSession session, FutureItemRange future, int peerCount, FuturePrefetch result)
	{
		ILogger log = session.log();
		ItemRef item = session.item();
		BlockRange range;
		try
		{
			range = future.get();
		}
		catch (ContentLookupException e)
		{
			_failSession(session, e.getMessage());
			result.success(PrefetchResult.failure(e.getMessage()));
			return;
		}
		
		long totalBlocks = range.totalBlocks();
		long initialBlocks = _store.localBlockCount(item.contentKey(), range);
		log.logOperation("Initial: " + initialBlocks + "/" + totalBlocks + " blocks, " + MiscHelpers.humanReadableBytes(range.totalBytes()));
		long now = _currentTimeMillisGenerator.getAsLong();
		if (initialBlocks >= totalBlocks)
		{
			PrefetchStats stats = session.completeFromCache(range, now);
			_registerSeed(session, range);
			_emit(session.item(), stats);
			log.logFinish("Already fully cached");
			_scheduleRemoval(sessionKey, session);
			result.success(PrefetchResult.cached(totalBlocks, range.totalBytes(), peerCount));
		}
		else
		{
			IBlockMonitor monitor = _store.monitor(item.contentKey(), item.itemPath());
			PrefetchStats stats = session.downloading(range, initialBlocks, monitor, now);
			if (null != stats)
			{
				monitor.setUpdateListener(() -> _onTick(session, monitor));
				_emit(session.item(), stats);
				FutureDownload download = _store.downloadRange(item.contentKey(), range);
				download.registerOnComplete(() -> _onDownloadDone(sessionKey, session, download));
				result.success(PrefetchResult.started(totalBlocks, range.totalBytes(), peerCount, initialBlocks));
			}
			else
			{
				// Removed while we were resolving.
				monitor.close();
				log.logFinish("Session removed before download started");
				result.success(PrefetchResult.failure("Prefetch session was removed"));
			}
		}
	}

	private void _onTick(DownloadSession session, IBlockMonitor monitor)
	{
		if (session.enqueueTick(monitor.downloadStats()))
		{
			DownloadSession.TickOutcome outcome = session.applyNextTick(_store.currentPeerCount(), monitor.downloadSpeed(), _currentTimeMillisGenerator.getAsLong());
			while (null != outcome)
			{
				PrefetchStats stats = outcome.stats();
				if (outcome.shouldLogMilestone())
				{
					session.log().logOperation("Progress: " + stats.progress() + "% (" + stats.downloadedBlocks() + "/" + stats.totalBlocks() + " blocks, " + MiscHelpers.humanReadableSpeed(stats.speedBytesPerSecond()) + ")");
				}
				if (outcome.shouldRegisterSeed())
				{
					session.log().logOperation("100% complete");
					_registerSeed(session, session.range());
				}
				_emit(session.item(), stats);
				outcome = session.applyNextTick(_store.currentPeerCount(), monitor.downloadSpeed(), _currentTimeMillisGenerator.getAsLong());
			}
		}
	}

	private void _onDownloadDone(ItemRef sessionKey, DownloadSession session, FutureDownload download)
	{
		try
		{
			download.get();
			session.downloadFinished(_currentTimeMillisGenerator.getAsLong());
			session.log().logFinish("Download complete");
			_emit(session.item(), session.snapshot(_currentTimeMillisGenerator.getAsLong()));
			_scheduleRemoval(sessionKey, session);
		}
		catch (TransferException e)
		{
			if (session.isTerminal())
			{
				// The monitor already saw every block arrive so the item is local.
				session.log().logVerbose("Ignoring transfer failure after completion: " + e.getMessage());
				_scheduleRemoval(sessionKey, session);
			}
			else
			{
				_failSession(session, e.getMessage());
			}
		}
	}

	private void _failSession(DownloadSession session, String message)
	{
		long now = _currentTimeMillisGenerator.getAsLong();
		_closeMonitor(session.fail(message, now));
		session.log().logError("Prefetch failed: " + message);
		session.log().logFinish("Prefetch of " + session.item() + " failed");
		_emit(session.item(), session.snapshot(now));
	}

	private void _registerSeed(DownloadSession session, BlockRange range)
	{
		ItemRef item = session.item();
		try
		{
			_seedingCache.addSeed(item.contentKey(), item.itemPath(), SeedReason.WATCHED, range.totalBlocks(), range.totalBytes());
		}
		catch (PersistenceException e)
		{
			// The seed is still active in memory, we just couldn't save it.
			session.log().logError("Failed to persist seed for " + item + ": " + e.getLocalizedMessage());
		}
	}

	private void _scheduleRemoval(ItemRef sessionKey, DownloadSession session)
	{
		_delayedRunner.runAfterDelay(() -> {
			boolean didRemove;
			synchronized (this)
			{
				// The session may have been replaced by a new start() since this was scheduled.
				didRemove = _sessions.remove(sessionKey, session);
			}
			if (didRemove)
			{
				_closeMonitor(session.detach());
				_logger.logVerbose("Cleaned up prefetch session for " + session.item());
			}
		}, _graceMillis);
	}

	private void _emit(ItemRef item, PrefetchStats stats)
	{
		List<IStatsListener> listeners;
		synchronized (this)
		{
			listeners = List.copyOf(_listeners);
		}
		for (IStatsListener listener : listeners)
		{
			_callbackDispatcher.accept(() -> listener.statsUpdated(item, stats));
		}
	}

	private static void _closeMonitor(IBlockMonitor monitor)
	{
		if (null != monitor)
		{
			monitor.close();
		}
	}

	private static ItemRef _sessionKey(ContentKey contentKey, String itemPath)
	{
		return new ItemRef(contentKey, ItemPaths.normalize(itemPath));
	}
}
