package com.jeffdisher.tubeswarm.prefetch;

import java.util.LinkedList;
import java.util.Queue;

import com.jeffdisher.tubeswarm.logic.ILogger;
import com.jeffdisher.tubeswarm.types.BlockRange;
import com.jeffdisher.tubeswarm.types.ItemRef;
import com.jeffdisher.tubeswarm.types.PrefetchStatus;
import com.jeffdisher.tubeswarm.utils.Assert;


/**
 * The mutable state of one prefetch, owned by the PrefetchTracker.
 * All state is guarded by the instance monitor.  Monitor ticks are queued and drained by whichever thread finds the
 * queue idle, so they are applied in arrival order without holding the lock while the tracker reacts to them.
 */
public class DownloadSession
{
	/**
	 * What the tracker must do after applying one tick.
	 */
	public static record TickOutcome(PrefetchStats stats, boolean shouldRegisterSeed, boolean shouldLogMilestone)
	{
	}

	private final ItemRef _item;
	private final ILogger _log;
	private final long _startedMillis;
	private PrefetchStatus _status;
	private int _peerCount;
	private BlockRange _range;
	private long _initialBlocks;
	private long _monitorBlocks;
	private double _speed;
	private String _error;
	private long _finishedMillis;
	// The last 10% boundary we logged (progress / 10).
	private int _lastLoggedDecile;
	private boolean _isSeedRegistered;
	private IBlockMonitor _monitor;
	private boolean _isDetached;

	private final Queue<IBlockMonitor.Stats> _pendingTicks;
	private boolean _isDraining;

	public DownloadSession(ItemRef item, ILogger log, long startedMillis)
	{
		_item = item;
		_log = log;
		_startedMillis = startedMillis;
		_status = PrefetchStatus.CONNECTING;
		_pendingTicks = new LinkedList<>();
	}

	/**
	 * @return The item, with the path as the caller gave it (not normalized).
	 */
	public ItemRef item()
	{
		return _item;
	}

	/**
	 * @return The session's nested logger.
	 */
	public ILogger log()
	{
		return _log;
	}

	public synchronized boolean isTerminal()
	{
		return _status.isTerminal();
	}

	public synchronized BlockRange range()
	{
		return _range;
	}

	/**
	 * Records the peer count and moves from CONNECTING to RESOLVING.
	 */
	public synchronized PrefetchStats resolving(int peerCount)
	{
		Assert.assertTrue(PrefetchStatus.CONNECTING == _status);
		_peerCount = peerCount;
		_status = PrefetchStatus.RESOLVING;
		return _snapshot(_startedMillis);
	}

	/**
	 * Moves from RESOLVING directly to COMPLETE since the whole range is already local.
	 */
	public synchronized PrefetchStats completeFromCache(BlockRange range, long nowMillis)
	{
		Assert.assertTrue(PrefetchStatus.RESOLVING == _status);
		_range = range;
		_initialBlocks = range.totalBlocks();
		_status = PrefetchStatus.COMPLETE;
		_isSeedRegistered = true;
		_finishedMillis = nowMillis;
		return _snapshot(nowMillis);
	}

	/**
	 * Moves from RESOLVING to DOWNLOADING, taking ownership of the monitor.
	 * 
	 * @return The new snapshot or null if the session was detached while resolving (the caller must then close the
	 * monitor since the session didn't take it).
	 */
	public synchronized PrefetchStats downloading(BlockRange range, long initialBlocks, IBlockMonitor monitor, long nowMillis)
	{
		PrefetchStats snapshot = null;
		if (!_isDetached)
		{
			Assert.assertTrue(PrefetchStatus.RESOLVING == _status);
			_range = range;
			_initialBlocks = initialBlocks;
			_monitor = monitor;
			_lastLoggedDecile = _progress() / 10;
			_status = PrefetchStatus.DOWNLOADING;
			snapshot = _snapshot(nowMillis);
		}
		return snapshot;
	}

	/**
	 * Adds a tick to the queue.
	 * 
	 * @return True if the caller must now drain the queue (nobody else is draining it).
	 */
	public synchronized boolean enqueueTick(IBlockMonitor.Stats tick)
	{
		_pendingTicks.add(tick);
		boolean shouldDrain = !_isDraining;
		_isDraining = true;
		return shouldDrain;
	}

	/**
	 * Applies the next queued tick.  Only the thread which was told to drain can call this.
	 * 
	 * @param fallbackPeerCount The peer count to use if the monitor doesn't know its peers.
	 * @param speed The monitor's current speed.
	 * @param nowMillis The current time.
	 * @return The outcome of the tick or null if the queue is now empty (the caller stops draining).
	 */
	public synchronized TickOutcome applyNextTick(int fallbackPeerCount, double speed, long nowMillis)
	{
		Assert.assertTrue(_isDraining);
		IBlockMonitor.Stats tick = _pendingTicks.poll();
		TickOutcome outcome = null;
		if (null == tick)
		{
			_isDraining = false;
		}
		else if (PrefetchStatus.ERROR == _status)
		{
			// The download already failed so late ticks are ignored but we still need to report something.
			outcome = new TickOutcome(_snapshot(nowMillis), false, false);
		}
		else
		{
			_monitorBlocks = tick.blocks();
			_peerCount = (tick.peers() > 0) ? tick.peers() : fallbackPeerCount;
			_speed = speed;
			boolean shouldRegisterSeed = false;
			if (!_isSeedRegistered && _isAllLocal())
			{
				_isSeedRegistered = true;
				shouldRegisterSeed = true;
				_markComplete(nowMillis);
			}
			int progress = _progress();
			boolean shouldLogMilestone = false;
			if ((progress / 10) > _lastLoggedDecile)
			{
				_lastLoggedDecile = progress / 10;
				shouldLogMilestone = true;
			}
			outcome = new TickOutcome(_snapshot(nowMillis), shouldRegisterSeed, shouldLogMilestone);
		}
		return outcome;
	}

	/**
	 * Called when the range download succeeds.
	 * 
	 * @return True if this call moved the session to COMPLETE.
	 */
	public synchronized boolean downloadFinished(long nowMillis)
	{
		boolean didChange = false;
		if (PrefetchStatus.DOWNLOADING == _status)
		{
			_markComplete(nowMillis);
			didChange = true;
		}
		return didChange;
	}

	/**
	 * Moves the session to ERROR and detaches its monitor.  A session which has already finished (COMPLETE or ERROR)
	 * is left as it is.
	 * 
	 * @return The monitor the caller must now close (null if there wasn't one or the session had already finished).
	 */
	public synchronized IBlockMonitor fail(String error, long nowMillis)
	{
		IBlockMonitor monitor = null;
		if (!_status.isTerminal())
		{
			_status = PrefetchStatus.ERROR;
			_error = error;
			_finishedMillis = nowMillis;
			monitor = _takeMonitor();
		}
		return monitor;
	}

	/**
	 * Marks the session as forgotten by the tracker.
	 * 
	 * @return The monitor the caller must now close (null if there wasn't one).
	 */
	public synchronized IBlockMonitor detach()
	{
		_isDetached = true;
		return _takeMonitor();
	}

	public synchronized PrefetchStats snapshot(long nowMillis)
	{
		return _snapshot(nowMillis);
	}


	private IBlockMonitor _takeMonitor()
	{
		IBlockMonitor monitor = _monitor;
		_monitor = null;
		return monitor;
	}

	private void _markComplete(long nowMillis)
	{
		if (PrefetchStatus.COMPLETE != _status)
		{
			_status = PrefetchStatus.COMPLETE;
			_finishedMillis = nowMillis;
		}
	}

	private long _downloadedBlocks()
	{
		long total = (null != _range) ? _range.totalBlocks() : 0L;
		return Math.min(total, _initialBlocks + _monitorBlocks);
	}

	private boolean _isAllLocal()
	{
		return (null != _range) && ((_initialBlocks + _monitorBlocks) >= _range.totalBlocks());
	}

	private int _progress()
	{
		long total = (null != _range) ? _range.totalBlocks() : 0L;
		return (total > 0L)
				? (int) Math.round((100.0 * _downloadedBlocks()) / total)
				: 0
		;
	}

	private PrefetchStats _snapshot(long nowMillis)
	{
		long totalBlocks = (null != _range) ? _range.totalBlocks() : 0L;
		long totalBytes = (null != _range) ? _range.totalBytes() : 0L;
		long downloadedBlocks = _downloadedBlocks();
		long downloadedBytes = (totalBlocks > 0L)
				? Math.round(((double) downloadedBlocks / totalBlocks) * totalBytes)
				: 0L
		;
		boolean isComplete = (PrefetchStatus.COMPLETE == _status) || ((null != _range) && (totalBlocks > 0L) && _isAllLocal());
		long endMillis = _status.isTerminal() ? _finishedMillis : nowMillis;
		return new PrefetchStats(_status
				, _progress()
				, totalBlocks
				, downloadedBlocks
				, totalBytes
				, downloadedBytes
				, _peerCount
				, _speed
				, endMillis - _startedMillis
				, isComplete
				, _error
		);
	}
}
