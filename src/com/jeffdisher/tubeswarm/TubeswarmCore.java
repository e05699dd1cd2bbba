package com.jeffdisher.tubeswarm;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

import com.jeffdisher.tubeswarm.feed.IPeerSwarm;
import com.jeffdisher.tubeswarm.feed.PublicFeedDirectory;
import com.jeffdisher.tubeswarm.logic.CallbackDispatcher;
import com.jeffdisher.tubeswarm.logic.IDelayedRunner;
import com.jeffdisher.tubeswarm.logic.ILogger;
import com.jeffdisher.tubeswarm.logic.IMetaStore;
import com.jeffdisher.tubeswarm.logic.RealMetaStore;
import com.jeffdisher.tubeswarm.logic.ScheduledDelayedRunner;
import com.jeffdisher.tubeswarm.logic.StandardLogger;
import com.jeffdisher.tubeswarm.prefetch.IContentStore;
import com.jeffdisher.tubeswarm.prefetch.PrefetchTracker;
import com.jeffdisher.tubeswarm.seeding.SeedingCache;
import com.jeffdisher.tubeswarm.types.PersistenceException;


/**
 * The assembled discovery core:  the public feed directory, the seeding cache, and the prefetch tracker, sharing one
 * metadata store, logger, and callback dispatcher.
 * The host supplies the peer transport and the content store.
 */
public class TubeswarmCore
{
	private static final String DEFAULT_STORAGE_DIRECTORY = ".tubeswarm";

	/**
	 * Builds the core from the environment (see EnvVars) with the standard on-disk store, console logger, and
	 * background threads.  These threads are stopped by shutdown().
	 * 
	 * @param swarm The peer transport.
	 * @param contentStore The content store.
	 * @param out The stream for normal log output.
	 * @param err The stream for error log output.
	 * @return The started core.
	 * @throws IOException The storage directory couldn't be created.
	 * @throws PersistenceException The stored state couldn't be read.
	 */
	public static TubeswarmCore startFromEnvironment(IPeerSwarm swarm, IContentStore contentStore, PrintStream out, PrintStream err) throws IOException, PersistenceException
	{
		String storagePath = System.getenv(EnvVars.ENV_VAR_TUBESWARM_STORAGE);
		File storageDirectory = (null != storagePath)
				? new File(storagePath)
				: new File(System.getProperty("user.home"), DEFAULT_STORAGE_DIRECTORY)
		;
		boolean verbose = (null != System.getenv(EnvVars.ENV_VAR_TUBESWARM_VERBOSE));
		RealMetaStore store = new RealMetaStore(storageDirectory);
		store.createDirectory();
		StandardLogger logger = StandardLogger.topLogger(out, err, verbose);
		CallbackDispatcher dispatcher = new CallbackDispatcher();
		dispatcher.start();
		ScheduledDelayedRunner delayedRunner = new ScheduledDelayedRunner();
		try
		{
			return start(swarm, contentStore, store, logger, () -> System.currentTimeMillis(), delayedRunner, dispatcher, () -> {
				delayedRunner.shutdown();
				dispatcher.shutdown();
			});
		}
		catch (PersistenceException e)
		{
			delayedRunner.shutdown();
			dispatcher.shutdown();
			throw e;
		}
	}

	/**
	 * Builds and starts the core from explicit collaborators.  The seeding cache is loaded before the feed starts
	 * listening to peers.
	 * 
	 * @param swarm The peer transport.
	 * @param contentStore The content store.
	 * @param metaStore The metadata store.
	 * @param logger The top-level logger.
	 * @param currentTimeMillisGenerator The clock.
	 * @param delayedRunner Runs deferred work.
	 * @param callbackDispatcher Runs listener notifications.
	 * @param onShutdown Run at the end of shutdown() to release anything the caller created for the core (can be null).
	 * @return The started core.
	 * @throws PersistenceException The stored state couldn't be read.
	 */
	public static TubeswarmCore start(IPeerSwarm swarm
			, IContentStore contentStore
			, IMetaStore metaStore
			, ILogger logger
			, LongSupplier currentTimeMillisGenerator
			, IDelayedRunner delayedRunner
			, Consumer<Runnable> callbackDispatcher
			, Runnable onShutdown
	) throws PersistenceException
	{
		SeedingCache seedingCache = new SeedingCache(metaStore, logger, currentTimeMillisGenerator);
		seedingCache.init();
		PrefetchTracker prefetchTracker = new PrefetchTracker(contentStore, seedingCache, logger, currentTimeMillisGenerator, delayedRunner, callbackDispatcher);
		PublicFeedDirectory feed = new PublicFeedDirectory(swarm, metaStore, logger, currentTimeMillisGenerator, delayedRunner, callbackDispatcher);
		feed.start();
		return new TubeswarmCore(logger, feed, seedingCache, prefetchTracker, onShutdown);
	}


	private final ILogger _logger;
	private final PublicFeedDirectory _feed;
	private final SeedingCache _seedingCache;
	private final PrefetchTracker _prefetchTracker;
	private final Runnable _onShutdown;

	private TubeswarmCore(ILogger logger, PublicFeedDirectory feed, SeedingCache seedingCache, PrefetchTracker prefetchTracker, Runnable onShutdown)
	{
		_logger = logger;
		_feed = feed;
		_seedingCache = seedingCache;
		_prefetchTracker = prefetchTracker;
		_onShutdown = onShutdown;
	}

	public PublicFeedDirectory feed()
	{
		return _feed;
	}

	public SeedingCache seeding()
	{
		return _seedingCache;
	}

	public PrefetchTracker prefetch()
	{
		return _prefetchTracker;
	}

	/**
	 * Detaches from the swarm and stops any background threads created for the core.
	 */
	public void shutdown()
	{
		_feed.stop();
		if (null != _onShutdown)
		{
			_onShutdown.run();
		}
		_logger.logOperation("Shutdown complete");
	}
}
