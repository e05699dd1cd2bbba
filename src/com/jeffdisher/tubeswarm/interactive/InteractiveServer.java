package com.jeffdisher.tubeswarm.interactive;

import java.io.IOException;
import java.net.InetSocketAddress;

import com.jeffdisher.tubeswarm.EnvVars;
import com.jeffdisher.tubeswarm.TubeswarmCore;
import com.jeffdisher.tubeswarm.logic.ILogger;


/**
 * The local REST interface over a running core, bound to the loopback interface.
 */
public class InteractiveServer
{
	public static final String LOOPBACK_ADDRESS = "127.0.0.1";
	public static final int DEFAULT_PORT = 8000;

	/**
	 * Creates and starts the server.
	 * 
	 * @param core The core to expose.
	 * @param logger The logger.
	 * @param port The port to listen on (0 for an ephemeral port).
	 * @return The running server.
	 * @throws IOException The server couldn't bind its port.
	 */
	public static InteractiveServer start(TubeswarmCore core, ILogger logger, int port) throws IOException
	{
		RestServer server = new RestServer(new InetSocketAddress(LOOPBACK_ADDRESS, port));
		ValidatedEntryPoints validated = new ValidatedEntryPoints(server, logger);
		
		// Public feed.
		validated.addGetHandler("/feed", new GET_Feed(core.feed()));
		validated.addGetHandler("/feed/stats", new GET_FeedStats(core.feed()));
		validated.addPostRawHandler("/feed/submit/{KEY}", new POST_Raw_SubmitFeed(core.feed()));
		validated.addPostRawHandler("/feed/hide/{KEY}", new POST_Raw_HideFeed(core.feed()));
		validated.addPostRawHandler("/feed/refresh", new POST_Raw_RefreshFeed(core.feed()));
		
		// Seeding.
		validated.addGetHandler("/seeding/status", new GET_SeedingStatus(core.seeding()));
		validated.addGetHandler("/seeding/storage", new GET_StorageStats(core.seeding()));
		validated.addPostRawHandler("/seeding/clear", new POST_Raw_ClearCache(core.seeding()));
		validated.addPostRawHandler("/seeding/maxStorage/{double}", new POST_Raw_MaxStorage(core.seeding()));
		validated.addPostFormHandler("/seeding/prefs", new POST_Prefs(core.seeding()));
		validated.addPostRawHandler("/seeding/pin/{KEY}", new POST_Raw_PinChannel(core.seeding()));
		validated.addDeleteHandler("/seeding/pin/{KEY}", new DELETE_PinChannel(core.seeding()));
		validated.addDeleteHandler("/seeding/seed/{KEY}/{path}", new DELETE_Seed(core.seeding()));
		
		// Prefetch.
		validated.addPostRawHandler("/prefetch/{KEY}/{path}", new POST_Raw_Prefetch(core.prefetch()));
		validated.addGetHandler("/prefetch/{KEY}/{path}", new GET_PrefetchStats(core.prefetch()));
		validated.addDeleteHandler("/prefetch/{KEY}/{path}", new DELETE_PrefetchStats(core.prefetch()));
		
		server.start();
		logger.logOperation("Interactive server listening on " + LOOPBACK_ADDRESS + ":" + server.getPort());
		return new InteractiveServer(server, logger);
	}

	/**
	 * Starts the server on the port named by the environment (see EnvVars).
	 * 
	 * @param core The core to expose.
	 * @param logger The logger.
	 * @return The running server.
	 * @throws IOException The server couldn't bind its port.
	 */
	public static InteractiveServer startFromEnvironment(TubeswarmCore core, ILogger logger) throws IOException
	{
		return start(core, logger, portFromEnvironment(System.getenv(EnvVars.ENV_VAR_TUBESWARM_PORT)));
	}

	/**
	 * Reads the port from the environment, falling back to DEFAULT_PORT.
	 * 
	 * @param value The value of the port environment variable (can be null).
	 * @return The port.
	 */
	public static int portFromEnvironment(String value)
	{
		int port = DEFAULT_PORT;
		if (null != value)
		{
			try
			{
				port = Integer.parseInt(value);
			}
			catch (NumberFormatException e)
			{
				throw new IllegalArgumentException("Invalid port: \"" + value + "\"", e);
			}
		}
		return port;
	}


	private final RestServer _server;
	private final ILogger _logger;

	private InteractiveServer(RestServer server, ILogger logger)
	{
		_server = server;
		_logger = logger;
	}

	public int getPort()
	{
		return _server.getPort();
	}

	public void stop()
	{
		_server.stop();
		_logger.logOperation("Interactive server stopped");
	}
}
