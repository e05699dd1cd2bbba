package com.jeffdisher.tubeswarm.interactive;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import com.jeffdisher.tubeswarm.logic.ILogger;
import com.jeffdisher.tubeswarm.types.PersistenceException;
import com.jeffdisher.tubeswarm.types.TubeswarmException;
import com.jeffdisher.tubeswarm.types.UsageException;
import com.jeffdisher.tubeswarm.utils.Assert;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * This class exists only as a layer above our REST entry-points to handle the common validation logic we want to apply
 * to all of them.
 * It checks the IP address of the remote client and also applies our standard responses to various kinds of
 * exceptions which may occur during an invocation.
 */
public class ValidatedEntryPoints
{
	private static final String LOCAL_IP = "127.0.0.1";

	private final RestServer _server;
	private final ILogger _logger;

	/**
	 * Creates the entry-point wrapper over top of the given server.
	 * 
	 * @param server The server these entry-points should be built on.
	 * @param logger The logger for failed requests.
	 */
	public ValidatedEntryPoints(RestServer server, ILogger logger)
	{
		_server = server;
		_logger = logger;
	}

	public void addGetHandler(String path, GET handler)
	{
		_server.addHandler("GET", path, (HttpServletRequest request, HttpServletResponse response, Object[] variables) -> {
			_commonChecks(request, response, () -> handler.handle(request, response, variables));
		});
	}

	public void addPostRawHandler(String path, POST_Raw handler)
	{
		_server.addHandler("POST", path, (HttpServletRequest request, HttpServletResponse response, Object[] variables) -> {
			_commonChecks(request, response, () -> handler.handle(request, response, variables));
		});
	}

	/**
	 * Installs a validated form POST handler.  Only the form variables with a single value are passed to the handler.
	 * 
	 * @param path The path to bind.
	 * @param handler The handler to install.
	 */
	public void addPostFormHandler(String path, POST_Form handler)
	{
		_server.addHandler("POST", path, (HttpServletRequest request, HttpServletResponse response, Object[] variables) -> {
			_commonChecks(request, response, () -> {
				Map<String, String> formVariables = new HashMap<>();
				for (Map.Entry<String, String[]> elt : request.getParameterMap().entrySet())
				{
					if (1 == elt.getValue().length)
					{
						formVariables.put(elt.getKey(), elt.getValue()[0]);
					}
				}
				handler.handle(request, response, variables, formVariables);
			});
		});
	}

	public void addDeleteHandler(String path, DELETE handler)
	{
		_server.addHandler("DELETE", path, (HttpServletRequest request, HttpServletResponse response, Object[] variables) -> {
			_commonChecks(request, response, () -> handler.handle(request, response, variables));
		});
	}


	private void _commonChecks(HttpServletRequest request, HttpServletResponse response, ThrowingRunnable task) throws IOException
	{
		if (LOCAL_IP.equals(request.getRemoteAddr()))
		{
			try
			{
				task.run();
			}
			catch (UsageException e)
			{
				// Usage exceptions are thrown for things like missing or invalid parameters.
				response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
			}
			catch (PersistenceException e)
			{
				// The change was applied but not saved, which the caller needs to know about.
				_logger.logError("Request " + request.getRequestURI() + " failed to persist: " + e.getLocalizedMessage());
				response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
			}
			catch (TubeswarmException e)
			{
				_logger.logError("Request " + request.getRequestURI() + " failed: " + e.getLocalizedMessage());
				response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
			}
			catch (IOException e)
			{
				// This could be an issue interacting with the parameters so we throw it back.
				throw e;
			}
			catch (Throwable t)
			{
				// This case is unknown and we would want to identify it and commute it into an error we can handle.
				throw Assert.unexpected(new Exception(t));
			}
		}
		else
		{
			response.setStatus(HttpServletResponse.SC_FORBIDDEN);
		}
	}


	/**
	 * Validated GET handler.
	 */
	public interface GET
	{
		/**
		 * Handles the call, after validation.
		 * 
		 * @param request The request.
		 * @param response The response.
		 * @param path The parsed path variables.
		 * @throws Throwable If something went wrong.
		 */
		void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable;
	}

	/**
	 * Validated raw POST handler.
	 */
	public interface POST_Raw
	{
		void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable;
	}

	/**
	 * Validated form POST handler.
	 */
	public interface POST_Form
	{
		/**
		 * Handles the call, after validation.
		 * 
		 * @param request The request.
		 * @param response The response.
		 * @param path The parsed path variables.
		 * @param formVariables The single-valued form variables.
		 * @throws Throwable If something went wrong.
		 */
		void handle(HttpServletRequest request, HttpServletResponse response, Object[] path, Map<String, String> formVariables) throws Throwable;
	}

	/**
	 * Validated DELETE handler.
	 */
	public interface DELETE
	{
		void handle(HttpServletRequest request, HttpServletResponse response, Object[] path) throws Throwable;
	}

	private interface ThrowingRunnable
	{
		void run() throws Throwable;
	}
}
