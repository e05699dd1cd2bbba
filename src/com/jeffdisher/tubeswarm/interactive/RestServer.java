package com.jeffdisher.tubeswarm.interactive;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import com.jeffdisher.tubeswarm.types.ContentKey;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;


/**
 * A small embedded Jetty server which routes requests by method and path pattern.
 * Patterns are "/"-separated, where a component can be a literal or one of the variable types:
 * -"{KEY}" - a content key (ContentKey, 400 if invalid)
 * -"{string}" - any single component (String)
 * -"{double}" - a number (Double, 400 if invalid)
 * -"{path}" - the rest of the path, including any "/" (String, only allowed as the last component)
 * The parsed variables are passed to the handler, in order.
 */
public class RestServer
{
	public static final String VAR_KEY = "{KEY}";
	public static final String VAR_STRING = "{string}";
	public static final String VAR_DOUBLE = "{double}";
	public static final String VAR_PATH = "{path}";

	private final Server _server;
	private final ServerConnector _connector;
	private final Map<String, List<Route>> _routesByMethod;

	/**
	 * Creates the server, not yet started.
	 * 
	 * @param interfaceToBind The interface and port to listen on (port 0 picks an ephemeral port).
	 */
	public RestServer(InetSocketAddress interfaceToBind)
	{
		_server = new Server();
		_connector = new ServerConnector(_server);
		_connector.setHost(interfaceToBind.getHostString());
		_connector.setPort(interfaceToBind.getPort());
		_server.addConnector(_connector);
		ServletContextHandler context = new ServletContextHandler();
		context.setContextPath("/");
		context.addServlet(new ServletHolder(new DispatchingServlet()), "/*");
		_server.setHandler(context);
		_routesByMethod = new HashMap<>();
	}

	/**
	 * Adds a handler for the given method and path pattern.  Must be called before start().
	 * 
	 * @param method The HTTP method ("GET", "POST", "DELETE").
	 * @param pattern The path pattern.
	 * @param handler The handler.
	 */
	public synchronized void addHandler(String method, String pattern, IHandler handler)
	{
		String[] components = _split(pattern);
		for (int i = 0; i < components.length - 1; ++i)
		{
			if (VAR_PATH.equals(components[i]))
			{
				throw new IllegalArgumentException("\"" + VAR_PATH + "\" must be the last component: " + pattern);
			}
		}
		_routesByMethod.computeIfAbsent(method, (String ignored) -> new ArrayList<>()).add(new Route(components, handler));
	}

	/**
	 * Starts listening.
	 * 
	 * @throws IOException The server couldn't bind its port.
	 */
	public void start() throws IOException
	{
		try
		{
			_server.start();
		}
		catch (IOException e)
		{
			throw e;
		}
		catch (Exception e)
		{
			throw new IOException("Server failed to start", e);
		}
	}

	/**
	 * @return The port the server is listening on (only valid once started).
	 */
	public int getPort()
	{
		return _connector.getLocalPort();
	}

	/**
	 * Stops the server and waits for it to finish.
	 */
	public void stop()
	{
		try
		{
			_server.stop();
			_server.join();
		}
		catch (InterruptedException e)
		{
			// We don't use interruption in this system.
			throw new IllegalStateException(e);
		}
		catch (Exception e)
		{
			throw new IllegalStateException("Server failed to stop", e);
		}
	}


	private synchronized List<Route> _routesFor(String method)
	{
		List<Route> routes = _routesByMethod.get(method);
		return (null != routes) ? List.copyOf(routes) : List.of();
	}

	private static String[] _split(String path)
	{
		String trimmed = path.startsWith("/") ? path.substring(1) : path;
		return trimmed.isEmpty() ? new String[0] : trimmed.split("/", -1);
	}

	// Returns null if the path doesn't match the route's shape, or BAD_VARIABLES if it matches but a variable is invalid.
	private static Object[] _match(String[] pattern, String[] path)
	{
		List<Object> variables = new ArrayList<>();
		boolean matches = true;
		boolean isBad = false;
		int i = 0;
		for (; matches && (i < pattern.length); ++i)
		{
			String component = pattern[i];
			if (VAR_PATH.equals(component))
			{
				if (i < path.length)
				{
					variables.add(String.join("/", Arrays.copyOfRange(path, i, path.length)));
					i = path.length;
				}
				else
				{
					matches = false;
				}
				break;
			}
			else if (i >= path.length)
			{
				matches = false;
			}
			else if (VAR_KEY.equals(component))
			{
				ContentKey key = ContentKey.fromHex(path[i]);
				isBad |= (null == key);
				variables.add(key);
			}
			else if (VAR_STRING.equals(component))
			{
				variables.add(path[i]);
			}
			else if (VAR_DOUBLE.equals(component))
			{
				Double value = null;
				try
				{
					value = Double.valueOf(path[i]);
				}
				catch (NumberFormatException e)
				{
					isBad = true;
				}
				variables.add(value);
			}
			else
			{
				matches = component.equals(path[i]);
			}
		}
		if (matches && (i != path.length))
		{
			matches = false;
		}
		Object[] result = null;
		if (matches)
		{
			result = isBad ? BAD_VARIABLES : variables.toArray();
		}
		return result;
	}

	private static final Object[] BAD_VARIABLES = new Object[0];


	/**
	 * The handler for one route.
	 */
	public interface IHandler
	{
		/**
		 * @param request The request.
		 * @param response The response.
		 * @param variables The parsed path variables, in pattern order.
		 * @throws IOException There was a problem writing the response.
		 */
		void handle(HttpServletRequest request, HttpServletResponse response, Object[] variables) throws IOException;
	}

	private static record Route(String[] pattern, IHandler handler)
	{
	}

	private class DispatchingServlet extends HttpServlet
	{
		private static final long serialVersionUID = 1L;

		@Override
		protected void service(HttpServletRequest request, HttpServletResponse response) throws IOException
		{
			String pathInfo = request.getPathInfo();
			String[] path = _split((null != pathInfo) ? pathInfo : "/");
			boolean handled = false;
			for (Route route : _routesFor(request.getMethod()))
			{
				Object[] variables = _match(route.pattern(), path);
				if (BAD_VARIABLES == variables)
				{
					response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
					handled = true;
					break;
				}
				else if (null != variables)
				{
					route.handler().handle(request, response, variables);
					handled = true;
					break;
				}
			}
			if (!handled)
			{
				response.setStatus(HttpServletResponse.SC_NOT_FOUND);
			}
		}
	}
}
