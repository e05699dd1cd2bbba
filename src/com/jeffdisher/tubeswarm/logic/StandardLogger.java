package com.jeffdisher.tubeswarm.logic;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicInteger;


/**
 * The console logger.  Each nested context gets a numeric prefix so that interleaved lines from concurrent peer
 * channels and download sessions can be told apart:  ">N>" opens a context, "=N=" is an operation in it, "*N*" is
 * verbose, "<N<" closes it.  Errors go to the error stream.
 */
public class StandardLogger implements ILogger
{
	public static StandardLogger topLogger(PrintStream stream, PrintStream errorStream, boolean verbose)
	{
		return new StandardLogger(stream, errorStream, "", verbose, new AtomicInteger(0));
	}


	private final PrintStream _stream;
	private final PrintStream _errorStream;
	private final String _prefix;
	private final boolean _verbose;
	// Shared across the whole tree since contexts are opened from many threads.
	private final AtomicInteger _operationCounter;
	private volatile boolean _errorOccurred;

	private StandardLogger(PrintStream stream
			, PrintStream errorStream
			, String prefix
			, boolean verbose
			, AtomicInteger operationCounter
	)
	{
		_stream = stream;
		_errorStream = errorStream;
		_prefix = prefix;
		_verbose = verbose;
		_operationCounter = operationCounter;
	}

	@Override
	public ILogger logStart(String openingMessage)
	{
		int operationNumber = _operationCounter.incrementAndGet();
		String prefix = "" + operationNumber;
		_stream.println(">" + prefix + "> " + openingMessage);
		return new StandardLogger(_stream, _errorStream, prefix, _verbose, _operationCounter);
	}

	@Override
	public void logOperation(String message)
	{
		_stream.println("=" + _prefix + "= " + message);
	}

	@Override
	public void logFinish(String finishMessage)
	{
		_stream.println("<" + _prefix + "< " + finishMessage);
	}

	@Override
	public void logVerbose(String message)
	{
		if (_verbose)
		{
			_stream.println("*" + _prefix + "* " + message);
		}
	}

	@Override
	public void logError(String message)
	{
		_errorStream.println("!" + _prefix + "! " + message);
		_errorOccurred = true;
	}

	public boolean didErrorOccur()
	{
		return _errorOccurred;
	}
}
