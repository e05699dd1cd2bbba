package com.jeffdisher.tubeswarm.testutils;

import java.util.concurrent.atomic.AtomicInteger;

import com.jeffdisher.tubeswarm.logic.ILogger;


/**
 * A logger which writes nothing, only counting the errors (including those of nested loggers) so tests can check that
 * a failure was reported.
 */
public class SilentLogger implements ILogger
{
	private final AtomicInteger _errorCount;

	public SilentLogger()
	{
		this(new AtomicInteger(0));
	}

	private SilentLogger(AtomicInteger errorCount)
	{
		_errorCount = errorCount;
	}

	@Override
	public ILogger logStart(String openingMessage)
	{
		return new SilentLogger(_errorCount);
	}

	@Override
	public void logOperation(String message)
	{
	}

	@Override
	public void logFinish(String finishMessage)
	{
	}

	@Override
	public void logVerbose(String message)
	{
	}

	@Override
	public void logError(String message)
	{
		_errorCount.incrementAndGet();
	}

	public int getErrorCount()
	{
		return _errorCount.get();
	}
}
