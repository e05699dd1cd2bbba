package com.jeffdisher.tubeswarm.logic;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;
import com.jeffdisher.tubeswarm.types.PersistenceException;
import com.jeffdisher.tubeswarm.utils.Assert;


/**
 * The on-disk metadata store:  each key is one JSON file in the storage directory.
 * We write using the typical atomic trick:  write a temp file and then move it over the original.  If the platform
 * can't do the move atomically, it falls back to a plain replace, which means that the read path must ignore a stray
 * temp file left by a crash.
 */
public class RealMetaStore implements IMetaStore
{
	private static final String SUFFIX = ".json";
	private static final String TEMP_SUFFIX = ".json.tmp";

	private final File _directory;

	public RealMetaStore(File directory)
	{
		_directory = directory;
	}

	/**
	 * Creates the storage directory if it doesn't already exist.
	 * 
	 * @throws IOException The directory doesn't exist and couldn't be created.
	 */
	public void createDirectory() throws IOException
	{
		if (!_directory.isDirectory())
		{
			boolean didMake = _directory.mkdirs();
			if (!didMake)
			{
				throw new IOException("Failed to create directory: " + _directory);
			}
		}
	}

	@Override
	public synchronized JsonValue get(String key) throws PersistenceException
	{
		File file = _fileForKey(key, SUFFIX);
		JsonValue value = null;
		if (file.isFile())
		{
			try
			{
				String text = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
				value = Json.parse(text);
			}
			catch (IOException e)
			{
				throw new PersistenceException(key, e);
			}
			catch (ParseException e)
			{
				throw new PersistenceException(key, e);
			}
		}
		return value;
	}

	@Override
	public synchronized void put(String key, JsonValue value) throws PersistenceException
	{
		Assert.assertTrue(null != value);
		File temp = _fileForKey(key, TEMP_SUFFIX);
		File file = _fileForKey(key, SUFFIX);
		try
		{
			Files.write(temp.toPath(), value.toString().getBytes(StandardCharsets.UTF_8));
			try
			{
				Files.move(temp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			}
			catch (AtomicMoveNotSupportedException e)
			{
				Files.move(temp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
			}
		}
		catch (IOException e)
		{
			throw new PersistenceException(key, e);
		}
	}


	private File _fileForKey(String key, String suffix)
	{
		// Keys are our own constants (like "active-seeds") so we only need to make sure they are plain file names.
		Assert.assertTrue(!key.isEmpty() && (-1 == key.indexOf('/')) && (-1 == key.indexOf('\\')));
		return new File(_directory, key + suffix);
	}
}
