package com.jeffdisher.tubeswarm.seeding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;


/**
 * The quota decision used by the seeding cache.  The implementation operates only on the data given to it, with no
 * on-disk representation.
 * Evictions are deterministic:  the candidates are ordered by priority rank (lowest first) and then by age (oldest
 * first) and removed from the front of that order until the cache is back within its limit.  The caller decides which
 * records are candidates at all (pinned records are never passed in).
 */
public class EvictionAlgorithm
{
	/**
	 * The type used to communicate eviction decisions through this API.
	 * 
	 * @param <T> The type of arbitrary user data required by the user's implementation.
	 */
	public static record Candidate<T>(long byteSize, int priorityRank, long addedMillis, T data)
	{
	}


	private final long _maximumSizeBytes;
	private long _currentSizeBytes;

	/**
	 * Creates the algorithm with the given limit and initial state.
	 * 
	 * @param maximumSizeBytes The maximum size the cache should be allowed to become, in bytes.
	 * @param currentSizeBytes The current occupancy of the cache, in bytes.
	 */
	public EvictionAlgorithm(long maximumSizeBytes, long currentSizeBytes)
	{
		_maximumSizeBytes = maximumSizeBytes;
		_currentSizeBytes = currentSizeBytes;
	}

	/**
	 * @return The number of bytes currently available in the cache (negative if overflowing).
	 */
	public long getBytesAvailable()
	{
		return (_maximumSizeBytes - _currentSizeBytes);
	}

	/**
	 * @return True if the cache is over its limit.
	 */
	public boolean isOverflowing()
	{
		return (_currentSizeBytes > _maximumSizeBytes);
	}

	/**
	 * Returns the prefix of the ordered candidates which should be removed to bring the cache back within its limit.
	 * If all the candidates together aren't enough, all of them are returned and the cache stays over its limit.
	 * 
	 * @param candidatesList The eviction candidates, in any order.
	 * @return The candidates to evict, in eviction order.
	 */
	public <T> List<Candidate<T>> toRemoveInResize(List<Candidate<T>> candidatesList)
	{
		List<Candidate<T>> candidates = new ArrayList<>(candidatesList);
		candidates.sort(Comparator.comparingInt((Candidate<T> candidate) -> candidate.priorityRank)
				.thenComparingLong((Candidate<T> candidate) -> candidate.addedMillis)
		);
		List<Candidate<T>> evictions = new ArrayList<>();
		for (Candidate<T> candidate : candidates)
		{
			if (!isOverflowing())
			{
				break;
			}
			evictions.add(candidate);
			_currentSizeBytes -= candidate.byteSize;
		}
		return evictions;
	}
}
