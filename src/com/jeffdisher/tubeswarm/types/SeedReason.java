package com.jeffdisher.tubeswarm.types;


/**
 * The reason a seed is being kept, which also determines its eviction priority.
 * Lower ranks are evicted first.  PINNED seeds are never evicted by quota enforcement.
 */
public enum SeedReason
{
	WATCHED("watched", 1),
	SUBSCRIBED("subscribed", 2),
	PINNED("pinned", 3),
	;

	/**
	 * @param name The stored name of a reason.
	 * @return The matching reason or null if the name isn't known.
	 */
	public static SeedReason fromName(String name)
	{
		SeedReason match = null;
		for (SeedReason reason : SeedReason.values())
		{
			if (reason.storedName.equals(name))
			{
				match = reason;
				break;
			}
		}
		return match;
	}


	public final String storedName;
	public final int priorityRank;

	private SeedReason(String storedName, int priorityRank)
	{
		this.storedName = storedName;
		this.priorityRank = priorityRank;
	}
}
