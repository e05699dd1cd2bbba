package com.jeffdisher.tubeswarm.seeding;


/**
 * The storage numbers shown next to the storage budget setting.  Note that usedBytes can exceed maxBytes when pinned
 * seeds alone are larger than the budget.
 */
public record StorageStats(long usedBytes, long maxBytes, int seedCount, int pinnedCount)
{
}
