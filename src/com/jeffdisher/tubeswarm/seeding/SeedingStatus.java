package com.jeffdisher.tubeswarm.seeding;

import java.util.List;


/**
 * A read-only summary of the seeding cache, for display.
 */
public record SeedingStatus(int activeSeeds
		, int pinnedChannels
		, long storageUsedBytes
		, long maxStorageBytes
		, SeedingConfig config
		, List<SeedRecord> seeds
)
{
}
