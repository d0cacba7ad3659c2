package com.jeffdisher.outbreak.types;


/**
 * An in-progress construction.  Remaining work is the time until dueMillis, when completionActionId fires.
 */
public record ConstructionProject(String id
		, String ownerId
		, StructureType type
		, String regionId
		, long startMillis
		, long dueMillis
		, long completionActionId
)
{
	public long remainingMillis(long nowMillis)
	{
		return Math.max(0L, this.dueMillis - nowMillis);
	}
}
