package com.jeffdisher.outbreak.types;


/**
 * A vehicle.  ownerId is null for abandoned vehicles which haven't been claimed.  While travelling,
 * destinationRegionId names where it is going and arrivalActionId is the pending action which will deliver it.
 */
public record Vehicle(String id
		, VehicleType type
		, String ownerId
		, String regionId
		, int condition
		, int fuel
		, String destinationRegionId
		, long arrivalActionId
)
{
	public static final int MAX_CONDITION = 100;
	public static final long NOT_TRAVELLING = 0L;

	public boolean isTravelling()
	{
		return (null != this.destinationRegionId);
	}
}
