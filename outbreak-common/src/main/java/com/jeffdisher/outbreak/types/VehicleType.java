package com.jeffdisher.outbreak.types;


public enum VehicleType
{
	BIKE(0, 10, 1, 0),
	JEEP(100, 50, 3, 10),
	TRUCK(150, 100, 2, 15),
	TANK(200, 30, 1, 25),
	HELICOPTER(300, 20, 5, 30),
	WARSHIP(500, 200, 2, 40),
	;

	public final int fuelCapacity;
	public final int cargoCapacity;
	/**
	 * Trips take the configured travel time divided by this.
	 */
	public final int speed;
	/**
	 * Fuel burned per trip.
	 */
	public final int fuelPerTrip;

	private VehicleType(int fuelCapacity, int cargoCapacity, int speed, int fuelPerTrip)
	{
		this.fuelCapacity = fuelCapacity;
		this.cargoCapacity = cargoCapacity;
		this.speed = speed;
		this.fuelPerTrip = fuelPerTrip;
	}
}
