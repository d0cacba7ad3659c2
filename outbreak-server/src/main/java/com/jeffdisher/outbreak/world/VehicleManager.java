package com.jeffdisher.outbreak.world;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.jeffdisher.outbreak.actions.IDroppedActionHandler;
import com.jeffdisher.outbreak.actions.IPendingActionHandler;
import com.jeffdisher.outbreak.actions.PendingAction;
import com.jeffdisher.outbreak.actions.PendingActionKind;
import com.jeffdisher.outbreak.actions.PendingActionQueue;
import com.jeffdisher.outbreak.offline.OfflineModeResolver;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.types.MutablePlayer;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Position;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.StructureType;
import com.jeffdisher.outbreak.types.Vehicle;
import com.jeffdisher.outbreak.types.WorldEvent;
import com.jeffdisher.outbreak.utils.Assert;


/**
 * Claiming, maintaining and driving vehicles.  A trip is a VEHICLE_ARRIVAL pending action:  the owner rides along and
 * can't do anything else until it arrives.
 * An unowned vehicle is protected by the lock of the region it is parked in, an owned one by its owner's lock.
 */
public class VehicleManager implements IPendingActionHandler, IDroppedActionHandler
{
	public static final String ITEM_FUEL = "fuel";
	public static final String ITEM_REPAIR_KIT = "repair_kit";
	public static final String ITEM_METAL = "metal";
	public static final int METAL_PER_REPAIR = 2;

	private final WorldState _world;
	private final PendingActionQueue _queue;
	private final IEventSink _events;
	private final OfflineModeResolver _offline;

	public VehicleManager(WorldState world, PendingActionQueue queue, IEventSink events, OfflineModeResolver offline)
	{
		_world = world;
		_queue = queue;
		_events = events;
		_offline = offline;
	}

	/**
	 * Takes ownership of an abandoned vehicle parked in the player's region.
	 */
	public Vehicle claim(String playerId, String vehicleId) throws ValidationException, ConflictException, TransientStoreException
	{
		try (EntityLocks.Held held = _world.lockPlayerInRegion(playerId))
		{
			Player player = _world.requireReady(playerId);
			Vehicle vehicle = _parkedHere(player, vehicleId);
			if (null != vehicle.ownerId())
			{
				throw new ConflictException("That vehicle already belongs to someone.");
			}
			Vehicle claimed = new Vehicle(vehicle.id(), vehicle.type(), playerId, vehicle.regionId(), vehicle.condition(), vehicle.fuel(), null, Vehicle.NOT_TRAVELLING);
			_world.commitVehicle(claimed);
			return claimed;
		}
	}

	/**
	 * Drives an owned vehicle to a connected region.
	 * 
	 * @param playerId The owner.
	 * @param vehicleId The vehicle.
	 * @param destinationId The connected region.
	 * @param nowMillis The current time.
	 * @return The vehicle, now travelling.
	 * @throws ValidationException The vehicle isn't usable for this trip.
	 * @throws ConflictException The player is busy.
	 * @throws TransientStoreException The store failed (nothing changed).
	 */
	public Vehicle travel(String playerId, String vehicleId, String destinationId, long nowMillis) throws ValidationException, ConflictException, TransientStoreException
	{
		try (EntityLocks.Held held = _world.lockPlayerInRegion(playerId))
		{
			Player player = _world.requireReady(playerId);
			Vehicle vehicle = _parkedHere(player, vehicleId);
			if (!playerId.equals(vehicle.ownerId()))
			{
				throw new ValidationException("That isn't your vehicle.");
			}
			Region from = _world.getRegion(vehicle.regionId());
			if ((null == _world.getRegion(destinationId)) || !from.isConnectedTo(destinationId))
			{
				throw new ValidationException("You can't drive to " + destinationId + " from " + from.id() + ".");
			}
			if (vehicle.condition() < _world.config.vehicleConditionThreshold)
			{
				throw new ValidationException("The vehicle is too damaged to drive (condition " + vehicle.condition() + ").");
			}
			if (vehicle.fuel() < vehicle.type().fuelPerTrip)
			{
				throw new ValidationException("Not enough fuel (need " + vehicle.type().fuelPerTrip + ").");
			}
			
			long due = nowMillis + _world.config.scaledMillis(Math.max(1L, _world.config.travelSeconds / vehicle.type().speed));
			Map<String, String> payload = Collections.singletonMap(PendingAction.KEY_DESTINATION, destinationId);
			PendingAction arrival = _queue.schedule(PendingActionKind.VEHICLE_ARRIVAL, playerId, vehicleId, due, payload);
			Vehicle travelling = new Vehicle(vehicle.id()
					, vehicle.type()
					, playerId
					, vehicle.regionId()
					, Math.max(0, vehicle.condition() - _world.config.vehicleWearPerTrip)
					, vehicle.fuel() - vehicle.type().fuelPerTrip
					, destinationId
					, arrival.id()
			);
			try
			{
				_world.commitVehicle(travelling);
			}
			catch (TransientStoreException e)
			{
				_queue.cancel(arrival.id());
				throw e;
			}
			return travelling;
		}
	}

	@Override
	public void handle(PendingAction action, long nowMillis) throws TransientStoreException
	{
		Assert.assertTrue(PendingActionKind.VEHICLE_ARRIVAL == action.kind());
		Vehicle snapshot = _world.getVehicle(action.subjectId());
		Player ownerSnapshot = (null != snapshot)
				? _world.getPlayer(snapshot.ownerId())
				: null
		;
		if (!_isCurrent(snapshot, action) || (null == ownerSnapshot))
		{
			System.out.println("Ignoring stale vehicle arrival " + action.id());
			return;
		}
		String destinationId = snapshot.destinationRegionId();
		List<String> playerIds = new ArrayList<>(_world.ambushersInRegion(destinationId));
		playerIds.add(ownerSnapshot.id());
		List<String> regionIds = Arrays.asList(ownerSnapshot.position().regionId(), snapshot.regionId(), destinationId);
		try (EntityLocks.Held held = _world.locks.acquire(playerIds, regionIds))
		{
			Vehicle vehicle = _world.getVehicle(snapshot.id());
			Player owner = _world.getPlayer(ownerSnapshot.id());
			if (!_isCurrent(vehicle, action) || (null == owner))
			{
				System.out.println("Ignoring stale vehicle arrival " + action.id());
				return;
			}
			// The owner can't act while travelling so their region can't have changed.
			Assert.invariant(owner.position().regionId().equals(ownerSnapshot.position().regionId()), "Owner of " + vehicle.id() + " moved while travelling");
			_world.commitVehicle(new Vehicle(vehicle.id(), vehicle.type(), vehicle.ownerId(), destinationId, vehicle.condition(), vehicle.fuel(), null, Vehicle.NOT_TRAVELLING));
			if (owner.isAlive())
			{
				MutablePlayer mutable = MutablePlayer.existing(owner);
				mutable.newPosition = Position.inRegion(destinationId);
				_world.commitPlayer(mutable.freeze());
				_offline.onPlayerArrived(owner.id(), destinationId);
			}
			_events.eventPosted(WorldEvent.forPlayer(WorldEvent.Type.VEHICLE_ARRIVED, owner.id(), destinationId, vehicle.type().name().toLowerCase() + " arrived"));
		}
	}

	/**
	 * The arrival was lost before it ran.  The trip is given a new arrival on the next world tick.
	 */
	@Override
	public void dropped(PendingAction action, long nowMillis) throws TransientStoreException
	{
		Assert.assertTrue(PendingActionKind.VEHICLE_ARRIVAL == action.kind());
		Vehicle snapshot = _world.getVehicle(action.subjectId());
		if (_isCurrent(snapshot, action))
		{
			try (EntityLocks.Held held = _world.locks.acquire(Collections.singletonList(snapshot.ownerId()), Collections.emptyList()))
			{
				Vehicle vehicle = _world.getVehicle(snapshot.id());
				if (_isCurrent(vehicle, action))
				{
					long due = nowMillis + _world.config.scaledMillis(_world.config.worldTickSeconds);
					PendingAction arrival = _queue.schedule(PendingActionKind.VEHICLE_ARRIVAL, vehicle.ownerId(), vehicle.id(), due, action.payload());
					try
					{
						_world.commitVehicle(new Vehicle(vehicle.id(), vehicle.type(), vehicle.ownerId(), vehicle.regionId(), vehicle.condition(), vehicle.fuel(), vehicle.destinationRegionId(), arrival.id()));
					}
					catch (TransientStoreException e)
					{
						_queue.cancel(arrival.id());
						throw e;
					}
					System.out.println("Rescheduled arrival of " + vehicle.id() + " after losing action " + action.id());
				}
			}
		}
	}

	/**
	 * Uses a repair kit and some metal to restore a vehicle's condition.  Mechanics do a better job, as does anyone
	 * working in a region with an advanced workshop.
	 */
	public Vehicle repair(String playerId, String vehicleId) throws ValidationException, ConflictException, TransientStoreException
	{
		try (EntityLocks.Held held = _world.lockPlayerInRegion(playerId))
		{
			Player player = _world.requireReady(playerId);
			Vehicle vehicle = _usableBy(player, vehicleId);
			if (Vehicle.MAX_CONDITION == vehicle.condition())
			{
				throw new ValidationException("That vehicle is already in perfect condition.");
			}
			MutablePlayer mutable = MutablePlayer.existing(player);
			if (!mutable.removeItems(ITEM_REPAIR_KIT, 1) || !mutable.removeItems(ITEM_METAL, METAL_PER_REPAIR))
			{
				throw new ValidationException("Repairs need 1 " + ITEM_REPAIR_KIT + " and " + METAL_PER_REPAIR + " " + ITEM_METAL + ".");
			}
			int restored = _world.config.vehicleRepairRate + player.characterClass().repairBonus;
			if (_world.getRegion(player.position().regionId()).hasStructure(StructureType.ADVANCED_WORKSHOP))
			{
				restored += _world.config.workshopRepairBonus;
			}
			int condition = Math.min(Vehicle.MAX_CONDITION, vehicle.condition() + restored);
			Vehicle repaired = new Vehicle(vehicle.id(), vehicle.type(), vehicle.ownerId(), vehicle.regionId(), condition, vehicle.fuel(), null, Vehicle.NOT_TRAVELLING);
			_world.commitVehicle(repaired);
			_world.commitPlayer(mutable.freeze());
			return repaired;
		}
	}

	/**
	 * Pours fuel from the player's inventory into a vehicle, up to its capacity.
	 */
	public Vehicle refuel(String playerId, String vehicleId, int amount) throws ValidationException, ConflictException, TransientStoreException
	{
		if (amount <= 0)
		{
			throw new ValidationException("Fuel amount must be positive.");
		}
		try (EntityLocks.Held held = _world.lockPlayerInRegion(playerId))
		{
			Player player = _world.requireReady(playerId);
			Vehicle vehicle = _usableBy(player, vehicleId);
			int capacity = vehicle.type().fuelCapacity;
			if (0 == capacity)
			{
				throw new ValidationException("That vehicle doesn't take fuel.");
			}
			int poured = Math.min(amount, capacity - vehicle.fuel());
			if (0 == poured)
			{
				throw new ValidationException("The tank is already full.");
			}
			MutablePlayer mutable = MutablePlayer.existing(player);
			if (!mutable.removeItems(ITEM_FUEL, poured))
			{
				throw new ValidationException("You don't have " + poured + " " + ITEM_FUEL + ".");
			}
			Vehicle refuelled = new Vehicle(vehicle.id(), vehicle.type(), vehicle.ownerId(), vehicle.regionId(), vehicle.condition(), vehicle.fuel() + poured, null, Vehicle.NOT_TRAVELLING);
			_world.commitVehicle(refuelled);
			_world.commitPlayer(mutable.freeze());
			return refuelled;
		}
	}


	private static boolean _isCurrent(Vehicle vehicle, PendingAction action)
	{
		return (null != vehicle)
				&& vehicle.isTravelling()
				&& (vehicle.arrivalActionId() == action.id())
		;
	}

	private Vehicle _parkedHere(Player player, String vehicleId) throws ValidationException
	{
		Vehicle vehicle = _world.getVehicle(vehicleId);
		if ((null == vehicle) || vehicle.isTravelling() || !vehicle.regionId().equals(player.position().regionId()))
		{
			throw new ValidationException("There is no vehicle \"" + vehicleId + "\" here.");
		}
		return vehicle;
	}

	private Vehicle _usableBy(Player player, String vehicleId) throws ValidationException
	{
		Vehicle vehicle = _parkedHere(player, vehicleId);
		if ((null != vehicle.ownerId()) && !player.id().equals(vehicle.ownerId()))
		{
			throw new ValidationException("That isn't your vehicle.");
		}
		return vehicle;
	}
}
