package com.jeffdisher.outbreak.world;

import com.jeffdisher.outbreak.actions.PendingActionQueue;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.types.ConstructionProject;
import com.jeffdisher.outbreak.types.MutablePlayer;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.PlayerStatus;
import com.jeffdisher.outbreak.types.Position;
import com.jeffdisher.outbreak.types.Vehicle;
import com.jeffdisher.outbreak.types.WorldEvent;
import com.jeffdisher.outbreak.utils.Assert;


/**
 * Applies the configured PlayerDownPolicy when a player's health reaches zero, wherever that happened (floor
 * encounter, scavenging mishap, ambush).
 */
public class PlayerCasualties
{
	private final WorldState _world;
	private final PendingActionQueue _queue;
	private final IEventSink _events;

	public PlayerCasualties(WorldState world, PendingActionQueue queue, IEventSink events)
	{
		_world = world;
		_queue = queue;
		_events = events;
	}

	/**
	 * Applies the down policy to the given player.  The caller must hold the player's lock and then commit the player
	 * and, if this returns true, call cascadeDeath() once the player is committed.
	 * 
	 * @param mutable The player who just went down.
	 * @param cause A short description for the event.
	 * @return True if the player is now permanently dead.
	 */
	public boolean applyDown(MutablePlayer mutable, String cause)
	{
		Player original = mutable.original();
		Assert.assertTrue(_world.locks.isPlayerHeld(original.id()));
		String regionId = mutable.newPosition.regionId();
		mutable.newPosition = Position.inRegion(regionId);
		boolean isDead;
		switch (_world.config.playerDownPolicy)
		{
		case RESPAWN:
			mutable.newHealth = Math.min(_world.config.respawnHealth, original.maxHealth());
			mutable.loseHalfOfEachStack();
			isDead = false;
			break;
		case PERMADEATH:
			mutable.newHealth = 0;
			mutable.newStatus = PlayerStatus.DEAD;
			mutable.clearOfflineMode();
			isDead = true;
			break;
		default:
			throw Assert.unreachable();
		}
		_events.eventPosted(WorldEvent.forPlayer(WorldEvent.Type.PLAYER_DOWN, original.id(), regionId, cause));
		return isDead;
	}

	/**
	 * Removes everything a permanently dead player still has in flight:  pending actions, a live encounter,
	 * constructions and vehicle trips (a travelling vehicle stops where it started).
	 * The caller must hold the player's lock.
	 * 
	 * @param playerId The dead player.
	 * @throws TransientStoreException A store operation failed.
	 */
	public void cascadeDeath(String playerId) throws TransientStoreException
	{
		Assert.assertTrue(_world.locks.isPlayerHeld(playerId));
		int cancelled = _queue.cancelAllForOwner(playerId);
		_world.removeEncounter(playerId);
		for (ConstructionProject project : _world.constructionsOwnedBy(playerId))
		{
			_world.removeConstruction(project.id());
		}
		for (Vehicle vehicle : _world.vehiclesOwnedBy(playerId))
		{
			if (vehicle.isTravelling())
			{
				_world.commitVehicle(new Vehicle(vehicle.id(), vehicle.type(), vehicle.ownerId(), vehicle.regionId(), vehicle.condition(), vehicle.fuel(), null, Vehicle.NOT_TRAVELLING));
			}
		}
		System.out.println("Player " + playerId + " died permanently (" + cancelled + " pending actions cancelled)");
	}
}
