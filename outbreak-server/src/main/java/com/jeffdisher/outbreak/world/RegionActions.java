package com.jeffdisher.outbreak.world;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.IntUnaryOperator;

import com.jeffdisher.outbreak.logic.EncounterMath;
import com.jeffdisher.outbreak.offline.OfflineModeResolver;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.types.CharacterClass;
import com.jeffdisher.outbreak.types.MutablePlayer;
import com.jeffdisher.outbreak.types.MutableRegion;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Position;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.utils.Assert;


/**
 * The simple online actions a player takes within the map:  joining, moving between regions, looting the open region
 * and tuning their radio.
 */
public class RegionActions
{
	public static final int MAX_NAME_LENGTH = 32;
	public static final int MAX_FREQUENCY_LENGTH = 16;

	private final WorldState _world;
	private final IntUnaryOperator _randomInt;
	private final OfflineModeResolver _offline;

	public RegionActions(WorldState world, IntUnaryOperator randomInt, OfflineModeResolver offline)
	{
		_world = world;
		_randomInt = randomInt;
		_offline = offline;
	}

	/**
	 * Creates a new player in the starting region.
	 * 
	 * @param playerId The ID assigned by the transport.
	 * @param name The display name.
	 * @param className The character class name (case-insensitive).
	 * @return The new player.
	 * @throws ValidationException The name or class is invalid.
	 * @throws ConflictException The player already exists.
	 * @throws TransientStoreException The store failed (nothing changed).
	 */
	public Player join(String playerId, String name, String className) throws ValidationException, ConflictException, TransientStoreException
	{
		if ((null == name) || name.isEmpty() || (name.length() > MAX_NAME_LENGTH))
		{
			throw new ValidationException("Names must be 1 to " + MAX_NAME_LENGTH + " characters.");
		}
		CharacterClass characterClass = CharacterClass.fromName(className);
		if (null == characterClass)
		{
			throw new ValidationException("Unknown class \"" + className + "\" (try scavenger, mechanic or soldier).");
		}
		String regionId = _world.config.startRegion;
		Assert.invariant(null != _world.getRegion(regionId), "Start region " + regionId + " is not in the world");
		try (EntityLocks.Held held = _world.locks.acquirePlayer(playerId, regionId))
		{
			if (null != _world.getPlayer(playerId))
			{
				throw new ConflictException("You have already joined.");
			}
			Player player = Player.create(playerId, name, characterClass, regionId);
			_world.commitPlayer(player);
			System.out.println("Player joined: " + playerId + " (" + name + ", " + characterClass + ")");
			return player;
		}
	}

	/**
	 * Walks to a connected region.  Anyone lying in ambush in the destination attacks immediately.
	 * 
	 * @param playerId The player.
	 * @param destinationId The region to move to.
	 * @return The player after arriving (and surviving or not surviving any ambush).
	 * @throws ValidationException The destination isn't reachable or the player can't act.
	 * @throws ConflictException The player is busy (encounter or travelling) or moved concurrently.
	 * @throws TransientStoreException The store failed.
	 */
	public Player move(String playerId, String destinationId) throws ValidationException, ConflictException, TransientStoreException
	{
		Player snapshot = _world.requireReady(playerId);
		String fromId = snapshot.position().regionId();
		Region from = _world.getRegion(fromId);
		if (null == _world.getRegion(destinationId))
		{
			throw new ValidationException("There is no region \"" + destinationId + "\".");
		}
		if (!from.isConnectedTo(destinationId))
		{
			throw new ValidationException("You can't get to " + destinationId + " from " + fromId + ".");
		}
		
		List<String> playerIds = new ArrayList<>(_world.ambushersInRegion(destinationId));
		playerIds.add(playerId);
		try (EntityLocks.Held held = _world.locks.acquire(playerIds, Arrays.asList(fromId, destinationId)))
		{
			Player player = _world.requireReady(playerId);
			if (!fromId.equals(player.position().regionId()))
			{
				throw new ConflictException("You are already on the move.");
			}
			MutablePlayer mutable = MutablePlayer.existing(player);
			mutable.newPosition = Position.inRegion(destinationId);
			_world.commitPlayer(mutable.freeze());
			_offline.onPlayerArrived(playerId, destinationId);
			return _world.getPlayer(playerId);
		}
	}

	/**
	 * Searches the open streets of the current region.  This makes noise.
	 * 
	 * @return The items found.
	 */
	public Map<String, Integer> loot(String playerId) throws ValidationException, ConflictException, TransientStoreException
	{
		try (EntityLocks.Held held = _world.lockPlayerInRegion(playerId))
		{
			Player player = _world.requireReady(playerId);
			Region region = _world.getRegion(player.position().regionId());
			Map<String, Integer> loot = EncounterMath.rollLoot(_world.getLootTable(region.lootTableId()), player.characterClass().lootPercent, _randomInt);
			MutableRegion mutableRegion = MutableRegion.existing(region);
			mutableRegion.addNoise(_world.config.noisePerLoot);
			MutablePlayer mutable = MutablePlayer.existing(player);
			mutable.addItems(loot);
			_world.commitPlayer(mutable.freeze());
			try
			{
				_world.commitRegion(mutableRegion.freeze());
			}
			catch (TransientStoreException e)
			{
				// The loot is already durable so it stands without the noise.
				System.out.println("WARNING:  Lost the noise update for " + region.id() + ": " + e.getMessage());
			}
			return loot;
		}
	}

	/**
	 * Tunes the player's radio.  Frequencies are either numeric ("101.5") or a single word ("alpha").
	 */
	public Player setFrequency(String playerId, String frequency) throws ValidationException, TransientStoreException
	{
		if (!isValidFrequency(frequency))
		{
			throw new ValidationException("Frequencies are numbers like 101.5 or words like alpha.");
		}
		try (EntityLocks.Held held = _world.lockPlayerInRegion(playerId))
		{
			MutablePlayer mutable = MutablePlayer.existing(_world.getPlayer(playerId));
			mutable.newRadioFrequency = frequency;
			Player updated = mutable.freeze();
			_world.commitPlayer(updated);
			return updated;
		}
	}

	public static boolean isValidFrequency(String frequency)
	{
		return (null != frequency)
				&& !frequency.isEmpty()
				&& (frequency.length() <= MAX_FREQUENCY_LENGTH)
				&& (frequency.matches("[0-9]+(\\.[0-9]+)?") || frequency.matches("[A-Za-z]+"))
		;
	}
}
