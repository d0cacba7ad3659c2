package com.jeffdisher.outbreak.encounter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.IntUnaryOperator;

import com.jeffdisher.outbreak.actions.IDroppedActionHandler;
import com.jeffdisher.outbreak.actions.IPendingActionHandler;
import com.jeffdisher.outbreak.actions.PendingAction;
import com.jeffdisher.outbreak.actions.PendingActionKind;
import com.jeffdisher.outbreak.actions.PendingActionQueue;
import com.jeffdisher.outbreak.logic.CombatResolver;
import com.jeffdisher.outbreak.logic.EncounterMath;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.types.Building;
import com.jeffdisher.outbreak.types.DayPhase;
import com.jeffdisher.outbreak.types.LootTable;
import com.jeffdisher.outbreak.types.MutablePlayer;
import com.jeffdisher.outbreak.types.MutableRegion;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Position;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.WorldEvent;
import com.jeffdisher.outbreak.types.ZombieStats;
import com.jeffdisher.outbreak.utils.Assert;
import com.jeffdisher.outbreak.world.ConflictException;
import com.jeffdisher.outbreak.world.EntityLocks;
import com.jeffdisher.outbreak.world.IEventSink;
import com.jeffdisher.outbreak.world.PlayerCasualties;
import com.jeffdisher.outbreak.world.ValidationException;
import com.jeffdisher.outbreak.world.WorldState;


/**
 * Drives a player's encounter with the zombie on a building floor.
 * Entering a floor presents the zombie and opens a decision window, backed by a DECISION_EXPIRY pending action.
 * The player can sneak or attack before the window closes, which is only accepted while the clock hasn't taken that
 * action from the queue.  Otherwise, the expiry handler makes the zombie attack.  Either way, exactly one resolution
 * happens per encounter:  both sides resolve under the player's lock and only while the encounter is still live.
 * Every resolution writes the player first so a store failure there leaves the encounter exactly as it was.
 */
public class EncounterStateMachine implements IPendingActionHandler, IDroppedActionHandler
{
	private final WorldState _world;
	private final PendingActionQueue _queue;
	private final IEventSink _events;
	private final IntUnaryOperator _randomInt;
	private final PlayerCasualties _casualties;

	public EncounterStateMachine(WorldState world
			, PendingActionQueue queue
			, IEventSink events
			, IntUnaryOperator randomInt
			, PlayerCasualties casualties
	)
	{
		_world = world;
		_queue = queue;
		_events = events;
		_randomInt = randomInt;
		_casualties = casualties;
	}

	/**
	 * Enters a floor of a building in the player's current region, presenting its zombie.
	 * 
	 * @param playerId The player.
	 * @param buildingId The building.
	 * @param floorIndex The 0-based floor.
	 * @param nowMillis The current time.
	 * @return The new encounter, in PRESENTED state.
	 * @throws ValidationException The building or floor doesn't exist here or the floor is already cleared.
	 * @throws ConflictException The player already has a live encounter or is travelling.
	 * @throws TransientStoreException The store failed (nothing changed).
	 */
	public Encounter enterFloor(String playerId, String buildingId, int floorIndex, long nowMillis) throws ValidationException, ConflictException, TransientStoreException
	{
		try (EntityLocks.Held held = _world.lockPlayerInRegion(playerId))
		{
			Player player = _world.getPlayer(playerId);
			_requireAlive(player);
			if (null != _world.getEncounter(playerId))
			{
				throw new ConflictException("You are already in an encounter.");
			}
			if (_world.isTravelling(playerId))
			{
				throw new ConflictException("You are travelling.");
			}
			Region region = _world.getRegion(player.position().regionId());
			Building building = _world.getBuilding(buildingId);
			if ((null == building) || !building.regionId().equals(region.id()))
			{
				throw new ValidationException("There is no building \"" + buildingId + "\" here.");
			}
			if (!building.hasFloor(floorIndex))
			{
				throw new ValidationException(building.name() + " has no floor " + floorIndex + ".");
			}
			if (building.floor(floorIndex).cleared())
			{
				throw new ValidationException("That floor has already been cleared.");
			}
			
			int difficulty = Building.difficultyTier(floorIndex, region.danger());
			ZombieStats zombie = EncounterMath.rollZombie(difficulty, _randomInt);
			long deadline = nowMillis + _world.config.scaledMillis(_world.config.decisionWindowSeconds);
			Map<String, String> payload = Collections.singletonMap(PendingAction.KEY_FLOOR, Integer.toString(floorIndex));
			PendingAction expiry = _queue.schedule(PendingActionKind.DECISION_EXPIRY, playerId, buildingId, deadline, payload);
			
			MutablePlayer mutable = MutablePlayer.existing(player);
			mutable.newPosition = Position.onFloor(region.id(), buildingId, floorIndex);
			try
			{
				_world.commitPlayer(mutable.freeze());
			}
			catch (TransientStoreException e)
			{
				_queue.cancel(expiry.id());
				throw e;
			}
			Encounter encounter = new Encounter(playerId, buildingId, floorIndex, nowMillis, difficulty, zombie, deadline, expiry.id(), EncounterState.PRESENTED);
			_world.putEncounter(encounter);
			_events.eventPosted(WorldEvent.forPlayer(WorldEvent.Type.ENCOUNTER_PRESENTED, playerId, region.id()
					, zombie.type().name().toLowerCase() + " zombie (health " + zombie.health() + ") on floor " + floorIndex + " of " + building.name()
			));
			return encounter;
		}
	}

	/**
	 * The player tries to slip past the zombie.  On success, they leave the building with whatever they could grab
	 * on the way.  On failure, the zombie is alerted and attacks.
	 */
	public EncounterOutcome sneak(String playerId, long nowMillis) throws ValidationException, ConflictException, TransientStoreException
	{
		try (EntityLocks.Held held = _world.lockPlayerInRegion(playerId))
		{
			Encounter encounter = _claimDecision(playerId);
			List<EncounterState> transitions = new ArrayList<>();
			transitions.add(EncounterState.SNEAK_RESOLVED);
			
			Player player = _world.getPlayer(playerId);
			DayPhase phase = _world.phaseAt(nowMillis);
			int chance = EncounterMath.sneakChance(player, encounter.difficulty(), phase);
			EncounterOutcome outcome;
			if (EncounterMath.rollPercent(chance, _randomInt))
			{
				Map<String, Integer> loot = EncounterMath.rollLimitedLoot(_floorLoot(encounter), _randomInt);
				MutablePlayer mutable = MutablePlayer.existing(player);
				mutable.newPosition = Position.inRegion(player.position().regionId());
				mutable.addItems(loot);
				Player updated = mutable.freeze();
				_world.commitPlayer(updated);
				_world.removeEncounter(playerId);
				transitions.add(EncounterState.FLED);
				_events.eventPosted(WorldEvent.forPlayer(WorldEvent.Type.PLAYER_FLED, playerId, updated.position().regionId(), "Snuck past the zombie"));
				outcome = new EncounterOutcome(encounter, Collections.unmodifiableList(transitions), null, loot, updated);
			}
			else
			{
				transitions.add(EncounterState.ATTACK_RESOLVED);
				outcome = _fight(encounter, transitions, true);
			}
			_releaseExpiry(encounter);
			return outcome;
		}
	}

	/**
	 * The player attacks the zombie.
	 */
	public EncounterOutcome attack(String playerId, long nowMillis) throws ValidationException, ConflictException, TransientStoreException
	{
		try (EntityLocks.Held held = _world.lockPlayerInRegion(playerId))
		{
			Encounter encounter = _claimDecision(playerId);
			List<EncounterState> transitions = new ArrayList<>();
			transitions.add(EncounterState.ATTACK_RESOLVED);
			EncounterOutcome outcome = _fight(encounter, transitions, false);
			_releaseExpiry(encounter);
			return outcome;
		}
	}

	/**
	 * The decision window closed with no choice:  the zombie attacks, with no alerted bonus.
	 */
	@Override
	public void handle(PendingAction action, long nowMillis) throws TransientStoreException
	{
		Assert.assertTrue(PendingActionKind.DECISION_EXPIRY == action.kind());
		String playerId = action.ownerId();
		try (EntityLocks.Held held = _world.tryLockPlayerInRegion(playerId))
		{
			Encounter encounter = _world.getEncounter(playerId);
			if ((null != held)
					&& (null != encounter)
					&& (encounter.expiryActionId() == action.id())
					&& (EncounterState.PRESENTED == encounter.state())
			)
			{
				List<EncounterState> transitions = new ArrayList<>();
				transitions.add(EncounterState.EXPIRED);
				transitions.add(EncounterState.ATTACK_RESOLVED);
				_fight(encounter, transitions, false);
			}
			else
			{
				System.out.println("Ignoring stale decision expiry " + action.id() + " for " + playerId);
			}
		}
	}

	/**
	 * The expiry was lost before it could resolve the encounter.  Nothing else will ever resolve it, so the zombie
	 * loses interest and the player is put back in the open region.
	 */
	@Override
	public void dropped(PendingAction action, long nowMillis) throws TransientStoreException
	{
		Assert.assertTrue(PendingActionKind.DECISION_EXPIRY == action.kind());
		String playerId = action.ownerId();
		try (EntityLocks.Held held = _world.tryLockPlayerInRegion(playerId))
		{
			Encounter encounter = _world.getEncounter(playerId);
			if ((null != held)
					&& (null != encounter)
					&& (encounter.expiryActionId() == action.id())
					&& (EncounterState.PRESENTED == encounter.state())
			)
			{
				// Released before the write:  a player left on the floor without an encounter is still free to act.
				_world.removeEncounter(playerId);
				Player player = _world.getPlayer(playerId);
				String regionId = player.position().regionId();
				MutablePlayer mutable = MutablePlayer.existing(player);
				mutable.newPosition = Position.inRegion(regionId);
				_world.commitPlayer(mutable.freeze());
				_events.eventPosted(WorldEvent.forPlayer(WorldEvent.Type.PLAYER_FLED, playerId, regionId, "The zombie lost interest"));
				System.out.println("Released encounter of " + playerId + " after losing decision expiry " + action.id());
			}
		}
	}


	private static void _requireAlive(Player player) throws ValidationException
	{
		if (!player.isAlive())
		{
			throw new ValidationException("You are dead.");
		}
	}

	// Once the clock has taken the expiry, the decision belongs to it (or to its recovery).
	private Encounter _claimDecision(String playerId) throws ValidationException, ConflictException
	{
		Encounter encounter = _world.getEncounter(playerId);
		if ((null == encounter) || (EncounterState.PRESENTED != encounter.state()))
		{
			throw new ValidationException("You aren't facing a zombie.");
		}
		if (null == _queue.get(encounter.expiryActionId()))
		{
			throw new ConflictException("Too late: the zombie already made its move.");
		}
		return encounter;
	}

	private void _releaseExpiry(Encounter encounter)
	{
		try
		{
			_queue.cancel(encounter.expiryActionId());
		}
		catch (TransientStoreException e)
		{
			// Left pending, it finds no live encounter when it fires.
			System.out.println("WARNING:  Couldn't cancel decision expiry " + encounter.expiryActionId() + ": " + e.getMessage());
		}
	}

	private LootTable _floorLoot(Encounter encounter)
	{
		Building building = _world.getBuilding(encounter.buildingId());
		String tableId = building.floor(encounter.floorIndex()).lootTableId();
		if (null == tableId)
		{
			tableId = _world.getRegion(building.regionId()).lootTableId();
		}
		return _world.getLootTable(tableId);
	}

	private EncounterOutcome _fight(Encounter encounter, List<EncounterState> transitions, boolean zombieAlerted) throws TransientStoreException
	{
		String playerId = encounter.playerId();
		Player player = _world.getPlayer(playerId);
		String regionId = player.position().regionId();
		CombatResolver.Combatant challenger = CombatResolver.Combatant.forPlayer(player, false);
		CombatResolver.Combatant zombie = CombatResolver.Combatant.forZombie(encounter.zombie(), zombieAlerted);
		CombatResolver.Result result = CombatResolver.resolve(challenger, zombie, _world.config, _randomInt);
		
		MutablePlayer mutable = MutablePlayer.existing(player);
		mutable.newHealth = result.challengerHealth();
		mutable.newWeapon = result.challengerWeapon();
		MutableRegion region = MutableRegion.existing(_world.getRegion(regionId));
		region.addNoise(_world.config.noisePerCombat);
		Map<String, Integer> loot = new TreeMap<>();
		Building clearedBuilding = null;
		boolean isDead = false;
		WorldEvent event;
		switch (result.winner())
		{
		case CHALLENGER:
		{
			transitions.add(EncounterState.CLEARED);
			Building building = _world.getBuilding(encounter.buildingId());
			// Someone else may have cleared it while this encounter was live.
			if (!building.floor(encounter.floorIndex()).cleared())
			{
				clearedBuilding = building.withFloorCleared(encounter.floorIndex());
			}
			loot.putAll(EncounterMath.rollLoot(_floorLoot(encounter), player.characterClass().lootPercent, _randomInt));
			mutable.addItems(loot);
			event = WorldEvent.forPlayer(WorldEvent.Type.FLOOR_CLEARED, playerId, regionId, "Cleared floor " + encounter.floorIndex() + " of " + building.name());
			break;
		}
		case OPPONENT:
			transitions.add(EncounterState.PLAYER_DOWN);
			isDead = _casualties.applyDown(mutable, "Killed by a " + encounter.zombie().type().name().toLowerCase() + " zombie");
			event = null;
			break;
		case STALEMATE:
			transitions.add(EncounterState.FLED);
			mutable.newPosition = Position.inRegion(regionId);
			event = WorldEvent.forPlayer(WorldEvent.Type.PLAYER_FLED, playerId, regionId, "Retreated from an endless fight");
			break;
		default:
			throw Assert.unreachable();
		}
		
		Player updated = mutable.freeze();
		_world.commitPlayer(updated);
		_world.removeEncounter(playerId);
		try
		{
			if (null != clearedBuilding)
			{
				_world.commitBuilding(clearedBuilding);
			}
			_world.commitRegion(region.freeze());
		}
		catch (TransientStoreException e)
		{
			// The player's outcome is already durable so the fight stands.
			System.out.println("WARNING:  Lost the world side of " + playerId + "'s fight in " + regionId + ": " + e.getMessage());
		}
		if (isDead)
		{
			_casualties.cascadeDeath(playerId);
		}
		if (null != event)
		{
			_events.eventPosted(event);
		}
		return new EncounterOutcome(encounter, Collections.unmodifiableList(transitions), result, Collections.unmodifiableMap(loot), updated);
	}
}
