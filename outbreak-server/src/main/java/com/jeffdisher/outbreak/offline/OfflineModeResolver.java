package com.jeffdisher.outbreak.offline;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.function.IntUnaryOperator;

import com.jeffdisher.outbreak.actions.IDroppedActionHandler;
import com.jeffdisher.outbreak.actions.IPendingActionHandler;
import com.jeffdisher.outbreak.actions.PendingAction;
import com.jeffdisher.outbreak.actions.PendingActionKind;
import com.jeffdisher.outbreak.actions.PendingActionQueue;
import com.jeffdisher.outbreak.logic.CombatResolver;
import com.jeffdisher.outbreak.logic.EncounterMath;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.types.MutablePlayer;
import com.jeffdisher.outbreak.types.MutableRegion;
import com.jeffdisher.outbreak.types.OfflineMode;
import com.jeffdisher.outbreak.types.Player;
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
 * Standing orders which act on a player's behalf while they are away.
 * Every order is backed by an OFFLINE_RESOLUTION pending action carrying the player's offline generation.  Changing or
 * clearing the order bumps the generation so any action already in flight finds itself stale and does nothing.
 * AMBUSH orders also fire immediately when another player arrives in the region (see onPlayerArrived()).
 * Players are always written before their region so a failed write leaves the order in place to run again.
 */
public class OfflineModeResolver implements IPendingActionHandler, IDroppedActionHandler
{
	private final WorldState _world;
	private final PendingActionQueue _queue;
	private final IEventSink _events;
	private final IntUnaryOperator _randomInt;
	private final PlayerCasualties _casualties;

	public OfflineModeResolver(WorldState world
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
	 * Replaces the player's standing order.  Any previously scheduled resolution is cancelled.
	 * 
	 * @param playerId The player.
	 * @param mode The new order (NONE just clears the old one).
	 * @param nowMillis The current time.
	 * @return The updated player.
	 * @throws ValidationException The player doesn't exist or is dead.
	 * @throws ConflictException The player is in an encounter.
	 * @throws TransientStoreException The store failed (nothing changed).
	 */
	public Player setMode(String playerId, OfflineMode mode, long nowMillis) throws ValidationException, ConflictException, TransientStoreException
	{
		try (EntityLocks.Held held = _world.lockPlayerInRegion(playerId))
		{
			Player player = _world.getPlayer(playerId);
			if (!player.isAlive())
			{
				throw new ValidationException("You are dead.");
			}
			if (null != _world.getEncounter(playerId))
			{
				throw new ConflictException("You can't change orders during an encounter.");
			}
			
			MutablePlayer mutable = MutablePlayer.existing(player);
			mutable.clearOfflineMode();
			PendingAction scheduled = null;
			if (OfflineMode.NONE != mode)
			{
				mutable.newOfflineMode = mode;
				scheduled = _scheduleResolution(playerId, mutable.newOfflineGeneration, nowMillis);
				mutable.newOfflineActionId = scheduled.id();
			}
			Player updated = _commitWithAction(mutable, scheduled);
			// The old action is only cancelled once the new generation is durable:  if it fires first, it is stale.
			if (Player.NO_ACTION != player.offlineActionId())
			{
				_queue.cancel(player.offlineActionId());
			}
			return updated;
		}
	}

	@Override
	public void handle(PendingAction action, long nowMillis) throws TransientStoreException
	{
		Assert.assertTrue(PendingActionKind.OFFLINE_RESOLUTION == action.kind());
		String playerId = action.ownerId();
		Player snapshot = _world.getPlayer(playerId);
		if ((null != snapshot) && (OfflineMode.AMBUSH == snapshot.offlineMode()))
		{
			String regionId = snapshot.position().regionId();
			String targetId = _pickAmbushTarget(playerId, regionId);
			try (EntityLocks.Held held = _world.locks.acquire(Arrays.asList(playerId, targetId), Collections.singletonList(regionId)))
			{
				Player ambusher = _world.getPlayer(playerId);
				if (_isCurrent(ambusher, action) && (OfflineMode.AMBUSH == ambusher.offlineMode()))
				{
					Player target = (null != targetId)
							? _world.getPlayer(targetId)
							: null
					;
					if (regionId.equals(ambusher.position().regionId())
							&& (null == _world.getEncounter(playerId))
							&& _isAmbushable(playerId, target, regionId)
					)
					{
						_resolveAmbush(ambusher, target, "Ambushed from hiding");
					}
					else
					{
						_reschedule(ambusher, nowMillis);
					}
				}
				else
				{
					_logStale(action);
				}
			}
		}
		else if ((null != snapshot) && (OfflineMode.SCAVENGE == snapshot.offlineMode()))
		{
			try (EntityLocks.Held held = _world.tryLockPlayerInRegion(playerId))
			{
				Player player = _world.getPlayer(playerId);
				if ((null != held) && _isCurrent(player, action) && (OfflineMode.SCAVENGE == player.offlineMode()))
				{
					_scavenge(player, nowMillis);
				}
				else
				{
					_logStale(action);
				}
			}
		}
		else
		{
			_logStale(action);
		}
	}

	/**
	 * The resolution was lost before it ran.  If the order it belonged to is still standing, it gets a new one.
	 */
	@Override
	public void dropped(PendingAction action, long nowMillis) throws TransientStoreException
	{
		Assert.assertTrue(PendingActionKind.OFFLINE_RESOLUTION == action.kind());
		try (EntityLocks.Held held = _world.tryLockPlayerInRegion(action.ownerId()))
		{
			Player player = _world.getPlayer(action.ownerId());
			if ((null != held) && _isCurrent(player, action))
			{
				_reschedule(player, nowMillis);
				System.out.println("Rescheduled " + player.offlineMode() + " order of " + player.id() + " after losing action " + action.id());
			}
		}
	}

	/**
	 * Resolves every ambush waiting in the region against a player who just arrived there.  The caller must already
	 * hold the locks of the arriving player, the region and whichever ambushers should be considered (ambushers whose
	 * lock isn't held are left for their periodic resolution).
	 * An ambush which can't be written is logged and left standing for its periodic resolution.
	 * 
	 * @param arrivingId The player who arrived.
	 * @param regionId The region they arrived in.
	 * @return The number of ambushes triggered.
	 */
	public int onPlayerArrived(String arrivingId, String regionId)
	{
		Assert.assertTrue(_world.locks.isPlayerHeld(arrivingId));
		int triggered = 0;
		for (String ambusherId : _world.ambushersInRegion(regionId))
		{
			Player target = _world.getPlayer(arrivingId);
			Player ambusher = _world.getPlayer(ambusherId);
			if (!ambusherId.equals(arrivingId)
					&& _world.locks.isPlayerHeld(ambusherId)
					&& _isAmbushable(ambusherId, target, regionId)
					&& (null == _world.getEncounter(ambusherId))
					&& !_world.isTravelling(ambusherId)
			)
			{
				try
				{
					_resolveAmbush(ambusher, target, "Sprang an ambush on an arrival");
					triggered += 1;
				}
				catch (TransientStoreException e)
				{
					System.out.println("WARNING:  Ambush by " + ambusherId + " in " + regionId + " not saved: " + e.getMessage());
				}
			}
		}
		return triggered;
	}


	private PendingAction _scheduleResolution(String playerId, int generation, long nowMillis) throws TransientStoreException
	{
		long due = nowMillis + _world.config.scaledMillis(_world.config.offlineIntervalSeconds);
		Map<String, String> payload = Collections.singletonMap(PendingAction.KEY_GENERATION, Integer.toString(generation));
		return _queue.schedule(PendingActionKind.OFFLINE_RESOLUTION, playerId, playerId, due, payload);
	}

	private Player _commitWithAction(MutablePlayer mutable, PendingAction scheduled) throws TransientStoreException
	{
		Player updated = mutable.freeze();
		try
		{
			_world.commitPlayer(updated);
		}
		catch (TransientStoreException e)
		{
			if (null != scheduled)
			{
				_queue.cancel(scheduled.id());
			}
			throw e;
		}
		return updated;
	}

	private void _reschedule(Player player, long nowMillis) throws TransientStoreException
	{
		MutablePlayer mutable = MutablePlayer.existing(player);
		PendingAction scheduled = _scheduleResolution(player.id(), player.offlineGeneration(), nowMillis);
		mutable.newOfflineActionId = scheduled.id();
		_commitWithAction(mutable, scheduled);
	}

	private static boolean _isCurrent(Player player, PendingAction action)
	{
		return (null != player)
				&& player.isAlive()
				&& (OfflineMode.NONE != player.offlineMode())
				&& (player.offlineGeneration() == action.payloadLong(PendingAction.KEY_GENERATION, -1L))
				&& (player.offlineActionId() == action.id())
		;
	}

	private boolean _isAmbushable(String ambusherId, Player target, String regionId)
	{
		return (null != target)
				&& !target.id().equals(ambusherId)
				&& target.isAlive()
				&& regionId.equals(target.position().regionId())
				&& (null == _world.getEncounter(target.id()))
				&& !_world.isTravelling(target.id())
		;
	}

	private String _pickAmbushTarget(String ambusherId, String regionId)
	{
		String targetId = null;
		for (Player candidate : _world.playersInRegion(regionId))
		{
			if ((null == targetId) && _isAmbushable(ambusherId, candidate, regionId))
			{
				targetId = candidate.id();
			}
		}
		return targetId;
	}

	private void _logStale(PendingAction action)
	{
		System.out.println("Ignoring stale offline resolution " + action.id() + " for " + action.ownerId());
	}

	private void _scavenge(Player player, long nowMillis) throws TransientStoreException
	{
		String regionId = player.position().regionId();
		Region region = _world.getRegion(regionId);
		MutablePlayer mutable = MutablePlayer.existing(player);
		MutableRegion mutableRegion = MutableRegion.existing(region);
		boolean isDead = false;
		String detail;
		int chance = EncounterMath.scavengeChance(player.stats().armor(), region.danger());
		if (EncounterMath.rollPercent(chance, _randomInt))
		{
			Map<String, Integer> loot = EncounterMath.rollLoot(_world.getLootTable(region.lootTableId()), player.characterClass().lootPercent, _randomInt);
			mutable.addItems(loot);
			mutableRegion.newNoise = mutableRegion.newNoise / 2.0;
			detail = "Scavenged " + loot;
		}
		else if (region.zombieCount() > 0)
		{
			ZombieStats zombie = EncounterMath.rollZombie(region.danger(), _randomInt);
			// Caught off guard while scavenging.
			CombatResolver.Combatant scavenger = CombatResolver.Combatant.forPlayer(player, false).withArmor(player.stats().armor() / 2);
			CombatResolver.Result result = CombatResolver.resolve(scavenger, CombatResolver.Combatant.forZombie(zombie, false), _world.config, _randomInt);
			mutable.newHealth = result.challengerHealth();
			mutable.newWeapon = result.challengerWeapon();
			mutableRegion.addNoise(_world.config.noisePerCombat);
			switch (result.winner())
			{
			case CHALLENGER:
				mutableRegion.newZombieCount -= 1;
				detail = "Fought off a zombie while scavenging";
				break;
			case OPPONENT:
				isDead = _casualties.applyDown(mutable, "Killed by a zombie while scavenging");
				mutable.clearOfflineMode();
				detail = "Went down while scavenging";
				break;
			case STALEMATE:
				detail = "Escaped a zombie while scavenging";
				break;
			default:
				throw Assert.unreachable();
			}
		}
		else
		{
			detail = "Found nothing while scavenging";
		}
		
		PendingAction scheduled = null;
		if (OfflineMode.SCAVENGE == mutable.newOfflineMode)
		{
			scheduled = _scheduleResolution(player.id(), mutable.newOfflineGeneration, nowMillis);
			mutable.newOfflineActionId = scheduled.id();
		}
		_commitWithAction(mutable, scheduled);
		_commitRegionAfterPlayer(mutableRegion.freeze());
		if (isDead)
		{
			_casualties.cascadeDeath(player.id());
		}
		_events.eventPosted(WorldEvent.forPlayer(WorldEvent.Type.OFFLINE_MODE_RESOLVED, player.id(), regionId, detail));
	}

	private void _commitRegionAfterPlayer(Region region)
	{
		try
		{
			_world.commitRegion(region);
		}
		catch (TransientStoreException e)
		{
			// The players' outcome is already durable so it stands without the noise.
			System.out.println("WARNING:  Lost the noise update for " + region.id() + ": " + e.getMessage());
		}
	}

	private void _resolveAmbush(Player ambusher, Player target, String detail) throws TransientStoreException
	{
		String regionId = ambusher.position().regionId();
		CombatResolver.Result result = CombatResolver.resolve(CombatResolver.Combatant.forPlayer(ambusher, true)
				, CombatResolver.Combatant.forPlayer(target, false)
				, _world.config
				, _randomInt
		);
		MutablePlayer mutableAmbusher = MutablePlayer.existing(ambusher);
		mutableAmbusher.newHealth = result.challengerHealth();
		mutableAmbusher.newWeapon = result.challengerWeapon();
		mutableAmbusher.clearOfflineMode();
		MutablePlayer mutableTarget = MutablePlayer.existing(target);
		mutableTarget.newHealth = result.opponentHealth();
		mutableTarget.newWeapon = result.opponentWeapon();
		MutableRegion region = MutableRegion.existing(_world.getRegion(regionId));
		region.addNoise(_world.config.noisePerCombat);
		
		boolean ambusherDead = false;
		boolean targetDead = false;
		String outcome;
		switch (result.winner())
		{
		case CHALLENGER:
			targetDead = _casualties.applyDown(mutableTarget, "Ambushed by " + ambusher.name());
			outcome = "won";
			break;
		case OPPONENT:
			ambusherDead = _casualties.applyDown(mutableAmbusher, "Killed springing an ambush on " + target.name());
			outcome = "lost";
			break;
		case STALEMATE:
			outcome = "drew";
			break;
		default:
			throw Assert.unreachable();
		}
		
		_world.commitPlayer(mutableAmbusher.freeze());
		try
		{
			_world.commitPlayer(mutableTarget.freeze());
		}
		catch (TransientStoreException e)
		{
			// Put the ambusher back as they were, order and all, so the ambush can run again.
			_world.commitPlayer(ambusher);
			throw e;
		}
		_commitRegionAfterPlayer(region.freeze());
		if (Player.NO_ACTION != ambusher.offlineActionId())
		{
			try
			{
				_queue.cancel(ambusher.offlineActionId());
			}
			catch (TransientStoreException e)
			{
				// The generation has moved on so it is stale when it fires.
				System.out.println("WARNING:  Couldn't cancel offline resolution " + ambusher.offlineActionId() + ": " + e.getMessage());
			}
		}
		if (ambusherDead)
		{
			_casualties.cascadeDeath(ambusher.id());
		}
		if (targetDead)
		{
			_casualties.cascadeDeath(target.id());
		}
		_events.eventPosted(new WorldEvent(WorldEvent.Type.AMBUSH_TRIGGERED, ambusher.id(), target.id(), regionId, detail));
		_events.eventPosted(WorldEvent.forPlayer(WorldEvent.Type.OFFLINE_MODE_RESOLVED, ambusher.id(), regionId, "Ambush " + outcome + " against " + target.name()));
	}
}
