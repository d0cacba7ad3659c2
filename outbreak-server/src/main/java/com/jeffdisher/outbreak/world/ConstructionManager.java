package com.jeffdisher.outbreak.world;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import com.jeffdisher.outbreak.actions.IDroppedActionHandler;
import com.jeffdisher.outbreak.actions.IPendingActionHandler;
import com.jeffdisher.outbreak.actions.PendingAction;
import com.jeffdisher.outbreak.actions.PendingActionKind;
import com.jeffdisher.outbreak.actions.PendingActionQueue;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.types.ConstructionProject;
import com.jeffdisher.outbreak.types.MutablePlayer;
import com.jeffdisher.outbreak.types.MutableRegion;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.StructureType;
import com.jeffdisher.outbreak.types.Vehicle;
import com.jeffdisher.outbreak.types.WorldEvent;
import com.jeffdisher.outbreak.utils.Assert;


/**
 * Long-running construction projects.  A project consumes its resources up front and completes through a
 * CONSTRUCTION_COMPLETE pending action, game days later.  Each player can only run one project at a time.
 */
public class ConstructionManager implements IPendingActionHandler, IDroppedActionHandler
{
	public static final String ID_PREFIX_PROJECT = "project-";
	public static final String ID_PREFIX_VEHICLE = "built-";

	private final WorldState _world;
	private final PendingActionQueue _queue;
	private final IEventSink _events;

	public ConstructionManager(WorldState world, PendingActionQueue queue, IEventSink events)
	{
		_world = world;
		_queue = queue;
		_events = events;
	}

	/**
	 * Starts building a structure in the player's current region.
	 * 
	 * @param playerId The builder.
	 * @param structureName The StructureType name (case-insensitive).
	 * @param nowMillis The current time.
	 * @return The new project.
	 * @throws ValidationException The structure is unknown or the player doesn't meet its requirements.
	 * @throws ConflictException The player is busy (already building, in an encounter or travelling).
	 * @throws TransientStoreException The store failed (nothing changed).
	 */
	public ConstructionProject start(String playerId, String structureName, long nowMillis) throws ValidationException, ConflictException, TransientStoreException
	{
		StructureType type = parseStructure(structureName);
		try (EntityLocks.Held held = _world.lockPlayerInRegion(playerId))
		{
			Player player = _world.requireReady(playerId);
			if (!_world.constructionsOwnedBy(playerId).isEmpty())
			{
				throw new ConflictException("You are already building something.");
			}
			Region region = _world.getRegion(player.position().regionId());
			if (player.effectiveIntelligence() < type.intelligenceRequired)
			{
				throw new ValidationException("Building " + _displayName(type) + " needs intelligence " + type.intelligenceRequired + ".");
			}
			if ((null != type.requiredRegionId) && !type.requiredRegionId.equals(region.id()))
			{
				throw new ValidationException(_displayName(type) + " can only be built in " + type.requiredRegionId + ".");
			}
			if ((null == type.producedVehicle) && (StructureType.BARRICADE != type) && region.hasStructure(type))
			{
				throw new ValidationException(region.name() + " already has " + _displayName(type) + ".");
			}
			MutablePlayer mutable = MutablePlayer.existing(player);
			Map<String, Integer> missing = new TreeMap<>();
			for (Map.Entry<String, Integer> need : new TreeMap<>(type.resources).entrySet())
			{
				if (!mutable.removeItems(need.getKey(), need.getValue()))
				{
					missing.put(need.getKey(), need.getValue() - mutable.countOf(need.getKey()));
				}
			}
			if (!missing.isEmpty())
			{
				throw new ValidationException("Not enough materials, still missing " + missing + ".");
			}
			
			String projectId = _world.nextEntityId(ID_PREFIX_PROJECT);
			long due = nowMillis + _world.config.scaledMillis((long)type.days * _world.config.dayLengthSeconds);
			PendingAction completion = _queue.schedule(PendingActionKind.CONSTRUCTION_COMPLETE, playerId, projectId, due, Collections.emptyMap());
			ConstructionProject project = new ConstructionProject(projectId, playerId, type, region.id(), nowMillis, due, completion.id());
			try
			{
				_world.commitConstruction(project);
				try
				{
					_world.commitPlayer(mutable.freeze());
				}
				catch (TransientStoreException e)
				{
					_world.removeConstruction(projectId);
					throw e;
				}
			}
			catch (TransientStoreException e)
			{
				_queue.cancel(completion.id());
				throw e;
			}
			System.out.println("Construction started: " + projectId + " (" + type + " by " + playerId + ")");
			return project;
		}
	}

	@Override
	public void handle(PendingAction action, long nowMillis) throws TransientStoreException
	{
		Assert.assertTrue(PendingActionKind.CONSTRUCTION_COMPLETE == action.kind());
		ConstructionProject snapshot = _world.getConstruction(action.subjectId());
		if ((null == snapshot) || (snapshot.completionActionId() != action.id()))
		{
			System.out.println("Ignoring stale construction completion " + action.id());
			return;
		}
		try (EntityLocks.Held held = _world.locks.acquirePlayer(snapshot.ownerId(), snapshot.regionId()))
		{
			ConstructionProject project = _world.getConstruction(snapshot.id());
			if ((null == project) || (project.completionActionId() != action.id()))
			{
				System.out.println("Ignoring stale construction completion " + action.id());
				return;
			}
			StructureType type = project.type();
			MutableRegion region = MutableRegion.existing(_world.getRegion(project.regionId()));
			if (null != type.producedVehicle)
			{
				Vehicle vehicle = new Vehicle(_world.nextEntityId(ID_PREFIX_VEHICLE)
						, type.producedVehicle
						, project.ownerId()
						, project.regionId()
						, Vehicle.MAX_CONDITION
						, 0
						, null
						, Vehicle.NOT_TRAVELLING
				);
				_world.commitVehicle(vehicle);
			}
			else
			{
				if (StructureType.BARRICADE == type)
				{
					region.changeDanger(-1);
				}
				region.newStructures.add(type.name());
				_world.commitRegion(region.freeze());
			}
			
			Player owner = _world.getPlayer(project.ownerId());
			if ((null != owner) && owner.isAlive())
			{
				// Finishing a project teaches the builder something.
				MutablePlayer mutable = MutablePlayer.existing(owner);
				mutable.newStats = owner.stats().withIntelligence(owner.stats().intelligence() + (type.intelligenceRequired / 10));
				_world.commitPlayer(mutable.freeze());
			}
			_world.removeConstruction(project.id());
			_events.eventPosted(WorldEvent.forPlayer(WorldEvent.Type.CONSTRUCTION_COMPLETED, project.ownerId(), project.regionId(), _displayName(type) + " is complete"));
		}
	}

	/**
	 * The completion was lost before it ran.  The project is given a new completion on the next world tick.
	 */
	@Override
	public void dropped(PendingAction action, long nowMillis) throws TransientStoreException
	{
		Assert.assertTrue(PendingActionKind.CONSTRUCTION_COMPLETE == action.kind());
		ConstructionProject snapshot = _world.getConstruction(action.subjectId());
		if ((null != snapshot) && (snapshot.completionActionId() == action.id()))
		{
			try (EntityLocks.Held held = _world.locks.acquirePlayer(snapshot.ownerId(), snapshot.regionId()))
			{
				ConstructionProject project = _world.getConstruction(snapshot.id());
				if ((null != project) && (project.completionActionId() == action.id()))
				{
					long due = nowMillis + _world.config.scaledMillis(_world.config.worldTickSeconds);
					PendingAction completion = _queue.schedule(PendingActionKind.CONSTRUCTION_COMPLETE, project.ownerId(), project.id(), due, Collections.emptyMap());
					try
					{
						_world.commitConstruction(new ConstructionProject(project.id(), project.ownerId(), project.type(), project.regionId(), project.startMillis(), due, completion.id()));
					}
					catch (TransientStoreException e)
					{
						_queue.cancel(completion.id());
						throw e;
					}
					System.out.println("Rescheduled completion of " + project.id() + " after losing action " + action.id());
				}
			}
		}
	}

	public static StructureType parseStructure(String name) throws ValidationException
	{
		StructureType type = null;
		if (null != name)
		{
			for (StructureType candidate : StructureType.values())
			{
				if (candidate.name().equalsIgnoreCase(name))
				{
					type = candidate;
				}
			}
		}
		if (null == type)
		{
			throw new ValidationException("Unknown structure \"" + name + "\".");
		}
		return type;
	}


	private static String _displayName(StructureType type)
	{
		return type.name().toLowerCase(Locale.ROOT).replace('_', ' ');
	}
}
