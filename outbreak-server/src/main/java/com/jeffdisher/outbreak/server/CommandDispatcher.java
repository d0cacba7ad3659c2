package com.jeffdisher.outbreak.server;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.LongSupplier;

import com.jeffdisher.outbreak.encounter.Encounter;
import com.jeffdisher.outbreak.encounter.EncounterOutcome;
import com.jeffdisher.outbreak.logic.DayCycle;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.types.ConstructionProject;
import com.jeffdisher.outbreak.types.OfflineMode;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.StructureType;
import com.jeffdisher.outbreak.types.Vehicle;
import com.jeffdisher.outbreak.world.ConflictException;
import com.jeffdisher.outbreak.world.ConstructionManager;
import com.jeffdisher.outbreak.world.ValidationException;
import com.jeffdisher.outbreak.world.WorldState;


/**
 * The entry point for player commands, however they arrive.  Each command is a verb and its arguments, run on the
 * calling thread.  Every failure is turned into a short message:  validation and conflict messages are shown as-is,
 * store failures ask the player to retry and anything else is logged and reported without detail.
 */
public class CommandDispatcher
{
	private final WorldEngine _engine;
	private final LongSupplier _currentTimeMillisProvider;

	public CommandDispatcher(WorldEngine engine, LongSupplier currentTimeMillisProvider)
	{
		_engine = engine;
		_currentTimeMillisProvider = currentTimeMillisProvider;
	}

	/**
	 * Runs a single command for a player.
	 * 
	 * @param playerId The player issuing the command.
	 * @param verb The command name (case-insensitive).
	 * @param args The arguments (already split).
	 * @return The result to show the player.
	 */
	public CommandResult dispatch(String playerId, String verb, String[] args)
	{
		_Verb command = _Verb.fromName(verb);
		CommandResult result;
		if (null == command)
		{
			result = CommandResult.failed("Unknown command \"" + verb + "\".  Try help.");
		}
		else if ((command.joinsTrailingWords && (args.length < command.argNames.length))
				|| (!command.joinsTrailingWords && (args.length != command.argNames.length))
		)
		{
			result = CommandResult.failed("Usage:  " + command.usage());
		}
		else
		{
			long nowMillis = _currentTimeMillisProvider.getAsLong();
			try
			{
				result = CommandResult.ok(command.handler.run(_engine, playerId, _joinTrailing(command, args), nowMillis));
			}
			catch (ValidationException e)
			{
				result = CommandResult.failed(e.getMessage());
			}
			catch (ConflictException e)
			{
				result = CommandResult.failed(e.getMessage());
			}
			catch (TransientStoreException e)
			{
				System.out.println("WARNING:  Command " + command + " for " + playerId + " failed to save: " + e.getMessage());
				result = CommandResult.failed("The world is busy, try again.");
			}
			catch (RuntimeException e)
			{
				System.out.println("ERROR:  Command " + command + " for " + playerId + " failed");
				e.printStackTrace();
				result = CommandResult.failed("Something went wrong.");
			}
		}
		return result;
	}


	private static String[] _joinTrailing(_Verb command, String[] args)
	{
		String[] joined = args;
		int last = command.argNames.length - 1;
		if (command.joinsTrailingWords && (args.length > command.argNames.length))
		{
			joined = Arrays.copyOf(args, command.argNames.length);
			joined[last] = String.join(" ", Arrays.copyOfRange(args, last, args.length));
		}
		return joined;
	}

	private static int _readInt(String value, String description) throws ValidationException
	{
		try
		{
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e)
		{
			throw new ValidationException(description + " must be a number.");
		}
	}

	private static OfflineMode _readMode(String value) throws ValidationException
	{
		OfflineMode mode = null;
		for (OfflineMode candidate : OfflineMode.values())
		{
			if (candidate.name().equalsIgnoreCase(value))
			{
				mode = candidate;
			}
		}
		if (null == mode)
		{
			throw new ValidationException("Modes are none, ambush or scavenge.");
		}
		return mode;
	}

	private static String _describeOutcome(EncounterOutcome outcome)
	{
		String text;
		switch (outcome.finalState())
		{
		case CLEARED:
			text = "You killed the zombie and cleared the floor.";
			break;
		case FLED:
			text = (null == outcome.combat())
					? "You slipped past the zombie and out of the building."
					: "The fight dragged on so you retreated."
			;
			break;
		case PLAYER_DOWN:
			text = "The zombie took you down.";
			break;
		default:
			text = "The encounter ended (" + outcome.finalState() + ").";
			break;
		}
		Map<String, Integer> loot = outcome.loot();
		if (!loot.isEmpty())
		{
			text += "  Found: " + loot + ".";
		}
		return text + "  Health: " + outcome.player().health() + "/" + outcome.player().maxHealth();
	}

	private static String _status(WorldEngine engine, String playerId, long nowMillis) throws ValidationException
	{
		WorldState world = engine.world;
		Player player = world.getPlayer(playerId);
		if (null == player)
		{
			throw new ValidationException("You haven't joined the world.");
		}
		Region region = world.getRegion(player.position().regionId());
		long dayLength = world.config.scaledMillis(world.config.dayLengthSeconds);
		StringBuilder builder = new StringBuilder();
		builder.append(player.name()).append(" the ").append(player.characterClass().name().toLowerCase(Locale.ROOT));
		builder.append(" (").append(player.status()).append(")\n");
		builder.append("Health: ").append(player.health()).append("/").append(player.maxHealth()).append("\n");
		builder.append("Location: ").append(region.name());
		if (player.position().isInBuilding())
		{
			builder.append(", ").append(player.position().buildingId()).append(" floor ").append(player.position().floorIndex());
		}
		builder.append(" (danger ").append(region.danger()).append(", zombies ").append(region.zombieCount()).append(")\n");
		builder.append("Day ").append(DayCycle.dayNumber(nowMillis, world.getEpochMillis(), dayLength))
				.append(", ").append(world.phaseAt(nowMillis).name().toLowerCase(Locale.ROOT)).append("\n");
		builder.append("Weapon: ").append(player.weapon().name());
		if (player.weapon().type().usesAmmo)
		{
			builder.append(" (").append(player.weapon().ammo()).append(" ammo)");
		}
		builder.append("\n");
		builder.append("Inventory: ").append(player.inventory()).append("\n");
		builder.append("Orders: ").append(player.offlineMode().name().toLowerCase(Locale.ROOT));
		if (null != player.radioFrequency())
		{
			builder.append("\nRadio: ").append(player.radioFrequency());
		}
		Encounter encounter = world.getEncounter(playerId);
		if (null != encounter)
		{
			long secondsLeft = Math.max(0L, encounter.deadlineMillis() - nowMillis) / 1000L;
			builder.append("\nFacing a ").append(encounter.zombie().type().name().toLowerCase(Locale.ROOT))
					.append(" zombie, ").append(secondsLeft).append("s to decide");
		}
		for (ConstructionProject project : world.constructionsOwnedBy(playerId))
		{
			long minutesLeft = project.remainingMillis(nowMillis) / 60_000L;
			builder.append("\nBuilding ").append(project.type().name().toLowerCase(Locale.ROOT))
					.append(": ").append(minutesLeft).append(" minutes left");
		}
		for (Vehicle vehicle : world.vehiclesOwnedBy(playerId))
		{
			builder.append("\nVehicle ").append(vehicle.id()).append(" (").append(vehicle.type().name().toLowerCase(Locale.ROOT))
					.append(", condition ").append(vehicle.condition()).append(", fuel ").append(vehicle.fuel());
			if (vehicle.isTravelling())
			{
				builder.append(", heading to ").append(vehicle.destinationRegionId());
			}
			builder.append(")");
		}
		return builder.toString();
	}


	private static interface _VerbHandler
	{
		String run(WorldEngine engine, String playerId, String[] args, long nowMillis) throws ValidationException, ConflictException, TransientStoreException;
	}

	private static enum _Verb
	{
		HELP(new String[0], (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			StringBuilder builder = new StringBuilder("Commands:");
			for (_Verb verb : _Verb.values())
			{
				builder.append("\n  ").append(verb.usage());
			}
			return builder.toString();
		}),
		JOIN(new String[] {"name", "class"}, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			Player player = engine.regions.join(playerId, args[0], args[1]);
			return "Welcome, " + player.name() + ".  You are in " + player.position().regionId() + ".";
		}),
		STATUS(new String[0], (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			return _status(engine, playerId, nowMillis);
		}),
		MOVE(new String[] {"region"}, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			Player player = engine.regions.move(playerId, args[0]);
			return player.isAlive()
					? "You are now in " + player.position().regionId() + ".  Health: " + player.health() + "/" + player.maxHealth()
					: "You didn't survive the trip."
			;
		}),
		LOOT(new String[0], (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			Map<String, Integer> loot = engine.regions.loot(playerId);
			return loot.isEmpty()
					? "You found nothing."
					: "You found: " + loot
			;
		}),
		ENTER(new String[] {"building", "floor"}, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			int floor = _readInt(args[1], "Floor");
			Encounter encounter = engine.encounters.enterFloor(playerId, args[0], floor, nowMillis);
			long seconds = (encounter.deadlineMillis() - nowMillis) / 1000L;
			return "A " + encounter.zombie().type().name().toLowerCase(Locale.ROOT) + " zombie blocks the way (health "
					+ encounter.zombie().health() + ").  sneak or attack within " + seconds + "s!";
		}),
		SNEAK(new String[0], (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			return _describeOutcome(engine.encounters.sneak(playerId, nowMillis));
		}),
		ATTACK(new String[0], (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			return _describeOutcome(engine.encounters.attack(playerId, nowMillis));
		}),
		SETMODE(new String[] {"none|ambush|scavenge"}, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			Player player = engine.offline.setMode(playerId, _readMode(args[0]), nowMillis);
			return "Orders set to " + player.offlineMode().name().toLowerCase(Locale.ROOT) + ".";
		}),
		BUILD(new String[] {"structure"}, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			ConstructionProject project = engine.constructions.start(playerId, args[0], nowMillis);
			StructureType type = ConstructionManager.parseStructure(args[0]);
			return "Started building " + type.name().toLowerCase(Locale.ROOT) + " (" + type.days + " days).  Project " + project.id() + ".";
		}),
		CLAIM(new String[] {"vehicle"}, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			Vehicle vehicle = engine.vehicles.claim(playerId, args[0]);
			return "The " + vehicle.type().name().toLowerCase(Locale.ROOT) + " is yours.";
		}),
		TRAVEL(new String[] {"vehicle", "region"}, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			Vehicle vehicle = engine.vehicles.travel(playerId, args[0], args[1], nowMillis);
			return "On the way to " + vehicle.destinationRegionId() + ".";
		}),
		REPAIR(new String[] {"vehicle"}, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			Vehicle vehicle = engine.vehicles.repair(playerId, args[0]);
			return "Condition is now " + vehicle.condition() + ".";
		}),
		REFUEL(new String[] {"vehicle", "amount"}, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			Vehicle vehicle = engine.vehicles.refuel(playerId, args[0], _readInt(args[1], "Amount"));
			return "Fuel is now " + vehicle.fuel() + "/" + vehicle.type().fuelCapacity + ".";
		}),
		SETFREQ(new String[] {"frequency"}, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			Player player = engine.regions.setFrequency(playerId, args[0]);
			return "Radio tuned to " + player.radioFrequency() + ".";
		}),
		RADIO(new String[] {"message"}, true, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			int listeners = engine.intel.radio(playerId, args[0]);
			return (1 == listeners)
					? "1 listener heard you."
					: listeners + " listeners heard you."
			;
		}),
		SPOT(new String[] {"player"}, (WorldEngine engine, String playerId, String[] args, long nowMillis) -> {
			return engine.intel.spot(playerId, args[0], nowMillis);
		}),
		;
		
		public final String[] argNames;
		// The last argument takes the rest of the words on the line.
		public final boolean joinsTrailingWords;
		public final _VerbHandler handler;
		
		private _Verb(String[] argNames, _VerbHandler handler)
		{
			this(argNames, false, handler);
		}
		
		private _Verb(String[] argNames, boolean joinsTrailingWords, _VerbHandler handler)
		{
			this.argNames = argNames;
			this.joinsTrailingWords = joinsTrailingWords;
			this.handler = handler;
		}
		
		public String usage()
		{
			StringBuilder builder = new StringBuilder(name().toLowerCase(Locale.ROOT));
			for (String arg : this.argNames)
			{
				builder.append(" <").append(arg).append(">");
			}
			if (this.joinsTrailingWords)
			{
				builder.append("...");
			}
			return builder.toString();
		}
		
		public static _Verb fromName(String name)
		{
			_Verb found = null;
			for (_Verb verb : _Verb.values())
			{
				if (verb.name().equalsIgnoreCase(name))
				{
					found = verb;
				}
			}
			return found;
		}
	}
}
