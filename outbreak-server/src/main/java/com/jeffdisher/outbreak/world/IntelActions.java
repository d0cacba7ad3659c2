package com.jeffdisher.outbreak.world;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.StructureType;
import com.jeffdisher.outbreak.types.WorldEvent;


/**
 * What players learn about each other from a distance:  anonymous radio traffic (sent through a radio tower) and
 * spotting another player's whereabouts.
 * Spotter cooldowns are only kept in memory so a restart makes every spotter ready again.
 */
public class IntelActions
{
	public static final int MAX_RADIO_MESSAGE_LENGTH = 500;

	private final WorldState _world;
	private final IEventSink _events;
	// Guarded by the spotting player's lock.
	private final Map<String, Long> _lastSpotMillis;

	public IntelActions(WorldState world, IEventSink events)
	{
		_world = world;
		_events = events;
		_lastSpotMillis = new HashMap<>();
	}

	/**
	 * Broadcasts a message to every other living player tuned to the sender's frequency.  The sender must be standing
	 * in a region with a radio tower and listeners only learn the frequency, never who sent it.
	 * 
	 * @param senderId The player transmitting.
	 * @param message The text to send.
	 * @return The number of players who received the message.
	 * @throws ValidationException The message is empty or too long, or the sender can't transmit.
	 * @throws ConflictException The sender is busy.
	 */
	public int radio(String senderId, String message) throws ValidationException, ConflictException
	{
		String text = (null != message)
				? message.strip()
				: ""
		;
		if (text.isEmpty() || (text.length() > MAX_RADIO_MESSAGE_LENGTH))
		{
			throw new ValidationException("Radio messages must be 1 to " + MAX_RADIO_MESSAGE_LENGTH + " characters.");
		}
		String frequency;
		String regionId;
		try (EntityLocks.Held held = _world.lockPlayerInRegion(senderId))
		{
			Player sender = _world.requireReady(senderId);
			frequency = sender.radioFrequency();
			if (null == frequency)
			{
				throw new ValidationException("Tune your radio first (setfreq).");
			}
			regionId = sender.position().regionId();
			Region region = _world.getRegion(regionId);
			if (!region.hasStructure(StructureType.RADIO_TOWER))
			{
				throw new ValidationException("You need a radio tower in " + region.name() + " to transmit.");
			}
		}
		
		List<String> listeners = new ArrayList<>();
		for (String playerId : _world.playerIds())
		{
			Player listener = _world.getPlayer(playerId);
			if (!playerId.equals(senderId)
					&& (null != listener)
					&& listener.isAlive()
					&& frequency.equals(listener.radioFrequency())
			)
			{
				listeners.add(playerId);
			}
		}
		if (listeners.isEmpty())
		{
			throw new ValidationException("No one is listening on " + frequency + ".");
		}
		String detail = "anon@" + frequency + ": " + text;
		for (String listenerId : listeners)
		{
			_events.eventPosted(new WorldEvent(WorldEvent.Type.RADIO_MESSAGE, listenerId, null, regionId, detail));
		}
		System.out.println("Radio message from " + senderId + " on " + frequency + " reached " + listeners.size() + " listeners");
		return listeners.size();
	}

	/**
	 * Reports where another player is and how they are doing.  Each player can only spot once per cooldown period.
	 * 
	 * @param spotterId The player looking.
	 * @param targetId The player being spotted.
	 * @param nowMillis The current time.
	 * @return A short report on the target.
	 * @throws ValidationException The target doesn't exist or the spotter is still cooling down.
	 * @throws ConflictException The spotter is busy.
	 */
	public String spot(String spotterId, String targetId, long nowMillis) throws ValidationException, ConflictException
	{
		try (EntityLocks.Held held = _world.lockPlayerInRegion(spotterId))
		{
			_world.requireReady(spotterId);
			if (spotterId.equals(targetId))
			{
				throw new ValidationException("You can't spot yourself.");
			}
			Player target = _world.getPlayer(targetId);
			if (null == target)
			{
				throw new ValidationException("There is no player \"" + targetId + "\".");
			}
			long cooldownMillis = _world.config.scaledMillis(_world.config.spotCooldownSeconds);
			Long lastMillis = _lastSpotMillis.get(spotterId);
			if ((null != lastMillis) && ((nowMillis - lastMillis) < cooldownMillis))
			{
				long secondsLeft = (cooldownMillis - (nowMillis - lastMillis) + 999L) / 1000L;
				throw new ValidationException("Your spotter is cooling down (" + secondsLeft + "s left).");
			}
			_lastSpotMillis.put(spotterId, nowMillis);
			
			StringBuilder report = new StringBuilder();
			report.append(target.name()).append(" (").append(target.status()).append("):  ");
			report.append(_world.getRegion(target.position().regionId()).name());
			if (target.position().isInBuilding())
			{
				report.append(", inside ").append(target.position().buildingId());
			}
			report.append(", health ").append(target.health()).append("/").append(target.maxHealth());
			report.append(", orders ").append(target.offlineMode().name().toLowerCase(Locale.ROOT));
			return report.toString();
		}
	}
}
