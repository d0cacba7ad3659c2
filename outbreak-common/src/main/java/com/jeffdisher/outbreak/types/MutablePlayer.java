package com.jeffdisher.outbreak.types;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.jeffdisher.outbreak.utils.Assert;


/**
 * A short-lived mutable view of a Player, used while an operation holds that player's lock.
 */
public class MutablePlayer
{
	public static MutablePlayer existing(Player player)
	{
		return new MutablePlayer(player);
	}


	private final Player _original;
	public Position newPosition;
	public int newHealth;
	public PlayerStats newStats;
	public final Map<String, Integer> newInventory;
	public Weapon newWeapon;
	public OfflineMode newOfflineMode;
	public int newOfflineGeneration;
	public long newOfflineActionId;
	public String newRadioFrequency;
	public PlayerStatus newStatus;

	private MutablePlayer(Player player)
	{
		_original = player;
		this.newPosition = player.position();
		this.newHealth = player.health();
		this.newStats = player.stats();
		this.newInventory = new TreeMap<>(player.inventory());
		this.newWeapon = player.weapon();
		this.newOfflineMode = player.offlineMode();
		this.newOfflineGeneration = player.offlineGeneration();
		this.newOfflineActionId = player.offlineActionId();
		this.newRadioFrequency = player.radioFrequency();
		this.newStatus = player.status();
	}

	public Player original()
	{
		return _original;
	}

	public int countOf(String item)
	{
		Integer count = this.newInventory.get(item);
		return (null != count)
				? count
				: 0
		;
	}

	public void addItems(Map<String, Integer> items)
	{
		for (Map.Entry<String, Integer> elt : items.entrySet())
		{
			Assert.assertTrue(elt.getValue() > 0);
			this.newInventory.merge(elt.getKey(), elt.getValue(), Integer::sum);
		}
	}

	/**
	 * Removes the given count of an item.
	 * 
	 * @return True if the items were removed, false if there weren't enough (in which case nothing changes).
	 */
	public boolean removeItems(String item, int count)
	{
		int existing = countOf(item);
		boolean didRemove = (existing >= count);
		if (didRemove)
		{
			if (existing == count)
			{
				this.newInventory.remove(item);
			}
			else
			{
				this.newInventory.put(item, existing - count);
			}
		}
		return didRemove;
	}

	/**
	 * Drops half (rounding up) of every stack, as a penalty for going down.
	 */
	public void loseHalfOfEachStack()
	{
		for (String item : this.newInventory.keySet().toArray((int size) -> new String[size]))
		{
			int remaining = this.newInventory.get(item) / 2;
			if (remaining > 0)
			{
				this.newInventory.put(item, remaining);
			}
			else
			{
				this.newInventory.remove(item);
			}
		}
	}

	/**
	 * Clears any standing order, invalidating whatever offline resolution might already be in flight.
	 */
	public void clearOfflineMode()
	{
		this.newOfflineMode = OfflineMode.NONE;
		this.newOfflineGeneration += 1;
		this.newOfflineActionId = Player.NO_ACTION;
	}

	public Player freeze()
	{
		Assert.assertTrue((this.newHealth >= 0) && (this.newHealth <= _original.maxHealth()));
		return new Player(_original.id()
				, _original.name()
				, _original.characterClass()
				, this.newPosition
				, this.newHealth
				, this.newStats
				, Collections.unmodifiableMap(new TreeMap<>(this.newInventory))
				, this.newWeapon
				, this.newOfflineMode
				, this.newOfflineGeneration
				, this.newOfflineActionId
				, this.newRadioFrequency
				, this.newStatus
		);
	}
}
