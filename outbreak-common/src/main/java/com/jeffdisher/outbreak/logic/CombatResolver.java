package com.jeffdisher.outbreak.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Weapon;
import com.jeffdisher.outbreak.types.WeaponType;
import com.jeffdisher.outbreak.types.WorldConfig;
import com.jeffdisher.outbreak.types.ZombieStats;


/**
 * Resolves a fight between 2 combatants.  This has no state:  the outcome depends only on the inputs and the values
 * returned by the injected random source, so the same inputs and the same random stream always produce the same
 * result.
 * The "challenger" is whoever started the fight (the player entering a floor, the ambusher, the scavenger caught by a
 * zombie) and wins initiative ties.
 */
public class CombatResolver
{
	/**
	 * Runs the fight to completion:  one side at zero health, or maxCombatRounds rounds with both still standing.
	 * 
	 * @param challenger The side which started the fight.
	 * @param opponent The other side.
	 * @param config The config for combat tuning values.
	 * @param randomInt Returns a value in [0, bound) for a given bound.
	 * @return The outcome of the fight.
	 */
	public static Result resolve(Combatant challenger, Combatant opponent, WorldConfig config, IntUnaryOperator randomInt)
	{
		int jitter = config.initiativeJitter;
		int challengerInitiative = challenger.speed() + challenger.initiativeBonus() + _centered(randomInt, jitter);
		int opponentInitiative = opponent.speed() + opponent.initiativeBonus() + _centered(randomInt, jitter);
		boolean challengerFirst = (challengerInitiative >= opponentInitiative);
		
		_Fighter challengerState = new _Fighter(challenger, true);
		_Fighter opponentState = new _Fighter(opponent, false);
		_Fighter first = challengerFirst ? challengerState : opponentState;
		_Fighter second = challengerFirst ? opponentState : challengerState;
		
		List<Hit> hits = new ArrayList<>();
		for (int round = 0; round < config.maxCombatRounds; ++round)
		{
			hits.add(_strike(first, second, config, randomInt));
			if (0 == second.health)
			{
				break;
			}
			hits.add(_strike(second, first, config, randomInt));
			if (0 == first.health)
			{
				break;
			}
		}
		
		Winner winner;
		if (0 == opponentState.health)
		{
			winner = Winner.CHALLENGER;
		}
		else if (0 == challengerState.health)
		{
			winner = Winner.OPPONENT;
		}
		else
		{
			winner = Winner.STALEMATE;
		}
		return new Result(winner
				, challengerState.health
				, opponentState.health
				, challengerState.weapon
				, opponentState.weapon
				, Collections.unmodifiableList(hits)
				, challengerFirst
		);
	}

	/**
	 * Computes the damage of a single hit, after all bonuses and the defender's armor.  This is the only place damage
	 * is computed.
	 * 
	 * @param baseDamage The weapon (or unarmed) damage.
	 * @param damagePercent The attacker's class damage bonus.
	 * @param variation The already-rolled random variation.
	 * @param alerted True if the attacker is alerted.
	 * @param critical True if this hit is a critical.
	 * @param ambush True if this is the ambusher's first hit.
	 * @param defenderArmor The defender's flat armor.
	 * @param config Combat tuning values.
	 * @return The damage dealt (always at least 1).
	 */
	public static int hitDamage(int baseDamage
			, int damagePercent
			, int variation
			, boolean alerted
			, boolean critical
			, boolean ambush
			, int defenderArmor
			, WorldConfig config
	)
	{
		int raw = baseDamage + (baseDamage * damagePercent / 100) + variation;
		if (alerted)
		{
			raw += raw * config.alertedBonus / 100;
		}
		if (critical)
		{
			raw = raw * config.criticalMultiplier / 100;
		}
		if (ambush)
		{
			raw = raw * (100 + config.ambushBonus) / 100;
		}
		return Math.max(1, raw - defenderArmor);
	}


	private static Hit _strike(_Fighter attacker, _Fighter defender, WorldConfig config, IntUnaryOperator randomInt)
	{
		Weapon weapon = attacker.weapon;
		int baseDamage;
		boolean disabled = false;
		if (null == weapon)
		{
			baseDamage = config.unarmedDamage;
		}
		else if (!weapon.type().usesAmmo)
		{
			baseDamage = weapon.damage();
		}
		else if (weapon.ammo() > 0)
		{
			baseDamage = weapon.damage();
			attacker.weapon = weapon.withAmmo(weapon.ammo() - 1);
		}
		else if (weapon.type().disabledWhenEmpty)
		{
			baseDamage = 0;
			disabled = true;
		}
		else
		{
			baseDamage = config.unarmedDamage;
		}
		
		Hit hit;
		if (disabled)
		{
			hit = new Hit(attacker.isChallenger, 0, false, false, true);
		}
		else
		{
			int variation = _centered(randomInt, config.damageVariation);
			boolean critical = (randomInt.applyAsInt(100) < config.criticalHitChance);
			boolean ambush = attacker.ambushPending;
			attacker.ambushPending = false;
			int damage = hitDamage(baseDamage
					, attacker.source.damagePercent()
					, variation
					, attacker.source.alerted()
					, critical
					, ambush
					, defender.source.armor()
					, config
			);
			defender.health = Math.max(0, defender.health - damage);
			hit = new Hit(attacker.isChallenger, damage, critical, ambush, false);
		}
		return hit;
	}

	private static int _centered(IntUnaryOperator randomInt, int spread)
	{
		return randomInt.applyAsInt(2 * spread + 1) - spread;
	}


	/**
	 * One side of a fight.
	 * 
	 * @param health Health going into the fight (must be positive).
	 * @param armor Flat reduction applied to every hit received.
	 * @param speed Base initiative.
	 * @param initiativeBonus Class initiative bonus.
	 * @param damagePercent Class damage bonus, as a percentage of base damage.
	 * @param weapon The weapon (null means unarmed).
	 * @param alerted If true, every hit this side lands gets the alerted bonus.
	 * @param ambusher If true, this side's first landed hit gets the ambush bonus.
	 */
	public static record Combatant(int health
			, int armor
			, int speed
			, int initiativeBonus
			, int damagePercent
			, Weapon weapon
			, boolean alerted
			, boolean ambusher
	)
	{
		public static Combatant forPlayer(Player player, boolean ambusher)
		{
			return new Combatant(player.health()
					, player.stats().armor()
					, player.stats().speed()
					, player.characterClass().initiativeBonus
					, player.characterClass().damagePercent
					, player.weapon()
					, false
					, ambusher
			);
		}

		public static Combatant forZombie(ZombieStats zombie, boolean alerted)
		{
			return new Combatant(zombie.health()
					, zombie.armor()
					, zombie.speed()
					, 0
					, 0
					, new Weapon("claws", WeaponType.MELEE, zombie.damage(), 0)
					, alerted
					, false
			);
		}

		public Combatant withArmor(int armor)
		{
			return new Combatant(this.health, armor, this.speed, this.initiativeBonus, this.damagePercent, this.weapon, this.alerted, this.ambusher);
		}
	}

	public static record Hit(boolean byChallenger
			, int damage
			, boolean critical
			, boolean ambush
			, boolean weaponDisabled
	)
	{
	}

	/**
	 * The outcome of a fight.  The weapons are returned since ammo may have been used.
	 */
	public static record Result(Winner winner
			, int challengerHealth
			, int opponentHealth
			, Weapon challengerWeapon
			, Weapon opponentWeapon
			, List<Hit> hits
			, boolean challengerActedFirst
	)
	{
	}

	public static enum Winner
	{
		CHALLENGER,
		OPPONENT,
		STALEMATE,
	}

	private static class _Fighter
	{
		public final Combatant source;
		public final boolean isChallenger;
		public int health;
		public Weapon weapon;
		public boolean ambushPending;
		public _Fighter(Combatant source, boolean isChallenger)
		{
			this.source = source;
			this.isChallenger = isChallenger;
			this.health = source.health();
			this.weapon = source.weapon();
			this.ambushPending = source.ambusher();
		}
	}
}
