package com.jeffdisher.outbreak.logic;

import java.util.Random;
import java.util.function.IntUnaryOperator;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.outbreak.types.CharacterClass;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Weapon;
import com.jeffdisher.outbreak.types.WeaponType;
import com.jeffdisher.outbreak.types.WorldConfig;
import com.jeffdisher.outbreak.types.ZombieStats;
import com.jeffdisher.outbreak.types.ZombieType;


public class TestCombatResolver
{
	// Always lands in the middle of the range:  no jitter, no variation, and never critical.
	private static final IntUnaryOperator CENTERED = (int bound) -> bound / 2;

	@Test
	public void soldierAgainstArmouredZombie() throws Throwable
	{
		// 20 base, +10% for the soldier, minus 15 armor.
		WorldConfig config = new WorldConfig();
		Assert.assertEquals(7, CombatResolver.hitDamage(20, 10, 0, false, false, false, 15, config));
		
		Player soldier = Player.create("p1", "Sol", CharacterClass.SOLDIER, "forest");
		CombatResolver.Combatant player = CombatResolver.Combatant.forPlayer(soldier, false);
		CombatResolver.Combatant zombie = CombatResolver.Combatant.forZombie(new ZombieStats(ZombieType.NORMAL, 21, 3, 15, 1), false);
		CombatResolver.Result result = CombatResolver.resolve(player, zombie, config, CENTERED);
		
		Assert.assertTrue(result.challengerActedFirst());
		Assert.assertEquals(CombatResolver.Winner.CHALLENGER, result.winner());
		// 3 hits of 7 from the player, 2 hits of the 1 damage minimum from the zombie.
		Assert.assertEquals(5, result.hits().size());
		for (CombatResolver.Hit hit : result.hits())
		{
			int expected = hit.byChallenger() ? 7 : 1;
			Assert.assertEquals(expected, hit.damage());
		}
		Assert.assertEquals(108, result.challengerHealth());
		Assert.assertEquals(0, result.opponentHealth());
		Assert.assertEquals(9, result.challengerWeapon().ammo());
	}

	@Test
	public void sameRandomStreamSameFight() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		CombatResolver.Combatant player = CombatResolver.Combatant.forPlayer(Player.create("p1", "Sam", CharacterClass.SCAVENGER, "forest"), false);
		CombatResolver.Combatant zombie = CombatResolver.Combatant.forZombie(new ZombieStats(ZombieType.TANK, 80, 12, 4, 4), true);
		Random first = new Random(42L);
		Random second = new Random(42L);
		CombatResolver.Result one = CombatResolver.resolve(player, zombie, config, (int bound) -> first.nextInt(bound));
		CombatResolver.Result two = CombatResolver.resolve(player, zombie, config, (int bound) -> second.nextInt(bound));
		Assert.assertEquals(one, two);
	}

	@Test
	public void ambushAppliesToFirstHitOnly() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		CombatResolver.Combatant ambusher = CombatResolver.Combatant.forPlayer(Player.create("a", "Ambusher", CharacterClass.SOLDIER, "forest"), true);
		CombatResolver.Combatant target = CombatResolver.Combatant.forPlayer(Player.create("t", "Target", CharacterClass.SOLDIER, "forest"), false);
		CombatResolver.Result result = CombatResolver.resolve(ambusher, target, config, CENTERED);
		
		// Equal initiative goes to the challenger.
		Assert.assertTrue(result.challengerActedFirst());
		CombatResolver.Hit opening = result.hits().get(0);
		Assert.assertTrue(opening.byChallenger());
		Assert.assertTrue(opening.ambush());
		// 22 doubled, minus 5 armor.
		Assert.assertEquals(39, opening.damage());
		int ambushCount = 0;
		for (CombatResolver.Hit hit : result.hits())
		{
			if (hit.ambush())
			{
				ambushCount += 1;
			}
			else
			{
				Assert.assertEquals(17, hit.damage());
			}
		}
		Assert.assertEquals(1, ambushCount);
		Assert.assertEquals(CombatResolver.Winner.CHALLENGER, result.winner());
		Assert.assertEquals(25, result.challengerHealth());
	}

	@Test
	public void emptyFirearmFallsBackToUnarmed() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		CombatResolver.Combatant shooter = new CombatResolver.Combatant(100, 0, 10, 0, 0, new Weapon("gun", WeaponType.FIREARM, 20, 1), false, false);
		CombatResolver.Combatant wall = new CombatResolver.Combatant(1000, 0, 1, 0, 0, new Weapon("claws", WeaponType.MELEE, 1, 0), false, false);
		CombatResolver.Result result = CombatResolver.resolve(shooter, wall, config, CENTERED);
		
		Assert.assertEquals(20, result.hits().get(0).damage());
		Assert.assertEquals(config.unarmedDamage, result.hits().get(2).damage());
		Assert.assertFalse(result.hits().get(2).weaponDisabled());
		Assert.assertEquals(0, result.challengerWeapon().ammo());
		// Nobody goes down within the round limit.
		Assert.assertEquals(CombatResolver.Winner.STALEMATE, result.winner());
		Assert.assertEquals(2 * config.maxCombatRounds, result.hits().size());
		Assert.assertEquals(50, result.challengerHealth());
	}

	@Test
	public void emptyLauncherIsDisabled() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		CombatResolver.Combatant shooter = new CombatResolver.Combatant(100, 0, 10, 0, 0, new Weapon("rpg", WeaponType.LAUNCHER, 20, 1), false, false);
		CombatResolver.Combatant wall = new CombatResolver.Combatant(1000, 0, 1, 0, 0, new Weapon("claws", WeaponType.MELEE, 1, 0), false, false);
		CombatResolver.Result result = CombatResolver.resolve(shooter, wall, config, CENTERED);
		
		CombatResolver.Hit empty = result.hits().get(2);
		Assert.assertTrue(empty.weaponDisabled());
		Assert.assertEquals(0, empty.damage());
		Assert.assertEquals(1000 - 20, result.opponentHealth());
	}

	@Test
	public void unarmed() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		CombatResolver.Combatant fists = new CombatResolver.Combatant(100, 0, 10, 0, 0, null, false, false);
		CombatResolver.Combatant zombie = CombatResolver.Combatant.forZombie(new ZombieStats(ZombieType.NORMAL, 10, 1, 0, 1), false);
		CombatResolver.Result result = CombatResolver.resolve(fists, zombie, config, CENTERED);
		Assert.assertEquals(config.unarmedDamage, result.hits().get(0).damage());
		Assert.assertEquals(CombatResolver.Winner.CHALLENGER, result.winner());
		Assert.assertNull(result.challengerWeapon());
	}

	@Test
	public void bonusesStack() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		// Alerted:  20 + 15%.
		Assert.assertEquals(23, CombatResolver.hitDamage(20, 0, 0, true, false, false, 0, config));
		// Critical:  22 * 150%, minus 15 armor.
		Assert.assertEquals(18, CombatResolver.hitDamage(20, 10, 0, false, true, false, 15, config));
		// Variation is applied before the multipliers.
		Assert.assertEquals(25, CombatResolver.hitDamage(20, 0, 5, false, false, false, 0, config));
		// Armor can't reduce a hit below 1.
		Assert.assertEquals(1, CombatResolver.hitDamage(1, 0, 0, false, false, false, 100, config));
	}

	@Test
	public void criticalRolls() throws Throwable
	{
		// Every roll at 0 means minimum jitter and variation, and every hit is critical.
		WorldConfig config = new WorldConfig();
		CombatResolver.Combatant player = new CombatResolver.Combatant(100, 0, 10, 0, 0, new Weapon("bat", WeaponType.MELEE, 20, 0), false, false);
		CombatResolver.Combatant zombie = CombatResolver.Combatant.forZombie(new ZombieStats(ZombieType.NORMAL, 100, 1, 0, 1), false);
		CombatResolver.Result result = CombatResolver.resolve(player, zombie, config, (int bound) -> 0);
		CombatResolver.Hit first = result.hits().get(0);
		Assert.assertTrue(first.critical());
		// (20 - 5) * 150%.
		Assert.assertEquals(22, first.damage());
	}
}
