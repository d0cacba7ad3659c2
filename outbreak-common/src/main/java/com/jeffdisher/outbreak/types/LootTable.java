package com.jeffdisher.outbreak.types;

import java.util.List;


/**
 * A named loot table.  Each entry is rolled independently:  chancePercent to appear at all, then a count in
 * [minCount, maxCount].
 */
public record LootTable(String id, List<Entry> entries)
{
	public static record Entry(String item, int minCount, int maxCount, int chancePercent)
	{
	}
}
