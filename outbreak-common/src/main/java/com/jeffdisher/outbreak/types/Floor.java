package com.jeffdisher.outbreak.types;


public record Floor(int index, boolean cleared, String lootTableId)
{
}
