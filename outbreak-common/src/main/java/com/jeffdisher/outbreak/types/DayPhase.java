package com.jeffdisher.outbreak.types;


public enum DayPhase
{
	DAY,
	NIGHT,
}
