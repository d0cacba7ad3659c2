package com.jeffdisher.outbreak.persistence;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.outbreak.config.TabListReader.TabListException;
import com.jeffdisher.outbreak.types.Building;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.Vehicle;
import com.jeffdisher.outbreak.types.VehicleType;


public class TestWorldCatalogLoader
{
	@Test
	public void defaultWorld() throws Throwable
	{
		WorldCatalog catalog = WorldCatalogLoader.loadDefault();
		Assert.assertEquals(5, catalog.regions().size());
		Assert.assertEquals(6, catalog.buildings().size());
		Assert.assertEquals(4, catalog.vehicles().size());
		Assert.assertEquals(5, catalog.lootTables().size());
		
		Region forest = catalog.regions().get(0);
		Assert.assertEquals("forest", forest.id());
		Assert.assertEquals(List.of("urban", "coast"), forest.connections());
		Assert.assertEquals(List.of("ranger_station"), forest.buildingIds());
		Assert.assertEquals(0, forest.zombieCount());
		Assert.assertFalse(forest.isActive());
		
		// Every connection goes both ways in the default world.
		for (Region region : catalog.regions())
		{
			for (String connection : region.connections())
			{
				Region other = catalog.regions().stream().filter((Region candidate) -> candidate.id().equals(connection)).findFirst().get();
				Assert.assertTrue(other.isConnectedTo(region.id()));
			}
		}
		
		Building hospital = catalog.buildings().get(2);
		Assert.assertEquals("hospital", hospital.id());
		Assert.assertEquals(3, hospital.floors().size());
		Assert.assertEquals("city", hospital.floor(2).lootTableId());
		Assert.assertFalse(hospital.floor(2).cleared());
		
		Vehicle bike = catalog.vehicles().get(0);
		Assert.assertEquals(VehicleType.BIKE, bike.type());
		Assert.assertNull(bike.ownerId());
		Assert.assertFalse(bike.isTravelling());
	}

	@Test
	public void minimal() throws Throwable
	{
		WorldCatalog catalog = _load("loot\tbasic\n"
				+ "\titem\tnails\t1\t2\t100\n"
				+ "region\tonly\tOnly\t1\t5\tbasic\n"
				+ "building\tshed\tonly\tShed\n"
				+ "\tfloor\tbasic\n"
		);
		Assert.assertEquals(1, catalog.regions().size());
		Assert.assertEquals(List.of("shed"), catalog.regions().get(0).buildingIds());
		Assert.assertEquals("nails", catalog.lootTables().get("basic").entries().get(0).item());
	}

	@Test
	public void badReferences() throws Throwable
	{
		_expectError("Region \"a\" connects to unknown region \"b\""
				, "loot\tbasic\nregion\ta\tA\t1\t5\tbasic\n\tconnects\tb\n"
		);
		_expectError("Unknown loot table: \"missing\""
				, "region\ta\tA\t1\t5\tmissing\n"
		);
		_expectError("Building \"shed\" is in unknown region \"nowhere\""
				, "loot\tbasic\nbuilding\tshed\tnowhere\tShed\n\tfloor\tbasic\n"
		);
		_expectError("Building \"shed\" has no floors"
				, "loot\tbasic\nregion\ta\tA\t1\t5\tbasic\nbuilding\tshed\ta\tShed\n"
		);
		_expectError("Vehicle \"bike\" has more fuel than its capacity"
				, "vehicle\tbike\tBIKE\ta\t50\t1\n"
		);
		_expectError("Unknown record type: \"castle\""
				, "castle\tgrey\n"
		);
	}


	private static WorldCatalog _load(String text) throws Throwable
	{
		return WorldCatalogLoader.load(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
	}

	private static void _expectError(String message, String text) throws Throwable
	{
		try
		{
			_load(text);
			Assert.fail();
		}
		catch (TabListException e)
		{
			Assert.assertEquals(message, e.getMessage());
		}
	}
}
