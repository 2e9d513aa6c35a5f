package edu.upf.taln.phrasegraph.core.structures;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.NoSuchElementException;

public class RegistryTest
{
	private static class Item implements Registry.Canonical<Integer, Item>
	{
		private final int key;
		private String value;

		Item(int key, String value)
		{
			this.key = key;
			this.value = value;
		}

		@Override
		public Integer getKey() { return key; }

		@Override
		public void updateFrom(Item other) { value = other.value; }
	}

	@Test
	public void testGetOrCreate()
	{
		final Registry<Integer, Item> registry = new Registry<>();
		final Item first = registry.getOrCreate(2, () -> new Item(2, "a"));
		final Item second = registry.getOrCreate(2, () -> new Item(2, "b"));

		Assert.assertSame(first, second);
		Assert.assertEquals("b", first.value);
		Assert.assertEquals(1, registry.size());
		Assert.assertSame(first, registry.put(new Item(2, "c")));
		Assert.assertEquals("c", first.value);
	}

	@Test
	public void testOrderAndLookup()
	{
		final Registry<Integer, Item> registry = new Registry<>();
		registry.put(new Item(5, "x"));
		registry.put(new Item(1, "y"));
		Assert.assertEquals(List.of(1, 5), List.copyOf(registry.keys()));
		Assert.assertEquals("y", registry.values().iterator().next().value);
		Assert.assertTrue(registry.get(3).isEmpty());
		Assert.assertTrue(registry.contains(5));

		registry.clear();
		Assert.assertTrue(registry.isEmpty());
	}

	@Test(expected = NoSuchElementException.class)
	public void testRequire()
	{
		new Registry<Integer, Item>().require(1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testKeyMismatch()
	{
		new Registry<Integer, Item>().getOrCreate(1, () -> new Item(2, "a"));
	}
}
