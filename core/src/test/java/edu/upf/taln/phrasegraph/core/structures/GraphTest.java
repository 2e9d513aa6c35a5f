package edu.upf.taln.phrasegraph.core.structures;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.Assert;
import org.junit.Test;

import java.util.*;

public class GraphTest
{
	private static Graph<Integer> diamond()
	{
		// 0 -> 1, 2 -> 3 plus isolated 4
		return Graph.fromLinks(List.of(Pair.of(0, 2), Pair.of(0, 1), Pair.of(1, 3), Pair.of(2, 3), Pair.of(4, null)));
	}

	@Test
	public void testFromLinks()
	{
		final Graph<Integer> g = diamond();
		Assert.assertEquals(5, g.size());
		Assert.assertEquals(List.of(1, 2), g.getChildren(0));
		Assert.assertEquals(List.of(), g.getChildren(3));
		Assert.assertEquals(List.of(1, 2), g.getParents(3));
		Assert.assertEquals(4, g.getLinks().size());
		Assert.assertEquals(List.of(4), g.getIsolates());
		Assert.assertEquals(List.of(0, 4), g.getSources());
	}

	@Test
	public void testDag()
	{
		final Graph<Integer> g = diamond();
		Assert.assertTrue(g.isDag());
		Assert.assertEquals(List.of(0, 1, 2, 3, 4), g.getTopologicalOrder());

		g.set(3, List.of(0));
		Assert.assertFalse(g.isDag());
		Assert.assertEquals(List.of(3), g.getParents(0));

		final Graph<Integer> loop = Graph.fromLinks(List.of(Pair.of(1, 1)));
		Assert.assertFalse(loop.isDag());
	}

	@Test(expected = IllegalStateException.class)
	public void testCyclicOrder()
	{
		Graph.fromLinks(List.of(Pair.of(1, 2), Pair.of(2, 1))).getTopologicalOrder();
	}

	@Test
	public void testHierarchy()
	{
		final List<Graph.Level<Integer>> levels = diamond().getHierarchy();
		Assert.assertEquals(5, levels.size());
		Assert.assertEquals(0, levels.get(0).depth);
		Assert.assertEquals(Integer.valueOf(1), levels.get(0).child);
		Assert.assertEquals(1, levels.get(1).depth);
		Assert.assertEquals(Integer.valueOf(3), levels.get(1).child);
		Assert.assertNull(levels.get(4).child);
		Assert.assertEquals(Integer.valueOf(4), levels.get(4).parent);

		Assert.assertEquals("0\n  1\n    3\n  2\n    3\n4", diamond().render(2));
	}

	@Test
	public void testMutableAndFreeze()
	{
		final Graph<Integer> g = diamond();
		final Map<Integer, SortedSet<Integer>> mutable = g.toMutable();
		mutable.get(0).remove(2);
		mutable.get(4).add(2);
		Assert.assertEquals(List.of(1, 2), g.getChildren(0));

		g.freeze(mutable);
		Assert.assertEquals(List.of(1), g.getChildren(0));
		Assert.assertEquals(List.of(4), g.getParents(2));
		Assert.assertTrue(g.getIsolates().isEmpty());
	}

	@Test
	public void testRemoveAndEquals()
	{
		final Graph<Integer> g = diamond();
		g.remove(4);
		g.remove(2);
		Assert.assertEquals(Graph.fromLinks(List.of(Pair.of(0, 1), Pair.of(1, 3))), g);
		Assert.assertNotEquals(diamond(), g);
	}
}
