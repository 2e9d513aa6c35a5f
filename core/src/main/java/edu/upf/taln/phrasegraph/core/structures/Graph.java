package edu.upf.taln.phrasegraph.core.structures;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.tuple.Pair;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Directed graph stored as a mapping from nodes to their ordered children.
 * Meant to hold DAGs: acyclicity is not enforced but can be checked with {@link #isDag()}.
 * The reversed graph (children to parents) is memoized and dropped whenever the graph is modified.
 */
public class Graph<N extends Comparable<? super N>>
{
	private final Map<N, List<N>> data = new LinkedHashMap<>();
	private Graph<N> rev = null;
	private Boolean is_dag = null;

	/**
	 * One step of a depth-first walk over the graph hierarchy.
	 * The child is null for sources without children.
	 */
	public static final class Level<N>
	{
		public final int depth;
		public final N parent;
		public final N child;

		public Level(int depth, N parent, N child)
		{
			this.depth = depth;
			this.parent = parent;
			this.child = child;
		}

		@Override
		public String toString() { return depth + ": " + parent + " -> " + child; }
	}

	public Graph() {}

	public Graph(Map<N, ? extends Collection<N>> data)
	{
		data.forEach(this::set);
	}

	/**
	 * Builds a sorted graph from parent-child links. A link with a null child adds the parent as a node only.
	 */
	public static <N extends Comparable<? super N>> Graph<N> fromLinks(Iterable<Pair<N, N>> links)
	{
		final Map<N, List<N>> map = new LinkedHashMap<>();
		for (Pair<N, N> link : links)
		{
			final List<N> children = map.computeIfAbsent(link.getLeft(), k -> new ArrayList<>());
			if (link.getRight() != null)
			{
				if (!children.contains(link.getRight()))
					children.add(link.getRight());
				map.computeIfAbsent(link.getRight(), k -> new ArrayList<>());
			}
		}
		return sort(map);
	}

	private static <N extends Comparable<? super N>> Graph<N> sort(Map<N, ? extends Collection<N>> map)
	{
		final Map<N, List<N>> sorted = new TreeMap<>();
		map.forEach((k, v) -> sorted.put(k, v.stream().sorted().distinct().collect(Collectors.toList())));
		return new Graph<>(sorted);
	}

	public Graph<N> sorted() { return sort(data); }

	public int size() { return data.size(); }
	public boolean contains(N node) { return data.containsKey(node); }
	public Set<N> getNodes() { return Collections.unmodifiableSet(data.keySet()); }
	public Map<N, List<N>> asMap() { return Collections.unmodifiableMap(data); }

	public List<N> getChildren(N node)
	{
		return data.getOrDefault(node, ImmutableList.of());
	}

	public List<N> getParents(N node)
	{
		return getRev().getChildren(node);
	}

	public List<Pair<N, N>> getLinks()
	{
		return data.entrySet().stream()
				.flatMap(e -> e.getValue().stream().map(c -> Pair.of(e.getKey(), c)))
				.collect(Collectors.toList());
	}

	/**
	 * Sets the children of a node, adding any new nodes to the graph.
	 */
	public void set(N node, Collection<N> children)
	{
		data.put(node, ImmutableList.copyOf(children));
		children.forEach(c -> data.putIfAbsent(c, ImmutableList.of()));
		invalidate();
	}

	public void remove(N node)
	{
		data.remove(node);
		data.replaceAll((k, v) -> v.contains(node) ? v.stream()
				.filter(c -> !c.equals(node))
				.collect(ImmutableList.toImmutableList()) : v);
		invalidate();
	}

	/**
	 * @return a copy of the adjacency with mutable, sorted children sets
	 */
	public Map<N, SortedSet<N>> toMutable()
	{
		final Map<N, SortedSet<N>> mutable = new LinkedHashMap<>();
		data.forEach((k, v) -> mutable.put(k, new TreeSet<>(v)));
		return mutable;
	}

	/**
	 * Replaces the contents of this graph with sorted, immutable children lists and rebuilds the reversed graph.
	 */
	public void freeze(Map<N, ? extends Collection<N>> adjacency)
	{
		data.clear();
		new TreeMap<>(adjacency).forEach((k, v) -> data.put(k, v.stream()
				.sorted()
				.distinct()
				.collect(ImmutableList.toImmutableList())));
		invalidate();
		updateRev();
	}

	private void invalidate()
	{
		rev = null;
		is_dag = null;
	}

	public Graph<N> getRev()
	{
		if (rev == null)
			rev = computeRev();
		return rev;
	}

	public void updateRev()
	{
		rev = computeRev();
	}

	private Graph<N> computeRev()
	{
		final Map<N, List<N>> map = new LinkedHashMap<>();
		data.forEach((parent, children) ->
		{
			map.computeIfAbsent(parent, k -> new ArrayList<>());
			children.forEach(c -> map.computeIfAbsent(c, k -> new ArrayList<>()).add(parent));
		});
		return sort(map);
	}

	/**
	 * Nodes without parents nor children.
	 */
	public List<N> getIsolates()
	{
		final Graph<N> r = getRev();
		return data.keySet().stream()
				.filter(n -> getChildren(n).isEmpty() && r.getChildren(n).isEmpty())
				.sorted()
				.collect(Collectors.toList());
	}

	/**
	 * Nodes without parents, isolated ones included, in sorted order.
	 */
	public List<N> getSources()
	{
		final Graph<N> r = getRev();
		final Set<N> sources = new TreeSet<>(getIsolates());
		final Iterable<N> order = isDag() ? getTopologicalOrder() : data.keySet();
		for (N node : order)
		{
			if (r.getChildren(node).isEmpty())
				sources.add(node);
		}
		return new ArrayList<>(sources);
	}

	public boolean isDag()
	{
		if (is_dag == null)
		{
			final boolean self_loops = data.entrySet().stream().anyMatch(e -> e.getValue().contains(e.getKey()));
			is_dag = !self_loops && !new CycleDetector<>(toJGraphT()).detectCycles();
		}
		return is_dag;
	}

	/**
	 * @throws IllegalStateException if the graph has cycles
	 */
	public List<N> getTopologicalOrder()
	{
		if (!isDag())
			throw new IllegalStateException("Cannot sort a graph with cycles");

		final List<N> order = new ArrayList<>();
		new TopologicalOrderIterator<>(toJGraphT(), Comparator.<N>naturalOrder()).forEachRemaining(order::add);
		return order;
	}

	private DefaultDirectedGraph<N, DefaultEdge> toJGraphT()
	{
		final DefaultDirectedGraph<N, DefaultEdge> g = new DefaultDirectedGraph<>(DefaultEdge.class);
		data.keySet().forEach(g::addVertex);
		data.forEach((parent, children) -> children.forEach(c -> g.addEdge(parent, c)));
		return g;
	}

	/**
	 * Depth-first walk starting from each source. Every parent-child link reachable from a source is emitted
	 * with the depth of the parent; sources without children are emitted once with a null child.
	 */
	public List<Level<N>> getHierarchy()
	{
		final List<Level<N>> levels = new ArrayList<>();
		for (N source : getSources())
			walk(source, 0, levels);
		return levels;
	}

	private void walk(N parent, int depth, List<Level<N>> levels)
	{
		if (depth > data.size())
			throw new IllegalStateException("Graph hierarchy is cyclic at " + parent);

		final List<N> children = getChildren(parent);
		if (children.isEmpty() && depth == 0)
			levels.add(new Level<>(0, parent, null));
		for (N child : children)
		{
			levels.add(new Level<>(depth, parent, child));
			walk(child, depth + 1, levels);
		}
	}

	protected String getLabel(N node) { return String.valueOf(node); }
	protected String getChildLabel(N parent, N child) { return String.valueOf(child); }

	/**
	 * Renders the hierarchy with one node per line, children indented under their parents.
	 */
	public String render(int indent)
	{
		final String sep = Strings.repeat(" ", indent);
		final StringBuilder s = new StringBuilder();
		final Set<N> shown = new HashSet<>();
		for (Level<N> l : getHierarchy())
		{
			if (l.depth == 0 && shown.add(l.parent))
			{
				if (s.length() > 0)
					s.append("\n");
				s.append(getLabel(l.parent));
			}
			if (l.child != null)
				s.append("\n").append(Strings.repeat(sep, l.depth + 1)).append(getChildLabel(l.parent, l.child));
		}
		return s.toString();
	}

	@Override
	public String toString() { return render(4); }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return data.equals(((Graph<?>) o).data);
	}

	@Override
	public int hashCode() { return data.hashCode(); }
}
