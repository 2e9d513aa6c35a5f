package edu.upf.taln.phrasegraph.core.structures;

import java.util.*;
import java.util.function.Supplier;

/**
 * Identity arena holding at most one canonical instance per key.
 * Creating an instance for a key already present updates the existing one in place and returns it.
 */
public class Registry<K extends Comparable<? super K>, V extends Registry.Canonical<K, V>>
{
	/**
	 * Objects whose identity is given by a key and which can absorb the contents of a newer instance.
	 */
	public interface Canonical<K, V>
	{
		K getKey();
		void updateFrom(V other);
	}

	private final Map<K, V> instances = new TreeMap<>();

	/**
	 * @param key key of the instance
	 * @param constructor creates a candidate instance with the given key
	 * @return the canonical instance for the key, updated with the candidate if it already existed
	 */
	public V getOrCreate(K key, Supplier<V> constructor)
	{
		final V candidate = constructor.get();
		if (!key.equals(candidate.getKey()))
			throw new IllegalArgumentException("Instance key " + candidate.getKey() + " does not match " + key);

		final V current = instances.get(key);
		if (current != null)
		{
			current.updateFrom(candidate);
			return current;
		}
		instances.put(key, candidate);
		return candidate;
	}

	public V put(V value)
	{
		return getOrCreate(value.getKey(), () -> value);
	}

	public Optional<V> get(K key) { return Optional.ofNullable(instances.get(key)); }
	public V require(K key)
	{
		final V v = instances.get(key);
		if (v == null)
			throw new NoSuchElementException("No instance registered for " + key);
		return v;
	}
	public boolean contains(K key) { return instances.containsKey(key); }
	public int size() { return instances.size(); }
	public boolean isEmpty() { return instances.isEmpty(); }
	public void clear() { instances.clear(); }
	public Set<K> keys() { return Collections.unmodifiableSet(instances.keySet()); }

	/**
	 * @return instances sorted by key
	 */
	public Collection<V> values() { return Collections.unmodifiableCollection(instances.values()); }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return instances.equals(((Registry<?, ?>) o).instances);
	}

	@Override
	public int hashCode() { return instances.hashCode(); }

	@Override
	public String toString() { return instances.values().toString(); }
}
