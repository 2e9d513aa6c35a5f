package edu.upf.taln.phrasegraph.core.grammar;

import java.util.Objects;

/**
 * Declaration of a controlled token slot of a component: a name and whether it holds one or several tokens.
 */
public final class SlotSpec
{
	private final String name;
	private final boolean multi;

	public SlotSpec(String name, boolean multi)
	{
		if (name == null || name.isEmpty())
			throw new IllegalArgumentException("Slot name cannot be empty");
		if (name.equals("tok") || name.equals("sub") || name.equals("role") || name.startsWith("@"))
			throw new IllegalArgumentException("Reserved slot name " + name);
		this.name = name;
		this.multi = multi;
	}

	public static SlotSpec single(String name) { return new SlotSpec(name, false); }
	public static SlotSpec multi(String name) { return new SlotSpec(name, true); }

	public String getName() { return name; }
	public boolean isMulti() { return multi; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SlotSpec other = (SlotSpec) o;
		return multi == other.multi && name.equals(other.name);
	}

	@Override
	public int hashCode() { return Objects.hash(name, multi); }

	@Override
	public String toString() { return multi ? name + "*" : name; }
}
