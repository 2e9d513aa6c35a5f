package edu.upf.taln.phrasegraph.core.symbols;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Relation between a child phrase and its parent, stored as a combinable bitmask.
 * Names follow a fixed order; several relations are written joined by "|", and a leading "~" negates
 * the set within the universe of known relations.
 */
public final class Dep implements Serializable
{
	private static final List<String> names = ImmutableList.of(
			"root", "subj", "dobj", "iobj", "pobj", "prep", "subcl", "relcl", "acl", "xcomp",
			"desc", "adesc", "cdesc", "nmod", "appos", "agent", "conj", "misc");
	private static final int all_mask = (1 << names.size()) - 1;
	private final static long serialVersionUID = 1L;

	public static final Dep NONE = new Dep(0);
	public static final Dep ROOT = flag("root");
	public static final Dep SUBJ = flag("subj");   // subject
	public static final Dep DOBJ = flag("dobj");   // direct object
	public static final Dep IOBJ = flag("iobj");   // indirect object
	public static final Dep POBJ = flag("pobj");   // prepositional object
	public static final Dep PREP = flag("prep");   // preposition
	public static final Dep SUBCL = flag("subcl"); // subordinate clause
	public static final Dep RELCL = flag("relcl"); // relative clause
	public static final Dep ACL = flag("acl");     // adnominal clause
	public static final Dep XCOMP = flag("xcomp"); // open clausal complement
	public static final Dep DESC = flag("desc");   // description
	public static final Dep ADESC = flag("adesc"); // adjectival complement description
	public static final Dep CDESC = flag("cdesc"); // clausal description
	public static final Dep NMOD = flag("nmod");   // nominal modifier
	public static final Dep APPOS = flag("appos"); // appositive
	public static final Dep AGENT = flag("agent"); // passive agent
	public static final Dep CONJ = flag("conj");   // coordinate
	public static final Dep MISC = flag("misc");   // anything else
	public static final Dep ALL = new Dep(all_mask);

	private final int mask;

	private Dep(int mask)
	{
		this.mask = mask;
	}

	private static Dep flag(String name)
	{
		return new Dep(1 << names.indexOf(name));
	}

	public static Dep of(int mask)
	{
		if ((mask & ~all_mask) != 0)
			throw new IllegalArgumentException("Invalid relation mask " + Integer.toBinaryString(mask));
		return new Dep(mask);
	}

	/**
	 * Parses a relation name such as "subj", "subj|dobj" or "~conj".
	 */
	public static Dep fromName(String name)
	{
		if (name == null)
			throw new IllegalArgumentException("Relation name cannot be null");

		String s = name.trim().toLowerCase();
		boolean negate = s.startsWith("~");
		if (negate)
			s = s.substring(1);

		int mask = 0;
		if (!s.isEmpty())
		{
			for (String part : Splitter.on('|').trimResults().split(s))
			{
				int bit = names.indexOf(part);
				if (bit < 0)
					throw new IllegalArgumentException("Unknown relation '" + part + "' in '" + name + "'");
				mask |= 1 << bit;
			}
		}

		return new Dep(negate ? ~mask & all_mask : mask);
	}

	public int getMask() { return mask; }
	public boolean isEmpty() { return mask == 0; }
	public Dep or(Dep other) { return new Dep(mask | other.mask); }
	public Dep and(Dep other) { return new Dep(mask & other.mask); }
	public Dep without(Dep other) { return new Dep(mask & ~other.mask); }
	public Dep not() { return new Dep(~mask & all_mask); }

	/**
	 * @return true if this relation shares at least one flag with other
	 */
	public boolean has(Dep other) { return (mask & other.mask) != 0; }

	/**
	 * @return true if every flag of other is set in this relation
	 */
	public boolean contains(Dep other) { return (mask & other.mask) == other.mask; }

	public List<String> getNames()
	{
		List<String> set = new ArrayList<>();
		for (int i = 0; i < names.size(); ++i)
		{
			if ((mask & (1 << i)) != 0)
				set.add(names.get(i));
		}
		return set;
	}

	public String getName()
	{
		return Joiner.on('|').join(getNames());
	}

	/**
	 * Role used when rendering the head of a phrase attached through this relation.
	 */
	public Role getRole()
	{
		for (String name : getNames())
		{
			if (name.contains("subj"))
				return Role.SUBJ;
			if (name.equals("dobj"))
				return Role.DOBJ;
			if (name.equals("iobj"))
				return Role.IOBJ;
			if (name.equals("pobj"))
				return Role.POBJ;
			if (name.contains("desc"))
				return Role.DESC;
			if (name.endsWith("cl"))
				return Role.VERB;
			if (name.equals("nmod") || name.equals("appos"))
				return Role.NOUN;
			if (name.equals("agent") || name.equals("prep"))
				return Role.PREP;
		}
		return null;
	}

	@Override
	public String toString() { return getName(); }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return mask == ((Dep) o).mask;
	}

	@Override
	public int hashCode() { return Integer.hashCode(mask); }
}
