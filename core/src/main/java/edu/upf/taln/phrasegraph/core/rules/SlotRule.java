package edu.upf.taln.phrasegraph.core.rules;

import com.google.common.collect.ImmutableList;
import edu.upf.taln.phrasegraph.core.grammar.Component;
import edu.upf.taln.phrasegraph.core.tokens.Token;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Finder for the tokens of a controlled slot.
 * Regular rules inspect each child of a candidate head token; post-init rules inspect the component once it
 * is built. Rules marked as inherited from the lead are also applied to the children of the lead token of a
 * coordination chain when nothing was found locally.
 */
public final class SlotRule
{
	private final String name;
	private final Function<Token, List<Token>> child_finder;
	private final Function<Component, List<Token>> component_finder;
	private final boolean inherited;

	private SlotRule(String name, Function<Token, List<Token>> child_finder,
	                 Function<Component, List<Token>> component_finder, boolean inherited)
	{
		this.name = Objects.requireNonNull(name);
		this.child_finder = child_finder;
		this.component_finder = component_finder;
		this.inherited = inherited;
	}

	/**
	 * Rule returning the child itself when it satisfies a predicate.
	 */
	public static SlotRule token(String name, Predicate<Token> predicate)
	{
		return new SlotRule(name, t -> predicate.test(t) ? ImmutableList.of(t) : ImmutableList.of(), null, false);
	}

	public static SlotRule children(String name, Function<Token, List<Token>> finder)
	{
		return new SlotRule(name, finder, null, false);
	}

	public static SlotRule postInit(String name, Function<Component, List<Token>> finder)
	{
		return new SlotRule(name, null, finder, false);
	}

	public SlotRule inheritedFromLead()
	{
		if (isPostInit())
			throw new IllegalStateException("Post-init slot " + name + " cannot be inherited from lead");
		return new SlotRule(name, child_finder, null, true);
	}

	public String getName() { return name; }
	public boolean isPostInit() { return component_finder != null; }
	public boolean isInheritedFromLead() { return inherited; }

	public List<Token> find(Token child)
	{
		if (child_finder == null)
			throw new IllegalStateException("Slot " + name + " is found from components");
		return child_finder.apply(child);
	}

	public List<Token> find(Component comp)
	{
		if (component_finder == null)
			throw new IllegalStateException("Slot " + name + " is found from children tokens");
		return component_finder.apply(comp);
	}

	@Override
	public String toString() { return name + (isPostInit() ? " (post-init)" : inherited ? " (from lead)" : ""); }
}
