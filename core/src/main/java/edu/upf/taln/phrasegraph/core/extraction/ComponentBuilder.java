package edu.upf.taln.phrasegraph.core.extraction;

import edu.upf.taln.phrasegraph.core.grammar.Component;
import edu.upf.taln.phrasegraph.core.grammar.ComponentType;
import edu.upf.taln.phrasegraph.core.grammar.Sentence;
import edu.upf.taln.phrasegraph.core.grammar.SlotSpec;
import edu.upf.taln.phrasegraph.core.rules.Grammar;
import edu.upf.taln.phrasegraph.core.rules.SlotRule;
import edu.upf.taln.phrasegraph.core.symbols.Role;
import edu.upf.taln.phrasegraph.core.tokens.Token;

import java.util.*;

/**
 * Builds components from candidate head tokens with the rules of a grammar.
 */
public class ComponentBuilder
{
	private final Grammar grammar;

	public ComponentBuilder(Grammar grammar)
	{
		this.grammar = Objects.requireNonNull(grammar);
	}

	/**
	 * Builds a component of the given type headed by tok and registers it in the sentence.
	 * If the role dispatches to another type, the component is built as that type instead.
	 *
	 * @param role role of the component, or null for the default role of the type
	 * @return the canonical component, or null if tok is not a valid head for the type
	 */
	public Component build(Sentence sentence, Token tok, ComponentType type, Role role)
	{
		if (!grammar.isHead(type, tok))
			return null;

		final Role r = role != null ? role : type.getRole();
		final ComponentType resolved = grammar.dispatch(r, tok.getPOS(), type);
		if (resolved != type)
			return build(sentence, tok, resolved, role);

		final Map<String, List<Token>> found = findSlots(tok, type);
		final Component comp = type.create(sentence, tok, r, grammar.getSlots(type));
		found.forEach(comp::setSlot);

		for (SlotRule rule : grammar.getSlotRules(type))
		{
			if (rule.isPostInit())
				comp.setSlot(rule.getName(), rule.find(comp));
		}
		grammar.getGetters(type).forEach((name, getter) -> comp.setAttribute(name, getter.get(comp)));

		return sentence.addComponent(comp);
	}

	private Map<String, List<Token>> findSlots(Token tok, ComponentType type)
	{
		final Map<String, SlotSpec> specs = new LinkedHashMap<>();
		grammar.getSlots(type).forEach(s -> specs.put(s.getName(), s));
		final Map<String, List<Token>> found = new LinkedHashMap<>();

		// each child is claimed by the first rule that finds tokens in it
		for (Token child : tok.getChildren())
		{
			for (SlotRule rule : grammar.getSlotRules(type))
			{
				if (rule.isPostInit())
					continue;
				final List<Token> current = found.getOrDefault(rule.getName(), Collections.emptyList());
				if (!specs.get(rule.getName()).isMulti() && !current.isEmpty())
					continue;

				final List<Token> tokens = rule.find(child);
				if (!tokens.isEmpty())
				{
					final List<Token> slot = found.computeIfAbsent(rule.getName(), n -> new ArrayList<>());
					if (specs.get(rule.getName()).isMulti())
						slot.addAll(tokens);
					else
						slot.add(tokens.get(0));
					break;
				}
			}
		}

		final Token lead = grammar.getCoordination().getLead(tok);
		if (!lead.equals(tok))
		{
			for (SlotRule rule : grammar.getSlotRules(type))
			{
				if (!rule.isInheritedFromLead() || found.containsKey(rule.getName()))
					continue;
				lead.getChildren().stream()
						.map(rule::find)
						.filter(l -> !l.isEmpty())
						.findFirst()
						.ifPresent(l -> found.put(rule.getName(),
								specs.get(rule.getName()).isMulti() ? new ArrayList<>(l) : new ArrayList<>(l.subList(0, 1))));
			}
		}

		return found;
	}
}
