package edu.upf.taln.phrasegraph.core.grammar;

import edu.upf.taln.phrasegraph.core.symbols.Role;
import edu.upf.taln.phrasegraph.core.tokens.Token;

import java.util.Collection;
import java.util.List;

/**
 * Description component: adjectives, adverbs and possessives, with their modifiers.
 */
public class Desc extends Component
{
	public Desc(Sentence sentence, Token tok, Role role, Collection<SlotSpec> slots)
	{
		super(sentence, tok, role, slots);
	}

	@Override
	public ComponentType getType() { return ComponentType.DESC; }

	public List<Token> getMod() { return getSlot("mod"); }
	public Token getDet() { return getSlotToken("det"); }
}
