package edu.upf.taln.phrasegraph.core.grammar;

import edu.upf.taln.phrasegraph.core.symbols.Role;
import edu.upf.taln.phrasegraph.core.tokens.Token;

import java.util.Collection;

public class Noun extends Component
{
	public Noun(Sentence sentence, Token tok, Role role, Collection<SlotSpec> slots)
	{
		super(sentence, tok, role, slots);
	}

	@Override
	public ComponentType getType() { return ComponentType.NOUN; }

	public Token getDet() { return getSlotToken("det"); }
}
