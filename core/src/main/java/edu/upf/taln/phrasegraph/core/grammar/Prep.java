package edu.upf.taln.phrasegraph.core.grammar;

import edu.upf.taln.phrasegraph.core.symbols.Role;
import edu.upf.taln.phrasegraph.core.tokens.Token;

import java.util.Collection;
import java.util.List;

public class Prep extends Component
{
	public Prep(Sentence sentence, Token tok, Role role, Collection<SlotSpec> slots)
	{
		super(sentence, tok, role, slots);
	}

	@Override
	public ComponentType getType() { return ComponentType.PREP; }

	/**
	 * @return chain of prepositions attached to the head token, e.g. "of" in "out of"
	 */
	public List<Token> getPreps() { return getSlot("preps"); }
}
