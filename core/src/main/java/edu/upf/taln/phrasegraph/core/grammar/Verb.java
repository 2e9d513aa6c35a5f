package edu.upf.taln.phrasegraph.core.grammar;

import edu.upf.taln.phrasegraph.core.symbols.Modal;
import edu.upf.taln.phrasegraph.core.symbols.Mood;
import edu.upf.taln.phrasegraph.core.symbols.Role;
import edu.upf.taln.phrasegraph.core.symbols.Tense;
import edu.upf.taln.phrasegraph.core.tokens.Token;

import java.util.Collection;

/**
 * Verb component, with tense, modality and mood attributes.
 */
public class Verb extends Component
{
	public Verb(Sentence sentence, Token tok, Role role, Collection<SlotSpec> slots)
	{
		super(sentence, tok, role, slots);
		setAttribute("tense", Tense.PRESENT);
		setAttribute("modal", Modal.NULL);
		setAttribute("mood", Mood.REAL);
	}

	@Override
	public ComponentType getType() { return ComponentType.VERB; }

	public Tense getTense() { return (Tense) getAttribute("tense"); }
	public Modal getModal() { return (Modal) getAttribute("modal"); }
	public Mood getMood() { return (Mood) getAttribute("mood"); }
}
