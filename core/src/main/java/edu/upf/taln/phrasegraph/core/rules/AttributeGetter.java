package edu.upf.taln.phrasegraph.core.rules;

import edu.upf.taln.phrasegraph.core.grammar.Component;

/**
 * Derives the value of a component attribute, e.g. the tense of a verb, once its slots are filled.
 */
@FunctionalInterface
public interface AttributeGetter
{
	Enum<?> get(Component comp);
}
