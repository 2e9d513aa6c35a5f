package edu.upf.taln.phrasegraph.core.rules;

import edu.upf.taln.phrasegraph.core.grammar.Component;
import edu.upf.taln.phrasegraph.core.tokens.Token;

import java.util.List;

/**
 * Language-specific rules on coordination and subordination of components.
 */
public interface CoordinationRules
{
	/**
	 * @return tokens coordinated with the given one, excluding it, in textual order
	 */
	List<Token> getConjuncts(Token tok);

	/**
	 * @return first token of the coordination chain of tok that is not itself a conjunct, or tok
	 */
	Token getLead(Token tok);

	/**
	 * @return coordinating conjunction shared by both components, or null if they are not coordinated
	 * or coordinated without a conjunction
	 */
	Token getCconj(Component comp, Component other);

	/**
	 * @return pre-conjunction attached to the leftmost conjunct of a chain, or null
	 */
	Token getPreconj(Token leftmost);

	/**
	 * @return conjunction subordinating child to parent, or null
	 */
	Token getSconj(Component child, Component parent);

	default boolean areConjoined(Component comp, Component other)
	{
		return comp != other && getConjuncts(comp.getToken()).contains(other.getToken());
	}
}
