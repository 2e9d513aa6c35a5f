package edu.upf.taln.phrasegraph.core.rules;

import edu.upf.taln.phrasegraph.core.tokens.Token;

/**
 * Tests whether a token can head a component of some type.
 */
@FunctionalInterface
public interface HeadPredicate
{
	boolean isHead(Token tok);
}
