package edu.upf.taln.phrasegraph.core.rules.en;

import edu.upf.taln.phrasegraph.core.grammar.Component;
import edu.upf.taln.phrasegraph.core.rules.CoordinationRules;
import edu.upf.taln.phrasegraph.core.tokens.Token;

import java.util.ArrayList;
import java.util.List;

public class EnglishCoordinationRules implements CoordinationRules
{
	@Override
	public List<Token> getConjuncts(Token tok) { return EnglishTokens.conjuncts(tok); }

	@Override
	public Token getLead(Token tok) { return EnglishTokens.lead(tok); }

	/**
	 * First coordinating conjunction attached to any token of the conj chain shared by both components.
	 */
	@Override
	public Token getCconj(Component comp, Component other)
	{
		final List<Token> conjs = EnglishTokens.conjuncts(comp.getToken());
		if (!conjs.contains(other.getToken()))
			return null;

		final List<Token> chain = new ArrayList<>();
		chain.add(comp.getToken());
		chain.addAll(conjs);
		for (Token conj : chain)
		{
			for (Token child : conj.getChildren())
			{
				if (EnglishTokens.isCconj(child))
					return child;
			}
		}
		return null;
	}

	@Override
	public Token getPreconj(Token leftmost)
	{
		return leftmost.getLefts().stream()
				.filter(EnglishTokens::isPreconj)
				.findFirst()
				.orElse(null);
	}

	/**
	 * A subordinating conjunction among the tokens of the child, when the child is attached directly to the
	 * head of the parent.
	 */
	@Override
	public Token getSconj(Component child, Component parent)
	{
		if (!child.getToken().getHead().equals(parent.getToken()))
			return null;
		return child.getSubtokens().stream()
				.filter(EnglishTokens::isSconj)
				.findFirst()
				.orElse(null);
	}
}
