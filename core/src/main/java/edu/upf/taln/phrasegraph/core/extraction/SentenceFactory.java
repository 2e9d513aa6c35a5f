package edu.upf.taln.phrasegraph.core.extraction;

import edu.upf.taln.phrasegraph.core.grammar.Sentence;
import edu.upf.taln.phrasegraph.core.tokens.Span;

public interface SentenceFactory
{
	Sentence create(Span span);
}
