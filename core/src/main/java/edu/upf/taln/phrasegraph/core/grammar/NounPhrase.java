package edu.upf.taln.phrasegraph.core.grammar;

import edu.upf.taln.phrasegraph.core.symbols.Dep;
import edu.upf.taln.phrasegraph.core.tokens.Token;

public class NounPhrase extends Phrase
{
	public NounPhrase(Sentence sentence, Token tok, Dep dep, Token sconj, Integer lead)
	{
		super(sentence, tok, dep, sconj, lead);
	}

	@Override
	public PhraseType getType() { return PhraseType.NP; }
}
