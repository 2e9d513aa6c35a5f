package edu.upf.taln.phrasegraph.core.grammar;

import edu.upf.taln.phrasegraph.core.symbols.Dep;
import edu.upf.taln.phrasegraph.core.tokens.Token;

import java.util.Arrays;

/**
 * Phrase subtypes, tried in declaration order when wrapping a component.
 */
public enum PhraseType
{
	VP(Verb.class)
	{
		@Override
		public Phrase create(Sentence sentence, Token tok, Dep dep, Token sconj, Integer lead)
		{
			return new VerbPhrase(sentence, tok, dep, sconj, lead);
		}
	},
	NP(Noun.class)
	{
		@Override
		public Phrase create(Sentence sentence, Token tok, Dep dep, Token sconj, Integer lead)
		{
			return new NounPhrase(sentence, tok, dep, sconj, lead);
		}
	},
	DP(Desc.class)
	{
		@Override
		public Phrase create(Sentence sentence, Token tok, Dep dep, Token sconj, Integer lead)
		{
			return new DescPhrase(sentence, tok, dep, sconj, lead);
		}
	},
	PP(Prep.class)
	{
		@Override
		public Phrase create(Sentence sentence, Token tok, Dep dep, Token sconj, Integer lead)
		{
			return new PrepPhrase(sentence, tok, dep, sconj, lead);
		}
	};

	private final Class<? extends Component> governed;

	PhraseType(Class<? extends Component> governed)
	{
		this.governed = governed;
	}

	public abstract Phrase create(Sentence sentence, Token tok, Dep dep, Token sconj, Integer lead);

	public String getAlias() { return name(); }

	public boolean governs(Component comp) { return governed.isInstance(comp); }

	/**
	 * @return the first phrase type governing the component
	 * @throws IllegalArgumentException if no phrase type governs it
	 */
	public static PhraseType governing(Component comp)
	{
		return Arrays.stream(values())
				.filter(t -> t.governs(comp))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("No phrase type governs " +
						comp.getClass().getSimpleName() + " component '" + comp + "'"));
	}

	public static Phrase fromComponent(Component comp)
	{
		return governing(comp).create(comp.getSentence(), comp.getToken(), Dep.MISC, null, null);
	}

	public static PhraseType fromAlias(String alias)
	{
		try
		{
			return valueOf(alias);
		}
		catch (IllegalArgumentException e)
		{
			throw new IllegalArgumentException("Unknown phrase type " + alias, e);
		}
	}
}
