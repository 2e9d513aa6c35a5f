package edu.upf.taln.phrasegraph.core.symbols;

/**
 * Syntactic roles of tokens within components.
 * Component-specific roles depend on the phrase a token belongs to, whereas fixed roles (negations,
 * punctuation marks of interest, interjections) are determined by the token alone.
 */
public enum Role
{
	// component-specific roles
	VERB, NOUN, SUBJ, DOBJ, IOBJ, PREP, POBJ, PROOT, DESC,
	BG, // background element, e.g. tokens of a subclause
	// fixed roles
	NEG, QMARK, EXCLAM, INTJ;

	public static Role fromName(String name)
	{
		return Role.valueOf(name.trim().toUpperCase());
	}

	public String getName() { return name().toLowerCase(); }
}
