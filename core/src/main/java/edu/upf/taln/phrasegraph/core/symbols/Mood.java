package edu.upf.taln.phrasegraph.core.symbols;

/**
 * Grammatical mood. Only indicative (realis) and imperative moods are distinguished.
 */
public enum Mood
{
	REAL, IMP;

	public static Mood fromName(String name)
	{
		return Mood.valueOf(name.trim().toUpperCase());
	}

	public String getName() { return name().toLowerCase(); }
}
