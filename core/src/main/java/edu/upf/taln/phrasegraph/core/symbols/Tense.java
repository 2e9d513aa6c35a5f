package edu.upf.taln.phrasegraph.core.symbols;

public enum Tense
{
	PAST, PRESENT, FUTURE;

	public static Tense fromName(String name)
	{
		return Tense.valueOf(name.trim().toUpperCase());
	}

	public String getName() { return name().toLowerCase(); }
}
