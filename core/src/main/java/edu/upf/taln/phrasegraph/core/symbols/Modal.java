package edu.upf.taln.phrasegraph.core.symbols;

/**
 * Modality of verbs, e.g. 'can' expresses ability and 'must' necessity.
 */
public enum Modal
{
	NULL, ABILITY, POSSIBILITY, NECESSITY, OBLIGATION, NEED;

	public static Modal fromName(String name)
	{
		return Modal.valueOf(name.trim().toUpperCase());
	}

	public String getName() { return name().toLowerCase(); }
}
