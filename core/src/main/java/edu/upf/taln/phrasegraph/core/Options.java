package edu.upf.taln.phrasegraph.core;

public class Options
{
	public String language = "en"; // language of the rule table
	public String backend = "rulebased"; // implementation of the rule table for the language
	public boolean check_invariants = false; // fail sentences whose phrase graph is cyclic or which are not fully covered by components
	public boolean resolve_asyndetic = true; // group conjuncts coordinated without a conjunction token, e.g. "came, saw, conquered"

	public Options() {}

	public Options(Options o)
	{
		this.language = o.language;
		this.backend = o.backend;
		this.check_invariants = o.check_invariants;
		this.resolve_asyndetic = o.resolve_asyndetic;
	}

	/**
	 * @return key of the rule table, e.g. "en.rulebased"
	 */
	public String getGrammarName() { return language + "." + backend; }

	@Override
	public String toString()
	{
		return "Options:" +
				"\n\tlanguage = " + language +
				"\n\tbackend = " + backend +
				"\n\tcheck_invariants = " + check_invariants +
				"\n\tresolve_asyndetic = " + resolve_asyndetic;
	}
}
