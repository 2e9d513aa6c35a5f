package edu.upf.taln.phrasegraph.core.rules;

import edu.upf.taln.phrasegraph.core.grammar.Component;
import edu.upf.taln.phrasegraph.core.symbols.Dep;

/**
 * Maps a child component and one of its syntactic parents to the relation between them.
 * Classification depends only on the annotations of the tokens involved.
 */
public interface DependencyClassifier
{
	/**
	 * @return a non-empty relation
	 */
	Dep classify(Component child, Component parent);
}
