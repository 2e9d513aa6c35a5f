package edu.upf.taln.phrasegraph.core.rules;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableMap;
import edu.upf.taln.phrasegraph.core.Options;
import edu.upf.taln.phrasegraph.core.rules.en.EnglishGrammar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Set;

/**
 * Available rule tables, keyed by "language.backend". Each table is built and validated on first use.
 */
public final class Grammars
{
	private static final ImmutableMap<String, Supplier<Grammar>> grammars = ImmutableMap.of(
			EnglishGrammar.name, Suppliers.memoize(EnglishGrammar::create));
	private final static Logger log = LogManager.getLogger();

	private Grammars() {}

	public static Set<String> getNames() { return grammars.keySet(); }

	/**
	 * @throws IllegalStateException if there is no rule table for the language and backend of the options
	 */
	public static Grammar resolve(Options options)
	{
		final String name = options.getGrammarName();
		final Supplier<Grammar> grammar = grammars.get(name);
		if (grammar == null)
			throw new IllegalStateException("No grammar for '" + name + "', available: " + grammars.keySet());
		log.debug("Resolved grammar " + name);
		return grammar.get();
	}
}
