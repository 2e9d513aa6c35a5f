package edu.upf.taln.phrasegraph.core;

import com.google.common.base.Stopwatch;
import edu.upf.taln.phrasegraph.core.extraction.DocumentFactory;
import edu.upf.taln.phrasegraph.core.extraction.GrammarSentenceFactory;
import edu.upf.taln.phrasegraph.core.extraction.SentenceFactory;
import edu.upf.taln.phrasegraph.core.grammar.GrammarDocument;
import edu.upf.taln.phrasegraph.core.grammar.Sentence;
import edu.upf.taln.phrasegraph.core.io.CoNLLUReader;
import edu.upf.taln.phrasegraph.core.rules.Grammar;
import edu.upf.taln.phrasegraph.core.rules.Grammars;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import edu.upf.taln.phrasegraph.core.tokens.Span;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point: turns parsed documents into grammatical analyses made of components, phrases, phrase graphs and
 * coordination groups.
 */
public final class GrammarParser
{
	private final static Logger log = LogManager.getLogger();

	private GrammarParser() {}

	public static SentenceFactory createFactory(Options o)
	{
		final Grammar grammar = Grammars.resolve(o);
		log.info("Using grammar " + grammar.getName());
		return new GrammarSentenceFactory(grammar, o);
	}

	public static Sentence parse(Span span, Options o)
	{
		return createFactory(o).create(span);
	}

	public static GrammarDocument parse(Document document, Options o)
	{
		try
		{
			return new DocumentFactory(createFactory(o)).create(document);
		}
		catch (RuntimeException e)
		{
			log.error("Analysis of document " + document.getId() + " failed");
			throw e;
		}
	}

	/**
	 * Reads documents in CoNLL-U format from a file and analyses them.
	 */
	public static List<GrammarDocument> parse(Path conllu, Options o) throws IOException
	{
		log.info("*Parsing started*");
		log.debug(o);
		final Stopwatch timer = Stopwatch.createStarted();

		final List<Document> documents = new CoNLLUReader().read(conllu);
		final DocumentFactory factory = new DocumentFactory(createFactory(o));
		final List<GrammarDocument> docs = documents.stream()
				.map(factory::create)
				.collect(Collectors.toList());

		log.info("Parsing of " + docs.size() + " documents took " + timer.stop());
		return docs;
	}
}
