package edu.upf.taln.phrasegraph.core.extraction;

import com.google.common.base.Stopwatch;
import edu.upf.taln.phrasegraph.core.grammar.GrammarDocument;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import edu.upf.taln.phrasegraph.core.tokens.InvalidSentenceException;
import edu.upf.taln.phrasegraph.core.tokens.Span;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Analyses every sentence of a document. Spans that are not proper sentences are skipped with a warning.
 */
public class DocumentFactory
{
	private final SentenceFactory factory;
	private final static Logger log = LogManager.getLogger();

	public DocumentFactory(SentenceFactory factory)
	{
		this.factory = Objects.requireNonNull(factory);
	}

	public GrammarDocument create(Document document)
	{
		final Stopwatch timer = Stopwatch.createStarted();
		final GrammarDocument doc = new GrammarDocument(document);
		int skipped = 0;
		for (Span span : document.getSentences())
		{
			try
			{
				doc.add(factory.create(span));
			}
			catch (InvalidSentenceException e)
			{
				log.warn("Skipping sentence: " + e.getMessage());
				++skipped;
			}
		}
		log.info("Analysed " + doc.size() + " sentences" + (skipped > 0 ? " (" + skipped + " skipped)" : "") +
				" in " + timer.stop());
		return doc;
	}
}
