package edu.upf.taln.phrasegraph.core;

import edu.upf.taln.phrasegraph.core.extraction.GrammarSentenceFactory;
import edu.upf.taln.phrasegraph.core.grammar.Sentence;
import edu.upf.taln.phrasegraph.core.io.CoNLLUReader;
import edu.upf.taln.phrasegraph.core.rules.Grammars;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Annotated sentences shared by tests, read from sentences.conllu:
 * 0 "The cat chased the mouse.", 1 "John cooked and ate the cake.", 2 "The book that she read was boring.",
 * 3 "Either John or Mary left."
 */
public final class Fixtures
{
	public static final int SIMPLE = 0;
	public static final int COORDINATION = 1;
	public static final int RELATIVE = 2;
	public static final int PRECONJ = 3;

	private Fixtures() {}

	public static String readResource(String name)
	{
		try (InputStream in = Fixtures.class.getResourceAsStream("/" + name))
		{
			if (in == null)
				throw new IllegalStateException("Missing test resource " + name);
			return IOUtils.toString(in, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			throw new UncheckedIOException(e);
		}
	}

	public static Document document()
	{
		return new CoNLLUReader().read(readResource("sentences.conllu")).get(0);
	}

	public static Sentence sentence(int i)
	{
		return sentence(i, new Options());
	}

	public static Sentence sentence(int i, Options options)
	{
		final Document doc = document();
		return new GrammarSentenceFactory(Grammars.resolve(options), options).create(doc.getSentences().get(i));
	}
}
