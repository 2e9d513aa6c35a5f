package edu.upf.taln.phrasegraph.core.io;

import edu.upf.taln.phrasegraph.core.tokens.Document;

import java.util.List;

/**
 * Readers of annotated documents produced by external taggers and parsers.
 */
public interface DocumentReader
{
	List<Document> read(String contents);
}
