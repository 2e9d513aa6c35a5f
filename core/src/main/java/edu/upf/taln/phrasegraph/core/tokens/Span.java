package edu.upf.taln.phrasegraph.core.tokens;

import org.apache.commons.lang3.tuple.Pair;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Contiguous [start, end) sequence of tokens of a document.
 */
public final class Span
{
	private final Document doc;
	private final int start;
	private final int end;

	Span(Document doc, int start, int end)
	{
		if (start < 0 || end > doc.size() || start >= end)
			throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ") for document of size " + doc.size());
		this.doc = doc;
		this.start = start;
		this.end = end;
	}

	public Document getDocument() { return doc; }
	public int getStart() { return start; }
	public int getEnd() { return end; }
	public Pair<Integer, Integer> getOffsets() { return Pair.of(start, end); }
	public int size() { return end - start; }
	public Token get(int i) { return doc.get(start + i); }
	public List<Token> getTokens() { return doc.getTokens().subList(start, end); }
	public boolean contains(Token t) { return t.getDocument() == doc && t.getIndex() >= start && t.getIndex() < end; }

	public String getText()
	{
		return getTokens().stream()
				.map(Token::getTextWithWhitespace)
				.collect(Collectors.joining())
				.trim();
	}

	/**
	 * A proper sentence has a single root token and every other token is headed from within the span.
	 *
	 * @return the root token
	 * @throws InvalidSentenceException if the span is not a proper sentence
	 */
	public Token getRoot()
	{
		final List<Token> roots = getTokens().stream()
				.filter(t -> t.isRoot() || !contains(t.getHead()))
				.collect(Collectors.toList());
		if (roots.size() != 1)
			throw new InvalidSentenceException(this, roots.size() + " root tokens " + roots);

		final Token root = roots.get(0);
		if (!root.isRoot())
			throw new InvalidSentenceException(this, "token " + root.getIndex() + " is headed outside the span");
		return root;
	}

	public boolean isSentence()
	{
		try
		{
			getRoot();
			return true;
		}
		catch (InvalidSentenceException e)
		{
			return false;
		}
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Span other = (Span) o;
		return doc == other.doc && start == other.start && end == other.end;
	}

	@Override
	public int hashCode() { return 31 * start + end; }

	@Override
	public String toString() { return "[" + start + ", " + end + ") " + getText(); }
}
