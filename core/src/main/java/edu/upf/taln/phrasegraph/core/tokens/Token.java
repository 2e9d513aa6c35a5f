package edu.upf.taln.phrasegraph.core.tokens;

import com.google.common.collect.ImmutableList;
import edu.upf.taln.phrasegraph.core.utils.POS;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * View over the annotations of one token of a document.
 * Tokens are identified by their document-level index and ordered by it.
 */
public final class Token implements Comparable<Token>
{
	private final Document doc;
	private final int i;

	Token(Document doc, int i)
	{
		this.doc = doc;
		this.i = i;
	}

	public Document getDocument() { return doc; }
	public int getIndex() { return i; }
	public TokenData getData() { return doc.getData(i); }
	public String getText() { return getData().getText(); }
	public String getWhitespace() { return getData().getWhitespace(); }
	public String getTextWithWhitespace() { return getText() + getWhitespace(); }
	public String getLemma() { return getData().getLemma() != null ? getData().getLemma() : getText(); }
	public POS.Tag getPOS() { return getData().getPOS(); }
	public String getTag() { return getData().getTag(); }
	public String getDep() { return getData().getDep(); }
	public String getEnt() { return getData().getEnt(); }

	public List<String> getMorph(String feature)
	{
		return getData().getMorph().getOrDefault(feature, ImmutableList.of());
	}

	public List<Token> getCorefs()
	{
		return getData().getCorefs().stream()
				.map(doc::get)
				.collect(Collectors.toList());
	}

	/**
	 * @return main coreferred token, or this token if it has no coreferences
	 */
	public Token getCoref()
	{
		final List<Token> refs = getCorefs();
		return refs.isEmpty() ? this : refs.get(0);
	}

	public Token getHead() { return doc.get(getData().getHead()); }
	public boolean isRoot() { return getData().getHead() == i; }
	public List<Token> getChildren() { return doc.getChildren(this); }

	public List<Token> getLefts()
	{
		return getChildren().stream()
				.filter(c -> c.i < i)
				.collect(Collectors.toList());
	}

	public List<Token> getRights()
	{
		return getChildren().stream()
				.filter(c -> c.i > i)
				.collect(Collectors.toList());
	}

	/**
	 * Heads of this token up to the root, closest first.
	 */
	public List<Token> getAncestors()
	{
		final List<Token> ancestors = new ArrayList<>();
		Token current = this;
		while (!current.isRoot())
		{
			current = current.getHead();
			if (current == this || ancestors.contains(current))
				throw new IllegalStateException("Cyclic head chain at token " + this);
			ancestors.add(current);
		}
		return ancestors;
	}

	public boolean isAncestor(Token descendant)
	{
		return descendant.getAncestors().contains(this);
	}

	public Span getSentence() { return doc.getSentence(this); }

	@Override
	public int compareTo(Token o) { return Integer.compare(i, o.i); }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Token other = (Token) o;
		return doc == other.doc && i == other.i;
	}

	@Override
	public int hashCode() { return Integer.hashCode(i); }

	@Override
	public String toString() { return getText(); }
}
