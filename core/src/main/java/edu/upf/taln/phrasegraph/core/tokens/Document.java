package edu.upf.taln.phrasegraph.core.tokens;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import org.apache.commons.lang3.tuple.Pair;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Sequence of annotated tokens split into sentences.
 * Immutable class.
 */
public final class Document
{
	private final String id;
	private final ImmutableList<TokenData> data;
	private final ImmutableList<Token> tokens;
	private final ImmutableList<Span> sentences;
	private final ImmutableListMultimap<Integer, Token> children; // from head indices to dependents, in textual order

	/**
	 * @param sentences token-based [start, end) offsets of sentences, covering the document in order
	 */
	public Document(String id, List<TokenData> data, List<Pair<Integer, Integer>> sentences)
	{
		this.id = id;
		this.data = ImmutableList.copyOf(data);
		this.tokens = IntStream.range(0, data.size())
				.mapToObj(i -> new Token(this, i))
				.collect(ImmutableList.toImmutableList());

		int offset = 0;
		ImmutableList.Builder<Span> spans = ImmutableList.builder();
		for (Pair<Integer, Integer> s : sentences)
		{
			if (s.getLeft() != offset || s.getRight() <= s.getLeft() || s.getRight() > data.size())
				throw new IllegalArgumentException("Sentence offsets " + s + " do not split the document in order");
			spans.add(new Span(this, s.getLeft(), s.getRight()));
			offset = s.getRight();
		}
		if (offset != data.size())
			throw new IllegalArgumentException("Sentences cover " + offset + " out of " + data.size() + " tokens");
		this.sentences = spans.build();

		ImmutableListMultimap.Builder<Integer, Token> builder = ImmutableListMultimap.builder();
		for (Token t : tokens)
		{
			int head = t.getData().getHead();
			if (head < 0 || head >= data.size())
				throw new IllegalArgumentException("Token " + t.getIndex() + " has head " + head + " out of range");
			if (head != t.getIndex())
				builder.put(head, t);
		}
		this.children = builder.build();
	}

	public String getId() { return id; }
	public int size() { return tokens.size(); }
	public Token get(int i) { return tokens.get(i); }
	public List<Token> getTokens() { return tokens; }
	public List<Span> getSentences() { return sentences; }
	TokenData getData(int i) { return data.get(i); }
	List<Token> getChildren(Token t) { return children.get(t.getIndex()); }

	public Span getSpan(int start, int end) { return new Span(this, start, end); }

	public Span getSentence(Token t)
	{
		return sentences.stream()
				.filter(s -> s.contains(t))
				.findFirst()
				.orElseThrow(() -> new IllegalStateException("Token " + t.getIndex() + " is not in any sentence"));
	}

	public String getText()
	{
		return tokens.stream()
				.map(Token::getTextWithWhitespace)
				.collect(Collectors.joining());
	}

	public JSONObject toData()
	{
		JSONObject json = new JSONObject();
		if (id != null)
			json.put("id", id);
		json.put("tokens", new JSONArray(data.stream().map(TokenData::toData).collect(Collectors.toList())));
		JSONArray sents = new JSONArray();
		sentences.forEach(s -> sents.put(new JSONArray(List.of(s.getStart(), s.getEnd()))));
		json.put("sents", sents);
		return json;
	}

	public static Document fromData(JSONObject json)
	{
		JSONArray tokens = json.getJSONArray("tokens");
		List<TokenData> data = IntStream.range(0, tokens.length())
				.mapToObj(tokens::getJSONObject)
				.map(TokenData::fromData)
				.collect(Collectors.toList());
		JSONArray sents = json.getJSONArray("sents");
		List<Pair<Integer, Integer>> offsets = IntStream.range(0, sents.length())
				.mapToObj(sents::getJSONArray)
				.map(a -> Pair.of(a.getInt(0), a.getInt(1)))
				.collect(Collectors.toList());
		return new Document(json.optString("id", null), data, offsets);
	}

	@Override
	public String toString() { return getText(); }
}
