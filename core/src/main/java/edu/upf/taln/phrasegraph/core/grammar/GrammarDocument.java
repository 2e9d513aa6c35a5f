package edu.upf.taln.phrasegraph.core.grammar;

import edu.upf.taln.phrasegraph.core.structures.Registry;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import org.apache.commons.lang3.tuple.Pair;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Grammatical analyses of the sentences of a document, canonical per (start, end) span and kept in textual order.
 */
public class GrammarDocument
{
	private final Document document;
	private final Registry<Pair<Integer, Integer>, Sentence> sentences = new Registry<>();

	public GrammarDocument(Document document)
	{
		this.document = Objects.requireNonNull(document);
	}

	public Document getDocument() { return document; }

	/**
	 * @return the canonical sentence for the span of the given one
	 */
	public Sentence add(Sentence sentence)
	{
		if (sentence.getSpan().getDocument() != document)
			throw new IllegalArgumentException("Sentence " + sentence.getKey() + " belongs to another document");
		return sentences.put(sentence);
	}

	public List<Sentence> getSentences() { return new ArrayList<>(sentences.values()); }
	public Optional<Sentence> getSentence(int start, int end) { return sentences.get(Pair.of(start, end)); }
	public int size() { return sentences.size(); }

	public List<Component> getComponents()
	{
		return sentences.values().stream()
				.flatMap(s -> s.getComponents().stream())
				.collect(Collectors.toList());
	}

	public List<Phrase> getPhrases()
	{
		return sentences.values().stream()
				.flatMap(s -> s.getPhrases().stream())
				.collect(Collectors.toList());
	}

	public JSONObject toData()
	{
		final JSONObject data = new JSONObject();
		data.put("doc", document.toData());
		data.put("sents", new JSONArray(sentences.values().stream().map(Sentence::toData).collect(Collectors.toList())));
		return data;
	}

	public static GrammarDocument fromData(JSONObject data)
	{
		final GrammarDocument doc = new GrammarDocument(Document.fromData(data.getJSONObject("doc")));
		final JSONArray sents = data.getJSONArray("sents");
		for (int i = 0; i < sents.length(); ++i)
			doc.add(Sentence.fromData(doc.document, sents.getJSONObject(i)));
		return doc;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GrammarDocument other = (GrammarDocument) o;
		return document.toData().similar(other.document.toData()) && sentences.equals(other.sentences);
	}

	@Override
	public int hashCode() { return sentences.keys().hashCode(); }

	@Override
	public String toString()
	{
		return sentences.values().stream()
				.map(s -> s.getText() + "\n" + s)
				.collect(Collectors.joining("\n\n"));
	}
}
