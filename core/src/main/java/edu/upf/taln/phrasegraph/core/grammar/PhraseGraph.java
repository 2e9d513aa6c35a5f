package edu.upf.taln.phrasegraph.core.grammar;

import edu.upf.taln.phrasegraph.core.structures.Graph;
import org.apache.commons.lang3.tuple.Pair;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Graph of the phrases of a sentence, with edges going from controlling to dependent phrases.
 * Edges carry no labels: the relation of a child to its parents is stored in the child phrase.
 */
public class PhraseGraph extends Graph<Phrase>
{
	public PhraseGraph() {}

	public PhraseGraph(Map<Phrase, ? extends Collection<Phrase>> data)
	{
		super(data);
	}

	/**
	 * @param links parent-child pairs; a null child adds the parent as a node without children
	 */
	public static PhraseGraph ofLinks(Iterable<Pair<Phrase, Phrase>> links)
	{
		return new PhraseGraph(Graph.fromLinks(links).asMap());
	}

	@Override
	protected String getLabel(Phrase node)
	{
		return node.getComponent().toString();
	}

	@Override
	protected String getChildLabel(Phrase parent, Phrase child)
	{
		final String sconj = child.getSconj() != null ? "(" + child.getSconj().getText() + ") " : "";
		return sconj + child.getComponent() + " [" + child.getDep().getName() + "]";
	}

	public JSONObject toData()
	{
		final JSONObject data = new JSONObject();
		asMap().forEach((parent, children) -> data.put(String.valueOf(parent.getIndex()),
				new JSONArray(children.stream().map(Phrase::getIndex).collect(Collectors.toList()))));
		return data;
	}

	/**
	 * Reads a graph record. Phrases must already be registered in the sentence.
	 */
	public static PhraseGraph fromData(Sentence sentence, JSONObject data)
	{
		final Map<Phrase, List<Phrase>> map = new TreeMap<>();
		for (String key : data.keySet())
		{
			final Phrase parent = sentence.getPhrase(parseIndex(key));
			final JSONArray indices = data.getJSONArray(key);
			final List<Phrase> children = new ArrayList<>();
			for (int i = 0; i < indices.length(); ++i)
				children.add(sentence.getPhrase(indices.getInt(i)));
			map.put(parent, children);
		}
		return new PhraseGraph(map);
	}

	static int parseIndex(String key)
	{
		try
		{
			return Integer.parseInt(key);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Invalid phrase index " + key, e);
		}
	}
}
