package edu.upf.taln.phrasegraph.core.grammar;

import edu.upf.taln.phrasegraph.core.structures.Registry;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import edu.upf.taln.phrasegraph.core.tokens.Span;
import edu.upf.taln.phrasegraph.core.tokens.Token;
import org.apache.commons.lang3.tuple.Pair;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Grammatical analysis of a sentence span: its components, the phrases wrapping them, the phrase graph and the
 * coordination groups indexed by the head index of their lead phrase.
 * Components and phrases are canonical per head token index.
 */
public class Sentence implements Registry.Canonical<Pair<Integer, Integer>, Sentence>
{
	private final Span span;
	private final Registry<Integer, Component> components = new Registry<>();
	private final Registry<Integer, Phrase> phrases = new Registry<>();
	private PhraseGraph graph = new PhraseGraph();
	private final Map<Integer, Conjuncts> conjuncts = new TreeMap<>();

	public Sentence(Span span)
	{
		this.span = Objects.requireNonNull(span);
	}

	public Span getSpan() { return span; }
	public int getStart() { return span.getStart(); }
	public int getEnd() { return span.getEnd(); }
	public String getText() { return span.getText(); }

	@Override
	public Pair<Integer, Integer> getKey() { return span.getOffsets(); }

	// Components and phrases

	/**
	 * Registers a component, or updates the one already registered for its head token.
	 * A new component also gets a phrase of the type governing it.
	 *
	 * @return the canonical component
	 */
	public Component addComponent(Component comp)
	{
		if (comp.getSentence() != this)
			throw new IllegalArgumentException("Component " + comp + " belongs to another sentence");
		final boolean known = components.contains(comp.getIndex());
		final Component canonical = components.put(comp);
		if (!known && !phrases.contains(comp.getIndex()))
			phrases.put(PhraseType.fromComponent(canonical));
		return canonical;
	}

	/**
	 * Registers a phrase, or updates the one already registered for its head token.
	 *
	 * @return the canonical phrase
	 */
	public Phrase addPhrase(Phrase phrase)
	{
		if (phrase.getSentence() != this)
			throw new IllegalArgumentException("Phrase " + phrase + " belongs to another sentence");
		return phrases.put(phrase);
	}

	public Component getComponent(int index) { return components.require(index); }
	public Optional<Component> findComponent(int index) { return components.get(index); }
	public Phrase getPhrase(int index) { return phrases.require(index); }
	public Optional<Phrase> findPhrase(int index) { return phrases.get(index); }
	public List<Component> getComponents() { return new ArrayList<>(components.values()); }
	public List<Phrase> getPhrases() { return new ArrayList<>(phrases.values()); }

	public List<VerbPhrase> getVerbPhrases() { return phrases(VerbPhrase.class); }
	public List<NounPhrase> getNounPhrases() { return phrases(NounPhrase.class); }
	public List<DescPhrase> getDescPhrases() { return phrases(DescPhrase.class); }
	public List<PrepPhrase> getPrepPhrases() { return phrases(PrepPhrase.class); }

	private <P extends Phrase> List<P> phrases(Class<P> type)
	{
		return phrases.values().stream()
				.filter(type::isInstance)
				.map(type::cast)
				.collect(Collectors.toList());
	}

	// Graph

	public PhraseGraph getGraph() { return graph; }

	public void setGraph(PhraseGraph graph)
	{
		this.graph = Objects.requireNonNull(graph);
		phrases.values().forEach(Phrase::resetDepth);
	}

	/**
	 * Replaces the graph edges with sorted, immutable children lists and rebuilds the reversed graph.
	 */
	public void freezeGraph(Map<Phrase, ? extends Collection<Phrase>> adjacency)
	{
		graph.freeze(adjacency);
		phrases.values().forEach(Phrase::resetDepth);
	}

	public List<Phrase> getSources() { return graph.getSources(); }
	public boolean isDag() { return graph.isDag(); }

	// Coordination

	public Map<Integer, Conjuncts> getConjuncts() { return Collections.unmodifiableMap(conjuncts); }
	public Optional<Conjuncts> getConjuncts(int lead) { return Optional.ofNullable(conjuncts.get(lead)); }

	public void setConjuncts(Collection<Conjuncts> groups)
	{
		conjuncts.clear();
		groups.stream()
				.sorted()
				.forEach(c -> conjuncts.put(c.getLead().getIndex(), c));
	}

	// Sentence-level views

	/**
	 * @return component of the root token of the sentence, or the component covering it as a sub token
	 */
	public Component getRoot()
	{
		final Token root = span.getRoot();
		return components.get(root.getIndex())
				.or(() -> components.values().stream().filter(c -> c.contains(root)).findFirst())
				.orElseThrow(() -> new IllegalStateException("Root token '" + root + "' is not covered by any component"));
	}

	public Conjuncts getRootGroup() { return getRoot().getPhrase().getGroup(); }

	/**
	 * @return fraction of the tokens of the span covered by the head, controlled or sub tokens of some component
	 */
	public double getCoverage()
	{
		final Set<Token> covered = components.values().stream()
				.flatMap(c -> c.getSubtokens().stream())
				.filter(span::contains)
				.collect(Collectors.toSet());
		return covered.size() / (double) span.size();
	}

	public boolean isCovered() { return getCoverage() == 1.0; }

	/**
	 * Replaces the contents of this sentence with a copy of those of another analysis of the same span.
	 */
	@Override
	public void updateFrom(Sentence other)
	{
		if (other == this)
			return;
		if (!other.getKey().equals(getKey()) || other.span.getDocument() != span.getDocument())
			throw new IllegalArgumentException("Cannot update sentence " + getKey() + " from " + other.getKey());
		readData(other.toData());
	}

	public JSONObject toData()
	{
		final JSONObject data = new JSONObject();
		data.put("start", getStart());
		data.put("end", getEnd());
		final JSONObject cmap = new JSONObject();
		components.values().forEach(c -> cmap.put(String.valueOf(c.getIndex()), c.toData()));
		data.put("cmap", cmap);
		final JSONObject pmap = new JSONObject();
		phrases.values().forEach(p -> pmap.put(String.valueOf(p.getIndex()), p.toData()));
		data.put("pmap", pmap);
		data.put("graph", graph.toData());
		data.put("conjs", new JSONArray(conjuncts.values().stream().map(Conjuncts::toData).collect(Collectors.toList())));
		return data;
	}

	public static Sentence fromData(Document doc, JSONObject data)
	{
		final Sentence sentence = new Sentence(doc.getSpan(data.getInt("start"), data.getInt("end")));
		sentence.readData(data);
		return sentence;
	}

	private void readData(JSONObject data)
	{
		components.clear();
		phrases.clear();
		conjuncts.clear();

		final JSONObject cmap = data.getJSONObject("cmap");
		sortedKeys(cmap).forEach(k -> Component.fromData(this, cmap.getJSONObject(k)));
		final JSONObject pmap = data.getJSONObject("pmap");
		sortedKeys(pmap).forEach(k -> Phrase.fromData(this, pmap.getJSONObject(k)));
		setGraph(PhraseGraph.fromData(this, data.getJSONObject("graph")));
		graph.updateRev();

		final JSONArray conjs = data.getJSONArray("conjs");
		final List<Conjuncts> groups = new ArrayList<>();
		for (int i = 0; i < conjs.length(); ++i)
			groups.add(Conjuncts.fromData(this, conjs.getJSONObject(i)));
		setConjuncts(groups);
	}

	private static List<String> sortedKeys(JSONObject json)
	{
		return json.keySet().stream()
				.sorted(Comparator.comparingInt(PhraseGraph::parseIndex))
				.collect(Collectors.toList());
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Sentence other = (Sentence) o;
		return getKey().equals(other.getKey()) &&
				components.equals(other.components) &&
				phrases.equals(other.phrases) &&
				graph.equals(other.graph) &&
				conjuncts.equals(other.conjuncts);
	}

	@Override
	public int hashCode() { return getKey().hashCode(); }

	/**
	 * Renders the phrase graph, children indented under their parents.
	 */
	@Override
	public String toString() { return graph.toString(); }
}
