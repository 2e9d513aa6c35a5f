package edu.upf.taln.phrasegraph.core.grammar;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import edu.upf.taln.phrasegraph.core.symbols.Dep;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import edu.upf.taln.phrasegraph.core.tokens.Token;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Group of coordinated phrases with a designated lead member, an optional coordinating conjunction
 * ("and", "or") and an optional pre-conjunction ("either", "neither").
 * Immutable class.
 */
public final class Conjuncts implements Comparable<Conjuncts>, Iterable<Phrase>
{
	private final ImmutableList<Phrase> members;
	private final int lead; // ordinal of the lead in members
	private final Token cconj;
	private final Token preconj;

	public Conjuncts(List<Phrase> members, int lead, Token cconj, Token preconj)
	{
		Preconditions.checkArgument(!members.isEmpty(), "Empty coordination group");
		Preconditions.checkElementIndex(lead, members.size(), "Lead ordinal");
		this.members = ImmutableList.copyOf(members);
		this.lead = lead;
		this.cconj = cconj;
		this.preconj = preconj;
	}

	public List<Phrase> getMembers() { return members; }
	public int getLeadOrdinal() { return lead; }
	public Phrase getLead() { return members.get(lead); }
	public Token getCconj() { return cconj; }
	public Token getPreconj() { return preconj; }
	public int size() { return members.size(); }
	public boolean contains(Phrase p) { return members.contains(p); }
	public Stream<Phrase> stream() { return members.stream(); }

	/**
	 * @return relation of the group, i.e. that of its lead
	 */
	public Dep getDep() { return getLead().getDep(); }

	@Override
	public Iterator<Phrase> iterator() { return members.iterator(); }

	public JSONObject toData()
	{
		final JSONObject data = new JSONObject();
		data.put("members", new JSONArray(members.stream().map(Phrase::getIndex).collect(Collectors.toList())));
		data.put("lead", lead);
		data.put("cconj", cconj != null ? cconj.getIndex() : JSONObject.NULL);
		data.put("preconj", preconj != null ? preconj.getIndex() : JSONObject.NULL);
		return data;
	}

	/**
	 * Reads a group record. Members must already be registered in the sentence.
	 */
	public static Conjuncts fromData(Sentence sentence, JSONObject data)
	{
		final Document doc = sentence.getSpan().getDocument();
		final JSONArray indices = data.getJSONArray("members");
		final List<Phrase> members = new ArrayList<>();
		for (int i = 0; i < indices.length(); ++i)
			members.add(sentence.getPhrase(indices.getInt(i)));
		final Token cconj = data.isNull("cconj") ? null : doc.get(data.getInt("cconj"));
		final Token preconj = data.isNull("preconj") ? null : doc.get(data.getInt("preconj"));
		return new Conjuncts(members, data.getInt("lead"), cconj, preconj);
	}

	private static Integer index(Token t) { return t != null ? t.getIndex() : null; }

	@Override
	public int compareTo(Conjuncts o)
	{
		return Comparator.comparingInt((Conjuncts c) -> c.getLead().getIndex())
				.thenComparingInt(c -> c.members.get(0).getIndex())
				.compare(this, o);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Conjuncts other = (Conjuncts) o;
		return lead == other.lead && members.equals(other.members) &&
				Objects.equals(index(cconj), index(other.cconj)) &&
				Objects.equals(index(preconj), index(other.preconj));
	}

	@Override
	public int hashCode() { return Objects.hash(members, lead); }

	@Override
	public String toString()
	{
		final String coords = Stream.of(preconj, cconj)
				.filter(Objects::nonNull)
				.map(Token::getText)
				.collect(Collectors.joining("|"));
		return (coords.isEmpty() ? "" : "[" + coords + "]") + members;
	}
}
