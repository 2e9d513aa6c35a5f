package edu.upf.taln.phrasegraph.core.grammar;

import edu.upf.taln.phrasegraph.core.structures.Registry;
import edu.upf.taln.phrasegraph.core.symbols.Dep;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import edu.upf.taln.phrasegraph.core.tokens.Token;
import org.json.JSONObject;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Node of the phrase graph of a sentence, wrapping the component with the same head token.
 * A phrase carries the relation to its parents, an optional subordinating conjunction and, for members of a
 * coordination group, the index of the lead phrase of the group.
 */
public abstract class Phrase implements Comparable<Phrase>, Registry.Canonical<Integer, Phrase>
{
	private final Sentence sentence;
	private final Token tok;
	private Dep dep;
	private Token sconj;
	private Integer lead;
	private Integer depth = null;

	protected Phrase(Sentence sentence, Token tok, Dep dep, Token sconj, Integer lead)
	{
		this.sentence = Objects.requireNonNull(sentence);
		this.tok = Objects.requireNonNull(tok);
		this.dep = dep != null ? dep : Dep.MISC;
		this.sconj = sconj;
		this.lead = lead;
	}

	public abstract PhraseType getType();

	public Sentence getSentence() { return sentence; }
	public Token getToken() { return tok; }
	public int getIndex() { return tok.getIndex(); }
	public Component getComponent() { return sentence.getComponent(getIndex()); }

	@Override
	public Integer getKey() { return getIndex(); }

	public Dep getDep() { return dep; }
	public void setDep(Dep dep) { this.dep = Objects.requireNonNull(dep); }
	public Token getSconj() { return sconj; }
	public void setSconj(Token sconj) { this.sconj = sconj; }
	public Integer getLeadIndex() { return lead; }
	public void setLeadIndex(Integer lead) { this.lead = lead; }

	public Phrase getLead() { return lead != null ? sentence.getPhrase(lead) : this; }
	public boolean isLead() { return getLead() == this; }

	// Graph navigation

	public List<Phrase> getChildren() { return sentence.getGraph().getChildren(this); }
	public List<Phrase> getParents() { return sentence.getGraph().getParents(this); }

	private List<Phrase> getChildren(Dep relation)
	{
		return getChildren().stream()
				.filter(c -> c.dep.has(relation))
				.collect(Collectors.toList());
	}

	/**
	 * Subject phrases, including subjects of passive agents attached to this phrase.
	 */
	public List<Phrase> getSubj()
	{
		final List<Phrase> subjects = new ArrayList<>();
		for (Phrase c : getChildren())
		{
			if (c.dep.has(Dep.SUBJ))
				subjects.add(c);
			else if (c.dep.has(Dep.AGENT))
				subjects.addAll(c.getSubj());
		}
		return subjects;
	}

	public List<Phrase> getDobj() { return getChildren(Dep.DOBJ); }
	public List<Phrase> getIobj() { return getChildren(Dep.IOBJ); }
	public List<Phrase> getDesc() { return getChildren(Dep.DESC.or(Dep.MISC)); }
	public List<Phrase> getCdesc() { return getChildren(Dep.CDESC); }
	public List<Phrase> getAdesc() { return getChildren(Dep.ADESC); }
	public List<Phrase> getPrep() { return getChildren(Dep.PREP); }
	public List<Phrase> getPobj() { return getChildren(Dep.POBJ); }
	public List<Phrase> getRelcl() { return getChildren(Dep.RELCL); }
	public List<Phrase> getXcomp() { return getChildren(Dep.XCOMP); }
	public List<Phrase> getAppos() { return getChildren(Dep.APPOS); }
	public List<Phrase> getNmod() { return getChildren(Dep.NMOD); }

	/**
	 * Subordinate clauses, including adnominal clauses headed by verbs.
	 */
	public List<Phrase> getSubcl()
	{
		return getChildren().stream()
				.filter(c -> c.dep.has(Dep.SUBCL) || (c instanceof VerbPhrase && c.dep.has(Dep.ACL)))
				.collect(Collectors.toList());
	}

	/**
	 * @return phrases reachable through children, excluding this one, in first-visit depth-first order
	 */
	public List<Phrase> getSubdag()
	{
		final List<Phrase> visited = visit(Phrase::getChildren);
		return visited.subList(1, visited.size());
	}

	/**
	 * @return phrases reachable through parents, excluding this one, in first-visit depth-first order
	 */
	public List<Phrase> getSupdag()
	{
		final List<Phrase> visited = visit(Phrase::getParents);
		return visited.subList(1, visited.size());
	}

	private List<Phrase> visit(Function<Phrase, List<Phrase>> next)
	{
		final Set<Phrase> visited = new LinkedHashSet<>();
		final Deque<Phrase> stack = new ArrayDeque<>();
		stack.push(this);
		while (!stack.isEmpty())
		{
			final Phrase p = stack.pop();
			if (!visited.add(p))
				continue;
			final List<Phrase> adjacent = next.apply(p);
			for (int i = adjacent.size() - 1; i >= 0; --i)
				stack.push(adjacent.get(i));
		}
		return new ArrayList<>(visited);
	}

	/**
	 * @return 0 for phrases without parents, otherwise one more than the minimum depth of the parents
	 */
	public int getDepth()
	{
		if (depth == null)
		{
			depth = getParents().stream()
					.mapToInt(p -> p.getDepth() + 1)
					.min()
					.orElse(0);
		}
		return depth;
	}

	void resetDepth() { depth = null; }

	// Coordination

	/**
	 * @return coordination group of this phrase, or a group with this phrase alone
	 */
	public Conjuncts getGroup()
	{
		return sentence.getConjuncts(getLead().getIndex())
				.filter(c -> c.contains(this))
				.orElseGet(() -> new Conjuncts(List.of(this), 0, null, null));
	}

	/**
	 * @return phrases coordinated with this one, excluding it
	 */
	public List<Phrase> getConjuncts()
	{
		return getGroup().getMembers().stream()
				.filter(p -> p != this)
				.collect(Collectors.toList());
	}

	// Components and tokens

	/**
	 * @return components of this phrase and of its subdag
	 */
	public List<Component> getComponents()
	{
		return visit(Phrase::getChildren).stream()
				.map(Phrase::getComponent)
				.collect(Collectors.toList());
	}

	public List<Verb> getVerbs() { return components(Verb.class); }
	public List<Noun> getNouns() { return components(Noun.class); }
	public List<Prep> getPreps() { return components(Prep.class); }
	public List<Desc> getDescs() { return components(Desc.class); }

	private <C extends Component> List<C> components(Class<C> type)
	{
		return getComponents().stream()
				.filter(type::isInstance)
				.map(type::cast)
				.collect(Collectors.toList());
	}

	/**
	 * @return tokens of the components of this phrase and its subdag, in textual order
	 */
	public List<Token> getTokens()
	{
		return getComponents().stream()
				.flatMap(c -> c.getTokens().stream())
				.distinct()
				.sorted()
				.collect(Collectors.toList());
	}

	public String getText()
	{
		return getTokens().stream().map(Token::getText).collect(Collectors.joining(" "));
	}

	@Override
	public void updateFrom(Phrase other)
	{
		if (other == this)
			return;
		dep = other.dep;
		sconj = other.sconj;
		lead = other.lead;
		depth = null;
	}

	public JSONObject toData()
	{
		final JSONObject data = new JSONObject();
		data.put("@class", getType().getAlias());
		data.put("head", getIndex());
		data.put("dep", dep.getName());
		data.put("sconj", sconj != null ? sconj.getIndex() : JSONObject.NULL);
		data.put("lead", lead != null ? lead : JSONObject.NULL);
		return data;
	}

	/**
	 * Reads a phrase record and registers it in the sentence.
	 */
	public static Phrase fromData(Sentence sentence, JSONObject data)
	{
		final Document doc = sentence.getSpan().getDocument();
		final PhraseType type = PhraseType.fromAlias(data.getString("@class"));
		final Token tok = doc.get(data.getInt("head"));
		final Dep dep = Dep.fromName(data.getString("dep"));
		final Token sconj = data.isNull("sconj") ? null : doc.get(data.getInt("sconj"));
		final Integer lead = data.isNull("lead") ? null : data.getInt("lead");
		return sentence.addPhrase(type.create(sentence, tok, dep, sconj, lead));
	}

	@Override
	public int compareTo(Phrase o) { return Integer.compare(getIndex(), o.getIndex()); }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Phrase other = (Phrase) o;
		return getIndex() == other.getIndex() &&
				dep.equals(other.dep) &&
				Objects.equals(sconj != null ? sconj.getIndex() : null, other.sconj != null ? other.sconj.getIndex() : null) &&
				Objects.equals(lead, other.lead);
	}

	@Override
	public int hashCode() { return Objects.hash(getClass(), getIndex()); }

	@Override
	public String toString() { return getComponent().toString(); }
}
