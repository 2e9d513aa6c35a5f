package edu.upf.taln.phrasegraph.core.extraction;

import edu.upf.taln.phrasegraph.core.grammar.Component;
import edu.upf.taln.phrasegraph.core.grammar.Conjuncts;
import edu.upf.taln.phrasegraph.core.grammar.Phrase;
import edu.upf.taln.phrasegraph.core.grammar.Sentence;
import edu.upf.taln.phrasegraph.core.grammar.VerbPhrase;
import edu.upf.taln.phrasegraph.core.rules.CoordinationRules;
import edu.upf.taln.phrasegraph.core.symbols.Dep;
import edu.upf.taln.phrasegraph.core.tokens.Token;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Detects groups of coordinated components and rewrites the phrase graph of a sentence so that coordination is
 * represented by conjunct groups instead of coordinate edges.
 */
public class ConjunctResolver
{
	private final CoordinationRules rules;
	private final boolean resolve_asyndetic;
	private final static Logger log = LogManager.getLogger();

	public ConjunctResolver(CoordinationRules rules, boolean resolve_asyndetic)
	{
		this.rules = Objects.requireNonNull(rules);
		this.resolve_asyndetic = resolve_asyndetic;
	}

	/**
	 * Finds maximal groups of components sharing a coordinating conjunction.
	 * Members get the index of the lead phrase and inherit its relation.
	 */
	public List<Conjuncts> detect(Sentence sentence)
	{
		final List<Component> comps = sentence.getComponents();
		final Map<Set<Component>, Pair<Token, List<Component>>> groups = new LinkedHashMap<>();
		for (int i = 0; i < comps.size(); ++i)
		{
			for (int j = i + 1; j < comps.size(); ++j)
			{
				final Component comp = comps.get(i);
				final Component other = comps.get(j);
				if (!rules.areConjoined(comp, other))
					continue;
				final Token cc = rules.getCconj(comp, other);
				if (cc == null && !resolve_asyndetic)
					continue;
				final boolean covered = groups.values().stream()
						.anyMatch(g -> Objects.equals(cc, g.getLeft()) &&
								g.getRight().contains(comp) && g.getRight().contains(other));
				if (covered)
					continue;

				final List<Component> members = close(cc, List.of(comp, other), comps);
				groups.putIfAbsent(new HashSet<>(members), Pair.of(cc, members));
			}
		}

		final List<Conjuncts> conjuncts = groups.values().stream()
				.map(this::createGroup)
				.sorted()
				.collect(Collectors.toList());
		log.debug("Found " + conjuncts.size() + " coordination groups in sentence " + sentence.getKey());
		return conjuncts;
	}

	// adds every component sharing the conjunction with all current members, until no candidate is left
	private List<Component> close(Token cc, List<Component> seed, List<Component> comps)
	{
		final List<Component> members = new ArrayList<>(seed);
		boolean changed = true;
		while (changed)
		{
			changed = false;
			for (Component comp : comps)
			{
				if (members.contains(comp))
					continue;
				final boolean shared = members.stream()
						.allMatch(m -> rules.areConjoined(comp, m) && Objects.equals(cc, rules.getCconj(comp, m)));
				if (shared)
				{
					members.add(comp);
					changed = true;
				}
			}
		}
		Collections.sort(members);
		return members;
	}

	private Conjuncts createGroup(Pair<Token, List<Component>> group)
	{
		final Token cc = group.getLeft();
		final List<Component> members = group.getRight();
		final List<Phrase> phrases = members.stream()
				.map(Component::getPhrase)
				.collect(Collectors.toList());

		final Token first = members.get(0).getToken();
		final Token leftmost = Stream.concat(Stream.of(first), rules.getConjuncts(first).stream())
				.min(Comparator.naturalOrder())
				.orElse(first);
		final Token preconj = rules.getPreconj(leftmost);

		int lead = 0;
		for (int i = 0; i < members.size(); ++i)
		{
			final Token tok = members.get(i).getToken();
			if (rules.getLead(tok).equals(tok))
			{
				lead = i;
				break;
			}
		}

		final Conjuncts conjuncts = new Conjuncts(phrases, lead, cc, preconj);
		final Phrase lead_phrase = conjuncts.getLead();
		final Dep lead_dep = lead_phrase.getDep();
		for (Phrase p : conjuncts)
		{
			p.setLeadIndex(lead_phrase.getIndex());
			p.setDep(p.getDep().or(lead_dep));
		}
		return conjuncts;
	}

	/**
	 * Replaces coordinate edges of the sentence graph with edges from the parents of lead phrases to their
	 * conjuncts, copies subjects, descriptions and subordinate clauses from leads to conjuncts lacking them, and
	 * clears the coordinate relation of all phrases. The graph is frozen afterwards.
	 */
	public void rewrite(Sentence sentence)
	{
		final Map<Phrase, SortedSet<Phrase>> graph = sentence.getGraph().toMutable();
		sentence.getPhrases().forEach(p -> graph.computeIfAbsent(p, k -> new TreeSet<>()));

		// coordinate links are redundant with conjunct groups
		graph.values().forEach(children -> children.removeIf(c -> c.getDep().has(Dep.CONJ)));

		// conjuncts of a child attach to the same parent
		for (Map.Entry<Phrase, SortedSet<Phrase>> e : graph.entrySet())
		{
			for (Phrase child : new ArrayList<>(e.getValue()))
			{
				if (!child.isLead())
					continue;
				child.getConjuncts().stream()
						.filter(c -> c.getDep().has(Dep.CONJ))
						.forEach(e.getValue()::add);
			}
		}

		int propagated = 0;
		for (Phrase phrase : new ArrayList<>(graph.keySet()))
		{
			if (!phrase.isLead())
				continue;
			final List<Phrase> conjuncts = phrase.getConjuncts();
			if (conjuncts.isEmpty())
				continue;
			final SortedSet<Phrase> children = graph.get(phrase);

			for (Phrase conj : conjuncts)
			{
				final SortedSet<Phrase> conj_children = graph.computeIfAbsent(conj, k -> new TreeSet<>());
				if (!hasSubject(conj, graph))
					propagated += copy(children, conj_children, Dep.SUBJ, conj);
				if (conj_children.stream().noneMatch(c -> c.getDep().has(Dep.DESC.or(Dep.MISC))))
					propagated += copy(children, conj_children, Dep.DESC, conj);
				if (phrase.getDep().has(Dep.CDESC) && conj_children.stream().noneMatch(ConjunctResolver::isSubclause))
					propagated += copy(children, conj_children, Dep.SUBCL, conj);
			}
		}

		for (Phrase p : sentence.getPhrases())
		{
			final Dep dep = p.getDep().without(Dep.CONJ);
			p.setDep(dep.isEmpty() ? Dep.MISC : dep);
		}

		sentence.freezeGraph(graph);
		log.debug("Propagated " + propagated + " edges to conjuncts in sentence " + sentence.getKey());
	}

	private static boolean hasSubject(Phrase phrase, Map<Phrase, SortedSet<Phrase>> graph)
	{
		for (Phrase c : graph.getOrDefault(phrase, Collections.emptySortedSet()))
		{
			if (c.getDep().has(Dep.SUBJ))
				return true;
			if (c.getDep().has(Dep.AGENT) && hasSubject(c, graph))
				return true;
		}
		return false;
	}

	private static boolean isSubclause(Phrase p)
	{
		return p.getDep().has(Dep.SUBCL) || (p instanceof VerbPhrase && p.getDep().has(Dep.ACL));
	}

	private static int copy(Collection<Phrase> from, Collection<Phrase> to, Dep relation, Phrase target)
	{
		int count = 0;
		for (Phrase c : from)
		{
			if (c.getDep().has(relation) && c != target && to.add(c))
				++count;
		}
		return count;
	}
}
