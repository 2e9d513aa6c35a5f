package edu.upf.taln.phrasegraph.core.extraction;

import edu.upf.taln.phrasegraph.core.Options;
import edu.upf.taln.phrasegraph.core.grammar.*;
import edu.upf.taln.phrasegraph.core.rules.Grammar;
import edu.upf.taln.phrasegraph.core.symbols.Dep;
import edu.upf.taln.phrasegraph.core.tokens.InvalidSentenceException;
import edu.upf.taln.phrasegraph.core.tokens.Span;
import edu.upf.taln.phrasegraph.core.tokens.Token;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Assembles the grammatical analysis of a sentence span: components, sub tokens, phrase links, coordination
 * groups and the rewritten phrase graph.
 */
public class GrammarSentenceFactory implements SentenceFactory
{
	private static final List<ComponentType> build_order = List.of(
			ComponentType.NOUN, ComponentType.VERB, ComponentType.PREP, ComponentType.DESC);
	private final Grammar grammar;
	private final ComponentBuilder builder;
	private final ConjunctResolver resolver;
	private final boolean check_invariants;
	private final static Logger log = LogManager.getLogger();

	public GrammarSentenceFactory(Grammar grammar, Options options)
	{
		this.grammar = grammar;
		this.builder = new ComponentBuilder(grammar);
		this.resolver = new ConjunctResolver(grammar.getCoordination(), options.resolve_asyndetic);
		this.check_invariants = options.check_invariants;
	}

	/**
	 * @throws InvalidSentenceException if the span is not a proper sentence
	 * @throws IllegalStateException if invariants are checked and the graph is cyclic or tokens are left uncovered
	 */
	@Override
	public Sentence create(Span span)
	{
		span.getRoot(); // fails for spans that are not proper sentences
		final Sentence sentence = new Sentence(span);

		// 1- Components
		for (Token tok : span.getTokens())
		{
			for (ComponentType type : build_order)
				builder.build(sentence, tok, type, null);
		}
		log.debug("Built " + sentence.getComponents().size() + " components for sentence " + sentence.getKey());

		// 2- Tokens not controlled by any component
		addSubs(sentence);

		// 3- Links between phrases
		sentence.setGraph(PhraseGraph.ofLinks(findLinks(sentence)));

		// 4- Coordination
		sentence.setConjuncts(resolver.detect(sentence));
		resolver.rewrite(sentence);

		if (sentence.getSources().isEmpty())
			log.warn("Graph of sentence " + sentence.getKey() + " has no sources");
		if (check_invariants)
			checkInvariants(sentence);
		return sentence;
	}

	private static void addSubs(Sentence sentence)
	{
		for (Token tok : sentence.getSpan().getTokens())
		{
			if (sentence.findComponent(tok.getIndex()).isPresent())
				continue;
			findParent(sentence, tok)
					.filter(c -> !c.getTokens().contains(tok))
					.ifPresent(c -> c.addSub(tok));
		}
	}

	/**
	 * @return component headed by the nearest ancestor of tok that heads a component
	 */
	private static Optional<Component> findParent(Sentence sentence, Token tok)
	{
		final Span span = sentence.getSpan();
		Token head = tok;
		for (int steps = 0; !head.isRoot() && span.contains(head.getHead()); ++steps)
		{
			if (steps > span.size())
				throw new InvalidSentenceException(span, "cyclic head chain at token " + tok.getIndex());
			head = head.getHead();
			if (head.equals(tok))
				break;
			final Optional<Component> comp = sentence.findComponent(head.getIndex());
			if (comp.isPresent())
				return comp;
		}
		return Optional.empty();
	}

	private List<Pair<Phrase, Phrase>> findLinks(Sentence sentence)
	{
		final List<Pair<Phrase, Phrase>> links = new ArrayList<>();
		for (Component comp : sentence.getComponents())
		{
			final Phrase phrase = comp.getPhrase();
			final Optional<Component> parent = findParent(sentence, comp.getToken());
			if (parent.isEmpty())
			{
				phrase.setDep(Dep.ROOT);
				links.add(Pair.of(phrase, null));
			}
			else
			{
				phrase.setDep(grammar.getClassifier().classify(comp, parent.get()));
				phrase.setSconj(grammar.getCoordination().getSconj(comp, parent.get()));
				links.add(Pair.of(parent.get().getPhrase(), phrase));
			}
		}
		return links;
	}

	private static void checkInvariants(Sentence sentence)
	{
		if (!sentence.isDag())
			throw new IllegalStateException("Graph of sentence " + sentence.getKey() + " is not acyclic:\n" + sentence);
		if (!sentence.isCovered())
			throw new IllegalStateException("Sentence " + sentence.getKey() + " is not fully covered by components: " +
					sentence.getCoverage());
	}
}
