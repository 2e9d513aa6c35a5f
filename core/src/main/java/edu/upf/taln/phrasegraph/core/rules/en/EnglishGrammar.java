package edu.upf.taln.phrasegraph.core.rules.en;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.upf.taln.phrasegraph.core.grammar.Component;
import edu.upf.taln.phrasegraph.core.grammar.SlotSpec;
import edu.upf.taln.phrasegraph.core.rules.Grammar;
import edu.upf.taln.phrasegraph.core.rules.SlotRule;
import edu.upf.taln.phrasegraph.core.symbols.Modal;
import edu.upf.taln.phrasegraph.core.symbols.Mood;
import edu.upf.taln.phrasegraph.core.symbols.Tense;
import edu.upf.taln.phrasegraph.core.tokens.Token;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import static edu.upf.taln.phrasegraph.core.grammar.ComponentType.*;
import static edu.upf.taln.phrasegraph.core.rules.en.EnglishTokens.*;

/**
 * Rule-based English grammar over spaCy-style annotations.
 */
public final class EnglishGrammar
{
	public static final String name = "en.rulebased";

	private static final Map<String, Modal> modals = ImmutableMap.<String, Modal>builder()
			.put("can", Modal.ABILITY)
			.put("could", Modal.ABILITY)
			.put("may", Modal.POSSIBILITY)
			.put("might", Modal.POSSIBILITY)
			.put("must", Modal.NECESSITY)
			.put("should", Modal.OBLIGATION)
			.put("ought", Modal.OBLIGATION)
			.put("need", Modal.NEED)
			.build();

	private EnglishGrammar() {}

	public static Grammar create()
	{
		return Grammar.builder(name)
				.defaultDispatch()
				.head(VERB, EnglishTokens::isVpHead)
				.head(NOUN, EnglishTokens::isNpHead)
				.head(PREP, EnglishTokens::isPpHead)
				.head(DESC, EnglishTokens::isDpHead)
				// slots of all components
				.rule(SlotRule.token("qmark", EnglishTokens::isQmark))
				.rule(SlotRule.token("exclam", EnglishTokens::isExclam))
				.rule(SlotRule.token("intj", EnglishTokens::isIntj))
				.rule(SlotRule.token("neg", t -> isNeg(t) || isNo(t)))
				// verbs
				.declare(VERB, SlotSpec.single("part"))
				.declare(VERB, SlotSpec.multi("aux"))
				.declare(VERB, SlotSpec.single("expl"))
				.rule(VERB, SlotRule.token("part", t -> isPart(t) && !isNeg(t)).inheritedFromLead())
				.rule(VERB, SlotRule.token("aux", t -> isAuxVerb(t) && !isPart(t) && !isConj(t)))
				.rule(VERB, SlotRule.token("expl", EnglishTokens::isExpl))
				.getter(VERB, "tense", EnglishGrammar::getTense)
				.getter(VERB, "modal", EnglishGrammar::getModal)
				.getter(VERB, "mood", EnglishGrammar::getMood)
				// nouns
				.rule(NOUN, SlotRule.token("det", t -> isDet(t) && !isNo(t)).inheritedFromLead())
				// prepositions
				.rule(PREP, SlotRule.children("preps", EnglishTokens::findPreps))
				// descriptions
				.rule(DESC, SlotRule.token("mod", EnglishTokens::isDescMod))
				.rule(DESC, SlotRule.postInit("det", EnglishGrammar::findDescDet))
				.classifier(new EnglishDependencyClassifier())
				.coordination(new EnglishCoordinationRules())
				.build();
	}

	/**
	 * Future with will/shall, past with have, else the tense of the first auxiliary or of the head.
	 */
	static Tense getTense(Component verb)
	{
		for (Token aux : verb.getSlot("aux"))
		{
			final String lemma = aux.getLemma().toLowerCase();
			if (lemma.equals("will") || lemma.equals("shall"))
				return Tense.FUTURE;
			if (lemma.equals("have"))
				return Tense.PAST;
			final Tense tense = tense(aux);
			if (tense != null)
				return tense;
		}
		final Tense tense = tense(verb.getToken());
		return tense != null ? tense : Tense.PRESENT;
	}

	static Modal getModal(Component verb)
	{
		return verb.getSlot("aux").stream()
				.map(a -> modals.get(a.getLemma().toLowerCase()))
				.filter(Objects::nonNull)
				.findFirst()
				.orElse(Modal.NULL);
	}

	static Mood getMood(Component verb)
	{
		return isImpMood(verb.getToken()) ? Mood.IMP : Mood.REAL;
	}

	/**
	 * Determiner of a modifier of the description, e.g. "a" in "a bit too big".
	 */
	static List<Token> findDescDet(Component desc)
	{
		for (Token mod : desc.getSlot("mod"))
		{
			if (isDescMod(mod))
			{
				for (Token child : mod.getChildren())
				{
					if (isDet(child))
						return ImmutableList.of(child);
				}
			}
		}
		return ImmutableList.of();
	}
}
