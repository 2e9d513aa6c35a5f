package edu.upf.taln.phrasegraph.core.rules.en;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import edu.upf.taln.phrasegraph.core.symbols.Tense;
import edu.upf.taln.phrasegraph.core.tokens.Token;
import edu.upf.taln.phrasegraph.core.utils.POS;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Token-level predicates of the rule-based English grammar.
 * Dependency labels follow the ClearNLP scheme used by spaCy English models; the equivalent Universal
 * Dependencies labels are accepted too.
 */
public final class EnglishTokens
{
	private static final Map<String, String> ud_labels = ImmutableMap.<String, String>builder()
			.put("root", "ROOT")
			.put("obj", "dobj")
			.put("nsubj:pass", "nsubjpass")
			.put("csubj:pass", "csubjpass")
			.put("aux:pass", "auxpass")
			.put("nmod:poss", "poss")
			.put("acl:relcl", "relcl")
			.put("obl:npmod", "npadvmod")
			.put("obl:agent", "agent")
			.put("cc:preconj", "preconj")
			.put("det:predet", "predet")
			.put("compound:prt", "prt")
			.build();
	private static final Set<String> no_lemmas = ImmutableSet.of("no", "never");

	private EnglishTokens() {}

	/**
	 * @return dependency label of the token in the ClearNLP scheme
	 */
	public static String dep(Token t)
	{
		final String dep = t.getDep();
		return ud_labels.getOrDefault(dep, dep);
	}

	private static boolean dep(Token t, String label) { return dep(t).equals(label); }
	private static boolean pos(Token t, POS.Tag tag) { return t.getPOS() == tag; }
	private static String lemma(Token t) { return t.getLemma().toLowerCase(); }

	// Coordination

	/**
	 * Tokens coordinated with t: the first token of its conj chain and every token attached to the chain
	 * through right conj dependents, excluding t.
	 */
	public static List<Token> conjuncts(Token t)
	{
		Token start = t;
		while (!start.isRoot() && isConj(start))
			start = start.getHead();

		final List<Token> chain = new ArrayList<>();
		chain.add(start);
		for (int i = 0; i < chain.size(); ++i)
		{
			for (Token child : chain.get(i).getRights())
			{
				if (isConj(child) && !chain.contains(child))
					chain.add(child);
			}
		}
		return chain.stream()
				.filter(c -> !c.equals(t))
				.sorted()
				.collect(Collectors.toList());
	}

	/**
	 * @return first token of the conj chain of t that is not a conjunct itself, or t
	 */
	public static Token lead(Token t)
	{
		return conjuncts(t).stream()
				.filter(c -> !isConj(c))
				.findFirst()
				.orElse(t);
	}

	public static boolean isPreconj(Token t) { return dep(t, "preconj"); }
	public static boolean isCconj(Token t) { return pos(t, POS.Tag.CCONJ) && !isPreconj(t); }
	public static boolean isSconj(Token t) { return pos(t, POS.Tag.SCONJ); }
	public static boolean isConj(Token t) { return dep(t, "conj"); }

	// Nouns

	public static boolean isPron(Token t) { return pos(t, POS.Tag.PRON); }
	public static boolean isNoun(Token t) { return pos(t, POS.Tag.NOUN) || pos(t, POS.Tag.PROPN); }
	public static boolean isNum(Token t) { return pos(t, POS.Tag.NUM); }
	public static boolean isNumNoun(Token t) { return isNum(t) && !isNummod(t); }
	public static boolean isNounlike(Token t) { return isNoun(t) || isPron(t) || isNumNoun(t); }

	public static boolean isNmod(Token t) { return dep(t, "nmod"); }
	public static boolean isNpadvmod(Token t) { return dep(t, "npadvmod"); }
	public static boolean isCompound(Token t) { return dep(t, "compound"); }
	public static boolean isNummod(Token t) { return dep(t, "nummod"); }
	public static boolean isNounMod(Token t) { return isNmod(t) || isNummod(t) || isNpadvmod(t) || isCompound(t); }

	public static boolean isNpHead(Token t)
	{
		return (isNounlike(t) || isNounMod(t)) && !isPoss(t) && !isExpl(t) && !isDescMod(t);
	}

	// Verbs

	public static boolean isVerb(Token t) { return pos(t, POS.Tag.VERB); }
	public static boolean isAux(Token t) { return pos(t, POS.Tag.AUX); }
	public static boolean isAuxpass(Token t) { return dep(t, "auxpass"); }
	public static boolean isVerblike(Token t) { return isVerb(t) || isAux(t) || isAuxpass(t); }

	/**
	 * Auxiliaries attached to a verb, as opposed to auxiliaries acting as main verbs.
	 */
	public static boolean isAuxVerb(Token t)
	{
		return (isAux(t) || isAuxpass(t)) && isVerblike(t.getHead()) && !isRoot(t) && !isCcomp(t) && !isAdvcl(t);
	}

	public static boolean isVpHead(Token t)
	{
		return !isAuxVerb(lead(t)) && isVerblike(t) && !isAmod(t) && !isPrep(t);
	}

	public static boolean isOprd(Token t) { return dep(t, "oprd"); }

	// Subjects and objects

	public static boolean isNsubj(Token t) { return dep(t, "nsubj"); }
	public static boolean isCsubj(Token t) { return dep(t, "csubj"); }
	public static boolean isSubj(Token t) { return isNsubj(t) || isCsubj(t); }
	public static boolean isSubjpass(Token t) { return dep(t, "nsubjpass") || dep(t, "csubjpass"); }
	public static boolean isDobj(Token t) { return dep(t, "dobj"); }
	public static boolean isIobj(Token t) { return dep(t, "iobj") || dep(t, "dative"); }

	// Prepositions

	public static boolean isAdp(Token t) { return pos(t, POS.Tag.ADP); }
	public static boolean isPrep(Token t) { return dep(t, "prep"); }
	public static boolean isPreplike(Token t) { return (isAdp(t) && !isAgent(t)) || isPrep(t); }

	public static boolean isPpHead(Token t)
	{
		return (isPreplike(t) || isAgent(t)) && !isPreplike(lead(t).getHead());
	}

	/**
	 * @return t followed by the chain of prepositions below it, if t is a preposition
	 */
	public static List<Token> findPreps(Token t)
	{
		final List<Token> preps = new ArrayList<>();
		if (isPrep(t) && !isConj(t))
		{
			preps.add(t);
			for (Token child : t.getChildren())
				preps.addAll(findPreps(child));
		}
		return preps;
	}

	// Descriptions

	public static boolean isAdj(Token t) { return pos(t, POS.Tag.ADJ); }
	public static boolean isAdv(Token t) { return pos(t, POS.Tag.ADV); }
	public static boolean isAdvmod(Token t) { return dep(t, "advmod"); }
	public static boolean isAmod(Token t) { return dep(t, "amod"); }
	public static boolean isPoss(Token t) { return dep(t, "poss"); }
	public static boolean isAppos(Token t) { return dep(t, "appos"); }

	public static boolean isDpHead(Token t)
	{
		final Token lead = lead(t);
		return !isNeg(lead) && !isDescMod(lead) &&
				(isAdj(t) || isAdv(t) || isPoss(t) || (isVerblike(t) && isAmod(t)));
	}

	/**
	 * Modifiers of adjectives and adverbs, e.g. "very" in "very big".
	 */
	public static boolean isDescMod(Token t)
	{
		final Token head = t.getHead();
		return (isAdv(head) || isAdj(head)) && (isAdvmod(t) || isNpadvmod(t) || isAmod(t));
	}

	// Clauses and complements

	public static boolean isAcl(Token t) { return dep(t, "acl"); }
	public static boolean isAdvcl(Token t) { return dep(t, "advcl"); }
	public static boolean isRelcl(Token t) { return dep(t, "relcl"); }
	public static boolean isXcomp(Token t) { return dep(t, "xcomp"); }
	public static boolean isCcomp(Token t) { return dep(t, "ccomp"); }
	public static boolean isAcomp(Token t) { return dep(t, "acomp"); }

	// Other

	public static boolean isRoot(Token t) { return dep(t, "ROOT"); }

	public static boolean isImpMood(Token t)
	{
		return isRoot(lead(t)) && t.getMorph("VerbForm").contains("Inf");
	}

	public static boolean isDet(Token t) { return pos(t, POS.Tag.DET); }
	public static boolean isNeg(Token t) { return dep(t, "neg"); }
	public static boolean isNo(Token t) { return dep(t, "det") && no_lemmas.contains(lemma(t)); }

	public static boolean isPart(Token t) { return pos(t, POS.Tag.PART); }
	public static boolean isAgent(Token t) { return dep(t, "agent"); }
	public static boolean isExpl(Token t) { return dep(t, "expl"); }
	public static boolean isAttr(Token t) { return dep(t, "attr"); }
	public static boolean isPunct(Token t) { return pos(t, POS.Tag.PUNCT); }
	public static boolean isQmark(Token t) { return isPunct(t) && lemma(t).equals("?"); }
	public static boolean isExclam(Token t) { return isPunct(t) && lemma(t).equals("!"); }
	public static boolean isIntj(Token t) { return pos(t, POS.Tag.INTJ); }

	/**
	 * @return tense from the Tense morphological feature, or null
	 */
	public static Tense tense(Token t)
	{
		final List<String> tense = t.getMorph("Tense");
		if (tense.contains("Past"))
			return Tense.PAST;
		if (tense.contains("Pres"))
			return Tense.PRESENT;
		return null;
	}
}
