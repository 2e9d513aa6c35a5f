package edu.upf.taln.phrasegraph.core.rules.en;

import edu.upf.taln.phrasegraph.core.grammar.Component;
import edu.upf.taln.phrasegraph.core.rules.DependencyClassifier;
import edu.upf.taln.phrasegraph.core.symbols.Dep;
import edu.upf.taln.phrasegraph.core.tokens.Token;

import static edu.upf.taln.phrasegraph.core.rules.en.EnglishTokens.*;

/**
 * Relation of a component to its parent, from the labels and POS tags of their head tokens.
 */
public class EnglishDependencyClassifier implements DependencyClassifier
{
	@Override
	public Dep classify(Component child, Component parent)
	{
		final Token tok = child.getToken();
		final Token head = parent.getToken();

		Dep dep = Dep.NONE;
		if (isConj(tok))
			dep = dep.or(Dep.CONJ);
		if (isPreplike(tok))
			return dep.or(Dep.PREP);
		if (isSubj(tok))
			dep = dep.or(Dep.SUBJ);
		if (isAgent(tok))
			return dep.or(Dep.AGENT);

		if (isPreplike(head))
		{
			if (isAdvmod(tok))
				return dep.or(Dep.DESC);
			dep = dep.or(Dep.POBJ);
		}
		if (isNounlike(head))
		{
			if (isAdj(tok) || isPoss(tok) || isAmod(tok) || isAcomp(tok))
				dep = dep.or(Dep.DESC);
			if (isAcl(tok))
				dep = dep.or(Dep.ACL);
			if (isRelcl(tok))
				dep = dep.or(Dep.RELCL);
			if (isNounMod(tok))
				dep = dep.or(Dep.NMOD);
			if (isAppos(tok))
				dep = dep.or(Dep.APPOS);
		}
		if (isVerblike(head))
		{
			if (isSubjpass(tok) || isDobj(tok))
				dep = dep.or(Dep.DOBJ);
			if (isIobj(tok))
				dep = dep.or(Dep.IOBJ);
			if (isOprd(tok) || isAttr(tok) || isAcomp(tok))
				dep = dep.or(Dep.ADESC);
			if ((isAdj(tok) || isNounlike(tok)) && (isCcomp(tok) || isAdvcl(tok)))
				dep = dep.or(Dep.CDESC);
			if (isAdv(tok))
				dep = dep.or(Dep.DESC);
			if (isImpMood(head) && isNpadvmod(tok))
				dep = dep.or(Dep.SUBJ);
		}
		if (isAgent(head))
			dep = dep.or(Dep.SUBJ);
		if (isVerblike(tok) && !isAcomp(tok) && !isXcomp(tok) && !dep.has(Dep.CONJ.or(Dep.DESC)))
			dep = dep.or(Dep.SUBCL);
		if (isXcomp(tok))
			dep = dep.or(Dep.XCOMP);

		return dep.isEmpty() ? Dep.MISC : dep;
	}
}
