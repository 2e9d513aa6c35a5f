package edu.upf.taln.phrasegraph.core.rules.en;

import edu.upf.taln.phrasegraph.core.Fixtures;
import edu.upf.taln.phrasegraph.core.symbols.Tense;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import edu.upf.taln.phrasegraph.core.tokens.Span;
import edu.upf.taln.phrasegraph.core.tokens.Token;
import edu.upf.taln.phrasegraph.core.tokens.TokenData;
import edu.upf.taln.phrasegraph.core.utils.POS;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class EnglishTokensTest
{
	private static Span sentence(int i)
	{
		return Fixtures.document().getSentences().get(i);
	}

	@Test
	public void testConjuncts()
	{
		final Span s = sentence(Fixtures.COORDINATION);
		final Token cooked = s.get(1);
		final Token ate = s.get(3);
		Assert.assertEquals(List.of(ate), EnglishTokens.conjuncts(cooked));
		Assert.assertEquals(List.of(cooked), EnglishTokens.conjuncts(ate));
		Assert.assertTrue(EnglishTokens.conjuncts(s.get(0)).isEmpty());
		Assert.assertEquals(cooked, EnglishTokens.lead(ate));
		Assert.assertEquals(cooked, EnglishTokens.lead(cooked));
		Assert.assertTrue(EnglishTokens.isCconj(s.get(2)));
		Assert.assertTrue(EnglishTokens.isConj(ate));
	}

	@Test
	public void testPreconj()
	{
		final Span s = sentence(Fixtures.PRECONJ);
		Assert.assertTrue(EnglishTokens.isPreconj(s.get(0)));
		Assert.assertFalse(EnglishTokens.isCconj(s.get(0)));
		Assert.assertTrue(EnglishTokens.isCconj(s.get(2)));
		Assert.assertEquals(s.get(1), EnglishTokens.lead(s.get(3)));
	}

	@Test
	public void testHeads()
	{
		final Span s = sentence(Fixtures.RELATIVE);
		Assert.assertTrue(EnglishTokens.isNpHead(s.get(1)));
		Assert.assertTrue(EnglishTokens.isNpHead(s.get(2)));
		Assert.assertFalse(EnglishTokens.isNpHead(s.get(0)));
		Assert.assertTrue(EnglishTokens.isVpHead(s.get(4)));
		Assert.assertTrue(EnglishTokens.isVpHead(s.get(5)));
		Assert.assertFalse(EnglishTokens.isAuxVerb(s.get(5)));
		Assert.assertTrue(EnglishTokens.isDpHead(s.get(6)));
		Assert.assertFalse(EnglishTokens.isPpHead(s.get(6)));
		Assert.assertEquals(Tense.PAST, EnglishTokens.tense(s.get(5)));
		Assert.assertNull(EnglishTokens.tense(s.get(6)));
	}

	@Test
	public void testUniversalLabels()
	{
		// "It was eaten by him" with Universal Dependencies labels
		final List<TokenData> data = List.of(
				new TokenData("It", " ", "it", POS.Tag.PRON, "nsubj:pass", 2),
				new TokenData("was", " ", "be", POS.Tag.AUX, "aux:pass", 2),
				new TokenData("eaten", " ", "eat", POS.Tag.VERB, "root", 2),
				new TokenData("by", " ", "by", POS.Tag.ADP, "obl:agent", 2),
				new TokenData("him", "", "he", POS.Tag.PRON, "pobj", 3));
		final Document doc = new Document("ud", data, List.of(Pair.of(0, data.size())));

		Assert.assertEquals("nsubjpass", EnglishTokens.dep(doc.get(0)));
		Assert.assertTrue(EnglishTokens.isSubjpass(doc.get(0)));
		Assert.assertTrue(EnglishTokens.isAuxpass(doc.get(1)));
		Assert.assertTrue(EnglishTokens.isAuxVerb(doc.get(1)));
		Assert.assertTrue(EnglishTokens.isRoot(doc.get(2)));
		Assert.assertTrue(EnglishTokens.isAgent(doc.get(3)));
		Assert.assertFalse(EnglishTokens.isPreplike(doc.get(3)));
		Assert.assertTrue(EnglishTokens.isPpHead(doc.get(3)));
	}

	@Test
	public void testFindPreps()
	{
		// "out of"
		final List<TokenData> data = List.of(
				new TokenData("ran", " ", "run", POS.Tag.VERB, "ROOT", 0),
				new TokenData("out", " ", "out", POS.Tag.ADP, "prep", 0),
				new TokenData("of", " ", "of", POS.Tag.ADP, "prep", 1),
				new TokenData("time", "", "time", POS.Tag.NOUN, "pobj", 2));
		final Document doc = new Document("preps", data, List.of(Pair.of(0, data.size())));
		Assert.assertEquals(List.of(doc.get(2)), EnglishTokens.findPreps(doc.get(2)));
		Assert.assertEquals(List.of(doc.get(1), doc.get(2)), EnglishTokens.findPreps(doc.get(1)));
		Assert.assertTrue(EnglishTokens.findPreps(doc.get(3)).isEmpty());
		Assert.assertTrue(EnglishTokens.isPpHead(doc.get(1)));
		Assert.assertFalse(EnglishTokens.isPpHead(doc.get(2)));
	}

	@Test
	public void testFixedRoles()
	{
		final List<TokenData> data = List.of(
				new TokenData("Oh", " ", "oh", POS.Tag.INTJ, "intj", 2),
				new TokenData("no", " ", "no", POS.Tag.DET, "det", 2),
				new TokenData("way", "", "way", POS.Tag.NOUN, "ROOT", 2),
				new TokenData("?", "", "?", POS.Tag.PUNCT, "punct", 2));
		final Document doc = new Document("roles", data, List.of(Pair.of(0, data.size())));
		Assert.assertTrue(EnglishTokens.isIntj(doc.get(0)));
		Assert.assertTrue(EnglishTokens.isNo(doc.get(1)));
		Assert.assertTrue(EnglishTokens.isDet(doc.get(1)));
		Assert.assertTrue(EnglishTokens.isQmark(doc.get(3)));
		Assert.assertFalse(EnglishTokens.isExclam(doc.get(3)));
	}
}
