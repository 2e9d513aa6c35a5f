package edu.upf.taln.phrasegraph.core.extraction;

import edu.upf.taln.phrasegraph.core.Fixtures;
import edu.upf.taln.phrasegraph.core.Options;
import edu.upf.taln.phrasegraph.core.grammar.*;
import edu.upf.taln.phrasegraph.core.rules.Grammars;
import edu.upf.taln.phrasegraph.core.symbols.Dep;
import edu.upf.taln.phrasegraph.core.symbols.Tense;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import edu.upf.taln.phrasegraph.core.tokens.InvalidSentenceException;
import edu.upf.taln.phrasegraph.core.tokens.TokenData;
import edu.upf.taln.phrasegraph.core.utils.POS;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class GrammarSentenceFactoryTest
{
	private static Phrase phrase(Sentence sentence, int offset)
	{
		return sentence.getPhrase(sentence.getStart() + offset);
	}

	private static Sentence create(List<TokenData> data, Options options)
	{
		final Document doc = new Document("test", data, List.of(Pair.of(0, data.size())));
		return new GrammarSentenceFactory(Grammars.resolve(options), options).create(doc.getSentences().get(0));
	}

	private static List<String> texts(List<Phrase> phrases)
	{
		return phrases.stream().map(Phrase::getText).collect(Collectors.toList());
	}

	@Test
	public void testBasicRelations()
	{
		final Sentence sentence = Fixtures.sentence(Fixtures.SIMPLE);
		Assert.assertEquals(3, sentence.getComponents().size());

		final Phrase chased = phrase(sentence, 2);
		Assert.assertTrue(chased instanceof VerbPhrase);
		Assert.assertEquals(Dep.ROOT, chased.getDep());
		Assert.assertEquals(List.of(chased), sentence.getSources());

		final List<Phrase> subj = chased.getSubj();
		Assert.assertEquals(1, subj.size());
		Assert.assertTrue(subj.get(0) instanceof NounPhrase);
		Assert.assertEquals("cat", subj.get(0).getToken().getText());
		Assert.assertEquals(List.of(phrase(sentence, 4)), chased.getDobj());

		final Noun cat = (Noun) sentence.getComponent(sentence.getStart() + 1);
		Assert.assertEquals("The", cat.getDet().getText());
		Assert.assertEquals("The cat", cat.toString());
		Assert.assertEquals(Tense.PAST, ((Verb) chased.getComponent()).getTense());
	}

	@Test
	public void testInvariants()
	{
		for (int i = 0; i < 4; ++i)
		{
			final Sentence sentence = Fixtures.sentence(i);
			Assert.assertTrue(sentence.isDag());
			Assert.assertEquals(1.0, sentence.getCoverage(), 0.0);
			Assert.assertTrue(sentence.isCovered());
		}
	}

	@Test
	public void testCheckedInvariants()
	{
		final Options options = new Options();
		options.check_invariants = true;
		for (int i = 0; i < 4; ++i)
			Assert.assertTrue(Fixtures.sentence(i, options).isCovered());
	}

	@Test
	public void testPunctuationIsSubToken()
	{
		final Sentence sentence = Fixtures.sentence(Fixtures.SIMPLE);
		final Component chased = sentence.getComponent(sentence.getStart() + 2);
		Assert.assertEquals(List.of(sentence.getSpan().get(5)), chased.getSub());
	}

	@Test
	public void testSubjectPropagation()
	{
		final Sentence sentence = Fixtures.sentence(Fixtures.COORDINATION);
		final Phrase cooked = phrase(sentence, 1);
		final Phrase ate = phrase(sentence, 3);

		Assert.assertEquals(List.of("John"), texts(cooked.getSubj()));
		Assert.assertEquals(List.of("John"), texts(ate.getSubj()));
		Assert.assertEquals(List.of("the cake"), texts(ate.getDobj()));

		final Conjuncts group = ate.getGroup();
		Assert.assertEquals(List.of(cooked, ate), group.getMembers());
		Assert.assertEquals(cooked, group.getLead());
		Assert.assertEquals("and", group.getCconj().getText());
		Assert.assertNull(group.getPreconj());
		Assert.assertTrue(cooked.isLead());
		Assert.assertFalse(ate.isLead());
		Assert.assertEquals(List.of(ate), cooked.getConjuncts());
		Assert.assertEquals(List.of(cooked, ate), sentence.getSources());
		Assert.assertEquals(group, sentence.getRootGroup());
	}

	@Test
	public void testNoCoordinateEdges()
	{
		for (int i = 0; i < 4; ++i)
		{
			final Sentence sentence = Fixtures.sentence(i);
			for (Phrase p : sentence.getPhrases())
			{
				Assert.assertFalse(p.getDep().has(Dep.CONJ));
				for (Phrase c : p.getChildren())
					Assert.assertFalse(c.getDep().has(Dep.CONJ));
			}
		}
	}

	@Test
	public void testRelativeClause()
	{
		final Sentence sentence = Fixtures.sentence(Fixtures.RELATIVE);
		final Phrase book = phrase(sentence, 1);
		final Phrase read = phrase(sentence, 4);
		Assert.assertTrue(book instanceof NounPhrase);
		Assert.assertEquals(List.of(read), book.getRelcl());
		Assert.assertEquals(List.of("she"), texts(read.getSubj()));
		Assert.assertEquals(List.of("that"), texts(read.getDobj()));

		final Phrase was = phrase(sentence, 5);
		Assert.assertEquals(Dep.ROOT, was.getDep());
		Assert.assertEquals(List.of(book), was.getSubj());
		Assert.assertEquals(List.of(phrase(sentence, 6)), was.getAdesc());
		Assert.assertTrue(phrase(sentence, 6) instanceof DescPhrase);
		Assert.assertEquals(2, read.getDepth());
		Assert.assertEquals(List.of(book, was), read.getSupdag());
	}

	@Test
	public void testPreconjunction()
	{
		final Sentence sentence = Fixtures.sentence(Fixtures.PRECONJ);
		final Phrase john = phrase(sentence, 1);
		final Phrase mary = phrase(sentence, 3);
		final Phrase left = phrase(sentence, 4);

		Assert.assertEquals(List.of(john, mary), left.getSubj());
		final Conjuncts group = sentence.getConjuncts(john.getIndex()).orElseThrow();
		Assert.assertEquals("or", group.getCconj().getText());
		Assert.assertEquals("Either", group.getPreconj().getText());
		Assert.assertEquals(Dep.SUBJ, mary.getDep());
		Assert.assertEquals(Dep.SUBJ, group.getDep());
	}

	@Test
	public void testAsyndeticCoordination()
	{
		// "She came, saw, conquered"
		final List<TokenData> data = List.of(
				new TokenData("She", " ", "she", POS.Tag.PRON, "nsubj", 1),
				new TokenData("came", "", "come", POS.Tag.VERB, "ROOT", 1),
				new TokenData(",", " ", ",", POS.Tag.PUNCT, "punct", 1),
				new TokenData("saw", "", "see", POS.Tag.VERB, "conj", 1),
				new TokenData(",", " ", ",", POS.Tag.PUNCT, "punct", 3),
				new TokenData("conquered", "", "conquer", POS.Tag.VERB, "conj", 3));
		final Document doc = new Document("asyndetic", data, List.of(Pair.of(0, data.size())));

		final Options options = new Options();
		Sentence sentence = new GrammarSentenceFactory(Grammars.resolve(options), options).create(doc.getSentences().get(0));
		final Conjuncts group = sentence.getPhrase(3).getGroup();
		Assert.assertEquals(3, group.size());
		Assert.assertNull(group.getCconj());
		Assert.assertEquals(1, group.getLead().getIndex());
		Assert.assertEquals(List.of("She"), texts(sentence.getPhrase(5).getSubj()));

		options.resolve_asyndetic = false;
		sentence = new GrammarSentenceFactory(Grammars.resolve(options), options).create(doc.getSentences().get(0));
		Assert.assertTrue(sentence.getConjuncts().isEmpty());
		Assert.assertEquals(1, sentence.getPhrase(3).getGroup().size());
	}

	@Test
	public void testPrepositionalPhrase()
	{
		// "The cat sat on the mat." with Universal Dependencies labels
		final List<TokenData> data = List.of(
				new TokenData("The", " ", "the", POS.Tag.DET, "det", 1),
				new TokenData("cat", " ", "cat", POS.Tag.NOUN, "nsubj", 2),
				new TokenData("sat", " ", "sit", POS.Tag.VERB, "root", 2),
				new TokenData("on", " ", "on", POS.Tag.ADP, "prep", 2),
				new TokenData("the", " ", "the", POS.Tag.DET, "det", 5),
				new TokenData("mat", "", "mat", POS.Tag.NOUN, "pobj", 3),
				new TokenData(".", "", ".", POS.Tag.PUNCT, "punct", 2));
		final Document doc = new Document("pp", data, List.of(Pair.of(0, data.size())));
		final Options options = new Options();
		options.check_invariants = true;
		final Sentence sentence = new GrammarSentenceFactory(Grammars.resolve(options), options).create(doc.getSentences().get(0));

		final Phrase sat = sentence.getPhrase(2);
		final Phrase on = sentence.getPhrase(3);
		Assert.assertEquals(List.of(on), sat.getPrep());
		Assert.assertTrue(on instanceof PrepPhrase);
		Assert.assertEquals(Dep.PREP, on.getDep());
		Assert.assertEquals(List.of("the mat"), texts(on.getPobj()));
		Assert.assertEquals(1, sat.getPreps().size());
		Assert.assertEquals("The cat sat on the mat", sat.getText());
	}

	@Test
	public void testDescriptionPropagation()
	{
		// "Quickly John cooked and ate the cake."
		final List<TokenData> data = List.of(
				new TokenData("Quickly", " ", "quickly", POS.Tag.ADV, "advmod", 2),
				new TokenData("John", " ", "John", POS.Tag.PROPN, "nsubj", 2),
				new TokenData("cooked", " ", "cook", POS.Tag.VERB, "ROOT", 2),
				new TokenData("and", " ", "and", POS.Tag.CCONJ, "cc", 2),
				new TokenData("ate", " ", "eat", POS.Tag.VERB, "conj", 2),
				new TokenData("the", " ", "the", POS.Tag.DET, "det", 6),
				new TokenData("cake", "", "cake", POS.Tag.NOUN, "dobj", 4),
				new TokenData(".", "", ".", POS.Tag.PUNCT, "punct", 2));
		final Sentence sentence = create(data, new Options());

		final Phrase quickly = sentence.getPhrase(0);
		Assert.assertTrue(quickly instanceof DescPhrase);
		Assert.assertEquals(List.of(quickly), sentence.getPhrase(2).getDesc());
		Assert.assertEquals(List.of(quickly), sentence.getPhrase(4).getDesc());
		Assert.assertEquals(List.of("John"), texts(sentence.getPhrase(4).getSubj()));
		Assert.assertTrue(sentence.isDag());
	}

	@Test
	public void testSubclausePropagation()
	{
		// "It seems happy and rich because it won."
		final List<TokenData> data = List.of(
				new TokenData("It", " ", "it", POS.Tag.PRON, "nsubj", 1),
				new TokenData("seems", " ", "seem", POS.Tag.VERB, "ROOT", 1),
				new TokenData("happy", " ", "happy", POS.Tag.ADJ, "ccomp", 1),
				new TokenData("and", " ", "and", POS.Tag.CCONJ, "cc", 2),
				new TokenData("rich", " ", "rich", POS.Tag.ADJ, "conj", 2),
				new TokenData("because", " ", "because", POS.Tag.SCONJ, "mark", 7),
				new TokenData("it", " ", "it", POS.Tag.PRON, "nsubj", 7),
				new TokenData("won", "", "win", POS.Tag.VERB, "advcl", 2),
				new TokenData(".", "", ".", POS.Tag.PUNCT, "punct", 1));
		final Options options = new Options();
		options.check_invariants = true;
		final Sentence sentence = create(data, options);

		final Phrase happy = sentence.getPhrase(2);
		final Phrase rich = sentence.getPhrase(4);
		final Phrase won = sentence.getPhrase(7);
		Assert.assertTrue(happy.getDep().has(Dep.CDESC));
		Assert.assertEquals(List.of(happy, rich), sentence.getPhrase(1).getCdesc());
		Assert.assertEquals(List.of(won), happy.getSubcl());
		Assert.assertEquals(List.of(won), rich.getSubcl());
		Assert.assertEquals("because", won.getSconj().getText());
	}

	@Test(timeout = 5000)
	public void testLongCoordination()
	{
		// "I like n0 , n1 , ... , and n15 ." with every conjunct attached to the previous one
		final int size = 16;
		final List<TokenData> data = new ArrayList<>();
		data.add(new TokenData("I", " ", "I", POS.Tag.PRON, "nsubj", 1));
		data.add(new TokenData("like", " ", "like", POS.Tag.VERB, "ROOT", 1));
		final List<Integer> nouns = new ArrayList<>();
		for (int k = 0; k < size; ++k)
		{
			if (k == 0)
			{
				nouns.add(data.size());
				data.add(new TokenData("n0", " ", "n0", POS.Tag.NOUN, "dobj", 1));
				continue;
			}
			final int previous = nouns.get(k - 1);
			data.add(new TokenData(",", " ", ",", POS.Tag.PUNCT, "punct", previous));
			if (k == size - 1)
				data.add(new TokenData("and", " ", "and", POS.Tag.CCONJ, "cc", previous));
			nouns.add(data.size());
			data.add(new TokenData("n" + k, " ", "n" + k, POS.Tag.NOUN, "conj", previous));
		}
		data.add(new TokenData(".", "", ".", POS.Tag.PUNCT, "punct", 1));

		final Sentence sentence = create(data, new Options());
		Assert.assertEquals(1, sentence.getConjuncts().size());
		final Conjuncts group = sentence.getPhrase(nouns.get(0)).getGroup();
		Assert.assertEquals(size, group.size());
		Assert.assertEquals(nouns.get(0).intValue(), group.getLead().getIndex());
		Assert.assertEquals("and", group.getCconj().getText());
		Assert.assertEquals(size, sentence.getPhrase(1).getDobj().size());
		Assert.assertTrue(sentence.isDag());
		Assert.assertTrue(sentence.isCovered());
	}

	@Test
	public void testSharedDeterminerCoverage()
	{
		// "the cats and dogs": the determiner of the lead also serves its conjunct
		final List<TokenData> data = List.of(
				new TokenData("the", " ", "the", POS.Tag.DET, "det", 1),
				new TokenData("cats", " ", "cat", POS.Tag.NOUN, "ROOT", 1),
				new TokenData("and", " ", "and", POS.Tag.CCONJ, "cc", 1),
				new TokenData("dogs", "", "dog", POS.Tag.NOUN, "conj", 1));
		final Options options = new Options();
		options.check_invariants = true;
		final Sentence sentence = create(data, options);

		Assert.assertEquals("the", ((Noun) sentence.getComponent(3)).getDet().getText());
		Assert.assertEquals(1.0, sentence.getCoverage(), 0.0);
		Assert.assertTrue(sentence.isCovered());
	}

	@Test(expected = InvalidSentenceException.class)
	public void testInvalidSpan()
	{
		final Document doc = Fixtures.document();
		final Options options = new Options();
		// "The cat": the subject is headed outside the span
		new GrammarSentenceFactory(Grammars.resolve(options), options).create(doc.getSpan(0, 2));
	}
}
