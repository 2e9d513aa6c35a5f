package edu.upf.taln.phrasegraph.core.grammar;

import edu.upf.taln.phrasegraph.core.Fixtures;
import edu.upf.taln.phrasegraph.core.symbols.Role;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class PhraseTypeTest
{
	@Test
	public void testGoverning()
	{
		final Sentence sentence = Fixtures.sentence(Fixtures.SIMPLE);
		Assert.assertEquals(PhraseType.NP, PhraseType.governing(sentence.getComponent(1)));
		Assert.assertEquals(PhraseType.VP, PhraseType.governing(sentence.getComponent(2)));
		Assert.assertTrue(PhraseType.fromComponent(sentence.getComponent(4)) instanceof NounPhrase);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUngovernedComponent()
	{
		final Sentence sentence = Fixtures.sentence(Fixtures.SIMPLE);
		final Component unknown = new Component(sentence, sentence.getSpan().get(1), Role.NOUN, List.of())
		{
			@Override
			public ComponentType getType() { return ComponentType.NOUN; }
		};
		PhraseType.governing(unknown);
	}
}
