package edu.upf.taln.phrasegraph.core.io;

import edu.upf.taln.phrasegraph.core.Fixtures;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import edu.upf.taln.phrasegraph.core.tokens.Token;
import edu.upf.taln.phrasegraph.core.utils.POS;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class CoNLLUReaderTest
{
	@Test
	public void testRead()
	{
		final List<Document> docs = new CoNLLUReader().read(Fixtures.readResource("sentences.conllu"));
		Assert.assertEquals(1, docs.size());

		final Document doc = docs.get(0);
		Assert.assertEquals("examples", doc.getId());
		Assert.assertEquals(27, doc.size());
		Assert.assertEquals(4, doc.getSentences().size());
		Assert.assertEquals(6, doc.getSentences().get(1).getStart());

		final Token cooked = doc.get(7);
		Assert.assertEquals("cooked", cooked.getText());
		Assert.assertEquals("cook", cooked.getLemma());
		Assert.assertEquals(POS.Tag.VERB, cooked.getPOS());
		Assert.assertEquals("VBD", cooked.getTag());
		Assert.assertEquals("ROOT", cooked.getDep());
		Assert.assertTrue(cooked.isRoot());
		Assert.assertEquals(List.of("Past"), cooked.getMorph("Tense"));
		Assert.assertEquals(cooked, doc.get(6).getHead());
		Assert.assertEquals("PERSON", doc.get(6).getEnt());
		Assert.assertEquals("", doc.get(4).getWhitespace());
		Assert.assertEquals("The cat chased the mouse.", doc.getSentences().get(0).getText());
	}

	@Test
	public void testDocumentsAndSkippedIds()
	{
		final String conllu = "# newdoc id = a\n" +
				"1-2\tdon't\t_\t_\t_\t_\t_\t_\t_\t_\n" +
				"1\tdo\tdo\tAUX\tVBP\t_\t3\taux\t_\t_\n" +
				"2\tn't\tnot\tPART\tRB\t_\t3\tneg\t_\t_\n" +
				"3\tgo\tgo\tVERB\tVB\tVerbForm=Inf\t0\tROOT\t_\tCoref=0\n" +
				"3.1\tgone\t_\t_\t_\t_\t_\t_\t_\t_\n" +
				"\n" +
				"# newdoc id = b\n" +
				"1\tHi\thi\t_\tUH\t_\t0\tROOT\t_\tSpaceAfter=No\n" +
				"2\t!\t!\tPUNCT\t.\t_\t1\tpunct\t_\t_\n";
		final List<Document> docs = new CoNLLUReader().read(conllu);
		Assert.assertEquals(2, docs.size());
		Assert.assertEquals(3, docs.get(0).size());
		Assert.assertEquals(List.of(docs.get(0).get(0)), docs.get(0).get(2).getCorefs());
		Assert.assertEquals(List.of("Inf"), docs.get(0).get(2).getMorph("VerbForm"));

		final Document b = docs.get(1);
		Assert.assertEquals("b", b.getId());
		Assert.assertEquals(POS.Tag.INTJ, b.get(0).getPOS());
		Assert.assertEquals("Hi!", b.getSentences().get(0).getText());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testWrongColumns()
	{
		new CoNLLUReader().read("1\tHi\thi\tINTJ\n");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidHead()
	{
		new CoNLLUReader().read("1\tHi\thi\tINTJ\tUH\t_\tx\tROOT\t_\t_\n");
	}
}
