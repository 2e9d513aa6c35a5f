package edu.upf.taln.phrasegraph.core.utils;


import java.util.Map;

import static java.util.Map.entry;

/**
 * UD 2 part-of-speech tags and conversion of fine-grained tagsets to them.
 * See https://universaldependencies.org/tagset-conversion/index.html
 */
public class POS
{
	public enum Tag
	{ADJ, ADP, PUNCT, ADV, AUX, SYM, INTJ, CCONJ, X, NOUN, DET, PROPN, NUM, VERB, PART, PRON, SCONJ}

	public enum Tagset
	{UD, EnglishPTB}

	/**
	 * @return the UD tag for a tag in the given tagset, or X if the tag is unknown
	 */
	public static Tag get(String tag, Tagset tagset)
	{
		switch (tagset)
		{
			case UD:
				return fromUD(tag);
			case EnglishPTB:
				return EnglishPTB.getOrDefault(tag, Tag.X);
			default:
				return Tag.X;
		}
	}

	private static Tag fromUD(String tag)
	{
		try
		{
			return Tag.valueOf(tag.trim().toUpperCase());
		}
		catch (IllegalArgumentException e)
		{
			return Tag.X;
		}
	}

	public static Map<String, Tag> EnglishPTB = Map.ofEntries(
			entry("#", Tag.SYM),
			entry("$", Tag.SYM),
			entry("''", Tag.PUNCT),
			entry(",", Tag.PUNCT),
			entry("-LRB-", Tag.PUNCT),
			entry("-RRB-", Tag.PUNCT),
			entry(".", Tag.PUNCT),
			entry(":", Tag.PUNCT),
			entry("ADD", Tag.X),
			entry("AFX", Tag.ADJ),
			entry("CC", Tag.CCONJ),
			entry("CD", Tag.NUM),
			entry("DT", Tag.DET),
			entry("EX", Tag.PRON),
			entry("FW", Tag.X),
			entry("HYPH", Tag.PUNCT),
			entry("IN", Tag.ADP),
			entry("JJ", Tag.ADJ),
			entry("JJR", Tag.ADJ),
			entry("JJS", Tag.ADJ),
			entry("LS", Tag.X),
			entry("MD", Tag.AUX),
			entry("NFP", Tag.PUNCT),
			entry("NIL", Tag.X),
			entry("NN", Tag.NOUN),
			entry("NNP", Tag.PROPN),
			entry("NNPS", Tag.PROPN),
			entry("NNS", Tag.NOUN),
			entry("PDT", Tag.DET),
			entry("POS", Tag.PART),
			entry("PRP", Tag.PRON),
			entry("PRP$", Tag.DET),
			entry("RB", Tag.ADV),
			entry("RBR", Tag.ADV),
			entry("RBS", Tag.ADV),
			entry("RP", Tag.ADP),
			entry("SYM", Tag.SYM),
			entry("TO", Tag.PART),
			entry("UH", Tag.INTJ),
			entry("VB", Tag.VERB),
			entry("VBD", Tag.VERB),
			entry("VBG", Tag.VERB),
			entry("VBN", Tag.VERB),
			entry("VBP", Tag.VERB),
			entry("VBZ", Tag.VERB),
			entry("WDT", Tag.DET),
			entry("WP", Tag.PRON),
			entry("WP$", Tag.DET),
			entry("WRB", Tag.ADV),
			entry("XX", Tag.X),
			entry("``", Tag.PUNCT));
}
