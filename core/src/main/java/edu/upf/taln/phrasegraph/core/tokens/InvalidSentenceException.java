package edu.upf.taln.phrasegraph.core.tokens;

/**
 * Thrown when a span of tokens does not form a proper sentence.
 */
public class InvalidSentenceException extends IllegalArgumentException
{
	private final static long serialVersionUID = 1L;

	public InvalidSentenceException(Span span, String reason)
	{
		super("Span [" + span.getStart() + ", " + span.getEnd() + ") is not a proper sentence: " + reason);
	}
}
