package org.javai.snippets.parse;

/**
 * Exception thrown when a snippet body does not follow the snippet grammar.
 * <p>
 * The parser state at the point of failure tells which construct was being read.
 */
public class SnippetSyntaxException extends RuntimeException {

	private final ParserState state;

	public SnippetSyntaxException(String message, ParserState state) {
		super(message);
		this.state = state;
	}

	/**
	 * The state the parser was in when the problem was detected.
	 */
	public ParserState state() {
		return state;
	}
}
