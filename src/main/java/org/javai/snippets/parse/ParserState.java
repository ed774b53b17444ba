package org.javai.snippets.parse;

/**
 * States of the snippet grammar state machine.
 */
public enum ParserState {

	/** Plain text, at top level or inside a placeholder. */
	TEXT,
	/** Right after an unescaped {@code $}. */
	DOLLAR,
	/** Right after <code>${</code>. */
	DOLLAR_LBRACE,
	/** Reading tabstop digits. */
	DOLLAR_TABSTOP,
	/** Reading a variable name. */
	DOLLAR_VAR,
	/** Inside {@code ${1|...|}}. */
	CHOICE,
	TRANSFORM_PATTERN,
	TRANSFORM_FORMAT,
	TRANSFORM_OPTIONS
}
