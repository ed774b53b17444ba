package org.javai.snippets.tabstop;

/**
 * Direction of a jump along the tabstop ring.
 */
public enum Direction {
	NEXT,
	PREV
}
