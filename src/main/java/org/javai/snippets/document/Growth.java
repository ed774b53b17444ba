package org.javai.snippets.document;

/**
 * How an anchor reacts to text inserted exactly at one of its boundaries.
 * Insertions strictly inside an anchor always extend it.
 */
public enum Growth {

	/**
	 * Boundary insertions stay outside. An empty anchor stays before the inserted text.
	 */
	LEFT,

	/**
	 * Boundary insertions stay outside. An empty anchor moves after the inserted text.
	 */
	RIGHT,

	/**
	 * Boundary insertions are absorbed.
	 */
	EXPAND
}
