package org.javai.snippets.document;

import org.javai.snippets.config.SnippetConfigurationException;

/**
 * A half-open character range {@code [start, end)} of a document.
 *
 * @param start first offset
 * @param end offset after the last character
 */
public record TextRange(int start, int end) {

	public TextRange {
		if (start < 0 || end < start) {
			throw new SnippetConfigurationException("Invalid range [" + start + ", " + end + "]");
		}
	}

	public static TextRange at(int offset) {
		return new TextRange(offset, offset);
	}

	public int length() {
		return end - start;
	}

	public boolean isEmpty() {
		return start == end;
	}
}
