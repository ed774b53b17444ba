package org.javai.snippets.document;

/**
 * The text buffer a snippet is expanded into.
 */
public interface SnippetDocument {

	int cursor();

	void setCursor(int offset);

	/**
	 * Inserts text. A cursor at or after {@code offset} moves with the text.
	 */
	void insertText(int offset, String text);

	/**
	 * Deletes the characters in {@code [start, end)}.
	 */
	void deleteText(int start, int end);

	String readText(int start, int end);

	int length();
}
