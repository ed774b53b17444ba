package org.javai.snippets.document;

/**
 * Positions in a document that track edits.
 * <p>
 * An anchor covers a range of the document. Inserting or deleting text moves
 * it according to its {@link Growth}. An anchor whose text is removed together
 * with surrounding text becomes invalid and stays so.
 */
public interface AnchorService {

	/**
	 * Creates an empty anchor with {@link Growth#EXPAND} growth.
	 *
	 * @param offset document offset of the anchor
	 * @return the new anchor
	 */
	AnchorId create(int offset);

	TextRange range(AnchorId anchor);

	/**
	 * Replaces the text covered by an anchor. Afterwards the anchor covers exactly
	 * the new text.
	 */
	void setText(AnchorId anchor, String text);

	void setGrowth(AnchorId anchor, Growth growth);

	void delete(AnchorId anchor);

	boolean isValid(AnchorId anchor);
}
