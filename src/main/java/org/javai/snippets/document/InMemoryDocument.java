package org.javai.snippets.document;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link SnippetDocument} and {@link AnchorService} backed by a
 * {@link StringBuilder}.
 * <p>
 * Not thread-safe; callers serialize access the same way an editor serializes
 * buffer edits.
 */
public class InMemoryDocument implements SnippetDocument, AnchorService {

	private final StringBuilder buffer;
	private final Map<AnchorId, Anchor> anchors = new LinkedHashMap<>();
	private long nextAnchorId = 1;
	private int cursor;

	public InMemoryDocument() {
		this("");
	}

	public InMemoryDocument(String text) {
		this.buffer = new StringBuilder(Objects.requireNonNull(text, "text must not be null"));
	}

	public String text() {
		return buffer.toString();
	}

	public int anchorCount() {
		return anchors.size();
	}

	@Override
	public int cursor() {
		return cursor;
	}

	@Override
	public void setCursor(int offset) {
		checkOffset(offset);
		cursor = offset;
	}

	@Override
	public void insertText(int offset, String text) {
		checkOffset(offset);
		Objects.requireNonNull(text, "text must not be null");
		if (text.isEmpty()) {
			return;
		}
		buffer.insert(offset, text);
		int n = text.length();
		for (Anchor anchor : anchors.values()) {
			anchor.onInsert(offset, n);
		}
		if (cursor >= offset) {
			cursor += n;
		}
	}

	@Override
	public void deleteText(int start, int end) {
		checkRange(start, end);
		if (start == end) {
			return;
		}
		buffer.delete(start, end);
		for (Anchor anchor : anchors.values()) {
			anchor.onDelete(start, end);
		}
		cursor = shiftForDelete(cursor, start, end);
	}

	@Override
	public String readText(int start, int end) {
		checkRange(start, end);
		return buffer.substring(start, end);
	}

	@Override
	public int length() {
		return buffer.length();
	}

	@Override
	public AnchorId create(int offset) {
		checkOffset(offset);
		AnchorId id = new AnchorId(nextAnchorId++);
		anchors.put(id, new Anchor(offset));
		return id;
	}

	/**
	 * Creates an anchor covering existing text, with {@link Growth#EXPAND} growth.
	 */
	public AnchorId create(TextRange range) {
		checkRange(range.start(), range.end());
		AnchorId id = create(range.start());
		anchors.get(id).end = range.end();
		return id;
	}

	@Override
	public TextRange range(AnchorId anchor) {
		Anchor a = anchor(anchor);
		return new TextRange(a.start, a.end);
	}

	@Override
	public void setText(AnchorId anchor, String text) {
		Objects.requireNonNull(text, "text must not be null");
		Anchor target = anchor(anchor);
		int start = target.start;
		deleteText(start, target.end);
		insertText(start, text);
		target.start = start;
		target.end = start + text.length();
	}

	@Override
	public void setGrowth(AnchorId anchor, Growth growth) {
		anchor(anchor).growth = Objects.requireNonNull(growth, "growth must not be null");
	}

	@Override
	public void delete(AnchorId anchor) {
		anchors.remove(anchor);
	}

	@Override
	public boolean isValid(AnchorId anchor) {
		Anchor a = anchors.get(anchor);
		return a != null && a.valid;
	}

	private Anchor anchor(AnchorId id) {
		Anchor anchor = anchors.get(Objects.requireNonNull(id, "anchor must not be null"));
		if (anchor == null) {
			throw new IllegalArgumentException("Unknown anchor " + id.value());
		}
		return anchor;
	}

	private void checkOffset(int offset) {
		if (offset < 0 || offset > buffer.length()) {
			throw new IllegalArgumentException("Offset " + offset + " outside document of length " + buffer.length());
		}
	}

	private void checkRange(int start, int end) {
		checkOffset(start);
		checkOffset(end);
		if (end < start) {
			throw new IllegalArgumentException("Invalid range [" + start + ", " + end + "]");
		}
	}

	private static int shiftForDelete(int point, int start, int end) {
		if (point >= end) {
			return point - (end - start);
		}
		return Math.min(point, start);
	}

	private static final class Anchor {
		private int start;
		private int end;
		private Growth growth = Growth.EXPAND;
		private boolean valid = true;

		private Anchor(int offset) {
			this.start = offset;
			this.end = offset;
		}

		private void onInsert(int offset, int n) {
			if (offset < start) {
				start += n;
				end += n;
			} else if (offset > end) {
				return;
			} else if (offset > start && offset < end) {
				end += n;
			} else if (growth == Growth.EXPAND) {
				end += n;
			} else if (offset == start && (start < end || growth == Growth.RIGHT)) {
				start += n;
				end += n;
			}
		}

		private void onDelete(int from, int to) {
			if (start < end && from <= start && end <= to && to - from > end - start) {
				valid = false;
			}
			start = shiftForDelete(start, from, to);
			end = shiftForDelete(end, from, to);
		}
	}
}
