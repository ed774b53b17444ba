package org.javai.snippets.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryDocumentTest {

	private final InMemoryDocument document = new InMemoryDocument("hello world");

	private AnchorId anchor(int start, int end, Growth growth) {
		AnchorId id = document.create(new TextRange(start, end));
		document.setGrowth(id, growth);
		return id;
	}

	@Test
	void editsText() {
		document.insertText(5, ",");
		document.deleteText(0, 1);

		assertThat(document.text()).isEqualTo("ello, world");
		assertThat(document.length()).isEqualTo(11);
		assertThat(document.readText(0, 4)).isEqualTo("ello");
	}

	@Test
	void cursorFollowsInsertionsAtOrBeforeIt() {
		document.setCursor(5);
		document.insertText(5, "!!");
		assertThat(document.cursor()).isEqualTo(7);

		document.insertText(9, "?");
		assertThat(document.cursor()).isEqualTo(7);

		document.deleteText(0, 6);
		assertThat(document.cursor()).isEqualTo(1);
	}

	@Test
	void rejectsOffsetsOutsideDocument() {
		assertThatThrownBy(() -> document.setCursor(12)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> document.deleteText(3, 2)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void setTextReplacesCoveredText() {
		AnchorId id = document.create(6);
		document.setText(id, "there");

		assertThat(document.text()).isEqualTo("hello thereworld");
		assertThat(document.range(id)).isEqualTo(new TextRange(6, 11));

		document.setText(id, "big ");
		assertThat(document.text()).isEqualTo("hello big world");
		assertThat(document.range(id)).isEqualTo(new TextRange(6, 10));
	}

	@Test
	void deletedAnchorIsGone() {
		AnchorId id = document.create(0);
		document.delete(id);

		assertThat(document.isValid(id)).isFalse();
		assertThat(document.anchorCount()).isZero();
		assertThatThrownBy(() -> document.range(id)).isInstanceOf(IllegalArgumentException.class);
	}

	@Nested
	@DisplayName("Growth at anchor boundaries")
	class BoundaryGrowth {

		@Test
		void expandAbsorbsBoundaryInsertions() {
			AnchorId id = anchor(6, 11, Growth.EXPAND);

			document.insertText(11, "!");
			document.insertText(6, "<");

			assertThat(document.range(id)).isEqualTo(new TextRange(6, 13));
		}

		@Test
		void leftAndRightKeepBoundaryInsertionsOutside() {
			AnchorId left = anchor(6, 11, Growth.LEFT);
			AnchorId right = anchor(0, 5, Growth.RIGHT);

			document.insertText(11, "!");
			document.insertText(5, ",");

			assertThat(document.range(left)).isEqualTo(new TextRange(7, 12));
			assertThat(document.range(right)).isEqualTo(new TextRange(0, 5));
		}

		@Test
		void interiorInsertionsAlwaysExtend() {
			AnchorId id = anchor(0, 5, Growth.LEFT);

			document.insertText(2, "xx");

			assertThat(document.range(id)).isEqualTo(new TextRange(0, 7));
		}

		@Test
		void emptyAnchorsPinOrFollow() {
			AnchorId left = document.create(5);
			document.setGrowth(left, Growth.LEFT);
			AnchorId right = document.create(5);
			document.setGrowth(right, Growth.RIGHT);
			AnchorId expand = document.create(5);

			document.insertText(5, "abc");

			assertThat(document.range(left)).isEqualTo(new TextRange(5, 5));
			assertThat(document.range(right)).isEqualTo(new TextRange(8, 8));
			assertThat(document.range(expand)).isEqualTo(new TextRange(5, 8));
		}
	}

	@Nested
	@DisplayName("Deletion")
	class Deletion {

		@Test
		void shiftsAndClampsAnchors() {
			AnchorId after = anchor(6, 11, Growth.LEFT);
			AnchorId overlapping = anchor(3, 8, Growth.LEFT);

			document.deleteText(4, 7);

			assertThat(document.range(after)).isEqualTo(new TextRange(4, 8));
			assertThat(document.range(overlapping)).isEqualTo(new TextRange(3, 5));
			assertThat(document.isValid(after)).isTrue();
			assertThat(document.isValid(overlapping)).isTrue();
		}

		@Test
		void exactDeletionLeavesEmptyValidAnchor() {
			AnchorId id = anchor(6, 11, Growth.LEFT);

			document.deleteText(6, 11);

			assertThat(document.range(id)).isEqualTo(new TextRange(6, 6));
			assertThat(document.isValid(id)).isTrue();
		}

		@Test
		void largerDeletionInvalidatesAnchor() {
			AnchorId id = anchor(6, 11, Growth.LEFT);

			document.deleteText(5, 11);

			assertThat(document.isValid(id)).isFalse();
		}

		@Test
		void emptyAnchorInsideDeletionStaysValid() {
			AnchorId id = document.create(7);

			document.deleteText(5, 11);

			assertThat(document.range(id)).isEqualTo(new TextRange(5, 5));
			assertThat(document.isValid(id)).isTrue();
		}
	}
}
