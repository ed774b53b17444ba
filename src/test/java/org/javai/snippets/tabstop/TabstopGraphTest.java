package org.javai.snippets.tabstop;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.NoSuchElementException;
import org.javai.snippets.normalize.SnippetNormalizer;
import org.javai.snippets.parse.SnippetParser;
import org.junit.jupiter.api.Test;

class TabstopGraphTest {

	@Test
	void finalTabstopIsAlwaysLast() {
		assertThat(TabstopGraph.of(List.of("2", "1", "0")).order()).containsExactly("1", "2", "0");
		assertThat(TabstopGraph.of(List.of("0", "10", "9")).order()).containsExactly("9", "10", "0");
	}

	@Test
	void sortsNumericallyNotLexically() {
		assertThat(TabstopGraph.of(List.of("10", "2", "1")).order()).containsExactly("1", "2", "10");
	}

	@Test
	void zeroPaddedIdsSortAfterShorterEqual() {
		assertThat(TabstopGraph.of(List.of("01", "1", "2")).order()).containsExactly("1", "01", "2");
		assertThat(TabstopOrder.INSTANCE.compare("00", "0")).isNegative();
	}

	@Test
	void collectsIdsFromNestedPlaceholders() {
		TabstopGraph graph = TabstopGraph.build(SnippetParser.parse("${3:a ${1:b ${2:c}}} $3"));

		assertThat(graph.order()).containsExactly("1", "2", "3");
	}

	@Test
	void ringWrapsInBothDirections() {
		TabstopGraph graph = TabstopGraph.of(List.of("1", "2", "0"));

		assertThat(graph.next("1")).isEqualTo("2");
		assertThat(graph.next("0")).isEqualTo("1");
		assertThat(graph.prev("1")).isEqualTo("0");
		assertThat(graph.next("2", Direction.PREV)).isEqualTo("1");
	}

	@Test
	void singleTabstopPointsToItself() {
		TabstopGraph graph = TabstopGraph.of(List.of("0"));

		assertThat(graph.next("0")).isEqualTo("0");
		assertThat(graph.prev("0")).isEqualTo("0");
	}

	@Test
	void walkingTheWholeRingReturnsToStart() {
		TabstopGraph graph = TabstopGraph.build(new SnippetNormalizer()
				.normalize(SnippetParser.parse("${1:a} ${4:b} ${2:$3} $1"), null));

		for (String start : graph.order()) {
			String id = start;
			for (int i = 0; i < graph.order().size(); i++) {
				id = graph.next(id, Direction.NEXT);
			}
			assertThat(id).isEqualTo(start);
		}
	}

	@Test
	void unknownIdIsRejected() {
		TabstopGraph graph = TabstopGraph.of(List.of("1", "0"));

		assertThatThrownBy(() -> graph.next("7"))
				.isInstanceOf(NoSuchElementException.class)
				.hasMessageContaining("7");
	}
}
