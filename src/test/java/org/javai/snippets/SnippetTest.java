package org.javai.snippets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.javai.snippets.config.SnippetConfigurationException;
import org.junit.jupiter.api.Test;

class SnippetTest {

	@Test
	void joinsLinesWithNewline() {
		assertThat(Snippet.ofLines(List.of("if ($1) {", "\t$0", "}")).body()).isEqualTo("if ($1) {\n\t$0\n}");
	}

	@Test
	void lookupIsCopied() {
		Map<String, String> lookup = new HashMap<>();
		lookup.put("1", "value");
		Snippet snippet = Snippet.of("$1").withLookup(lookup);

		lookup.put("2", "later");

		assertThat(snippet.lookup()).containsOnlyKeys("1");
		assertThatThrownBy(() -> snippet.lookup().put("3", "x")).isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void rejectsNullLookupValue() {
		Map<String, String> lookup = new HashMap<>();
		lookup.put("1", null);

		assertThatThrownBy(() -> Snippet.of("$1").withLookup(lookup))
				.isInstanceOf(SnippetConfigurationException.class)
				.hasMessageContaining("'1'");
	}
}
