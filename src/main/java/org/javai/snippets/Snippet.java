package org.javai.snippets;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.snippets.normalize.SnippetNormalizer;

/**
 * A snippet to expand: its body and the values to substitute for tabstops and
 * variables.
 *
 * @param body body in LSP snippet syntax
 * @param lookup values keyed by tabstop id or variable name
 */
public record Snippet(String body, Map<String, String> lookup) {

	public Snippet {
		Objects.requireNonNull(body, "body must not be null");
		SnippetNormalizer.validateLookup(lookup);
		lookup = lookup != null ? Collections.unmodifiableMap(new LinkedHashMap<>(lookup)) : Map.of();
	}

	public static Snippet of(String body) {
		return new Snippet(body, Map.of());
	}

	/**
	 * Creates a snippet from body lines joined with {@code "\n"}.
	 */
	public static Snippet ofLines(List<String> lines) {
		Objects.requireNonNull(lines, "lines must not be null");
		return new Snippet(String.join("\n", lines), Map.of());
	}

	public Snippet withLookup(Map<String, String> lookup) {
		return new Snippet(body, lookup);
	}
}
