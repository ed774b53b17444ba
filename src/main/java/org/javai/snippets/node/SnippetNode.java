package org.javai.snippets.node;

import java.util.List;
import java.util.Objects;

/**
 * A node of a parsed snippet body. Sealed to ensure all node kinds are known.
 * <p>
 * Nodes can be:
 * <ul>
 *   <li>{@link Text} - literal text</li>
 *   <li>{@link Tabstop} - a numbered fill-in point with optional placeholder, choices or transform</li>
 *   <li>{@link Variable} - a named value resolved during normalization</li>
 * </ul>
 * <p>
 * Right after parsing, tabstops and variables carry no {@code text}. After
 * normalization each of them has exactly one of {@code text} or
 * {@code placeholder} set.
 */
public sealed interface SnippetNode {

	/**
	 * Accepts a visitor and dispatches to the method matching this node kind.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	<R> R accept(SnippetNodeVisitor<R> visitor);

	/**
	 * Literal text.
	 *
	 * @param text the text, never null
	 */
	record Text(String text) implements SnippetNode {
		public Text {
			Objects.requireNonNull(text, "text must not be null");
		}

		@Override
		public <R> R accept(SnippetNodeVisitor<R> visitor) {
			return visitor.visitText(this);
		}
	}

	/**
	 * A tabstop. The id is kept as written so that {@code 1} and {@code 01} stay distinct.
	 *
	 * @param id digits identifying the tabstop
	 * @param placeholder default content, or null
	 * @param text resolved content, or null
	 * @param choices choice values, or null
	 * @param transform raw transform parts, or null
	 */
	record Tabstop(String id, List<SnippetNode> placeholder, String text, List<String> choices, Transform transform)
			implements SnippetNode {
		public Tabstop {
			Objects.requireNonNull(id, "id must not be null");
			placeholder = placeholder != null ? List.copyOf(placeholder) : null;
			choices = choices != null ? List.copyOf(choices) : null;
		}

		/**
		 * Creates a bare tabstop ({@code $1} or {@code ${1}}).
		 */
		public static Tabstop of(String id) {
			return new Tabstop(id, null, null, null, null);
		}

		public static Tabstop withPlaceholder(String id, List<SnippetNode> placeholder) {
			return new Tabstop(id, placeholder, null, null, null);
		}

		public static Tabstop withText(String id, String text) {
			return new Tabstop(id, null, text, null, null);
		}

		public boolean hasPlaceholder() {
			return placeholder != null;
		}

		@Override
		public <R> R accept(SnippetNodeVisitor<R> visitor) {
			return visitor.visitTabstop(this);
		}
	}

	/**
	 * A variable reference ({@code $name}, {@code ${name:default}}, {@code ${name/re/fmt/opts}}).
	 *
	 * @param name variable name
	 * @param placeholder fallback content, or null
	 * @param text resolved value, or null
	 * @param transform raw transform parts, or null
	 */
	record Variable(String name, List<SnippetNode> placeholder, String text, Transform transform)
			implements SnippetNode {
		public Variable {
			Objects.requireNonNull(name, "name must not be null");
			placeholder = placeholder != null ? List.copyOf(placeholder) : null;
		}

		public static Variable of(String name) {
			return new Variable(name, null, null, null);
		}

		public static Variable withPlaceholder(String name, List<SnippetNode> placeholder) {
			return new Variable(name, placeholder, null, null);
		}

		public static Variable withText(String name, String text) {
			return new Variable(name, null, text, null);
		}

		public boolean hasPlaceholder() {
			return placeholder != null;
		}

		@Override
		public <R> R accept(SnippetNodeVisitor<R> visitor) {
			return visitor.visitVariable(this);
		}
	}
}
