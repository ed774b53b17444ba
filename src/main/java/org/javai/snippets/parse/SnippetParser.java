package org.javai.snippets.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.javai.snippets.node.SnippetNode;
import org.javai.snippets.node.Transform;

/**
 * Parser for snippet bodies written in the LSP snippet syntax.
 * <p>
 * Works in a single left-to-right pass over code points, driven by
 * {@link ParserState}. Entering <code>${id:</code> pushes a placeholder level whose
 * node list receives subsequent nodes; the matching unescaped <code>}</code> pops it.
 *
 * <pre>
 * List&lt;SnippetNode&gt; nodes = new SnippetParser("for (${1:i} = 0; $1 &lt; ${2:n}; $1++)").parse();
 * </pre>
 */
public class SnippetParser {

	private static final String CHOICE_NOT_CLOSED = "Tabstop with choices should be closed with \"|}\"";
	private static final String BRACE_NOT_CLOSED = "\"${\" should be closed with \"}\"";
	private static final String TRANSFORM_NOT_CLOSED =
			"Transform should contain 3 \"/\" outside of `${...}` and be closed with \"}\"";
	private static final String PLACEHOLDER_NOT_CLOSED = "Placeholder should be closed with \"}\"";

	private final String body;

	private final List<NodeBuilder> root = new ArrayList<>();
	private final Deque<NodeBuilder> openPlaceholders = new ArrayDeque<>();
	private ParserState state = ParserState.TEXT;
	private NodeBuilder current;
	private boolean escaped;
	private boolean choiceClosing;
	private boolean formatAfterDollar;
	private int formatDepth;

	public SnippetParser(String body) {
		if (body == null) {
			throw new SnippetSyntaxException("Snippet body should be string or list of strings", ParserState.TEXT);
		}
		this.body = body;
	}

	/**
	 * Creates a parser for a body given as lines, joined with {@code "\n"}.
	 *
	 * @param lines body lines
	 */
	public SnippetParser(List<String> lines) {
		this(lines != null ? String.join("\n", lines) : null);
	}

	public static List<SnippetNode> parse(String body) {
		return new SnippetParser(body).parse();
	}

	public static List<SnippetNode> parse(List<String> lines) {
		return new SnippetParser(lines).parse();
	}

	/**
	 * Parses the body into nodes.
	 *
	 * @return the top-level nodes, never empty
	 * @throws SnippetSyntaxException if the body is malformed
	 */
	public List<SnippetNode> parse() {
		int i = 0;
		while (i < body.length()) {
			int c = body.codePointAt(i);
			state = step(c);
			i += Character.charCount(c);
		}
		finish();
		return build(root);
	}

	private ParserState step(int c) {
		return switch (state) {
			case TEXT -> onText(c);
			case DOLLAR -> onDollar(c);
			case DOLLAR_LBRACE -> onDollarBrace(c);
			case DOLLAR_TABSTOP -> onTabstopId(c);
			case DOLLAR_VAR -> onVariableName(c);
			case CHOICE -> onChoice(c);
			case TRANSFORM_PATTERN -> onTransformPattern(c);
			case TRANSFORM_FORMAT -> onTransformFormat(c);
			case TRANSFORM_OPTIONS -> onTransformOptions(c);
		};
	}

	private ParserState onText(int c) {
		if (escaped) {
			escaped = false;
			if (c != '$' && c != '{' && c != '}' && c != '\\') {
				appendText('\\');
			}
			appendText(c);
			return ParserState.TEXT;
		}
		switch (c) {
			case '\\' -> escaped = true;
			case '$' -> {
				return ParserState.DOLLAR;
			}
			case '}' -> {
				// Unescaped `}` outside of any placeholder is plain text
				if (openPlaceholders.isEmpty()) {
					appendText(c);
				} else {
					openPlaceholders.pop();
				}
			}
			default -> appendText(c);
		}
		return ParserState.TEXT;
	}

	private ParserState onDollar(int c) {
		if (isDigit(c)) {
			current = startNode(NodeKind.TABSTOP, false);
			current.name.appendCodePoint(c);
			return ParserState.DOLLAR_TABSTOP;
		}
		if (isNameStart(c)) {
			current = startNode(NodeKind.VARIABLE, false);
			current.name.appendCodePoint(c);
			return ParserState.DOLLAR_VAR;
		}
		if (c == '{') {
			return ParserState.DOLLAR_LBRACE;
		}
		appendText('$');
		return onText(c);
	}

	private ParserState onDollarBrace(int c) {
		if (isDigit(c)) {
			current = startNode(NodeKind.TABSTOP, true);
			current.name.appendCodePoint(c);
			return ParserState.DOLLAR_TABSTOP;
		}
		if (isNameStart(c)) {
			current = startNode(NodeKind.VARIABLE, true);
			current.name.appendCodePoint(c);
			return ParserState.DOLLAR_VAR;
		}
		throw error("`${` should be followed by digit (in tabstop) or letter/underscore (in variable), not \""
				+ display(c) + "\"");
	}

	private ParserState onTabstopId(int c) {
		if (isDigit(c)) {
			current.name.appendCodePoint(c);
			return ParserState.DOLLAR_TABSTOP;
		}
		if (!current.braced) {
			current = null;
			return onText(c);
		}
		return switch (c) {
			case '}' -> closeCurrent();
			case ':' -> openPlaceholder();
			case '|' -> {
				current.choices = new ArrayList<>();
				current.choice = new StringBuilder();
				yield ParserState.CHOICE;
			}
			case '/' -> openTransform();
			default -> throw error("Tabstop id should be followed by \"}\", \":\", \"|\", or \"/\" not \""
					+ display(c) + "\"");
		};
	}

	private ParserState onVariableName(int c) {
		if (isNameChar(c)) {
			current.name.appendCodePoint(c);
			return ParserState.DOLLAR_VAR;
		}
		if (!current.braced) {
			current = null;
			return onText(c);
		}
		return switch (c) {
			case '}' -> closeCurrent();
			case ':' -> openPlaceholder();
			case '/' -> openTransform();
			default -> throw error("Variable name should be followed by \"}\", \":\" or \"/\", not \""
					+ display(c) + "\"");
		};
	}

	private ParserState onChoice(int c) {
		if (choiceClosing) {
			if (c != '}') {
				throw error(CHOICE_NOT_CLOSED);
			}
			current.choices.add(current.choice.toString());
			current.choice = null;
			choiceClosing = false;
			return closeCurrent();
		}
		if (escaped) {
			escaped = false;
			if (c != ',' && c != '|' && c != '\\') {
				current.choice.append('\\');
			}
			current.choice.appendCodePoint(c);
			return ParserState.CHOICE;
		}
		switch (c) {
			case '\\' -> escaped = true;
			case ',' -> {
				current.choices.add(current.choice.toString());
				current.choice = new StringBuilder();
			}
			case '|' -> choiceClosing = true;
			default -> current.choice.appendCodePoint(c);
		}
		return ParserState.CHOICE;
	}

	private ParserState onTransformPattern(int c) {
		StringBuilder pattern = current.transform[0];
		if (escaped) {
			escaped = false;
			pattern.append('\\').appendCodePoint(c);
			return ParserState.TRANSFORM_PATTERN;
		}
		if (c == '\\') {
			escaped = true;
			return ParserState.TRANSFORM_PATTERN;
		}
		if (c == '/') {
			formatDepth = 0;
			formatAfterDollar = false;
			return ParserState.TRANSFORM_FORMAT;
		}
		pattern.appendCodePoint(c);
		return ParserState.TRANSFORM_PATTERN;
	}

	private ParserState onTransformFormat(int c) {
		StringBuilder format = current.transform[1];
		boolean afterDollar = formatAfterDollar;
		formatAfterDollar = false;
		if (escaped) {
			escaped = false;
			format.append('\\').appendCodePoint(c);
			return ParserState.TRANSFORM_FORMAT;
		}
		switch (c) {
			case '\\' -> escaped = true;
			case '$' -> {
				format.append('$');
				formatAfterDollar = true;
			}
			case '{' -> {
				if (afterDollar) {
					formatDepth++;
				}
				format.append('{');
			}
			case '}' -> {
				if (formatDepth > 0) {
					formatDepth--;
				}
				format.append('}');
			}
			case '/' -> {
				if (formatDepth == 0) {
					return ParserState.TRANSFORM_OPTIONS;
				}
				format.append('/');
			}
			default -> format.appendCodePoint(c);
		}
		return ParserState.TRANSFORM_FORMAT;
	}

	private ParserState onTransformOptions(int c) {
		if (c == '}') {
			return closeCurrent();
		}
		current.transform[2].appendCodePoint(c);
		return ParserState.TRANSFORM_OPTIONS;
	}

	private void finish() {
		switch (state) {
			case TEXT -> {
				if (escaped) {
					appendText('\\');
				}
			}
			case DOLLAR -> {
				// A trailing `$` is its own text node
				NodeBuilder dollar = new NodeBuilder(NodeKind.TEXT, false);
				dollar.name.append('$');
				dollar.sealed = true;
				target().add(dollar);
			}
			case DOLLAR_LBRACE -> throw error(BRACE_NOT_CLOSED);
			case DOLLAR_TABSTOP, DOLLAR_VAR -> {
				if (current.braced) {
					throw error(BRACE_NOT_CLOSED);
				}
			}
			case CHOICE -> throw error(CHOICE_NOT_CLOSED);
			case TRANSFORM_PATTERN, TRANSFORM_FORMAT, TRANSFORM_OPTIONS -> throw error(TRANSFORM_NOT_CLOSED);
		}
		if (!openPlaceholders.isEmpty()) {
			throw new SnippetSyntaxException(PLACEHOLDER_NOT_CLOSED, ParserState.TEXT);
		}
	}

	private NodeBuilder startNode(NodeKind kind, boolean braced) {
		NodeBuilder node = new NodeBuilder(kind, braced);
		target().add(node);
		return node;
	}

	private ParserState closeCurrent() {
		current = null;
		return ParserState.TEXT;
	}

	private ParserState openPlaceholder() {
		current.placeholder = new ArrayList<>();
		openPlaceholders.push(current);
		current = null;
		return ParserState.TEXT;
	}

	private ParserState openTransform() {
		current.transform = new StringBuilder[] { new StringBuilder(), new StringBuilder(), new StringBuilder() };
		return ParserState.TRANSFORM_PATTERN;
	}

	private void appendText(int c) {
		List<NodeBuilder> target = target();
		NodeBuilder last = target.isEmpty() ? null : target.get(target.size() - 1);
		if (last == null || last.kind != NodeKind.TEXT || last.sealed) {
			last = new NodeBuilder(NodeKind.TEXT, false);
			target.add(last);
		}
		last.name.appendCodePoint(c);
	}

	private List<NodeBuilder> target() {
		return openPlaceholders.isEmpty() ? root : openPlaceholders.peek().placeholder;
	}

	private SnippetSyntaxException error(String message) {
		return new SnippetSyntaxException(message, state);
	}

	private static List<SnippetNode> build(List<NodeBuilder> builders) {
		List<SnippetNode> nodes = new ArrayList<>(builders.size());
		for (NodeBuilder builder : builders) {
			SnippetNode node = builder.build();
			if (node instanceof SnippetNode.Text text && text.text().isEmpty()) {
				continue;
			}
			nodes.add(node);
		}
		if (nodes.isEmpty()) {
			nodes.add(new SnippetNode.Text(""));
		}
		return nodes;
	}

	private static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isNameStart(int c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isNameChar(int c) {
		return isNameStart(c) || isDigit(c);
	}

	private static String display(int c) {
		return new String(Character.toChars(c));
	}

	private enum NodeKind {
		TEXT, TABSTOP, VARIABLE
	}

	/**
	 * Mutable accumulator for a node while its characters are being read.
	 */
	private static final class NodeBuilder {
		private final NodeKind kind;
		private final boolean braced;
		// Text content for text nodes, id or name otherwise
		private final StringBuilder name = new StringBuilder();
		private boolean sealed;
		private List<NodeBuilder> placeholder;
		private List<String> choices;
		private StringBuilder choice;
		private StringBuilder[] transform;

		private NodeBuilder(NodeKind kind, boolean braced) {
			this.kind = kind;
			this.braced = braced;
		}

		private SnippetNode build() {
			List<SnippetNode> children = placeholder != null ? SnippetParser.build(placeholder) : null;
			Transform parts = transform != null
					? new Transform(transform[0].toString(), transform[1].toString(), transform[2].toString())
					: null;
			return switch (kind) {
				case TEXT -> new SnippetNode.Text(name.toString());
				case TABSTOP -> new SnippetNode.Tabstop(name.toString(), children, null, choices, parts);
				case VARIABLE -> new SnippetNode.Variable(name.toString(), children, null, parts);
			};
		}
	}
}
