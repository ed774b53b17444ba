package org.javai.snippets.node;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Utility class for walking snippet node trees.
 * Provides common traversal patterns for tree operations.
 */
public final class SnippetNodeWalker {

	private SnippetNodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Walks a node list in pre-order (node before its placeholder children).
	 *
	 * @param nodes the nodes to walk, may be null
	 * @param action invoked for every node
	 */
	public static void walkPreOrder(List<SnippetNode> nodes, Consumer<SnippetNode> action) {
		if (nodes == null) {
			return;
		}
		for (SnippetNode node : nodes) {
			action.accept(node);
			walkPreOrder(placeholderOf(node), action);
		}
	}

	/**
	 * Returns the placeholder of a node, or null for text and nodes without one.
	 */
	public static List<SnippetNode> placeholderOf(SnippetNode node) {
		return node.accept(new SnippetNodeVisitor<>() {
			@Override
			public List<SnippetNode> visitText(SnippetNode.Text text) {
				return null;
			}

			@Override
			public List<SnippetNode> visitTabstop(SnippetNode.Tabstop tabstop) {
				return tabstop.placeholder();
			}

			@Override
			public List<SnippetNode> visitVariable(SnippetNode.Variable variable) {
				return variable.placeholder();
			}
		});
	}

	/**
	 * Collects distinct tabstop ids in pre-order of first appearance.
	 */
	public static Set<String> tabstopIds(List<SnippetNode> nodes) {
		Set<String> ids = new LinkedHashSet<>();
		walkPreOrder(nodes, node -> {
			if (node instanceof SnippetNode.Tabstop tabstop) {
				ids.add(tabstop.id());
			}
		});
		return ids;
	}

	/**
	 * Renders nodes to the text they would occupy in a document: resolved text
	 * where present, placeholder content otherwise.
	 */
	public static String render(List<SnippetNode> nodes) {
		StringBuilder sb = new StringBuilder();
		if (nodes != null) {
			for (SnippetNode node : nodes) {
				sb.append(render(node));
			}
		}
		return sb.toString();
	}

	/**
	 * Renders a single node.
	 */
	public static String render(SnippetNode node) {
		return node.accept(new SnippetNodeVisitor<>() {
			@Override
			public String visitText(SnippetNode.Text text) {
				return text.text();
			}

			@Override
			public String visitTabstop(SnippetNode.Tabstop tabstop) {
				return tabstop.text() != null ? tabstop.text() : render(tabstop.placeholder());
			}

			@Override
			public String visitVariable(SnippetNode.Variable variable) {
				return variable.text() != null ? variable.text() : render(variable.placeholder());
			}
		});
	}
}
