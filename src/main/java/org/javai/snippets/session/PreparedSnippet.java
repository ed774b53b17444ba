package org.javai.snippets.session;

import java.util.List;
import java.util.Objects;
import org.javai.snippets.node.SnippetNode;
import org.javai.snippets.node.SnippetNodeWalker;
import org.javai.snippets.tabstop.TabstopGraph;
import org.javai.snippets.tabstop.TabstopOrder;

/**
 * A normalized snippet tree with its tabstop ring, ready to be expanded.
 *
 * @param nodes normalized nodes
 * @param graph tabstop ring of the nodes
 */
public record PreparedSnippet(List<SnippetNode> nodes, TabstopGraph graph) {

	public PreparedSnippet {
		Objects.requireNonNull(nodes, "nodes must not be null");
		Objects.requireNonNull(graph, "graph must not be null");
		nodes = List.copyOf(nodes);
	}

	/**
	 * Returns true if the final tabstop is the only one and offers no choices, in
	 * which case the snippet needs no interactive session.
	 */
	public boolean isPlainText() {
		if (!graph.order().equals(List.of(TabstopOrder.FINAL_ID))) {
			return false;
		}
		boolean[] choices = { false };
		SnippetNodeWalker.walkPreOrder(nodes, node -> {
			if (node instanceof SnippetNode.Tabstop tabstop && tabstop.choices() != null) {
				choices[0] = true;
			}
		});
		return !choices[0];
	}
}
