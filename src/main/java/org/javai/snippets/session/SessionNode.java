package org.javai.snippets.session;

import java.util.ArrayList;
import java.util.List;
import org.javai.snippets.document.AnchorId;
import org.javai.snippets.node.SnippetNode;
import org.javai.snippets.node.SnippetNodeVisitor;

/**
 * A node of a live session, addressed by its preorder index in the session arena.
 * Parent and children are indexes into the same arena.
 */
final class SessionNode {

	enum Kind {
		TEXT, TABSTOP, VARIABLE
	}

	final int index;
	final int parent;
	final Kind kind;
	// Tabstop id, or variable name
	final String name;
	final List<String> choices;
	String text;
	List<Integer> children;
	AnchorId anchor;
	boolean live = true;

	private SessionNode(int index, int parent, Kind kind, String name, List<String> choices, String text) {
		this.index = index;
		this.parent = parent;
		this.kind = kind;
		this.name = name;
		this.choices = choices;
		this.text = text;
	}

	static SessionNode from(SnippetNode node, int index, int parent) {
		return node.accept(new SnippetNodeVisitor<>() {
			@Override
			public SessionNode visitText(SnippetNode.Text text) {
				return new SessionNode(index, parent, Kind.TEXT, null, null, text.text());
			}

			@Override
			public SessionNode visitTabstop(SnippetNode.Tabstop tabstop) {
				return new SessionNode(index, parent, Kind.TABSTOP, tabstop.id(), tabstop.choices(),
						resolvedText(tabstop.text(), tabstop.placeholder()));
			}

			@Override
			public SessionNode visitVariable(SnippetNode.Variable variable) {
				return new SessionNode(index, parent, Kind.VARIABLE, variable.name(), null,
						resolvedText(variable.text(), variable.placeholder()));
			}
		});
	}

	private static String resolvedText(String text, List<SnippetNode> placeholder) {
		if (text != null) {
			return text;
		}
		// Without a placeholder the node renders empty
		return placeholder == null ? "" : null;
	}

	void addChild(int child) {
		if (children == null) {
			children = new ArrayList<>();
		}
		children.add(child);
	}

	boolean isTabstop() {
		return kind == Kind.TABSTOP;
	}

	boolean hasPlaceholder() {
		return text == null;
	}
}
