package org.javai.snippets.session;

import java.util.List;
import java.util.Objects;
import org.javai.snippets.document.TextRange;

/**
 * Immutable view of a session at one point in time, carried by session events.
 *
 * @param state lifecycle state of the session
 * @param currentTabstop focused tabstop id, or null before the first focus
 * @param tabstops the tabstop ring in visit order
 * @param range document range of the whole snippet
 * @param nodes live nodes in preorder
 */
public record SessionSnapshot(
		SnippetSession.State state,
		String currentTabstop,
		List<TabstopState> tabstops,
		TextRange range,
		List<NodeSnapshot> nodes
) {

	public SessionSnapshot {
		Objects.requireNonNull(state, "state must not be null");
		tabstops = tabstops != null ? List.copyOf(tabstops) : List.of();
		nodes = nodes != null ? List.copyOf(nodes) : List.of();
	}

	/**
	 * Decoration a node should be drawn with.
	 */
	public enum Highlight {
		/** Focused tabstop whose content gets appended to */
		CURRENT,
		/** Focused tabstop whose placeholder gets replaced */
		CURRENT_REPLACE,
		UNVISITED,
		VISITED,
		FINAL,
		NONE
	}

	/**
	 * One entry of the tabstop ring.
	 */
	public record TabstopState(String id, String prev, String next, boolean visited) {
	}

	/**
	 * A live node of the session.
	 *
	 * @param index preorder index
	 * @param parent index of the enclosing node, -1 at top level
	 * @param kind node kind name
	 * @param name tabstop id or variable name, null for text
	 * @param text document text covered by the node
	 * @param range document range covered by the node
	 * @param highlight decoration of the node
	 * @param marker text to show in place of an empty tabstop, or null
	 */
	public record NodeSnapshot(
			int index,
			int parent,
			String kind,
			String name,
			String text,
			TextRange range,
			Highlight highlight,
			String marker
	) {
	}
}
