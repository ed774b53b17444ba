package org.javai.snippets.tabstop;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.javai.snippets.node.SnippetNode;
import org.javai.snippets.node.SnippetNodeWalker;

/**
 * The ring of distinct tabstop ids in visit order.
 * <p>
 * Jumping past the last id wraps to the first and vice versa, so a ring of one
 * id maps that id to itself in both directions.
 *
 * @param order distinct ids sorted by {@link TabstopOrder}
 */
public record TabstopGraph(List<String> order) {

	public TabstopGraph {
		Objects.requireNonNull(order, "order must not be null");
		order = List.copyOf(order);
	}

	/**
	 * Builds the ring from every tabstop in a node tree, nested placeholders included.
	 */
	public static TabstopGraph build(List<SnippetNode> nodes) {
		return of(SnippetNodeWalker.tabstopIds(nodes));
	}

	/**
	 * Builds the ring from a collection of ids; duplicates are dropped.
	 */
	public static TabstopGraph of(Collection<String> ids) {
		List<String> sorted = new ArrayList<>(new LinkedHashSet<>(ids));
		sorted.sort(TabstopOrder.INSTANCE);
		return new TabstopGraph(sorted);
	}

	public boolean contains(String id) {
		return order.contains(id);
	}

	public boolean isEmpty() {
		return order.isEmpty();
	}

	public String next(String id) {
		return next(id, Direction.NEXT);
	}

	public String prev(String id) {
		return next(id, Direction.PREV);
	}

	/**
	 * Returns the neighbour of an id on the ring.
	 *
	 * @throws NoSuchElementException if the id is not on the ring
	 */
	public String next(String id, Direction direction) {
		int index = order.indexOf(id);
		if (index < 0) {
			throw new NoSuchElementException("Tabstop '" + id + "' is not in the graph");
		}
		int step = direction == Direction.NEXT ? 1 : -1;
		return order.get(Math.floorMod(index + step, order.size()));
	}
}
