package org.javai.snippets.session;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.snippets.config.SnippetEngineConfig;
import org.javai.snippets.document.AnchorId;
import org.javai.snippets.document.AnchorService;
import org.javai.snippets.document.Growth;
import org.javai.snippets.document.SnippetDocument;
import org.javai.snippets.document.TextRange;
import org.javai.snippets.node.SnippetNode;
import org.javai.snippets.node.SnippetNodeWalker;
import org.javai.snippets.tabstop.Direction;
import org.javai.snippets.tabstop.TabstopGraph;
import org.javai.snippets.tabstop.TabstopOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One live expansion of a snippet.
 * <p>
 * The session writes its normalized tree into the document, keeping one anchor
 * per node plus one for the whole snippet. It always has a focused tabstop until
 * stopped. Every tabstop sharing the focused id mirrors the text typed into the
 * first of them, the reference node.
 * <p>
 * All operations are serialized on the session lock.
 */
public class SnippetSession {

	private static final Logger logger = LoggerFactory.getLogger(SnippetSession.class);

	/**
	 * Lifecycle state of a session.
	 */
	public enum State {
		CREATED,
		ACTIVE,
		SUSPENDED,
		STOPPED
	}

	private final List<SnippetNode> tree;
	private final SnippetDocument document;
	private final AnchorService anchors;
	private final SnippetEngineConfig config;
	private final SnippetSessionListener listener;
	private final Object lock;

	private final List<SessionNode> arena = new ArrayList<>();
	private final Map<String, List<Integer>> nodesByTabstop = new LinkedHashMap<>();
	private final Set<String> visited = new HashSet<>();
	private TabstopGraph graph = TabstopGraph.of(List.of());
	private AnchorId extent;
	private String current;
	private State state = State.CREATED;

	public SnippetSession(List<SnippetNode> tree, SnippetDocument document, AnchorService anchors,
			SnippetEngineConfig config, SnippetSessionListener listener) {
		this(tree, document, anchors, config, listener, new Object());
	}

	/**
	 * Creates a session guarded by {@code lock}. Sessions driven by a
	 * {@link SnippetEngine} share the engine's lock, so a listener may call back
	 * into the engine from any session operation.
	 */
	SnippetSession(List<SnippetNode> tree, SnippetDocument document, AnchorService anchors,
			SnippetEngineConfig config, SnippetSessionListener listener, Object lock) {
		this.lock = Objects.requireNonNull(lock, "lock must not be null");
		this.tree = List.copyOf(Objects.requireNonNull(tree, "tree must not be null"));
		this.document = Objects.requireNonNull(document, "document must not be null");
		this.anchors = Objects.requireNonNull(anchors, "anchors must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.listener = listener != null ? listener : new SnippetSessionListener() {
		};
	}

	/**
	 * Writes the tree into the document at {@code offset} and focuses the first tabstop.
	 */
	public void start(int offset) {
		synchronized (lock) {
			requireState(State.CREATED);
			extent = anchors.create(offset);
			int end = materialize(tree, -1, offset);
			anchors.setGrowth(extent, Growth.LEFT);
			for (String id : List.copyOf(nodesByTabstop.keySet())) {
				SessionNode reference = reference(id);
				if (reference != null) {
					rewriteMirrors(reference, render(reference));
				}
			}
			graph = liveGraph();
			state = State.ACTIVE;
			logger.debug("Started snippet session over [{}, {}] with tabstops {}", offset, end, graph.order());
			Optional<ChoiceOffer> offer = graph.isEmpty() ? Optional.empty() : focusTabstop(graph.order().get(0));
			listener.onSessionStart(snapshot());
			offer.ifPresent(listener::onChoiceOffer);
		}
	}

	/**
	 * Focuses a tabstop: marks it visited and moves the cursor to its reference node.
	 *
	 * @throws IllegalArgumentException if no live node carries the id
	 */
	public void focus(String tabstopId) {
		synchronized (lock) {
			requireState(State.ACTIVE);
			focusTabstop(tabstopId).ifPresent(listener::onChoiceOffer);
		}
	}

	/**
	 * Folds the text of the reference node into the tree and every mirror.
	 *
	 * @return true if anything changed
	 * @throws SessionCorruptionException if an anchor no longer resolves
	 */
	public boolean synchronize() {
		synchronized (lock) {
			requireState(State.ACTIVE);
			return synchronizeCurrent();
		}
	}

	/**
	 * Moves focus along the tabstop ring, skipping tabstops no longer in the tree.
	 *
	 * @return the newly focused tabstop id
	 */
	public String jump(Direction direction) {
		synchronized (lock) {
			requireState(State.ACTIVE);
			synchronizeCurrent();
			String from = current;
			Set<String> live = liveTabstopIds();
			TabstopGraph ring = graph;
			if (!ring.contains(from)) {
				Set<String> ids = new LinkedHashSet<>(live);
				ids.add(from);
				ring = TabstopGraph.of(ids);
			}
			String to = ring.next(from, direction);
			for (int i = 0; i < ring.order().size() && !live.contains(to); i++) {
				to = ring.next(to, direction);
			}
			JumpEvent event = new JumpEvent(from, to);
			logger.debug("Jumping from tabstop {} to {}", from, to);
			listener.onJumpPre(event);
			focusTabstop(to).ifPresent(listener::onChoiceOffer);
			listener.onJumpPost(event);
			return to;
		}
	}

	/**
	 * Hides decoration while a nested session is active. Anchors are kept.
	 */
	public void suspend() {
		synchronized (lock) {
			requireState(State.ACTIVE);
			state = State.SUSPENDED;
			logger.debug("Suspended snippet session at tabstop {}", current);
			listener.onSessionSuspend(snapshot());
		}
	}

	/**
	 * Makes a suspended session active again, folding in text typed while it was
	 * suspended. The cursor is left where it is.
	 *
	 * @throws SessionCorruptionException if an anchor no longer resolves
	 */
	public void resume() {
		synchronized (lock) {
			requireState(State.SUSPENDED);
			synchronizeCurrent();
			state = State.ACTIVE;
			SessionNode reference = reference(current);
			if (reference != null) {
				pivotGrowth(reference);
			}
			logger.debug("Resumed snippet session at tabstop {}", current);
			listener.onSessionResume(snapshot());
		}
	}

	/**
	 * Stops the session and deletes its anchors. Stopping twice does nothing.
	 */
	public void stop() {
		synchronized (lock) {
			if (state == State.STOPPED) {
				return;
			}
			SessionSnapshot last = snapshot();
			deleteAnchors();
			state = State.STOPPED;
			logger.debug("Stopped snippet session");
			listener.onSessionStop(last);
		}
	}

	/**
	 * Stops a corrupted session without emitting events.
	 */
	void forceStop() {
		synchronized (lock) {
			deleteAnchors();
			state = State.STOPPED;
		}
	}

	/**
	 * Checks that every anchor of the session still resolves.
	 *
	 * @throws SessionCorruptionException otherwise
	 */
	public void validate() {
		synchronized (lock) {
			if (extent != null && !anchors.isValid(extent)) {
				throw new SessionCorruptionException("Snippet range no longer resolves");
			}
			for (SessionNode node : arena) {
				if (node.live && !anchors.isValid(node.anchor)) {
					throw new SessionCorruptionException("Anchor of node " + node.index + " no longer resolves");
				}
			}
		}
	}

	public State state() {
		synchronized (lock) {
			return state;
		}
	}

	public String currentTabstop() {
		synchronized (lock) {
			return current;
		}
	}

	public TabstopGraph graph() {
		synchronized (lock) {
			return graph;
		}
	}

	public boolean isVisited(String tabstopId) {
		synchronized (lock) {
			return visited.contains(tabstopId);
		}
	}

	/**
	 * Returns the document range of the whole snippet.
	 */
	public TextRange range() {
		synchronized (lock) {
			requireStarted();
			return anchors.range(extent);
		}
	}

	/**
	 * Returns the document ranges of every live node with the tabstop id, in preorder.
	 */
	public List<TextRange> tabstopRanges(String tabstopId) {
		synchronized (lock) {
			requireStarted();
			List<TextRange> ranges = new ArrayList<>();
			for (int index : nodesByTabstop.getOrDefault(tabstopId, List.of())) {
				SessionNode node = arena.get(index);
				if (node.live) {
					ranges.add(anchors.range(node.anchor));
				}
			}
			return ranges;
		}
	}

	public SessionSnapshot snapshot() {
		synchronized (lock) {
			List<SessionSnapshot.TabstopState> tabstops = new ArrayList<>();
			for (String id : graph.order()) {
				tabstops.add(new SessionSnapshot.TabstopState(id, graph.prev(id), graph.next(id), visited.contains(id)));
			}
			List<SessionSnapshot.NodeSnapshot> nodes = new ArrayList<>();
			for (SessionNode node : arena) {
				if (node.live) {
					nodes.add(nodeSnapshot(node));
				}
			}
			TextRange range = extent != null && state != State.STOPPED ? anchors.range(extent) : null;
			return new SessionSnapshot(state, current, tabstops, range, nodes);
		}
	}

	private SessionSnapshot.NodeSnapshot nodeSnapshot(SessionNode node) {
		TextRange range = state != State.STOPPED ? anchors.range(node.anchor) : null;
		String text = range != null ? document.readText(range.start(), range.end()) : node.text;
		SessionSnapshot.Highlight highlight = SessionSnapshot.Highlight.NONE;
		String marker = null;
		if (node.isTabstop() && state == State.ACTIVE) {
			boolean isFinal = TabstopOrder.FINAL_ID.equals(node.name);
			if (node.name.equals(current)) {
				highlight = node.hasPlaceholder()
						? SessionSnapshot.Highlight.CURRENT_REPLACE
						: SessionSnapshot.Highlight.CURRENT;
			} else if (isFinal) {
				highlight = SessionSnapshot.Highlight.FINAL;
			} else {
				highlight = visited.contains(node.name)
						? SessionSnapshot.Highlight.VISITED
						: SessionSnapshot.Highlight.UNVISITED;
			}
			if (range != null && range.isEmpty()) {
				marker = isFinal ? config.emptyTabstopFinal() : config.emptyTabstop();
			}
		}
		return new SessionSnapshot.NodeSnapshot(node.index, node.parent, node.kind.name(), node.name, text, range,
				highlight, marker);
	}

	private int materialize(List<SnippetNode> nodes, int parent, int offset) {
		int pos = offset;
		for (SnippetNode source : nodes) {
			SessionNode node = SessionNode.from(source, arena.size(), parent);
			arena.add(node);
			if (parent >= 0) {
				arena.get(parent).addChild(node.index);
			}
			if (node.isTabstop()) {
				nodesByTabstop.computeIfAbsent(node.name, id -> new ArrayList<>()).add(node.index);
			}
			// Expand while the node content is written, then pin it
			node.anchor = anchors.create(pos);
			if (node.text != null) {
				document.insertText(pos, node.text);
				pos += node.text.length();
			} else {
				pos = materialize(SnippetNodeWalker.placeholderOf(source), node.index, pos);
			}
			anchors.setGrowth(node.anchor, Growth.LEFT);
		}
		return pos;
	}

	private Optional<ChoiceOffer> focusTabstop(String tabstopId) {
		SessionNode reference = reference(tabstopId);
		if (reference == null) {
			throw new IllegalArgumentException("Tabstop '" + tabstopId + "' is not in the session");
		}
		visited.add(tabstopId);
		current = tabstopId;
		pivotGrowth(reference);
		TextRange range = rangeOf(reference);
		document.setCursor(reference.hasPlaceholder() ? range.start() : range.end());
		logger.debug("Focused tabstop {} at [{}, {}]", tabstopId, range.start(), range.end());
		if (reference.choices != null || range.isEmpty()) {
			return Optional.of(new ChoiceOffer(tabstopId, reference.choices));
		}
		return Optional.empty();
	}

	private boolean synchronizeCurrent() {
		SessionNode reference = reference(current);
		if (reference == null) {
			validate();
			return false;
		}
		TextRange range = rangeOf(reference);
		String observed = document.readText(range.start(), range.end());
		boolean changed = !observed.equals(render(reference));
		if (changed) {
			dropChildren(reference);
		}
		validate();
		if (!changed) {
			return false;
		}
		reference.text = observed;
		int cursor = document.cursor();
		rewriteMirrors(reference, observed);
		pivotGrowth(reference);
		if (cursor >= range.start() && cursor <= rangeOf(reference).end()) {
			document.setCursor(cursor);
		}
		graph = liveGraph();
		logger.debug("Synchronized tabstop {} to '{}'", current, observed);
		return true;
	}

	/**
	 * Writes content into every other live node sharing the reference tabstop id
	 * whose rendering differs.
	 */
	private void rewriteMirrors(SessionNode reference, String content) {
		for (int index : nodesByTabstop.get(reference.name)) {
			SessionNode mirror = arena.get(index);
			if (!mirror.live || mirror == reference || content.equals(render(mirror))) {
				continue;
			}
			dropChildren(mirror);
			pivotGrowth(mirror);
			anchors.setText(mirror.anchor, content);
			mirror.text = content;
		}
	}

	/**
	 * Sets growth so that only the pivot and its ancestors absorb text typed at
	 * the pivot boundaries.
	 */
	private void pivotGrowth(SessionNode pivot) {
		Set<Integer> expanding = new HashSet<>();
		for (int i = pivot.index; i >= 0; i = arena.get(i).parent) {
			expanding.add(i);
		}
		for (SessionNode node : arena) {
			if (!node.live) {
				continue;
			}
			Growth growth;
			if (expanding.contains(node.index)) {
				growth = Growth.EXPAND;
			} else if (node.index < pivot.index) {
				growth = Growth.LEFT;
			} else {
				growth = Growth.RIGHT;
			}
			anchors.setGrowth(node.anchor, growth);
		}
		// The snippet range only grows where the pivot touches its edge
		TextRange span = anchors.range(extent);
		TextRange at = anchors.range(pivot.anchor);
		boolean touches = at.start() == span.start() || at.end() == span.end();
		anchors.setGrowth(extent, touches ? Growth.EXPAND : Growth.LEFT);
	}

	private void dropChildren(SessionNode node) {
		if (node.children == null) {
			return;
		}
		for (int child : node.children) {
			SessionNode descendant = arena.get(child);
			dropChildren(descendant);
			descendant.live = false;
			anchors.delete(descendant.anchor);
		}
		node.children = null;
	}

	private String render(SessionNode node) {
		if (node.text != null) {
			return node.text;
		}
		StringBuilder sb = new StringBuilder();
		if (node.children != null) {
			for (int child : node.children) {
				sb.append(render(arena.get(child)));
			}
		}
		return sb.toString();
	}

	private SessionNode reference(String tabstopId) {
		if (tabstopId == null) {
			return null;
		}
		for (int index : nodesByTabstop.getOrDefault(tabstopId, List.of())) {
			SessionNode node = arena.get(index);
			if (node.live) {
				return node;
			}
		}
		return null;
	}

	private TextRange rangeOf(SessionNode node) {
		if (!anchors.isValid(node.anchor)) {
			throw new SessionCorruptionException("Anchor of node " + node.index + " no longer resolves");
		}
		return anchors.range(node.anchor);
	}

	private Set<String> liveTabstopIds() {
		Set<String> ids = new LinkedHashSet<>();
		for (SessionNode node : arena) {
			if (node.live && node.isTabstop()) {
				ids.add(node.name);
			}
		}
		return ids;
	}

	private TabstopGraph liveGraph() {
		return TabstopGraph.of(liveTabstopIds());
	}

	private void deleteAnchors() {
		for (SessionNode node : arena) {
			if (node.live && node.anchor != null) {
				anchors.delete(node.anchor);
			}
		}
		if (extent != null) {
			anchors.delete(extent);
		}
	}

	private void requireState(State expected) {
		if (state != expected) {
			throw new IllegalStateException("Snippet session is " + state + ", expected " + expected);
		}
	}

	private void requireStarted() {
		if (state == State.CREATED || state == State.STOPPED) {
			throw new IllegalStateException("Snippet session is " + state);
		}
	}
}
