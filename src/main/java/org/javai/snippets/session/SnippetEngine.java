package org.javai.snippets.session;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.snippets.Snippet;
import org.javai.snippets.config.SnippetEngineConfig;
import org.javai.snippets.document.AnchorService;
import org.javai.snippets.document.SnippetDocument;
import org.javai.snippets.document.TextRange;
import org.javai.snippets.node.SnippetNode;
import org.javai.snippets.node.SnippetNodeVisitor;
import org.javai.snippets.node.SnippetNodeWalker;
import org.javai.snippets.normalize.SnippetNormalizer;
import org.javai.snippets.parse.SnippetParser;
import org.javai.snippets.tabstop.Direction;
import org.javai.snippets.tabstop.TabstopGraph;
import org.javai.snippets.tabstop.TabstopOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for embedding snippets into an editor.
 *
 * <p>The engine parses and normalizes snippets, expands them into a document and
 * routes navigation and document-change notifications to the active session.
 * Expanding while a session is active suspends it and starts a nested session on
 * top of the {@link SessionStack}.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * InMemoryDocument document = new InMemoryDocument();
 * SnippetEngine engine = new SnippetEngine(document, document);
 * engine.addListener(new StopOnFinalTabstop(engine));
 *
 * engine.expand(Snippet.of("for (${1:i} = 0; $1 < ${2:n}; $1++) {\n\t$0\n}"));
 * // ... edit the document ...
 * engine.onDocumentChanged();
 * engine.jump(Direction.NEXT);
 * }</pre>
 *
 * <p>Stack changes and the operations of every session the engine starts are
 * serialized on the engine. A session found corrupted is stopped, removed from
 * the stack and reported once to listeners.</p>
 */
public class SnippetEngine {

	private static final Logger logger = LoggerFactory.getLogger(SnippetEngine.class);

	private final SnippetDocument document;
	private final AnchorService anchors;
	private final SnippetEngineConfig config;
	private final SnippetNormalizer normalizer;
	private final SessionStack stack;
	private final SessionEvents events = new SessionEvents();

	public SnippetEngine(SnippetDocument document, AnchorService anchors) {
		this(document, anchors, SnippetEngineConfig.defaults(), new SnippetNormalizer(), new SessionStack());
	}

	public SnippetEngine(SnippetDocument document, AnchorService anchors, SnippetEngineConfig config,
			SnippetNormalizer normalizer, SessionStack stack) {
		this.document = Objects.requireNonNull(document, "document must not be null");
		this.anchors = Objects.requireNonNull(anchors, "anchors must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
		this.stack = Objects.requireNonNull(stack, "stack must not be null");
	}

	public void addListener(SnippetSessionListener listener) {
		events.add(listener);
	}

	public void removeListener(SnippetSessionListener listener) {
		events.remove(listener);
	}

	public List<SnippetNode> parse(String body) {
		return SnippetParser.parse(body);
	}

	/**
	 * Parses and normalizes a snippet and computes its tabstop ring.
	 */
	public PreparedSnippet prepare(Snippet snippet) {
		Objects.requireNonNull(snippet, "snippet must not be null");
		List<SnippetNode> nodes = normalizer.normalize(SnippetParser.parse(snippet.body()), snippet.lookup());
		return new PreparedSnippet(nodes, TabstopGraph.build(nodes));
	}

	public Optional<SnippetSession> expand(Snippet snippet) {
		return expand(snippet, null);
	}

	/**
	 * Expands a snippet at the cursor.
	 *
	 * @param snippet the snippet
	 * @param region text to remove first, typically the typed snippet prefix; may be null
	 * @return the started session, or empty if the snippet was inserted as plain text
	 * @throws org.javai.snippets.parse.SnippetSyntaxException if the body is malformed
	 */
	public synchronized Optional<SnippetSession> expand(Snippet snippet, TextRange region) {
		PreparedSnippet prepared = prepare(snippet);
		if (region != null) {
			document.deleteText(region.start(), region.end());
			document.setCursor(region.start());
		}
		int offset = document.cursor();

		if (prepared.isPlainText()) {
			String text = SnippetNodeWalker.render(prepared.nodes());
			document.insertText(offset, text);
			document.setCursor(offset + finalTabstopOffset(prepared.nodes()));
			logger.debug("Inserted snippet without tabstops at {}", offset);
			return Optional.empty();
		}

		Optional<SnippetSession> parent = stack.peek();
		parent.ifPresent(session -> guarded(session, SnippetSession::suspend));
		SnippetSession session = new SnippetSession(prepared.nodes(), document, anchors, config, events, this);
		stack.push(session);
		try {
			guarded(session, s -> s.start(offset));
		}
		catch (RuntimeException ex) {
			session.forceStop();
			stack.remove(session);
			resumeTop();
			throw ex;
		}
		return session.state() == SnippetSession.State.STOPPED ? Optional.empty() : Optional.of(session);
	}

	/**
	 * Jumps the active session.
	 *
	 * @throws IllegalStateException if no session is active
	 */
	public synchronized void jump(Direction direction) {
		SnippetSession session = requireActive();
		guarded(session, s -> s.jump(direction));
	}

	/**
	 * Stops the active session and resumes the one below it, if any.
	 *
	 * @throws IllegalStateException if no session is active
	 */
	public synchronized void stop() {
		SnippetSession session = requireActive();
		session.stop();
		stack.remove(session);
		resumeTop();
	}

	/**
	 * Stops every session, innermost first.
	 */
	public synchronized void stopAll() {
		while (!stack.isEmpty()) {
			SnippetSession session = stack.pop();
			session.stop();
		}
	}

	/**
	 * Notifies the active session that the document text has changed. Must be
	 * called after the edit has been applied.
	 */
	public synchronized void onDocumentChanged() {
		stack.peek().ifPresent(session -> guarded(session, SnippetSession::synchronize));
	}

	public synchronized Optional<SnippetSession> activeSession() {
		return stack.peek();
	}

	public synchronized List<SnippetSession> sessions() {
		return stack.asList();
	}

	private SnippetSession requireActive() {
		return stack.peek().orElseThrow(() -> new IllegalStateException("No active snippet session"));
	}

	private void resumeTop() {
		stack.peek().ifPresent(session -> {
			if (session.state() == SnippetSession.State.SUSPENDED) {
				guarded(session, SnippetSession::resume);
			}
		});
	}

	private void guarded(SnippetSession session, SessionOperation operation) {
		try {
			operation.apply(session);
		}
		catch (SessionCorruptionException ex) {
			logger.warn("Snippet session is corrupted and will be stopped: {}", ex.getMessage());
			session.forceStop();
			stack.remove(session);
			events.onSessionCorruption(ex);
			resumeTop();
		}
	}

	private static int finalTabstopOffset(List<SnippetNode> nodes) {
		int[] offset = { 0 };
		boolean found = locateFinal(nodes, offset);
		return found ? offset[0] : SnippetNodeWalker.render(nodes).length();
	}

	private static boolean locateFinal(List<SnippetNode> nodes, int[] offset) {
		for (SnippetNode node : nodes) {
			boolean found = node.accept(new SnippetNodeVisitor<>() {
				@Override
				public Boolean visitText(SnippetNode.Text text) {
					offset[0] += text.text().length();
					return false;
				}

				@Override
				public Boolean visitTabstop(SnippetNode.Tabstop tabstop) {
					if (TabstopOrder.FINAL_ID.equals(tabstop.id())) {
						return true;
					}
					return descend(tabstop.text(), tabstop.placeholder());
				}

				@Override
				public Boolean visitVariable(SnippetNode.Variable variable) {
					return descend(variable.text(), variable.placeholder());
				}

				private Boolean descend(String text, List<SnippetNode> placeholder) {
					if (text != null) {
						offset[0] += text.length();
						return false;
					}
					return placeholder != null && locateFinal(placeholder, offset);
				}
			});
			if (found) {
				return true;
			}
		}
		return false;
	}

	@FunctionalInterface
	private interface SessionOperation {
		void apply(SnippetSession session);
	}
}
