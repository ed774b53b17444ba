package org.javai.snippets.session;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered stack of sessions, outermost first. Only the top session is active.
 */
public class SessionStack {

	private final List<SnippetSession> sessions = new ArrayList<>();

	public void push(SnippetSession session) {
		sessions.add(Objects.requireNonNull(session, "session must not be null"));
	}

	/**
	 * Removes and returns the top session.
	 *
	 * @throws IllegalStateException if the stack is empty
	 */
	public SnippetSession pop() {
		if (sessions.isEmpty()) {
			throw new IllegalStateException("No snippet session to pop");
		}
		return sessions.remove(sessions.size() - 1);
	}

	public Optional<SnippetSession> peek() {
		return sessions.isEmpty() ? Optional.empty() : Optional.of(sessions.get(sessions.size() - 1));
	}

	public boolean remove(SnippetSession session) {
		return sessions.remove(session);
	}

	public List<SnippetSession> asList() {
		return List.copyOf(sessions);
	}

	public int size() {
		return sessions.size();
	}

	public boolean isEmpty() {
		return sessions.isEmpty();
	}
}
