package org.javai.snippets.session;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits session events to registered listeners.
 */
class SessionEvents implements SnippetSessionListener {

	private static final Logger logger = LoggerFactory.getLogger(SessionEvents.class);

	private final List<SnippetSessionListener> listeners = new CopyOnWriteArrayList<>();

	void add(SnippetSessionListener listener) {
		if (listener != null) {
			listeners.add(listener);
		}
	}

	void remove(SnippetSessionListener listener) {
		listeners.remove(listener);
	}

	@Override
	public void onSessionStart(SessionSnapshot snapshot) {
		emit("session-start", l -> l.onSessionStart(snapshot));
	}

	@Override
	public void onSessionStop(SessionSnapshot snapshot) {
		emit("session-stop", l -> l.onSessionStop(snapshot));
	}

	@Override
	public void onSessionSuspend(SessionSnapshot snapshot) {
		emit("session-suspend", l -> l.onSessionSuspend(snapshot));
	}

	@Override
	public void onSessionResume(SessionSnapshot snapshot) {
		emit("session-resume", l -> l.onSessionResume(snapshot));
	}

	@Override
	public void onJumpPre(JumpEvent event) {
		emit("jump-pre", l -> l.onJumpPre(event));
	}

	@Override
	public void onJumpPost(JumpEvent event) {
		emit("jump-post", l -> l.onJumpPost(event));
	}

	@Override
	public void onChoiceOffer(ChoiceOffer offer) {
		emit("choice-offer", l -> l.onChoiceOffer(offer));
	}

	@Override
	public void onSessionCorruption(SessionCorruptionException error) {
		emit("session-corruption", l -> l.onSessionCorruption(error));
	}

	private void emit(String event, Consumer<SnippetSessionListener> call) {
		for (SnippetSessionListener listener : listeners) {
			try {
				call.accept(listener);
			}
			catch (RuntimeException ex) {
				logger.warn("Listener threw an exception on {}", event, ex);
			}
		}
	}
}
