package org.javai.snippets.session;

/**
 * Receives session lifecycle and navigation events. All methods default to no-op.
 * <p>
 * Events are fire-and-forget: an exception thrown by a listener is logged and
 * does not affect the session.
 */
public interface SnippetSessionListener {

	default void onSessionStart(SessionSnapshot snapshot) {
	}

	default void onSessionStop(SessionSnapshot snapshot) {
	}

	default void onSessionSuspend(SessionSnapshot snapshot) {
	}

	default void onSessionResume(SessionSnapshot snapshot) {
	}

	default void onJumpPre(JumpEvent event) {
	}

	default void onJumpPost(JumpEvent event) {
	}

	default void onChoiceOffer(ChoiceOffer offer) {
	}

	/**
	 * Called once when a session is found corrupted and removed.
	 */
	default void onSessionCorruption(SessionCorruptionException error) {
	}
}
