package org.javai.snippets.session;

/**
 * Exception thrown when an anchor of a session no longer resolves. A corrupted
 * session cannot be repaired and is stopped by the engine.
 */
public class SessionCorruptionException extends RuntimeException {

	public SessionCorruptionException(String message) {
		super(message);
	}
}
