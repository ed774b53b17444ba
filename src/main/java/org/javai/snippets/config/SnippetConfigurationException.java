package org.javai.snippets.config;

/**
 * Exception thrown when invalid values are passed to the normalizer, a session
 * or the engine configuration.
 */
public class SnippetConfigurationException extends RuntimeException {

	public SnippetConfigurationException(String message) {
		super(message);
	}
}
