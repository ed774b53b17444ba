package org.javai.snippets.config;

/**
 * Configuration for snippet sessions.
 *
 * <p>Controls the markers shown for empty tabstops while a session is active.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * SnippetEngineConfig config = SnippetEngineConfig.defaults();
 *
 * // Custom configuration
 * SnippetEngineConfig config = SnippetEngineConfig.builder()
 *         .emptyTabstop("_")
 *         .build();
 * }</pre>
 *
 * @param emptyTabstop marker shown for an empty tabstop
 * @param emptyTabstopFinal marker shown for an empty final tabstop
 */
public record SnippetEngineConfig(
		String emptyTabstop,
		String emptyTabstopFinal
) {

	public static final String DEFAULT_EMPTY_TABSTOP = "•";

	public static final String DEFAULT_EMPTY_TABSTOP_FINAL = "∎";

	public SnippetEngineConfig {
		if (emptyTabstop == null) {
			throw new SnippetConfigurationException("emptyTabstop must not be null");
		}
		if (emptyTabstopFinal == null) {
			throw new SnippetConfigurationException("emptyTabstopFinal must not be null");
		}
	}

	/**
	 * Creates a configuration with default values.
	 *
	 * @return default configuration
	 */
	public static SnippetEngineConfig defaults() {
		return new SnippetEngineConfig(DEFAULT_EMPTY_TABSTOP, DEFAULT_EMPTY_TABSTOP_FINAL);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link SnippetEngineConfig}.
	 */
	public static class Builder {
		private String emptyTabstop = DEFAULT_EMPTY_TABSTOP;
		private String emptyTabstopFinal = DEFAULT_EMPTY_TABSTOP_FINAL;

		private Builder() {}

		public Builder emptyTabstop(String emptyTabstop) {
			this.emptyTabstop = emptyTabstop;
			return this;
		}

		/**
		 * Sets the marker of the final tabstop when it is empty.
		 *
		 * @param emptyTabstopFinal the marker, may be empty to show nothing
		 * @return this builder
		 */
		public Builder emptyTabstopFinal(String emptyTabstopFinal) {
			this.emptyTabstopFinal = emptyTabstopFinal;
			return this;
		}

		public SnippetEngineConfig build() {
			return new SnippetEngineConfig(emptyTabstop, emptyTabstopFinal);
		}
	}
}
