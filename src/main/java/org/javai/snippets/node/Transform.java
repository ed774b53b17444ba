package org.javai.snippets.node;

import java.util.Objects;

/**
 * Raw parts of a {@code ${id/pattern/format/flags}} transform.
 * <p>
 * The parts are kept exactly as written, escapes included. The engine never
 * evaluates them.
 */
public record Transform(String pattern, String format, String flags) {

	public Transform {
		Objects.requireNonNull(pattern, "pattern must not be null");
		Objects.requireNonNull(format, "format must not be null");
		Objects.requireNonNull(flags, "flags must not be null");
	}
}
