package org.javai.snippets.normalize;

import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Facts about the editor the snippet is expanded in, used to evaluate the
 * built-in variables ({@code TM_FILENAME}, {@code TM_CURRENT_LINE}, ...).
 * <p>
 * Implemented by the embedding editor. Every fact is optional; a missing fact
 * leaves the variable to the environment fallback.
 */
public interface EditorContext {

	/**
	 * A context that knows nothing.
	 */
	EditorContext NONE = new EditorContext() {
	};

	default Optional<String> selectedText() {
		return Optional.empty();
	}

	default Optional<String> currentLine() {
		return Optional.empty();
	}

	default Optional<String> currentWord() {
		return Optional.empty();
	}

	/**
	 * Zero-based line index of the cursor.
	 */
	default OptionalInt lineIndex() {
		return OptionalInt.empty();
	}

	/**
	 * Zero-based column of the cursor.
	 */
	default OptionalInt cursorIndex() {
		return OptionalInt.empty();
	}

	default Optional<Path> filePath() {
		return Optional.empty();
	}

	default Optional<Path> workspaceFolder() {
		return Optional.empty();
	}

	default Optional<String> clipboard() {
		return Optional.empty();
	}

	default Optional<String> lineComment() {
		return Optional.empty();
	}

	default Optional<String> blockCommentStart() {
		return Optional.empty();
	}

	default Optional<String> blockCommentEnd() {
		return Optional.empty();
	}
}
