package org.javai.snippets.normalize;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Catalogue of the built-in snippet variables.
 * <p>
 * Editor facts come from an {@link EditorContext}, time from a {@link Clock} and
 * randomness from a {@link Random}, so every variable can be pinned in tests.
 */
public class SnippetVariables {

	private static final Set<String> RANDOM_NAMES = Set.of("RANDOM", "RANDOM_HEX", "UUID");

	private static final Map<String, Evaluator> EVALUATORS = Map.ofEntries(
			variable("TM_SELECTED_TEXT", v -> v.context.selectedText()),
			variable("TM_CURRENT_LINE", v -> v.context.currentLine()),
			variable("TM_CURRENT_WORD", v -> v.context.currentWord()),
			variable("TM_LINE_INDEX", v -> asString(v.context.lineIndex(), 0)),
			variable("TM_LINE_NUMBER", v -> asString(v.context.lineIndex(), 1)),
			variable("TM_FILENAME", v -> v.context.filePath().map(SnippetVariables::fileName)),
			variable("TM_FILENAME_BASE", v -> v.context.filePath().map(SnippetVariables::fileNameBase)),
			variable("TM_DIRECTORY", v -> v.context.filePath().map(Path::getParent).map(Path::toString)),
			variable("TM_FILEPATH", v -> v.context.filePath().map(Path::toString)),
			variable("RELATIVE_FILEPATH", SnippetVariables::relativeFilePath),
			variable("WORKSPACE_FOLDER", v -> v.context.workspaceFolder().map(Path::toString)),
			variable("WORKSPACE_NAME", v -> v.context.workspaceFolder().map(SnippetVariables::fileName)),
			variable("CLIPBOARD", v -> v.context.clipboard()),
			variable("CURSOR_INDEX", v -> asString(v.context.cursorIndex(), 0)),
			variable("CURSOR_NUMBER", v -> asString(v.context.cursorIndex(), 1)),
			variable("LINE_COMMENT", v -> v.context.lineComment()),
			variable("BLOCK_COMMENT_START", v -> v.context.blockCommentStart()),
			variable("BLOCK_COMMENT_END", v -> v.context.blockCommentEnd()),
			variable("CURRENT_YEAR", v -> v.formatNow("yyyy")),
			variable("CURRENT_YEAR_SHORT", v -> v.formatNow("yy")),
			variable("CURRENT_MONTH", v -> v.formatNow("MM")),
			variable("CURRENT_MONTH_NAME", v -> v.formatNow("MMMM")),
			variable("CURRENT_MONTH_NAME_SHORT", v -> v.formatNow("MMM")),
			variable("CURRENT_DATE", v -> v.formatNow("dd")),
			variable("CURRENT_DAY_NAME", v -> v.formatNow("EEEE")),
			variable("CURRENT_DAY_NAME_SHORT", v -> v.formatNow("EEE")),
			variable("CURRENT_HOUR", v -> v.formatNow("HH")),
			variable("CURRENT_MINUTE", v -> v.formatNow("mm")),
			variable("CURRENT_SECOND", v -> v.formatNow("ss")),
			variable("CURRENT_SECONDS_UNIX", v -> Optional.of(Long.toString(v.clock.instant().getEpochSecond()))),
			variable("CURRENT_TIMEZONE_OFFSET", v -> v.formatNow("xx")),
			variable("RANDOM", v -> Optional.of(String.format("%06d", v.random.nextInt(1_000_000)))),
			variable("RANDOM_HEX", v -> Optional.of(String.format("%06x", v.random.nextInt(0x1000000)))),
			variable("UUID", v -> Optional.of(v.randomUuid().toString())));

	private final EditorContext context;
	private final Clock clock;
	private final Random random;

	public SnippetVariables(EditorContext context) {
		this(context, Clock.systemDefaultZone(), new Random());
	}

	public SnippetVariables(EditorContext context, Clock clock, Random random) {
		this.context = Objects.requireNonNull(context, "context must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.random = Objects.requireNonNull(random, "random must not be null");
	}

	/**
	 * Returns true if the name belongs to the catalogue.
	 */
	public boolean isKnown(String name) {
		return EVALUATORS.containsKey(name);
	}

	/**
	 * Returns true for variables that produce a new value on every evaluation.
	 */
	public static boolean isRandom(String name) {
		return RANDOM_NAMES.contains(name);
	}

	/**
	 * Evaluates a catalogue variable.
	 *
	 * @param name variable name
	 * @return the value, or empty if the name is unknown or the editor cannot provide it
	 */
	public Optional<String> evaluate(String name) {
		Evaluator evaluator = EVALUATORS.get(name);
		if (evaluator == null) {
			return Optional.empty();
		}
		return evaluator.evaluate(this);
	}

	private Optional<String> formatNow(String pattern) {
		ZonedDateTime now = ZonedDateTime.now(clock);
		return Optional.of(DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH).format(now));
	}

	private UUID randomUuid() {
		long mostSig = (random.nextLong() & ~0xF000L) | 0x4000L;
		long leastSig = (random.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
		return new UUID(mostSig, leastSig);
	}

	private Optional<String> relativeFilePath() {
		Optional<Path> file = context.filePath();
		if (file.isEmpty()) {
			return Optional.empty();
		}
		Optional<Path> workspace = context.workspaceFolder();
		if (workspace.isPresent() && file.get().startsWith(workspace.get())) {
			return Optional.of(workspace.get().relativize(file.get()).toString());
		}
		return Optional.of(file.get().toString());
	}

	private static Optional<String> asString(OptionalInt value, int offset) {
		return value.isPresent() ? Optional.of(Integer.toString(value.getAsInt() + offset)) : Optional.empty();
	}

	private static String fileName(Path path) {
		Path name = path.getFileName();
		return name != null ? name.toString() : "";
	}

	private static String fileNameBase(Path path) {
		String name = fileName(path);
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	private static Map.Entry<String, Evaluator> variable(String name, Evaluator evaluator) {
		return Map.entry(name, evaluator);
	}

	@FunctionalInterface
	private interface Evaluator {
		Optional<String> evaluate(SnippetVariables variables);
	}
}
