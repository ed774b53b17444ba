package org.javai.snippets.normalize;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.javai.snippets.config.SnippetConfigurationException;
import org.javai.snippets.node.SnippetNode;
import org.javai.snippets.node.SnippetNodeVisitor;
import org.javai.snippets.node.SnippetNodeWalker;
import org.javai.snippets.tabstop.TabstopOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves variables and lookup values in a parsed node tree and guarantees a
 * final tabstop.
 * <p>
 * Variables are resolved from, in order: the caller's lookup, values already
 * resolved during the same call, the {@link SnippetVariables} catalogue and the
 * environment. Random variables are re-evaluated at every occurrence.
 */
public class SnippetNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(SnippetNormalizer.class);

	private final SnippetVariables variables;
	private final Function<String, String> environment;

	public SnippetNormalizer() {
		this(new SnippetVariables(EditorContext.NONE), System::getenv);
	}

	public SnippetNormalizer(SnippetVariables variables) {
		this(variables, System::getenv);
	}

	public SnippetNormalizer(SnippetVariables variables, Function<String, String> environment) {
		this.variables = Objects.requireNonNull(variables, "variables must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	/**
	 * Normalizes parsed nodes.
	 *
	 * @param nodes parsed nodes
	 * @param lookup values keyed by tabstop id or variable name, may be null
	 * @return the normalized nodes, ending with a final tabstop if none was present
	 * @throws SnippetConfigurationException if the lookup holds null keys or values
	 */
	public List<SnippetNode> normalize(List<SnippetNode> nodes, Map<String, String> lookup) {
		Objects.requireNonNull(nodes, "nodes must not be null");
		validateLookup(lookup);
		Map<String, String> values = lookup != null ? lookup : Map.of();

		Resolution resolution = new Resolution(values);
		List<SnippetNode> result = resolution.normalizeAll(nodes);
		if (!SnippetNodeWalker.tabstopIds(result).contains(TabstopOrder.FINAL_ID)) {
			result.add(SnippetNode.Tabstop.withText(TabstopOrder.FINAL_ID, ""));
		}
		return List.copyOf(result);
	}

	/**
	 * Checks that a lookup holds no null keys or values.
	 *
	 * @param lookup the lookup, may be null
	 * @throws SnippetConfigurationException on a null key or value
	 */
	public static void validateLookup(Map<String, String> lookup) {
		if (lookup == null) {
			return;
		}
		for (Map.Entry<String, String> entry : lookup.entrySet()) {
			if (entry.getKey() == null) {
				throw new SnippetConfigurationException("Lookup keys must not be null");
			}
			if (entry.getValue() == null) {
				throw new SnippetConfigurationException("Lookup value for '" + entry.getKey() + "' must not be null");
			}
		}
	}

	/**
	 * State of one normalize call. The cache dies with it.
	 */
	private final class Resolution implements SnippetNodeVisitor<SnippetNode> {

		private final Map<String, String> lookup;
		private final Map<String, Optional<String>> cache = new HashMap<>();

		private Resolution(Map<String, String> lookup) {
			this.lookup = lookup;
		}

		private List<SnippetNode> normalizeAll(List<SnippetNode> nodes) {
			List<SnippetNode> result = new ArrayList<>(nodes.size());
			for (SnippetNode node : nodes) {
				result.add(node.accept(this));
			}
			return result;
		}

		private List<SnippetNode> normalizePlaceholder(List<SnippetNode> placeholder) {
			if (placeholder == null) {
				return List.of(new SnippetNode.Text(""));
			}
			return normalizeAll(placeholder);
		}

		@Override
		public SnippetNode visitText(SnippetNode.Text text) {
			return text;
		}

		@Override
		public SnippetNode visitTabstop(SnippetNode.Tabstop tabstop) {
			String value = lookup.get(tabstop.id());
			if (value != null) {
				return new SnippetNode.Tabstop(tabstop.id(), null, value, tabstop.choices(), tabstop.transform());
			}
			return new SnippetNode.Tabstop(tabstop.id(), normalizePlaceholder(tabstop.placeholder()), null,
					tabstop.choices(), tabstop.transform());
		}

		@Override
		public SnippetNode visitVariable(SnippetNode.Variable variable) {
			Optional<String> value = resolve(variable.name());
			if (value.isPresent()) {
				return new SnippetNode.Variable(variable.name(), null, value.get(), variable.transform());
			}
			return new SnippetNode.Variable(variable.name(), normalizePlaceholder(variable.placeholder()), null,
					variable.transform());
		}

		private Optional<String> resolve(String name) {
			String fromLookup = lookup.get(name);
			if (fromLookup != null) {
				return Optional.of(fromLookup);
			}
			if (SnippetVariables.isRandom(name)) {
				return variables.evaluate(name);
			}
			Optional<String> cached = cache.get(name);
			if (cached != null) {
				return cached;
			}
			Optional<String> value = variables.evaluate(name);
			if (value.isEmpty()) {
				value = Optional.ofNullable(environment.apply(name));
			}
			if (value.isEmpty()) {
				logger.debug("Variable '{}' is unresolved", name);
			}
			cache.put(name, value);
			return value;
		}
	}
}
