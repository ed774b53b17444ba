package org.javai.snippets.session;

import java.util.List;
import java.util.Objects;

/**
 * Signal that the focused tabstop has choices to offer or no content yet.
 * Presenting the offer is up to the listener.
 *
 * @param tabstopId the focused tabstop
 * @param choices choice values in authored order, empty when the tabstop has none
 */
public record ChoiceOffer(String tabstopId, List<String> choices) {

	public ChoiceOffer {
		Objects.requireNonNull(tabstopId, "tabstopId must not be null");
		choices = choices != null ? List.copyOf(choices) : List.of();
	}
}
