package org.javai.snippets.session;

/**
 * A jump between two tabstops of the active session.
 *
 * @param from tabstop focused before the jump
 * @param to tabstop focused after the jump
 */
public record JumpEvent(String from, String to) {
}
