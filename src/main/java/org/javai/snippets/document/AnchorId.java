package org.javai.snippets.document;

/**
 * Opaque handle of an anchor created by an {@link AnchorService}.
 *
 * @param value identifier unique within its service
 */
public record AnchorId(long value) {
}
