package org.javai.snippets.node;

/**
 * Visitor interface for traversing snippet node trees.
 * <p>
 * Every traversal over {@link SnippetNode} goes through this interface, so a
 * new node kind is a compile-time checked change.
 *
 * @param <R> the return type of the visitor operations
 */
public interface SnippetNodeVisitor<R> {

	R visitText(SnippetNode.Text text);

	R visitTabstop(SnippetNode.Tabstop tabstop);

	R visitVariable(SnippetNode.Variable variable);
}
