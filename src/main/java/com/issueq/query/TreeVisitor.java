package com.issueq.query;

/**
 * Callback for {@link NodeUtils#walk}. {@code parent} is null for the node the walk started at.
 */
@FunctionalInterface
public interface TreeVisitor {
    void visit(QueryNode node, QueryNode parent);
}
