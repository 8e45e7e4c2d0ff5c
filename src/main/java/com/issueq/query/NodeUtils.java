package com.issueq.query;

import com.issueq.query.QueryNode.Any;
import com.issueq.query.QueryNode.Compare;
import com.issueq.query.QueryNode.Date;
import com.issueq.query.QueryNode.Literal;
import com.issueq.query.QueryNode.Missing;
import com.issueq.query.QueryNode.OrExpression;
import com.issueq.query.QueryNode.QualifiedValue;
import com.issueq.query.QueryNode.Query;
import com.issueq.query.QueryNode.QueryDocument;
import com.issueq.query.QueryNode.Range;
import com.issueq.query.QueryNode.SortBy;
import com.issueq.query.QueryNode.VariableDefinition;
import com.issueq.query.QueryNode.VariableName;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only traversal helpers over a parsed tree. Safe to call concurrently on the same tree.
 */
public final class NodeUtils {

    private static final ChildrenVisitor CHILDREN = new ChildrenVisitor();

    private record Visit(QueryNode node, QueryNode parent) {}

    private NodeUtils() {}

    /**
     * Direct children of a node in source order.
     */
    public static ImmutableList<QueryNode> children(QueryNode node) {
        return node.accept(CHILDREN);
    }

    /**
     * Visits {@code node} and all of its descendants in document order, parents before children.
     */
    public static void walk(QueryNode node, TreeVisitor visitor) {
        if (node == null) {
            return;
        }
        Deque<Visit> stack = new ArrayDeque<>();
        stack.push(new Visit(node, null));
        while (!stack.isEmpty()) {
            Visit visit = stack.pop();
            visitor.visit(visit.node(), visit.parent());
            children(visit.node()).reverseForEach(child -> stack.push(new Visit(child, visit.node())));
        }
    }

    public static Optional<QueryNode> nodeAt(QueryNode node, int offset) {
        return nodeAt(node, offset, null);
    }

    /**
     * Finds the innermost node whose span contains {@code offset}.
     *
     * @param parents when not null, receives the chain from {@code node} down to the result
     */
    public static Optional<QueryNode> nodeAt(QueryNode node, int offset, List<QueryNode> parents) {
        Map<QueryNode, QueryNode> parentOf = new IdentityHashMap<>();
        QueryNode[] match = new QueryNode[1];
        walk(node, (candidate, parent) -> {
            if (containsPosition(candidate, offset)) {
                parentOf.put(candidate, parent);
                match[0] = candidate;
            }
        });
        if (match[0] == null) {
            return Optional.empty();
        }
        if (parents != null) {
            MutableList<QueryNode> chain = Lists.mutable.empty();
            for (QueryNode current = match[0]; current != null; current = parentOf.get(current)) {
                chain.add(current);
            }
            parents.addAll(chain.reverseThis());
        }
        return Optional.of(match[0]);
    }

    public static boolean containsPosition(QueryNode node, int offset) {
        return node.start() <= offset && offset <= node.end();
    }

    private static final class ChildrenVisitor implements QueryNode.Visitor<ImmutableList<QueryNode>> {

        @Override
        public ImmutableList<QueryNode> visitDocument(QueryDocument node) {
            return Lists.immutable.withAll(node.nodes());
        }

        @Override
        public ImmutableList<QueryNode> visitVariableDefinition(VariableDefinition node) {
            return Lists.immutable.with(node.name(), node.value());
        }

        @Override
        public ImmutableList<QueryNode> visitVariableName(VariableName node) {
            return Lists.immutable.empty();
        }

        @Override
        public ImmutableList<QueryNode> visitOrExpression(OrExpression node) {
            return Lists.immutable.with(node.left(), node.right());
        }

        @Override
        public ImmutableList<QueryNode> visitQuery(Query node) {
            MutableList<QueryNode> children = Lists.mutable.withAll(node.nodes());
            if (node.sortby() != null) {
                children.add(node.sortby());
            }
            return children.toImmutable();
        }

        @Override
        public ImmutableList<QueryNode> visitSortBy(SortBy node) {
            return Lists.immutable.with(node.criteria());
        }

        @Override
        public ImmutableList<QueryNode> visitQualifiedValue(QualifiedValue node) {
            return Lists.immutable.with(node.qualifier(), node.value());
        }

        @Override
        public ImmutableList<QueryNode> visitCompare(Compare node) {
            return Lists.immutable.with(node.value());
        }

        @Override
        public ImmutableList<QueryNode> visitRange(Range node) {
            MutableList<QueryNode> children = Lists.mutable.empty();
            if (node.open() != null) {
                children.add(node.open());
            }
            if (node.close() != null) {
                children.add(node.close());
            }
            return children.toImmutable();
        }

        @Override
        public ImmutableList<QueryNode> visitLiteral(Literal node) {
            return Lists.immutable.empty();
        }

        @Override
        public ImmutableList<QueryNode> visitNumber(QueryNode.Number node) {
            return Lists.immutable.empty();
        }

        @Override
        public ImmutableList<QueryNode> visitDate(Date node) {
            return Lists.immutable.empty();
        }

        @Override
        public ImmutableList<QueryNode> visitAny(Any node) {
            return Lists.immutable.empty();
        }

        @Override
        public ImmutableList<QueryNode> visitMissing(Missing node) {
            return Lists.immutable.empty();
        }
    }
}
