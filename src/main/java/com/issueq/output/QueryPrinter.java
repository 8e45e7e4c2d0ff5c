package com.issueq.output;

import com.issueq.query.QueryNode;
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
import com.issueq.query.QueryNode.Simple;
import com.issueq.query.QueryNode.SortBy;
import com.issueq.query.QueryNode.Statement;
import com.issueq.query.QueryNode.VariableDefinition;
import com.issueq.query.QueryNode.VariableName;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Renders trees back to query text, substituting variable values.
 *
 * <p>A document or an OR-expression has no single rendering: each OR branch is a query of
 * its own, see {@link #printQueries(QueryNode)}.
 */
public class QueryPrinter {
    private final PrintContext context;
    private final Renderer renderer = new Renderer();

    public QueryPrinter(PrintContext context) {
        this.context = context;
    }

    /**
     * Renders a node that has exactly one rendering.
     *
     * @throws IllegalArgumentException for documents and OR-expressions
     */
    public String print(QueryNode node) {
        return node.accept(renderer);
    }

    /**
     * Renders every query reachable from {@code node}, one entry per OR branch. Variable
     * definitions and other nodes rendering to nothing are left out.
     */
    public ImmutableList<String> printQueries(QueryNode node) {
        MutableList<String> queries = Lists.mutable.empty();
        collect(node, queries);
        return queries.toImmutable();
    }

    private void collect(QueryNode node, MutableList<String> queries) {
        if (node instanceof QueryDocument document) {
            for (Statement statement : document.nodes()) {
                collect(statement, queries);
            }
        } else if (node instanceof OrExpression or) {
            // walk the right spine in a loop, OR chains can be long
            QueryNode current = or;
            while (current instanceof OrExpression branch) {
                add(print(branch.left()), queries);
                current = branch.right();
            }
            add(print(current), queries);
        } else {
            add(print(node), queries);
        }
    }

    private static void add(String query, MutableList<String> queries) {
        if (!query.isEmpty()) {
            queries.add(query);
        }
    }

    private String source(QueryNode node) {
        return context.text().substring(node.start(), node.end());
    }

    private final class Renderer implements QueryNode.Visitor<String> {

        @Override
        public String visitDocument(QueryDocument node) {
            throw new IllegalArgumentException("A document renders to one query per line, use printQueries");
        }

        @Override
        public String visitOrExpression(OrExpression node) {
            throw new IllegalArgumentException("An OR-expression renders to one query per branch, use printQueries");
        }

        @Override
        public String visitVariableDefinition(VariableDefinition node) {
            return "";
        }

        @Override
        public String visitMissing(Missing node) {
            return "";
        }

        @Override
        public String visitVariableName(VariableName node) {
            String value = context.variableValues().get(node.name());
            return value != null ? value : node.value();
        }

        @Override
        public String visitQuery(Query node) {
            // sortby is not part of the query text
            StringBuilder sb = new StringBuilder();
            int lastEnd = -1;
            for (Simple child : node.nodes()) {
                if (lastEnd != -1 && child.start() != lastEnd) {
                    sb.append(' ');
                }
                sb.append(child.accept(this));
                lastEnd = child.end();
            }
            return sb.toString();
        }

        @Override
        public String visitSortBy(SortBy node) {
            return source(node.criteria());
        }

        @Override
        public String visitQualifiedValue(QualifiedValue node) {
            return (node.not() ? "-" : "") + node.qualifier().value() + ":" + node.value().accept(this);
        }

        @Override
        public String visitCompare(Compare node) {
            return node.comparator() + node.value().accept(this);
        }

        @Override
        public String visitRange(Range node) {
            if (node.open() != null && node.close() != null) {
                return node.open().accept(this) + ".." + node.close().accept(this);
            }
            if (node.open() != null) {
                return node.open().accept(this) + "..*";
            }
            return "*.." + node.close().accept(this);
        }

        @Override
        public String visitLiteral(Literal node) {
            return source(node);
        }

        @Override
        public String visitNumber(QueryNode.Number node) {
            return source(node);
        }

        @Override
        public String visitDate(Date node) {
            return source(node);
        }

        @Override
        public String visitAny(Any node) {
            return source(node);
        }
    }
}
