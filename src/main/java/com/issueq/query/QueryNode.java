package com.issueq.query;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Syntax tree of a query document. Every node covers {@code [start, end]} of the parsed
 * text and lies within the span of its parent.
 *
 * <p>The sub-interfaces narrow where a node may appear: {@link Statement}s make up a
 * document, {@link Simple} nodes make up a query, {@link Operand}s follow comparators
 * and {@link Bound}s open a range.
 */
public sealed interface QueryNode {

    int start();

    int end();

    <R> R accept(Visitor<R> visitor);

    /**
     * Top level entries of a {@link QueryDocument}.
     */
    sealed interface Statement extends QueryNode {}

    /**
     * A query or a chain of OR-ed queries.
     */
    sealed interface Branch extends Statement {}

    /**
     * Right hand side of a variable definition.
     */
    sealed interface DefinitionValue extends QueryNode {}

    sealed interface Simple extends QueryNode {}

    sealed interface Operand extends Simple {}

    sealed interface Bound extends Operand {}

    record QueryDocument(int start, int end, ImmutableList<Statement> nodes) implements QueryNode {
        public QueryDocument {
            requireSpan(start, end);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDocument(this);
        }
    }

    // ${name}=query
    record VariableDefinition(int start, int end, VariableName name, DefinitionValue value) implements Statement {
        public VariableDefinition {
            requireSpan(start, end);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableDefinition(this);
        }
    }

    /**
     * A {@code ${name}} reference; {@link #value()} is the token text.
     */
    record VariableName(int start, int end, String value) implements Simple {
        public VariableName {
            requireSpan(start, end);
        }

        /**
         * The name without the surrounding <code>${</code> and <code>}</code>.
         */
        public String name() {
            if (value.startsWith("${") && value.endsWith("}")) {
                return value.substring(2, value.length() - 1);
            }
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableName(this);
        }
    }

    // left OR right, right associative
    record OrExpression(int start, int end, Token or, Query left, Branch right) implements Branch {
        public OrExpression {
            requireSpan(start, end);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOrExpression(this);
        }
    }

    /**
     * One query line. {@code sortby} is null unless the line ends with a sort-by clause.
     */
    record Query(int start, int end, ImmutableList<Simple> nodes, SortBy sortby) implements Branch, DefinitionValue {
        public Query {
            requireSpan(start, end);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitQuery(this);
        }
    }

    /**
     * {@code sort-by:criteria}; criteria is a {@link Literal} or a {@link Missing}.
     */
    record SortBy(int start, int end, Token keyword, Simple criteria) implements Simple {
        public SortBy {
            requireSpan(start, end);
        }

        public boolean descending() {
            return keyword.type() == TokenType.SORT_DESC_BY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSortBy(this);
        }
    }

    // [-]qualifier:value
    record QualifiedValue(int start, int end, boolean not, Literal qualifier, Simple value) implements Simple {
        public QualifiedValue {
            requireSpan(start, end);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitQualifiedValue(this);
        }
    }

    // <value, <=value, >value, >=value
    record Compare(int start, int end, String comparator, Operand value) implements Simple {
        public Compare {
            requireSpan(start, end);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCompare(this);
        }
    }

    /**
     * {@code open..close}, {@code open..*} or {@code *..close}. An absent bound is null,
     * a bound that was expected but not found is a {@link Missing}.
     */
    record Range(int start, int end, Bound open, Operand close) implements Simple {
        public Range {
            requireSpan(start, end);
            if (open == null && close == null) {
                throw new IllegalArgumentException("range needs at least one bound");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRange(this);
        }
    }

    record Literal(int start, int end, String value) implements Simple {
        public Literal {
            requireSpan(start, end);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record Number(int start, int end, double value) implements Bound {
        public Number {
            requireSpan(start, end);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record Date(int start, int end, String value) implements Bound {
        public Date {
            requireSpan(start, end);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDate(this);
        }
    }

    /**
     * A token the grammar has no better node for.
     */
    record Any(int start, int end, TokenType tokenType) implements Simple {
        public Any {
            requireSpan(start, end);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAny(this);
        }
    }

    /**
     * Zero width placeholder for something the parser expected but did not find.
     */
    record Missing(int start, int end, String message) implements Operand, DefinitionValue {
        public Missing {
            requireSpan(start, end);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMissing(this);
        }
    }

    /**
     * One method per node kind, so a new kind fails to compile until every visitor handles it.
     */
    interface Visitor<R> {
        R visitDocument(QueryDocument node);

        R visitVariableDefinition(VariableDefinition node);

        R visitVariableName(VariableName node);

        R visitOrExpression(OrExpression node);

        R visitQuery(Query node);

        R visitSortBy(SortBy node);

        R visitQualifiedValue(QualifiedValue node);

        R visitCompare(Compare node);

        R visitRange(Range node);

        R visitLiteral(Literal node);

        R visitNumber(Number node);

        R visitDate(Date node);

        R visitAny(Any node);

        R visitMissing(Missing node);
    }

    private static void requireSpan(int start, int end) {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + "]");
        }
    }
}
