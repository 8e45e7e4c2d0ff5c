package com.issueq.query;

import com.issueq.query.QueryNode.Any;
import com.issueq.query.QueryNode.Bound;
import com.issueq.query.QueryNode.Branch;
import com.issueq.query.QueryNode.Compare;
import com.issueq.query.QueryNode.Date;
import com.issueq.query.QueryNode.DefinitionValue;
import com.issueq.query.QueryNode.Literal;
import com.issueq.query.QueryNode.Missing;
import com.issueq.query.QueryNode.Operand;
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
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Recursive descent parser for query documents.
 *
 * <p>Parsing never fails: gaps in the input become {@link Missing} nodes and constructs
 * that only look like OR-expressions, qualified values or sort-by clauses fall back to
 * plain content. Speculative rules take a checkpoint (the current token) and rewind to it
 * when they do not match, so a failed attempt leaves no trace.
 *
 * <p>Instances keep the scanner state of the running parse and must not be shared
 * between threads.
 */
public class QueryParser {
    private static final Logger log = LoggerFactory.getLogger(QueryParser.class);

    private final Scanner scanner = new Scanner();
    private Token token = Token.eof(0);

    public QueryDocument parse(String text) {
        String input = text == null ? "" : text;
        scanner.reset(input);
        token = scanner.next();

        MutableList<Statement> nodes = Lists.mutable.empty();
        while (token.type() != TokenType.EOF) {
            if (accept(TokenType.WHITESPACE).isPresent() || accept(TokenType.NEW_LINE).isPresent()) {
                continue;
            }
            QueryParser.<Statement>firstOf(this::parseVariableDefinition, () -> parseQuery(true))
                .ifPresent(nodes::add);
        }
        log.debug("Parsed {} statement(s) from {} characters", nodes.size(), input.length());
        return new QueryDocument(0, input.length(), nodes.toImmutable());
    }

    /**
     * Parses the rest of the line. With {@code allowOr}, an {@code OR} followed by more
     * content splits the line into branches, folded into {@code a OR (b OR c)}. The chain
     * is built in a loop so that long lines do not grow the call stack.
     */
    private Optional<Branch> parseQuery(boolean allowOr) {
        MutableList<Query> branches = Lists.mutable.empty();
        MutableList<Token> ors = Lists.mutable.empty();
        MutableList<Simple> nodes = Lists.mutable.empty();
        SortBy sortBy = null;

        while (token.type() != TokenType.NEW_LINE && token.type() != TokenType.EOF) {
            if (accept(TokenType.WHITESPACE).isPresent() || accept(TokenType.LINE_COMMENT).isPresent()) {
                continue;
            }

            if (allowOr && nodes.notEmpty() && token.type() == TokenType.OR) {
                Token or = token;
                accept(TokenType.OR);
                Token checkpoint = mark();
                if (hasContentBeforeLineEnd()) {
                    branches.add(query(nodes, sortBy));
                    ors.add(or);
                    nodes = Lists.mutable.empty();
                    sortBy = null;
                    continue;
                }
                // nothing after OR, it is just a word
                rewind(checkpoint);
                if (sortBy != null) {
                    demote(sortBy, nodes);
                    sortBy = null;
                }
                nodes.add(new Any(or.start(), or.end(), or.type()));
                continue;
            }

            // a sort-by clause only counts at the end of the query
            if (sortBy != null) {
                demote(sortBy, nodes);
                sortBy = null;
            }
            if (nodes.notEmpty()) {
                Optional<SortBy> parsed = parseSortBy();
                if (parsed.isPresent()) {
                    sortBy = parsed.get();
                    continue;
                }
            }

            QueryParser.<Simple>firstOf(
                    this::parseQualifiedValue,
                    this::parseNumber,
                    this::parseVariableName,
                    this::parseLiteral,
                    () -> parseAny(token.type()))
                .ifPresent(nodes::add);
        }

        if (nodes.isEmpty()) {
            return Optional.empty();
        }
        Branch result = query(nodes, sortBy);
        for (int i = branches.size() - 1; i >= 0; i--) {
            Query left = branches.get(i);
            result = new OrExpression(left.start(), result.end(), ors.get(i), left, result);
        }
        return Optional.of(result);
    }

    // every token but trivia ends up as a node of the query
    private boolean hasContentBeforeLineEnd() {
        while (accept(TokenType.WHITESPACE).isPresent() || accept(TokenType.LINE_COMMENT).isPresent()) {
            // skip
        }
        return token.type() != TokenType.NEW_LINE && token.type() != TokenType.EOF;
    }

    private Query query(MutableList<Simple> nodes, SortBy sortBy) {
        int end = sortBy != null ? sortBy.end() : nodes.getLast().end();
        return new Query(nodes.getFirst().start(), end, nodes.toImmutable(), sortBy);
    }

    private void demote(SortBy sortBy, MutableList<Simple> nodes) {
        Token keyword = sortBy.keyword();
        log.trace("Sort-by at {} is followed by more content, keeping it as text", keyword.start());
        nodes.add(new Literal(keyword.start(), keyword.end(), scanner.value(keyword)));
        if (!(sortBy.criteria() instanceof Missing)) {
            nodes.add(sortBy.criteria());
        }
    }

    private Optional<SortBy> parseSortBy() {
        Optional<Token> keyword = accept(TokenType.SORT_ASC_BY).or(() -> accept(TokenType.SORT_DESC_BY));
        if (keyword.isEmpty()) {
            return Optional.empty();
        }
        while (accept(TokenType.WHITESPACE).isPresent()) {
            // skip
        }
        Simple criteria = QueryParser.<Simple>firstOf(this::parseLiteral)
            .orElseGet(() -> missing("expected sort criteria"));
        return Optional.of(new SortBy(keyword.get().start(), criteria.end(), keyword.get(), criteria));
    }

    private Optional<Any> parseAny(TokenType type) {
        return accept(type).map(t -> new Any(t.start(), t.end(), t.type()));
    }

    private Optional<Literal> parseLiteral() {
        return accept(TokenType.LITERAL)
            .or(() -> accept(TokenType.QUOTED_LITERAL))
            .map(t -> new Literal(t.start(), t.end(), scanner.value(t)));
    }

    private Optional<QueryNode.Number> parseNumber() {
        return accept(TokenType.NUMBER)
            .map(t -> new QueryNode.Number(t.start(), t.end(), Double.parseDouble(scanner.value(t))));
    }

    private Optional<Date> parseDate() {
        return accept(TokenType.DATE)
            .or(() -> accept(TokenType.DATE_TIME))
            .map(t -> new Date(t.start(), t.end(), scanner.value(t)));
    }

    private Optional<Bound> parseBound() {
        return firstOf(this::parseDate, this::parseNumber);
    }

    private Optional<Compare> parseCompare() {
        Optional<Token> comparator = accept(TokenType.LESS_THAN)
            .or(() -> accept(TokenType.LESS_THAN_EQUAL))
            .or(() -> accept(TokenType.GREATER_THAN))
            .or(() -> accept(TokenType.GREATER_THAN_EQUAL));
        if (comparator.isEmpty()) {
            return Optional.empty();
        }
        Operand value = QueryParser.<Operand>firstOf(this::parseBound)
            .orElseGet(() -> missing("expected date or number"));
        Token cmp = comparator.get();
        return Optional.of(new Compare(cmp.start(), value.end(), scanner.value(cmp), value));
    }

    /**
     * A date or number, extended to {@code open..close} or {@code open..*} when a range
     * token follows it.
     */
    private Optional<Simple> parseBoundOrRange() {
        Optional<Bound> bound = parseBound();
        if (bound.isEmpty()) {
            return Optional.empty();
        }
        Bound open = bound.get();
        if (accept(TokenType.RANGE).isPresent()) {
            Operand close = QueryParser.<Operand>firstOf(this::parseBound)
                .orElseGet(() -> missing("expected number or date"));
            return Optional.of(new Range(open.start(), close.end(), open, close));
        }
        Optional<Token> openEnd = accept(TokenType.RANGE_FIXED_START);
        if (openEnd.isPresent()) {
            return Optional.of(new Range(open.start(), openEnd.get().end(), open, null));
        }
        return Optional.of(open);
    }

    // *..value
    private Optional<Range> parseRangeFixedEnd() {
        Optional<Token> start = accept(TokenType.RANGE_FIXED_END);
        if (start.isEmpty()) {
            return Optional.empty();
        }
        Operand close = QueryParser.<Operand>firstOf(this::parseBound)
            .orElseGet(() -> missing("expected number or date"));
        return Optional.of(new Range(start.get().start(), close.end(), null, close));
    }

    private Optional<QualifiedValue> parseQualifiedValue() {
        Token checkpoint = mark();
        Optional<Token> not = accept(TokenType.DASH);
        Optional<Literal> qualifier = parseLiteral();
        if (qualifier.isEmpty() || accept(TokenType.COLON).isEmpty()) {
            rewind(checkpoint);
            return Optional.empty();
        }

        Simple value = QueryParser.<Simple>firstOf(
                this::parseCompare,
                this::parseBoundOrRange,
                this::parseRangeFixedEnd,
                this::parseVariableName,
                this::parseLiteral,
                () -> parseAny(TokenType.SHA))
            .orElseGet(() -> missing("expected value"));

        int start = not.map(Token::start).orElse(qualifier.get().start());
        return Optional.of(new QualifiedValue(start, value.end(), not.isPresent(), qualifier.get(), value));
    }

    private Optional<VariableName> parseVariableName() {
        return accept(TokenType.VARIABLE_NAME)
            .map(t -> new VariableName(t.start(), t.end(), scanner.value(t)));
    }

    private Optional<VariableDefinition> parseVariableDefinition() {
        Token checkpoint = mark();
        Optional<VariableName> name = parseVariableName();
        if (name.isEmpty()) {
            return Optional.empty();
        }
        if (accept(TokenType.EQUALS).isEmpty()) {
            rewind(checkpoint);
            return Optional.empty();
        }
        // without OR the result is always a plain query
        DefinitionValue value = QueryParser.<DefinitionValue>firstOf(() -> parseQuery(false).map(Query.class::cast))
            .orElseGet(() -> missing("query expected"));
        return Optional.of(new VariableDefinition(name.get().start(), value.end(), name.get(), value));
    }

    private Missing missing(String message) {
        return new Missing(token.start(), token.start(), message);
    }

    private Optional<Token> accept(TokenType type) {
        if (token.type() == TokenType.EOF || token.type() != type) {
            return Optional.empty();
        }
        Token accepted = token;
        token = scanner.next();
        return Optional.of(accepted);
    }

    private Token mark() {
        return token;
    }

    private void rewind(Token checkpoint) {
        if (checkpoint.start() != token.start()) {
            log.trace("Backtracking from {} to {}", token.start(), checkpoint.start());
        }
        scanner.resetPosition(checkpoint);
        token = scanner.next();
    }

    /**
     * Tries each alternative in turn and returns the first match.
     */
    @SafeVarargs
    private static <T> Optional<T> firstOf(Supplier<? extends Optional<? extends T>>... alternatives) {
        for (Supplier<? extends Optional<? extends T>> alternative : alternatives) {
            Optional<? extends T> result = alternative.get();
            if (result.isPresent()) {
                return Optional.of(result.get());
            }
        }
        return Optional.empty();
    }
}
