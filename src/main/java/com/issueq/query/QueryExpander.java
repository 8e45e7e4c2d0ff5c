package com.issueq.query;

import com.issueq.output.PrintContext;
import com.issueq.output.QueryPrinter;
import com.issueq.query.QueryNode.QueryDocument;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Map;

/**
 * Turns query text into the list of queries to run: parses it, resolves its variables and
 * renders every OR branch as a query of its own.
 *
 * <p>Holds a {@link QueryParser}, so instances are not thread safe.
 */
public class QueryExpander {
    private final QueryParser parser = new QueryParser();

    public ImmutableList<String> expand(String text) {
        return expand(text, Map.of());
    }

    public ImmutableList<String> expand(String text, Map<String, String> presets) {
        String input = text == null ? "" : text;
        QueryDocument document = parser.parse(input);
        Map<String, String> variables = new VariableResolver(presets).resolve(document, input);
        return new QueryPrinter(new PrintContext(input, variables)).printQueries(document);
    }
}
