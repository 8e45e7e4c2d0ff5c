package com.issueq.query;

import com.issueq.output.PrintContext;
import com.issueq.output.QueryPrinter;
import com.issueq.query.QueryNode.QueryDocument;
import com.issueq.query.QueryNode.Statement;
import com.issueq.query.QueryNode.VariableDefinition;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Computes variable values of a document. Definitions are evaluated top to bottom, so a
 * definition sees the presets and every variable defined above it.
 */
public class VariableResolver {
    private static final Logger log = LoggerFactory.getLogger(VariableResolver.class);

    private final Map<String, String> presets;

    public VariableResolver() {
        this(Map.of());
    }

    public VariableResolver(Map<String, String> presets) {
        this.presets = presets == null ? Map.of() : Map.copyOf(presets);
    }

    public MutableMap<String, String> resolve(QueryDocument document, String text) {
        MutableMap<String, String> values = Maps.mutable.ofMap(presets);
        for (Statement statement : document.nodes()) {
            if (statement instanceof VariableDefinition definition) {
                String name = definition.name().name();
                String value = new QueryPrinter(new PrintContext(text, values)).print(definition.value());
                if (values.containsKey(name)) {
                    log.debug("Variable {} redefined at offset {}", name, definition.start());
                }
                values.put(name, value);
                log.debug("Resolved {} = '{}'", name, value);
            }
        }
        return values;
    }
}
