package com.issueq.query;

import com.issueq.query.QueryNode.Missing;
import com.issueq.query.QueryNode.QueryDocument;
import com.issueq.query.QueryNode.Statement;
import com.issueq.query.QueryNode.VariableDefinition;
import com.issueq.query.QueryNode.VariableName;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Set;

/**
 * Reports the gaps the parser filled with {@link Missing} nodes as errors, and variable
 * references that are neither preset nor defined further up as warnings.
 */
public class Diagnostics {
    private final Set<String> presetVariables;

    public Diagnostics() {
        this(Set.of());
    }

    public Diagnostics(Set<String> presetVariables) {
        this.presetVariables = presetVariables == null ? Set.of() : Set.copyOf(presetVariables);
    }

    public ImmutableList<Diagnostic> collect(QueryDocument document, String text) {
        MutableList<Diagnostic> diagnostics = Lists.mutable.empty();
        MutableSet<String> defined = Sets.mutable.withAll(presetVariables);

        for (Statement statement : document.nodes()) {
            NodeUtils.walk(statement, (node, parent) -> {
                if (node instanceof Missing missing) {
                    diagnostics.add(diagnostic(Diagnostic.Severity.ERROR, missing.message(), node, text));
                } else if (node instanceof VariableName variable
                        && !isDefinitionTarget(variable, parent)
                        && !defined.contains(variable.name())) {
                    diagnostics.add(diagnostic(Diagnostic.Severity.WARNING,
                            "unknown variable '" + variable.value() + "'", node, text));
                }
            });
            // a definition is visible from the next statement on
            if (statement instanceof VariableDefinition definition) {
                defined.add(definition.name().name());
            }
        }
        return diagnostics.toImmutable();
    }

    private static boolean isDefinitionTarget(VariableName variable, QueryNode parent) {
        return parent instanceof VariableDefinition definition && definition.name() == variable;
    }

    private static Diagnostic diagnostic(Diagnostic.Severity severity, String message, QueryNode node, String text) {
        int line = 1;
        int lineStart = 0;
        int limit = Math.min(node.start(), text.length());
        // line breaks as the scanner sees them: \r\n, \r or \n
        for (int i = 0; i < limit; i++) {
            char c = text.charAt(i);
            if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < limit && text.charAt(i + 1) == '\n') {
                    i++;
                }
                line++;
                lineStart = i + 1;
            }
        }
        return new Diagnostic(severity, message, node.start(), node.end(), line, node.start() - lineStart + 1);
    }
}
