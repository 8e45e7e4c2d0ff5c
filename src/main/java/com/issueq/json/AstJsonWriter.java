package com.issueq.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.issueq.query.QueryNode;
import com.issueq.query.QueryNode.Any;
import com.issueq.query.QueryNode.Branch;
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

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Writes a syntax tree as JSON. Every node becomes an object with {@code type},
 * {@code start} and {@code end} plus the fields of its kind; absent optional fields
 * are omitted.
 */
public class AstJsonWriter {
    // OR chains nest one object per OR
    private final JsonFactory factory = JsonFactory.builder()
        .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
        .build();
    private final boolean prettyPrint;

    public AstJsonWriter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String write(QueryNode node) {
        StringWriter out = new StringWriter();
        try {
            write(node, out);
        } catch (IOException e) {
            // StringWriter does not fail
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    public void write(QueryNode node, Writer out) throws IOException {
        try (JsonGenerator generator = factory.createGenerator(out)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            node.accept(new NodeWriter(generator));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static final class NodeWriter implements QueryNode.Visitor<Void> {
        private final JsonGenerator generator;

        NodeWriter(JsonGenerator generator) {
            this.generator = generator;
        }

        @Override
        public Void visitDocument(QueryDocument node) {
            return object(node, () -> {
                generator.writeArrayFieldStart("nodes");
                for (QueryNode child : node.nodes()) {
                    child.accept(this);
                }
                generator.writeEndArray();
            });
        }

        @Override
        public Void visitVariableDefinition(VariableDefinition node) {
            return object(node, () -> {
                field("name", node.name());
                field("value", node.value());
            });
        }

        @Override
        public Void visitVariableName(VariableName node) {
            return object(node, () -> generator.writeStringField("value", node.value()));
        }

        @Override
        public Void visitOrExpression(OrExpression node) {
            // the right spine is written in a loop, the nesting is only in the output
            try {
                int open = 0;
                Branch current = node;
                while (current instanceof OrExpression or) {
                    begin(or);
                    field("left", or.left());
                    generator.writeFieldName("right");
                    open++;
                    current = or.right();
                }
                current.accept(this);
                for (int i = 0; i < open; i++) {
                    generator.writeEndObject();
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        @Override
        public Void visitQuery(Query node) {
            return object(node, () -> {
                generator.writeArrayFieldStart("nodes");
                for (QueryNode child : node.nodes()) {
                    child.accept(this);
                }
                generator.writeEndArray();
                if (node.sortby() != null) {
                    field("sortby", node.sortby());
                }
            });
        }

        @Override
        public Void visitSortBy(SortBy node) {
            return object(node, () -> {
                generator.writeStringField("keyword", node.keyword().type().name());
                field("criteria", node.criteria());
            });
        }

        @Override
        public Void visitQualifiedValue(QualifiedValue node) {
            return object(node, () -> {
                generator.writeBooleanField("not", node.not());
                field("qualifier", node.qualifier());
                field("value", node.value());
            });
        }

        @Override
        public Void visitCompare(Compare node) {
            return object(node, () -> {
                generator.writeStringField("comparator", node.comparator());
                field("value", node.value());
            });
        }

        @Override
        public Void visitRange(Range node) {
            return object(node, () -> {
                if (node.open() != null) {
                    field("open", node.open());
                }
                if (node.close() != null) {
                    field("close", node.close());
                }
            });
        }

        @Override
        public Void visitLiteral(Literal node) {
            return object(node, () -> generator.writeStringField("value", node.value()));
        }

        @Override
        public Void visitNumber(QueryNode.Number node) {
            return object(node, () -> generator.writeNumberField("value", node.value()));
        }

        @Override
        public Void visitDate(Date node) {
            return object(node, () -> generator.writeStringField("value", node.value()));
        }

        @Override
        public Void visitAny(Any node) {
            return object(node, () -> generator.writeStringField("tokenType", node.tokenType().name()));
        }

        @Override
        public Void visitMissing(Missing node) {
            return object(node, () -> generator.writeStringField("message", node.message()));
        }

        private void begin(QueryNode node) throws IOException {
            generator.writeStartObject();
            generator.writeStringField("type", node.getClass().getSimpleName());
            generator.writeNumberField("start", node.start());
            generator.writeNumberField("end", node.end());
        }

        private void field(String name, QueryNode value) throws IOException {
            generator.writeFieldName(name);
            value.accept(this);
        }

        private Void object(QueryNode node, Body body) {
            try {
                begin(node);
                body.write();
                generator.writeEndObject();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }
    }

    @FunctionalInterface
    private interface Body {
        void write() throws IOException;
    }
}
