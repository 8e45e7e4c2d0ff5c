package com.issueq.query;

/**
 * A problem found in a parsed document.
 *
 * @param line   1-based line of {@code start}
 * @param column 1-based column of {@code start}
 */
public record Diagnostic(Severity severity, String message, int start, int end, int line, int column) {

    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * {@code line:column: severity: message}
     */
    public String format() {
        return line + ":" + column + ": " + severity.display() + ": " + message;
    }
}
