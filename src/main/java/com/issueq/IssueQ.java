package com.issueq;

import com.issueq.json.AstJsonWriter;
import com.issueq.output.PrintContext;
import com.issueq.output.QueryPrinter;
import com.issueq.query.Diagnostic;
import com.issueq.query.Diagnostics;
import com.issueq.query.QueryNode.QueryDocument;
import com.issueq.query.QueryParser;
import com.issueq.query.VariableResolver;
import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "issueq", mixinStandardHelpOptions = true, version = "1.0",
         description = "Parse issue search queries and print the queries they expand to")
public class IssueQ implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(IssueQ.class);

    @Parameters(index = "0", arity = "0..1", description = "Query file (default: stdin)")
    private File inputFile;

    @Option(names = {"-D", "--define"}, paramLabel = "NAME=VALUE",
            description = "Preset a variable, e.g. -D user=octocat")
    private Map<String, String> presets = new LinkedHashMap<>();

    @Option(names = "--ast", description = "Print the syntax tree as JSON")
    private boolean printAst = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = "--check", description = "Print diagnostics, exit with 1 if there are errors")
    private boolean check = false;

    @Spec
    private CommandSpec spec;

    private final InputStream stdin;

    public IssueQ() {
        this(System.in);
    }

    IssueQ(InputStream stdin) {
        this.stdin = stdin;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new IssueQ()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String text;
        try {
            text = readInput();
        } catch (IOException e) {
            log.debug("Failed to read query input", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }

        QueryDocument document = new QueryParser().parse(text);

        if (check) {
            ImmutableList<Diagnostic> diagnostics = new Diagnostics(presets.keySet()).collect(document, text);
            for (Diagnostic diagnostic : diagnostics) {
                out.println(diagnostic.format());
            }
            out.flush();
            return diagnostics.anySatisfy(Diagnostic::isError) ? 1 : 0;
        }

        if (printAst) {
            out.println(new AstJsonWriter(!compactOutput).write(document));
            out.flush();
            return 0;
        }

        Map<String, String> variables = new VariableResolver(presets).resolve(document, text);
        QueryPrinter printer = new QueryPrinter(new PrintContext(text, variables));
        for (String query : printer.printQueries(document)) {
            out.println(query);
        }
        out.flush();
        return 0;
    }

    private String readInput() throws IOException {
        if (inputFile != null) {
            return Files.readString(inputFile.toPath(), StandardCharsets.UTF_8);
        }
        return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
    }
}
