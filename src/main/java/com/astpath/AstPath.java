package com.astpath;

import com.astpath.json.JsonTreeReader;
import com.astpath.output.NodeMatch;
import com.astpath.output.OutputFormatter;
import com.astpath.query.EngineOptions;
import com.astpath.query.PathEngine;
import com.astpath.query.PathException;
import com.astpath.query.PathExpression;
import com.astpath.tree.SyntaxNode;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "astpath", mixinStandardHelpOptions = true, version = "1.0",
         description = "Query a JSON serialized syntax tree with path expressions")
public class AstPath implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(AstPath.class);

    @Parameters(index = "0", description = "The path expression, e.g. //method[@async and Get*]")
    private String path;

    @Parameters(index = "1", arity = "0..1", description = "Syntax tree JSON file (default: stdin)")
    private File inputFile;

    @Option(names = {"-c", "--compact-output"}, description = "Print each match on a single line")
    private boolean compactOutput = false;

    @Option(names = {"-p", "--paths-only"}, description = "Print only the stable path of each match")
    private boolean pathsOnly = false;

    @Option(names = {"-t", "--with-text"}, description = "Include the source text of each match")
    private boolean withText = false;

    @Option(names = "--max-depth", description = "Maximum nesting of path predicates (default: ${DEFAULT-VALUE})")
    private int maxDepth = EngineOptions.DEFAULT_MAX_DEPTH;

    @Option(names = "--max-visits", description = "Maximum nodes visited per query (default: ${DEFAULT-VALUE})")
    private int maxVisits = EngineOptions.DEFAULT_MAX_VISITS;

    @Option(names = "--cache-size", description = "Parsed paths kept in memory, 0 disables caching (default: ${DEFAULT-VALUE})")
    private int cacheSize = EngineOptions.DEFAULT_CACHE_SIZE;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AstPath()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            PathEngine engine = new PathEngine(new EngineOptions(maxDepth, maxVisits, cacheSize));

            // Parse the path first so syntax errors show up before any input is read
            PathExpression expression = engine.parse(path);

            SyntaxNode root;
            try (InputStream input = inputFile != null ? new FileInputStream(inputFile) : System.in) {
                root = new JsonTreeReader().read(input);
            }

            MutableList<SyntaxNode> matches = engine.evaluate(expression, root);

            OutputFormatter formatter = new OutputFormatter(!compactOutput, withText);
            for (SyntaxNode node : matches) {
                String stablePath = engine.toPathString(node);
                out.println(pathsOnly ? stablePath : formatter.format(new NodeMatch(node, stablePath)));
            }
            out.flush();
            return 0;
        } catch (PathException | IOException | IllegalArgumentException e) {
            logger.debug("query '{}' failed", path, e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
