package org.osm.overpass.engine.cli;

import org.osm.overpass.dsl.OverpassParseException;
import org.osm.overpass.engine.compiler.CompilerOptions;
import org.osm.overpass.engine.compiler.OverpassCompileException;
import org.osm.overpass.engine.compiler.OverpassCompiler;
import org.osm.overpass.engine.compiler.SqlScript;
import org.osm.overpass.engine.transpiler.SqlDialect;
import org.osm.overpass.engine.transpiler.SqlDialects;
import org.osm.overpass.engine.transpiler.UnsupportedDialectException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * Reads an Overpass query on standard input and prints the SQL for one dialect.
 *
 * Exit codes: 0 on success, 1 when the query does not parse or compile,
 * 2 when the command line is wrong (unknown dialect, bad option).
 */
@Command(name = "overpass-sql", mixinStandardHelpOptions = true, version = "0.1.0",
         description = "Compile an Overpass QL query read from stdin into SQL")
public class OverpassSqlCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(OverpassSqlCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_QUERY_ERROR = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Parameters(index = "0", description = "Target dialect: postgres or duckdb")
    private String dialectName;

    @Option(names = "--srid", description = "SRID of the backend geometry columns (default: ${DEFAULT-VALUE})")
    private int srid = CompilerOptions.WGS84;

    @Option(names = "--default-timeout",
            description = "Timeout in seconds when the query sets none (default: ${DEFAULT-VALUE})")
    private int defaultTimeout = CompilerOptions.DEFAULT_TIMEOUT_SECONDS;

    @Option(names = "--max-timeout",
            description = "Upper bound for the query timeout in seconds (default: ${DEFAULT-VALUE})")
    private int maxTimeout = CompilerOptions.MAX_TIMEOUT_SECONDS;

    @Spec
    private CommandSpec spec;

    private final InputStream input;

    public OverpassSqlCommand() {
        this(System.in);
    }

    OverpassSqlCommand(InputStream input) {
        this.input = input;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OverpassSqlCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        SqlDialect dialect;
        CompilerOptions options;
        try {
            dialect = SqlDialects.forName(dialectName);
            options = new CompilerOptions(srid, defaultTimeout, maxTimeout);
        } catch (UnsupportedDialectException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        String query;
        try {
            query = new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("Failed to read standard input", e);
            err.println("Error: cannot read query: " + e.getMessage());
            return EXIT_QUERY_ERROR;
        }

        try {
            SqlScript script = new OverpassCompiler(dialect, options).compile(query);
            out.print(script.toSql());
            out.flush();
            logger.info("Wrote {} statements for {}", script.statements().size(), dialect.name());
            return EXIT_OK;
        } catch (OverpassParseException e) {
            err.println("Syntax error: " + e.getMessage());
            if (!e.getExpected().isEmpty()) {
                err.println("Expected one of: " + String.join(" ", e.getExpected()));
            }
            return EXIT_QUERY_ERROR;
        } catch (OverpassCompileException e) {
            err.println("Compile error: " + e.getMessage());
            return EXIT_QUERY_ERROR;
        }
    }
}
