package org.osm.overpass.engine.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the overpass-sql command line.
 */
class OverpassSqlCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(InputStream stdin, String... args) {
        CommandLine commandLine = new CommandLine(new OverpassSqlCommand(stdin));
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private int run(String query, String... args) {
        return run(new ByteArrayInputStream(query.getBytes(StandardCharsets.UTF_8)), args);
    }

    private static InputStream unreadable() {
        return new InputStream() {
            @Override
            public int read() {
                throw new AssertionError("standard input must not be read");
            }
        };
    }

    @Test
    void printsPostgresScript() {
        int exitCode = run("node[amenity=cafe];out ids;", "postgres");

        assertEquals(OverpassSqlCommand.EXIT_OK, exitCode);
        assertEquals("""
                SET statement_timeout = 180000;

                WITH
                __1 AS (
                    SELECT node.* FROM node
                    WHERE (node.tags?'amenity' AND node.tags->>'amenity' = 'cafe')
                )
                SELECT osm_type, id FROM __1;
                """, out.toString());
        assertEquals("", err.toString());
    }

    @Test
    void printsDuckDbScript() {
        int exitCode = run("area(1)->.a; node(area.a); out ids;", "duckdb");

        assertEquals(OverpassSqlCommand.EXIT_OK, exitCode);
        String sql = out.toString();
        assertTrue(sql.startsWith("CREATE OR REPLACE TEMP TABLE _a AS\n"), sql);
        assertTrue(sql.indexOf("SET VARIABLE _a_bbox") < sql.indexOf("SELECT osm_type, id FROM __1;"), sql);
    }

    @Test
    @DisplayName("unknown dialect fails before stdin is read")
    void unknownDialect() {
        int exitCode = run(unreadable(), "sqlite");

        assertEquals(OverpassSqlCommand.EXIT_CONFIG_ERROR, exitCode);
        assertEquals("", out.toString());
        assertTrue(err.toString().contains("Unsupported dialect 'sqlite'"), err.toString());
    }

    @Test
    void missingDialect() {
        assertEquals(CommandLine.ExitCode.USAGE, run(unreadable()));
        assertEquals("", out.toString());
    }

    @Test
    void invalidOption() {
        assertEquals(OverpassSqlCommand.EXIT_CONFIG_ERROR, run(unreadable(), "--srid", "0", "postgres"));
        assertEquals(CommandLine.ExitCode.USAGE, run(unreadable(), "--srid", "abc", "postgres"));
    }

    @Test
    void syntaxError() {
        int exitCode = run("node[amenity=cafe]", "postgres");

        assertEquals(OverpassSqlCommand.EXIT_QUERY_ERROR, exitCode);
        assertEquals("", out.toString());
        assertTrue(err.toString().startsWith("Syntax error: line 1:18"), err.toString());
        assertTrue(err.toString().contains("Expected one of:"), err.toString());
    }

    @Test
    void compileError() {
        int exitCode = run("node.missing; out;", "duckdb");

        assertEquals(OverpassSqlCommand.EXIT_QUERY_ERROR, exitCode);
        assertEquals("", out.toString());
        assertTrue(err.toString().startsWith("Compile error: Set '.missing'"), err.toString());
    }

    @Test
    void timeoutOptions() {
        int exitCode = run("[timeout:100];node;out ids;", "--max-timeout", "60", "postgres");

        assertEquals(OverpassSqlCommand.EXIT_OK, exitCode);
        assertTrue(out.toString().startsWith("SET statement_timeout = 60000;"), out.toString());
    }

    @Test
    void sridOption() {
        int exitCode = run("node;out geom ids;", "--srid", "3857", "postgres");

        assertEquals(OverpassSqlCommand.EXIT_OK, exitCode);
        assertTrue(out.toString().contains("ST_Transform(geom, 4326) AS geom"), out.toString());
    }
}
