package com.astpath;

import com.astpath.json.JsonTreeReader;
import com.astpath.query.PathEngine;
import com.astpath.tree.SyntaxNode;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstPathTest {

    @Test
    public void testFindMethodsByWildcardName() throws IOException {
        List<String> names = queryFixture("//method[Get*]").collect(SyntaxNode::name);

        assertEquals(List.of("GetUser", "GetUserById"), names);
    }

    @Test
    public void testStablePathOfMatch() throws IOException {
        SyntaxNode root = readFixture();
        PathEngine engine = new PathEngine();

        SyntaxNode ifStatement = engine.evaluate("//if-statement[.//throw-statement]", root).getOnly();

        assertEquals("/class[UserService]/method[GetUser]/block/if-statement", engine.toPathString(ifStatement));
        assertSame(ifStatement, engine.evaluate(engine.toPathString(ifStatement), root).getOnly());
    }

    @Test
    public void testCommandLinePathsOnly() throws Exception {
        StringWriter out = new StringWriter();
        int exitCode = run(out, new StringWriter(), "-p", "//method[@async]", fixturePath());

        assertEquals(0, exitCode);
        assertEquals(List.of("/class[UserService]/method[GetUser]", "/class[UserService]/method[GetUserById]"),
                out.toString().lines().toList());
    }

    @Test
    public void testCommandLineCompactOutput() throws Exception {
        StringWriter out = new StringWriter();
        int exitCode = run(out, new StringWriter(), "-c", "//method[GetUser]", fixturePath());

        assertEquals(0, exitCode);
        assertEquals("{\"kind\":\"method\",\"name\":\"GetUser\",\"path\":\"/class[UserService]/method[GetUser]\","
                + "\"location\":\"3:5-9:6\"}", out.toString().trim());
    }

    @Test
    public void testCommandLineReportsSyntaxError() throws Exception {
        StringWriter err = new StringWriter();
        int exitCode = run(new StringWriter(), err, "//method[@async and]", fixturePath());

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error: Expected predicate expression"), err.toString());
    }

    @Test
    public void testCommandLineReportsMissingFile() {
        StringWriter err = new StringWriter();
        int exitCode = run(new StringWriter(), err, "//method", "does-not-exist.json");

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error:"));
    }

    private int run(StringWriter out, StringWriter err, String... args) {
        return new CommandLine(new AstPath())
                .setOut(new PrintWriter(out))
                .setErr(new PrintWriter(err))
                .execute(args);
    }

    private MutableList<SyntaxNode> queryFixture(String path) throws IOException {
        return new PathEngine().evaluate(path, readFixture());
    }

    private SyntaxNode readFixture() throws IOException {
        try (InputStream is = getClass().getResourceAsStream("/trees/user-service.json")) {
            assertNotNull(is, "Fixture not found");
            return new JsonTreeReader().read(is);
        }
    }

    private String fixturePath() throws URISyntaxException {
        return Path.of(getClass().getResource("/trees/user-service.json").toURI()).toString();
    }
}
