package com.astpath.query;

import com.astpath.tree.SimpleNode;
import com.astpath.tree.SyntaxNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PathStringifierTest {

    private final PathEngine engine = new PathEngine();

    private SimpleNode tree() {
        return SimpleNode.builder("file").children(
                SimpleNode.builder("function").name("main").child(
                        SimpleNode.builder("body").children(
                                SimpleNode.builder("call").text("init()"),
                                SimpleNode.builder("call").text("run()"),
                                SimpleNode.builder("return"))),
                SimpleNode.builder("function").name("helper"),
                SimpleNode.builder("function").name("helper"),
                SimpleNode.builder("function").name("and"),
                SimpleNode.builder("function").name("it's"),
                SimpleNode.builder("Foo.Bar").name("x"),
                SimpleNode.builder("Foo.Bar").name("y"),
                SimpleNode.builder("variable").name("x"))
                .build();
    }

    private void assertRoundTrip(String expectedPath, SyntaxNode node) {
        String path = engine.toPathString(node);
        assertEquals(expectedPath, path);
        assertSame(node, engine.evaluate(path, node).getOnly());
    }

    @Test
    public void testRootIsSelf() {
        SimpleNode root = tree();
        assertEquals("/.", engine.toPathString(root));
        assertSame(root, engine.evaluate("/.", root).getOnly());
    }

    @Test
    public void testNamedAndUnnamedSegments() {
        SimpleNode root = tree();
        SyntaxNode body = root.children().get(0).children().get(0);

        assertRoundTrip("/function[main]", root.children().get(0));
        assertRoundTrip("/function[main]/body", body);
        assertRoundTrip("/function[main]/body/call[2]", body.children().get(1));
        assertRoundTrip("/function[main]/body/return", body.children().get(2));
    }

    @Test
    public void testSameNamedSiblingsGetIndex() {
        SimpleNode root = tree();

        assertRoundTrip("/function[helper][1]", root.children().get(1));
        assertRoundTrip("/function[helper][2]", root.children().get(2));
    }

    @Test
    public void testNamesThatAreNotIdentifiersAreQuoted() {
        SimpleNode root = tree();

        assertRoundTrip("/function['and']", root.children().get(3));
        assertRoundTrip("/function['it\\'s']", root.children().get(4));
    }

    @Test
    public void testKindsThatAreNotIdentifiersUseWildcard() {
        SimpleNode root = tree();

        assertRoundTrip("/*[y]", root.children().get(6));
        // x is shared with the variable, so the index counts among all children named x
        assertRoundTrip("/*[x][1]", root.children().get(5));
        assertRoundTrip("/variable[x]", root.children().get(7));
    }

    @Test
    public void testPathIsUsableFromAnyNodeOfTheTree() {
        SimpleNode root = tree();
        SyntaxNode call = root.children().get(0).children().get(0).children().get(1);

        String path = engine.toPathString(call);

        assertSame(call, engine.evaluate(path, root.children().get(7)).getOnly());
        assertEquals("run()", engine.evaluate(path, root).getOnly().text());
    }
}
