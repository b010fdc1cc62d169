package com.astpath.tree;

import com.astpath.SampleTrees;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SimpleNodeTest {

    @Test
    public void testParentLinks() {
        SimpleNode root = SampleTrees.letters();
        SimpleNode b = root.children().get(0);
        SimpleNode e = b.children().get(1);

        assertNull(root.parent());
        assertSame(root, b.parent());
        assertSame(b, e.parent());
        assertSame(root, SyntaxTrees.root(e));
        assertEquals(2, SyntaxTrees.depth(e));
        assertEquals(1, SyntaxTrees.indexInParent(e));
        assertEquals(-1, SyntaxTrees.indexInParent(root));
    }

    @Test
    public void testKindCategories() {
        SimpleNode node = SimpleNode.builder("if-statement").alsoKind("statement", "branch").build();

        assertEquals("if-statement", node.kind());
        assertTrue(node.isKind("if-statement"));
        assertTrue(node.isKind("statement"));
        assertTrue(node.isKind("branch"));
        assertFalse(node.isKind("Statement"));
    }

    @Test
    public void testModifiers() {
        SimpleNode node = SimpleNode.builder("method").modifiers("public", "static").build();

        assertEquals(AttributeValue.of(true), node.attribute("public"));
        assertEquals(AttributeValue.of(true), node.attribute("static"));
        assertEquals(AttributeValue.of("public static"), node.attribute("modifiers"));
        assertNull(node.attribute("private"));
    }

    @Test
    public void testAttributeValues() {
        SimpleNode node = SimpleNode.builder("field")
                .attribute("count", 3)
                .attribute("ratio", 0.5)
                .attribute("type", "int")
                .attribute("readonly", false)
                .build();

        assertEquals("3", node.attribute("count").asText());
        assertEquals("0.5", node.attribute("ratio").asText());
        assertEquals("int", node.attribute("type").asText());
        assertEquals("false", node.attribute("readonly").asText());
        assertEquals(4, node.attributes().size());
    }

    @Test
    public void testBuilderChangesAfterBuildDoNotLeakIntoNode() {
        SimpleNode.Builder builder = SimpleNode.builder("x").attribute("a", 1).alsoKind("z");
        SimpleNode node = builder.build();

        builder.attribute("late", true).alsoKind("y");

        assertNull(node.attribute("late"));
        assertEquals(1, node.attributes().size());
        assertTrue(node.isKind("z"));
        assertFalse(node.isKind("y"));
        assertNotNull(builder.build().attribute("late"));
    }

    @Test
    public void testSpan() {
        assertEquals("3:5-9:6", Span.of(3, 5, 9, 6).toString());
        assertTrue(Span.of(3, 5, 9, 6).isKnown());
        assertFalse(Span.NONE.isKnown());
    }

    @Test
    public void testChildrenAreReadOnly() {
        SimpleNode root = SampleTrees.letters();

        assertThrows(UnsupportedOperationException.class, () -> root.children().clear());
    }
}
