package com.astpath;

import com.astpath.tree.SimpleNode;
import com.astpath.tree.Span;

/**
 * Syntax trees shaped like what a C# front end would hand over.
 */
public final class SampleTrees {

    private SampleTrees() {
    }

    /**
     * <pre>
     * compilation-unit
     *   namespace Shop
     *     class UserService
     *       method GetUser        public async   (block: if[throw], return)
     *       method GetUserById    private async  (block: if[return], expression)
     *       method SetUser        public         (block: expression)
     *       method DeleteUser     async static   (block: a(); b(); c(); d();)
     *     class Overloads
     *       method Save (1 parameter), method Save (2 parameters), field count
     *   namespace 'Shop.Internal'
     *     class 'Generic&lt;T&gt;'
     * </pre>
     */
    public static SimpleNode userService() {
        return SimpleNode.builder("compilation-unit").children(
            SimpleNode.builder("namespace").name("Shop").children(
                SimpleNode.builder("class").name("UserService").modifiers("public")
                    .span(Span.of(3, 5, 40, 6))
                    .children(
                        method("GetUser", "Task<User>", 1, "public", "async").span(Span.of(5, 9, 10, 10)).child(
                            block(
                                statement("if-statement", "if (id < 0) throw new ArgumentException(nameof(id));")
                                    .child(statement("throw-statement", "throw new ArgumentException(nameof(id));")),
                                statement("return-statement", "return await repository.Find(id);"))),
                        method("GetUserById", "Task<User>", 2, "private", "async").child(
                            block(
                                statement("if-statement", "if (cache.Has(id)) return cache.Get(id);")
                                    .child(statement("return-statement", "return cache.Get(id);")),
                                statement("expression-statement", "Log(id);"))),
                        method("SetUser", "void", 1, "public").child(
                            block(statement("expression-statement", "repository.Save(user);"))),
                        method("DeleteUser", "Task", 1, "async", "static").child(
                            block(
                                statement("expression-statement", "a();"),
                                statement("expression-statement", "b();"),
                                statement("expression-statement", "c();"),
                                statement("expression-statement", "d();")))),
                SimpleNode.builder("class").name("Overloads").children(
                    SimpleNode.builder("method").name("Save").attribute("parameters", 1).child(block()),
                    SimpleNode.builder("method").name("Save").attribute("parameters", 2).child(block()),
                    SimpleNode.builder("field").name("count"))),
            SimpleNode.builder("namespace").name("Shop.Internal").children(
                SimpleNode.builder("class").name("Generic<T>")))
            .build();
    }

    /**
     * <pre>
     * a
     *   b
     *     d
     *     e
     *   c
     *     f
     * </pre>
     */
    public static SimpleNode letters() {
        return SimpleNode.builder("n").name("a").children(
            SimpleNode.builder("n").name("b").children(
                SimpleNode.builder("n").name("d"),
                SimpleNode.builder("n").name("e")),
            SimpleNode.builder("n").name("c").children(
                SimpleNode.builder("n").name("f")))
            .build();
    }

    private static SimpleNode.Builder method(String name, String returns, int parameters, String... modifiers) {
        return SimpleNode.builder("method").alsoKind("member").name(name)
            .attribute("returns", returns)
            .attribute("parameters", parameters)
            .modifiers(modifiers)
            .text(String.join(" ", modifiers) + " " + returns + " " + name + "(...)");
    }

    private static SimpleNode.Builder block(SimpleNode.Builder... statements) {
        return SimpleNode.builder("block").children(statements);
    }

    private static SimpleNode.Builder statement(String kind, String text) {
        return SimpleNode.builder(kind).alsoKind("statement").text(text);
    }
}
