package com.astpath.tree;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

import java.util.List;
import java.util.Objects;

/**
 * General purpose {@link SyntaxNode} for providers that copy their tree into memory, and for
 * trees read from JSON. Nodes are assembled through {@link Builder}; parent links are set when a
 * child is attached, so a built tree cannot have inconsistent links.
 */
public final class SimpleNode implements SyntaxNode {

    private final String kind;
    private final MutableSet<String> extraKinds;
    private final String name;
    private final String text;
    private final Span span;
    private final MutableMap<String, AttributeValue> attributes;
    private final MutableList<SimpleNode> children;
    private SimpleNode parent;

    private SimpleNode(Builder builder) {
        this.kind = builder.kind;
        this.extraKinds = Sets.mutable.withAll(builder.extraKinds);
        this.name = builder.name;
        this.text = builder.text;
        this.span = builder.span;
        this.attributes = Maps.mutable.withMap(builder.attributes);
        this.children = Lists.mutable.withInitialCapacity(builder.children.size());
        for (Builder child : builder.children) {
            SimpleNode node = child.build();
            node.parent = this;
            children.add(node);
        }
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public boolean isKind(String kind) {
        return this.kind.equals(kind) || extraKinds.contains(kind);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<SimpleNode> children() {
        return children.asUnmodifiable();
    }

    @Override
    public SimpleNode parent() {
        return parent;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public Span span() {
        return span;
    }

    @Override
    public AttributeValue attribute(String key) {
        return attributes.get(key);
    }

    public MutableMap<String, AttributeValue> attributes() {
        return attributes.asUnmodifiable();
    }

    @Override
    public String toString() {
        return name == null ? kind : kind + "[" + name + "]";
    }

    public static final class Builder {
        private final String kind;
        private final MutableSet<String> extraKinds = Sets.mutable.empty();
        private String name;
        private String text = "";
        private Span span = Span.NONE;
        private final MutableMap<String, AttributeValue> attributes = Maps.mutable.empty();
        private final MutableList<Builder> children = Lists.mutable.empty();

        private Builder(String kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /** Additional kinds the node answers to in node tests. */
        public Builder alsoKind(String... kinds) {
            extraKinds.addAll(Lists.mutable.with(kinds));
            return this;
        }

        public Builder text(String text) {
            this.text = text == null ? "" : text;
            return this;
        }

        public Builder span(Span span) {
            this.span = span == null ? Span.NONE : span;
            return this;
        }

        public Builder attribute(String key, Object value) {
            attributes.put(key, AttributeValue.of(value));
            return this;
        }

        /** Sets each given modifier as a boolean attribute and all of them as {@code modifiers}. */
        public Builder modifiers(String... modifiers) {
            for (String modifier : modifiers) {
                attributes.put(modifier, AttributeValue.of(true));
            }
            attributes.put("modifiers", AttributeValue.of(String.join(" ", modifiers)));
            return this;
        }

        public Builder child(Builder child) {
            children.add(child);
            return this;
        }

        public Builder children(Builder... children) {
            this.children.addAll(Lists.mutable.with(children));
            return this;
        }

        public SimpleNode build() {
            return new SimpleNode(this);
        }
    }
}
