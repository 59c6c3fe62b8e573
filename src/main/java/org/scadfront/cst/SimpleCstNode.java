package org.scadfront.cst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable {@link CstNode} implementation. Host adapters copy their grammar runtime's tree into
 * instances of this class when the runtime's own nodes cannot be exposed directly.
 */
public final class SimpleCstNode implements CstNode {

    private final String type;
    private final String text;
    private final CstPoint startPoint;
    private final CstPoint endPoint;
    private final int startByte;
    private final int endByte;
    private final boolean named;
    private final boolean missing;
    private final List<CstNode> children;
    private final List<CstNode> namedChildren;
    private final Map<String, CstNode> fields;

    private SimpleCstNode(Builder builder) {
        this.type = builder.type;
        this.text = builder.text;
        this.startPoint = builder.startPoint;
        this.endPoint = builder.endPoint;
        this.startByte = builder.startByte;
        this.endByte = builder.endByte;
        this.named = builder.named;
        this.missing = builder.missing;
        this.children = Collections.unmodifiableList(new ArrayList<>(builder.children));
        this.fields = Collections.unmodifiableMap(new HashMap<>(builder.fields));
        List<CstNode> namedOnly = new ArrayList<>();
        for (CstNode child : builder.children) {
            if (child.isNamed()) {
                namedOnly.add(child);
            }
        }
        this.namedChildren = Collections.unmodifiableList(namedOnly);
    }

    /**
     * Starts building a named node.
     * @param type The grammar node kind.
     * @return A new builder.
     */
    public static Builder builder(String type) {
        return new Builder(type);
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public int childCount() {
        return children.size();
    }

    @Override
    public CstNode child(int index) {
        return index >= 0 && index < children.size() ? children.get(index) : null;
    }

    @Override
    public int namedChildCount() {
        return namedChildren.size();
    }

    @Override
    public CstNode namedChild(int index) {
        return index >= 0 && index < namedChildren.size() ? namedChildren.get(index) : null;
    }

    @Override
    public CstNode childForFieldName(String fieldName) {
        return fields.get(fieldName);
    }

    @Override
    public CstPoint startPoint() {
        return startPoint;
    }

    @Override
    public CstPoint endPoint() {
        return endPoint;
    }

    @Override
    public int startByte() {
        return startByte;
    }

    @Override
    public int endByte() {
        return endByte;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public boolean isMissing() {
        return missing;
    }

    @Override
    public List<CstNode> children() {
        return children;
    }

    @Override
    public List<CstNode> namedChildren() {
        return namedChildren;
    }

    @Override
    public String toString() {
        return type + "[" + startByte + ".." + endByte + "]";
    }

    /**
     * Builder for {@link SimpleCstNode}. Children are appended in source order; a child added with
     * a field name is also reachable through {@link CstNode#childForFieldName(String)}.
     */
    public static final class Builder {
        private final String type;
        private String text = "";
        private CstPoint startPoint = new CstPoint(0, 0);
        private CstPoint endPoint = new CstPoint(0, 0);
        private int startByte;
        private int endByte;
        private boolean named = true;
        private boolean missing;
        private final List<CstNode> children = new ArrayList<>();
        private final Map<String, CstNode> fields = new HashMap<>();

        private Builder(String type) {
            this.type = type;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder range(int startByte, int endByte, CstPoint startPoint, CstPoint endPoint) {
            this.startByte = startByte;
            this.endByte = endByte;
            this.startPoint = startPoint;
            this.endPoint = endPoint;
            return this;
        }

        public Builder named(boolean named) {
            this.named = named;
            return this;
        }

        public Builder missing(boolean missing) {
            this.missing = missing;
            return this;
        }

        public Builder child(CstNode child) {
            children.add(child);
            return this;
        }

        public Builder field(String fieldName, CstNode child) {
            children.add(child);
            fields.put(fieldName, child);
            return this;
        }

        public SimpleCstNode build() {
            return new SimpleCstNode(this);
        }
    }
}
