package com.galaxyast.docs.metta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the MeTTa syntax tree.
 *
 * Each node is owned by exactly one parent. {@code endLine} never drops below
 * {@code startLine} and is raised as children are attached, so a parent always
 * ends at or after its last child.
 */
public final class MettaNode {

    private final NodeKind kind;
    private final String value;
    private final int startLine;
    private int endLine;
    private final List<MettaNode> children = new ArrayList<>();

    public MettaNode(NodeKind kind, String value, int startLine) {
        this(kind, value, startLine, startLine);
    }

    public MettaNode(NodeKind kind, String value, int startLine, int endLine) {
        this.kind = kind;
        this.value = value != null ? value : "";
        this.startLine = startLine;
        this.endLine = Math.max(startLine, endLine);
    }

    public NodeKind kind()               { return kind; }
    public String value()                { return value; }
    public int startLine()               { return startLine; }
    public int endLine()                 { return endLine; }
    public List<MettaNode> children()    { return Collections.unmodifiableList(children); }

    public boolean is(NodeKind expected) {
        return kind == expected;
    }

    void addChild(MettaNode child) {
        children.add(child);
        extendTo(child.endLine);
    }

    /** Records the line of the token that closes this node. */
    void closeAt(int line) {
        extendTo(line);
    }

    private void extendTo(int line) {
        if (line > endLine) {
            endLine = line;
        }
    }

    @Override
    public String toString() {
        return "MettaNode(" + kind.label() + ", '" + value + "', " + startLine + "-" + endLine + ")";
    }
}
