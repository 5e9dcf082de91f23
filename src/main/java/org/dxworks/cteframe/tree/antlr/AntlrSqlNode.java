package org.dxworks.cteframe.tree.antlr;

import org.dxworks.cteframe.model.SourceRange;
import org.dxworks.cteframe.tree.NodeType;
import org.dxworks.cteframe.tree.SqlNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable mirror of one ANTLR parse tree node. Wired up once by {@link AntlrSqlTree}.
 */
final class AntlrSqlNode implements SqlNode {

    private final NodeType type;
    private final String source;
    private SourceRange range;
    private final List<SqlNode> children = new ArrayList<>();
    private final List<SqlNode> childrenView = Collections.unmodifiableList(children);
    private AntlrSqlNode parent;
    private int indexInParent = -1;

    AntlrSqlNode(NodeType type, String source, SourceRange range) {
        this.type = type;
        this.source = source;
        this.range = range;
    }

    void addChild(AntlrSqlNode child) {
        child.parent = this;
        child.indexInParent = children.size();
        children.add(child);
    }

    void setRange(SourceRange range) {
        this.range = range;
    }

    @Override
    public NodeType getType() {
        return type;
    }

    @Override
    public String getText() {
        return range.substring(source);
    }

    @Override
    public List<SqlNode> getChildren() {
        return childrenView;
    }

    @Override
    public SqlNode getParent() {
        return parent;
    }

    @Override
    public SqlNode getPrevSibling() {
        if (parent == null || indexInParent <= 0) return null;
        return parent.children.get(indexInParent - 1);
    }

    @Override
    public SqlNode getNextSibling() {
        if (parent == null || indexInParent + 1 >= parent.children.size()) return null;
        return parent.children.get(indexInParent + 1);
    }

    @Override
    public SourceRange getRange() {
        return range;
    }

    @Override
    public String toString() {
        return type + range.toString();
    }
}
