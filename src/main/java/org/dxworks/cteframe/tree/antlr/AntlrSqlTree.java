package org.dxworks.cteframe.tree.antlr;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.dxworks.cteframe.model.SourceRange;
import org.dxworks.cteframe.tree.NodeType;
import org.dxworks.cteframe.tree.SqlNode;
import org.dxworks.cteframe.tree.SqlTree;
import org.dxworks.cteframe.tree.TreeHelper;
import org.dxworks.cteframe.tree.antlr.generated.CteSqlParser;

/**
 * {@link SqlTree} backed by the ANTLR CTE grammar.
 * The parse tree is copied into {@link AntlrSqlNode}s once, so the result is a plain immutable snapshot.
 */
public final class AntlrSqlTree implements SqlTree {

    private final String source;
    private final SqlNode root;
    private final int syntaxErrorCount;

    private AntlrSqlTree(String source, SqlNode root, int syntaxErrorCount) {
        this.source = source;
        this.root = root;
        this.syntaxErrorCount = syntaxErrorCount;
    }

    public static AntlrSqlTree parse(String source) {
        if (source == null) {
            throw new IllegalArgumentException("SQL source must not be null");
        }
        AntlrParserFactory.SyntaxErrorCounter errors = new AntlrParserFactory.SyntaxErrorCounter();
        CteSqlParser parser = AntlrParserFactory.createParser(source, errors);
        CteSqlParser.ScriptContext script = parser.script();

        OffsetMapper offsets = new OffsetMapper(source);
        AntlrSqlNode root = mirror(script, source, offsets);
        // The document node always spans the whole text, leading and trailing whitespace included
        root.setRange(SourceRange.of(0, source.length()));
        return new AntlrSqlTree(source, root, errors.getCount());
    }

    @Override
    public SqlNode getRoot() {
        return root;
    }

    @Override
    public String getSource() {
        return source;
    }

    public int getSyntaxErrorCount() {
        return syntaxErrorCount;
    }

    @Override
    public SqlNode findNodeAt(int offset) {
        if (source.isEmpty() || offset < 0 || offset > source.length()) return null;
        int effective = offset == source.length() ? lastStatementCharacter() : offset;
        return TreeHelper.findDeepestNodeAt(root, effective);
    }

    // Trailing whitespace and terminators belong to no statement
    private int lastStatementCharacter() {
        int i = source.length() - 1;
        while (i > 0 && (Character.isWhitespace(source.charAt(i)) || source.charAt(i) == ';')) {
            i--;
        }
        return i;
    }

    private static AntlrSqlNode mirror(ParserRuleContext ctx, String source, OffsetMapper offsets) {
        AntlrSqlNode node = new AntlrSqlNode(ruleType(ctx.getRuleIndex()), source, null);
        SourceRange span = null;
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            AntlrSqlNode mirrored = null;
            if (child instanceof ParserRuleContext) {
                mirrored = mirror((ParserRuleContext) child, source, offsets);
            } else if (child instanceof TerminalNode) {
                mirrored = mirrorToken(((TerminalNode) child).getSymbol(), source, offsets);
            }
            if (mirrored == null) continue;
            node.addChild(mirrored);
            if (mirrored.getRange().isEmpty()) continue;
            span = span == null ? mirrored.getRange() : span.union(mirrored.getRange());
        }
        if (span == null) {
            // Empty rule (error recovery or an optional-only rule): anchor at its start token
            int at = ctx.getStart() != null ? offsets.toCharIndex(ctx.getStart().getStartIndex()) : 0;
            at = Math.max(0, Math.min(at, source.length()));
            span = SourceRange.of(at, at);
        }
        node.setRange(span);
        return node;
    }

    private static AntlrSqlNode mirrorToken(Token token, String source, OffsetMapper offsets) {
        // EOF and tokens conjured up by error recovery have no source text
        if (token.getType() == Token.EOF || token.getStartIndex() < 0 || token.getStopIndex() < token.getStartIndex()) {
            return null;
        }
        int start = offsets.toCharIndex(token.getStartIndex());
        int end = offsets.toCharIndex(token.getStopIndex() + 1);
        return new AntlrSqlNode(tokenType(token.getType()), source, SourceRange.of(start, end));
    }

    static NodeType ruleType(int ruleIndex) {
        switch (ruleIndex) {
            case CteSqlParser.RULE_withClause: return NodeType.WITH_CLAUSE;
            case CteSqlParser.RULE_withQuery: return NodeType.WITH_QUERY_WRAPPER;
            case CteSqlParser.RULE_namedQueryDefinition: return NodeType.NAMED_QUERY_DEFINITION;
            case CteSqlParser.RULE_selectStatement: return NodeType.SELECT_STATEMENT;
            case CteSqlParser.RULE_queryExpression: return NodeType.QUERY_EXPRESSION;
            case CteSqlParser.RULE_fromClause: return NodeType.FROM_CLAUSE;
            case CteSqlParser.RULE_tableReference: return NodeType.TABLE_REFERENCE;
            case CteSqlParser.RULE_joinExpression: return NodeType.JOIN_EXPRESSION;
            case CteSqlParser.RULE_identifier: return NodeType.IDENTIFIER;
            default: return NodeType.OTHER;
        }
    }

    static NodeType tokenType(int tokenType) {
        switch (tokenType) {
            case CteSqlParser.LPAREN: return NodeType.LEFT_PAREN;
            case CteSqlParser.RPAREN: return NodeType.RIGHT_PAREN;
            case CteSqlParser.COMMA: return NodeType.COMMA;
            case CteSqlParser.WITH: return NodeType.WITH_KEYWORD;
            default: return NodeType.OTHER;
        }
    }

    /**
     * ANTLR char streams index by code point while Java strings index by UTF-16 unit.
     */
    private static final class OffsetMapper {
        private final int[] codePointToChar;

        OffsetMapper(String source) {
            int codePoints = source.codePointCount(0, source.length());
            if (codePoints == source.length()) {
                codePointToChar = null;
                return;
            }
            codePointToChar = new int[codePoints + 1];
            int charIndex = 0;
            for (int cp = 0; cp < codePoints; cp++) {
                codePointToChar[cp] = charIndex;
                charIndex += Character.charCount(source.codePointAt(charIndex));
            }
            codePointToChar[codePoints] = source.length();
        }

        int toCharIndex(int codePointIndex) {
            if (codePointToChar == null) return codePointIndex;
            if (codePointIndex < 0) return 0;
            if (codePointIndex >= codePointToChar.length) return codePointToChar[codePointToChar.length - 1];
            return codePointToChar[codePointIndex];
        }
    }
}
