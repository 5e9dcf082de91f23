package org.dxworks.cteframe.tree;

/**
 * Node kinds the CTE analysis looks at. Parsers map everything else to {@link #OTHER}.
 */
public enum NodeType {
    WITH_CLAUSE,
    WITH_QUERY_WRAPPER,
    NAMED_QUERY_DEFINITION,
    SELECT_STATEMENT,
    QUERY_EXPRESSION,
    FROM_CLAUSE,
    TABLE_REFERENCE,
    JOIN_EXPRESSION,
    IDENTIFIER,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    WITH_KEYWORD,
    WHITESPACE,
    OTHER
}
