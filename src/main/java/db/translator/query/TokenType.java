package db.translator.query;

/**
 * Lexical categories produced by {@link SqlLexer}.
 */
public enum TokenType {
    IDENTIFIER,
    KEYWORD,
    INTEGER,
    FLOAT,
    STRING,
    OPERATOR,   // = != <> < <= > >=
    MINUS,
    COMMA,
    STAR,
    DOT,
    LPAREN,
    RPAREN,
    SEMICOLON,
    EOF
}
