package db.translator.query;

/**
 * One lexical token. text is the decoded value for STRING tokens, the upper-cased word for
 * KEYWORD tokens and the raw source slice otherwise. offset/end index into the lexed input.
 */
public record Token(TokenType type, String text, int offset, int end) {

    public boolean is(TokenType t) { return type == t; }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
