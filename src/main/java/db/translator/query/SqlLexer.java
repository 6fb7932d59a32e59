package db.translator.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Hand-written scanner for the supported SELECT subset.
 * Keywords are matched case-insensitively on whole words only, so keyword text inside quoted
 * literals or as part of a longer identifier (e.g. "order_id") never misfires.
 * String literals use single or double quotes; the quote character is escaped by doubling it.
 * Comments are rejected rather than skipped.
 */
public final class SqlLexer {

    static final Set<String> KEYWORDS = Set.of(
        "SELECT", "FROM", "WHERE", "LIMIT", "OFFSET",
        "AND", "OR", "NOT", "IS", "NULL", "TRUE", "FALSE",
        "LIKE", "ILIKE", "IN", "BETWEEN", "EXISTS", "DISTINCT", "AS", "ALL", "CASE",
        "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS", "OUTER", "ON", "USING",
        "GROUP", "ORDER", "BY", "HAVING", "UNION", "INTERSECT", "EXCEPT", "FETCH", "WITH",
        "INSERT", "UPDATE", "DELETE"
    );

    private final String input;
    private final int base;
    private int pos;

    private SqlLexer(String input, int base) {
        this.input = input;
        this.base = base;
    }

    public static List<Token> tokenize(String input) {
        return tokenize(input, 0);
    }

    /**
     * Tokenize a fragment whose first character sits at {@code base} in the enclosing query,
     * so reported offsets point into the original string.
     */
    public static List<Token> tokenize(String input, int base) {
        if (input == null) throw new IllegalArgumentException("input must not be null");
        return new SqlLexer(input, base).run();
    }

    private List<Token> run() {
        List<Token> out = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                out.add(new Token(TokenType.EOF, "", base + pos, base + pos));
                return out;
            }
            out.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char ch = input.charAt(pos);
        if (isIdentStart(ch)) return word(start);
        if (Character.isDigit(ch) || (ch == '.' && Character.isDigit(peek(1)))) return number(start);
        if (ch == '\'' || ch == '"') return quoted(start, ch);
        if ((ch == '-' && peek(1) == '-') || (ch == '/' && peek(1) == '*')) {
            throw new SqlSyntaxException("SQL comments are not supported", base + start);
        }
        switch (ch) {
            case ',': return single(TokenType.COMMA, start);
            case '*': return single(TokenType.STAR, start);
            case '.': return single(TokenType.DOT, start);
            case '(': return single(TokenType.LPAREN, start);
            case ')': return single(TokenType.RPAREN, start);
            case ';': return single(TokenType.SEMICOLON, start);
            case '-': return single(TokenType.MINUS, start);
            case '=': return single(TokenType.OPERATOR, start);
            case '!':
                if (peek(1) == '=') return operator(start, 2);
                throw new SqlSyntaxException("Unknown operator '!'", base + start);
            case '<':
                if (peek(1) == '=' || peek(1) == '>') return operator(start, 2);
                return operator(start, 1);
            case '>':
                if (peek(1) == '=') return operator(start, 2);
                return operator(start, 1);
            default:
                throw new SqlSyntaxException("Unexpected character '" + ch + "'", base + start);
        }
    }

    private Token word(int start) {
        while (pos < input.length() && isIdentPart(input.charAt(pos))) pos++;
        String raw = input.substring(start, pos);
        String upper = raw.toUpperCase(Locale.ROOT);
        if (KEYWORDS.contains(upper)) {
            return new Token(TokenType.KEYWORD, upper, base + start, base + pos);
        }
        return new Token(TokenType.IDENTIFIER, raw, base + start, base + pos);
    }

    private Token number(int start) {
        boolean fractional = false;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) pos++;
        if (pos < input.length() && input.charAt(pos) == '.') {
            fractional = true;
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) pos++;
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int expStart = pos;
            pos++;
            if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) pos++;
            if (pos >= input.length() || !Character.isDigit(input.charAt(pos))) {
                throw new SqlSyntaxException("Malformed exponent in numeric literal", base + expStart);
            }
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) pos++;
            fractional = true;
        }
        if (pos < input.length() && isIdentPart(input.charAt(pos))) {
            throw new SqlSyntaxException("Malformed numeric literal '" + input.substring(start, pos + 1) + "'", base + start);
        }
        TokenType type = fractional ? TokenType.FLOAT : TokenType.INTEGER;
        return new Token(type, input.substring(start, pos), base + start, base + pos);
    }

    private Token quoted(int start, char quote) {
        StringBuilder value = new StringBuilder();
        pos++; // opening quote
        while (pos < input.length()) {
            char ch = input.charAt(pos);
            if (ch == quote) {
                if (peek(1) == quote) { // doubled quote is a literal quote
                    value.append(quote);
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING, value.toString(), base + start, base + pos);
            }
            value.append(ch);
            pos++;
        }
        throw new SqlSyntaxException("Unterminated string literal", base + start);
    }

    private Token single(TokenType type, int start) {
        pos++;
        return new Token(type, input.substring(start, pos), base + start, base + pos);
    }

    private Token operator(int start, int length) {
        pos += length;
        return new Token(TokenType.OPERATOR, input.substring(start, pos), base + start, base + pos);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) pos++;
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private static boolean isIdentStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private static boolean isIdentPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }
}
