package db.translator.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for WHERE text. Precedence, weakest first:
 * <pre>
 *   or_expr    := and_expr ( OR and_expr )*
 *   and_expr   := not_expr ( AND not_expr )*
 *   not_expr   := NOT not_expr | primary
 *   primary    := '(' or_expr ')' | comparison
 *   comparison := column ( op literal | IS [NOT] NULL )?
 * </pre>
 * A bare column is read as {@code column = TRUE}. A chain of the same connective becomes one
 * n-ary node; parenthesised groups always stay separate nodes. Nesting of NOT and parentheses
 * is capped at {@link #MAX_DEPTH} levels.
 */
public class PredicateParser {
    public static final int MAX_DEPTH = 256;

    public Predicate parse(String text) {
        return parse(text, 0);
    }

    /**
     * @param base position of {@code text} inside the full query, used for error offsets
     */
    public Predicate parse(String text, int base) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        if (text.isBlank()) throw new SqlSyntaxException("Empty predicate", base);
        Cursor c = new Cursor(SqlLexer.tokenize(text, base));
        Predicate p = c.orExpr();
        Token rest = c.peek();
        if (!rest.is(TokenType.EOF)) {
            if (rest.is(TokenType.RPAREN)) throw new SqlSyntaxException("Unbalanced ')'", rest.offset());
            throw new SqlSyntaxException("Unexpected " + rest + ", expected AND/OR", rest.offset());
        }
        return p;
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int i;
        private int depth;

        Cursor(List<Token> tokens) { this.tokens = tokens; }

        void enter(Token at) {
            if (++depth > MAX_DEPTH) throw new SqlSyntaxException("Expression nested too deeply", at.offset());
        }

        Token peek() { return tokens.get(i); }

        Token consume() {
            Token t = tokens.get(i);
            if (!t.is(TokenType.EOF)) i++;
            return t;
        }

        Predicate orExpr() {
            List<Predicate> operands = new ArrayList<>();
            operands.add(andExpr());
            while (peek().isKeyword("OR")) {
                consume();
                operands.add(andExpr());
            }
            return operands.size() == 1 ? operands.get(0) : new Logical(Logical.Op.OR, operands);
        }

        Predicate andExpr() {
            List<Predicate> operands = new ArrayList<>();
            operands.add(notExpr());
            while (peek().isKeyword("AND")) {
                consume();
                operands.add(notExpr());
            }
            return operands.size() == 1 ? operands.get(0) : new Logical(Logical.Op.AND, operands);
        }

        Predicate notExpr() {
            if (peek().isKeyword("NOT")) {
                enter(consume());
                Predicate inner = notExpr();
                depth--;
                return Logical.not(inner);
            }
            return primary();
        }

        Predicate primary() {
            if (peek().is(TokenType.LPAREN)) {
                Token open = consume();
                enter(open);
                if (peek().isKeyword("SELECT")) throw new UnsupportedFeatureException("subqueries", peek().offset());
                Predicate inner = orExpr();
                Token close = peek();
                if (!close.is(TokenType.RPAREN)) {
                    throw new SqlSyntaxException("Unbalanced '(' opened at offset " + open.offset()
                        + ", found " + close, close.offset());
                }
                consume();
                depth--;
                return inner;
            }
            return comparison();
        }

        Predicate comparison() {
            Token col = peek();
            if (col.isKeyword("EXISTS")) throw new UnsupportedFeatureException("subqueries", col.offset());
            if (!col.is(TokenType.IDENTIFIER)) {
                throw new SqlSyntaxException("Expected column name but found " + col, col.offset());
            }
            consume();
            Token next = peek();
            if (next.is(TokenType.DOT)) throw new UnsupportedFeatureException("qualified column names", next.offset());
            if (next.is(TokenType.LPAREN)) throw new UnsupportedFeatureException("function call " + col.text() + "()", col.offset());

            if (next.is(TokenType.OPERATOR)) {
                consume();
                ComparisonOp op = ComparisonOp.fromSymbol(next.text());
                Token valueTok = peek();
                Literal value = literal(next);
                if (value.kind() == Literal.Kind.NULL) {
                    throw new SqlSyntaxException("Comparison with NULL must use IS NULL or IS NOT NULL", valueTok.offset());
                }
                if (op.isOrdering() && !value.isNumeric()) {
                    throw new SqlSyntaxException("Operator " + op.symbol() + " requires a numeric literal, found "
                        + value.kind(), valueTok.offset());
                }
                return new Comparison(col.text(), op, value);
            }
            if (next.isKeyword("IS")) {
                consume();
                boolean negated = false;
                if (peek().isKeyword("NOT")) {
                    consume();
                    negated = true;
                }
                Token nul = peek();
                if (!nul.isKeyword("NULL")) throw new SqlSyntaxException("Expected NULL after IS but found " + nul, nul.offset());
                consume();
                return new Comparison(col.text(), negated ? ComparisonOp.NE : ComparisonOp.EQ, Literal.NULL);
            }
            if (next.isKeyword("NOT")) {
                Token after = tokens.get(i + 1);
                if (after.isKeyword("LIKE") || after.isKeyword("ILIKE") || after.isKeyword("IN") || after.isKeyword("BETWEEN")) {
                    throw new UnsupportedFeatureException("NOT " + after.text(), after.offset());
                }
                throw new SqlSyntaxException("Unexpected NOT after column '" + col.text() + "'", next.offset());
            }
            if (next.isKeyword("LIKE") || next.isKeyword("ILIKE") || next.isKeyword("IN") || next.isKeyword("BETWEEN")) {
                throw new UnsupportedFeatureException(next.text(), next.offset());
            }
            if (next.is(TokenType.EOF) || next.is(TokenType.RPAREN) || next.isKeyword("AND") || next.isKeyword("OR")) {
                return new Comparison(col.text(), ComparisonOp.EQ, Literal.TRUE);
            }
            throw new SqlSyntaxException("Expected comparison operator after '" + col.text() + "' but found " + next, next.offset());
        }

        Literal literal(Token op) {
            Token t = consume();
            switch (t.type()) {
                case INTEGER:
                    return integer(t.text(), t);
                case FLOAT:
                    return floating(t.text(), t);
                case STRING:
                    return Literal.ofString(t.text());
                case MINUS: {
                    Token num = consume();
                    if (num.is(TokenType.INTEGER)) return integer("-" + num.text(), num);
                    if (num.is(TokenType.FLOAT)) return floating("-" + num.text(), num);
                    throw new SqlSyntaxException("Expected a number after '-' but found " + num, num.offset());
                }
                case KEYWORD:
                    switch (t.text()) {
                        case "TRUE": return Literal.TRUE;
                        case "FALSE": return Literal.FALSE;
                        case "NULL": return Literal.NULL;
                        default: break;
                    }
                    break;
                case IDENTIFIER:
                    throw new UnsupportedFeatureException("column-to-column comparison", t.offset());
                case LPAREN:
                    if (peek().isKeyword("SELECT")) throw new UnsupportedFeatureException("subqueries", peek().offset());
                    break;
                default:
                    break;
            }
            throw new SqlSyntaxException("Expected a literal after '" + op.text() + "' but found " + t, t.offset());
        }

        private static Literal integer(String text, Token at) {
            try {
                return Literal.ofInteger(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new SqlSyntaxException("Integer literal out of range: " + text, at.offset());
            }
        }

        private static Literal floating(String text, Token at) {
            double d = Double.parseDouble(text);
            if (Double.isInfinite(d)) throw new SqlSyntaxException("Numeric literal out of range: " + text, at.offset());
            return Literal.ofFloat(d);
        }
    }
}
