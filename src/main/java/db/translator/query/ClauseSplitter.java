package db.translator.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Cuts a statement of the form
 *   SELECT <cols|*> FROM <table> [WHERE <predicate>] [LIMIT <n>] [OFFSET <n>] [;]
 * into its clauses. LIMIT and OFFSET may appear in either order, each at most once.
 * The WHERE text is handed on verbatim; everything this grammar does not cover is rejected,
 * never dropped.
 */
public class ClauseSplitter {

    private static final Set<String> JOIN_KEYWORDS = Set.of("JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS", "OUTER");
    private static final Set<String> TRAILING_CLAUSES = Set.of(
        "GROUP", "ORDER", "HAVING", "UNION", "INTERSECT", "EXCEPT", "FETCH", "ON", "USING");
    private static final Set<String> OTHER_STATEMENTS = Set.of("INSERT", "UPDATE", "DELETE", "WITH");

    public SelectClauses split(String sql) {
        if (sql == null) throw new IllegalArgumentException("sql must not be null");
        List<Token> tokens = SqlLexer.tokenize(sql);
        int i = 0;

        Token first = tokens.get(i);
        if (first.is(TokenType.EOF)) throw new SqlSyntaxException("Empty query", 0);
        if (first.type() == TokenType.KEYWORD && OTHER_STATEMENTS.contains(first.text())) {
            throw new UnsupportedFeatureException(first.text() + " statements", first.offset());
        }
        if (!first.isKeyword("SELECT")) throw new SqlSyntaxException("Expected SELECT but found " + first, first.offset());
        i++;
        if (tokens.get(i).isKeyword("DISTINCT")) throw new UnsupportedFeatureException("SELECT DISTINCT", tokens.get(i).offset());

        // Target list
        List<String> columns = new ArrayList<>();
        if (tokens.get(i).is(TokenType.STAR)) {
            i++;
        } else {
            while (true) {
                Token col = tokens.get(i);
                if (col.is(TokenType.STAR)) throw new SqlSyntaxException("'*' cannot be mixed with column names", col.offset());
                requireIdentifier(col, "column name");
                Token after = tokens.get(i + 1);
                if (after.is(TokenType.LPAREN)) throw new UnsupportedFeatureException("function call " + col.text() + "()", col.offset());
                if (after.is(TokenType.DOT)) throw new UnsupportedFeatureException("qualified column names", after.offset());
                if (after.isKeyword("AS") || after.is(TokenType.IDENTIFIER)) throw new UnsupportedFeatureException("column aliases", after.offset());
                if (columns.contains(col.text())) throw new SqlSyntaxException("Duplicate column '" + col.text() + "' in SELECT list", col.offset());
                columns.add(col.text());
                i++;
                if (!tokens.get(i).is(TokenType.COMMA)) break;
                i++;
            }
        }

        // FROM
        Token from = tokens.get(i);
        if (!from.isKeyword("FROM")) throw new SqlSyntaxException("Expected FROM but found " + from, from.offset());
        i++;
        Token table = tokens.get(i);
        if (table.is(TokenType.LPAREN)) throw new UnsupportedFeatureException("subqueries", table.offset());
        requireIdentifier(table, "table name");
        i++;
        Token afterTable = tokens.get(i);
        if (afterTable.is(TokenType.DOT)) throw new UnsupportedFeatureException("schema-qualified table names", afterTable.offset());
        if (afterTable.is(TokenType.COMMA)) throw new UnsupportedFeatureException("multiple tables in FROM", afterTable.offset());
        if (afterTable.is(TokenType.IDENTIFIER) || afterTable.isKeyword("AS")) {
            throw new UnsupportedFeatureException("table aliases", afterTable.offset());
        }
        rejectTrailingClause(afterTable);

        // WHERE
        String whereText = null;
        int whereOffset = -1;
        if (tokens.get(i).isKeyword("WHERE")) {
            Token where = tokens.get(i);
            i++;
            int start = i;
            while (!isClauseEnd(tokens.get(i))) {
                Token t = tokens.get(i);
                if (t.isKeyword("SELECT")) throw new UnsupportedFeatureException("subqueries", t.offset());
                rejectTrailingClause(t);
                i++;
            }
            if (i == start) throw new SqlSyntaxException("Empty WHERE clause", where.end());
            whereOffset = tokens.get(start).offset();
            whereText = sql.substring(whereOffset, tokens.get(i - 1).end());
        }

        // LIMIT / OFFSET
        Integer limit = null;
        Integer offset = null;
        while (tokens.get(i).isKeyword("LIMIT") || tokens.get(i).isKeyword("OFFSET")) {
            Token kw = tokens.get(i);
            if (kw.text().equals("LIMIT")) {
                if (limit != null) throw new SqlSyntaxException("Duplicate LIMIT clause", kw.offset());
                limit = nonNegativeInt(kw, tokens.get(i + 1));
            } else {
                if (offset != null) throw new SqlSyntaxException("Duplicate OFFSET clause", kw.offset());
                offset = nonNegativeInt(kw, tokens.get(i + 1));
            }
            i += 2;
        }

        if (tokens.get(i).is(TokenType.SEMICOLON)) i++;
        Token tail = tokens.get(i);
        if (!tail.is(TokenType.EOF)) {
            rejectTrailingClause(tail);
            if (tail.isKeyword("WHERE")) throw new SqlSyntaxException("WHERE must precede LIMIT/OFFSET", tail.offset());
            if (tail.isKeyword("SELECT")) throw new UnsupportedFeatureException("multiple statements", tail.offset());
            throw new SqlSyntaxException("Unexpected " + tail + " after end of statement", tail.offset());
        }
        return new SelectClauses(columns, table.text(), whereText, whereOffset, limit, offset);
    }

    private static boolean isClauseEnd(Token t) {
        return t.is(TokenType.EOF) || t.is(TokenType.SEMICOLON) || t.isKeyword("LIMIT") || t.isKeyword("OFFSET");
    }

    private static void requireIdentifier(Token t, String what) {
        if (t.is(TokenType.IDENTIFIER)) return;
        if (t.is(TokenType.KEYWORD)) {
            throw new SqlSyntaxException("Expected " + what + " but found keyword " + t.text(), t.offset());
        }
        throw new SqlSyntaxException("Expected " + what + " but found " + t, t.offset());
    }

    private static void rejectTrailingClause(Token t) {
        if (t.type() != TokenType.KEYWORD) return;
        if (JOIN_KEYWORDS.contains(t.text())) throw new UnsupportedFeatureException("JOIN", t.offset());
        if (TRAILING_CLAUSES.contains(t.text())) {
            String name = t.text().equals("GROUP") || t.text().equals("ORDER") ? t.text() + " BY" : t.text();
            throw new UnsupportedFeatureException(name, t.offset());
        }
    }

    private static int nonNegativeInt(Token keyword, Token value) {
        if (!value.is(TokenType.INTEGER)) {
            int at = value.is(TokenType.EOF) ? keyword.end() : value.offset();
            throw new SqlSyntaxException(keyword.text() + " must be a non-negative integer, found " + value, at);
        }
        try {
            return Integer.parseInt(value.text());
        } catch (NumberFormatException e) {
            throw new SqlSyntaxException(keyword.text() + " value out of range: " + value.text(), value.offset());
        }
    }
}
