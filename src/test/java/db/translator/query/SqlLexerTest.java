package db.translator.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class SqlLexerTest {

    private List<TokenType> types(String sql) {
        return SqlLexer.tokenize(sql).stream().map(Token::type).toList();
    }

    @Test
    void keywordsAreCaseInsensitive() {
        List<Token> tokens = SqlLexer.tokenize("sElEcT * fRoM users");
        assertTrue(tokens.get(0).isKeyword("SELECT"));
        assertEquals(TokenType.STAR, tokens.get(1).type());
        assertTrue(tokens.get(2).isKeyword("FROM"));
        assertEquals(TokenType.IDENTIFIER, tokens.get(3).type());
        assertEquals("users", tokens.get(3).text());
        assertEquals(TokenType.EOF, tokens.get(4).type());
    }

    @Test
    void keywordTextInsideLiteralsAndIdentifiersStaysData() {
        List<Token> tokens = SqlLexer.tokenize("order_id = 'x WHERE y LIMIT 3' AND fromage = \"or\"");
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("order_id", tokens.get(0).text());
        assertEquals(TokenType.STRING, tokens.get(2).type());
        assertEquals("x WHERE y LIMIT 3", tokens.get(2).text());
        assertTrue(tokens.get(3).isKeyword("AND"));
        assertEquals(TokenType.IDENTIFIER, tokens.get(4).type());
        assertEquals(TokenType.STRING, tokens.get(6).type());
        assertEquals("or", tokens.get(6).text());
    }

    @Test
    void doubledQuotesEscapeTheQuoteCharacter() {
        List<Token> tokens = SqlLexer.tokenize("'it''s' \"say \"\"hi\"\"\"");
        assertEquals("it's", tokens.get(0).text());
        assertEquals("say \"hi\"", tokens.get(1).text());
    }

    @Test
    void numbersSplitIntoIntegerAndFloat() {
        List<Token> tokens = SqlLexer.tokenize("42 4.5 .5 1e3 2E-2");
        assertEquals(TokenType.INTEGER, tokens.get(0).type());
        assertEquals(TokenType.FLOAT, tokens.get(1).type());
        assertEquals(TokenType.FLOAT, tokens.get(2).type());
        assertEquals(TokenType.FLOAT, tokens.get(3).type());
        assertEquals(TokenType.FLOAT, tokens.get(4).type());
        assertEquals("2E-2", tokens.get(4).text());
    }

    @Test
    void operatorsAndPunctuation() {
        assertEquals(List.of(TokenType.OPERATOR, TokenType.OPERATOR, TokenType.OPERATOR, TokenType.OPERATOR,
                TokenType.OPERATOR, TokenType.OPERATOR, TokenType.OPERATOR, TokenType.COMMA, TokenType.LPAREN,
                TokenType.RPAREN, TokenType.SEMICOLON, TokenType.MINUS, TokenType.EOF),
            types("= != <> < <= > >= , ( ) ; -"));
        assertEquals("<=", SqlLexer.tokenize("a<=1").get(1).text());
    }

    @Test
    void offsetsAreShiftedByBase() {
        List<Token> tokens = SqlLexer.tokenize("a = 1", 20);
        assertEquals(20, tokens.get(0).offset());
        assertEquals(22, tokens.get(1).offset());
        assertEquals(24, tokens.get(2).offset());
        assertEquals(25, tokens.get(3).offset());
    }

    @Test
    void commentsAreRejected() {
        SqlSyntaxException dash = assertThrows(SqlSyntaxException.class, () -> SqlLexer.tokenize("SELECT * FROM t -- hi"));
        assertEquals(16, dash.offset());
        SqlSyntaxException block = assertThrows(SqlSyntaxException.class, () -> SqlLexer.tokenize("SELECT /* x */ * FROM t"));
        assertEquals(7, block.offset());
    }

    @Test
    void badInputReportsPosition() {
        SqlSyntaxException unterminated = assertThrows(SqlSyntaxException.class, () -> SqlLexer.tokenize("a = 'abc"));
        assertEquals(4, unterminated.offset());
        SqlSyntaxException bang = assertThrows(SqlSyntaxException.class, () -> SqlLexer.tokenize("a ! 1"));
        assertEquals(2, bang.offset());
        SqlSyntaxException at = assertThrows(SqlSyntaxException.class, () -> SqlLexer.tokenize("a = @b"));
        assertEquals(4, at.offset());
        assertThrows(SqlSyntaxException.class, () -> SqlLexer.tokenize("a = 12abc"));
        assertThrows(SqlSyntaxException.class, () -> SqlLexer.tokenize("a = 1e"));
    }
}
