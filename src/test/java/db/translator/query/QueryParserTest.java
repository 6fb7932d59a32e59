package db.translator.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class QueryParserTest {

    private final QueryParser parser = new QueryParser();

    @Test
    void fullStatement() {
        Query q = parser.parse("SELECT name, age FROM users WHERE age >= 21 AND name != 'x' LIMIT 5 OFFSET 2;");
        assertEquals(List.of("name", "age"), q.columns());
        assertFalse(q.selectsAll());
        assertEquals("users", q.table());
        assertEquals(Logical.and(
            new Comparison("age", ComparisonOp.GTE, Literal.ofInteger(21)),
            new Comparison("name", ComparisonOp.NE, Literal.ofString("x"))), q.predicate());
        assertEquals(5, q.limit());
        assertEquals(2, q.offset());
    }

    @Test
    void noWhereMeansNoPredicate() {
        Query q = parser.parse("SELECT * FROM t");
        assertTrue(q.selectsAll());
        assertNull(q.predicate());
        assertNull(q.limit());
    }

    @Test
    void limitZeroIsKept() {
        Query zero = parser.parse("SELECT * FROM t LIMIT 0");
        Query none = parser.parse("SELECT * FROM t");
        assertEquals(Integer.valueOf(0), zero.limit());
        assertNotEquals(zero, none);
    }

    @Test
    void danglingOperatorOffsetRefersToWholeQuery() {
        String sql = "SELECT * FROM t WHERE a = ";
        SqlSyntaxException e = assertThrows(SqlSyntaxException.class, () -> parser.parse(sql));
        assertTrue(e.offset() >= sql.indexOf('='), "offset " + e.offset());
    }

    @Test
    void likeIsUnsupportedFeature() {
        UnsupportedFeatureException e = assertThrows(UnsupportedFeatureException.class,
            () -> parser.parse("SELECT a, b FROM t WHERE x LIKE '%foo'"));
        assertEquals("LIKE", e.feature());
        assertEquals(27, e.offset());
    }

    @Test
    void parsingIsRepeatable() {
        String sql = "SELECT * FROM t WHERE a = 1 AND (b > 2 OR c IS NULL)";
        assertEquals(parser.parse(sql), parser.parse(sql));
    }
}
