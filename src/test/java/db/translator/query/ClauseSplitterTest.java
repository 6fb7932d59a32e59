package db.translator.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ClauseSplitterTest {

    private final ClauseSplitter splitter = new ClauseSplitter();

    @Test
    void starWithoutWhereOrLimit() {
        SelectClauses c = splitter.split("SELECT * FROM users");
        assertTrue(c.columns().isEmpty());
        assertEquals("users", c.table());
        assertNull(c.whereText());
        assertNull(c.limit());
        assertNull(c.offset());
    }

    @Test
    void columnOrderIsPreserved() {
        SelectClauses c = splitter.split("select zeta, alpha,mid from t");
        assertEquals(List.of("zeta", "alpha", "mid"), c.columns());
    }

    @Test
    void whereTextIsExtractedVerbatimWithOffset() {
        String sql = "SELECT a FROM t WHERE  x = 'LIMIT 5'  AND (y>2)  LIMIT 10;";
        SelectClauses c = splitter.split(sql);
        assertEquals("x = 'LIMIT 5'  AND (y>2)", c.whereText());
        assertEquals(sql.indexOf("x ="), c.whereOffset());
        assertEquals(10, c.limit());
    }

    @Test
    void limitZeroDiffersFromNoLimit() {
        assertEquals(0, splitter.split("SELECT * FROM t LIMIT 0").limit());
        assertNull(splitter.split("SELECT * FROM t").limit());
    }

    @Test
    void limitAndOffsetInEitherOrder() {
        SelectClauses a = splitter.split("SELECT * FROM t LIMIT 5 OFFSET 10");
        SelectClauses b = splitter.split("SELECT * FROM t OFFSET 10 LIMIT 5");
        assertEquals(5, a.limit());
        assertEquals(10, a.offset());
        assertEquals(a, b);
        SelectClauses onlyOffset = splitter.split("SELECT * FROM t WHERE a = 1 OFFSET 3");
        assertNull(onlyOffset.limit());
        assertEquals(3, onlyOffset.offset());
    }

    @Test
    void badLimitValues() {
        SqlSyntaxException neg = assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM t LIMIT -1"));
        assertEquals(22, neg.offset());
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM t LIMIT 2.5"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM t LIMIT 'ten'"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM t LIMIT"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM t LIMIT 99999999999"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM t LIMIT 1 LIMIT 2"));
    }

    @Test
    void unsupportedClausesAreNamed() {
        UnsupportedFeatureException order = assertThrows(UnsupportedFeatureException.class,
            () -> splitter.split("SELECT * FROM t WHERE a = 1 ORDER BY a"));
        assertEquals("ORDER BY", order.feature());
        assertEquals(28, order.offset());
        UnsupportedFeatureException group = assertThrows(UnsupportedFeatureException.class,
            () -> splitter.split("SELECT a FROM t GROUP BY a"));
        assertEquals("GROUP BY", group.feature());
        UnsupportedFeatureException join = assertThrows(UnsupportedFeatureException.class,
            () -> splitter.split("SELECT * FROM a JOIN b ON x = y"));
        assertEquals("JOIN", join.feature());
        UnsupportedFeatureException trailing = assertThrows(UnsupportedFeatureException.class,
            () -> splitter.split("SELECT * FROM t LIMIT 3 ORDER BY a"));
        assertEquals("ORDER BY", trailing.feature());
    }

    @Test
    void joinsAndMultipleTablesAreSyntaxErrors() {
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM a, b"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM a LEFT JOIN b ON a.x = b.x"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM a alias"));
    }

    @Test
    void otherStatementKindsAreRejected() {
        UnsupportedFeatureException delete = assertThrows(UnsupportedFeatureException.class,
            () -> splitter.split("DELETE FROM t"));
        assertEquals("DELETE statements", delete.feature());
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SHOW TABLES"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("   "));
        assertThrows(IllegalArgumentException.class, () -> splitter.split(null));
    }

    @Test
    void malformedSelectLists() {
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT FROM t"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT a, FROM t"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT a, * FROM t"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT a, a FROM t"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * t"));
        assertThrows(UnsupportedFeatureException.class, () -> splitter.split("SELECT count(a) FROM t"));
        assertThrows(UnsupportedFeatureException.class, () -> splitter.split("SELECT DISTINCT a FROM t"));
        assertThrows(UnsupportedFeatureException.class, () -> splitter.split("SELECT a AS b FROM t"));
    }

    @Test
    void emptyWhereIsASyntaxError() {
        SqlSyntaxException e = assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM t WHERE"));
        assertEquals(21, e.offset());
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM t WHERE LIMIT 4"));
    }

    @Test
    void statementTerminators() {
        assertEquals("t", splitter.split("SELECT * FROM t;").table());
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM t; SELECT * FROM u"));
        assertThrows(SqlSyntaxException.class, () -> splitter.split("SELECT * FROM t LIMIT 1 WHERE a = 1"));
        assertThrows(UnsupportedFeatureException.class, () -> splitter.split("SELECT * FROM t WHERE a = (SELECT 1)"));
    }
}
