package db.translator.document;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import db.translator.query.SqlSyntaxException;
import db.translator.query.UnsupportedFeatureException;

public class DocumentQueryTranslatorTest {

    private final DocumentQueryTranslator translator = new DocumentQueryTranslator();

    @Test
    void selectAllWithoutWhereIsMatchAll() {
        DocumentQuery q = translator.translate("SELECT * FROM users");
        assertEquals("users", q.collection());
        assertEquals(Map.of(), q.filter());
        assertEquals(Map.of("_id", 0), q.projection());
        assertNull(q.limit());
        assertNull(q.offset());
    }

    @Test
    void limitAndOffsetCarryThrough() {
        DocumentQuery q = translator.translate("SELECT name FROM users WHERE age > 3 LIMIT 0 OFFSET 7");
        assertEquals(0, q.limit());
        assertEquals(7, q.offset());
        assertEquals(Map.of("age", Map.of("$gt", 3L)), q.filter());
    }

    @Test
    void jsonForm() {
        DocumentQuery q = translator.translate("SELECT name FROM users WHERE age >= 21 AND (nick = 'a<b' OR nick IS NULL) LIMIT 5");
        assertEquals("{\"collection\":\"users\","
                + "\"filter\":{\"$and\":[{\"age\":{\"$gte\":21}},{\"$or\":[{\"nick\":\"a<b\"},{\"nick\":null}]}]},"
                + "\"projection\":{\"name\":1,\"_id\":0},"
                + "\"limit\":5}",
            q.toJson());
    }

    @Test
    void errorsPropagateWithTheirKind() {
        assertThrows(UnsupportedFeatureException.class, () -> translator.translate("SELECT a, b FROM t WHERE x LIKE '%foo'"));
        SqlSyntaxException e = assertThrows(SqlSyntaxException.class, () -> translator.translate("SELECT * FROM t WHERE a = "));
        assertTrue(e.offset() >= 24);
    }
}
