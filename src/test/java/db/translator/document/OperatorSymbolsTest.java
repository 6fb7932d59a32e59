package db.translator.document;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import db.translator.query.ComparisonOp;

public class OperatorSymbolsTest {

    @Test
    void mappingIsABijection() {
        Set<String> keys = new HashSet<>();
        for (ComparisonOp op : ComparisonOp.values()) {
            String key = OperatorSymbols.keyFor(op);
            assertNotNull(key, op.name());
            assertTrue(keys.add(key), "duplicate key " + key);
            assertEquals(op, OperatorSymbols.opFor(key));
        }
        assertEquals(ComparisonOp.values().length, keys.size());
    }

    @Test
    void logicalKeysAreNotComparisonKeys() {
        assertFalse(OperatorSymbols.isComparisonKey(OperatorSymbols.AND));
        assertFalse(OperatorSymbols.isComparisonKey(OperatorSymbols.OR));
        assertFalse(OperatorSymbols.isComparisonKey(OperatorSymbols.NOR));
        assertThrows(IllegalArgumentException.class, () -> OperatorSymbols.opFor("$regex"));
    }
}
