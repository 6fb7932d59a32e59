package db.translator.document;

import java.util.List;
import java.util.Map;

/**
 * Runs a translated query against a document store.
 */
public interface DocumentExecutor {

    List<Map<String, Object>> find(DocumentQuery query) throws Exception;

    default String name() { return "document"; }
}
