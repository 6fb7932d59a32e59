package db.translator.document;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Find-style request for a document store.
 * filter: {} matches every document.
 * limit / offset: null when absent; limit 0 returns no documents.
 */
public record DocumentQuery(String collection, Map<String, Object> filter, Map<String, Object> projection,
                            Integer limit, Integer offset) {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

    public String toJson() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("collection", collection);
        root.put("filter", filter);
        root.put("projection", projection);
        if (limit != null) root.put("limit", limit);
        if (offset != null) root.put("skip", offset);
        return GSON.toJson(root);
    }
}
