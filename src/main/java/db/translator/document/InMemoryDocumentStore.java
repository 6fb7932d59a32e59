package db.translator.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Document store kept in memory: named collections of ordered documents.
 * Writes replace a collection's document list wholesale, so concurrent finds always see a
 * consistent snapshot.
 */
public class InMemoryDocumentStore implements DocumentExecutor {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, List<Map<String, Object>>> collections = new ConcurrentHashMap<>();

    public void insertMany(String collection, List<Map<String, Object>> docs) {
        if (collection == null || collection.isEmpty()) throw new IllegalArgumentException("collection must not be empty");
        List<Map<String, Object>> copies = new ArrayList<>(docs.size());
        for (Map<String, Object> d : docs) copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(d)));
        collections.merge(collection, List.copyOf(copies), (old, added) -> {
            List<Map<String, Object>> merged = new ArrayList<>(old.size() + added.size());
            merged.addAll(old);
            merged.addAll(added);
            return List.copyOf(merged);
        });
        log.debug("Inserted {} document(s) into '{}'", docs.size(), collection);
    }

    public void drop(String collection) {
        collections.remove(collection);
    }

    public int count(String collection) {
        return collections.getOrDefault(collection, List.of()).size();
    }

    public Set<String> collectionNames() {
        return Collections.unmodifiableSet(new TreeSet<>(collections.keySet()));
    }

    /**
     * Filter, then skip, then limit, then project. An unknown collection yields no documents.
     */
    @Override
    public List<Map<String, Object>> find(DocumentQuery query) {
        List<Map<String, Object>> docs = collections.getOrDefault(query.collection(), List.of());
        DocumentMatcher matcher = DocumentMatcher.compile(query.filter());
        int toSkip = query.offset() == null ? 0 : query.offset();
        int cap = query.limit() == null ? Integer.MAX_VALUE : query.limit();
        List<Map<String, Object>> out = new ArrayList<>();
        for (Map<String, Object> doc : docs) {
            if (out.size() >= cap) break;
            if (!matcher.test(doc)) continue;
            if (toSkip > 0) {
                toSkip--;
                continue;
            }
            out.add(project(doc, query.projection()));
        }
        return out;
    }

    @Override
    public String name() { return "in-memory document store"; }

    private static Map<String, Object> project(Map<String, Object> doc, Map<String, Object> projection) {
        if (projection == null || projection.isEmpty()) return doc;
        boolean inclusive = false;
        for (Map.Entry<String, Object> e : projection.entrySet()) {
            if (!e.getKey().equals("_id") && isIncluded(e.getValue())) { inclusive = true; break; }
        }
        Map<String, Object> out = new LinkedHashMap<>();
        if (inclusive) {
            for (Map.Entry<String, Object> e : projection.entrySet()) {
                if (isIncluded(e.getValue()) && doc.containsKey(e.getKey())) out.put(e.getKey(), doc.get(e.getKey()));
            }
        } else {
            for (Map.Entry<String, Object> e : doc.entrySet()) {
                Object flag = projection.get(e.getKey());
                if (flag == null || isIncluded(flag)) out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    private static boolean isIncluded(Object flag) {
        if (flag instanceof Number n) return n.intValue() != 0;
        return Boolean.TRUE.equals(flag);
    }
}
