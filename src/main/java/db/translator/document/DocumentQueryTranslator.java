package db.translator.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.translator.query.Query;
import db.translator.query.QueryParser;

/**
 * SQL text in, document query out. Pure and stateless; one instance can serve all threads.
 */
public class DocumentQueryTranslator {
    private static final Logger log = LoggerFactory.getLogger(DocumentQueryTranslator.class);

    private final QueryParser parser = new QueryParser();
    private final FilterRenderer renderer = new FilterRenderer();

    public DocumentQuery translate(String sql) {
        return render(parser.parse(sql));
    }

    public DocumentQuery render(Query query) {
        DocumentQuery out = new DocumentQuery(
            query.table(),
            renderer.render(query.predicate()),
            renderer.renderProjection(query.columns()),
            query.limit(),
            query.offset());
        log.debug("Translated predicate {} into filter {}", query.predicate(), out.filter());
        return out;
    }
}
