package com.polydoc.repositories.mongo;

import com.polydoc.core.query.Filter;
import com.polydoc.core.query.Sort;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Translation between repository documents and MongoDB: the {@code id} key is stored as
 * {@code _id}, instants as BSON dates.
 */
public interface Converters {
    String ID = "id";
    String MONGO_ID = "_id";

    static Document toMongo(Document document) {
        Document doc = new Document();
        if (document.containsKey(ID)) {
            doc.put(MONGO_ID, document.get(ID));
        }
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            if (!ID.equals(entry.getKey())) {
                doc.put(entry.getKey(), toMongoValue(entry.getValue()));
            }
        }
        return doc;
    }

    static Document fromMongo(Document doc) {
        if (doc == null) {
            return null;
        }
        Document document = new Document();
        Object id = doc.get(MONGO_ID);
        if (id != null) {
            document.put(ID, id.toString());
        }
        for (Map.Entry<String, Object> entry : doc.entrySet()) {
            if (!MONGO_ID.equals(entry.getKey())) {
                document.put(entry.getKey(), fromMongoValue(entry.getValue()));
            }
        }
        return document;
    }

    @SuppressWarnings("unchecked")
    private static Object toMongoValue(Object value) {
        if (value instanceof Instant) {
            return Date.from((Instant) value);
        }
        if (value instanceof Map) {
            Document nested = new Document();
            ((Map<String, Object>) value).forEach((key, inner) -> nested.put(key, toMongoValue(inner)));
            return nested;
        }
        if (value instanceof Collection) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                list.add(toMongoValue(element));
            }
            return list;
        }
        return value;
    }

    private static Object fromMongoValue(Object value) {
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Document) {
            Document nested = new Document();
            ((Document) value).forEach((key, inner) -> nested.put(key, fromMongoValue(inner)));
            return nested;
        }
        if (value instanceof Collection) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                list.add(fromMongoValue(element));
            }
            return list;
        }
        return value;
    }

    static Bson toBson(Filter filter) {
        if (filter == null || filter instanceof Filter.All) {
            return new Document();
        }
        if (filter instanceof Filter.Eq) {
            Filter.Eq eq = (Filter.Eq) filter;
            return Filters.eq(field(eq.field()), toMongoValue(eq.value()));
        }
        if (filter instanceof Filter.Ne) {
            Filter.Ne ne = (Filter.Ne) filter;
            return Filters.ne(field(ne.field()), toMongoValue(ne.value()));
        }
        if (filter instanceof Filter.In) {
            Filter.In in = (Filter.In) filter;
            return Filters.in(field(in.field()), (List<?>) toMongoValue(in.values()));
        }
        if (filter instanceof Filter.Nin) {
            Filter.Nin nin = (Filter.Nin) filter;
            return Filters.nin(field(nin.field()), (List<?>) toMongoValue(nin.values()));
        }
        if (filter instanceof Filter.Comparison) {
            Filter.Comparison comparison = (Filter.Comparison) filter;
            String field = field(comparison.field());
            Object value = toMongoValue(comparison.value());
            switch (comparison.operator()) {
                case GT:
                    return Filters.gt(field, value);
                case GTE:
                    return Filters.gte(field, value);
                case LT:
                    return Filters.lt(field, value);
                default:
                    return Filters.lte(field, value);
            }
        }
        if (filter instanceof Filter.Exists) {
            Filter.Exists exists = (Filter.Exists) filter;
            return Filters.exists(field(exists.field()), exists.exists());
        }
        if (filter instanceof Filter.And) {
            return Filters.and(toBson(((Filter.And) filter).filters()));
        }
        if (filter instanceof Filter.Or) {
            return Filters.or(toBson(((Filter.Or) filter).filters()));
        }
        if (filter instanceof Filter.Not) {
            return Filters.nor(toBson(((Filter.Not) filter).filter()));
        }
        throw new IllegalArgumentException("Unsupported filter: " + filter);
    }

    private static List<Bson> toBson(List<Filter> filters) {
        List<Bson> bson = new ArrayList<>();
        for (Filter filter : filters) {
            bson.add(toBson(filter));
        }
        return bson;
    }

    static Bson toBson(Sort sort) {
        if (sort == null || sort.orders().isEmpty()) {
            return null;
        }
        List<Bson> orders = new ArrayList<>();
        for (Sort.Order order : sort.orders()) {
            String field = field(order.field());
            orders.add(order.direction() == Sort.Direction.DESC ? Sorts.descending(field) : Sorts.ascending(field));
        }
        return Sorts.orderBy(orders);
    }

    private static String field(String field) {
        return ID.equals(field) ? MONGO_ID : field;
    }
}
