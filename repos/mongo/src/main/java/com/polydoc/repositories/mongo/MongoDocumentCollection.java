package com.polydoc.repositories.mongo;

import com.fasterxml.uuid.Generators;
import com.polydoc.core.Auditable;
import com.polydoc.core.query.Filter;
import com.polydoc.core.store.CollectionDefinition;
import com.polydoc.core.store.DocumentCollection;
import com.polydoc.core.store.DuplicateKeyException;
import com.polydoc.core.store.Query;
import com.polydoc.core.store.Session;
import com.polydoc.core.store.StoreException;
import com.polydoc.core.store.TransactionConflictException;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.WriteConcern;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.polydoc.repositories.mongo.Converters.ID;
import static com.polydoc.repositories.mongo.Converters.MONGO_ID;
import static com.polydoc.repositories.mongo.Converters.fromMongo;
import static com.polydoc.repositories.mongo.Converters.toBson;
import static com.polydoc.repositories.mongo.Converters.toMongo;

/**
 * A MongoDB collection. Documents are validated against the collection definition before every
 * write; unique fields are enforced by the indexes {@link MongoDocumentStore} creates.
 */
public class MongoDocumentCollection implements DocumentCollection {
    private static final Logger logger = LoggerFactory.getLogger(MongoDocumentCollection.class);
    private static final int DUPLICATE_KEY_CODE = 11000;
    private static final Pattern DUPLICATE_INDEX = Pattern.compile("index: (\\S+?)_-?1\\b");

    private final MongoCollection<Document> collection;
    private final CollectionDefinition definition;

    MongoDocumentCollection(MongoCollection<Document> collection, CollectionDefinition definition) {
        this.collection = collection;
        this.definition = definition;
    }

    @Override
    public String name() {
        return definition.name();
    }

    @Override
    public Document insert(Session session, Document document) {
        Document toStore = new Document(document);
        if (toStore.get(ID) == null) {
            toStore.put(ID, Generators.timeBasedGenerator().generate().toString());
        }
        definition.validate(toStore);
        Document doc = toMongo(toStore);

        ClientSession clientSession = clientSessionOf(session);
        execute("creating document", () -> {
            if (clientSession == null) {
                collection.withWriteConcern(WriteConcern.MAJORITY).insertOne(doc);
            } else {
                collection.insertOne(clientSession, doc);
            }
            return null;
        });
        return fromMongo(doc);
    }

    @Override
    public Optional<Document> findById(Session session, String id) {
        return findOne(session, Filters.eq(MONGO_ID, id));
    }

    @Override
    public Optional<Document> findOne(Session session, Filter filter) {
        return findOne(session, toBson(filter));
    }

    private Optional<Document> findOne(Session session, Bson filter) {
        ClientSession clientSession = clientSessionOf(session);
        Document doc = execute("reading document", () -> clientSession == null
                ? collection.find(filter).first()
                : collection.find(clientSession, filter).first());
        return Optional.ofNullable(fromMongo(doc));
    }

    @Override
    public List<Document> find(Session session, Query query) {
        ClientSession clientSession = clientSessionOf(session);
        Bson filter = toBson(query.filter());
        List<Document> results = execute("reading documents", () -> {
            FindIterable<Document> found = clientSession == null
                    ? collection.find(filter)
                    : collection.find(clientSession, filter);
            Bson sort = toBson(query.sort());
            if (sort != null) {
                found = found.sort(sort);
            }
            if (query.skip() > 0) {
                found = found.skip(query.skip());
            }
            if (query.limit() > 0) {
                found = found.limit(query.limit());
            }
            return found.into(new ArrayList<>());
        });
        return results.stream()
                .map(Converters::fromMongo)
                .collect(Collectors.toList());
    }

    @Override
    public boolean replace(Session session, String id, Long expectedVersion, Document document) {
        Document toStore = new Document(document);
        toStore.put(ID, id);
        definition.validate(toStore);
        Document doc = toMongo(toStore);

        Bson filter = expectedVersion == null
                ? Filters.eq(MONGO_ID, id)
                : Filters.and(Filters.eq(MONGO_ID, id), Filters.eq(Auditable.VERSION, expectedVersion));
        ClientSession clientSession = clientSessionOf(session);
        long matched = execute("updating document", () -> clientSession == null
                ? collection.withWriteConcern(WriteConcern.MAJORITY).replaceOne(filter, doc).getMatchedCount()
                : collection.replaceOne(clientSession, filter, doc).getMatchedCount());
        return matched > 0;
    }

    @Override
    public boolean deleteById(Session session, String id) {
        Bson filter = Filters.eq(MONGO_ID, id);
        ClientSession clientSession = clientSessionOf(session);
        long deleted = execute("removing document", () -> clientSession == null
                ? collection.withWriteConcern(WriteConcern.MAJORITY).deleteOne(filter).getDeletedCount()
                : collection.deleteOne(clientSession, filter).getDeletedCount());
        return deleted > 0;
    }

    private <R> R execute(String action, Supplier<R> operation) {
        try {
            return operation.get();
        } catch (MongoWriteException e) {
            if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                throw duplicateKey(e);
            }
            logger.error("Error {} in {}: {}", action, name(), e.getMessage(), e);
            throw new StoreException("Failed " + action + " in " + name(), e);
        } catch (MongoException e) {
            if (e.getCode() == DUPLICATE_KEY_CODE) {
                throw duplicateKey(e);
            }
            if (e.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)) {
                throw new TransactionConflictException("Write conflict in " + name() + ": " + e.getMessage(), e);
            }
            logger.error("Error {} in {}: {}", action, name(), e.getMessage(), e);
            throw new StoreException("Failed " + action + " in " + name(), e);
        }
    }

    private DuplicateKeyException duplicateKey(MongoException e) {
        Matcher matcher = DUPLICATE_INDEX.matcher(String.valueOf(e.getMessage()));
        String field = matcher.find() ? matcher.group(1) : null;
        return new DuplicateKeyException(e.getMessage(), field, e);
    }

    private static ClientSession clientSessionOf(Session session) {
        if (session == null) {
            return null;
        }
        if (!(session instanceof MongoSession)) {
            throw new StoreException("The given session was not started by a MongoDB store");
        }
        MongoSession mongoSession = (MongoSession) session;
        return mongoSession.hasActiveTransaction() ? mongoSession.clientSession() : null;
    }
}
