package com.polydoc.repositories.memory;

import com.fasterxml.uuid.Generators;
import com.polydoc.core.Auditable;
import com.polydoc.core.query.Filter;
import com.polydoc.core.store.CollectionDefinition;
import com.polydoc.core.store.DocumentCollection;
import com.polydoc.core.store.DuplicateKeyException;
import com.polydoc.core.store.Query;
import com.polydoc.core.store.Session;
import com.polydoc.core.store.StoreException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A collection of an {@link InMemoryDocumentStore}. Operations given a session with an active
 * transaction see and change that transaction's copy of the data; all others work on the shared data.
 */
public class InMemoryCollection implements DocumentCollection {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCollection.class);
    private static final String ID = "id";

    private final InMemoryStore store;
    private final CollectionDefinition definition;

    InMemoryCollection(InMemoryStore store, CollectionDefinition definition) {
        this.store = store;
        this.definition = definition;
    }

    @Override
    public String name() {
        return definition.name();
    }

    @Override
    public Document insert(Session session, Document document) {
        Object givenId = document.get(ID);
        String id = givenId != null ? givenId.toString() : Generators.timeBasedGenerator().generate().toString();
        Document toStore = new Document(ID, id);
        document.forEach((key, value) -> {
            if (!ID.equals(key)) {
                toStore.put(key, value);
            }
        });
        Document stored = Documents.copy(toStore);
        definition.validate(stored);

        return inView(session, view -> {
            if (view.contains(id)) {
                throw new DuplicateKeyException(name(), ID, id);
            }
            checkUnique(view, id, stored);
            view.put(id, stored);
            logger.debug("Inserted document {} into {}", id, name());
            return Documents.copy(stored);
        });
    }

    @Override
    public Optional<Document> findById(Session session, String id) {
        return inView(session, view -> Optional.ofNullable(view.get(id)).map(Documents::copy));
    }

    @Override
    public Optional<Document> findOne(Session session, Filter filter) {
        return inView(session, view -> view.documents()
                .filter(document -> DocumentMatcher.matches(document, filter))
                .findFirst()
                .map(Documents::copy));
    }

    @Override
    public List<Document> find(Session session, Query query) {
        return inView(session, view -> {
            Stream<Document> matching = view.documents()
                    .filter(document -> DocumentMatcher.matches(document, query.filter()));
            if (query.sort() != null) {
                matching = matching.sorted(Documents.comparator(query.sort()));
            }
            if (query.skip() > 0) {
                matching = matching.skip(query.skip());
            }
            if (query.limit() > 0) {
                matching = matching.limit(query.limit());
            }
            return matching.map(Documents::copy).collect(Collectors.toList());
        });
    }

    @Override
    public boolean replace(Session session, String id, Long expectedVersion, Document document) {
        Document stored = Documents.copy(document);
        stored.put(ID, id);
        definition.validate(stored);

        return inView(session, view -> {
            Document current = view.get(id);
            if (current == null) {
                return false;
            }
            if (expectedVersion != null && !versionMatches(current, expectedVersion)) {
                logger.debug("Document {} of {} no longer has version {}", id, name(), expectedVersion);
                return false;
            }
            checkUnique(view, id, stored);
            view.put(id, stored);
            return true;
        });
    }

    @Override
    public boolean deleteById(Session session, String id) {
        return inView(session, view -> view.remove(id));
    }

    private void checkUnique(View view, String id, Document document) {
        for (String field : definition.uniqueFields()) {
            Object value = Documents.valueAt(document, field);
            boolean taken = view.documents()
                    .filter(other -> !id.equals(other.get(ID)))
                    .anyMatch(other -> Objects.equals(Documents.valueAt(other, field), value));
            if (taken) {
                throw new DuplicateKeyException(name(), field, value);
            }
        }
    }

    private static boolean versionMatches(Document document, Long expectedVersion) {
        Object version = document.get(Auditable.VERSION);
        return version instanceof Number && ((Number) version).longValue() == expectedVersion;
    }

    private <R> R inView(Session session, Function<View, R> action) {
        InMemorySession transaction = transactionOf(session);
        return store.locked(() -> {
            if (transaction != null) {
                return action.apply(new View(transaction.workspace(name()), transaction));
            }
            return action.apply(new View(store.collection(name()), null));
        });
    }

    private InMemorySession transactionOf(Session session) {
        if (session == null) {
            return null;
        }
        if (!(session instanceof InMemorySession) || !((InMemorySession) session).belongsTo(store)) {
            throw new StoreException("The given session was not started by this store");
        }
        InMemorySession inMemorySession = (InMemorySession) session;
        return inMemorySession.hasActiveTransaction() ? inMemorySession : null;
    }

    /**
     * The documents an operation sees, recording writes made inside a transaction.
     */
    private final class View {
        private final Map<String, Document> documents;
        private final InMemorySession transaction;

        private View(Map<String, Document> documents, InMemorySession transaction) {
            this.documents = documents;
            this.transaction = transaction;
        }

        Document get(String id) {
            return documents.get(id);
        }

        boolean contains(String id) {
            return documents.containsKey(id);
        }

        Stream<Document> documents() {
            return documents.values().stream();
        }

        void put(String id, Document document) {
            documents.put(id, document);
            written(id);
        }

        boolean remove(String id) {
            boolean removed = documents.remove(id) != null;
            if (removed) {
                written(id);
            }
            return removed;
        }

        private void written(String id) {
            if (transaction != null) {
                transaction.markWritten(name(), id);
            }
        }
    }
}
