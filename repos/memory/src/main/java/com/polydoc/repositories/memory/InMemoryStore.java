package com.polydoc.repositories.memory;

import com.polydoc.core.store.TransactionConflictException;
import org.bson.Document;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Shared data of an in-memory document store: collections of documents keyed by id, in insertion
 * order.
 * <p>
 * Stored documents are never mutated in place, so a snapshot only needs to copy the maps.
 */
public class InMemoryStore {
    private final Map<String, Map<String, Document>> db = new LinkedHashMap<>();
    private final Object lock = new Object();

    <R> R locked(Supplier<R> action) {
        synchronized (lock) {
            return action.get();
        }
    }

    Map<String, Document> collection(String name) {
        synchronized (lock) {
            return db.computeIfAbsent(name, key -> new LinkedHashMap<>());
        }
    }

    Map<String, Map<String, Document>> snapshot() {
        synchronized (lock) {
            Map<String, Map<String, Document>> copy = new LinkedHashMap<>();
            db.forEach((name, documents) -> copy.put(name, new LinkedHashMap<>(documents)));
            return copy;
        }
    }

    /**
     * Applies the writes of a transaction.
     *
     * @param baseline  collections as they were when the transaction started
     * @param workspace collections as the transaction left them
     * @param written   ids written by the transaction, per collection
     * @throws TransactionConflictException if another writer changed one of the written documents
     *                                      since the transaction started; nothing is applied then
     */
    void commit(Map<String, Map<String, Document>> baseline,
                Map<String, Map<String, Document>> workspace,
                Map<String, Set<String>> written) {
        synchronized (lock) {
            for (Map.Entry<String, Set<String>> entry : written.entrySet()) {
                Map<String, Document> live = db.getOrDefault(entry.getKey(), Map.of());
                Map<String, Document> before = baseline.getOrDefault(entry.getKey(), Map.of());
                for (String id : entry.getValue()) {
                    if (live.get(id) != before.get(id)) {
                        throw new TransactionConflictException(String.format(
                                "Write conflict on document %s of collection %s", id, entry.getKey()));
                    }
                }
            }
            for (Map.Entry<String, Set<String>> entry : written.entrySet()) {
                Map<String, Document> live = db.computeIfAbsent(entry.getKey(), key -> new LinkedHashMap<>());
                Map<String, Document> after = workspace.getOrDefault(entry.getKey(), Map.of());
                for (String id : entry.getValue()) {
                    Document document = after.get(id);
                    if (document == null) {
                        live.remove(id);
                    } else {
                        live.put(id, document);
                    }
                }
            }
        }
    }
}
