package com.polydoc.repositories.memory;

import com.polydoc.core.Schema;
import com.polydoc.core.query.Filter;
import com.polydoc.core.query.Sort;
import com.polydoc.core.store.CollectionDefinition;
import com.polydoc.core.store.DocumentCollection;
import com.polydoc.core.store.DocumentValidationException;
import com.polydoc.core.store.DuplicateKeyException;
import com.polydoc.core.store.Query;
import com.polydoc.core.store.Session;
import com.polydoc.core.store.StoreException;
import com.polydoc.core.store.TransactionConflictException;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.polydoc.core.Schema.FieldType.NUMBER;
import static com.polydoc.core.Schema.FieldType.STRING;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryDocumentStoreTest {
    private static final Schema ITEM = Schema.builder()
            .required("name", STRING)
            .unique("code", STRING)
            .field("price", NUMBER)
            .build();

    private InMemoryDocumentStore store;
    private DocumentCollection items;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        items = store.collection(new CollectionDefinition("items", "Item", "__t", ITEM, Map.of()));
    }

    @Test
    void insertGeneratesAnIdAndStoresACopy() {
        Document given = item("hammer", "H1", 10);

        Document stored = items.insert(null, given);
        given.put("name", "changed");

        assertNotNull(stored.getString("id"));
        assertEquals("hammer", items.findById(null, stored.getString("id")).orElseThrow().getString("name"));
    }

    @Test
    void insertKeepsAGivenId() {
        Document stored = items.insert(null, item("hammer", "H1", 10).append("id", "fixed"));

        assertEquals("fixed", stored.getString("id"));
        assertThrows(DuplicateKeyException.class,
                () -> items.insert(null, item("saw", "S1", 5).append("id", "fixed")));
    }

    @Test
    void insertValidatesAgainstTheSchema() {
        DocumentValidationException e = assertThrows(DocumentValidationException.class,
                () -> items.insert(null, new Document("code", "H1")));

        assertEquals(List.of("Path `name` is required."), e.violations());
        assertTrue(e.getMessage().startsWith("Item validation failed"));
    }

    @Test
    void uniqueFieldsRejectTakenValues() {
        items.insert(null, item("hammer", "H1", 10));

        DuplicateKeyException e = assertThrows(DuplicateKeyException.class,
                () -> items.insert(null, item("saw", "H1", 5)));

        assertEquals("code", e.field());
        assertEquals(1, items.find(null, Query.of(Filter.all())).size());
    }

    @Test
    void optionalUniqueFieldsTreatMissingValuesAsEqual() {
        Schema tagged = Schema.builder()
                .required("name", STRING)
                .add(new Schema.Field("tag", STRING, false, true))
                .build();
        DocumentCollection tags = store.collection(new CollectionDefinition("tags", "Tag", "__t", tagged, Map.of()));
        tags.insert(null, new Document("name", "first"));

        assertThrows(DuplicateKeyException.class, () -> tags.insert(null, new Document("name", "second")));
    }

    @Test
    void findAppliesSortSkipAndLimit() {
        items.insert(null, item("b", "B", 2));
        items.insert(null, item("c", "C", 3));
        items.insert(null, item("a", "A", 1));

        List<Document> found = items.find(null, new Query(Filter.gt("price", 1), Sort.ascending("name"), 1, 1));

        assertEquals(List.of("c"), names(found));
        assertEquals(List.of("b", "c", "a"), names(items.find(null, Query.of(Filter.all()))));
    }

    @Test
    void replaceChecksTheExpectedVersion() {
        String id = items.insert(null, item("hammer", "H1", 10).append("version", 0L)).getString("id");

        assertFalse(items.replace(null, id, 3L, item("hammer", "H1", 11).append("version", 4L)));
        assertTrue(items.replace(null, id, 0L, item("hammer", "H1", 12).append("version", 1L)));
        assertEquals(12, items.findById(null, id).orElseThrow().getInteger("price"));
        assertFalse(items.replace(null, "unknown", null, item("saw", "S1", 1)));
    }

    @Test
    void transactionWritesAreIsolatedUntilCommit() {
        Session session = store.startSession();
        session.startTransaction();
        String id = items.insert(session, item("hammer", "H1", 10)).getString("id");

        assertTrue(items.findById(session, id).isPresent());
        assertTrue(items.findById(null, id).isEmpty());

        session.commitTransaction();
        session.close();

        assertTrue(items.findById(null, id).isPresent());
    }

    @Test
    void transactionsReadTheSnapshotTakenAtStart() {
        Session session = store.startSession();
        session.startTransaction();
        String id = items.insert(null, item("hammer", "H1", 10)).getString("id");

        assertTrue(items.findById(session, id).isEmpty());

        session.abortTransaction();
        session.close();
    }

    @Test
    void abortDiscardsTheWorkspace() {
        String id = items.insert(null, item("hammer", "H1", 10)).getString("id");
        Session session = store.startSession();
        session.startTransaction();
        assertTrue(items.deleteById(session, id));

        session.abortTransaction();
        session.close();

        assertTrue(items.findById(null, id).isPresent());
    }

    @Test
    void commitFailsWhenAWrittenDocumentChangedConcurrently() {
        String id = items.insert(null, item("hammer", "H1", 10)).getString("id");
        Session session = store.startSession();
        session.startTransaction();
        items.replace(session, id, null, item("hammer", "H1", 11));

        items.replace(null, id, null, item("hammer", "H1", 12));

        assertThrows(TransactionConflictException.class, session::commitTransaction);
        assertFalse(session.hasActiveTransaction());
        session.close();
        assertEquals(12, items.findById(null, id).orElseThrow().getInteger("price"));
    }

    @Test
    void sessionsOfAnotherStoreAreRejected() {
        Session foreign = new InMemoryDocumentStore().startSession();
        foreign.startTransaction();

        assertThrows(StoreException.class, () -> items.findById(foreign, "any"));

        foreign.close();
    }

    @Test
    void startingASecondTransactionOnASessionFails() {
        Session session = store.startSession();
        session.startTransaction();

        assertThrows(IllegalStateException.class, session::startTransaction);

        session.close();
        assertFalse(session.hasActiveTransaction());
        assertThrows(IllegalStateException.class, session::startTransaction);
    }

    @Test
    void pluginStoresWithTheSameNameShareData() {
        InMemoryPlugin plugin = new InMemoryPlugin();
        CollectionDefinition definition = new CollectionDefinition("items", "Item", "__t", ITEM, Map.of());
        InMemoryConfig config = new InMemoryConfig();

        String id = plugin.createStore(config).collection(definition).insert(null, item("hammer", "H1", 10))
                .getString("id");

        assertTrue(plugin.createStore(config).collection(definition).findById(null, id).isPresent());
        plugin.cleanUp();
        assertTrue(plugin.createStore(config).collection(definition).findById(null, id).isEmpty());
    }

    private static Document item(String name, String code, int price) {
        return new Document("name", name).append("code", code).append("price", price);
    }

    private static List<String> names(List<Document> documents) {
        return documents.stream().map(document -> document.getString("name")).collect(Collectors.toList());
    }
}
