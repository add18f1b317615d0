package com.polydoc.repos.certification;

import com.polydoc.core.InvalidArgumentException;
import com.polydoc.core.OperationOptions;
import com.polydoc.core.TransactionCoordinator;
import com.polydoc.core.ValidationException;
import com.polydoc.core.query.Filter;
import com.polydoc.core.store.Session;
import com.polydoc.repos.certification.domain.AudioBook;
import com.polydoc.repos.certification.domain.Book;
import com.polydoc.repos.certification.domain.BookRepository;
import com.polydoc.repos.certification.domain.DraftBookRepository;
import com.polydoc.repos.certification.domain.PaperBook;
import com.polydoc.repos.certification.domain.Publication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Certifies the transactional behaviour of a store: atomic bulk writes, rollback on failure and
 * isolation of uncommitted writes.
 */
public abstract class TransactionCertification extends StoreCertification {
    protected BookRepository repository;
    protected TransactionCoordinator coordinator;

    @BeforeEach
    public void setUpRepository() {
        repository = new BookRepository(store, collectionName);
        coordinator = new TransactionCoordinator(store);
    }

    @Test
    public void saveAllShouldStoreEveryEntity() {
        List<Publication> saved = repository.saveAll(List.of(
                new Book("Effective Java", "Best practices", "0134685997"),
                new PaperBook("Refactoring", "Improving code", "0134757599", 2)));

        assertEquals(2, saved.size());
        assertEquals(saved, repository.findAll());
    }

    @Test
    public void saveAllShouldStoreNothingWhenOneEntityIsInvalid() {
        assertThrows(ValidationException.class, () -> repository.saveAll(List.of(
                new Book("Effective Java", "Best practices", "0134685997"),
                new PaperBook("Refactoring", "Improving code", "0134685997", 2))));

        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    public void saveAllShouldInsertAndUpdateInOneGo() {
        Book stored = repository.save(new Book("Effective Jav", "Best practices", "0134685997"));

        List<Publication> saved = repository.saveAll(List.of(
                stored.withTitle("Effective Java"),
                new AudioBook("Dune", "Spice", "0441013597", List.of("Audible"), "mp3")));

        assertEquals("Effective Java", saved.get(0).title());
        assertEquals(2, repository.findAll().size());
    }

    @Test
    public void saveAllShouldRejectANullCollection() {
        assertThrows(InvalidArgumentException.class, () -> repository.saveAll(null));
    }

    @Test
    public void runInTransactionShouldCommitWhenTheWorkSucceeds() {
        String id = coordinator.runInTransaction(session -> {
            OperationOptions options = OperationOptions.builder().session(session).build();
            Book book = repository.save(new Book("Effective Java", "Best practices", "0134685997"), options);
            repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 2), options);
            return book.id();
        });

        assertTrue(repository.findById(id).isPresent());
        assertEquals(2, repository.findAll().size());
    }

    @Test
    public void runInTransactionShouldDiscardEveryWriteWhenTheWorkThrows() {
        Book stored = repository.save(new Book("Effective Java", "Best practices", "0134685997"));
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> coordinator.runInTransaction(session -> {
                    OperationOptions options = OperationOptions.builder().session(session).build();
                    repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 2), options);
                    repository.save(stored.withTitle("Changed"), options);
                    repository.deleteById(stored.id(), options);
                    throw failure;
                }));

        assertSame(failure, thrown);
        assertEquals(List.of(stored), repository.findAll());
    }

    @Test
    public void writesShouldStayInvisibleOutsideTheTransactionUntilCommitted() {
        Session session = store.startSession();
        try {
            session.startTransaction();
            OperationOptions inTransaction = OperationOptions.builder().session(session).build();
            Book book = repository.save(new Book("Effective Java", "Best practices", "0134685997"), inTransaction);

            assertTrue(repository.findById(book.id(), inTransaction).isPresent());
            assertTrue(repository.findById(book.id()).isEmpty());

            session.commitTransaction();

            assertTrue(repository.findById(book.id()).isPresent());
        } finally {
            session.close();
        }
    }

    @Test
    public void abortedTransactionsShouldLeaveNoTrace() {
        Session session = store.startSession();
        try {
            session.startTransaction();
            repository.save(new Book("Effective Java", "Best practices", "0134685997"),
                    OperationOptions.builder().session(session).build());
            session.abortTransaction();
        } finally {
            session.close();
        }

        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    public void saveAllShouldJoinTheTransactionOfTheGivenSession() {
        Session session = store.startSession();
        try {
            session.startTransaction();
            OperationOptions inTransaction = OperationOptions.builder().session(session).build();

            repository.saveAll(List.of(new Book("Effective Java", "Best practices", "0134685997")), inTransaction);

            assertTrue(session.hasActiveTransaction());
            assertTrue(repository.findAll().isEmpty());
            assertEquals(1, repository.findAll(inTransaction).size());

            session.abortTransaction();
        } finally {
            session.close();
        }

        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    public void saveAllShouldStartATransactionOnAGivenIdleSession() {
        Session session = store.startSession();
        try {
            repository.saveAll(List.of(new Book("Effective Java", "Best practices", "0134685997")),
                    OperationOptions.builder().session(session).build());

            assertFalse(session.hasActiveTransaction());
        } finally {
            session.close();
        }

        assertEquals(1, repository.findAll().size());
    }

    @Test
    public void deleteAllShouldRejectMissingFilters() {
        repository.save(new Book("Effective Java", "Best practices", "0134685997"));

        InvalidArgumentException e = assertThrows(InvalidArgumentException.class,
                () -> repository.deleteAll(OperationOptions.none()));

        assertEquals("Null filters are disallowed", e.getMessage());
        assertFalse(repository.findAll().get(0).deleted());
    }

    @Test
    public void deleteAllShouldMarkTheMatchingEntitiesAsDeleted() {
        Book book = repository.save(new Book("Effective Java", "Best practices", "0134685997"));
        PaperBook paperBook = repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 2));
        AudioBook audioBook = repository.save(new AudioBook("Dune", "Spice", "0441013597", List.of("Audible"), "mp3"));

        int deleted = repository.deleteAll(OperationOptions.builder()
                .filters(Filter.in("isbn", "0134685997", "0441013597"))
                .build());

        assertEquals(2, deleted);
        assertTrue(repository.findById(book.id()).map(Publication::deleted).orElseThrow());
        assertTrue(repository.findById(audioBook.id()).map(Publication::deleted).orElseThrow());
        assertFalse(repository.findById(paperBook.id()).map(Publication::deleted).orElseThrow());
        assertEquals(3, repository.findAll().size());
    }

    @Test
    public void deleteAllShouldMarkNothingWhenOneEntityFailsValidation() {
        repository.save(new Book("Effective Java", "Best practices", "0134685997"));
        new DraftBookRepository(store, collectionName).save(new Book("Untitled draft", null, "0134757599"));

        assertThrows(ValidationException.class,
                () -> repository.deleteAll(OperationOptions.builder().filters(Filter.all()).build()));

        List<Publication> stored = repository.findAll();
        assertEquals(2, stored.size());
        assertTrue(stored.stream().noneMatch(Publication::deleted));
    }

    @Test
    public void deleteAllWithoutArgumentsShouldMarkEveryEntityAsDeleted() {
        repository.save(new Book("Effective Java", "Best practices", "0134685997"));
        repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 2));

        assertEquals(2, repository.deleteAll());

        List<Publication> remaining = repository.findAll(OperationOptions.builder()
                .filters(Filter.eq("deleted", false))
                .build());
        assertTrue(remaining.isEmpty());
    }

    @Test
    public void deleteAllShouldKeepTheSubtypeOfTheMarkedEntities() {
        PaperBook paperBook = repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 2));

        repository.deleteAll(OperationOptions.builder().filters(Filter.eq("__t", "PaperBook")).build());

        Optional<Publication> found = repository.findById(paperBook.id());
        assertEquals(PaperBook.class, found.orElseThrow().getClass());
        assertTrue(found.get().deleted());
    }
}
