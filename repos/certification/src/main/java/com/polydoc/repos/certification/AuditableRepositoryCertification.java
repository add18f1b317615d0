package com.polydoc.repos.certification;

import com.polydoc.core.OperationOptions;
import com.polydoc.core.Patch;
import com.polydoc.repos.certification.domain.AuditableBook;
import com.polydoc.repos.certification.domain.AuditableBookRepository;
import com.polydoc.repos.certification.domain.AuditablePaperBook;
import com.polydoc.repos.certification.domain.AuditablePublication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public abstract class AuditableRepositoryCertification extends StoreCertification {
    protected AuditableBookRepository repository;

    @BeforeEach
    public void setUpRepository() {
        repository = new AuditableBookRepository(store, collectionName);
    }

    @Test
    public void insertShouldStartAtVersionZeroAndStampTheCreator() {
        Instant before = Instant.now().minusSeconds(1);

        AuditableBook saved = repository.save(new AuditableBook("Effective Java", "Best practices", "0134685997"),
                OperationOptions.builder().userId("alice").build());

        assertEquals(0L, saved.version());
        assertEquals("alice", saved.createdBy());
        assertEquals("alice", saved.updatedBy());
        assertNotNull(saved.createdAt());
        assertEquals(saved.createdAt(), saved.updatedAt());
        assertTrue(saved.createdAt().isAfter(before));
        assertEquals(saved, repository.findById(saved.id()).orElseThrow());
    }

    @Test
    public void insertWithoutUserShouldLeaveTheWriterFieldsEmpty() {
        AuditableBook saved = repository.save(new AuditableBook("Effective Java", "Best practices", "0134685997"));

        assertEquals(0L, saved.version());
        assertNull(saved.createdBy());
        assertNull(saved.updatedBy());
    }

    @Test
    public void insertShouldIgnoreAuditValuesSetByTheCaller() {
        AuditableBook forged = new AuditableBook(null, "Effective Java", "Best practices", "0134685997",
                41L, Instant.EPOCH, "mallory", Instant.EPOCH, "mallory");

        AuditableBook saved = repository.save(forged, OperationOptions.builder().userId("alice").build());

        assertEquals(0L, saved.version());
        assertEquals("alice", saved.createdBy());
        assertNotEquals(Instant.EPOCH, saved.createdAt());
    }

    @Test
    public void everyUpdateShouldIncrementTheVersionByOne() {
        AuditableBook saved = repository.save(new AuditableBook("Effective Java", "Best practices", "0134685997"),
                OperationOptions.builder().userId("alice").build());

        AuditableBook first = repository.save(saved.withDescription("Third edition"),
                OperationOptions.builder().userId("bob").build());
        AuditableBook second = repository.save(first.withDescription("Third edition, revised"));

        assertEquals(1L, first.version());
        assertEquals(2L, second.version());
        assertEquals("alice", second.createdBy());
        assertEquals("bob", second.updatedBy());
        assertEquals(saved.createdAt(), second.createdAt());
        assertFalse(second.updatedAt().isBefore(saved.updatedAt()));
        assertEquals(second, repository.findById(saved.id()).orElseThrow());
    }

    @Test
    public void updateShouldIgnoreTheVersionGivenByTheCaller() {
        AuditableBook saved = repository.save(new AuditableBook("Effective Java", "Best practices", "0134685997"));
        AuditableBook stale = new AuditableBook(saved.id(), saved.title(), "Stale copy", saved.isbn(),
                7L, null, "mallory", null, null);

        AuditableBook updated = repository.save(stale, OperationOptions.builder().userId("bob").build());

        assertEquals(1L, updated.version());
        assertNull(updated.createdBy());
        assertEquals("bob", updated.updatedBy());
        assertEquals("Stale copy", updated.description());
    }

    @Test
    public void patchesShouldBeAuditedLikeFullUpdates() {
        AuditablePaperBook saved = repository.save(
                new AuditablePaperBook("Refactoring", "Improving code", "0134757599", 1));

        AuditablePaperBook patched = repository.save(Patch.of(saved.id()).set("edition", 2),
                OperationOptions.builder().userId("carol").build());

        assertEquals(AuditablePaperBook.class, patched.getClass());
        assertEquals(2, patched.edition());
        assertEquals(1L, patched.version());
        assertEquals("carol", patched.updatedBy());
    }

    @Test
    public void patchesShouldNotOverwriteAuditFields() {
        AuditableBook saved = repository.save(new AuditableBook("Effective Java", "Best practices", "0134685997"));

        AuditableBook patched = repository.save(Patch.of(saved.id())
                .set("version", 99L)
                .set("createdBy", "mallory")
                .set("description", "Patched"));

        assertEquals(1L, patched.version());
        assertNull(patched.createdBy());
        assertEquals("Patched", patched.description());
    }

    @Test
    public void auditedSubtypesShouldKeepTheirType() {
        AuditablePaperBook saved = repository.save(
                new AuditablePaperBook("Refactoring", "Improving code", "0134757599", 1),
                OperationOptions.builder().userId("alice").build());

        AuditablePublication found = repository.findById(saved.id()).orElseThrow();

        assertEquals(AuditablePaperBook.class, found.getClass());
        assertEquals(0L, found.version());
        assertEquals("alice", found.createdBy());
    }
}
