package com.polydoc.repos.certification;

import com.polydoc.core.InvalidArgumentException;
import com.polydoc.core.OperationOptions;
import com.polydoc.core.Patch;
import com.polydoc.core.UnregisteredConstructorException;
import com.polydoc.core.ValidationException;
import com.polydoc.core.query.Filter;
import com.polydoc.core.query.Sort;
import com.polydoc.core.store.DocumentValidationException;
import com.polydoc.core.store.DuplicateKeyException;
import com.polydoc.repos.certification.domain.AudioBook;
import com.polydoc.repos.certification.domain.Book;
import com.polydoc.repos.certification.domain.BookRepository;
import com.polydoc.repos.certification.domain.ElectronicBook;
import com.polydoc.repos.certification.domain.ExtendedBookRepository;
import com.polydoc.repos.certification.domain.PaperBook;
import com.polydoc.repos.certification.domain.Publication;
import com.polydoc.repos.certification.domain.SubtypeOnlyBookRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public abstract class RepositoryCertification extends StoreCertification {
    protected BookRepository repository;

    @BeforeEach
    public void setUpRepository() {
        repository = new BookRepository(store, collectionName);
    }

    @Test
    public void saveShouldInsertAnEntityWithoutIdAndGenerateOne() {
        Book book = new Book("Effective Java", "Best practices", "0134685997");

        Book saved = repository.save(book);

        assertNotNull(saved.id());
        assertEquals("Effective Java", saved.title());
        assertEquals("0134685997", saved.isbn());
    }

    @Test
    public void findByIdShouldReturnTheSavedEntity() {
        Book saved = repository.save(new Book("Effective Java", "Best practices", "0134685997"));

        Optional<Publication> found = repository.findById(saved.id());

        assertTrue(found.isPresent());
        assertEquals(saved, found.get());
    }

    @Test
    public void saveShouldKeepTheExactSubtypeOfEverySavedEntity() {
        PaperBook paperBook = repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 2));
        AudioBook audioBook = repository.save(
                new AudioBook("Dune", "Spice", "0441013597", List.of("Audible", "Spotify"), "mp3"));

        Publication foundPaperBook = repository.findById(paperBook.id()).orElseThrow();
        Publication foundAudioBook = repository.findById(audioBook.id()).orElseThrow();

        assertEquals(PaperBook.class, foundPaperBook.getClass());
        assertEquals(paperBook, foundPaperBook);
        assertEquals(AudioBook.class, foundAudioBook.getClass());
        assertEquals(List.of("Audible", "Spotify"), ((AudioBook) foundAudioBook).hostingPlatforms());
    }

    @Test
    public void saveShouldRejectANullEntity() {
        assertThrows(InvalidArgumentException.class, () -> repository.save((Book) null));
        assertThrows(InvalidArgumentException.class, () -> repository.save((Patch) null));
    }

    @Test
    public void saveShouldRejectATypeTheRepositoryWasNotSetUpFor() {
        ElectronicBook electronicBook = new ElectronicBook("Neuromancer", "Cyberspace", "0441569595", "epub");

        InvalidArgumentException e = assertThrows(InvalidArgumentException.class,
                () -> repository.save(electronicBook));

        assertTrue(e.getMessage().contains("ElectronicBook"));
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    public void saveShouldRejectAnIdMatchingNoStoredEntity() {
        Book book = new Book("00000000-0000-0000-0000-000000000000", "Ghost", "Nobody", "0000000000", false);

        InvalidArgumentException e = assertThrows(InvalidArgumentException.class, () -> repository.save(book));

        assertTrue(e.getMessage().contains("00000000-0000-0000-0000-000000000000"));
    }

    @Test
    public void saveShouldUpdateAnEntityThatHasAnId() {
        Book saved = repository.save(new Book("Effective Jav", "Best practices", "0134685997"));

        Book updated = repository.save(saved.withTitle("Effective Java"));

        assertEquals(saved.id(), updated.id());
        assertEquals("Effective Java", updated.title());
        assertEquals("Effective Java", repository.findById(saved.id()).map(Publication::title).orElseThrow());
        assertEquals(1, repository.findAll().size());
    }

    @Test
    public void saveShouldOnlyWriteTheFieldsSetOnAPatch() {
        PaperBook saved = repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 1));

        PaperBook updated = repository.save(Patch.of(saved.id()).set("edition", 2));

        assertEquals(PaperBook.class, updated.getClass());
        assertEquals(2, updated.edition());
        assertEquals("Refactoring", updated.title());
        assertEquals("Improving code", updated.description());
        assertEquals(updated, repository.findById(saved.id()).orElseThrow());
    }

    @Test
    public void saveShouldDropPatchedFieldsTheTypeDoesNotDeclare() {
        PaperBook saved = repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 1));

        PaperBook updated = repository.save(Patch.of(saved.id()).set("edition", 2).set("shelf", "B-12"));

        assertEquals(2, updated.edition());
        assertTrue(repository.findAll(OperationOptions.builder()
                .filters(Filter.eq("shelf", "B-12"))
                .build()).isEmpty());
    }

    @Test
    public void saveShouldReportSchemaViolationsAsValidationErrors() {
        Book untitled = new Book(null, "No title", "1111111111");

        ValidationException e = assertThrows(ValidationException.class, () -> repository.save(untitled));

        assertInstanceOf(DocumentValidationException.class, e.getCause());
        assertTrue(e.getMessage().contains("title"));
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    public void saveShouldReportSubtypeSchemaViolationsAsValidationErrors() {
        PaperBook withoutEdition = new PaperBook("Refactoring", "Improving code", "0134757599", null);

        ValidationException e = assertThrows(ValidationException.class, () -> repository.save(withoutEdition));

        assertTrue(e.getMessage().contains("edition"));
    }

    @Test
    public void saveShouldReportDuplicateUniqueValuesAsValidationErrors() {
        repository.save(new Book("Effective Java", "Best practices", "0134685997"));

        ValidationException e = assertThrows(ValidationException.class,
                () -> repository.save(new PaperBook("Copy", "Same isbn", "0134685997", 1)));

        assertInstanceOf(DuplicateKeyException.class, e.getCause());
        assertEquals(1, repository.findAll().size());
    }

    @Test
    public void findByIdShouldRejectAMissingId() {
        assertThrows(InvalidArgumentException.class, () -> repository.findById(null));
        assertThrows(InvalidArgumentException.class, () -> repository.findById(""));
    }

    @Test
    public void findByIdShouldReturnEmptyForAnUnknownId() {
        assertTrue(repository.findById("00000000-0000-0000-0000-000000000001").isEmpty());
    }

    @Test
    public void findOneShouldRequireAFilter() {
        assertThrows(InvalidArgumentException.class, () -> repository.findOne(null));
        assertThrows(InvalidArgumentException.class, () -> repository.findOne(null, OperationOptions.none()));
    }

    @Test
    public void findOneShouldReturnTheFirstMatchingEntity() {
        repository.save(new Book("Effective Java", "Best practices", "0134685997"));
        PaperBook paperBook = repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 2));

        Optional<Publication> found = repository.findOne(Filter.eq("title", "Refactoring"));

        assertEquals(Optional.of(paperBook), found);
    }

    @Test
    public void findOneShouldPreferTheFiltersOfTheOptions() {
        Book book = repository.save(new Book("Effective Java", "Best practices", "0134685997"));
        repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 2));

        Optional<Publication> found = repository.findOne(
                Filter.eq("title", "Refactoring"),
                OperationOptions.builder().filters(Filter.eq("isbn", "0134685997")).build());

        assertEquals(Optional.of(book), found);
    }

    @Test
    public void findOneShouldReturnEmptyWhenNothingMatches() {
        repository.save(new Book("Effective Java", "Best practices", "0134685997"));

        assertTrue(repository.findOne(Filter.eq("title", "Missing")).isEmpty());
    }

    @Test
    public void findAllShouldReturnEveryEntityInStorageOrder() {
        List<Publication> saved = saveThreeBooks();

        List<Publication> found = repository.findAll();

        assertEquals(saved, found);
    }

    @Test
    public void findAllShouldReturnTheRequestedPage() {
        List<Publication> saved = saveThreeBooks();

        List<Publication> page = repository.findAll(OperationOptions.builder().pageable(2, 1).build());

        assertEquals(List.of(saved.get(1)), page);
    }

    @Test
    public void findAllShouldReturnNothingForAPageBeyondTheLastOne() {
        saveThreeBooks();

        List<Publication> page = repository.findAll(OperationOptions.builder().pageable(3, 2).build());
        List<Publication> beyond = repository.findAll(OperationOptions.builder().pageable(4, 1).build());

        assertEquals(1, page.size());
        assertTrue(beyond.isEmpty());
    }

    @Test
    public void findAllShouldReturnNothingForAPageFarBeyondTheIntRange() {
        saveThreeBooks();

        List<Publication> page = repository.findAll(OperationOptions.builder()
                .pageable(Integer.MAX_VALUE, 2)
                .build());

        assertTrue(page.isEmpty());
    }

    @Test
    public void findAllShouldIgnorePagingWithAZeroPageNumberOrOffset() {
        saveThreeBooks();

        assertEquals(3, repository.findAll(OperationOptions.builder().pageable(0, 1).build()).size());
        assertEquals(3, repository.findAll(OperationOptions.builder().pageable(2, 0).build()).size());
    }

    @Test
    public void findAllShouldRejectNegativePaging() {
        assertThrows(InvalidArgumentException.class,
                () -> repository.findAll(OperationOptions.builder().pageable(-1, 1).build()));
        assertThrows(InvalidArgumentException.class,
                () -> repository.findAll(OperationOptions.builder().pageable(1, -1).build()));
    }

    @Test
    public void findAllShouldFilterAndSort() {
        saveThreeBooks();

        List<Publication> found = repository.findAll(OperationOptions.builder()
                .filters(Filter.ne("title", "Dune"))
                .sortBy(Sort.descending("title"))
                .build());

        assertEquals(List.of("Refactoring", "Effective Java"), found.stream().map(Publication::title).toList());
    }

    @Test
    public void findAllShouldSelectASubtypeByItsDiscriminator() {
        saveThreeBooks();

        List<Publication> paperBooks = repository.findAll(OperationOptions.builder()
                .filters(Filter.eq("__t", "PaperBook"))
                .build());

        assertEquals(1, paperBooks.size());
        assertEquals(PaperBook.class, paperBooks.get(0).getClass());
    }

    @Test
    public void findAllShouldReturnAnEmptyListWhenNothingMatches() {
        saveThreeBooks();

        assertTrue(repository.findAll(OperationOptions.builder()
                .filters(Filter.eq("title", "Missing"))
                .build()).isEmpty());
    }

    @Test
    public void deleteByIdShouldRemoveAnExistingEntity() {
        Book saved = repository.save(new Book("Effective Java", "Best practices", "0134685997"));

        assertTrue(repository.deleteById(saved.id()));
        assertTrue(repository.findById(saved.id()).isEmpty());
    }

    @Test
    public void deleteByIdShouldReturnFalseForAnUnknownId() {
        saveThreeBooks();

        assertFalse(repository.deleteById("00000000-0000-0000-0000-000000000001"));
        assertEquals(3, repository.findAll().size());
    }

    @Test
    public void deleteByIdShouldRejectAMissingId() {
        assertThrows(InvalidArgumentException.class, () -> repository.deleteById(null));
        assertThrows(InvalidArgumentException.class, () -> repository.deleteById(" "));
    }

    @Test
    public void customQueriesShouldHydrateTheStoredSubtype() {
        repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 2));

        Optional<Publication> found = repository.findByIsbn("0134757599");

        assertTrue(found.isPresent());
        assertEquals(PaperBook.class, found.get().getClass());
        assertThrows(InvalidArgumentException.class, () -> repository.findByIsbn(""));
    }

    @Test
    public void readingADocumentOfAnUnregisteredSubtypeShouldFail() {
        ExtendedBookRepository newer = new ExtendedBookRepository(store, collectionName);
        ElectronicBook stored = newer.save(new ElectronicBook("Neuromancer", "Cyberspace", "0441569595", "epub"));

        assertThrows(UnregisteredConstructorException.class, () -> repository.findById(stored.id()));
        assertEquals(stored, newer.findById(stored.id()).orElseThrow());
    }

    @Test
    public void readingASupertypeDocumentWithoutASupertypeClassShouldFail() {
        SubtypeOnlyBookRepository subtypesOnly = new SubtypeOnlyBookRepository(store, collectionName);
        Book book = repository.save(new Book("Effective Java", "Best practices", "0134685997"));
        PaperBook paperBook = subtypesOnly.save(new PaperBook("Refactoring", "Improving code", "0134757599", 2));

        assertEquals(paperBook, repository.findById(paperBook.id()).orElseThrow());
        assertThrows(UnregisteredConstructorException.class, () -> subtypesOnly.findById(book.id()));
    }

    private List<Publication> saveThreeBooks() {
        Publication first = repository.save(new Book("Effective Java", "Best practices", "0134685997"));
        Publication second = repository.save(new PaperBook("Refactoring", "Improving code", "0134757599", 2));
        Publication third = repository.save(
                new AudioBook("Dune", "Spice", "0441013597", List.of("Audible"), null));
        return List.of(first, second, third);
    }
}
