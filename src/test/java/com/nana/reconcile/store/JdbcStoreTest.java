package com.nana.reconcile.store;

import com.nana.reconcile.fixtures.Author;
import com.nana.reconcile.fixtures.Book;
import com.nana.reconcile.fixtures.Catalog;
import com.nana.reconcile.fixtures.Category;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SQLite-backed stores and transaction handles.
 */
class JdbcStoreTest {

    private Catalog catalog;
    private Author tolkien;

    @BeforeEach
    void setUp() {
        catalog = Catalog.inMemory();
        tolkien = catalog.addAuthor("Tolkien");
    }

    @AfterEach
    void tearDown() {
        catalog.close();
    }

    private Transaction auto() {
        return catalog.transactions.autoCommit();
    }

    // ======================================================================
    // CRUD
    // ======================================================================

    @Nested
    @DisplayName("Store operations")
    class CrudTests {

        @Test
        @DisplayName("Saving a new object assigns its id; saving again updates")
        void save_insertsThenUpdates() {
            Book book = catalog.addBook("Dune", tolkien, "9.99");
            assertNotNull(book.getId());

            book.setName("Dune Messiah");
            catalog.books.save(book, auto());

            assertEquals(1, catalog.allBooks().size());
            assertEquals("Dune Messiah", catalog.loadBook(book.getId()).getName());
        }

        @Test
        @DisplayName("Values round-trip through their column types")
        void save_roundTripsTypes() {
            Book saved = catalog.addBook("Emma", tolkien, "4.50");

            Book loaded = catalog.loadBook(saved.getId());

            assertEquals(new BigDecimal("4.50"), loaded.getPrice());
            assertEquals(saved.getPublished(), loaded.getPublished());
            assertEquals(Boolean.TRUE, loaded.getAvailable());
            assertEquals(tolkien.getId(), loaded.getAuthor().getId());
        }

        @Test
        @DisplayName("A null criterion matches missing values only")
        void findBy_nullMatchesNull() {
            catalog.addBook("Anonymous", null, null);
            catalog.addBook("Signed", tolkien, null);

            Map<String, Object> criteria = new HashMap<>();
            criteria.put("author", null);
            List<Book> found = catalog.books.findBy(criteria);

            assertEquals(1, found.size());
            assertEquals("Anonymous", found.get(0).getName());
            assertEquals(1, catalog.books.findBy(Map.of("author", tolkien)).size());
        }

        @Test
        @DisplayName("findAllIn with no values matches nothing")
        void findAllIn_emptyValues() {
            catalog.addBook("Dune", tolkien, "1");
            assertTrue(catalog.books.findAllIn("id", List.of()).isEmpty());
            assertEquals(1, catalog.books.findAllIn("name", List.of("Dune", "Other")).size());
        }

        @Test
        @DisplayName("streamAll reads every row in id order")
        void streamAll_readsInOrder() {
            catalog.addBook("B", tolkien, "1");
            catalog.addBook("A", tolkien, "1");

            try (Stream<Book> all = catalog.books.streamAll()) {
                assertEquals(List.of("B", "A"), all.map(Book::getName).toList());
            }
        }

        @Test
        @DisplayName("Many-to-many members are replaced, not appended")
        void saveRelation_replacesMembers() {
            Category a = catalog.addCategory("A");
            Category b = catalog.addCategory("B");
            Book book = catalog.addBook("Dune", tolkien, "1", a);

            book.setCategories(List.of(b));
            catalog.books.saveRelation(book, "categories", auto());

            Book loaded = catalog.loadBook(book.getId());
            assertEquals(List.of(b.getId()), loaded.getCategories().stream().map(Category::getId).toList());
            assertEquals(1, catalog.books.getRelationMembers(loaded, "categories").size());
        }

        @Test
        @DisplayName("Deleting removes the row; deleting an unsaved object fails")
        void delete_behaviour() {
            Book book = catalog.addBook("Dune", tolkien, "1");

            catalog.books.delete(book, auto());

            assertTrue(catalog.allBooks().isEmpty());
            assertThrows(ModelStore.PersistenceException.class, () -> catalog.books.delete(new Book(), auto()));
        }

        @Test
        @DisplayName("Constraint violations surface as PersistenceException")
        void constraintViolation_isPersistenceException() {
            Book nameless = new Book();
            assertThrows(ModelStore.PersistenceException.class, () -> catalog.books.save(nameless, auto()));
        }

        @Test
        @DisplayName("Relation members of a scalar attribute are rejected")
        void relationMembers_scalarRejected() {
            Book book = catalog.addBook("Dune", tolkien, "1");
            assertThrows(IllegalArgumentException.class,
                    () -> catalog.books.getRelationMembers(book, "name"));
            assertThrows(ModelStore.PersistenceException.class,
                    () -> catalog.authors.saveRelation(tolkien, "books", auto()));
        }
    }

    // ======================================================================
    // TRANSACTIONS
    // ======================================================================

    @Nested
    @DisplayName("Transactions")
    class TransactionTests {

        @Test
        @DisplayName("Commit keeps the changes")
        void commit_persists() {
            try (Transaction tx = catalog.transactions.begin()) {
                catalog.books.save(newBook("Kept"), tx);
                tx.commit();
            }
            assertEquals(1, catalog.allBooks().size());
            assertFalse(catalog.transactions.inTransaction());
        }

        @Test
        @DisplayName("Rollback discards the changes")
        void rollback_discards() {
            try (Transaction tx = catalog.transactions.begin()) {
                catalog.books.save(newBook("Gone"), tx);
                tx.rollback();
            }
            assertTrue(catalog.allBooks().isEmpty());
        }

        @Test
        @DisplayName("Closing an active transaction rolls it back")
        void close_rollsBack() throws Exception {
            Transaction tx = catalog.transactions.begin();
            catalog.books.save(newBook("Gone"), tx);
            tx.close();

            assertFalse(tx.isActive());
            assertTrue(catalog.allBooks().isEmpty());
            assertTrue(catalog.database.getConnection().getAutoCommit());
        }

        @Test
        @DisplayName("Only one transaction can be open at a time")
        void begin_twiceFails() {
            try (Transaction tx = catalog.transactions.begin()) {
                assertTrue(catalog.transactions.inTransaction());
                assertThrows(ModelStore.PersistenceException.class, () -> catalog.transactions.begin());
            }
        }

        @Test
        @DisplayName("An ended transaction cannot be used or ended again")
        void endedTransaction_rejected() {
            Transaction tx = catalog.transactions.begin();
            tx.commit();

            assertThrows(IllegalStateException.class, tx::commit);
            assertThrows(IllegalStateException.class, tx::rollback);
            assertThrows(ModelStore.PersistenceException.class, () -> catalog.books.save(newBook("X"), tx));
            assertThrows(IllegalArgumentException.class, () -> catalog.books.save(newBook("X"), null));
        }

        @Test
        @DisplayName("Auto-commit handle is unmanaged and inert")
        void autoCommit_isInert() {
            Transaction tx = auto();
            assertFalse(tx.isManaged());
            assertTrue(tx.isActive());
            tx.rollback();
            tx.commit();
            assertTrue(tx.isActive());
        }

        @Test
        @DisplayName("A closed database refuses connections")
        void closedDatabase_refuses() {
            Database database = new Database("jdbc:sqlite::memory:");
            database.close();
            assertThrows(IllegalStateException.class, database::getConnection);
        }

        private Book newBook(String name) {
            Book book = new Book();
            book.setName(name);
            return book;
        }
    }

    // ======================================================================
    // SCHEMA
    // ======================================================================

    @Nested
    @DisplayName("Schema paths")
    class SchemaTests {

        @Test
        @DisplayName("Dotted paths read through foreign keys, null-safe")
        void resolvePath_readsThroughRelation() {
            Accessor<Book, Object> authorName = catalog.books.getSchema().resolvePath("author.name");
            Book book = new Book();

            assertNull(authorName.get(book));
            book.setAuthor(tolkien);
            assertEquals("Tolkien", authorName.get(book));
            assertEquals(AttributeKind.STRING,
                    catalog.books.getSchema().resolveAttribute("author.name").getKind());
        }

        @Test
        @DisplayName("Writing through a path sets the intermediate object's attribute")
        void resolvePath_writesThroughRelation() {
            Accessor<Book, Object> authorName = catalog.books.getSchema().resolvePath("author.name");
            Author author = new Author("Old");
            Book book = new Book();
            book.setAuthor(author);

            authorName.set(book, "New");
            authorName.set(new Book(), "Ignored");

            assertEquals("New", author.getName());
        }

        @Test
        @DisplayName("Unknown attributes and non-relation hops are rejected")
        void resolvePath_rejectsInvalid() {
            ModelSchema<Book> schema = catalog.books.getSchema();
            assertThrows(IllegalArgumentException.class, () -> schema.resolvePath("isbn"));
            assertThrows(IllegalArgumentException.class, () -> schema.resolvePath("name.length"));
            assertThrows(IllegalArgumentException.class, () -> schema.resolveAttribute("author.age"));
        }

        @Test
        @DisplayName("Relation attributes require a related store")
        void schemaBuilder_rejectsRelationKindForScalars() {
            assertThrows(IllegalArgumentException.class, () -> ModelSchema.<Book>builder("Book")
                    .attribute("author", AttributeKind.FOREIGN_KEY, Book::getAuthor, Book::setAuthor));
            assertThrows(IllegalStateException.class, () -> ModelSchema.<Book>builder("Empty").build());
        }
    }
}
