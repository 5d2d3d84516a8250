package com.nana.reconcile.fixtures;

import com.nana.reconcile.store.Database;
import com.nana.reconcile.store.JdbcTransactionManager;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * In-memory SQLite catalog of authors, categories and books.
 */
public final class Catalog implements AutoCloseable {

    public final Database database;
    public final JdbcTransactionManager transactions;
    public final AuthorStore authors;
    public final CategoryStore categories;
    public final BookStore books;

    private Catalog(Database database) {
        this.database = database;
        this.transactions = new JdbcTransactionManager(database);
        this.authors = new AuthorStore(database, transactions);
        this.categories = new CategoryStore(database, transactions);
        this.books = new BookStore(database, transactions, authors, categories);
        database.execute(AuthorStore.DDL, CategoryStore.DDL,
                BookStore.DDL_BOOKS, BookStore.DDL_BOOK_CATEGORIES);
    }

    public static Catalog inMemory() {
        return new Catalog(new Database("jdbc:sqlite::memory:"));
    }

    public Author addAuthor(String name) {
        Author author = new Author(name);
        authors.save(author, transactions.autoCommit());
        return author;
    }

    public Category addCategory(String name) {
        Category category = new Category(name);
        categories.save(category, transactions.autoCommit());
        return category;
    }

    public Book addBook(String name, Author author, String price, Category... categoryList) {
        Book book = new Book();
        book.setName(name);
        book.setAuthor(author);
        book.setPrice(price == null ? null : new BigDecimal(price));
        book.setPublished(LocalDate.of(2020, 1, 15));
        book.setAvailable(Boolean.TRUE);
        book.setCategories(List.of(categoryList));
        books.save(book, transactions.autoCommit());
        books.saveRelation(book, "categories", transactions.autoCommit());
        return book;
    }

    /** @return every book freshly loaded from the database */
    public List<Book> allBooks() {
        return books.findBy(Map.of());
    }

    public Book loadBook(int id) {
        return books.findBy(Map.of("id", id)).get(0);
    }

    @Override
    public void close() {
        database.close();
    }
}
