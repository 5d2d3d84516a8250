package com.nana.reconcile.resource;

import com.nana.reconcile.dataset.Dataset;
import com.nana.reconcile.diff.DiffMatchPatchEngine;
import com.nana.reconcile.fixtures.Author;
import com.nana.reconcile.fixtures.Book;
import com.nana.reconcile.fixtures.Catalog;
import com.nana.reconcile.result.ImportType;
import com.nana.reconcile.result.RowResult;
import com.nana.reconcile.store.Accessor;
import com.nana.reconcile.util.ReconcileConfig;
import com.nana.reconcile.widget.CharWidget;
import com.nana.reconcile.widget.DateWidget;
import com.nana.reconcile.widget.ForeignKeyWidget;
import com.nana.reconcile.widget.IntegerWidget;
import com.nana.reconcile.widget.WidgetFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Field generation from a model schema and construction-time validation.
 */
class ModelResourceTest {

    private Catalog catalog;
    private final ReconcileConfig config = new ReconcileConfig(new Properties());

    @BeforeEach
    void setUp() {
        catalog = Catalog.inMemory();
        Author tolkien = catalog.addAuthor("Tolkien");
        catalog.addBook("The Hobbit", tolkien, "12.50");
    }

    @AfterEach
    void tearDown() {
        catalog.close();
    }

    private ModelResource<Book> resource(ResourceOptions options) {
        return new ModelResource<>(catalog.books, options, FieldSet.empty(), config, new DiffMatchPatchEngine());
    }

    private ModelResource<Book> resource(ResourceOptions options, FieldSet<Book> declared) {
        return new ModelResource<>(catalog.books, options, declared, config, new DiffMatchPatchEngine());
    }

    private static List<String> names(Resource<?> resource) {
        return resource.getFields().stream().map(Field::getName).toList();
    }

    // ======================================================================
    // GENERATION
    // ======================================================================

    @Nested
    @DisplayName("Field generation")
    class GenerationTests {

        @Test
        @DisplayName("Every attribute becomes a field in schema order")
        void allAttributes() {
            ModelResource<Book> resource = resource(ResourceOptions.defaults());

            assertEquals(List.of("id", "name", "author", "price", "published", "available", "categories"),
                    names(resource));
            assertEquals(names(resource), resource.getColumnHeaders());
            assertTrue(resource.getField("categories").isRelationCollection());
            assertInstanceOf(ForeignKeyWidget.class, resource.getField("author").getWidget());
        }

        @Test
        @DisplayName("Whitelist and exclude filter generated fields")
        void whitelistAndExclude() {
            ResourceOptions options = ResourceOptions.builder()
                    .fields("id", "name", "price", "categories")
                    .exclude("categories")
                    .build();

            assertEquals(List.of("id", "name", "price"), names(resource(options)));
        }

        @Test
        @DisplayName("Declared fields come first and are never filtered")
        void declaredFieldsWin() {
            FieldSet<Book> declared = FieldSet.<Book>builder()
                    .field("name", Field.of(Accessor.of(Book::getName, Book::setName), new CharWidget())
                            .column("Title"))
                    .field("nameLength", Field.computed(b -> b.getName().length(), new IntegerWidget()))
                    .build();
            ResourceOptions options = ResourceOptions.builder().fields("id").exclude("name").build();

            ModelResource<Book> resource = resource(options, declared);

            assertEquals(List.of("name", "nameLength", "id"), names(resource));
            assertEquals("Title", resource.getField("name").getColumnName());
        }

        @Test
        @DisplayName("Dotted whitelist entries follow relations and are readonly")
        void dottedPathIsReadonly() {
            ModelResource<Book> resource = resource(ResourceOptions.builder()
                    .fields("id", "name", "author.name").build());

            Field<Book, ?> authorName = resource.getField("author.name");
            assertTrue(authorName.isReadonly());
            assertEquals("author.name", authorName.getAttribute());
            assertEquals(List.of("1", "The Hobbit", "Tolkien"), resource.export().getData().get(0));

            RowResult row = resource.importData(Dataset.withHeaders("id", "name", "author.name")
                    .append("1", "The Hobbit", "Someone Else")).getRows().get(0);
            assertEquals(ImportType.UPDATE, row.getImportType());
            assertEquals("Tolkien", catalog.loadBook(1).getAuthor().getName());
        }

        @Test
        @DisplayName("Widget arguments reach generated widgets")
        void widgetArgumentsApplied() {
            ModelResource<Book> resource = resource(ResourceOptions.builder()
                    .widget("published", Map.of(WidgetFactory.ARG_FORMAT, "dd/MM/yyyy"))
                    .widget("author", Map.of(WidgetFactory.ARG_FIELD, "name"))
                    .build());

            assertEquals(List.of("dd/MM/yyyy"),
                    ((DateWidget) resource.getField("published").getWidget()).getPatterns());
            List<String> exported = resource.export().getData().get(0);
            assertEquals("Tolkien", exported.get(resource.getColumnHeaders().indexOf("author")));
            assertEquals("15/01/2020", exported.get(resource.getColumnHeaders().indexOf("published")));
        }

        @Test
        @DisplayName("Column order moves named fields to the front")
        void columnOrderApplied() {
            ModelResource<Book> resource = resource(ResourceOptions.builder()
                    .columnOrder("price", "name").build());

            assertEquals(List.of("price", "name", "id", "author", "published", "available", "categories"),
                    resource.getColumnHeaders());
        }

        @Test
        @DisplayName("forStore exposes every attribute")
        void forStore() {
            assertEquals(7, ModelResource.forStore(catalog.books).getFields().size());
        }
    }

    // ======================================================================
    // VALIDATION
    // ======================================================================

    @Nested
    @DisplayName("Construction-time validation")
    class ValidationTests {

        @Test
        @DisplayName("Unknown import id field is rejected")
        void unknownImportId() {
            ResourceOptions options = ResourceOptions.builder().importIdFields("isbn").build();
            assertThrows(IllegalArgumentException.class, () -> resource(options));
        }

        @Test
        @DisplayName("Import id field must exist after filtering")
        void excludedImportId() {
            ResourceOptions options = ResourceOptions.builder().exclude("id").build();
            assertThrows(IllegalArgumentException.class, () -> resource(options));
        }

        @Test
        @DisplayName("Computed field cannot identify rows")
        void computedImportId() {
            FieldSet<Book> declared = FieldSet.<Book>builder()
                    .field("slug", Field.computed(Book::getName, new CharWidget()))
                    .build();
            ResourceOptions options = ResourceOptions.builder().importIdFields("slug").build();
            assertThrows(IllegalArgumentException.class, () -> resource(options, declared));
        }

        @Test
        @DisplayName("Unknown column order entry is rejected")
        void unknownColumnOrder() {
            ResourceOptions options = ResourceOptions.builder().columnOrder("isbn").build();
            assertThrows(IllegalArgumentException.class, () -> resource(options));
        }

        @Test
        @DisplayName("Repeated column order entry is rejected")
        void repeatedColumnOrder() {
            ResourceOptions options = ResourceOptions.builder().columnOrder("price", "name", "price").build();
            assertThrows(IllegalArgumentException.class, () -> resource(options));
        }

        @Test
        @DisplayName("Hooks for undeclared fields are rejected")
        void unknownHook() {
            FieldSet<Book> declared = FieldSet.<Book>builder()
                    .exporter("isbn", Book::getName)
                    .build();
            assertThrows(IllegalArgumentException.class, () -> resource(ResourceOptions.defaults(), declared));
        }

        @Test
        @DisplayName("Dotted path through a scalar attribute is rejected")
        void invalidPath() {
            ResourceOptions options = ResourceOptions.builder().fields("id", "name.length").build();
            assertThrows(IllegalArgumentException.class, () -> resource(options));
        }

        @Test
        @DisplayName("Unknown widget argument is rejected")
        void unknownWidgetArgument() {
            ResourceOptions options = ResourceOptions.builder()
                    .widget("price", Map.of("precision", 2)).build();
            assertThrows(IllegalArgumentException.class, () -> resource(options));
        }
    }

    // ======================================================================
    // OPTIONS
    // ======================================================================

    @Nested
    @DisplayName("ResourceOptions")
    class OptionsTests {

        @Test
        @DisplayName("Defaults match the documented values")
        void defaults() {
            ResourceOptions options = ResourceOptions.defaults();

            assertNull(options.getFields());
            assertTrue(options.getExclude().isEmpty());
            assertEquals(List.of("id"), options.getImportIdFields());
            assertEquals(TransactionMode.INHERIT, options.getUseTransactions());
            assertFalse(options.isSkipUnchanged());
            assertTrue(options.isReportSkipped());
            assertTrue(options.getColumnOrder().isEmpty());
            assertEquals(InstanceLoaderType.MODEL, options.getInstanceLoader());
            assertEquals(Map.of(), options.getWidgetArgs("anything"));
        }

        @Test
        @DisplayName("An empty import id list is rejected")
        void emptyImportIds() {
            assertThrows(IllegalArgumentException.class, () -> ResourceOptions.builder().importIdFields());
        }

        @Test
        @DisplayName("Built options cannot be changed")
        void immutable() {
            ResourceOptions options = ResourceOptions.builder()
                    .exclude("price")
                    .widget("published", Map.of(WidgetFactory.ARG_FORMAT, "dd/MM/yyyy"))
                    .build();

            assertThrows(UnsupportedOperationException.class, () -> options.getExclude().add("name"));
            assertThrows(UnsupportedOperationException.class,
                    () -> options.getWidgetArgs("published").put("field", "x"));
        }
    }
}
