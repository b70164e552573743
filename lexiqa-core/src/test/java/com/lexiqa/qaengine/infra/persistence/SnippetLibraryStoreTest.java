package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.exceptions.DocumentParseException;
import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import com.lexiqa.qaengine.api.model.SnippetCategory;
import com.lexiqa.qaengine.api.model.SnippetEntry;
import com.lexiqa.qaengine.api.model.SnippetLibrary;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnippetLibraryStoreTest {

    @TempDir
    Path tempDir;

    private Path libraryPath;
    private SnippetLibraryStore store;

    @BeforeEach
    void setUp() {
        libraryPath = tempDir.resolve("user").resolve("library.xml");
        store = new SnippetLibraryStore(libraryPath, OpenTelemetry.noop().getTracer("test"));
    }

    private Path copyFixture() throws Exception {
        Path target = tempDir.resolve("imported.xml");
        try (InputStream in = getClass().getResourceAsStream("/fixtures/library.xml")) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    @Test
    @DisplayName("Should start from the default categories when no library exists")
    void shouldReturnDefaultsWhenMissing() throws Exception {
        SnippetLibrary library = store.load();

        assertThat(library.categoryNames()).containsExactlyElementsOf(SnippetLibrary.DEFAULT_CATEGORY_NAMES);
        assertThat(library.size()).isZero();
        assertThat(Files.exists(libraryPath)).isFalse();
    }

    @Test
    void shouldSaveAndReloadFromDefaultLocation() throws Exception {
        SnippetLibrary library = SnippetLibrary.defaults()
                .withEntry("Spesialtegn", new SnippetEntry("nbsp", "No-break space", "", "(\\d) (kr)", "$1 $2", null));

        store.save(library);

        assertThat(Files.exists(libraryPath)).isTrue();
        assertThat(store.load()).isEqualTo(library);
    }

    @Test
    void shouldAssignIdsToEntriesWithoutOne() throws Exception {
        SnippetLibrary library = store.importFrom(copyFixture());

        SnippetEntry doublePeriod = library.findByName("Double period").orElseThrow();
        assertThat(doublePeriod.id()).isNotBlank().hasSize(36);
        assertThat(library.findById("quotes")).isPresent();
    }

    @Test
    @DisplayName("Should keep duplicate categories separate and in document order")
    void shouldKeepDuplicateCategories() throws Exception {
        SnippetLibrary library = store.importFrom(copyFixture());

        assertThat(library.categoryNames())
                .containsExactly("Tegnsetting", "Tegnsetting", SnippetLibrary.UNCATEGORIZED);
        assertThat(library.categories().get(0).entries()).hasSize(2);
        assertThat(library.categories().get(1).entries()).extracting(SnippetEntry::id).containsExactly("ellipsis");
        assertThat(library.entriesIn("Tegnsetting")).hasSize(3);
    }

    @Test
    void shouldCollectNamelessAndOrphanEntriesAsUncategorized() throws Exception {
        SnippetLibrary library = store.importFrom(copyFixture());

        SnippetCategory uncategorized = library.categories().get(2);
        assertThat(uncategorized.entries()).extracting(SnippetEntry::id).containsExactly("nameless", "orphan");
        assertThat(uncategorized.entries()).allSatisfy(e ->
                assertThat(e.category()).isEqualTo(SnippetLibrary.UNCATEGORIZED));
    }

    @Test
    void shouldReadEntryFieldsVerbatim() throws Exception {
        SnippetEntry quotes = store.importFrom(copyFixture()).findById("quotes").orElseThrow();

        assertThat(quotes.description()).isEqualTo("Convert \"x\" to «x»");
        assertThat(quotes.pattern()).isEqualTo("\"([^\"]+)\"");
        assertThat(quotes.replacement()).isEqualTo("«\\1»");
        assertThat(quotes.category()).isEqualTo("Tegnsetting");
    }

    @Test
    void shouldNotTouchDefaultLocationOnImport() throws Exception {
        store.importFrom(copyFixture());

        assertThat(Files.exists(libraryPath)).isFalse();
    }

    @Test
    void shouldFailImportOfMissingFile() {
        assertThatThrownBy(() -> store.importFrom(tempDir.resolve("nope.xml")))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("nope.xml");
    }

    @Test
    void shouldFailOnMalformedLibrary() throws Exception {
        Path broken = tempDir.resolve("broken.xml");
        Files.writeString(broken, "<regex-library><category name=\"a\"></regex-library>");

        assertThatThrownBy(() -> store.importFrom(broken)).isInstanceOf(DocumentParseException.class);
    }

    @Test
    void shouldExportWithIdsAndReimportUnchanged() throws Exception {
        SnippetLibrary imported = store.importFrom(copyFixture());
        Path exported = tempDir.resolve("out").resolve("exported.xml");

        store.exportTo(imported, exported);

        String xml = Files.readString(exported);
        assertThat(xml).contains("<entry id=\"" + imported.findByName("Double period").orElseThrow().id() + "\">");
        assertThat(store.importFrom(exported)).isEqualTo(imported);
    }

    @Test
    void shouldWriteEmptyCategories() {
        String xml = new SnippetLibraryWriter().toXml(new SnippetLibrary(List.of(SnippetCategory.empty("A & B"))));

        assertThat(xml).contains("<category name=\"A &amp; B\"/>");
    }

    @Test
    @DisplayName("Entries belong to their nearest enclosing category, also when categories nest")
    void shouldAssignEntriesToNearestCategory() throws Exception {
        Path nested = tempDir.resolve("nested.xml");
        Files.writeString(nested, """
                <regex-library>
                  <category name="A">
                    <category name="B">
                      <entry id="1"><name>inner</name><pattern>x</pattern></entry>
                    </category>
                    <entry id="2"><name>outer</name><pattern>y</pattern></entry>
                  </category>
                </regex-library>
                """);

        SnippetLibrary library = store.importFrom(nested);

        assertThat(library.categoryNames()).containsExactly("A", "B");
        assertThat(library.entriesIn("A")).extracting(SnippetEntry::id).containsExactly("2");
        assertThat(library.entriesIn("B")).extracting(SnippetEntry::id).containsExactly("1");
        assertThat(library.findById("2").orElseThrow().category()).isEqualTo("A");
        assertThat(library.findById("1").orElseThrow().category()).isEqualTo("B");
    }

    @Test
    void shouldSkipUnknownElementsInsideEntries() throws Exception {
        Path extended = tempDir.resolve("extended.xml");
        Files.writeString(extended, """
                <regex-library>
                  <category name="A">
                    <entry id="1">
                      <tags><name>not the entry name</name></tags>
                      <name>real</name>
                      <pattern>x</pattern>
                    </entry>
                  </category>
                </regex-library>
                """);

        SnippetEntry entry = store.importFrom(extended).findById("1").orElseThrow();

        assertThat(entry.name()).isEqualTo("real");
        assertThat(entry.pattern()).isEqualTo("x");
    }

    @Test
    void shouldRefuseToSaveCharactersXmlCannotHold() {
        SnippetLibrary library = SnippetLibrary.empty()
                .withEntry("A", new SnippetEntry("1", "bell\u0007", "", "x", "", "A"));

        assertThatThrownBy(() -> store.save(library))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name")
                .hasMessageContaining("U+0007");
        assertThat(libraryPath).doesNotExist();
    }

    @Test
    void shouldKeepLineBreaksInCategoryNames() throws Exception {
        SnippetLibrary library = new SnippetLibrary(List.of(SnippetCategory.empty("two\nlines\tand tab")));

        store.save(library);

        assertThat(store.load().categoryNames()).containsExactly("two\nlines\tand tab");
    }
}
