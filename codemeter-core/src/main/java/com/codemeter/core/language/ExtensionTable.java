package com.codemeter.core.language;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table of {@link ExtensionMapping}s.
 *
 * <p>The default table is data, not code: it is read from the classpath resource
 * {@value #DEFAULT_RESOURCE} with Jackson YAML. Entry order matters, because the resolver keeps
 * the first entry when two keys fold to the same lower-case form.
 *
 * <p><b>Resource format:</b>
 * <pre>{@code
 * extensions:
 *   - { extension: ".java", language: "Java" }
 *   - { extension: ".CMakeLists.txt", language: "CMake" }
 * }</pre>
 */
public final class ExtensionTable {

    private static final Logger log = LoggerFactory.getLogger(ExtensionTable.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Classpath location of the built-in extension table.
     */
    public static final String DEFAULT_RESOURCE = "/extensions.yaml";

    private static volatile ExtensionTable defaultTable;

    private final List<ExtensionMapping> mappings;

    private ExtensionTable(List<ExtensionMapping> mappings) {
        this.mappings = Collections.unmodifiableList(mappings);
    }

    /**
     * Builds a table from extension/language pairs, preserving iteration order.
     *
     * @param extensionToLanguage ordered extension key to language map
     * @return new table
     */
    public static ExtensionTable of(Map<String, String> extensionToLanguage) {
        List<ExtensionMapping> mappings = new ArrayList<>(extensionToLanguage.size());
        extensionToLanguage.forEach((extension, language) ->
            mappings.add(new ExtensionMapping(mappings.size(), extension, language)));
        return new ExtensionTable(mappings);
    }

    /**
     * Builds a table from a list of {@code {extension, language}} pairs. Unlike
     * {@link #of(Map)} this keeps duplicate keys, which is how collisions are expressed.
     *
     * @param pairs extension and language pairs, each array of length 2
     * @return new table
     */
    public static ExtensionTable ofPairs(List<String[]> pairs) {
        List<ExtensionMapping> mappings = new ArrayList<>(pairs.size());
        for (String[] pair : pairs) {
            mappings.add(new ExtensionMapping(mappings.size(), pair[0], pair[1]));
        }
        return new ExtensionTable(mappings);
    }

    /**
     * Returns the built-in table, loading it on first use.
     *
     * @return the default table
     * @throws UncheckedIOException if the bundled resource is missing or malformed
     */
    public static ExtensionTable loadDefault() {
        ExtensionTable table = defaultTable;
        if (table == null) {
            synchronized (ExtensionTable.class) {
                table = defaultTable;
                if (table == null) {
                    table = load(DEFAULT_RESOURCE);
                    defaultTable = table;
                }
            }
        }
        return table;
    }

    /**
     * Loads a table from a classpath resource.
     *
     * @param resource absolute classpath resource name
     * @return loaded table
     * @throws UncheckedIOException if the resource is missing or cannot be parsed
     */
    public static ExtensionTable load(String resource) {
        try (InputStream in = ExtensionTable.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Extension table resource not found: " + resource));
            }
            TableDocument document = YAML_MAPPER.readValue(in, TableDocument.class);
            List<ExtensionMapping> mappings = new ArrayList<>();
            if (document.extensions() != null) {
                for (TableEntry entry : document.extensions()) {
                    mappings.add(new ExtensionMapping(mappings.size(), entry.extension(), entry.language()));
                }
            }
            log.debug("Loaded {} extension mappings from {}", mappings.size(), resource);
            return new ExtensionTable(mappings);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load extension table " + resource, e);
        }
    }

    /**
     * Returns all mappings in table order.
     *
     * @return unmodifiable list of mappings
     */
    public List<ExtensionMapping> mappings() {
        return mappings;
    }

    /**
     * Returns the mapping at the given index.
     *
     * @param index table index
     * @return mapping
     */
    public ExtensionMapping get(int index) {
        return mappings.get(index);
    }

    /**
     * Returns the number of entries.
     *
     * @return table size
     */
    public int size() {
        return mappings.size();
    }

    /**
     * Groups the extension keys of every language, in first-seen order.
     *
     * @return language name to its extension keys
     */
    public Map<String, Set<String>> extensionsByLanguage() {
        Map<String, Set<String>> grouped = new LinkedHashMap<>();
        for (ExtensionMapping mapping : mappings) {
            grouped.computeIfAbsent(mapping.language(), k -> new LinkedHashSet<>())
                .add(mapping.extension());
        }
        return grouped;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TableDocument(
        @JsonProperty("extensions") List<TableEntry> extensions
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TableEntry(
        @JsonProperty("extension") String extension,
        @JsonProperty("language") String language
    ) {}
}
