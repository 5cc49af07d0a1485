package com.coderenew.core.knowledge;

import com.coderenew.core.model.DeprecatedItem;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads deprecation catalogues from JSON.
 *
 * <p>The bundled catalogue lives on the classpath at {@value #BUNDLED_CATALOG}.
 */
public final class DeprecationCatalogLoader {

    public static final String BUNDLED_CATALOG = "/wordpress-deprecations.json";

    private static final Logger log = LoggerFactory.getLogger(DeprecationCatalogLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DeprecationCatalogLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * JSON document shape of a catalogue file.
     *
     * @param catalogVersion free-form catalogue revision
     * @param deprecations catalogue entries
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Catalog(
        @JsonProperty("catalog_version") String catalogVersion,
        @JsonProperty("deprecations") List<DeprecatedItem> deprecations
    ) {
        Catalog {
            deprecations = deprecations == null ? List.of() : List.copyOf(deprecations);
        }
    }

    /**
     * Loads the catalogue bundled with the library.
     *
     * @return catalogue entries
     * @throws UncheckedIOException if the resource is missing or unreadable
     */
    public static List<DeprecatedItem> loadBundled() {
        try (InputStream in = DeprecationCatalogLoader.class.getResourceAsStream(BUNDLED_CATALOG)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Bundled catalogue not found: " + BUNDLED_CATALOG));
            }
            return read(in, BUNDLED_CATALOG);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled catalogue", e);
        }
    }

    /**
     * Loads a catalogue file from disk.
     *
     * @param path catalogue JSON file
     * @return catalogue entries
     * @throws IOException if the file cannot be read or parsed
     */
    public static List<DeprecatedItem> load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        }
    }

    private static List<DeprecatedItem> read(InputStream in, String source) throws IOException {
        Catalog catalog = MAPPER.readValue(in, Catalog.class);
        log.debug("Loaded {} deprecation entries from {} (revision {})",
            catalog.deprecations().size(), source, catalog.catalogVersion());
        return catalog.deprecations();
    }
}
