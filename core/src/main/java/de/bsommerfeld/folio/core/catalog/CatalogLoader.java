package de.bsommerfeld.folio.core.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.folio.core.domain.Entry;
import de.bsommerfeld.folio.core.domain.EntryLink;
import de.bsommerfeld.folio.core.domain.LinkKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a {@link CatalogStore} from the JSON catalog shipped on the
 * classpath. The document has two arrays, {@code projects} (filterable) and
 * {@code credentials} (static section):
 *
 * <pre>
 * {
 *   "projects": [
 *     { "title": "...", "year": "2025", "summary": "...", "details": "...",
 *       "tags": ["Java", "MVC"], "primary-tag": "Java",
 *       "links": [ { "label": "Details", "kind": "detail" },
 *                  { "label": "GitHub", "kind": "external", "target": "https://..." } ] }
 *   ],
 *   "credentials": [ ... same shape ... ]
 * }
 * </pre>
 *
 * Loading happens once at startup. Any structural problem is fatal and
 * surfaces as {@link CatalogException}.
 */
public final class CatalogLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogLoader.class);

    public static final String DEFAULT_RESOURCE = "catalog.json";

    private final ObjectMapper mapper;

    public CatalogLoader() {
        this(new ObjectMapper());
    }

    public CatalogLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public CatalogStore loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * Reads the catalog from a classpath resource.
     *
     * @throws CatalogException if the resource is missing or malformed
     */
    public CatalogStore loadResource(String resource) {
        try (InputStream in = CatalogLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new CatalogException("Catalog resource not found: " + resource);
            }
            CatalogStore store = parse(mapper.readTree(in));
            LOG.info("Loaded catalog '{}': {} entries, {} credentials, {} tags",
                    resource, store.size(), store.credentials().size(), store.tagIndex().size());
            return store;
        } catch (IOException e) {
            throw new CatalogException("Failed to read catalog resource: " + resource, e);
        }
    }

    CatalogStore parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new CatalogException("Catalog root must be a JSON object");
        }
        List<Entry> projects = parseEntries(root.path("projects"), "projects");
        List<Entry> credentials = parseEntries(root.path("credentials"), "credentials");
        return new CatalogStore(projects, credentials);
    }

    private List<Entry> parseEntries(JsonNode array, String section) {
        List<Entry> entries = new ArrayList<>();
        if (array.isMissingNode() || array.isNull()) {
            return entries;
        }
        if (!array.isArray()) {
            throw new CatalogException("Catalog section '" + section + "' must be an array");
        }
        int index = 0;
        for (JsonNode node : array) {
            entries.add(parseEntry(node, section, index++));
        }
        return entries;
    }

    private Entry parseEntry(JsonNode node, String section, int index) {
        String title = node.path("title").asText(null);
        if (title == null || title.isBlank()) {
            throw new CatalogException("Entry " + section + "[" + index + "] has no title");
        }

        Set<String> tags = new LinkedHashSet<>();
        for (JsonNode tag : node.path("tags")) {
            tags.add(tag.asText());
        }

        List<EntryLink> links = new ArrayList<>();
        for (JsonNode link : node.path("links")) {
            links.add(parseLink(link, title));
        }

        return new Entry(
                title,
                node.path("year").asText(""),
                node.path("summary").asText(""),
                node.path("details").asText(""),
                tags,
                node.path("primary-tag").asText(null),
                links);
    }

    private EntryLink parseLink(JsonNode node, String owner) {
        try {
            return new EntryLink(
                    node.path("label").asText(""),
                    LinkKind.fromCatalogName(node.path("kind").asText(null)),
                    node.path("target").asText(null));
        } catch (IllegalArgumentException e) {
            throw new CatalogException("Invalid link on entry '" + owner + "': " + e.getMessage(), e);
        }
    }
}
