/*
 * Markup-Uglify - HTML Minification and Text Extraction
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.markup.uglify.schema;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Element metadata table, loaded from YAML. Each entry under {@code tags} lists the content
 * categories of one element name and whether it is a void (self-closing) element.
 */
public final class TagTable {
    private static final String DEFAULT_TABLE_RESOURCE = "/html-tags.yaml";
    private static final Logger logger = LoggerFactory.getLogger(TagTable.class);

    public Map<String, Entry> tags;

    private Map<String, TagDescriptor> descriptors;

    public static final class Entry {
        public Set<String> categories;

        /** Void element: never has children or an end tag. */
        public boolean self_closing;
    }

    public TagTable() {
        this.tags = new HashMap<>();
    }

    /** Returns the descriptor for {@code name} (case-insensitive), or null for unknown tags. */
    public TagDescriptor descriptorFor(String name) {
        if (name == null) {
            return null;
        }
        return descriptors().get(name.toLowerCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return descriptorFor(name) != null;
    }

    public int size() {
        return tags.size();
    }

    /**
     * Load TagTable from classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static TagTable fromResource(String resourcePath) {
        try (var inputStream = TagTable.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(TagTable.class, new LoaderOptions()));
            TagTable table = yaml.load(inputStream);
            if (table == null || table.tags == null) {
                throw new IllegalArgumentException("No tags defined in " + resourcePath);
            }

            logger.debug("Loaded TagTable with {} tags from resource {}", table.size(), resourcePath);

            var warnings = table.validate();
            if (!warnings.isEmpty()) {
                logger.warn(
                        "Tag table loaded from {} has {} warnings:", resourcePath, warnings.size());
                for (String warning : warnings) {
                    logger.warn("  - {}", warning);
                }
            }

            return table;
        } catch (Exception e) {
            logger.error(
                    "Failed to load TagTable from resource {}: {}", resourcePath, e.getMessage());
            throw new RuntimeException(
                    "Failed to load tag table from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Load default table from standard location */
    public static TagTable loadDefault() {
        return fromResource(DEFAULT_TABLE_RESOURCE);
    }

    /** A table with just enough entries for text extraction of simple documents. */
    public static TagTable minimal() {
        TagTable t = new TagTable();
        t.put("html", false);
        t.put("head", false, "METADATA");
        t.put("body", false, "SECTIONING");
        t.put("p", false, "FLOW");
        t.put("div", false, "FLOW");
        t.put("ul", false, "FLOW");
        t.put("li", false);
        t.put("span", false, "FLOW", "PHRASING");
        t.put("b", false, "FLOW", "PHRASING");
        t.put("em", false, "FLOW", "PHRASING");
        t.put("a", false, "FLOW", "PHRASING", "INTERACTIVE");
        t.put("br", true, "FLOW", "PHRASING");
        t.put("img", true, "FLOW", "PHRASING", "EMBEDDED");
        t.put("script", false, "METADATA", "FLOW", "PHRASING", "RAW_TEXT");
        t.put("style", false, "METADATA", "RAW_TEXT");
        t.put("pre", false, "FLOW", "PREFORMATTED");
        return t;
    }

    private void put(String name, boolean selfClosing, String... categories) {
        Entry entry = new Entry();
        entry.categories = Set.of(categories);
        entry.self_closing = selfClosing;
        tags.put(name, entry);
        descriptors = null;
    }

    /**
     * Checks every entry and returns a warning for each category name that is not a known {@link
     * ContentKind}, and for void elements declared with raw-text content.
     */
    public List<String> validate() {
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, Entry> e : tags.entrySet()) {
            Entry entry = e.getValue();
            if (entry == null || entry.categories == null) {
                continue;
            }
            for (String category : entry.categories) {
                if (parseKind(category) == null) {
                    warnings.add(
                            String.format(
                                    "Tag '%s' has unknown category '%s'", e.getKey(), category));
                }
            }
            if (entry.self_closing && entry.categories.contains(ContentKind.RAW_TEXT.name())) {
                warnings.add(
                        String.format(
                                "Tag '%s' is self-closing but declares raw text content",
                                e.getKey()));
            }
        }
        return warnings;
    }

    private Map<String, TagDescriptor> descriptors() {
        if (descriptors == null) {
            Map<String, TagDescriptor> built = new HashMap<>();
            for (Map.Entry<String, Entry> e : tags.entrySet()) {
                String name = e.getKey().toLowerCase(Locale.ROOT);
                Entry entry = e.getValue();
                Set<ContentKind> kinds = EnumSet.noneOf(ContentKind.class);
                boolean selfClosing = false;
                if (entry != null) {
                    selfClosing = entry.self_closing;
                    if (entry.categories != null) {
                        for (String category : entry.categories) {
                            ContentKind kind = parseKind(category);
                            if (kind != null) {
                                kinds.add(kind);
                            }
                        }
                    }
                }
                built.put(name, new TagDescriptor(name, kinds, selfClosing));
            }
            descriptors = built;
        }
        return descriptors;
    }

    private static ContentKind parseKind(String category) {
        if (category == null) {
            return null;
        }
        try {
            return ContentKind.valueOf(category.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
