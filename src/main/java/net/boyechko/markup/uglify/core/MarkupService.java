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
package net.boyechko.markup.uglify.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;
import net.boyechko.markup.uglify.ast.html.HtmlDocument;
import net.boyechko.markup.uglify.ast.script.Block;
import net.boyechko.markup.uglify.optimize.UnreachableCodeRemover;
import net.boyechko.markup.uglify.parse.HtmlTreeBuilder;
import net.boyechko.markup.uglify.schema.TagTable;
import net.boyechko.markup.uglify.writer.HtmlMinifySettings;
import net.boyechko.markup.uglify.writer.HtmlMinifyWriter;
import net.boyechko.markup.uglify.writer.HtmlToTextOption;
import net.boyechko.markup.uglify.writer.HtmlToTextWriter;
import net.boyechko.markup.uglify.writer.HtmlWriterBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Parses documents and writes them out under the configured output policy. */
public class MarkupService {
    private static final Logger logger = LoggerFactory.getLogger(MarkupService.class);

    private final TagTable tagTable;
    private final HtmlTreeBuilder treeBuilder;
    private final OutputMode mode;
    private final Set<HtmlToTextOption> textOptions;
    private final HtmlMinifySettings minifySettings;

    public static class MarkupServiceBuilder {
        private TagTable tagTable;
        private OutputMode mode = OutputMode.MINIFY;
        private final Set<HtmlToTextOption> textOptions = EnumSet.noneOf(HtmlToTextOption.class);
        private HtmlMinifySettings minifySettings = HtmlMinifySettings.defaults();

        public MarkupServiceBuilder withTagTable(TagTable tagTable) {
            this.tagTable = tagTable;
            return this;
        }

        public MarkupServiceBuilder withMode(OutputMode mode) {
            this.mode = mode;
            return this;
        }

        public MarkupServiceBuilder withTextOptions(Set<HtmlToTextOption> options) {
            textOptions.addAll(options);
            return this;
        }

        public MarkupServiceBuilder withMinifySettings(HtmlMinifySettings settings) {
            this.minifySettings = settings;
            return this;
        }

        public MarkupService build() {
            if (mode == null) {
                throw new IllegalStateException(
                        "OutputMode must be provided via withMode(...) before building MarkupService");
            }
            if (minifySettings == null) {
                throw new IllegalStateException("HtmlMinifySettings must not be null");
            }
            if (tagTable == null) {
                tagTable = TagTable.loadDefault();
            }
            return new MarkupService(this);
        }
    }

    private MarkupService(MarkupServiceBuilder builder) {
        this.tagTable = builder.tagTable;
        this.treeBuilder = new HtmlTreeBuilder(tagTable);
        this.mode = builder.mode;
        this.textOptions = Set.copyOf(builder.textOptions);
        this.minifySettings = builder.minifySettings;
    }

    public OutputMode mode() {
        return mode;
    }

    public TagTable tagTable() {
        return tagTable;
    }

    public HtmlDocument parse(String html) {
        return treeBuilder.parse(html);
    }

    /** Transforms {@code html} according to the configured {@link OutputMode}. */
    public String transform(String html) {
        return render(treeBuilder.parse(html));
    }

    public String transform(Path input) throws IOException {
        logger.info("Transforming {} ({})", input, mode);
        return render(treeBuilder.parse(input));
    }

    /** Transforms {@code input} and writes the result to {@code output}, creating parent dirs. */
    public void transform(Path input, Path output) throws IOException {
        String result = transform(input);
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, result, StandardCharsets.UTF_8);
        logger.info("Wrote {} characters to {}", result.length(), output);
    }

    public String render(HtmlDocument document) {
        StringBuilder out = new StringBuilder();
        newWriter(out).render(document);
        return out.toString();
    }

    /** Removes unreachable statements from {@code program}; returns how many were removed. */
    public int removeUnreachableCode(Block program) {
        return new UnreachableCodeRemover().apply(program);
    }

    private HtmlWriterBase newWriter(Appendable out) {
        return switch (mode) {
            case TEXT -> new HtmlToTextWriter(out, textOptions);
            case MINIFY -> new HtmlMinifyWriter(out, minifySettings);
        };
    }
}
