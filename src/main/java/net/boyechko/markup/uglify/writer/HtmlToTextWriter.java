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
package net.boyechko.markup.uglify.writer;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;
import net.boyechko.markup.uglify.ast.html.HtmlCData;
import net.boyechko.markup.uglify.ast.html.HtmlComment;
import net.boyechko.markup.uglify.ast.html.HtmlDoctype;
import net.boyechko.markup.uglify.ast.html.HtmlElement;
import net.boyechko.markup.uglify.ast.html.HtmlRaw;

/**
 * Extracts human-readable text from an HTML tree. Only content inside {@code <body>} is written.
 * Block-level and list-item end tags become line breaks; comments, CDATA, DOCTYPE and raw
 * script/style content never produce output.
 */
public class HtmlToTextWriter extends HtmlWriterBase {
    private static final Pattern CONTROL_WHITESPACE = Pattern.compile("[\r\n\t\f]+");

    private final boolean keepStructure;
    private final boolean keepFormatting;
    private final boolean keepHtmlEscape;

    private boolean outputEnabled;

    public HtmlToTextWriter(Appendable out) {
        this(out, EnumSet.noneOf(HtmlToTextOption.class));
    }

    /**
     * @param out the sink to append text to
     * @param options the output toggles; null means none
     * @throws IllegalArgumentException if {@code out} is null
     */
    public HtmlToTextWriter(Appendable out, Set<HtmlToTextOption> options) {
        super(out);
        Set<HtmlToTextOption> opts = options != null ? options : Set.of();
        this.keepStructure = opts.contains(HtmlToTextOption.KEEP_STRUCTURE);
        this.keepFormatting = opts.contains(HtmlToTextOption.KEEP_FORMATTING);
        this.keepHtmlEscape = opts.contains(HtmlToTextOption.KEEP_HTML_ESCAPE);
    }

    @Override
    protected void write(String text) {
        if (!outputEnabled) {
            return;
        }
        if (!keepStructure) {
            text = CONTROL_WHITESPACE.matcher(text).replaceAll(" ");
        }
        if (keepFormatting || !keepHtmlEscape) {
            text = text.replace("&lt;", "<").replace("&gt;", ">").replace("&amp;", "&");
        }
        super.write(text);
    }

    @Override
    protected void write(char c) {
        if (!outputEnabled) {
            return;
        }
        super.write(keepStructure || !isSpace(c) ? c : ' ');
    }

    @Override
    protected void writeCData(HtmlCData node) {}

    @Override
    protected void writeComment(HtmlComment node) {}

    @Override
    protected void writeDoctype(HtmlDoctype node) {}

    @Override
    protected void writeRaw(HtmlRaw node) {}

    @Override
    protected void writeStartTag(HtmlElement node) {
        if (node.hasName("body")) {
            outputEnabled = true;
        } else if (keepFormatting && node.isPhrasing()) {
            super.writeStartTag(node);
        } else if (node.descriptor() != null && node.hasName("br")) {
            // Without KEEP_STRUCTURE this comes out as a space.
            write('\n');
        }
    }

    @Override
    protected void writeEndTag(HtmlElement node) {
        if (!node.isPhrasing() || node.hasName("li")) {
            write('\n');
        }

        if (node.hasName("body")) {
            outputEnabled = false;
        } else if (keepFormatting && node.isPhrasing()) {
            super.writeEndTag(node);
        }
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }
}
