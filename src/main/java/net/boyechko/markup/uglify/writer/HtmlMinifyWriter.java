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

import java.util.regex.Pattern;
import net.boyechko.markup.uglify.ast.html.HtmlCData;
import net.boyechko.markup.uglify.ast.html.HtmlComment;
import net.boyechko.markup.uglify.ast.html.HtmlDoctype;
import net.boyechko.markup.uglify.ast.html.HtmlElement;
import net.boyechko.markup.uglify.ast.html.HtmlRaw;
import net.boyechko.markup.uglify.ast.html.HtmlText;
import net.boyechko.markup.uglify.schema.ContentKind;

/** Writes the tree back as markup, dropping what {@link HtmlMinifySettings} allows. */
public class HtmlMinifyWriter extends HtmlWriterBase {
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private final HtmlMinifySettings settings;

    /** Nesting depth of elements whose whitespace is significant. */
    private int preserveDepth;

    public HtmlMinifyWriter(Appendable out) {
        this(out, HtmlMinifySettings.defaults());
    }

    public HtmlMinifyWriter(Appendable out, HtmlMinifySettings settings) {
        super(out);
        this.settings = settings != null ? settings : HtmlMinifySettings.defaults();
    }

    @Override
    protected void writeStartTag(HtmlElement node) {
        if (preservesWhitespace(node)) {
            preserveDepth++;
        }
        super.writeStartTag(node);
    }

    @Override
    protected void writeEndTag(HtmlElement node) {
        super.writeEndTag(node);
        if (preservesWhitespace(node)) {
            preserveDepth--;
        }
    }

    @Override
    protected void writeText(HtmlText node) {
        if (settings.collapseWhitespace() && preserveDepth == 0) {
            write(WHITESPACE_RUN.matcher(node.text()).replaceAll(" "));
        } else {
            write(node.text());
        }
    }

    @Override
    protected void writeComment(HtmlComment node) {
        if (settings.removeComments() && !node.isImportant()) {
            return;
        }
        write("<!--");
        write(node.comment());
        write("-->");
    }

    @Override
    protected void writeCData(HtmlCData node) {
        write("<![CDATA[");
        write(node.data());
        write("]]>");
    }

    @Override
    protected void writeDoctype(HtmlDoctype node) {
        write("<!");
        write(node.declaration());
        write('>');
    }

    @Override
    protected void writeRaw(HtmlRaw node) {
        write(node.content());
    }

    private static boolean preservesWhitespace(HtmlElement node) {
        return node.descriptor() != null
                && (node.descriptor().is(ContentKind.PREFORMATTED)
                        || node.descriptor().is(ContentKind.RAW_TEXT));
    }
}
