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

import net.boyechko.markup.uglify.ast.AstNode;
import net.boyechko.markup.uglify.ast.html.HtmlDocument;
import net.boyechko.markup.uglify.ast.html.HtmlElement;
import net.boyechko.markup.uglify.ast.html.HtmlText;
import net.boyechko.markup.uglify.schema.TagTable;

/** Builds small HTML trees by hand for writer tests. */
final class HtmlTrees {
    static final TagTable TAGS = TagTable.loadDefault();

    private HtmlTrees() {}

    static HtmlElement el(String name, AstNode... children) {
        HtmlElement element = new HtmlElement(name, TAGS.descriptorFor(name));
        for (AstNode child : children) {
            element.appendChild(child);
        }
        return element;
    }

    static HtmlText text(String text) {
        return new HtmlText(text);
    }

    /** {@code <html><head><title>Head title</title></head><body>...</body></html>} */
    static HtmlDocument page(AstNode... bodyChildren) {
        HtmlDocument document = new HtmlDocument();
        document.appendChild(
                el("html", el("head", el("title", text("Head title"))), el("body", bodyChildren)));
        return document;
    }
}
