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

import java.io.IOException;
import java.io.UncheckedIOException;
import net.boyechko.markup.uglify.ast.AstNode;
import net.boyechko.markup.uglify.ast.AstVisitor;
import net.boyechko.markup.uglify.ast.html.HtmlAttribute;
import net.boyechko.markup.uglify.ast.html.HtmlCData;
import net.boyechko.markup.uglify.ast.html.HtmlComment;
import net.boyechko.markup.uglify.ast.html.HtmlDoctype;
import net.boyechko.markup.uglify.ast.html.HtmlDocument;
import net.boyechko.markup.uglify.ast.html.HtmlElement;
import net.boyechko.markup.uglify.ast.html.HtmlRaw;
import net.boyechko.markup.uglify.ast.html.HtmlText;

/**
 * Serializes an HTML tree to a character sink. The traversal is fixed: for each element the
 * start tag hook runs, then the children in document order, then the end tag hook. Subclasses
 * express an output policy by overriding the hooks and the two {@code write} primitives, through
 * which every character of output passes.
 *
 * <p>A writer keeps per-document state and must not be shared between documents or threads.
 */
public abstract class HtmlWriterBase implements AstVisitor {
    private final Appendable out;

    protected HtmlWriterBase(Appendable out) {
        if (out == null) {
            throw new IllegalArgumentException("Output sink must not be null");
        }
        this.out = out;
    }

    /** Writes {@code root} and everything below it. */
    public final void render(AstNode root) {
        root.accept(this);
    }

    // ── Traversal ───────────────────────────────────────────────────

    @Override
    public final void visit(HtmlDocument node) {
        node.acceptChildren(this);
    }

    @Override
    public final void visit(HtmlElement node) {
        writeStartTag(node);
        node.acceptChildren(this);
        writeEndTag(node);
    }

    @Override
    public final void visit(HtmlText node) {
        writeText(node);
    }

    @Override
    public final void visit(HtmlComment node) {
        writeComment(node);
    }

    @Override
    public final void visit(HtmlCData node) {
        writeCData(node);
    }

    @Override
    public final void visit(HtmlDoctype node) {
        writeDoctype(node);
    }

    @Override
    public final void visit(HtmlRaw node) {
        writeRaw(node);
    }

    // ── Policy hooks ────────────────────────────────────────────────

    protected void writeStartTag(HtmlElement node) {
        write('<');
        write(node.name());
        for (HtmlAttribute attribute : node.attributes()) {
            write(' ');
            write(attribute.name());
            if (!attribute.isBoolean()) {
                write("=\"");
                write(escapeAttribute(attribute.value()));
                write('"');
            }
        }
        write('>');
    }

    /** Attribute values are stored decoded; {@code &} goes first so existing entities stay literal. */
    static String escapeAttribute(String value) {
        return value.replace("&", "&amp;").replace("\"", "&quot;");
    }

    /** Void elements have no end tag. */
    protected void writeEndTag(HtmlElement node) {
        if (node.isSelfClosing()) {
            return;
        }
        write("</");
        write(node.name());
        write('>');
    }

    protected void writeText(HtmlText node) {
        write(node.text());
    }

    protected void writeComment(HtmlComment node) {}

    protected void writeCData(HtmlCData node) {}

    protected void writeDoctype(HtmlDoctype node) {}

    protected void writeRaw(HtmlRaw node) {}

    // ── Output primitives ───────────────────────────────────────────

    protected void write(String text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write to output", e);
        }
    }

    protected void write(char c) {
        try {
            out.append(c);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write to output", e);
        }
    }
}
