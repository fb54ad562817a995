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
package net.boyechko.markup.uglify.parse;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.markup.uglify.ast.AstNode;
import net.boyechko.markup.uglify.ast.AstVisitor;
import net.boyechko.markup.uglify.ast.html.HtmlComment;
import net.boyechko.markup.uglify.ast.html.HtmlDoctype;
import net.boyechko.markup.uglify.ast.html.HtmlDocument;
import net.boyechko.markup.uglify.ast.html.HtmlElement;
import net.boyechko.markup.uglify.ast.html.HtmlRaw;
import net.boyechko.markup.uglify.ast.html.HtmlText;
import net.boyechko.markup.uglify.schema.TagTable;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for converting jsoup's parse tree into the AST. */
class HtmlTreeBuilderTest {
    private final HtmlTreeBuilder builder = new HtmlTreeBuilder(TagTable.loadDefault());

    /** Collects every node of the tree in document order. */
    private static final class Flattener implements AstVisitor {
        final List<AstNode> nodes = new ArrayList<>();

        @Override
        public void visit(HtmlDocument node) {
            node.acceptChildren(this);
        }

        @Override
        public void visit(HtmlElement node) {
            nodes.add(node);
            node.acceptChildren(this);
        }

        @Override
        public void visit(HtmlText node) {
            nodes.add(node);
        }

        @Override
        public void visit(HtmlComment node) {
            nodes.add(node);
        }

        @Override
        public void visit(HtmlDoctype node) {
            nodes.add(node);
        }

        @Override
        public void visit(HtmlRaw node) {
            nodes.add(node);
        }
    }

    private static List<AstNode> flatten(HtmlDocument doc) {
        Flattener flattener = new Flattener();
        doc.accept(flattener);
        return flattener.nodes;
    }

    private static HtmlElement find(HtmlDocument doc, String name) {
        return flatten(doc).stream()
                .filter(n -> n instanceof HtmlElement e && e.hasName(name))
                .map(HtmlElement.class::cast)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No <" + name + "> in tree"));
    }

    @Test
    void buildsHtmlHeadBodySkeleton() {
        HtmlDocument doc = builder.parse("<html><body>Hello<br>World</body></html>");

        HtmlElement html = (HtmlElement) doc.child(0);
        assertEquals("html", html.name());
        assertEquals("head", ((HtmlElement) html.child(0)).name());
        HtmlElement body = (HtmlElement) html.child(1);
        assertEquals("body", body.name());
        assertEquals(3, body.childCount());
        assertEquals("Hello", ((HtmlText) body.child(0)).text());
        assertTrue(((HtmlElement) body.child(1)).isSelfClosing());
    }

    @Test
    void resolvesDescriptorsFromTable() {
        HtmlDocument doc = builder.parse("<p><em>x</em><my-widget>y</my-widget></p>");

        assertTrue(find(doc, "em").isPhrasing());
        assertNotNull(find(doc, "p").descriptor());
        assertNull(find(doc, "my-widget").descriptor());
    }

    @Test
    void mapsScriptStyleCommentAndDoctype() {
        HtmlDocument doc =
                builder.parse(
                        "<!DOCTYPE html><html><head><style>p{}</style></head>"
                                + "<body><!-- note --><script>a < b</script></body></html>");

        assertInstanceOf(HtmlDoctype.class, doc.child(0));
        assertTrue(((HtmlDoctype) doc.child(0)).declaration().toLowerCase().startsWith("doctype"));

        HtmlElement style = find(doc, "style");
        assertEquals("p{}", ((HtmlRaw) style.child(0)).content());
        HtmlElement script = find(doc, "script");
        assertEquals("a < b", ((HtmlRaw) script.child(0)).content());

        HtmlComment comment =
                flatten(doc).stream()
                        .filter(HtmlComment.class::isInstance)
                        .map(HtmlComment.class::cast)
                        .findFirst()
                        .orElseThrow();
        assertEquals(" note ", comment.comment());
    }

    @Test
    void keepsAttributesInOrder() {
        HtmlDocument doc = builder.parse("<input type=checkbox checked name=\"a&amp;b\">");

        HtmlElement input = find(doc, "input");
        assertEquals(3, input.attributes().size());
        assertEquals("type", input.attributes().get(0).name());
        assertTrue(input.attributes().get(1).isBoolean());
        assertEquals("a&b", input.attributes().get(2).value());
    }

    @Test
    void textKeepsEscapedForm() {
        HtmlDocument doc = builder.parse("<p>&lt;b&gt; &amp; 1 &lt; 2</p>");

        String text = ((HtmlText) find(doc, "p").child(0)).text();
        assertTrue(text.contains("&lt;b"), "Escapes should survive: " + text);
        assertEquals("<b> & 1 < 2", Parser.unescapeEntities(text, false));
    }

    @Test
    void escapeTextCoversMarkupCharacters() {
        assertEquals("a &lt;b&gt; &amp;amp;", HtmlTreeBuilder.escapeText("a <b> &amp;"));
    }

    @Test
    void recordsSourceNameAndPosition(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("page.html");
        Files.writeString(file, "<html><body>\n<p>x</p></body></html>");

        HtmlDocument doc = builder.parse(file);

        HtmlElement p = find(doc, "p");
        assertEquals(file.toString(), p.context().sourceName());
        if (p.context().isKnown()) {
            assertEquals(2, p.context().line());
        }
    }

    @Test
    void rejectsNullInput() {
        assertThrows(IllegalArgumentException.class, () -> builder.parse((String) null));
        assertThrows(IllegalArgumentException.class, () -> new HtmlTreeBuilder(null));
    }
}
