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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.markup.uglify.ast.AstNode;
import net.boyechko.markup.uglify.ast.ContainerNode;
import net.boyechko.markup.uglify.ast.SourceContext;
import net.boyechko.markup.uglify.ast.html.HtmlCData;
import net.boyechko.markup.uglify.ast.html.HtmlComment;
import net.boyechko.markup.uglify.ast.html.HtmlDoctype;
import net.boyechko.markup.uglify.ast.html.HtmlDocument;
import net.boyechko.markup.uglify.ast.html.HtmlElement;
import net.boyechko.markup.uglify.ast.html.HtmlRaw;
import net.boyechko.markup.uglify.ast.html.HtmlText;
import net.boyechko.markup.uglify.schema.TagTable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.Range;
import org.jsoup.nodes.TextNode;
import org.jsoup.nodes.XmlDeclaration;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses HTML with jsoup and converts the result into the project's AST. Element descriptors are
 * resolved against the {@link TagTable}; text nodes keep their escaped source form.
 */
public class HtmlTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(HtmlTreeBuilder.class);

    private final TagTable tagTable;

    public HtmlTreeBuilder(TagTable tagTable) {
        if (tagTable == null) {
            throw new IllegalArgumentException("Tag table is required");
        }
        this.tagTable = tagTable;
    }

    public HtmlDocument parse(String html) {
        return parse(html, null);
    }

    public HtmlDocument parse(Path path) throws IOException {
        String html = Files.readString(path, StandardCharsets.UTF_8);
        return parse(html, path.toString());
    }

    public HtmlDocument parse(String html, String sourceName) {
        if (html == null) {
            throw new IllegalArgumentException("HTML input is required");
        }
        Parser parser = Parser.htmlParser().setTrackPosition(true);
        Document jsoupDoc = Jsoup.parse(html, "", parser);

        Conversion conversion = new Conversion(html, sourceName);
        HtmlDocument document = new HtmlDocument(new SourceContext(sourceName, 1, 1, ""));
        conversion.convertChildren(jsoupDoc, document);

        logger.debug(
                "Parsed {}: {} elements, {} text nodes ({} re-escaped)",
                sourceName != null ? sourceName : "<input>",
                conversion.elementCount,
                conversion.textCount,
                conversion.reescapedCount);
        return document;
    }

    /** Escapes the characters that cannot appear literally in HTML text. */
    static String escapeText(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /** State of a single conversion; holds the raw input for source slicing. */
    private final class Conversion {
        private final String input;
        private final String sourceName;
        private int elementCount;
        private int textCount;
        private int reescapedCount;

        Conversion(String input, String sourceName) {
            this.input = input;
            this.sourceName = sourceName;
        }

        void convertChildren(Node parent, ContainerNode target) {
            for (Node child : parent.childNodes()) {
                AstNode converted = convert(child);
                if (converted != null) {
                    target.appendChild(converted);
                }
            }
        }

        private AstNode convert(Node node) {
            SourceContext context = contextOf(node);

            // CDataNode extends TextNode, so it has to be matched first.
            if (node instanceof CDataNode cdata) {
                return new HtmlCData(cdata.text(), context);
            }
            if (node instanceof TextNode text) {
                textCount++;
                return new HtmlText(escapedText(text), context);
            }
            if (node instanceof Element element) {
                return convertElement(element, context);
            }
            if (node instanceof Comment comment) {
                return new HtmlComment(comment.getData(), context);
            }
            if (node instanceof DataNode data) {
                return new HtmlRaw(data.getWholeData(), context);
            }
            if (node instanceof DocumentType doctype) {
                String outer = doctype.outerHtml().strip();
                return new HtmlDoctype(outer.substring(2, outer.length() - 1), context);
            }
            if (node instanceof XmlDeclaration declaration) {
                return new HtmlRaw(declaration.outerHtml(), context);
            }
            logger.debug("Skipping unsupported node {} at {}", node.nodeName(), context);
            return null;
        }

        private HtmlElement convertElement(Element element, SourceContext context) {
            elementCount++;
            String name = element.normalName();
            HtmlElement converted = new HtmlElement(name, tagTable.descriptorFor(name), context);
            for (Attribute attribute : element.attributes()) {
                String value = attribute.hasDeclaredValue() ? attribute.getValue() : null;
                converted.addAttribute(attribute.getKey(), value);
            }
            convertChildren(element, converted);
            return converted;
        }

        /**
         * Returns the text as written in the source when jsoup tracked its position and the slice
         * decodes to the same characters; otherwise re-escapes the decoded text.
         */
        private String escapedText(TextNode text) {
            String decoded = text.getWholeText();
            Range range = text.sourceRange();
            if (range.isTracked()) {
                int start = range.startPos();
                int end = range.endPos();
                if (start >= 0 && end <= input.length() && start <= end) {
                    String slice = input.substring(start, end);
                    if (Parser.unescapeEntities(slice, false).equals(decoded)) {
                        return slice;
                    }
                }
            }
            reescapedCount++;
            return escapeText(decoded);
        }

        private SourceContext contextOf(Node node) {
            Range range = node.sourceRange();
            if (!range.isTracked()) {
                return new SourceContext(sourceName, 0, 0, "");
            }
            return new SourceContext(
                    sourceName, range.start().lineNumber(), range.start().columnNumber(), "");
        }
    }
}
