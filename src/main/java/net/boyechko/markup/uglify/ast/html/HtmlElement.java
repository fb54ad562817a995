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
package net.boyechko.markup.uglify.ast.html;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.boyechko.markup.uglify.ast.AstVisitor;
import net.boyechko.markup.uglify.ast.ContainerNode;
import net.boyechko.markup.uglify.ast.SourceContext;
import net.boyechko.markup.uglify.schema.ContentKind;
import net.boyechko.markup.uglify.schema.TagDescriptor;

/**
 * An HTML element. The descriptor comes from the tag table and is null for tags the table does
 * not know; such elements count as non-phrasing and never self-closing.
 */
public final class HtmlElement extends ContainerNode {
    private final String name;
    private final TagDescriptor descriptor; // may be null for custom tags
    private final List<HtmlAttribute> attributes = new ArrayList<>();

    public HtmlElement(String name, TagDescriptor descriptor) {
        this(name, descriptor, SourceContext.none());
    }

    public HtmlElement(String name, TagDescriptor descriptor, SourceContext context) {
        super(context);
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Element name is required");
        }
        this.name = name;
        this.descriptor = descriptor;
    }

    public String name() {
        return name;
    }

    public TagDescriptor descriptor() {
        return descriptor;
    }

    public List<HtmlAttribute> attributes() {
        return Collections.unmodifiableList(attributes);
    }

    public HtmlElement addAttribute(String attrName, String value) {
        attributes.add(new HtmlAttribute(attrName, value));
        return this;
    }

    public boolean hasName(String tagName) {
        return name.equals(tagName);
    }

    public boolean isPhrasing() {
        return descriptor != null && descriptor.is(ContentKind.PHRASING);
    }

    public boolean isSelfClosing() {
        return descriptor != null && descriptor.selfClosing();
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "<" + name + ">";
    }
}
