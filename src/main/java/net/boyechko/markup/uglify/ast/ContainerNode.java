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
package net.boyechko.markup.uglify.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A node that owns an ordered list of children. */
public abstract class ContainerNode extends AstNode {
    private final List<AstNode> children = new ArrayList<>();

    protected ContainerNode(SourceContext context) {
        super(context);
    }

    public List<AstNode> children() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    public AstNode child(int index) {
        return children.get(index);
    }

    public void appendChild(AstNode child) {
        if (child == null) {
            throw new IllegalArgumentException("Child node must not be null");
        }
        children.add(child);
    }

    public AstNode removeChild(int index) {
        return children.remove(index);
    }

    public void replaceChild(int index, AstNode replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("Replacement node must not be null");
        }
        children.set(index, replacement);
    }

    /** Visits each child in document order. */
    public void acceptChildren(AstVisitor visitor) {
        for (AstNode child : children) {
            child.accept(visitor);
        }
    }
}
