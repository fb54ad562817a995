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

/** Base type of every node in the markup and script trees. */
public abstract class AstNode {
    private final SourceContext context;

    protected AstNode(SourceContext context) {
        this.context = context != null ? context : SourceContext.none();
    }

    public SourceContext context() {
        return context;
    }

    /** Dispatches to the {@code visit} overload of {@code visitor} for this node's kind. */
    public abstract void accept(AstVisitor visitor);

    /**
     * Whether unreachable-code removal must keep this node. Binding declarations report {@code
     * true}, and so does anything else that must survive the pass.
     */
    public boolean isDeclaration() {
        return false;
    }

    /** Whether this node introduces a name into its scope. */
    public boolean introducesBinding() {
        return false;
    }
}
