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
package net.boyechko.markup.uglify.ast.script;

import java.util.List;
import net.boyechko.markup.uglify.ast.AstNode;
import net.boyechko.markup.uglify.ast.AstVisitor;
import net.boyechko.markup.uglify.ast.SourceContext;

/** {@code var}, {@code let} or {@code const} declaration of one or more names. */
public final class VariableDeclaration extends AstNode {

    public enum Kind {
        VAR,
        LET,
        CONST
    }

    private final Kind kind;
    private final List<String> names;

    public VariableDeclaration(Kind kind, String... names) {
        this(kind, List.of(names), SourceContext.none());
    }

    public VariableDeclaration(Kind kind, List<String> names, SourceContext context) {
        super(context);
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Declaration must name at least one variable");
        }
        this.kind = kind;
        this.names = List.copyOf(names);
    }

    public Kind kind() {
        return kind;
    }

    public List<String> names() {
        return names;
    }

    @Override
    public boolean isDeclaration() {
        return true;
    }

    @Override
    public boolean introducesBinding() {
        return true;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + String.join(", ", names) + ";";
    }
}
