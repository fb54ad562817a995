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

import net.boyechko.markup.uglify.ast.AstNode;
import net.boyechko.markup.uglify.ast.SourceContext;

/**
 * A statement that unconditionally transfers control out of the current statement list. Every
 * later statement in the same block is unreachable.
 */
public abstract class JumpStatement extends AstNode {

    protected JumpStatement(SourceContext context) {
        super(context);
    }

    /** The keyword that introduces the statement. */
    public abstract String keyword();

    @Override
    public String toString() {
        return keyword() + ";";
    }
}
