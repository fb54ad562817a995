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

import net.boyechko.markup.uglify.ast.AstVisitor;
import net.boyechko.markup.uglify.ast.SourceContext;

public final class ThrowStatement extends JumpStatement {
    private final String operand; // may be null

    public ThrowStatement() {
        this(null, SourceContext.none());
    }

    public ThrowStatement(String operand, SourceContext context) {
        super(context);
        this.operand = operand;
    }

    public String operand() {
        return operand;
    }

    @Override
    public String keyword() {
        return "throw";
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
