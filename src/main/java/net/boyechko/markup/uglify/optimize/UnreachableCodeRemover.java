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
package net.boyechko.markup.uglify.optimize;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.markup.uglify.ast.AstNode;
import net.boyechko.markup.uglify.ast.AstVisitor;
import net.boyechko.markup.uglify.ast.script.Block;
import net.boyechko.markup.uglify.ast.script.FunctionDeclaration;
import net.boyechko.markup.uglify.ast.script.JumpStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes statements that follow a {@code return}, {@code break}, {@code continue} or {@code
 * throw} in the same block. Nodes reporting {@link AstNode#isDeclaration()} are kept even when
 * unreachable: hoisted declarations still affect the enclosing scope, and important comments
 * must reach the output.
 */
public class UnreachableCodeRemover implements AstVisitor {
    private static final Logger logger = LoggerFactory.getLogger(UnreachableCodeRemover.class);

    private final List<AstNode> removed = new ArrayList<>();

    /** Runs the pass over {@code root} and returns the number of statements removed. */
    public int apply(AstNode root) {
        int before = removed.size();
        root.accept(this);
        int count = removed.size() - before;
        if (count > 0) {
            logger.debug("Removed {} unreachable statement(s)", count);
        }
        return count;
    }

    /** Statements removed so far, in removal order. */
    public List<AstNode> removedStatements() {
        return List.copyOf(removed);
    }

    @Override
    public void visit(Block block) {
        boolean unreachable = false;
        int i = 0;
        while (i < block.childCount()) {
            AstNode statement = block.child(i);
            if (unreachable && !statement.isDeclaration()) {
                logger.trace("Removing unreachable {} at {}", statement, statement.context());
                removed.add(block.removeChild(i));
                continue;
            }
            statement.accept(this);
            if (statement instanceof JumpStatement) {
                unreachable = true;
            }
            i++;
        }
    }

    @Override
    public void visit(FunctionDeclaration node) {
        node.body().accept(this);
    }
}
