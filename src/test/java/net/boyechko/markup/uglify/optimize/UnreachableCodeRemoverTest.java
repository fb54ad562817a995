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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Stream;
import net.boyechko.markup.uglify.ast.AstNode;
import net.boyechko.markup.uglify.ast.SourceContext;
import net.boyechko.markup.uglify.ast.script.Block;
import net.boyechko.markup.uglify.ast.script.BreakStatement;
import net.boyechko.markup.uglify.ast.script.ContinueStatement;
import net.boyechko.markup.uglify.ast.script.ExpressionStatement;
import net.boyechko.markup.uglify.ast.script.FunctionDeclaration;
import net.boyechko.markup.uglify.ast.script.ImportantComment;
import net.boyechko.markup.uglify.ast.script.JumpStatement;
import net.boyechko.markup.uglify.ast.script.ReturnStatement;
import net.boyechko.markup.uglify.ast.script.ThrowStatement;
import net.boyechko.markup.uglify.ast.script.VariableDeclaration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class UnreachableCodeRemoverTest {

    static Stream<JumpStatement> jumps() {
        return Stream.of(
                new ReturnStatement("x", SourceContext.none()),
                new BreakStatement(),
                new ContinueStatement("outer", SourceContext.none()),
                new ThrowStatement("new Error()", SourceContext.none()));
    }

    private static ImportantComment license() {
        return new ImportantComment(SourceContext.of("/*! Copyright ACME, MIT */"));
    }

    @ParameterizedTest
    @MethodSource("jumps")
    void keepsImportantCommentAfterJump(JumpStatement jump) {
        ImportantComment comment = license();
        ExpressionStatement dead = new ExpressionStatement("cleanup()");
        Block block = Block.of(new ExpressionStatement("work()"), jump, dead, comment);

        int removed = new UnreachableCodeRemover().apply(block);

        assertEquals(1, removed);
        assertEquals(3, block.childCount());
        assertSame(jump, block.child(1));
        assertSame(comment, block.child(2));
    }

    @Test
    void keepsDeclarationsRemovesEverythingElse() {
        VariableDeclaration hoisted = new VariableDeclaration(VariableDeclaration.Kind.VAR, "x");
        FunctionDeclaration helper = new FunctionDeclaration("helper", new Block());
        Block block =
                Block.of(
                        new ReturnStatement(),
                        new ExpressionStatement("a()"),
                        hoisted,
                        new ExpressionStatement("b()"),
                        helper,
                        new ThrowStatement("e", SourceContext.none()));

        UnreachableCodeRemover remover = new UnreachableCodeRemover();
        int removed = remover.apply(block);

        assertEquals(3, removed);
        assertEquals(List.of("return;", "var x;", "function helper()"), render(block));
        assertEquals(3, remover.removedStatements().size());
    }

    @Test
    void reachableCodeIsUntouched() {
        Block block =
                Block.of(
                        new ExpressionStatement("a()"),
                        license(),
                        new ExpressionStatement("b()"),
                        new ReturnStatement());

        assertEquals(0, new UnreachableCodeRemover().apply(block));
        assertEquals(4, block.childCount());
    }

    @Test
    void nestedBlocksAreProcessedIndependently() {
        Block inner = Block.of(new BreakStatement(), new ExpressionStatement("deadInner()"));
        Block outer = Block.of(inner, new ExpressionStatement("stillReachable()"));

        int removed = new UnreachableCodeRemover().apply(outer);

        assertEquals(1, removed);
        assertEquals(1, inner.childCount());
        assertEquals(2, outer.childCount(), "A jump inside a nested block does not end the outer one");
    }

    @Test
    void functionBodiesAreProcessed() {
        Block body = Block.of(new ReturnStatement(), new ExpressionStatement("never()"), license());
        Block program = Block.of(new FunctionDeclaration("f", body), new ExpressionStatement("f()"));

        assertEquals(1, new UnreachableCodeRemover().apply(program));
        assertEquals(2, body.childCount());
        assertInstanceOf(ImportantComment.class, body.child(1));
    }

    @Test
    void retainedFunctionAfterJumpIsStillCleaned() {
        Block body = Block.of(new ThrowStatement("e", SourceContext.none()), new ExpressionStatement("x()"));
        Block program = Block.of(new ReturnStatement(), new FunctionDeclaration("late", body));

        assertEquals(1, new UnreachableCodeRemover().apply(program));
        assertEquals(2, program.childCount());
        assertEquals(1, body.childCount());
    }

    @Test
    void nestedBlockAfterJumpIsRemovedWithItsContents() {
        Block nested =
                Block.of(license(), new VariableDeclaration(VariableDeclaration.Kind.VAR, "y"));
        Block program = Block.of(new ReturnStatement(), nested);
        UnreachableCodeRemover remover = new UnreachableCodeRemover();

        assertEquals(1, remover.apply(program));
        assertEquals(1, program.childCount());
        assertSame(nested, remover.removedStatements().get(0));
    }

    private static List<String> render(Block block) {
        return block.children().stream().map(AstNode::toString).toList();
    }
}
