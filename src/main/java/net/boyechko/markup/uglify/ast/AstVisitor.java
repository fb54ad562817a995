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

import net.boyechko.markup.uglify.ast.html.HtmlCData;
import net.boyechko.markup.uglify.ast.html.HtmlComment;
import net.boyechko.markup.uglify.ast.html.HtmlDoctype;
import net.boyechko.markup.uglify.ast.html.HtmlDocument;
import net.boyechko.markup.uglify.ast.html.HtmlElement;
import net.boyechko.markup.uglify.ast.html.HtmlRaw;
import net.boyechko.markup.uglify.ast.html.HtmlText;
import net.boyechko.markup.uglify.ast.script.Block;
import net.boyechko.markup.uglify.ast.script.BreakStatement;
import net.boyechko.markup.uglify.ast.script.ContinueStatement;
import net.boyechko.markup.uglify.ast.script.ExpressionStatement;
import net.boyechko.markup.uglify.ast.script.FunctionDeclaration;
import net.boyechko.markup.uglify.ast.script.ImportantComment;
import net.boyechko.markup.uglify.ast.script.ReturnStatement;
import net.boyechko.markup.uglify.ast.script.ThrowStatement;
import net.boyechko.markup.uglify.ast.script.VariableDeclaration;

/**
 * Visitor interface for AST traversal. One overload per node kind, each a no-op by default, so
 * a pass only overrides the kinds it handles. Nodes call back here from {@link
 * AstNode#accept(AstVisitor)}.
 */
public interface AstVisitor {

    default void visit(HtmlDocument node) {}

    default void visit(HtmlElement node) {}

    default void visit(HtmlText node) {}

    default void visit(HtmlComment node) {}

    default void visit(HtmlCData node) {}

    default void visit(HtmlDoctype node) {}

    default void visit(HtmlRaw node) {}

    default void visit(Block node) {}

    default void visit(ExpressionStatement node) {}

    default void visit(VariableDeclaration node) {}

    default void visit(FunctionDeclaration node) {}

    default void visit(ReturnStatement node) {}

    default void visit(BreakStatement node) {}

    default void visit(ContinueStatement node) {}

    default void visit(ThrowStatement node) {}

    default void visit(ImportantComment node) {}
}
