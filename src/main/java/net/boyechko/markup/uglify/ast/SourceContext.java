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

/**
 * Where a node came from. Writers treat this as opaque; it is carried for diagnostics and for
 * nodes whose payload is their own source text.
 */
public record SourceContext(
        String sourceName,
        /** 1-based line, or 0 when unknown. */
        int line,
        /** 1-based column, or 0 when unknown. */
        int column,
        String code) {

    private static final SourceContext NONE = new SourceContext(null, 0, 0, "");

    public SourceContext {
        if (code == null) {
            code = "";
        }
    }

    public static SourceContext none() {
        return NONE;
    }

    public static SourceContext of(String code) {
        return new SourceContext(null, 0, 0, code);
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        if (!isKnown()) {
            return "<unknown>";
        }
        String name = sourceName != null ? sourceName : "<input>";
        return name + ":" + line + ":" + column;
    }
}
