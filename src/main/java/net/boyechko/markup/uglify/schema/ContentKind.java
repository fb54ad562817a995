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
package net.boyechko.markup.uglify.schema;

/** HTML content categories an element can belong to. */
public enum ContentKind {
    METADATA,
    FLOW,
    SECTIONING,
    HEADING,
    /** Inline-level content such as {@code em}, {@code a} or {@code br}. */
    PHRASING,
    EMBEDDED,
    INTERACTIVE,
    /** Content of the element is not parsed as markup ({@code script}, {@code style}). */
    RAW_TEXT,
    /** Whitespace in the element is significant ({@code pre}, {@code textarea}). */
    PREFORMATTED
}
