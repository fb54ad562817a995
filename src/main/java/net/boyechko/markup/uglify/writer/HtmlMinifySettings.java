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
package net.boyechko.markup.uglify.writer;

/**
 * Settings for {@link HtmlMinifyWriter}.
 *
 * @param collapseWhitespace collapse whitespace runs in text to one space, except inside
 *     preformatted and raw-text elements
 * @param removeComments drop comments, except important ({@code <!--! ... -->}) ones
 */
public record HtmlMinifySettings(boolean collapseWhitespace, boolean removeComments) {

    public static HtmlMinifySettings defaults() {
        return new HtmlMinifySettings(true, true);
    }

    /** Re-serializes without changing anything but the parser's normalization. */
    public static HtmlMinifySettings verbatim() {
        return new HtmlMinifySettings(false, false);
    }

    public HtmlMinifySettings withCollapseWhitespace(boolean value) {
        return new HtmlMinifySettings(value, removeComments);
    }

    public HtmlMinifySettings withRemoveComments(boolean value) {
        return new HtmlMinifySettings(collapseWhitespace, value);
    }
}
