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

/** Independent toggles for {@link HtmlToTextWriter}; any combination is valid. */
public enum HtmlToTextOption {
    /** Keep line breaks and other control whitespace instead of turning them into spaces. */
    KEEP_STRUCTURE,

    /** Echo phrasing-level tags such as {@code <b>} or {@code <a href>} instead of dropping them. */
    KEEP_FORMATTING,

    /**
     * Leave {@code &lt;}, {@code &gt;} and {@code &amp;} as written. Has no effect together with
     * {@link #KEEP_FORMATTING}, which needs the decoded form.
     */
    KEEP_HTML_ESCAPE
}
