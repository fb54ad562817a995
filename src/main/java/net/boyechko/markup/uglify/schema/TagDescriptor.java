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

import java.util.EnumSet;
import java.util.Set;

/** What the tag table knows about one element name. */
public record TagDescriptor(String name, Set<ContentKind> categories, boolean selfClosing) {
    public TagDescriptor {
        if (name == null) {
            throw new IllegalArgumentException("Tag name is required");
        }
        categories =
                categories == null || categories.isEmpty()
                        ? Set.of()
                        : Set.copyOf(EnumSet.copyOf(categories));
    }

    public boolean is(ContentKind kind) {
        return categories.contains(kind);
    }

    public boolean isPhrasing() {
        return is(ContentKind.PHRASING);
    }
}
