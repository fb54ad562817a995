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
package net.boyechko.markup.uglify.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import net.boyechko.markup.uglify.core.VerbosityLevel;
import org.slf4j.LoggerFactory;

/** Adjusts Logback at runtime for the command-line tool. Log output goes to stderr. */
public final class LoggingSetup {
    static final String PROJECT_LOGGER = "net.boyechko.markup.uglify";

    private LoggingSetup() {}

    /** Sets the project logger to the level for {@code verbosity}. */
    public static void apply(VerbosityLevel verbosity) {
        Logger projectLogger = (Logger) LoggerFactory.getLogger(PROJECT_LOGGER);
        projectLogger.setLevel(Level.toLevel(verbosity.logLevel(), Level.WARN));
    }

    public static Level currentLevel() {
        Logger projectLogger = (Logger) LoggerFactory.getLogger(PROJECT_LOGGER);
        return projectLogger.getLevel();
    }
}
