package io.museg.command.common;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import picocli.CommandLine;

/// How much an image report prints: {@code -v} adds geometry and file details, {@code -q} leaves
/// only errors on stderr.
public class VerbosityOption {

    /// Report detail, from least to most.
    public enum Level {
        QUIET,
        NORMAL,
        VERBOSE;

        /// @return whether anything but errors is printed
        public boolean prints() {
            return this != QUIET;
        }
    }

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Also print geometry and file details"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Print nothing but errors"
    )
    private boolean quiet = false;

    /// @return the requested report level
    /// @throws IllegalStateException if both {@code --verbose} and {@code --quiet} are given
    public Level level() {
        if (verbose && quiet) {
            throw new IllegalStateException("Cannot specify both --verbose and --quiet options");
        }
        if (quiet) {
            return Level.QUIET;
        }
        return verbose ? Level.VERBOSE : Level.NORMAL;
    }
}
