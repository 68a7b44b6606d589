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

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerbosityOptionTest {

    private VerbosityOption parse(String... args) {
        VerbosityOption option = new VerbosityOption();
        new CommandLine(option).parseArgs(args);
        return option;
    }

    @Test
    void levelFollowsFlags() {
        assertThat(parse().level()).isEqualTo(VerbosityOption.Level.NORMAL);
        assertThat(parse("-v").level()).isEqualTo(VerbosityOption.Level.VERBOSE);
        assertThat(parse("--quiet").level()).isEqualTo(VerbosityOption.Level.QUIET);
        assertThat(VerbosityOption.Level.QUIET.prints()).isFalse();
        assertThat(VerbosityOption.Level.VERBOSE.prints()).isTrue();
    }

    @Test
    void verboseAndQuietConflict() {
        assertThatThrownBy(() -> parse("-v", "-q").level())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("--verbose and --quiet");
    }
}
