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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OutputFileOption")
class OutputFileOptionTest {

    @TempDir
    Path tempDir;

    private OutputFileOption parse(String... args) {
        OutputFileOption option = new OutputFileOption();
        new CommandLine(option).parseArgs(args);
        return option;
    }

    @Test
    @DisplayName("single-file output targets only the header")
    void singleFileTargets() {
        OutputFileOption.OutputFile output = new OutputFileOption.OutputFile(tempDir.resolve("scan"), false);
        assertThat(output.targets(true)).containsExactly(tempDir.resolve("scan.mha"));
    }

    @Test
    @DisplayName("split-header output targets the header and its payload file")
    void splitHeaderTargets() {
        Path header = tempDir.resolve("my scan.MHD");
        OutputFileOption.OutputFile output = new OutputFileOption.OutputFile(header, false);

        assertThat(output.targets(false))
            .containsExactly(header, tempDir.resolve("my scan.raw").toAbsolutePath());
        assertThat(output.targets(true))
            .containsExactly(header, tempDir.resolve("my scan.zraw").toAbsolutePath());
    }

    @Test
    @DisplayName("an existing payload file blocks the write without --force")
    void existingPayloadBlocks() throws IOException {
        Files.writeString(tempDir.resolve("scan.zraw"), "old");
        OutputFileOption option = parse("-o", tempDir.resolve("scan.mhd").toString());

        option.validate(false);
        assertThatThrownBy(() -> option.validate(true))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("scan.zraw")
            .hasMessageContaining("Use --force to overwrite.");

        parse("-o", tempDir.resolve("scan.mhd").toString(), "--force").validate(true);
    }

    @Test
    @DisplayName("an existing header blocks the write without --force")
    void existingHeaderBlocks() throws IOException {
        Path header = Files.writeString(tempDir.resolve("scan.mha"), "old");
        OutputFileOption option = parse("-o", tempDir.resolve("scan").toString());

        assertThat(option.getOutputFile().existingWithoutForce(false)).contains(header);
        assertThatThrownBy(() -> option.validate(false)).isInstanceOf(IllegalStateException.class);
    }
}
