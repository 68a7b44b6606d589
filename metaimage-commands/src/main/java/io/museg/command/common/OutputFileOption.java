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

import io.museg.metaimage.PayloadLocation;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared output file option with force overwrite flag.
 *
 * <p>The header file actually written may differ from the requested path: names without a
 * {@code .mha} or {@code .mhd} extension get {@code .mha} appended. A {@code .mhd} output also
 * writes a {@code .raw} or {@code .zraw} payload file beside the header.
 */
public class OutputFileOption {

    /**
     * Immutable output file specification with force-overwrite flag.
     *
     * @param path  the requested output path (never null)
     * @param force whether to force overwrite if the file exists
     */
    public record OutputFile(Path path, boolean force) {

        public OutputFile {
            if (path == null) {
                throw new IllegalArgumentException("Output path cannot be null");
            }
        }

        /**
         * Gets every file a save to this output would write: the header, then any external
         * payload file.
         *
         * @param compressed whether the payload will be compressed
         */
        public List<Path> targets(boolean compressed) {
            PayloadLocation.Destination destination = PayloadLocation.destinationFor(path, compressed);
            List<Path> targets = new ArrayList<>(2);
            targets.add(destination.headerPath());
            if (destination.location() instanceof PayloadLocation.External external) {
                targets.add(external.resolve(destination.headerPath()));
            }
            return targets;
        }

        /**
         * Finds the first file a save would overwrite, unless force is set.
         *
         * @param compressed whether the payload will be compressed
         */
        public Optional<Path> existingWithoutForce(boolean compressed) {
            if (force) {
                return Optional.empty();
            }
            return targets(compressed).stream().filter(Files::exists).findFirst();
        }

        @Override
        public String toString() {
            if (force) {
                return path + " (force)";
            }
            return path.toString();
        }
    }

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "The output file path (.mha for one file, .mhd for a header with a .raw/.zraw payload)",
        required = true
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if output files already exist"
    )
    private boolean force = false;

    public OutputFile getOutputFile() {
        return new OutputFile(outputPath, force);
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public boolean isForce() {
        return force;
    }

    /**
     * Validates the output, refusing to overwrite the header or payload file without force.
     *
     * @param compressed whether the payload will be compressed
     */
    public void validate(boolean compressed) {
        Optional<Path> existing = getOutputFile().existingWithoutForce(compressed);
        if (existing.isPresent()) {
            throw new IllegalStateException(
                "Output file already exists: " + existing.get() + ". Use --force to overwrite."
            );
        }
    }

    @Override
    public String toString() {
        return getOutputFile().toString();
    }
}
