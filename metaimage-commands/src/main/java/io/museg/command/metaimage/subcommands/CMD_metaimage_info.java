package io.museg.command.metaimage.subcommands;

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

import io.museg.command.common.InputFileOption;
import io.museg.command.common.VerbosityOption;
import io.museg.metaimage.MetaImage;
import io.museg.metaimage.MetaImageIO;
import io.museg.metaimage.tags.MetaImageTags;
import io.museg.metaimage.tags.TagNames;
import io.museg.metaimage.types.NdArray;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.Callable;

/// Show the header and a summary of the voxel data of a MetaImage file.
///
/// The file is loaded leniently, so headers without geometric tags are accepted.
///
/// ## Usage
///
/// ```bash
/// metaimage info -i brain.mha
/// metaimage info -i brain.mhd --tags-only
/// ```
@CommandLine.Command(
    name = "info",
    header = "Show MetaImage header and data summary",
    description = "Prints the header tags of a MetaImage file, followed by element type, shape, channels, "
        + "byte order, payload location and value range.",
    exitCodeList = {
        "0: Success",
        "1: Error reading file"
    }
)
public class CMD_metaimage_info implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_metaimage_info.class);

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(
        names = {"--tags-only"},
        description = "Print only the header, without reading the payload"
    )
    private boolean tagsOnly = false;

    @Override
    public Integer call() {
        try {
            VerbosityOption.Level level = verbosityOption.level();
            inputFileOption.validate();
            Path inputPath = inputFileOption.getInputPath();

            if (tagsOnly) {
                MetaImageTags tags = MetaImageIO.readTags(inputPath, true);
                if (level.prints()) {
                    System.out.print(tags.toText());
                }
                return 0;
            }

            MetaImage image = MetaImageIO.read(inputPath);
            if (level.prints()) {
                printInfo(inputPath, image, level);
            }
            return 0;
        } catch (Exception e) {
            logger.error("Error reading {}", inputFileOption, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void printInfo(Path inputPath, MetaImage image, VerbosityOption.Level level) throws IOException {
        NdArray array = image.array();
        MetaImageTags tags = image.tags();

        System.out.println("Header:");
        for (String line : tags.toText().split("\n")) {
            System.out.println("  " + line);
        }
        System.out.println();

        System.out.println("Data:");
        System.out.printf("  Element Type:      %s (%s)%n", tags.getString(TagNames.ELEMENT_TYPE), array.kind());
        System.out.printf("  Shape:             %s%n", Arrays.toString(array.shape()));
        System.out.printf("  Channels:          %d%n", image.channels());
        System.out.printf("  Byte Order:        %s%n", array.byteOrder());
        System.out.printf("  Payload:           %s%n", tags.getString(TagNames.ELEMENT_DATA_FILE));
        System.out.printf("  Compressed:        %s%n", tags.getBoolean(TagNames.COMPRESSED_DATA) ? "zlib" : "no");
        System.out.printf("  Range:             %s .. %s%n", format(array.min()), format(array.max()));

        if (level == VerbosityOption.Level.VERBOSE) {
            System.out.println();
            System.out.println("Geometry:");
            System.out.printf("  Origin:            %s%n", Arrays.toString(image.origin()));
            System.out.printf("  Spacing:           %s%n", Arrays.toString(image.spacing()));
            System.out.printf("  Direction:         %s%n", Arrays.toString(image.direction()));
            System.out.printf("  Header File:       %s (%,d bytes)%n", inputPath.toAbsolutePath(), Files.size(inputPath));
        }
    }

    private static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
