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
import io.museg.command.common.OutputFileOption;
import io.museg.command.common.VerbosityOption;
import io.museg.metaimage.MetaImage;
import io.museg.metaimage.MetaImageIO;
import io.museg.metaimage.tags.TagNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/// Rewrite a MetaImage file, optionally changing its tags, compression, byte order or layout.
///
/// The output extension picks the layout: {@code .mha} stores the payload after the header,
/// {@code .mhd} stores it in a {@code .raw} or {@code .zraw} file beside the header.
///
/// ## Usage
///
/// ```bash
/// metaimage convert -i scan.mhd -o scan.mha --compress
/// metaimage convert -i scan.mha -o scan-be.mha --msb --tag Modality=MET_MOD_MR
/// ```
@CommandLine.Command(
    name = "convert",
    header = "Convert a MetaImage file",
    description = "Loads a MetaImage file and writes it again with the requested tag overrides.",
    exitCodeList = {
        "0: Success",
        "1: Error reading, validating or writing files"
    }
)
public class CMD_metaimage_convert implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_metaimage_convert.class);

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"--compress"},
        description = "Compress the payload with zlib (default: keep the input setting)",
        negatable = true)
    private Boolean compress;

    @CommandLine.Option(names = {"--msb"}, description = "Write big-endian elements")
    private boolean msb = false;

    @CommandLine.Option(names = {"--lsb"}, description = "Write little-endian elements")
    private boolean lsb = false;

    @CommandLine.Option(names = {"--tag"},
        description = "Set a header tag (format: Name=Value)",
        arity = "0..*")
    private Map<String, String> tags = new LinkedHashMap<>();

    @CommandLine.Option(names = {"--ignore-errors"},
        description = "Load the input even if it lacks required geometric tags")
    private boolean ignoreErrors = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (msb && lsb) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --msb and --lsb cannot be combined");
        }
        try {
            VerbosityOption.Level level = verbosityOption.level();
            inputFileOption.validate();

            Path inputPath = inputFileOption.getInputPath();
            MetaImage image = MetaImageIO.load(inputPath, ignoreErrors);
            Map<String, Object> overrides = overrides();
            boolean compressed = image.tags().update(overrides, true).getBoolean(TagNames.COMPRESSED_DATA);
            outputFileOption.validate(compressed);
            Path written = MetaImageIO.save(outputFileOption.getOutputPath(), image, overrides);

            if (level.prints()) {
                System.out.println("Wrote " + written);
            }
            if (level == VerbosityOption.Level.VERBOSE) {
                System.out.print(MetaImageIO.readTags(written, true).toText());
            }
            return 0;
        } catch (Exception e) {
            logger.error("Error converting {} to {}", inputFileOption, outputFileOption, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Map<String, Object> overrides() {
        Map<String, Object> overrides = new LinkedHashMap<>(tags);
        if (compress != null) {
            overrides.put(TagNames.COMPRESSED_DATA, compress);
        }
        if (msb) {
            overrides.put(TagNames.BINARY_DATA_BYTE_ORDER_MSB, true);
        } else if (lsb) {
            overrides.put(TagNames.BINARY_DATA_BYTE_ORDER_MSB, false);
        }
        logger.debug("Tag overrides: {}", overrides);
        return overrides;
    }
}
