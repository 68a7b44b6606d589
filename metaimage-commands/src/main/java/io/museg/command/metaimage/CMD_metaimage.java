package io.museg.command.metaimage;

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

import io.museg.command.metaimage.subcommands.CMD_metaimage_convert;
import io.museg.command.metaimage.subcommands.CMD_metaimage_info;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Tools for inspecting and converting MetaImage ({@code .mha}/{@code .mhd}) files.
///
/// This is the top level command which serves as the entry point for all sub-commands.
@CommandLine.Command(name = "metaimage",
    header = "Inspect and convert MetaImage files",
    description = "Contains subcommands to show and rewrite MetaImage headers and payloads",
    mixinStandardHelpOptions = true,
    subcommands = {
        CommandLine.HelpCommand.class,
        CMD_metaimage_info.class,
        CMD_metaimage_convert.class
    })
public class CMD_metaimage implements Callable<Integer> {

    /// Run a metaimage command
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new CMD_metaimage())
            .setCaseInsensitiveEnumValuesAllowed(true);
        System.exit(commandLine.execute(args));
    }

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
