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

package io.insight2d.specdata.command;

import picocli.CommandLine;

/// Tools for reading, inspecting and converting two-dimensional spectrum files
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "specdata",
    mixinStandardHelpOptions = true,
    subcommands = {CMD_info.class, CMD_convert.class, CMD_formats.class})
public class CMD_specdata {

  /// run a specdata command
  /// @param args command line args
  public static void main(String[] args) {
    System.setProperty("slf4j.internal.verbosity", "ERROR");
    int exitCode = commandLine().execute(args);
    System.exit(exitCode);
  }

  /// @return the configured command line, without executing it
  public static CommandLine commandLine() {
    return new CommandLine(new CMD_specdata()).setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
  }
}
