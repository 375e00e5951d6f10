/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.stratalog.command;

import io.stratalog.command.logcheck.CMD_logcheck;
import io.stratalog.command.loggen.CMD_loggen;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Entry point bundling the stratalog tools
@CommandLine.Command(name = "stratalog",
    header = "Tools for exercising and verifying stratalog log files",
    mixinStandardHelpOptions = true,
    version = "stratalog 1.0.0",
    subcommands = {
        CMD_loggen.class,
        CMD_logcheck.class,
        CommandLine.HelpCommand.class
    })
public class CMD_stratalog implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// Run a stratalog command
    /// @param args command line args
    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new CMD_stratalog()).setCaseInsensitiveEnumValuesAllowed(true);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
