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

package io.stratalog.command.logcheck;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Verify a log file and its backups: every line intact, payloads whole, per-thread order
/// kept, backup count bound respected.
@CommandLine.Command(name = "logcheck",
    header = "Verify the integrity of a rotated log file chain",
    description = "Reads <file>.N ... <file>.1, <file> in that order and reports corrupt lines, "
        + "out-of-order loggen records and per-tag record counts.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:chain is intact", "1:problems found", "2:expected count not met"})
public class CMD_logcheck implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_logcheck.class);

    @CommandLine.Parameters(paramLabel = "FILE", description = "The active log file")
    private Path file;

    @CommandLine.Option(names = {"-b", "--backup-count"}, defaultValue = "5",
        description = "Backup count the writers used (default: ${DEFAULT-VALUE})")
    private int backupCount;

    @CommandLine.Option(names = {"-e", "--expect"},
        description = "Expected number of loggen records across the chain")
    private Long expected;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// Run the logcheck command
    /// @param args command line args
    public static void main(String[] args) {
        int exitCode = new CommandLine(new CMD_logcheck()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        VerificationReport report = new LogChainVerifier(file, backupCount).verify();
        var out = spec.commandLine().getOut();
        out.printf("files: %d%n", report.getFiles().size());
        for (Path path : report.getFiles()) {
            out.printf("  %s%n", path.getFileName());
        }
        out.printf("loggen records: %d%n", report.getLoadRecords());
        out.printf("other records: %d%n", report.getOtherRecords());
        report.getRecordsByTag().forEach((tag, count) -> out.printf("  tag %s: %d%n", tag, count));
        out.printf("corrupt lines: %d%n", report.getCorruptLines());
        out.printf("out of order: %d%n", report.getOutOfOrder());
        for (String problem : report.getProblems()) {
            out.printf("problem: %s%n", problem);
        }
        out.flush();
        if (!report.isClean()) {
            logger.warn("Log chain {} has problems: {}", file, report);
            return 1;
        }
        if (expected != null && report.getLoadRecords() != expected) {
            out.printf("expected %d loggen records, found %d%n", expected, report.getLoadRecords());
            out.flush();
            return 2;
        }
        return 0;
    }
}
