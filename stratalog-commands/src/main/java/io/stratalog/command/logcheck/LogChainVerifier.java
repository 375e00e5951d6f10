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

import io.stratalog.rotation.BackupChain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a backup chain oldest file first and checks every line.
 *
 * <p>A line is intact when it has the full record layout written by
 * {@link io.stratalog.sinks.RecordFormatter}, with a timestamp free of the {@code " - "}
 * field separator. Lines carrying a {@code loggen} message are
 * checked further: the payload must have the announced length, and the sequence numbers of
 * each producer thread must increase from one line to the next. Lines of other records,
 * such as drop notices, are counted but not checked further.
 *
 * @since 1.0.0
 */
public final class LogChainVerifier {

    private static final Logger logger = LogManager.getLogger(LogChainVerifier.class);

    private static final Pattern ANSI = Pattern.compile("\u001b\\[[0-9;]*m");
    private static final Pattern RECORD = Pattern.compile(
        "^((?:(?! - ).)+) - (?:(\\S+):(-?\\d+) - )?(\\d+) - (\\d+) - (\\S+) - \\[(DEBUG|INFO|WARNING|ERROR|CRITICAL)] - (.*)$");
    private static final Pattern LOAD = Pattern.compile(
        "^tag=(\\S+) thread=(\\d+) seq=(\\d+) len=(\\d+) payload=([a-z0-9]*)$");
    private static final int MAX_REPORTED_PROBLEMS = 20;

    private final Path activeFile;
    private final int backupCount;

    /**
     * @param activeFile the active log file; backups are found next to it
     * @param backupCount the number of backups the writers were configured with
     */
    public LogChainVerifier(Path activeFile, int backupCount) {
        this.activeFile = activeFile;
        this.backupCount = backupCount;
    }

    public VerificationReport verify() throws IOException {
        BackupChain chain = new BackupChain(activeFile, backupCount);
        List<Path> files = new ArrayList<>(chain.existingBackups());
        Collections.reverse(files);
        if (Files.exists(activeFile)) {
            files.add(activeFile);
        }

        VerificationReport report = new VerificationReport(files);
        Map<String, Long> lastSequence = new HashMap<>();
        for (Path file : files) {
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                int lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    check(file, lineNumber, line, report, lastSequence);
                }
            }
        }
        int backupsOnDisk = countBackupsOnDisk();
        if (backupsOnDisk > backupCount) {
            report.problem(backupsOnDisk + " backup files exist, more than the backup count " + backupCount);
        }
        logger.debug("Verified {}: {}", activeFile, report);
        return report;
    }

    private void check(Path file, int lineNumber, String rawLine, VerificationReport report,
                       Map<String, Long> lastSequence) {
        String line = ANSI.matcher(rawLine).replaceAll("");
        Matcher record = RECORD.matcher(line);
        if (!record.matches()) {
            report.corrupt();
            note(report, file.getFileName() + ":" + lineNumber + ": not an intact record: " + abbreviate(rawLine));
            return;
        }
        String message = record.group(8);
        Matcher load = LOAD.matcher(message);
        if (!load.matches()) {
            if (message.startsWith("tag=")) {
                report.corrupt();
                note(report, file.getFileName() + ":" + lineNumber + ": malformed loggen message: "
                    + abbreviate(message));
            } else {
                report.otherRecord();
            }
            return;
        }
        String tag = load.group(1);
        int announced = Integer.parseInt(load.group(4));
        if (load.group(5).length() != announced) {
            report.corrupt();
            note(report, file.getFileName() + ":" + lineNumber + ": payload length " + load.group(5).length()
                + " does not match len=" + announced);
            return;
        }
        String producer = tag + "/" + record.group(4) + "/" + load.group(2);
        long sequence = Long.parseLong(load.group(3));
        Long previous = lastSequence.put(producer, sequence);
        if (previous != null && sequence <= previous) {
            report.outOfOrder();
            note(report, file.getFileName() + ":" + lineNumber + ": " + producer + " seq " + sequence
                + " after " + previous);
        }
        report.loadRecord(tag);
    }

    private static void note(VerificationReport report, String problem) {
        if (report.getProblems().size() < MAX_REPORTED_PROBLEMS) {
            report.problem(problem);
        }
    }

    private int countBackupsOnDisk() throws IOException {
        Path dir = activeFile.toAbsolutePath().getParent();
        String prefix = activeFile.getFileName().toString() + ".";
        int count = 0;
        try (var entries = Files.list(dir)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                String name = entry.getFileName().toString();
                if (name.startsWith(prefix) && name.substring(prefix.length()).matches("\\d+")) {
                    count++;
                }
            }
        }
        return count;
    }

    private static String abbreviate(String line) {
        return line.length() <= 120 ? line : line.substring(0, 117) + "...";
    }
}
