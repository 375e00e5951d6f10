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

package io.stratalog.command.loggen;

import io.stratalog.LogHandle;
import io.stratalog.LogRegistry;
import io.stratalog.config.ConfigResolver;
import io.stratalog.config.LoggingOptions;
import io.stratalog.delivery.DeliveryStats;
import io.stratalog.eventing.LogLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/// Emit tagged, fixed-size records from several threads into one log file chain. Run
/// several instances against the same `--log-dir` to exercise cross-process rotation, then
/// check the result with `logcheck`.
@CommandLine.Command(name = "loggen",
    header = "Generate concurrent log load",
    description = "Each thread emits --count records of the form "
        + "'tag=T thread=N seq=S len=L payload=...' through the stratalog delivery path.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:all records accepted", "3:some records were dropped"})
public class CMD_loggen implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_loggen.class);

    /** Logger name the generated records are written under. */
    public static final String LOGGER_NAME = "loggen";

    @CommandLine.Option(names = {"-t", "--threads"}, defaultValue = "2",
        description = "Producer threads (default: ${DEFAULT-VALUE})")
    private int threads;

    @CommandLine.Option(names = {"-n", "--count"}, defaultValue = "1000",
        description = "Records per thread (default: ${DEFAULT-VALUE})")
    private int count;

    @CommandLine.Option(names = {"-s", "--message-size"}, defaultValue = "100",
        description = "Payload characters per record (default: ${DEFAULT-VALUE})")
    private int messageSize;

    @CommandLine.Option(names = {"--tag"},
        description = "Tag identifying this generator in the output (default: p<pid>)")
    private String tag;

    @CommandLine.Option(names = {"--level"}, defaultValue = "INFO",
        converter = LoggingOptions.LevelConverter.class,
        description = "Level of the generated records (default: ${DEFAULT-VALUE})")
    private LogLevel level;

    @CommandLine.Option(names = {"--console"},
        description = "Mirror the generated records to the console")
    private boolean console;

    @CommandLine.Option(names = {"--queue-capacity"},
        description = "Delivery queue capacity")
    private Integer queueCapacity;

    @CommandLine.Option(names = {"--flush-every"},
        description = "Records per file flush")
    private Integer flushEvery;

    @CommandLine.Option(names = {"--grace-ms"}, defaultValue = "30000",
        description = "Shutdown drain period in milliseconds (default: ${DEFAULT-VALUE})")
    private long graceMillis;

    @CommandLine.Mixin
    private LoggingOptions loggingOptions = new LoggingOptions();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final LogRegistry registry;

    public CMD_loggen() {
        this(LogRegistry.global());
    }

    public CMD_loggen(LogRegistry registry) {
        this.registry = registry;
    }

    /// Run the loggen command
    /// @param args command line args
    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new CMD_loggen()).setCaseInsensitiveEnumValuesAllowed(true);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (threads < 1 || count < 0 || messageSize < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "--threads must be >= 1, --count and --message-size >= 0");
        }
        String effectiveTag = tag != null ? tag : "p" + ProcessHandle.current().pid();

        Map<String, Object> overrides = new LinkedHashMap<>();
        overrides.put("console", console);
        if (queueCapacity != null) {
            overrides.put("queue_capacity", queueCapacity);
        }
        if (flushEvery != null) {
            overrides.put("flush_every", flushEvery);
        }
        ConfigResolver.Resolution resolution = new ConfigResolver().resolve(null, loggingOptions, overrides);
        resolution.initialize(registry);
        DeliveryStats stats = registry.getStats();
        long acceptedBefore = stats.getAccepted();
        long lostBefore = stats.getTotalLost();

        LogHandle log = registry.getLogger(LOGGER_NAME);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        long began;
        try {
            List<Future<?>> futures = new ArrayList<>(threads);
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int seq = 0; seq < count; seq++) {
                        log.log(level, LoadMessage.render(effectiveTag, thread, seq, messageSize));
                    }
                    return null;
                }));
            }
            began = System.nanoTime();
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
        }
        long emitted = System.nanoTime() - began;
        boolean drained = registry.shutdown(Duration.ofMillis(graceMillis));
        long total = System.nanoTime() - began;

        long accepted = stats.getAccepted() - acceptedBefore;
        long lost = stats.getTotalLost() - lostBefore;
        PrintWriter out = spec.commandLine().getOut();
        out.printf("loggen %s (pid %d): %d threads x %d records%n",
            effectiveTag, ProcessHandle.current().pid(), threads, count);
        out.printf("  accepted=%d lost=%d drained=%s rotations=%d skippedRotations=%d sinkFaults=%d%n",
            accepted, lost, drained, stats.getRotations(), stats.getSkippedRotations(), stats.getSinkFaults());
        out.printf("  emit %.1f ms, emit+drain %.1f ms, %.0f records/s%n",
            emitted / 1e6, total / 1e6, (long) threads * count / Math.max(total / 1e9, 1e-9));
        out.flush();
        logger.debug("loggen {} finished: {}", effectiveTag, stats);
        return lost == 0 ? 0 : 3;
    }
}
