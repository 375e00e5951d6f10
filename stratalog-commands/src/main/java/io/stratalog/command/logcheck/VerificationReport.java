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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts and problems found by {@link LogChainVerifier}.
 */
public final class VerificationReport {

    private final List<Path> files;
    private final Map<String, Long> recordsByTag = new TreeMap<>();
    private final List<String> problems = new ArrayList<>();
    private long loadRecords;
    private long otherRecords;
    private long corruptLines;
    private long outOfOrder;

    VerificationReport(List<Path> files) {
        this.files = List.copyOf(files);
    }

    void loadRecord(String tag) {
        loadRecords++;
        recordsByTag.merge(tag, 1L, Long::sum);
    }

    void otherRecord() {
        otherRecords++;
    }

    void corrupt() {
        corruptLines++;
    }

    void outOfOrder() {
        outOfOrder++;
    }

    void problem(String description) {
        problems.add(description);
    }

    /**
     * @return the files read, oldest first
     */
    public List<Path> getFiles() {
        return files;
    }

    public long getLoadRecords() {
        return loadRecords;
    }

    public long getOtherRecords() {
        return otherRecords;
    }

    public long getCorruptLines() {
        return corruptLines;
    }

    public long getOutOfOrder() {
        return outOfOrder;
    }

    public Map<String, Long> getRecordsByTag() {
        return Collections.unmodifiableMap(recordsByTag);
    }

    public List<String> getProblems() {
        return Collections.unmodifiableList(problems);
    }

    public boolean isClean() {
        return corruptLines == 0 && outOfOrder == 0 && problems.isEmpty();
    }

    @Override
    public String toString() {
        return "files=" + files.size() + " loadRecords=" + loadRecords + " otherRecords=" + otherRecords
            + " corrupt=" + corruptLines + " outOfOrder=" + outOfOrder + " byTag=" + recordsByTag;
    }
}
