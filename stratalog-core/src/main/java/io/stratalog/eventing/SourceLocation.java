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

package io.stratalog.eventing;

import java.util.Objects;
import java.util.Set;

/**
 * The caller position captured when a record is emitted: source file, line, and the
 * calling class and method. Frames belonging to logging wrappers are skipped so the
 * location points at application code.
 *
 * @since 1.0.0
 */
public final class SourceLocation {

    /**
     * Placeholder used when location capture is disabled or no caller frame was found.
     */
    public static final SourceLocation UNKNOWN = new SourceLocation("?", 0, "?", "?");

    private static final StackWalker WALKER = StackWalker.getInstance();
    private static final String SELF = SourceLocation.class.getName();

    public final String fileName;
    public final int lineNumber;
    public final String className;
    public final String methodName;

    public SourceLocation(String fileName, int lineNumber, String className, String methodName) {
        this.fileName = fileName == null ? "?" : fileName;
        this.lineNumber = lineNumber;
        this.className = className == null ? "?" : className;
        this.methodName = methodName == null ? "?" : methodName;
    }

    /**
     * Captures the first stack frame whose declaring class is not in {@code wrapperClasses}.
     *
     * @param wrapperClasses fully qualified names of classes to skip
     * @return the caller location, or {@link #UNKNOWN} if every frame was skipped
     */
    public static SourceLocation capture(Set<String> wrapperClasses) {
        return WALKER.walk(frames -> frames
            .filter(f -> !SELF.equals(f.getClassName()) && !wrapperClasses.contains(f.getClassName()))
            .findFirst()
            .map(f -> new SourceLocation(f.getFileName(), f.getLineNumber(), f.getClassName(), f.getMethodName()))
            .orElse(UNKNOWN));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceLocation)) {
            return false;
        }
        SourceLocation that = (SourceLocation) o;
        return lineNumber == that.lineNumber
            && fileName.equals(that.fileName)
            && className.equals(that.className)
            && methodName.equals(that.methodName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, lineNumber, className, methodName);
    }

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
