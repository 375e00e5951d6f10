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

/**
 * The message body written by {@code loggen}:
 * <pre>tag=p0 thread=1 seq=42 len=16 payload=abcdefghijklmnop</pre>
 * The payload length is repeated in {@code len} so that a truncated or merged line can be
 * told apart from an intact one.
 */
public final class LoadMessage {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private LoadMessage() {
    }

    public static String render(String tag, int thread, long sequence, int payloadLength) {
        StringBuilder sb = new StringBuilder(48 + payloadLength);
        sb.append("tag=").append(tag)
            .append(" thread=").append(thread)
            .append(" seq=").append(sequence)
            .append(" len=").append(payloadLength)
            .append(" payload=");
        for (int i = 0; i < payloadLength; i++) {
            sb.append(ALPHABET.charAt((int) ((sequence + i) % ALPHABET.length())));
        }
        return sb.toString();
    }
}
