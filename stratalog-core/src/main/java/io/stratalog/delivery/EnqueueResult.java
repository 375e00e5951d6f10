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


package io.stratalog.delivery;

/**
 * Outcome of handing a record to a {@link DeliveryQueue}. Producers may ignore it; a
 * dropped record is already counted in {@link DeliveryStats}.
 *
 * @since 1.0.0
 */
public enum EnqueueResult {
    /** The record is queued and will be delivered unless shutdown grace runs out. */
    ACCEPTED,
    /** The queue was full or closed; the record was counted and discarded. */
    DROPPED
}
