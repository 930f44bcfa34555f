/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.memory.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditEventType {
    LEARNING_ADDED("learning_added"),
    LEARNINGS_DELETED("learnings_deleted"),
    VERSIONS_RECONCILED("versions_reconciled"),
    FILE_SOFT_DELETED("file_soft_deleted"),
    FILE_RESTORED("file_restored"),
    FILE_PINNED("file_pinned"),
    FILE_UNPINNED("file_unpinned"),
    FILE_MOVED("file_moved"),
    FILE_RENAMED("file_renamed"),
    FILE_DELETED("file_deleted"),
    TTL_CLEANUP("ttl_cleanup"),
    COLLECTION_REINDEXED("collection_reindexed");

    private final String code;

    AuditEventType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
