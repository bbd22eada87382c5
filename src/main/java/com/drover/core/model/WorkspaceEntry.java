package com.drover.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Append-only, mission-scoped artifact agents use to share intermediate findings.
 *
 * @param id         entry id
 * @param missionId  owning mission
 * @param agentId    author
 * @param entryType  kind of entry (finding, result, plan, ...)
 * @param title      short heading
 * @param content    body text
 * @param tags       free-form tags
 * @param references ids of related entries
 * @param createdAt  creation time
 */
public record WorkspaceEntry(
    String id,
    @JsonProperty("mission_id") String missionId,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("entry_type") String entryType,
    String title,
    String content,
    List<String> tags,
    List<String> references,
    @JsonProperty("created_at") Instant createdAt
) {

    public WorkspaceEntry {
        tags = tags == null ? List.of() : List.copyOf(tags);
        references = references == null ? List.of() : List.copyOf(references);
    }
}
