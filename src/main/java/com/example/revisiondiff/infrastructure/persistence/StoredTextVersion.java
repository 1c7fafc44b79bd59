package com.example.revisiondiff.infrastructure.persistence;

import com.example.revisiondiff.domain.TextVersion;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One element of the JSON array kept per document.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredTextVersion {

    @JsonProperty("version_id")
    private String versionId;

    @JsonProperty("content")
    private String content;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("label")
    private String label;

    @JsonProperty("style")
    private String style;

    static StoredTextVersion from(TextVersion version) {
        StoredTextVersion stored = new StoredTextVersion();
        stored.setVersionId(version.versionId());
        stored.setContent(version.content());
        stored.setTimestamp(version.timestamp().toString());
        stored.setLabel(version.label());
        stored.setStyle(version.style());
        return stored;
    }

    boolean isComplete() {
        return versionId != null && content != null && timestamp != null;
    }

    TextVersion toVersion() {
        return new TextVersion(versionId, content, LocalDateTime.parse(timestamp), label, style);
    }
}
