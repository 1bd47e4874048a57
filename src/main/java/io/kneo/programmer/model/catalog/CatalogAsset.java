package io.kneo.programmer.model.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Setter
@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogAsset {
    public static final String STATE_READY = "ready";

    private String uuid;
    private String uri;
    @JsonProperty("canonical_uri")
    private String canonicalUri;
    private String state;
    @JsonProperty("duration_ms")
    private Long durationMs;
    @JsonProperty("collection_uuid")
    private String collectionUuid;

    public boolean isReady() {
        return STATE_READY.equals(state);
    }
}
