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
public class ChapterMarker {
    public static final String KIND_CHAPTER = "CHAPTER";

    @JsonProperty("asset_uuid")
    private String assetUuid;
    private String kind;
    @JsonProperty("start_ms")
    private long startMs;
}
