package io.kneo.programmer.model.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Setter
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogSnapshot {
    private List<CatalogAsset> assets = new ArrayList<>();
    private Map<String, Map<String, Object>> editorials = new HashMap<>();
    private Map<String, ProbeData> probes = new HashMap<>();
    private List<ChapterMarker> markers = new ArrayList<>();
    private List<CollectionRecord> collections = new ArrayList<>();
}
