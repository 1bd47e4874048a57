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
public class ProbeData {
    @JsonProperty("loudness_gain_db")
    private Double loudnessGainDb;
    @JsonProperty("integrated_lufs")
    private Double integratedLufs;
}
