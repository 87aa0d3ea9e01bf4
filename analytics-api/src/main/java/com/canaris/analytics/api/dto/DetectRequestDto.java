package com.canaris.analytics.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectRequestDto {
    private String modelName;
    @NotEmpty
    private List<Double> values;
    /** Score with the trained model when there is one; z-score otherwise. Defaults to true. */
    private Boolean useMl;
    /** Z-score threshold for the statistical path. */
    @JsonProperty("zThreshold")
    private Double zThreshold;
}
