package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelInfo {
    private String name;
    private String provider;
    @JsonProperty("context_window")
    private int contextWindow;
    @JsonProperty("input_price_per_1m")
    private double inputPricePer1m;
    @JsonProperty("output_price_per_1m")
    private double outputPricePer1m;
    private String description;
}
