package com.mouse.apex.model;

import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
public class PipelineResult {
    List<Prediction> predictions;
    PipelineReport report;

    public Optional<Prediction> best() {
        return predictions.isEmpty() ? Optional.empty() : Optional.of(predictions.get(0));
    }
}
