package com.mouse.apex.model;

import java.util.List;

/** Value-at-risk figures are in stake units. */
public record RiskAssessment(double valueAtRisk,
                             double conditionalValueAtRisk,
                             String sensitivityAnalysis,
                             String adversarialScenario,
                             String blackSwanEvent,
                             List<String> keyRisks,
                             List<String> potentialFailures) {
}
