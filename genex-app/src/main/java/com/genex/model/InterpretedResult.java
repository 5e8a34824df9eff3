package com.genex.model;

public record InterpretedResult(
    GenotypeCall call,
    CuratedAnnotation annotation,
    String normalizedGenotype,
    Zygosity zygosity,
    RiskLevel riskLevel,
    String interpretation,
    String recommendation
) {
    public boolean requiresDisclaimer() {
        return riskLevel == RiskLevel.ELEVATED || riskLevel == RiskLevel.HIGH || riskLevel == RiskLevel.CARRIER;
    }
}
