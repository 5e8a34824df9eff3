package com.genex.model;

public record ApoeStatus(
    String genotype,      // e.g. "ε3/ε3"
    String rs429358,
    String rs7412,
    RiskLevel riskLevel,
    String interpretation
) {}
