package com.genex.service;

import com.genex.config.AnnotationsConfig;
import com.genex.model.ApoeStatus;
import com.genex.model.CuratedAnnotation;
import com.genex.model.GenotypeCall;
import com.genex.model.InterpretedResult;
import com.genex.model.RiskLevel;
import com.genex.model.Zygosity;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Interprets a genotype call against its curated annotation. Allele order never matters:
 * both the call and the rule patterns are compared in sorted order.
 */
@Service
public class AnnotationMatcher {

    public static final String APOE_RS429358 = "rs429358";
    public static final String APOE_RS7412 = "rs7412";

    public InterpretedResult match(GenotypeCall call, CuratedAnnotation annotation) throws AnnotationLookupException {
        if (call == null) {
            throw new AnnotationLookupException(annotation != null ? annotation.rsid() : null,
                AnnotationLookupException.Reason.NOT_TESTED);
        }
        if (annotation == null) {
            throw new AnnotationLookupException(call.rsid(), AnnotationLookupException.Reason.NOT_ANNOTATED);
        }

        String genotype = normalize(call);
        Zygosity zygosity = zygosity(genotype);
        RiskLevel riskLevel = riskLevel(genotype, zygosity, annotation.riskAllele());

        String interpretation = annotation.interpretationRules().get(genotype);
        if (interpretation == null) {
            interpretation = describe(genotype, zygosity, riskLevel, annotation.condition());
        }
        String recommendation = isFinding(riskLevel) ? annotation.recommendation() : null;

        return new InterpretedResult(call, annotation, genotype, zygosity, riskLevel, interpretation, recommendation);
    }

    public static String normalize(GenotypeCall call) {
        if (!call.isCalled()) {
            return GenotypeCall.NO_CALL;
        }
        return AnnotationsConfig.sortAlleles(call.genotype());
    }

    static Zygosity zygosity(String genotype) {
        if (GenotypeCall.NO_CALL.equals(genotype)) {
            return Zygosity.NO_CALL;
        }
        if (genotype.length() == 1) {
            return Zygosity.HEMIZYGOUS;
        }
        return genotype.charAt(0) == genotype.charAt(1) ? Zygosity.HOMOZYGOUS : Zygosity.HETEROZYGOUS;
    }

    static RiskLevel riskLevel(String genotype, Zygosity zygosity, String riskAllele) {
        if (zygosity == Zygosity.NO_CALL || riskAllele == null || riskAllele.length() != 1) {
            return RiskLevel.UNKNOWN;
        }
        int riskCount = 0;
        for (char allele : genotype.toCharArray()) {
            if (allele == riskAllele.charAt(0)) riskCount++;
        }
        if (zygosity == Zygosity.HEMIZYGOUS) {
            return riskCount == 1 ? RiskLevel.HIGH : RiskLevel.NORMAL;
        }
        return switch (riskCount) {
            case 2 -> RiskLevel.HIGH;
            case 1 -> RiskLevel.CARRIER;
            default -> RiskLevel.NORMAL;
        };
    }

    private static String describe(String genotype, Zygosity zygosity, RiskLevel riskLevel, String condition) {
        String text = switch (riskLevel) {
            case HIGH -> (zygosity == Zygosity.HEMIZYGOUS ? "Hemizygous" : "Homozygous")
                + " for risk allele (" + genotype + ")";
            case CARRIER -> "Heterozygous carrier (" + genotype + ")";
            case NORMAL -> "Normal genotype (" + genotype + ")";
            default -> "Genotype: " + genotype;
        };
        return condition != null && !condition.isBlank() ? text + " for " + condition : text;
    }

    private static boolean isFinding(RiskLevel riskLevel) {
        return riskLevel == RiskLevel.HIGH || riskLevel == RiskLevel.ELEVATED || riskLevel == RiskLevel.CARRIER;
    }

    // ========== APOE ==========

    private record ApoeType(String genotype, RiskLevel riskLevel, String interpretation) {}

    // keyed by "rs429358/rs7412", both in sorted allele order
    private static final Map<String, ApoeType> APOE_TYPES = Map.of(
        "TT/CC", new ApoeType("ε3/ε3", RiskLevel.NORMAL, "Most common genotype. Average Alzheimer's risk."),
        "TT/CT", new ApoeType("ε2/ε3", RiskLevel.NORMAL, "Protective genotype. Lower than average Alzheimer's risk."),
        "TT/TT", new ApoeType("ε2/ε2", RiskLevel.NORMAL, "Rare protective genotype. Lowest Alzheimer's risk."),
        "CT/CC", new ApoeType("ε3/ε4", RiskLevel.ELEVATED, "One ε4 copy. ~3x increased Alzheimer's risk."),
        "CC/CC", new ApoeType("ε4/ε4", RiskLevel.HIGH, "Two ε4 copies. ~12x increased Alzheimer's risk."),
        "CT/CT", new ApoeType("ε2/ε4", RiskLevel.ELEVATED, "Mixed genotype - one protective, one risk allele.")
    );

    /**
     * Combines the two APOE-defining SNPs into an ε genotype. Either call may be null.
     */
    public ApoeStatus classifyApoe(GenotypeCall rs429358, GenotypeCall rs7412) {
        String first = rs429358 != null ? normalize(rs429358) : GenotypeCall.NO_CALL;
        String second = rs7412 != null ? normalize(rs7412) : GenotypeCall.NO_CALL;

        if (GenotypeCall.NO_CALL.equals(first) || GenotypeCall.NO_CALL.equals(second)) {
            if ("TT".equals(first)) {
                return new ApoeStatus("ε2/ε3 or ε3/ε3 (no ε4)", first, second, RiskLevel.NORMAL,
                    "No ε4 allele detected. Average or lower Alzheimer's risk.");
            }
            return new ApoeStatus("Unknown", first, second, RiskLevel.UNKNOWN,
                "Unable to determine - missing SNP data.");
        }

        ApoeType type = APOE_TYPES.get(first + "/" + second);
        if (type == null) {
            return new ApoeStatus("Atypical (" + first + "/" + second + ")", first, second, RiskLevel.UNKNOWN,
                "Unusual combination, may need verification.");
        }
        return new ApoeStatus(type.genotype(), first, second, type.riskLevel(), type.interpretation());
    }
}
