package com.genex.service;

import com.genex.model.ApoeStatus;
import com.genex.model.CuratedAnnotation;
import com.genex.model.GenotypeCall;
import com.genex.model.InterpretedResult;
import com.genex.model.RiskLevel;
import com.genex.model.Zygosity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnnotationMatcherTest {

    private final AnnotationMatcher matcher = new AnnotationMatcher();

    private static final CuratedAnnotation FACTOR_V = new CuratedAnnotation(
        "rs6025", "F5", "health", "Factor V Leiden - blood clotting disorder",
        "Factor V Leiden Thrombophilia", "A", "G", "pathogenic", null,
        "Discuss with doctor before surgery or long flights.", Map.of(), List.of());

    private static final CuratedAnnotation ALDH2 = new CuratedAnnotation(
        "rs671", "ALDH2", "trait", "Alcohol flush reaction", "Alcohol Flush Reaction",
        "A", "G", null, null, null,
        Map.of("AG", "Moderate alcohol flush reaction likely", "GG", "No alcohol flush reaction expected"),
        List.of());

    private static GenotypeCall call(String rsid, String genotype) {
        return new GenotypeCall(rsid, "1", 1000L, genotype, "test.txt");
    }

    // ========== ZYGOSITY AND RISK ==========

    @Nested
    @DisplayName("risk allele counting")
    class RiskAlleles {

        @Test
        void heterozygousCarrier() throws Exception {
            InterpretedResult result = matcher.match(call("rs6025", "GA"), FACTOR_V);

            assertThat(result.normalizedGenotype()).isEqualTo("AG");
            assertThat(result.zygosity()).isEqualTo(Zygosity.HETEROZYGOUS);
            assertThat(result.riskLevel()).isEqualTo(RiskLevel.CARRIER);
            assertThat(result.interpretation()).isEqualTo("Heterozygous carrier (AG) for Factor V Leiden Thrombophilia");
            assertThat(result.recommendation()).startsWith("Discuss with doctor");
            assertThat(result.requiresDisclaimer()).isTrue();
        }

        @Test
        void homozygousRisk() throws Exception {
            InterpretedResult result = matcher.match(call("rs6025", "AA"), FACTOR_V);

            assertThat(result.zygosity()).isEqualTo(Zygosity.HOMOZYGOUS);
            assertThat(result.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(result.interpretation()).startsWith("Homozygous for risk allele (AA)");
        }

        @Test
        void normalGenotypeHasNoRecommendation() throws Exception {
            InterpretedResult result = matcher.match(call("rs6025", "GG"), FACTOR_V);

            assertThat(result.riskLevel()).isEqualTo(RiskLevel.NORMAL);
            assertThat(result.interpretation()).isEqualTo("Normal genotype (GG) for Factor V Leiden Thrombophilia");
            assertThat(result.recommendation()).isNull();
            assertThat(result.requiresDisclaimer()).isFalse();
        }

        @Test
        void hemizygousCall() throws Exception {
            InterpretedResult risk = matcher.match(call("rs6025", "A"), FACTOR_V);
            InterpretedResult normal = matcher.match(call("rs6025", "G"), FACTOR_V);

            assertThat(risk.zygosity()).isEqualTo(Zygosity.HEMIZYGOUS);
            assertThat(risk.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(risk.interpretation()).startsWith("Hemizygous for risk allele (A)");
            assertThat(normal.riskLevel()).isEqualTo(RiskLevel.NORMAL);
        }

        @Test
        void noCallIsUnknown() throws Exception {
            InterpretedResult result = matcher.match(call("rs6025", "--"), FACTOR_V);

            assertThat(result.zygosity()).isEqualTo(Zygosity.NO_CALL);
            assertThat(result.riskLevel()).isEqualTo(RiskLevel.UNKNOWN);
            assertThat(result.interpretation()).isEqualTo("Genotype: -- for Factor V Leiden Thrombophilia");
            assertThat(result.recommendation()).isNull();
        }

        @Test
        void unknownRiskAlleleIsUnknown() throws Exception {
            CuratedAnnotation eyeColor = new CuratedAnnotation("rs12913832", "HERC2", "trait", "Eye color",
                "Eye Color", null, null, null, null, null, Map.of(), List.of());

            InterpretedResult result = matcher.match(call("rs12913832", "AG"), eyeColor);

            assertThat(result.riskLevel()).isEqualTo(RiskLevel.UNKNOWN);
            assertThat(result.interpretation()).isEqualTo("Genotype: AG for Eye Color");
        }
    }

    // ========== ALLELE ORDER ==========

    @Nested
    @DisplayName("allele order")
    class AlleleOrder {

        @ParameterizedTest
        @CsvSource({"AG, GA", "CT, TC", "AC, CA"})
        void bothOrdersInterpretIdentically(String first, String second) throws Exception {
            CuratedAnnotation annotation = new CuratedAnnotation("rs1", "G", "trait", "d", "Condition",
                "A", "C", null, null, null, Map.of(), List.of());

            InterpretedResult a = matcher.match(call("rs1", first), annotation);
            InterpretedResult b = matcher.match(call("rs1", second), annotation);

            assertThat(a.zygosity()).isEqualTo(b.zygosity());
            assertThat(a.riskLevel()).isEqualTo(b.riskLevel());
            assertThat(a.interpretation()).isEqualTo(b.interpretation());
        }

        @Test
        void ruleTextMatchesEitherOrder() throws Exception {
            assertThat(matcher.match(call("rs671", "GA"), ALDH2).interpretation())
                .isEqualTo("Moderate alcohol flush reaction likely");
            assertThat(matcher.match(call("rs671", "AG"), ALDH2).interpretation())
                .isEqualTo("Moderate alcohol flush reaction likely");
        }

        @Test
        void fallsBackToRiskTextWithoutRule() throws Exception {
            assertThat(matcher.match(call("rs671", "AA"), ALDH2).interpretation())
                .isEqualTo("Homozygous for risk allele (AA) for Alcohol Flush Reaction");
        }
    }

    // ========== LOOKUP FAILURES ==========

    @Nested
    @DisplayName("lookup failures")
    class LookupFailures {

        @Test
        void missingCallIsNotTested() {
            assertThatThrownBy(() -> matcher.match(null, FACTOR_V))
                .isInstanceOfSatisfying(AnnotationLookupException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(AnnotationLookupException.Reason.NOT_TESTED);
                    assertThat(e.getRsid()).isEqualTo("rs6025");
                });
        }

        @Test
        void missingAnnotationIsNotAnnotated() {
            assertThatThrownBy(() -> matcher.match(call("rs999", "AA"), null))
                .isInstanceOf(AnnotationLookupException.class)
                .hasMessageContaining("rs999 has no curated annotation");
        }
    }

    // ========== APOE ==========

    @Nested
    @DisplayName("APOE")
    class Apoe {

        @ParameterizedTest(name = "{0}/{1} -> {2}")
        @CsvSource({
            "TT, CC, ε3/ε3, NORMAL",
            "TT, TC, ε2/ε3, NORMAL",
            "TT, TT, ε2/ε2, NORMAL",
            "TC, CC, ε3/ε4, ELEVATED",
            "CC, CC, ε4/ε4, HIGH",
            "CT, CT, ε2/ε4, ELEVATED"
        })
        void classifiesGenotypes(String rs429358, String rs7412, String expected, RiskLevel risk) {
            ApoeStatus status = matcher.classifyApoe(call("rs429358", rs429358), call("rs7412", rs7412));

            assertThat(status.genotype()).isEqualTo(expected);
            assertThat(status.riskLevel()).isEqualTo(risk);
        }

        @Test
        void missingRs7412WithTtRulesOutEpsilonFour() {
            ApoeStatus status = matcher.classifyApoe(call("rs429358", "TT"), null);

            assertThat(status.genotype()).contains("no ε4");
            assertThat(status.rs7412()).isEqualTo("--");
            assertThat(status.riskLevel()).isEqualTo(RiskLevel.NORMAL);
        }

        @Test
        void missingDataIsUnknown() {
            ApoeStatus status = matcher.classifyApoe(null, call("rs7412", "CC"));

            assertThat(status.genotype()).isEqualTo("Unknown");
            assertThat(status.riskLevel()).isEqualTo(RiskLevel.UNKNOWN);
        }

        @Test
        void unusualCombinationIsAtypical() {
            ApoeStatus status = matcher.classifyApoe(call("rs429358", "CC"), call("rs7412", "TT"));

            assertThat(status.genotype()).isEqualTo("Atypical (CC/TT)");
        }
    }
}
