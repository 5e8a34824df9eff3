package com.genex.config;

import com.genex.model.CuratedAnnotation;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Curated SNP reference table.
 * Entries are defined in snpdb.yml under 'genex.snpdb.annotations'
 */
@Configuration
@ConfigurationProperties(prefix = "genex.snpdb")
public class AnnotationsConfig {

    private String version = "unversioned";
    private String date;
    private List<AnnotationDefinition> annotations = new ArrayList<>();

    public List<CuratedAnnotation> toAnnotations() {
        return annotations.stream()
            .map(AnnotationDefinition::toAnnotation)
            .toList();
    }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public String getDate() { return date; }
    public void setDate(String date) { this.date = date; }

    public List<AnnotationDefinition> getAnnotations() { return annotations; }
    public void setAnnotations(List<AnnotationDefinition> annotations) { this.annotations = annotations; }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class AnnotationDefinition {
        private String rsid;
        private String gene;
        private String category;
        private String description;
        private String condition;
        private String riskAllele;
        private String normalAllele;
        private String clinicalSignificance;
        private String drugs;
        private String recommendation;
        private List<InterpretationRule> interpretations = new ArrayList<>();
        private List<String> citations = new ArrayList<>();

        public CuratedAnnotation toAnnotation() {
            Map<String, String> rules = new LinkedHashMap<>();
            for (InterpretationRule rule : interpretations) {
                rules.putIfAbsent(sortAlleles(rule.getGenotype()), rule.getText());
            }
            return new CuratedAnnotation(
                rsid, gene, category, description, condition,
                upper(riskAllele), upper(normalAllele), clinicalSignificance,
                drugs, recommendation, rules, citations
            );
        }

        // Getters and setters for Spring Boot binding
        public String getRsid() { return rsid; }
        public void setRsid(String rsid) { this.rsid = rsid; }

        public String getGene() { return gene; }
        public void setGene(String gene) { this.gene = gene; }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public String getCondition() { return condition; }
        public void setCondition(String condition) { this.condition = condition; }

        public String getRiskAllele() { return riskAllele; }
        public void setRiskAllele(String riskAllele) { this.riskAllele = riskAllele; }

        public String getNormalAllele() { return normalAllele; }
        public void setNormalAllele(String normalAllele) { this.normalAllele = normalAllele; }

        public String getClinicalSignificance() { return clinicalSignificance; }
        public void setClinicalSignificance(String clinicalSignificance) { this.clinicalSignificance = clinicalSignificance; }

        public String getDrugs() { return drugs; }
        public void setDrugs(String drugs) { this.drugs = drugs; }

        public String getRecommendation() { return recommendation; }
        public void setRecommendation(String recommendation) { this.recommendation = recommendation; }

        public List<InterpretationRule> getInterpretations() { return interpretations; }
        public void setInterpretations(List<InterpretationRule> interpretations) { this.interpretations = interpretations; }

        public List<String> getCitations() { return citations; }
        public void setCitations(List<String> citations) { this.citations = citations; }
    }

    public static class InterpretationRule {
        private String genotype;
        private String text;

        public String getGenotype() { return genotype; }
        public void setGenotype(String genotype) { this.genotype = genotype; }

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }
    }

    /**
     * Upper-cases and sorts the alleles of a genotype pattern so that AG and GA share a key.
     */
    public static String sortAlleles(String genotype) {
        if (genotype == null) {
            return "";
        }
        char[] alleles = genotype.trim().toUpperCase(Locale.ROOT).toCharArray();
        Arrays.sort(alleles);
        return new String(alleles);
    }

    private static String upper(String allele) {
        return allele == null || allele.isBlank() ? null : allele.trim().toUpperCase(Locale.ROOT);
    }
}
