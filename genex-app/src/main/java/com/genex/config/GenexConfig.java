package com.genex.config;

import com.genex.parser.GedcomParser;
import com.genex.parser.GenotypeFileParser;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Settings under {@code genex.*} in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "genex")
public class GenexConfig {

    private String dataDir = System.getProperty("user.home") + "/.genex";
    private final ImportSettings importSettings = new ImportSettings();
    private final TreeSettings tree = new TreeSettings();

    @Bean
    public GenotypeFileParser genotypeFileParser() {
        return new GenotypeFileParser(importSettings.getSniffLines(), importSettings.getMaxSkipRate());
    }

    @Bean
    public GedcomParser gedcomParser() {
        return new GedcomParser();
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public ImportSettings getImport() {
        return importSettings;
    }

    public TreeSettings getTree() {
        return tree;
    }

    public static class ImportSettings {
        private int sniffLines = GenotypeFileParser.DEFAULT_SNIFF_LINES;
        private double maxSkipRate = GenotypeFileParser.DEFAULT_MAX_SKIP_RATE;
        private int batchSize = 10_000;

        public int getSniffLines() { return sniffLines; }
        public void setSniffLines(int sniffLines) { this.sniffLines = sniffLines; }

        public double getMaxSkipRate() { return maxSkipRate; }
        public void setMaxSkipRate(double maxSkipRate) { this.maxSkipRate = maxSkipRate; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }

    public static class TreeSettings {
        // null means no limit
        private Integer maxGenerations;

        public Integer getMaxGenerations() { return maxGenerations; }
        public void setMaxGenerations(Integer maxGenerations) { this.maxGenerations = maxGenerations; }
    }
}
