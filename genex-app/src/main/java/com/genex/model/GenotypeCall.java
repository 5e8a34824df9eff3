package com.genex.model;

public record GenotypeCall(
    String rsid,
    String chromosome,
    long position,
    String genotype,
    String sourceFile
) {
    public static final String NO_CALL = "--";

    public boolean isCalled() {
        return genotype != null && !genotype.isEmpty() && !NO_CALL.equals(genotype);
    }

    public boolean isHaploid() {
        return genotype != null && genotype.length() == 1;
    }

    /**
     * Alleles of the call. A haploid call yields a single allele.
     */
    public char[] alleles() {
        return genotype == null ? new char[0] : genotype.toCharArray();
    }

    public int countAllele(char allele) {
        int count = 0;
        for (char c : alleles()) {
            if (c == allele) count++;
        }
        return count;
    }
}
