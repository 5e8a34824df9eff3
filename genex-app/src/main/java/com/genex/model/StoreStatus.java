package com.genex.model;

public record StoreStatus(
    long genotypeCallCount,
    long individualCount,
    long familyCount,
    String genomeSource,
    String gedcomSource,
    String snpdbVersion
) {}
