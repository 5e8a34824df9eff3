package com.genex.model;

public enum Zygosity {
    HOMOZYGOUS,
    HETEROZYGOUS,
    HEMIZYGOUS,
    NO_CALL
}
