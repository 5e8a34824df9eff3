package com.genex.service;

/**
 * An rsid could not be interpreted, either because the genome has no call for it
 * or because the curated table does not cover it.
 */
public class AnnotationLookupException extends Exception {

    public enum Reason {
        NOT_TESTED,
        NOT_ANNOTATED
    }

    private final String rsid;
    private final Reason reason;

    public AnnotationLookupException(String rsid, Reason reason) {
        super(describe(rsid, reason));
        this.rsid = rsid;
        this.reason = reason;
    }

    public String getRsid() {
        return rsid;
    }

    public Reason getReason() {
        return reason;
    }

    private static String describe(String rsid, Reason reason) {
        return switch (reason) {
            case NOT_TESTED -> rsid + " was not tested in the imported genome";
            case NOT_ANNOTATED -> rsid + " has no curated annotation";
        };
    }
}
