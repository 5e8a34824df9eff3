package com.genex.model;

/**
 * A GEDCOM line kept verbatim because the importer has no dedicated field for it.
 * The path is the dotted tag chain below the record, e.g. {@code OCCU} or {@code RESI.PLAC}.
 */
public record GedcomAttribute(String tagPath, String value) {}
