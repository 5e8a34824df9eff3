package com.genex.model;

import java.util.ArrayList;
import java.util.List;

public record Family(
    String id,
    String husbandRef,
    String wifeRef,
    String marriageDate,
    String marriagePlace,
    List<String> childRefs,
    List<GedcomAttribute> attributes
) {
    public Family {
        childRefs = childRefs != null ? List.copyOf(childRefs) : List.of();
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
    }

    /**
     * Husband then wife, skipping whichever is absent.
     */
    public List<String> spouseRefs() {
        List<String> spouses = new ArrayList<>(2);
        if (husbandRef != null) spouses.add(husbandRef);
        if (wifeRef != null) spouses.add(wifeRef);
        return spouses;
    }
}
