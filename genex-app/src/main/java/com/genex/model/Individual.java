package com.genex.model;

import java.util.List;

public record Individual(
    String id,
    String givenName,
    String surname,
    Sex sex,
    String birthDate,
    String birthPlace,
    String deathDate,
    String deathPlace,
    String parentFamilyRef,
    List<String> spouseFamilyRefs,
    List<GedcomAttribute> attributes
) {
    public Individual {
        givenName = givenName != null ? givenName : "";
        surname = surname != null ? surname : "";
        sex = sex != null ? sex : Sex.UNKNOWN;
        spouseFamilyRefs = spouseFamilyRefs != null ? List.copyOf(spouseFamilyRefs) : List.of();
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
    }

    public String fullName() {
        StringBuilder sb = new StringBuilder();
        if (givenName != null && !givenName.isBlank()) {
            sb.append(givenName);
        }
        if (surname != null && !surname.isBlank()) {
            if (sb.length() > 0) sb.append(" ");
            sb.append(surname);
        }
        return sb.toString();
    }

    public String displayName() {
        String full = fullName();
        return full.isEmpty() ? "Unknown" : full;
    }

    public String lifespan() {
        if (isBlank(birthDate) && isBlank(deathDate)) {
            return "";
        }
        if (isBlank(deathDate)) {
            return "b. " + birthDate;
        }
        return (isBlank(birthDate) ? "?" : birthDate) + " - " + deathDate;
    }

    /**
     * Both birth date and birth place are recorded.
     */
    public boolean hasCompleteBirthRecord() {
        return !isBlank(birthDate) && !isBlank(birthPlace);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
