package com.genex.parser;

import com.genex.model.Family;
import com.genex.model.FamilyGraph;
import com.genex.model.GedcomAttribute;
import com.genex.model.Individual;
import com.genex.model.ParseWarning;
import com.genex.model.Sex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented GEDCOM 5.5 reader. Builds individuals and families from INDI and FAM
 * records, resolves their cross references and flags individuals that are their own
 * ancestor. Dates are kept verbatim.
 */
public class GedcomParser {

    static final String HEADER_LINE = "0 HEAD";

    private static final Pattern LINE = Pattern.compile("^(\\d{1,2})\\s+(?:(@[^@\\s]+@)\\s+)?(\\S+)(?:\\s(.*))?$");
    private static final Pattern POINTER = Pattern.compile("^@([^@\\s]+)@$");

    private final Logger log;

    public GedcomParser() {
        this(LoggerFactory.getLogger(GedcomParser.class));
    }

    // For testing only
    GedcomParser(Logger log) {
        this.log = log;
    }

    public GedcomResult parse(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file.getFileName().toString());
        }
    }

    /**
     * @throws FormatException if the first non-blank line is not {@code 0 HEAD}
     */
    public GedcomResult parse(InputStream in, String source) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        ParseState state = new ParseState(source);
        String line;
        while ((line = reader.readLine()) != null) {
            if (!state.accept(line)) {
                break;
            }
        }
        GedcomResult result = state.finish();
        log.info("Parsed {}: {} individuals, {} families, {} warnings",
            source, result.individuals().size(), result.families().size(), result.warnings().size());
        return result;
    }

    /**
     * Whether the first non-blank line of the file is {@code 0 HEAD}. Never throws.
     */
    public boolean detect(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int read = 0;
            while ((line = reader.readLine()) != null && read++ < 16) {
                String trimmed = GenotypeFileParser.stripBom(line).trim();
                if (!trimmed.isEmpty()) {
                    return HEADER_LINE.equals(trimmed);
                }
            }
            return false;
        } catch (IOException | RuntimeException e) {
            log.debug("Not a GEDCOM file {}: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * {@code @I1@} becomes {@code I1}. Returns null when the value is not a pointer.
     */
    public static String canonicalId(String pointer) {
        if (pointer == null) {
            return null;
        }
        Matcher m = POINTER.matcher(pointer.trim());
        return m.matches() ? m.group(1) : null;
    }

    private record Node(int level, String path, RecordBuilder record) {}

    private record Ref(String id, int line) {}

    /**
     * Receives the sub-lines of one level-0 record. {@code path} is the dot-joined tag path
     * below the record, e.g. {@code BIRT.DATE}.
     */
    private interface RecordBuilder {
        void accept(String path, String value, int line, List<ParseWarning> warnings);
    }

    private final class ParseState {
        private final String source;
        private final Map<String, IndividualBuilder> individuals = new LinkedHashMap<>();
        private final Map<String, FamilyBuilder> families = new LinkedHashMap<>();
        private final Map<String, String> header = new LinkedHashMap<>();
        private final List<ParseWarning> warnings = new ArrayList<>();
        private final Deque<Node> stack = new ArrayDeque<>();
        private int lineNumber;
        private boolean headerSeen;
        private boolean trailerSeen;

        ParseState(String source) {
            this.source = source;
        }

        /**
         * @return false once the trailer has been read
         */
        boolean accept(String raw) {
            lineNumber++;
            String line = lineNumber == 1 ? GenotypeFileParser.stripBom(raw) : raw;
            line = line.trim();
            if (line.isEmpty()) {
                return true;
            }
            if (!headerSeen) {
                if (!HEADER_LINE.equals(line)) {
                    throw new FormatException(source, "not a GEDCOM file, expected '" + HEADER_LINE
                        + "' on line " + lineNumber);
                }
                headerSeen = true;
                stack.push(new Node(0, "", this::acceptHeader));
                return true;
            }

            Matcher m = LINE.matcher(line);
            if (!m.matches()) {
                warn(lineNumber, "malformed line ignored: " + abbreviate(line));
                return true;
            }
            int level = Integer.parseInt(m.group(1));
            String xref = m.group(2);
            String tag = m.group(3).toUpperCase(Locale.ROOT);
            String value = m.group(4) != null ? m.group(4).trim() : "";

            if (level == 0) {
                stack.clear();
                if ("TRLR".equals(tag)) {
                    trailerSeen = true;
                    return false;
                }
                stack.push(new Node(0, "", openRecord(xref, tag)));
                return true;
            }

            while (!stack.isEmpty() && stack.peek().level() >= level) {
                stack.pop();
            }
            if (stack.isEmpty() || stack.peek().level() != level - 1) {
                warn(lineNumber, "level " + level + " line has no enclosing level " + (level - 1) + " line, ignored");
                return true;
            }
            Node parent = stack.peek();
            String path = parent.path().isEmpty() ? tag : parent.path() + "." + tag;
            stack.push(new Node(level, path, parent.record()));
            if (parent.record() != null) {
                parent.record().accept(path, value, lineNumber, warnings);
            }
            return true;
        }

        private RecordBuilder openRecord(String xref, String tag) {
            String id = canonicalId(xref);
            switch (tag) {
                case "HEAD":
                    return this::acceptHeader;
                case "INDI":
                    if (id == null) {
                        warn(lineNumber, "INDI record without an id ignored");
                        return null;
                    }
                    if (individuals.containsKey(id) || families.containsKey(id)) {
                        warn(lineNumber, "duplicate record id " + id + ", keeping the first");
                        return null;
                    }
                    IndividualBuilder individual = new IndividualBuilder(id);
                    individuals.put(id, individual);
                    return individual;
                case "FAM":
                    if (id == null) {
                        warn(lineNumber, "FAM record without an id ignored");
                        return null;
                    }
                    if (families.containsKey(id) || individuals.containsKey(id)) {
                        warn(lineNumber, "duplicate record id " + id + ", keeping the first");
                        return null;
                    }
                    FamilyBuilder family = new FamilyBuilder(id);
                    families.put(id, family);
                    return family;
                default:
                    // NOTE, SOUR, SUBM, OBJE, REPO ...
                    return null;
            }
        }

        private void acceptHeader(String path, String value, int line, List<ParseWarning> sink) {
            switch (path) {
                case "SOUR" -> header.putIfAbsent("source", value);
                case "GEDC.VERS" -> header.putIfAbsent("version", value);
                case "CHAR" -> header.putIfAbsent("charset", value);
                default -> { }
            }
        }

        GedcomResult finish() {
            if (!headerSeen) {
                throw new FormatException(source, "empty file, expected '" + HEADER_LINE + "'");
            }
            if (!trailerSeen) {
                warnings.add(ParseWarning.unlocated("missing 0 TRLR, file may be truncated"));
            }

            Map<String, Individual> resolvedIndividuals = new LinkedHashMap<>();
            for (IndividualBuilder builder : individuals.values()) {
                resolvedIndividuals.put(builder.id, builder.build());
            }
            Map<String, Family> resolvedFamilies = new LinkedHashMap<>();
            for (FamilyBuilder builder : families.values()) {
                resolvedFamilies.put(builder.id, builder.build());
            }

            SortedSet<String> cyclic = FamilyGraph.of(resolvedIndividuals.values(), resolvedFamilies.values())
                .cycleMembers();
            for (String id : cyclic) {
                warnings.add(ParseWarning.unlocated(id + " is their own ancestor (cyclic parent links)"));
            }

            for (ParseWarning warning : warnings) {
                log.warn("{}: {}", source, warning);
            }
            return new GedcomResult(resolvedIndividuals, resolvedFamilies, warnings, header, cyclic);
        }

        private String resolveFamily(Ref ref, String owner, String tag) {
            if (ref == null) {
                return null;
            }
            if (!families.containsKey(ref.id())) {
                warn(ref.line(), tag + " of " + owner + " points to unknown family " + ref.id() + ", link dropped");
                return null;
            }
            return ref.id();
        }

        private String resolveIndividual(Ref ref, String owner, String tag) {
            if (ref == null) {
                return null;
            }
            if (!individuals.containsKey(ref.id())) {
                warn(ref.line(), tag + " of " + owner + " points to unknown individual " + ref.id() + ", link dropped");
                return null;
            }
            return ref.id();
        }

        private Ref pointer(String tag, String value, int line, String owner) {
            String id = canonicalId(value);
            if (id == null) {
                warn(line, tag + " of " + owner + " is not a pointer: " + abbreviate(value));
            }
            return id == null ? null : new Ref(id, line);
        }

        private void warn(int line, String message) {
            warnings.add(ParseWarning.atLine(line, message));
        }

        private final class IndividualBuilder implements RecordBuilder {
            private final String id;
            private int nameCount;
            private String givenName;
            private String surname;
            private Sex sex = Sex.UNKNOWN;
            private String birthDate;
            private String birthPlace;
            private String deathDate;
            private String deathPlace;
            private Ref parentFamily;
            private final List<Ref> spouseFamilies = new ArrayList<>();
            private final List<GedcomAttribute> attributes = new ArrayList<>();

            IndividualBuilder(String id) {
                this.id = id;
            }

            @Override
            public void accept(String path, String value, int line, List<ParseWarning> sink) {
                switch (path) {
                    case "NAME" -> {
                        nameCount++;
                        if (nameCount == 1) {
                            splitName(value);
                        } else {
                            attribute(path, value);
                        }
                    }
                    case "NAME.GIVN" -> {
                        if (nameCount == 1 && !value.isEmpty()) givenName = value;
                    }
                    case "NAME.SURN" -> {
                        if (nameCount == 1 && !value.isEmpty()) surname = value;
                    }
                    case "SEX" -> sex = Sex.fromCode(value);
                    case "BIRT.DATE" -> birthDate = firstNonEmpty(birthDate, value);
                    case "BIRT.PLAC" -> birthPlace = firstNonEmpty(birthPlace, value);
                    case "DEAT.DATE" -> deathDate = firstNonEmpty(deathDate, value);
                    case "DEAT.PLAC" -> deathPlace = firstNonEmpty(deathPlace, value);
                    case "FAMC" -> {
                        Ref ref = pointer("FAMC", value, line, id);
                        if (ref != null && parentFamily != null) {
                            warn(line, "additional FAMC " + ref.id() + " of " + id + " ignored, keeping "
                                + parentFamily.id());
                        } else if (ref != null) {
                            parentFamily = ref;
                        }
                    }
                    case "FAMS" -> {
                        Ref ref = pointer("FAMS", value, line, id);
                        if (ref != null) spouseFamilies.add(ref);
                    }
                    default -> attribute(path, value);
                }
            }

            private void splitName(String value) {
                int open = value.indexOf('/');
                if (open < 0) {
                    givenName = value.trim();
                    surname = "";
                    return;
                }
                int close = value.indexOf('/', open + 1);
                givenName = value.substring(0, open).trim();
                surname = (close < 0 ? value.substring(open + 1) : value.substring(open + 1, close)).trim();
            }

            private void attribute(String path, String value) {
                if (!value.isEmpty()) {
                    attributes.add(new GedcomAttribute(path, value));
                }
            }

            Individual build() {
                List<String> resolvedSpouseFamilies = new ArrayList<>();
                for (Ref ref : spouseFamilies) {
                    String familyId = resolveFamily(ref, id, "FAMS");
                    if (familyId != null && !resolvedSpouseFamilies.contains(familyId)) {
                        resolvedSpouseFamilies.add(familyId);
                    }
                }
                return new Individual(id, nullToEmpty(givenName), nullToEmpty(surname), sex,
                    birthDate, birthPlace, deathDate, deathPlace,
                    resolveFamily(parentFamily, id, "FAMC"), resolvedSpouseFamilies, attributes);
            }
        }

        private final class FamilyBuilder implements RecordBuilder {
            private final String id;
            private Ref husband;
            private Ref wife;
            private String marriageDate;
            private String marriagePlace;
            private final List<Ref> children = new ArrayList<>();
            private final List<GedcomAttribute> attributes = new ArrayList<>();

            FamilyBuilder(String id) {
                this.id = id;
            }

            @Override
            public void accept(String path, String value, int line, List<ParseWarning> sink) {
                switch (path) {
                    case "HUSB" -> husband = spouse("HUSB", husband, value, line);
                    case "WIFE" -> wife = spouse("WIFE", wife, value, line);
                    case "CHIL" -> {
                        Ref ref = pointer("CHIL", value, line, id);
                        if (ref != null) children.add(ref);
                    }
                    case "MARR.DATE" -> marriageDate = firstNonEmpty(marriageDate, value);
                    case "MARR.PLAC" -> marriagePlace = firstNonEmpty(marriagePlace, value);
                    default -> {
                        if (!value.isEmpty()) attributes.add(new GedcomAttribute(path, value));
                    }
                }
            }

            private Ref spouse(String tag, Ref current, String value, int line) {
                Ref ref = pointer(tag, value, line, id);
                if (ref == null) {
                    return current;
                }
                if (current != null) {
                    warn(line, "additional " + tag + " " + ref.id() + " of " + id + " ignored");
                    return current;
                }
                return ref;
            }

            Family build() {
                List<String> childIds = new ArrayList<>();
                for (Ref ref : children) {
                    String childId = resolveIndividual(ref, id, "CHIL");
                    if (childId != null && !childIds.contains(childId)) {
                        childIds.add(childId);
                    }
                }
                return new Family(id, resolveIndividual(husband, id, "HUSB"), resolveIndividual(wife, id, "WIFE"),
                    marriageDate, marriagePlace, childIds, attributes);
            }
        }
    }

    private static String firstNonEmpty(String current, String value) {
        return current != null || value.isEmpty() ? current : value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String abbreviate(String line) {
        return line.length() > 60 ? line.substring(0, 57) + "..." : line;
    }
}
