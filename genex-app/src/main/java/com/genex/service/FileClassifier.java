package com.genex.service;

import com.genex.parser.GedcomParser;
import com.genex.parser.GenotypeFileParser;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Decides how a file found while scanning a data directory should be imported.
 * GEDCOM files are recognized by extension or content. A {@code .txt}/{@code .zip} file is a
 * genotype export only if the genotype parser recognizes it; otherwise it is UNRECOGNIZED.
 */
@Component
public class FileClassifier {

    public enum FileKind {
        GEDCOM,
        GENOME,
        UNRECOGNIZED,
        UNSUPPORTED
    }

    private final GedcomParser gedcomParser;
    private final GenotypeFileParser genotypeParser;

    public FileClassifier(GedcomParser gedcomParser, GenotypeFileParser genotypeParser) {
        this.gedcomParser = gedcomParser;
        this.genotypeParser = genotypeParser;
    }

    public FileKind classify(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.startsWith(".")) {
            return FileKind.UNSUPPORTED;
        }
        if (name.endsWith(".ged") || name.endsWith(".gedcom") || gedcomParser.detect(file)) {
            return FileKind.GEDCOM;
        }
        if (name.endsWith(".txt") || name.endsWith(".zip")) {
            return genotypeParser.detect(file) ? FileKind.GENOME : FileKind.UNRECOGNIZED;
        }
        return FileKind.UNSUPPORTED;
    }
}
