package com.genex.service;

import com.genex.config.GenexConfig;
import com.genex.model.ImportSummary;
import com.genex.parser.FormatException;
import com.genex.parser.GedcomParser;
import com.genex.parser.GedcomResult;
import com.genex.parser.GenotypeFileParser;
import com.genex.parser.GenotypeFileParser.GenotypeCallReader;
import com.genex.repository.FamilyRepository;
import com.genex.repository.GenotypeCallRepository;
import com.genex.repository.IndividualRepository;
import com.genex.repository.MetadataRepository;
import com.genex.repository.RecordAttributeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Writes parsed files into the store. Every import runs in one transaction under a single
 * writer lock: it either replaces the previous data of its kind completely or leaves it
 * untouched. A second import started while one is running fails immediately.
 */
@Service
public class ImportService {

    private static final Logger log = LoggerFactory.getLogger(ImportService.class);

    private final ReentrantLock writerLock = new ReentrantLock();
    private final TransactionTemplate transactionTemplate;
    private final GenotypeFileParser genotypeParser;
    private final GedcomParser gedcomParser;
    private final FileClassifier classifier;
    private final GenotypeCallRepository callRepository;
    private final IndividualRepository individualRepository;
    private final FamilyRepository familyRepository;
    private final RecordAttributeRepository attributeRepository;
    private final MetadataRepository metadataRepository;
    private final AnnotationTable annotationTable;
    private final int batchSize;

    public ImportService(PlatformTransactionManager transactionManager,
                         GenotypeFileParser genotypeParser,
                         GedcomParser gedcomParser,
                         FileClassifier classifier,
                         GenotypeCallRepository callRepository,
                         IndividualRepository individualRepository,
                         FamilyRepository familyRepository,
                         RecordAttributeRepository attributeRepository,
                         MetadataRepository metadataRepository,
                         AnnotationTable annotationTable,
                         GenexConfig config) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.genotypeParser = genotypeParser;
        this.gedcomParser = gedcomParser;
        this.classifier = classifier;
        this.callRepository = callRepository;
        this.individualRepository = individualRepository;
        this.familyRepository = familyRepository;
        this.attributeRepository = attributeRepository;
        this.metadataRepository = metadataRepository;
        this.annotationTable = annotationTable;
        this.batchSize = Math.max(1, config.getImport().getBatchSize());
    }

    // ========== GENOME ==========

    public ImportSummary importGenome(Path file, boolean force) throws IOException {
        return locked(() -> {
            try (GenotypeCallReader reader = genotypeParser.open(file)) {
                clearGenome(force);
                return writeGenome(reader);
            }
        });
    }

    public ImportSummary importGenome(InputStream in, String source, boolean force) throws IOException {
        return locked(() -> {
            try (GenotypeCallReader reader = genotypeParser.parse(in, source)) {
                clearGenome(force);
                return writeGenome(reader);
            }
        });
    }

    private void clearGenome(boolean force) {
        if (!force && callRepository.count() > 0) {
            throw new IllegalStateException("Genome data already imported from "
                + metadataRepository.get(MetadataRepository.GENOME_SOURCE).orElse("an earlier import")
                + "; re-import with force to replace it");
        }
        callRepository.deleteAll();
    }

    private ImportSummary writeGenome(GenotypeCallReader reader) {
        long written = callRepository.saveAll(reader, batchSize);
        long stored = callRepository.count();

        metadataRepository.put(MetadataRepository.GENOME_SOURCE, reader.getSourceFile());
        metadataRepository.put(MetadataRepository.GENOME_DATA_SOURCE, reader.getDataSource().code());
        metadataRepository.put(MetadataRepository.GENOME_BUILD, reader.getGenomeBuild().label());
        metadataRepository.put(MetadataRepository.GENOME_CALL_COUNT, Long.toString(stored));
        metadataRepository.put(MetadataRepository.GENOME_IMPORTED_AT, Instant.now().toString());
        metadataRepository.put(MetadataRepository.SNPDB_VERSION, annotationTable.version());

        log.info("Imported {} genotype calls from {} ({}, {}), {} lines skipped, {} calls stored",
            written, reader.getSourceFile(), reader.getDataSource(), reader.getGenomeBuild().label(),
            reader.getMalformedLines(), stored);
        return new ImportSummary(ImportSummary.Kind.GENOME, reader.getSourceFile(), (int) written, reader.getWarnings());
    }

    // ========== FAMILY TREE ==========

    public ImportSummary importGedcom(Path file, boolean force) throws IOException {
        return locked(() -> {
            GedcomResult result = gedcomParser.parse(file);
            clearTree(force);
            return writeTree(result, file.getFileName().toString());
        });
    }

    public ImportSummary importGedcom(InputStream in, String source, boolean force) throws IOException {
        return locked(() -> {
            GedcomResult result = gedcomParser.parse(in, source);
            clearTree(force);
            return writeTree(result, source);
        });
    }

    private void clearTree(boolean force) {
        if (!force && individualRepository.count() > 0) {
            throw new IllegalStateException("Family tree already imported from "
                + metadataRepository.get(MetadataRepository.GEDCOM_SOURCE).orElse("an earlier import")
                + "; re-import with force to replace it");
        }
        attributeRepository.deleteAll();
        familyRepository.deleteAll();
        individualRepository.deleteAll();
    }

    private ImportSummary writeTree(GedcomResult result, String source) {
        individualRepository.saveAll(result.individuals().values());
        familyRepository.saveAll(result.families().values());
        individualRepository.saveSpouseLinks(result.individuals().values());

        metadataRepository.put(MetadataRepository.GEDCOM_SOURCE, source);
        putOrClear(MetadataRepository.GEDCOM_PRODUCER, result.header().get("source"));
        putOrClear(MetadataRepository.GEDCOM_VERSION, result.header().get("version"));
        putOrClear(MetadataRepository.GEDCOM_CHARSET, result.header().get("charset"));
        metadataRepository.put(MetadataRepository.GEDCOM_IMPORTED_AT, Instant.now().toString());
        metadataRepository.put(MetadataRepository.SNPDB_VERSION, annotationTable.version());

        log.info("Imported {} individuals and {} families from {} with {} warnings",
            result.individuals().size(), result.families().size(), source, result.warnings().size());
        return new ImportSummary(ImportSummary.Kind.FAMILY_TREE, source, result.recordCount(), result.warnings());
    }

    private void putOrClear(String key, String value) {
        if (value == null || value.isEmpty()) {
            metadataRepository.delete(key);
        } else {
            metadataRepository.put(key, value);
        }
    }

    // ========== DIRECTORY ==========

    /**
     * Imports every recognized file below {@code dir} in one transaction. Genotype files are
     * merged into a single genome; at most one GEDCOM file is accepted. A {@code .txt} or
     * {@code .zip} file that is not a genotype export is skipped with a warning, unless nothing
     * else in the directory is recognized, which is a {@link FormatException}. A recognized
     * file that fails to parse rolls the whole directory back.
     */
    public List<ImportSummary> importDirectory(Path dir, boolean force) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Not a directory: " + dir);
        }
        List<Path> genomeFiles = new ArrayList<>();
        List<Path> gedcomFiles = new ArrayList<>();
        List<Path> unrecognized = new ArrayList<>();
        for (Path file : listFiles(dir)) {
            switch (classifier.classify(file)) {
                case GENOME -> genomeFiles.add(file);
                case GEDCOM -> gedcomFiles.add(file);
                case UNRECOGNIZED -> unrecognized.add(file);
                default -> log.debug("Skipping unsupported file {}", file);
            }
        }
        if (gedcomFiles.size() > 1) {
            throw new IllegalArgumentException("More than one GEDCOM file in " + dir + ": " + gedcomFiles);
        }
        if (genomeFiles.isEmpty() && gedcomFiles.isEmpty()) {
            if (!unrecognized.isEmpty()) {
                throw new FormatException(dir.toString(),
                    "no recognized genotype or GEDCOM file; not genotype exports: " + unrecognized);
            }
            log.warn("No genotype or GEDCOM files found in {}", dir);
            return List.of();
        }
        for (Path file : unrecognized) {
            log.warn("Skipping {}: not a recognized genotype export", file);
        }

        return locked(() -> {
            List<ImportSummary> summaries = new ArrayList<>();
            if (!genomeFiles.isEmpty()) {
                clearGenome(force);
                for (Path file : genomeFiles) {
                    try (GenotypeCallReader reader = genotypeParser.open(file)) {
                        summaries.add(writeGenome(reader));
                    }
                }
            }
            for (Path file : gedcomFiles) {
                GedcomResult result = gedcomParser.parse(file);
                clearTree(force);
                summaries.add(writeTree(result, file.getFileName().toString()));
            }
            return summaries;
        });
    }

    private static List<Path> listFiles(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(file -> !isHidden(dir.relativize(file)))
                .sorted()
                .toList();
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    // ========== LOCKING ==========

    @FunctionalInterface
    private interface ImportWork<T> {
        T run() throws IOException;
    }

    private <T> T locked(ImportWork<T> work) throws IOException {
        if (!writerLock.tryLock()) {
            throw new IllegalStateException("Another import is already running");
        }
        try {
            return transactionTemplate.execute(status -> {
                try {
                    return work.run();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } finally {
            writerLock.unlock();
        }
    }
}
