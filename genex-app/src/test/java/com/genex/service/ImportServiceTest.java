package com.genex.service;

import com.genex.model.Family;
import com.genex.model.GedcomAttribute;
import com.genex.model.GenotypeCall;
import com.genex.model.ImportSummary;
import com.genex.model.Individual;
import com.genex.model.ParseWarning;
import com.genex.model.StoreStatus;
import com.genex.parser.FormatException;
import com.genex.repository.FamilyRepository;
import com.genex.repository.GenotypeCallRepository;
import com.genex.repository.IndividualRepository;
import com.genex.repository.MetadataRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Imports run against the in-memory store. Not {@code @Transactional}: the service
 * manages its own transactions and rollback is part of what is tested.
 */
@SpringBootTest
@ActiveProfiles("test")
@Sql("/clean-store.sql")
class ImportServiceTest {

    @Autowired
    private ImportService importService;

    @Autowired
    private GenotypeCallRepository callRepository;

    @Autowired
    private IndividualRepository individualRepository;

    @Autowired
    private FamilyRepository familyRepository;

    @Autowired
    private MetadataRepository metadataRepository;

    @Autowired
    private StatusService statusService;

    @TempDir
    Path tempDir;

    static Path resource(String name) throws Exception {
        return Path.of(ImportServiceTest.class.getResource(name).toURI());
    }

    private Path copyToTemp(String resourceName, String fileName) throws Exception {
        Path target = tempDir.resolve(fileName);
        Files.createDirectories(target.getParent());
        Files.copy(resource(resourceName), target);
        return target;
    }

    // ========== GENOME ==========

    @Nested
    @DisplayName("genome import")
    class GenomeImport {

        @Test
        void importsCallsAndRecordsMetadata() throws Exception {
            ImportSummary summary = importService.importGenome(resource("/genome/synthetic_genome.txt"), false);

            assertThat(summary.kind()).isEqualTo(ImportSummary.Kind.GENOME);
            assertThat(summary.source()).isEqualTo("synthetic_genome.txt");
            assertThat(summary.recordCount()).isEqualTo(18);
            assertThat(summary.warnings()).isEmpty();
            assertThat(callRepository.count()).isEqualTo(18);
            assertThat(metadataRepository.findAll())
                .containsEntry(MetadataRepository.GENOME_SOURCE, "synthetic_genome.txt")
                .containsEntry(MetadataRepository.GENOME_DATA_SOURCE, "23andme")
                .containsEntry(MetadataRepository.GENOME_BUILD, "GRCh37")
                .containsEntry(MetadataRepository.GENOME_CALL_COUNT, "18")
                .containsEntry(MetadataRepository.SNPDB_VERSION, "1.0.0")
                .containsKey(MetadataRepository.GENOME_IMPORTED_AT);
        }

        @Test
        void forcedReimportYieldsIdenticalCallSet() throws Exception {
            importService.importGenome(resource("/genome/synthetic_genome.txt"), false);
            List<GenotypeCall> first = callRepository.findAll();

            importService.importGenome(resource("/genome/synthetic_genome.txt"), true);

            assertThat(callRepository.findAll()).isEqualTo(first);
        }

        @Test
        void refusesToReplaceWithoutForce() throws Exception {
            importService.importGenome(resource("/genome/synthetic_genome.txt"), false);

            assertThatThrownBy(() -> importService.importGenome(resource("/genome/synthetic_genome_v2.txt"), false))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("synthetic_genome.txt");
            assertThat(callRepository.count()).isEqualTo(18);
        }

        @Test
        void forcedImportReplacesPreviousGeneration() throws Exception {
            importService.importGenome(resource("/genome/synthetic_genome.txt"), false);

            importService.importGenome(resource("/genome/synthetic_genome_v2.txt"), true);

            assertThat(callRepository.count()).isEqualTo(3);
            assertThat(callRepository.findByRsid("rs429358")).map(GenotypeCall::genotype).contains("CT");
            assertThat(callRepository.findByRsid("rs12913832")).isEmpty();
        }

        @Test
        void lastDuplicateWins() throws Exception {
            ImportSummary summary = importService.importGenome(resource("/genome/duplicates.txt"), false);

            assertThat(summary.recordCount()).isEqualTo(3);
            assertThat(callRepository.count()).isEqualTo(2);
            assertThat(callRepository.findByRsid("rs3094315")).map(GenotypeCall::genotype).contains("GG");
        }

        @Test
        void reportsSkippedLinesAsWarnings() throws Exception {
            ImportSummary summary = importService.importGenome(resource("/genome/boundary_accepted.txt"), false);

            assertThat(summary.recordCount()).isEqualTo(2);
            assertThat(summary.warnings()).extracting(ParseWarning::line).containsExactly(3, 5);
        }

        @Test
        void unrecognizedFileLeavesPriorGenerationUntouched() throws Exception {
            importService.importGenome(resource("/genome/synthetic_genome.txt"), false);

            assertThatThrownBy(() -> importService.importGenome(resource("/genome/unrelated.txt"), true))
                .isInstanceOf(FormatException.class);
            assertThat(callRepository.count()).isEqualTo(18);
        }

        @Test
        void storesChrPrefixedChromosomes() throws Exception {
            String content = "# rsid\tchromosome\tposition\tgenotype\n"
                + "rs1\tchr10\t100\tAG\n"
                + "rs2\tchrXY\t200\tCC\n"
                + "rs3\tchrM\t300\tA\n";

            ImportSummary summary = importService.importGenome(
                new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), "ucsc.txt", false);

            assertThat(summary.recordCount()).isEqualTo(3);
            assertThat(callRepository.findAll()).extracting(GenotypeCall::chromosome)
                .containsExactly("10", "XY", "MT");
        }

        @Test
        void lateFormatErrorRollsBackPartialWrite() throws Exception {
            importService.importGenome(resource("/genome/synthetic_genome.txt"), false);
            StringBuilder content = new StringBuilder();
            for (int i = 1; i <= 1000; i++) {
                content.append("rs").append(900000 + i).append("\t1\t").append(i).append("\tAA\n");
            }
            for (int i = 0; i < 1001; i++) {
                content.append("garbage\n");
            }

            assertThatThrownBy(() -> importService.importGenome(
                new ByteArrayInputStream(content.toString().getBytes(StandardCharsets.UTF_8)), "late.txt", true))
                .isInstanceOf(FormatException.class)
                .hasMessageContaining("in the file");
            assertThat(callRepository.count()).isEqualTo(18);
            assertThat(callRepository.findByRsid("rs900001")).isEmpty();
        }
    }

    // ========== FAMILY TREE ==========

    @Nested
    @DisplayName("family tree import")
    class FamilyTreeImport {

        @Test
        void storesIndividualsFamiliesAndLinks() throws Exception {
            ImportSummary summary = importService.importGedcom(resource("/gedcom/synthetic_family.ged"), false);

            assertThat(summary.kind()).isEqualTo(ImportSummary.Kind.FAMILY_TREE);
            assertThat(summary.recordCount()).isEqualTo(14);
            assertThat(individualRepository.count()).isEqualTo(10);
            assertThat(familyRepository.count()).isEqualTo(4);

            Individual alex = individualRepository.findById("I1").orElseThrow();
            assertThat(alex.parentFamilyRef()).isEqualTo("F1");
            assertThat(alex.attributes()).containsExactly(new GedcomAttribute("OCCU", "Software Engineer"));
            assertThat(individualRepository.findById("I2").orElseThrow().spouseFamilyRefs()).containsExactly("F1");

            Family family = familyRepository.findById("F1").orElseThrow();
            assertThat(family.childRefs()).containsExactly("I1", "I10");
            assertThat(family.marriagePlace()).isEqualTo("Denver, Colorado, USA");
        }

        @Test
        void recordsHeaderInMetadata() throws Exception {
            importService.importGedcom(resource("/gedcom/synthetic_family.ged"), false);

            assertThat(metadataRepository.findAll())
                .containsEntry(MetadataRepository.GEDCOM_SOURCE, "synthetic_family.ged")
                .containsEntry(MetadataRepository.GEDCOM_PRODUCER, "GENEX_TEST")
                .containsEntry(MetadataRepository.GEDCOM_VERSION, "5.5.1")
                .containsEntry(MetadataRepository.GEDCOM_CHARSET, "UTF-8");
        }

        @Test
        void replacingTreeClearsStaleHeaderMetadata() throws Exception {
            importService.importGedcom(resource("/gedcom/synthetic_family.ged"), false);

            importService.importGedcom(resource("/gedcom/smith_family.ged"), true);

            assertThat(metadataRepository.findAll())
                .containsEntry(MetadataRepository.GEDCOM_VERSION, "5.5.1")
                .doesNotContainKeys(MetadataRepository.GEDCOM_PRODUCER, MetadataRepository.GEDCOM_CHARSET);
        }

        @Test
        void danglingParentFamilyImportsWithWarning() throws Exception {
            ImportSummary summary = importService.importGedcom(resource("/gedcom/dangling_famc.ged"), false);

            assertThat(summary.warnings()).extracting(ParseWarning::message)
                .anySatisfy(m -> assertThat(m).contains("F9"));
            assertThat(individualRepository.findById("I1").orElseThrow().parentFamilyRef()).isNull();
        }

        @Test
        void forcedReimportReplacesTree() throws Exception {
            importService.importGedcom(resource("/gedcom/synthetic_family.ged"), false);

            importService.importGedcom(resource("/gedcom/smith_family.ged"), true);

            assertThat(individualRepository.count()).isEqualTo(5);
            assertThat(familyRepository.count()).isEqualTo(1);
            assertThat(individualRepository.findById("I10")).isEmpty();
        }

        @Test
        void rejectedFileLeavesTreeUntouched() throws Exception {
            importService.importGedcom(resource("/gedcom/synthetic_family.ged"), false);

            assertThatThrownBy(() -> importService.importGedcom(resource("/gedcom/not_gedcom.ged"), true))
                .isInstanceOf(FormatException.class);
            assertThat(individualRepository.count()).isEqualTo(10);
        }

        @Test
        void refusesToReplaceWithoutForce() throws Exception {
            importService.importGedcom(resource("/gedcom/synthetic_family.ged"), false);

            assertThatThrownBy(() -> importService.importGedcom(resource("/gedcom/smith_family.ged"), false))
                .isInstanceOf(IllegalStateException.class);
            assertThat(individualRepository.count()).isEqualTo(10);
        }
    }

    // ========== DIRECTORY ==========

    @Nested
    @DisplayName("directory import")
    class DirectoryImport {

        @Test
        void importsRecognizedFilesAndSkipsTheRest() throws Exception {
            copyToTemp("/genome/synthetic_genome.txt", "genome/synthetic_genome.txt");
            copyToTemp("/gedcom/synthetic_family.ged", "tree/family.ged");
            Files.writeString(tempDir.resolve("notes.pdf"), "not imported");
            copyToTemp("/genome/unrelated.txt", ".cache/unrelated.txt");
            copyToTemp("/genome/unrelated.txt", ".hidden.txt");

            List<ImportSummary> summaries = importService.importDirectory(tempDir, false);

            assertThat(summaries).extracting(ImportSummary::kind)
                .containsExactly(ImportSummary.Kind.GENOME, ImportSummary.Kind.FAMILY_TREE);
            StoreStatus status = statusService.status();
            assertThat(status.genotypeCallCount()).isEqualTo(18);
            assertThat(status.individualCount()).isEqualTo(10);
            assertThat(status.familyCount()).isEqualTo(4);
            assertThat(status.genomeSource()).isEqualTo("synthetic_genome.txt");
            assertThat(status.gedcomSource()).isEqualTo("family.ged");
            assertThat(status.snpdbVersion()).isEqualTo("1.0.0");
            assertThat(statusService.metadata()).containsKeys(
                MetadataRepository.GENOME_IMPORTED_AT, MetadataRepository.GEDCOM_IMPORTED_AT);
        }

        @Test
        void skipsTextFileThatIsNotAGenotypeExport() throws Exception {
            copyToTemp("/genome/synthetic_genome.txt", "genome.txt");
            Files.writeString(tempDir.resolve("README.txt"), "Raw data downloaded from the vendor.\nKeep private.\n");

            List<ImportSummary> summaries = importService.importDirectory(tempDir, false);

            assertThat(summaries).extracting(ImportSummary::source).containsExactly("genome.txt");
            assertThat(callRepository.count()).isEqualTo(18);
        }

        @Test
        void unrelatedTextFileFailsAndKeepsPriorGeneration() throws Exception {
            importService.importGenome(resource("/genome/synthetic_genome.txt"), false);
            copyToTemp("/genome/unrelated.txt", "unrelated.txt");

            assertThatThrownBy(() -> importService.importDirectory(tempDir, true))
                .isInstanceOf(FormatException.class);
            assertThat(callRepository.count()).isEqualTo(18);
            assertThat(callRepository.findByRsid("rs429358")).map(GenotypeCall::genotype).contains("TT");
        }

        @Test
        void failureInLaterFileRollsBackWholeDirectory() throws Exception {
            copyToTemp("/genome/synthetic_genome.txt", "a_genome.txt");
            copyToTemp("/gedcom/not_gedcom.ged", "b_tree.ged");

            assertThatThrownBy(() -> importService.importDirectory(tempDir, false))
                .isInstanceOf(FormatException.class);
            assertThat(callRepository.count()).isZero();
        }

        @Test
        void mergesSeveralGenotypeFiles() throws Exception {
            copyToTemp("/genome/synthetic_genome.txt", "a.txt");
            copyToTemp("/genome/duplicates.txt", "b.txt");

            List<ImportSummary> summaries = importService.importDirectory(tempDir, false);

            assertThat(summaries).hasSize(2);
            assertThat(callRepository.findByRsid("rs3094315")).map(GenotypeCall::genotype).contains("GG");
            assertThat(callRepository.count()).isEqualTo(18);
        }

        @Test
        void emptyDirectoryImportsNothing() throws Exception {
            assertThat(importService.importDirectory(tempDir, false)).isEmpty();
        }

        @Test
        void rejectsMissingDirectory() {
            assertThatThrownBy(() -> importService.importDirectory(tempDir.resolve("missing"), false))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ========== WRITER LOCK ==========

    @Test
    void secondConcurrentImportFailsFast() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InputStream slow = new GatedInputStream(
            Files.readAllBytes(resource("/genome/synthetic_genome.txt")), started, release);

        CompletableFuture<ImportSummary> first = CompletableFuture.supplyAsync(() -> {
            try {
                return importService.importGenome(slow, "slow.txt", true);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> importService.importGenome(resource("/genome/duplicates.txt"), true))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already running");
        } finally {
            release.countDown();
        }
        assertThat(first.get(10, TimeUnit.SECONDS).recordCount()).isEqualTo(18);
    }

    /**
     * Blocks the first read until released, keeping the importer inside its lock.
     */
    private static class GatedInputStream extends InputStream {
        private final ByteArrayInputStream delegate;
        private final CountDownLatch started;
        private final CountDownLatch release;

        GatedInputStream(byte[] content, CountDownLatch started, CountDownLatch release) {
            this.delegate = new ByteArrayInputStream(content);
            this.started = started;
            this.release = release;
        }

        private void awaitRelease() throws IOException {
            started.countDown();
            try {
                if (!release.await(10, TimeUnit.SECONDS)) {
                    throw new IOException("not released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException(e);
            }
        }

        @Override
        public int read() throws IOException {
            awaitRelease();
            return delegate.read();
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            awaitRelease();
            return delegate.read(b, off, len);
        }
    }
}
