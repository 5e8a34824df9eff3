package com.genex.parser;

import com.genex.model.DataSource;
import com.genex.model.GenomeBuild;
import com.genex.model.GenotypeCall;
import com.genex.model.ParseWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads consumer genotype exports: comment header lines followed by
 * {@code rsid chromosome position genotype} rows, tab or space delimited.
 */
public class GenotypeFileParser {

    public static final int DEFAULT_SNIFF_LINES = 1000;
    public static final double DEFAULT_MAX_SKIP_RATE = 0.5;

    private static final int RSID_COLUMN = 0;
    private static final int CHROMOSOME_COLUMN = 1;
    private static final int POSITION_COLUMN = 2;
    private static final int GENOTYPE_COLUMN = 3;
    private static final int COLUMN_COUNT = 4;

    private static final Pattern DELIMITER = Pattern.compile("[\\t ]+");
    private static final Pattern RSID_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9_.:-]*");
    private static final Pattern CHROMOSOME_PATTERN = Pattern.compile("(?i)(?:chr)?(?:[1-9]|1\\d|2[0-6]|X|Y|XY|MT|M)");
    private static final Pattern COLUMN_HEADER = Pattern.compile("(?i)#?\\s*rsid[\\t ]+chrom\\w*[\\t ]+pos\\w*[\\t ]+.*");

    private static final Set<Character> NUCLEOTIDES = Set.of('A', 'C', 'G', 'T');
    private static final Set<Character> INDELS = Set.of('D', 'I');

    private final Logger log;
    private final int sniffLines;
    private final double maxSkipRate;

    public GenotypeFileParser() {
        this(DEFAULT_SNIFF_LINES, DEFAULT_MAX_SKIP_RATE);
    }

    public GenotypeFileParser(int sniffLines, double maxSkipRate) {
        this(sniffLines, maxSkipRate, LoggerFactory.getLogger(GenotypeFileParser.class));
    }

    // For testing only
    GenotypeFileParser(int sniffLines, double maxSkipRate, Logger log) {
        if (sniffLines <= 0) {
            throw new IllegalArgumentException("sniffLines must be positive");
        }
        if (maxSkipRate < 0 || maxSkipRate > 1) {
            throw new IllegalArgumentException("maxSkipRate must be between 0 and 1");
        }
        this.sniffLines = sniffLines;
        this.maxSkipRate = maxSkipRate;
        this.log = log;
    }

    /**
     * Open a genotype file, reading the first {@code .txt} entry when given a zip archive.
     * The returned reader owns the file handle.
     */
    public GenotypeCallReader open(Path file) throws IOException {
        String name = file.getFileName().toString();
        InputStream in = Files.newInputStream(file);
        try {
            if (name.toLowerCase(Locale.ROOT).endsWith(".zip")) {
                in = firstTextEntry(new ZipInputStream(in), name);
            }
            return parse(in, name);
        } catch (IOException | RuntimeException e) {
            in.close();
            throw e;
        }
    }

    /**
     * Sniff the head of the stream and return a lazy reader over its calls.
     *
     * @throws FormatException if the head of the stream is not a genotype export
     */
    public GenotypeCallReader parse(InputStream in, String sourceFile) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        GenotypeCallReader callReader = new GenotypeCallReader(reader, sourceFile);
        callReader.sniff();
        return callReader;
    }

    /**
     * Whether the file looks like a genotype export. Never throws for unreadable or foreign files.
     */
    public boolean detect(Path file) {
        try (GenotypeCallReader ignored = open(file)) {
            return true;
        } catch (FormatException | IOException e) {
            log.debug("{} is not a genotype file: {}", file, e.getMessage());
            return false;
        }
    }

    static String normalizeGenotype(String raw) {
        return raw.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Upper-cased with any {@code chr} prefix removed; {@code M} becomes {@code MT}.
     */
    static String normalizeChromosome(String raw) {
        String chromosome = raw.trim().toUpperCase(Locale.ROOT);
        if (chromosome.startsWith("CHR")) {
            chromosome = chromosome.substring(3);
        }
        return "M".equals(chromosome) ? "MT" : chromosome;
    }

    static boolean isValidGenotype(String genotype) {
        if (GenotypeCall.NO_CALL.equals(genotype)) {
            return true;
        }
        if (genotype.length() == 1) {
            char c = genotype.charAt(0);
            return NUCLEOTIDES.contains(c) || INDELS.contains(c);
        }
        if (genotype.length() == 2) {
            char a = genotype.charAt(0);
            char b = genotype.charAt(1);
            return (NUCLEOTIDES.contains(a) && NUCLEOTIDES.contains(b))
                || (INDELS.contains(a) && INDELS.contains(b));
        }
        return false;
    }

    private static InputStream firstTextEntry(ZipInputStream zip, String archiveName) throws IOException {
        ZipEntry entry;
        while ((entry = zip.getNextEntry()) != null) {
            if (!entry.isDirectory() && entry.getName().toLowerCase(Locale.ROOT).endsWith(".txt")) {
                return zip;
            }
        }
        throw new FormatException(archiveName, "zip archive contains no .txt genotype file");
    }

    /**
     * Lazy sequence of calls. Lines inside the sniff window are buffered; the rest are read on demand.
     * The skip-rate ceiling is enforced over the sniff window up front and over the whole file at end
     * of stream, so a caller writing calls inside a transaction sees the failure before committing.
     */
    public class GenotypeCallReader implements Iterator<GenotypeCall>, Closeable {

        private final BufferedReader reader;
        private final String sourceFile;
        private final Deque<GenotypeCall> buffered = new ArrayDeque<>();
        private final List<ParseWarning> warnings = new ArrayList<>();

        private DataSource dataSource = DataSource.UNKNOWN;
        private GenomeBuild genomeBuild = GenomeBuild.UNKNOWN;
        private boolean headerRecognized;
        private int lineNumber;
        private long validLines;
        private long malformedLines;
        private boolean endOfInput;
        private boolean finished;
        private GenotypeCall next;

        private GenotypeCallReader(BufferedReader reader, String sourceFile) {
            this.reader = reader;
            this.sourceFile = sourceFile;
        }

        private void sniff() throws IOException {
            while (lineNumber < sniffLines) {
                String line = reader.readLine();
                if (line == null) {
                    endOfInput = true;
                    break;
                }
                lineNumber++;
                GenotypeCall call = readLine(line);
                if (call != null) {
                    buffered.add(call);
                }
            }

            if (validLines == 0 && !headerRecognized) {
                throw new FormatException(sourceFile,
                    "no genotype header and no rsid/chromosome/position/genotype lines in the first "
                        + lineNumber + " lines");
            }
            checkSkipRate("the first " + lineNumber + " lines");
            log.debug("{}: recognized genotype file (source={}, build={})", sourceFile, dataSource, genomeBuild);
        }

        private GenotypeCall readLine(String rawLine) {
            String line = lineNumber == 1 ? stripBom(rawLine).trim() : rawLine.trim();
            if (line.isEmpty()) {
                return null;
            }
            if (line.startsWith("#")) {
                readHeaderComment(line);
                return null;
            }
            if (COLUMN_HEADER.matcher(line).matches()) {
                headerRecognized = true;
                return null;
            }
            GenotypeCall call = parseDataLine(line);
            if (call == null) {
                malformedLines++;
            } else {
                validLines++;
            }
            return call;
        }

        private void readHeaderComment(String line) {
            if (COLUMN_HEADER.matcher(line).matches()) {
                headerRecognized = true;
            }
            DataSource source = DataSource.fromHeader(line);
            if (source != DataSource.UNKNOWN) {
                headerRecognized = true;
                if (dataSource == DataSource.UNKNOWN) {
                    dataSource = source;
                }
            }
            GenomeBuild build = GenomeBuild.fromHeader(line);
            if (build != GenomeBuild.UNKNOWN && genomeBuild == GenomeBuild.UNKNOWN) {
                genomeBuild = build;
            }
        }

        private GenotypeCall parseDataLine(String line) {
            String[] columns = DELIMITER.split(line);
            if (columns.length != COLUMN_COUNT) {
                warn("expected " + COLUMN_COUNT + " columns but found " + columns.length);
                return null;
            }
            String rsid = columns[RSID_COLUMN];
            if (!RSID_PATTERN.matcher(rsid).matches()) {
                warn("invalid rsid \"" + rsid + "\"");
                return null;
            }
            String chromosome = columns[CHROMOSOME_COLUMN];
            if (!CHROMOSOME_PATTERN.matcher(chromosome).matches()) {
                warn("unknown chromosome \"" + chromosome + "\"");
                return null;
            }
            long position;
            try {
                position = Long.parseLong(columns[POSITION_COLUMN]);
            } catch (NumberFormatException e) {
                warn("unparseable position \"" + columns[POSITION_COLUMN] + "\"");
                return null;
            }
            if (position < 0) {
                warn("negative position " + position);
                return null;
            }
            String genotype = normalizeGenotype(columns[GENOTYPE_COLUMN]);
            if (!isValidGenotype(genotype)) {
                warn("invalid genotype \"" + columns[GENOTYPE_COLUMN] + "\"");
                return null;
            }
            return new GenotypeCall(rsid, normalizeChromosome(chromosome), position, genotype, sourceFile);
        }

        private void warn(String message) {
            ParseWarning warning = ParseWarning.atLine(lineNumber, message);
            warnings.add(warning);
            log.debug("{}: skipped {}", sourceFile, warning);
        }

        private void checkSkipRate(String scope) {
            long sampled = validLines + malformedLines;
            if (sampled > 0 && (double) malformedLines / sampled > maxSkipRate) {
                throw new FormatException(sourceFile, String.format(Locale.ROOT,
                    "%d of %d data lines in %s are malformed (limit %.0f%%)",
                    malformedLines, sampled, scope, maxSkipRate * 100));
            }
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (!buffered.isEmpty()) {
                next = buffered.poll();
                return true;
            }
            try {
                while (!endOfInput) {
                    String line = reader.readLine();
                    if (line == null) {
                        endOfInput = true;
                        break;
                    }
                    lineNumber++;
                    GenotypeCall call = readLine(line);
                    if (call != null) {
                        next = call;
                        return true;
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            if (!finished) {
                finished = true;
                checkSkipRate("the file");
                if (malformedLines > 0) {
                    log.warn("{}: skipped {} malformed lines", sourceFile, malformedLines);
                }
            }
            return false;
        }

        @Override
        public GenotypeCall next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            GenotypeCall call = next;
            next = null;
            return call;
        }

        public Stream<GenotypeCall> stream() {
            return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
        }

        public DataSource getDataSource() {
            return dataSource;
        }

        public GenomeBuild getGenomeBuild() {
            return genomeBuild;
        }

        public String getSourceFile() {
            return sourceFile;
        }

        public long getValidLines() {
            return validLines;
        }

        public long getMalformedLines() {
            return malformedLines;
        }

        public List<ParseWarning> getWarnings() {
            return Collections.unmodifiableList(warnings);
        }

        @Override
        public void close() throws IOException {
            reader.close();
        }
    }

    static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
