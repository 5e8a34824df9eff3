package com.genex.service;

import com.genex.model.ApoeStatus;
import com.genex.model.CuratedAnnotation;
import com.genex.model.GenotypeCall;
import com.genex.model.InterpretedResult;
import com.genex.repository.GenotypeCallRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
public class GenotypeService {

    private final GenotypeCallRepository callRepository;
    private final AnnotationTable annotationTable;
    private final AnnotationMatcher matcher;

    public GenotypeService(GenotypeCallRepository callRepository, AnnotationTable annotationTable,
                           AnnotationMatcher matcher) {
        this.callRepository = callRepository;
        this.annotationTable = annotationTable;
        this.matcher = matcher;
    }

    public Optional<GenotypeCall> findCall(String rsid) {
        return callRepository.findByRsid(normalizeRsid(rsid));
    }

    /**
     * @throws AnnotationLookupException NOT_ANNOTATED when the rsid is not curated,
     *         NOT_TESTED when the genome has no call for it
     */
    public InterpretedResult interpret(String rsid) throws AnnotationLookupException {
        String key = normalizeRsid(rsid);
        CuratedAnnotation annotation = annotationTable.find(key)
            .orElseThrow(() -> new AnnotationLookupException(key, AnnotationLookupException.Reason.NOT_ANNOTATED));
        GenotypeCall call = callRepository.findByRsid(annotation.rsid())
            .orElseThrow(() -> new AnnotationLookupException(key, AnnotationLookupException.Reason.NOT_TESTED));
        return matcher.match(call, annotation);
    }

    public ApoeStatus apoeStatus() {
        Map<String, GenotypeCall> calls = callRepository.findByRsids(
            List.of(AnnotationMatcher.APOE_RS429358, AnnotationMatcher.APOE_RS7412));
        return matcher.classifyApoe(calls.get(AnnotationMatcher.APOE_RS429358), calls.get(AnnotationMatcher.APOE_RS7412));
    }

    /**
     * Interprets every called genotype of one annotation category, in table order.
     * Annotations without a call, or with a no-call, are left out.
     */
    public List<InterpretedResult> analyzeCategory(String category) {
        List<CuratedAnnotation> annotations = annotationTable.byCategory(category);
        Map<String, GenotypeCall> calls = callRepository.findByRsids(
            annotations.stream().map(CuratedAnnotation::rsid).toList());

        List<InterpretedResult> results = new ArrayList<>();
        for (CuratedAnnotation annotation : annotations) {
            GenotypeCall call = calls.get(annotation.rsid());
            if (call == null || !call.isCalled()) {
                continue;
            }
            try {
                results.add(matcher.match(call, annotation));
            } catch (AnnotationLookupException e) {
                // both sides are present here
                throw new IllegalStateException(e);
            }
        }
        return results;
    }

    private static String normalizeRsid(String rsid) {
        if (rsid == null || rsid.isBlank()) {
            throw new IllegalArgumentException("rsid must not be blank");
        }
        return rsid.trim().toLowerCase(Locale.ROOT);
    }
}
