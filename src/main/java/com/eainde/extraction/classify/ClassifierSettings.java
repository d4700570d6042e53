package com.eainde.extraction.classify;

import com.eainde.extraction.model.DocumentCategory;
import com.eainde.extraction.segment.SegmentCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword sets and gating thresholds for {@link SegmentClassifier}.
 *
 * @param keywords                 keywords per substantive category; multi-word phrases weigh double
 * @param documentKeywords         extra keywords added for a declared document category
 * @param signatureKeywords        attestation terms (signature, notary, witness, ...)
 * @param exclusionMaxChars        signature segments shorter than this may be excluded
 * @param signatureDominanceRatio  share of all keyword hits that must be signature terms
 * @param excludeSignatureSegments whether short signature segments are gated out at all
 */
public record ClassifierSettings(
        Map<SegmentCategory, List<String>> keywords,
        Map<DocumentCategory, Map<SegmentCategory, List<String>>> documentKeywords,
        List<String> signatureKeywords,
        int exclusionMaxChars,
        double signatureDominanceRatio,
        boolean excludeSignatureSegments
) {

    public static final Map<SegmentCategory, List<String>> DEFAULT_KEYWORDS = defaultKeywords();

    public static final Map<DocumentCategory, Map<SegmentCategory, List<String>>> DEFAULT_DOCUMENT_KEYWORDS =
            defaultDocumentKeywords();

    public static final List<String> DEFAULT_SIGNATURE_KEYWORDS = List.of(
            "signature", "signed", "seal", "notary", "notary public", "witness", "in witness whereof",
            "acknowledgment", "acknowledged", "attestation", "attest", "executed", "certificate",
            "commission expires", "sworn");

    public ClassifierSettings {
        if (keywords == null || keywords.isEmpty()) throw new IllegalArgumentException("keywords must not be empty");
        if (keywords.containsKey(SegmentCategory.SIGNATURE) || keywords.containsKey(SegmentCategory.UNCLASSIFIED)) {
            throw new IllegalArgumentException("keywords may only name substantive categories");
        }
        if (signatureKeywords == null || signatureKeywords.isEmpty()) {
            throw new IllegalArgumentException("signatureKeywords must not be empty");
        }
        if (exclusionMaxChars < 0) throw new IllegalArgumentException("exclusionMaxChars must be >= 0");
        if (signatureDominanceRatio <= 0.0 || signatureDominanceRatio > 1.0) {
            throw new IllegalArgumentException("signatureDominanceRatio must be in (0, 1]");
        }
        keywords = copy(keywords);
        Map<DocumentCategory, Map<SegmentCategory, List<String>>> documents = new EnumMap<>(DocumentCategory.class);
        if (documentKeywords != null) documentKeywords.forEach((doc, extra) -> documents.put(doc, copy(extra)));
        documentKeywords = Collections.unmodifiableMap(documents);
        signatureKeywords = List.copyOf(signatureKeywords);
    }

    public static ClassifierSettings defaults() {
        return new ClassifierSettings(DEFAULT_KEYWORDS, DEFAULT_DOCUMENT_KEYWORDS, DEFAULT_SIGNATURE_KEYWORDS,
                1_500, 0.6, true);
    }

    private static Map<SegmentCategory, List<String>> copy(Map<SegmentCategory, List<String>> source) {
        Map<SegmentCategory, List<String>> copy = new EnumMap<>(SegmentCategory.class);
        source.forEach((category, words) -> copy.put(category, List.copyOf(words)));
        return Collections.unmodifiableMap(copy);
    }

    private static Map<SegmentCategory, List<String>> defaultKeywords() {
        Map<SegmentCategory, List<String>> map = new EnumMap<>(SegmentCategory.class);
        map.put(SegmentCategory.FINANCIAL, List.of("rent", "base rent", "minimum rent", "annual rent",
                "monthly rent", "additional rent", "security deposit", "payment", "operating cost", "tax",
                "taxes", "charges", "escalation", "late charge"));
        map.put(SegmentCategory.PARTIES, List.of("landlord", "tenant", "lessor", "lessee", "guarantor",
                "guaranty", "by and between", "parties"));
        map.put(SegmentCategory.PREMISES, List.of("premises", "demised", "leased space", "square feet",
                "rentable area", "building", "parking", "property"));
        map.put(SegmentCategory.TERM, List.of("term", "duration", "commencement", "commencement date",
                "expiration", "expiration date", "renewal", "option to extend", "holdover"));
        map.put(SegmentCategory.USE, List.of("use", "permitted use", "purpose", "conduct", "operations",
                "signage", "exclusive use", "prohibited use"));
        map.put(SegmentCategory.MAINTENANCE, List.of("maintenance", "repair", "repairs", "condition",
                "alterations", "utilities", "janitorial", "hvac"));
        map.put(SegmentCategory.ASSIGNMENT, List.of("assignment", "assign", "sublet", "sublease", "transfer",
                "change of control"));
        map.put(SegmentCategory.INSURANCE, List.of("insurance", "liability", "indemnity", "indemnification",
                "casualty", "damage", "destruction", "waiver of subrogation"));
        map.put(SegmentCategory.DEFAULT_REMEDIES, List.of("default", "remedies", "remedy", "breach", "cure",
                "event of default", "termination", "terminate", "re-entry"));
        return Collections.unmodifiableMap(map);
    }

    private static Map<DocumentCategory, Map<SegmentCategory, List<String>>> defaultDocumentKeywords() {
        Map<DocumentCategory, Map<SegmentCategory, List<String>>> map = new EnumMap<>(DocumentCategory.class);
        map.put(DocumentCategory.RETAIL, Map.of(
                SegmentCategory.FINANCIAL, List.of("percentage rent", "gross sales", "overage", "breakpoint"),
                SegmentCategory.USE, List.of("operating hours", "business hours", "co-tenancy", "anchor tenant",
                        "radius restriction"),
                SegmentCategory.MAINTENANCE, List.of("common area", "common area maintenance", "cam")));
        map.put(DocumentCategory.OFFICE, Map.of(
                SegmentCategory.FINANCIAL, List.of("operating expenses", "base year", "expense stop"),
                SegmentCategory.MAINTENANCE, List.of("building services", "cleaning", "after-hours hvac"),
                SegmentCategory.PREMISES, List.of("tenant improvements", "improvement allowance", "build-out")));
        map.put(DocumentCategory.INDUSTRIAL, Map.of(
                SegmentCategory.USE, List.of("hazardous materials", "environmental", "loading dock", "shipping",
                        "receiving"),
                SegmentCategory.PREMISES, List.of("yard", "outside storage", "clear height")));
        return Collections.unmodifiableMap(map);
    }
}
