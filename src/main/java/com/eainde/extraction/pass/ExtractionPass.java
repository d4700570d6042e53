package com.eainde.extraction.pass;

import com.eainde.extraction.model.DocumentCategory;
import com.eainde.extraction.segment.SegmentCategory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One extraction pass over the segments of a document.
 *
 * @param name               unique pass name, e.g. {@code direct_extraction}
 * @param dependsOn          passes whose aggregated output this pass receives as context
 * @param instructions       system instructions sent with every call of this pass
 * @param callTimeout        per-call timeout
 * @param expensive          expensive passes are skipped for large documents
 * @param segmentCategories  segment categories the pass runs on; empty means all
 * @param allowedFields      field names the pass may return; empty means any
 * @param documentCategories document categories the pass applies to; empty means all
 */
public record ExtractionPass(
        String name,
        List<String> dependsOn,
        String instructions,
        Duration callTimeout,
        boolean expensive,
        Set<SegmentCategory> segmentCategories,
        Set<String> allowedFields,
        Set<DocumentCategory> documentCategories
) {

    public ExtractionPass {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("pass name must not be blank");
        if (instructions == null || instructions.isBlank()) {
            throw new IllegalArgumentException("pass '" + name + "' has no instructions");
        }
        if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("pass '" + name + "' needs a positive call timeout");
        }
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        if (dependsOn.contains(name)) throw new IllegalArgumentException("pass '" + name + "' depends on itself");
        segmentCategories = segmentCategories == null || segmentCategories.isEmpty()
                ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(segmentCategories));
        allowedFields = allowedFields == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(allowedFields));
        documentCategories = documentCategories == null || documentCategories.isEmpty()
                ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(documentCategories));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean appliesTo(SegmentCategory category) {
        return segmentCategories.isEmpty() || segmentCategories.contains(category);
    }

    public boolean appliesTo(DocumentCategory category) {
        return documentCategories.isEmpty() || documentCategories.contains(category);
    }

    public boolean allowsField(String fieldName) {
        return allowedFields.isEmpty() || allowedFields.contains(fieldName);
    }

    ExtractionPass withDependsOn(List<String> dependencies) {
        return new ExtractionPass(name, dependencies, instructions, callTimeout, expensive,
                segmentCategories, allowedFields, documentCategories);
    }

    public static class Builder {
        private final String name;
        private List<String> dependsOn = List.of();
        private String instructions;
        private Duration callTimeout = Duration.ofSeconds(60);
        private boolean expensive;
        private Set<SegmentCategory> segmentCategories = Set.of();
        private Set<String> allowedFields = Set.of();
        private Set<DocumentCategory> documentCategories = Set.of();

        private Builder(String name) {
            this.name = name;
        }

        public Builder dependsOn(String... passes) {
            this.dependsOn = List.of(passes);
            return this;
        }

        public Builder dependsOn(List<String> passes) {
            this.dependsOn = passes;
            return this;
        }

        public Builder instructions(String instructions) {
            this.instructions = instructions;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder expensive(boolean expensive) {
            this.expensive = expensive;
            return this;
        }

        public Builder segmentCategories(Set<SegmentCategory> segmentCategories) {
            this.segmentCategories = segmentCategories;
            return this;
        }

        public Builder allowedFields(Set<String> allowedFields) {
            this.allowedFields = allowedFields;
            return this;
        }

        public Builder documentCategories(Set<DocumentCategory> documentCategories) {
            this.documentCategories = documentCategories;
            return this;
        }

        public ExtractionPass build() {
            return new ExtractionPass(name, dependsOn, instructions, callTimeout, expensive,
                    segmentCategories, allowedFields, documentCategories);
        }
    }
}
