package com.eainde.extraction.pass;

import com.eainde.extraction.segment.SegmentCategory;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

/**
 * Built-in passes used when configuration declares none.
 *
 * <ol>
 *   <li>{@value #DIRECT_EXTRACTION}: explicit clause values, per segment.</li>
 *   <li>{@value #CROSS_REFERENCE_RESOLUTION}: resolves references such as "as defined in Section 4.2"
 *       using the direct pass output as context.</li>
 *   <li>{@value #IMPLICIT_FACT_DERIVATION}: facts implied but not stated. Expensive.</li>
 *   <li>{@value #CALCULATION_DERIVATION}: derived amounts and dates (rent schedule, expiration).
 *       Expensive, financial and term segments only.</li>
 * </ol>
 */
public final class PassCatalog {

    public static final String DIRECT_EXTRACTION = "direct_extraction";
    public static final String CROSS_REFERENCE_RESOLUTION = "cross_reference_resolution";
    public static final String IMPLICIT_FACT_DERIVATION = "implicit_fact_derivation";
    public static final String CALCULATION_DERIVATION = "calculation_derivation";

    private static final String OUTPUT_RULES = """
            Return JSON only, in the form {"fields": [{"name": ..., "value": ..., "excerpt": ..., \
            "confidence": ..., "category": ...}]}.
            - name: snake_case field name. Use these names where they fit: landlord, tenant, \
            premises_address, commencement_date, expiration_date, base_rent, security_deposit, \
            permitted_use, maintenance_responsibility, assignment_rights, insurance_requirements, \
            default_remedies, operating_hours, common_area_charges, percentage_rent, building_services, \
            operating_expenses, tenant_improvements, environmental_obligations, hazardous_materials.
            - excerpt: the verbatim sentence from the segment supporting the value.
            - confidence: 0.0 to 1.0.
            - category: one of financial, parties, premises, term, use, maintenance, assignment, \
            insurance, default_remedies.
            Omit fields the text does not support. Never invent values.""";

    private PassCatalog() {
    }

    public static List<ExtractionPass> defaults() {
        return List.of(
                ExtractionPass.builder(DIRECT_EXTRACTION)
                        .instructions("""
                                You are an expert commercial lease analyst. Extract every clause value \
                                stated explicitly in this lease segment: parties, premises, term dates, \
                                rent amounts, deposits, permitted use, maintenance duties, assignment \
                                rights, insurance requirements and default remedies.
                                """ + OUTPUT_RULES)
                        .callTimeout(Duration.ofSeconds(60))
                        .build(),
                ExtractionPass.builder(CROSS_REFERENCE_RESOLUTION)
                        .dependsOn(DIRECT_EXTRACTION)
                        .instructions("""
                                You are resolving cross-references in a lease. The context lists values \
                                already extracted from the whole document. Where this segment refers to \
                                another section, exhibit or defined term, return the field with the \
                                referenced value resolved.
                                """ + OUTPUT_RULES)
                        .callTimeout(Duration.ofSeconds(60))
                        .build(),
                ExtractionPass.builder(IMPLICIT_FACT_DERIVATION)
                        .dependsOn(DIRECT_EXTRACTION)
                        .instructions("""
                                Identify facts this lease segment implies without stating them outright, \
                                such as which party bears a cost or whether a right is exclusive. Use the \
                                context values for consistency. Only return facts the text clearly supports.
                                """ + OUTPUT_RULES)
                        .callTimeout(Duration.ofSeconds(90))
                        .expensive(true)
                        .build(),
                ExtractionPass.builder(CALCULATION_DERIVATION)
                        .dependsOn(DIRECT_EXTRACTION, CROSS_REFERENCE_RESOLUTION)
                        .instructions("""
                                Derive calculated lease values from this segment and the context: annual \
                                and monthly rent, rent per square foot, escalated rent by year, expiration \
                                date from commencement and term. Put the inputs of each calculation in \
                                the excerpt.
                                """ + OUTPUT_RULES)
                        .callTimeout(Duration.ofSeconds(90))
                        .expensive(true)
                        .segmentCategories(EnumSet.of(SegmentCategory.FINANCIAL, SegmentCategory.TERM))
                        .build());
    }

    public static PassPlan defaultPlan() {
        return PassPlan.of(defaults());
    }
}
