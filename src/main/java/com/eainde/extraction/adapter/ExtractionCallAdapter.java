package com.eainde.extraction.adapter;

import com.eainde.extraction.model.ExtractionResult;
import com.eainde.extraction.pass.ExtractionPass;
import com.eainde.extraction.segment.Segment;

import java.util.Map;

/**
 * Makes exactly one bounded extraction call for a (segment, pass) pair and
 * turns every outcome into a typed {@link ExtractionResult}. Implementations
 * do not retry and do not throw for call failures.
 */
public interface ExtractionCallAdapter {

    ExtractionResult call(Segment segment, ExtractionPass pass, Map<String, String> priorContext);
}
