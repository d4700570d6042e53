package com.eainde.extraction.adapter;

import com.eainde.extraction.model.CallStatus;
import com.eainde.extraction.model.ExtractedField;
import com.eainde.extraction.model.ExtractionResult;
import com.eainde.extraction.pass.ExtractionPass;
import com.eainde.extraction.segment.Segment;
import com.eainde.extraction.segment.SegmentCategory;
import com.eainde.extraction.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One bounded call per (segment, pass).
 *
 * <ul>
 *   <li>Text longer than {@code maxRequestChars} is cut, keeping the head.</li>
 *   <li>The service runs on the adapter's own threads; the caller waits at most the
 *       pass timeout, then the call is cancelled (interrupted) and reported as
 *       {@link CallStatus#TIMEOUT}.</li>
 *   <li>The payload is validated by {@link ExtractionResponseParser}; invalid
 *       payloads are reported as {@link CallStatus#MALFORMED} and never parsed into fields.</li>
 * </ul>
 *
 * <p>No retries here: the orchestrator owns retry policy.</p>
 */
@Slf4j
public class DefaultExtractionCallAdapter implements ExtractionCallAdapter, AutoCloseable {

    static final String GENERAL_CATEGORY = "general";

    private final ExtractionService service;
    private final ExtractionResponseParser parser;
    private final int maxRequestChars;
    private final MdcAwareExecutor callExecutor;

    public DefaultExtractionCallAdapter(ExtractionService service, ExtractionResponseParser parser,
                                        int maxRequestChars) {
        if (maxRequestChars < 1) throw new IllegalArgumentException("maxRequestChars must be >= 1");
        this.service = service;
        this.parser = parser;
        this.maxRequestChars = maxRequestChars;
        this.callExecutor = MdcAwareExecutor.cached("extraction-call-");
    }

    @Override
    public ExtractionResult call(Segment segment, ExtractionPass pass, Map<String, String> priorContext) {
        long started = System.nanoTime();
        String text = segment.text();
        boolean truncated = text.length() > maxRequestChars;
        if (truncated) {
            text = truncateHead(text, maxRequestChars);
            log.warn("Segment {} truncated from {} to {} chars for pass {}",
                    segment.id(), segment.length(), text.length(), pass.name());
        }

        ExtractionRequest request = new ExtractionRequest(segment.id(), pass.name(), pass.instructions(), text,
                priorContext, pass.allowedFields(),
                segment.hasPageHint() ? segment.pageHint().toString() : null, pass.callTimeout());

        FutureTask<String> task = new FutureTask<>(() -> service.extract(request));
        String raw;
        try {
            callExecutor.execute(task);
            raw = task.get(pass.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Call {}/{} timed out after {}", segment.id(), pass.name(), pass.callTimeout());
            return ExtractionResult.failure(segment.id(), pass.name(), CallStatus.TIMEOUT,
                    "timed out after " + pass.callTimeout().toMillis() + " ms", true, since(started), truncated);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            boolean retryable = cause instanceof ExtractionServiceException
                    && ((ExtractionServiceException) cause).isTransientFailure();
            log.warn("Call {}/{} failed ({}): {}", segment.id(), pass.name(),
                    retryable ? "transient" : "permanent", cause.getMessage());
            return ExtractionResult.failure(segment.id(), pass.name(), CallStatus.SERVICE_ERROR,
                    String.valueOf(cause.getMessage()), retryable, since(started), truncated);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            return ExtractionResult.failure(segment.id(), pass.name(), CallStatus.SERVICE_ERROR,
                    "interrupted while waiting for the service", false, since(started), truncated);
        } catch (RejectedExecutionException e) {
            return ExtractionResult.failure(segment.id(), pass.name(), CallStatus.SERVICE_ERROR,
                    "call adapter is closed", false, since(started), truncated);
        }

        try {
            List<ExtractedField> fields = parser.parse(raw, pass, defaultCategory(segment));
            log.debug("Call {}/{} returned {} fields in {} ms", segment.id(), pass.name(), fields.size(),
                    since(started).toMillis());
            return ExtractionResult.ok(segment.id(), pass.name(), fields, since(started), truncated);
        } catch (MalformedResponseException e) {
            log.warn("Call {}/{} returned a malformed response: {}", segment.id(), pass.name(), e.getMessage());
            return ExtractionResult.failure(segment.id(), pass.name(), CallStatus.MALFORMED,
                    e.getMessage(), true, since(started), truncated);
        }
    }

    /**
     * Stops the call threads; in-flight calls are interrupted.
     */
    @Override
    public void close() {
        callExecutor.close();
    }

    /**
     * Keeps the head of {@code text}, backing off to a word boundary in the last tenth.
     */
    static String truncateHead(String text, int maxChars) {
        if (text.length() <= maxChars) return text;
        int cut = maxChars;
        int floor = maxChars - maxChars / 10;
        for (int i = maxChars; i > floor; i--) {
            if (Character.isWhitespace(text.charAt(i - 1))) {
                cut = i;
                break;
            }
        }
        return text.substring(0, cut);
    }

    private static String defaultCategory(Segment segment) {
        SegmentCategory category = segment.classification();
        return category == SegmentCategory.SIGNATURE || category == SegmentCategory.UNCLASSIFIED
                ? GENERAL_CATEGORY : category.key();
    }

    private static Duration since(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
