package dev.pekelund.docroute.routing;

import dev.pekelund.docroute.ai.AiExtractionClient;
import dev.pekelund.docroute.ai.AiExtractionResponse;
import dev.pekelund.docroute.ai.PagePayload;
import dev.pekelund.docroute.model.BatchResult;
import dev.pekelund.docroute.model.ExtractionSource;
import dev.pekelund.docroute.model.PageGroup;
import dev.pekelund.docroute.numbers.NumberExtractor;
import dev.pekelund.docroute.routing.AiCallOutcome.FailureReason;
import dev.pekelund.docroute.source.DocumentSource;
import dev.pekelund.docroute.source.DocumentSourceException;
import dev.pekelund.docroute.source.PositionedWord;
import dev.pekelund.docroute.support.PipelineMdc;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends page groups to the AI extraction capability and falls back to local number extraction for
 * every group the AI does not answer.
 * <p>
 * Group calls run concurrently up to {@link FailoverSettings#maxConcurrentGroups()}; results are
 * returned in group order whatever order the calls complete in.
 */
public class AiFailoverRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(AiFailoverRouter.class);
    private static final long NOT_STARTED = Long.MIN_VALUE;

    private final AiExtractionClient aiClient;
    private final FailoverSettings settings;
    private final LocalFallbackExtractor fallbackExtractor;

    public AiFailoverRouter(AiExtractionClient aiClient, FailoverSettings settings) {
        this(aiClient, settings, new NumberExtractor());
    }

    public AiFailoverRouter(AiExtractionClient aiClient, FailoverSettings settings, NumberExtractor numberExtractor) {
        this.aiClient = aiClient != null ? aiClient : AiExtractionClient.disabled();
        this.settings = settings != null ? settings : FailoverSettings.defaults();
        this.fallbackExtractor = new LocalFallbackExtractor(numberExtractor);
    }

    /**
     * Routes every group and returns one batch per group, in group order. Returns an empty list when
     * routing is disabled.
     *
     * @throws PipelineCancelledException when the calling thread is interrupted while waiting for the AI
     */
    public List<BatchResult> processGroups(DocumentSource document, List<PageGroup> groups) {
        if (!settings.enabled()) {
            LOGGER.info("AI failover routing disabled; {} page groups left to code-only handling", groups.size());
            return List.of();
        }
        if (groups.isEmpty()) {
            return List.of();
        }

        boolean available = isClientAvailable();
        boolean includeWords = available && settings.useVisionIfAvailable() && aiClient.supportsVision();
        List<List<PagePayload>> payloads = new ArrayList<>(groups.size());
        for (PageGroup group : groups) {
            payloads.add(buildPayload(document, group, includeWords));
        }

        List<AiCallOutcome> outcomes;
        if (available) {
            LOGGER.info("Routing {} page groups to AI extraction (max {} concurrent)", groups.size(),
                settings.maxConcurrentGroups());
            outcomes = callAi(groups, payloads);
        } else {
            LOGGER.info("AI extraction unavailable; using local fallback for {} page groups", groups.size());
            outcomes = new ArrayList<>(groups.size());
            for (int i = 0; i < groups.size(); i++) {
                outcomes.add(AiCallOutcome.failure(FailureReason.UNAVAILABLE, null));
            }
        }

        List<BatchResult> results = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            PageGroup group = groups.get(i);
            AiCallOutcome outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                AiExtractionResponse response = outcome.response();
                results.add(new BatchResult(group, response.tables(), response.pages(), response.processingSummary(),
                    ExtractionSource.AI, null));
            } else {
                if (outcome.reason() != FailureReason.UNAVAILABLE) {
                    LOGGER.warn("AI extraction for page group {} failed ({}); using local fallback", group,
                        outcome.describeFailure());
                }
                results.add(fallbackExtractor.extract(group, payloads.get(i), outcome.describeFailure()));
            }
        }
        return results;
    }

    private boolean isClientAvailable() {
        try {
            return aiClient.isAvailable();
        } catch (RuntimeException ex) {
            LOGGER.warn("AI client availability check failed; treating it as unavailable", ex);
            return false;
        }
    }

    private List<AiCallOutcome> callAi(List<PageGroup> groups, List<List<PagePayload>> payloads) {
        int threads = Math.min(settings.maxConcurrentGroups(), groups.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, workerThreadFactory());
        List<Future<AiExtractionResponse>> futures = new ArrayList<>(groups.size());
        List<AtomicLong> startedAt = new ArrayList<>(groups.size());
        try {
            for (int i = 0; i < groups.size(); i++) {
                String groupLabel = groups.get(i).toString();
                List<PagePayload> payload = payloads.get(i);
                AtomicLong callStart = new AtomicLong(NOT_STARTED);
                startedAt.add(callStart);
                futures.add(executor.submit(PipelineMdc.propagate(() -> {
                    callStart.set(System.nanoTime());
                    PipelineMdc.setGroup(groupLabel);
                    LOGGER.debug("Calling AI extraction for page group {} ({} pages)", groupLabel, payload.size());
                    return aiClient.extract(payload);
                })));
            }
            List<AiCallOutcome> outcomes = new ArrayList<>(groups.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), startedAt.get(i)));
            }
            return outcomes;
        } catch (InterruptedException ex) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException("Document processing was cancelled while waiting for AI extraction",
                ex);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Waits for one group call. The timeout runs from the moment the call started on its worker. A call
     * still queued after a full timeout of waiting counts as timed out.
     */
    private AiCallOutcome await(Future<AiExtractionResponse> future, AtomicLong callStart)
        throws InterruptedException {
        long timeoutNanos = settings.groupTimeout().toNanos();
        boolean waitedWhileQueued = false;
        while (true) {
            long started = callStart.get();
            long remaining;
            if (started == NOT_STARTED) {
                if (waitedWhileQueued) {
                    return timedOut(future);
                }
                waitedWhileQueued = true;
                remaining = timeoutNanos;
            } else {
                remaining = started + timeoutNanos - System.nanoTime();
                if (remaining <= 0 && !future.isDone()) {
                    return timedOut(future);
                }
            }
            try {
                AiExtractionResponse response = future.get(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
                if (response == null || response.isEmpty()) {
                    return AiCallOutcome.failure(FailureReason.EMPTY_RESPONSE, "response carried no pages or tables");
                }
                return AiCallOutcome.success(response);
            } catch (TimeoutException ex) {
                long startedNow = callStart.get();
                if (startedNow != NOT_STARTED && System.nanoTime() - startedNow >= timeoutNanos) {
                    return timedOut(future);
                }
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                return AiCallOutcome.failure(FailureReason.CALL_FAILED, cause.getMessage());
            } catch (CancellationException ex) {
                return AiCallOutcome.failure(FailureReason.CALL_FAILED, "call was cancelled");
            }
        }
    }

    private AiCallOutcome timedOut(Future<AiExtractionResponse> future) {
        future.cancel(true);
        return AiCallOutcome.failure(FailureReason.TIMEOUT, "no response within " + settings.groupTimeout());
    }

    private List<PagePayload> buildPayload(DocumentSource document, PageGroup group, boolean includeWords) {
        List<PagePayload> pages = new ArrayList<>(group.size());
        group.pageIndices().forEach(pageIndex -> pages.add(new PagePayload(pageIndex + 1,
            readText(document, pageIndex), includeWords ? readWords(document, pageIndex) : List.of())));
        return pages;
    }

    private String readText(DocumentSource document, int pageIndex) {
        try {
            String text = document.getPageText(pageIndex);
            return text != null ? text : "";
        } catch (DocumentSourceException ex) {
            LOGGER.warn("Could not read text of page {} for routing - {}", pageIndex + 1, ex.getMessage());
            return "";
        }
    }

    private List<PositionedWord> readWords(DocumentSource document, int pageIndex) {
        try {
            return document.getPositionedWords(pageIndex);
        } catch (DocumentSourceException ex) {
            LOGGER.warn("Could not read word positions of page {} for routing - {}", pageIndex + 1, ex.getMessage());
            return List.of();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "docroute-ai-group-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
