package ai.gamedata.translator.translate;

import ai.gamedata.translator.cache.TranslationCache;
import ai.gamedata.translator.extract.StringTable;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a {@link StringTable} into a translation mapping: cached strings are answered
 * locally, the rest go to the translator in fixed-size batches. A batch that keeps failing
 * maps its strings to themselves, so a file can always be written.
 */
public class BatchTranslationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchTranslationService.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    public static final int DEFAULT_BATCH_SIZE = 32;

    private final TranslatorFactory translatorFactory;
    private final TranslationMode mode;
    private final TranslationCache cache;
    private final AlreadyTranslatedPolicy policy;
    private final boolean skipTranslated;
    private final int batchSize;
    private final int maxRetryAttempts;
    private final int initialBackoffSeconds;
    private final int maxBackoffSeconds;
    private final double jitterFactor;

    public BatchTranslationService(TranslatorFactory translatorFactory, TranslationMode mode, TranslationCache cache) {
        this(translatorFactory, mode, cache, new AlreadyTranslatedPolicy(), false, DEFAULT_BATCH_SIZE, 6, 2, 60, 0.3);
    }

    public BatchTranslationService(TranslatorFactory translatorFactory, TranslationMode mode, TranslationCache cache,
                                   AlreadyTranslatedPolicy policy, boolean skipTranslated, int batchSize,
                                   int maxRetryAttempts, int initialBackoffSeconds, int maxBackoffSeconds, double jitterFactor) {
        this.translatorFactory = Objects.requireNonNull(translatorFactory, "translatorFactory");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.policy = Objects.requireNonNull(policy, "policy");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1) {
            throw new IllegalArgumentException("initialBackoffSeconds must be at least 1");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        this.skipTranslated = skipTranslated;
        this.batchSize = batchSize;
        this.maxRetryAttempts = maxRetryAttempts;
        this.initialBackoffSeconds = initialBackoffSeconds;
        this.maxBackoffSeconds = maxBackoffSeconds;
        this.jitterFactor = jitterFactor;
    }

    public TranslationBatchResult translate(StringTable table) {
        if (table == null || table.isEmpty()) {
            return TranslationBatchResult.empty();
        }
        Map<String, String> results = new LinkedHashMap<>();
        List<String> pending = new ArrayList<>();
        int fromCache = 0;
        int skipped = 0;
        for (String text : table) {
            if (skipTranslated && policy.isAlreadyTranslated(text)) {
                results.put(text, text);
                skipped++;
                continue;
            }
            Optional<String> cached = cache.lookup(text);
            if (cached.isPresent()) {
                results.put(text, cached.get());
                fromCache++;
            } else {
                pending.add(text);
            }
        }
        if (pending.isEmpty()) {
            return new TranslationBatchResult(results, fromCache, skipped, 0, 0);
        }

        Translator translator = translatorFactory.select(mode);
        int totalBatches = (pending.size() + batchSize - 1) / batchSize;
        LOGGER.info("Translating {} new strings in {} batch(es)", pending.size(), totalBatches);
        int untranslated = 0;
        for (int start = 0, batchNumber = 1; start < pending.size(); start += batchSize, batchNumber++) {
            List<String> batch = pending.subList(start, Math.min(start + batchSize, pending.size()));
            LOGGER.debug("Batch {}/{}: strings {}-{} of {}", batchNumber, totalBatches,
                    start + 1, start + batch.size(), pending.size());
            List<String> translated = translateBatch(translator, batch);
            for (int i = 0; i < batch.size(); i++) {
                String original = batch.get(i);
                String result = translated.get(i);
                results.put(original, result);
                if (policy.looksUntranslated(original, result)) {
                    untranslated++;
                    continue;
                }
                if (mode.recordsToCache()) {
                    cache.record(original, result);
                }
            }
        }
        return new TranslationBatchResult(results, fromCache, skipped, pending.size(), untranslated);
    }

    private List<String> translateBatch(Translator translator, List<String> batch) {
        List<PlaceholderProtector.Protected> protectedTexts = new ArrayList<>(batch.size());
        List<String> payload = new ArrayList<>(batch.size());
        for (String text : batch) {
            PlaceholderProtector.Protected prepared = PlaceholderProtector.protect(text);
            protectedTexts.add(prepared);
            payload.add(prepared.text());
        }
        List<String> raw;
        try {
            raw = translateWithRetry(translator, payload);
        } catch (TranslationException ex) {
            LOGGER.error("Translation failed for a batch of {} strings; keeping originals: {}", batch.size(), ex.getMessage());
            return List.copyOf(batch);
        }
        if (raw == null || raw.size() != batch.size()) {
            LOGGER.warn("Translator returned {} results for {} strings; keeping originals",
                    raw == null ? 0 : raw.size(), batch.size());
            return List.copyOf(batch);
        }
        List<String> restored = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            String value = raw.get(i);
            restored.add(value == null || value.isBlank() ? batch.get(i) : protectedTexts.get(i).restore(value));
        }
        return restored;
    }

    private List<String> translateWithRetry(Translator translator, List<String> sourceStrings) {
        TranslationException lastFailure = null;
        for (int attempt = 0; attempt < maxRetryAttempts; attempt++) {
            try {
                return translator.translate(sourceStrings);
            } catch (TranslationException ex) {
                lastFailure = ex;
                Optional<Duration> maybeDelay = calculateRetryDelay(ex, attempt);
                if (maybeDelay.isEmpty() || attempt == maxRetryAttempts - 1) {
                    if (isRateLimitError(ex)) {
                        LOGGER.error("Translation rate limited; max retries ({}) exceeded", maxRetryAttempts);
                    }
                    throw ex;
                }
                Duration delay = maybeDelay.get();
                LOGGER.warn("Translation rate limited; retrying in {} seconds (attempt {}/{})",
                        delay.toSeconds(), attempt + 1, maxRetryAttempts);
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Translation retry interrupted");
                    throw ex;
                }
            }
        }
        throw lastFailure == null ? new TranslationException("Unknown translation failure") : lastFailure;
    }

    private Optional<Duration> calculateRetryDelay(Throwable throwable, int attemptNumber) {
        if (!isRateLimitError(throwable)) {
            return Optional.empty();
        }
        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay;
        }
        // initialBackoff * 2^attempt, capped, with +/- jitter
        long baseDelaySeconds = initialBackoffSeconds * (1L << Math.min(attemptNumber, 30));
        long cappedDelaySeconds = Math.min(baseDelaySeconds, maxBackoffSeconds);
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * jitterFactor;
        long finalDelaySeconds = Math.max(1, (long) (cappedDelaySeconds * jitterMultiplier));
        return Optional.of(Duration.ofSeconds(finalDelaySeconds));
    }

    private boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null) {
            return Optional.empty();
        }
        Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
        if (matcher.find()) {
            try {
                double seconds = Double.parseDouble(matcher.group(1));
                return Optional.of(Duration.ofMillis(Math.max(0, (long) (seconds * 1000))));
            } catch (NumberFormatException ignored) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
