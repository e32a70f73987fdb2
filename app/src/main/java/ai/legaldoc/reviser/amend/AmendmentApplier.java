package ai.legaldoc.reviser.amend;

import ai.legaldoc.reviser.article.LegalPatterns;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies one repeal directive to the text of one article through an {@link ArticleEditor}.
 *
 * <p>A response is accepted only when it has at least two non-blank lines and the first one carries the
 * modification marker. Rejected responses and editor failures both consume an attempt. When every attempt
 * fails the original lines are returned unchanged, so a single bad amendment never aborts a run.</p>
 */
public class AmendmentApplier {

    private static final Logger LOGGER = LoggerFactory.getLogger(AmendmentApplier.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final ArticleEditor editor;
    private final int maxAttempts;
    private final int initialBackoffSeconds;
    private final int maxBackoffSeconds;
    private final double jitterFactor;

    public AmendmentApplier(ArticleEditor editor) {
        this(editor, DEFAULT_MAX_ATTEMPTS, 2, 60, 0.3);
    }

    public AmendmentApplier(ArticleEditor editor, int maxAttempts, int initialBackoffSeconds,
                            int maxBackoffSeconds, double jitterFactor) {
        this.editor = Objects.requireNonNull(editor, "editor");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
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
        this.maxAttempts = maxAttempts;
        this.initialBackoffSeconds = initialBackoffSeconds;
        this.maxBackoffSeconds = maxBackoffSeconds;
        this.jitterFactor = jitterFactor;
    }

    /**
     * @param oldText     full article text, header first, paragraphs separated by newlines
     * @param instruction natural-language repeal directive
     * @return the revised lines, or the original lines split verbatim when no attempt succeeded
     */
    public List<String> applyAmendment(String oldText, String instruction) {
        String source = oldText == null ? "" : oldText;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                String response = editor.edit(source, instruction);
                Optional<List<String>> accepted = validate(response);
                if (accepted.isPresent()) {
                    LOGGER.info("Amendment applied on attempt {}/{}: {}", attempt + 1, maxAttempts, firstLine(source));
                    return accepted.get();
                }
                LOGGER.warn("Amendment attempt {}/{} rejected for {}: response lacks a marked header or body",
                        attempt + 1, maxAttempts, firstLine(source));
            } catch (RuntimeException ex) {
                LOGGER.warn("Amendment attempt {}/{} failed for {}: {}", attempt + 1, maxAttempts, firstLine(source), ex.getMessage());
                if (attempt < maxAttempts - 1 && !waitBeforeRetry(ex, attempt)) {
                    break;
                }
            }
        }
        LOGGER.error("Amendment failed after {} attempts for {}; keeping original text", maxAttempts, firstLine(source));
        return source.isEmpty() ? List.of() : List.of(source.split("\\R"));
    }

    static Optional<List<String>> validate(String response) {
        if (response == null) {
            return Optional.empty();
        }
        List<String> lines = Arrays.stream(response.split("\\R"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
        if (lines.size() < 2 || lines.get(0).indexOf(LegalPatterns.MODIFICATION_MARKER) < 0) {
            return Optional.empty();
        }
        return Optional.of(List.copyOf(lines));
    }

    /**
     * Sleeps before the next attempt when the failure was a rate limit.
     *
     * @return {@code false} when the wait was interrupted and retrying should stop
     */
    private boolean waitBeforeRetry(RuntimeException failure, int attempt) {
        Optional<Duration> maybeDelay = calculateRetryDelay(failure, attempt);
        if (maybeDelay.isEmpty()) {
            return true;
        }
        Duration delay = maybeDelay.get();
        LOGGER.warn("Editor rate limited (429/RESOURCE_EXHAUSTED); retrying in {} ms (attempt {}/{})",
                delay.toMillis(), attempt + 1, maxAttempts);
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Amendment retry interrupted");
            return false;
        }
    }

    private Optional<Duration> calculateRetryDelay(Throwable throwable, int attemptNumber) {
        if (!isRateLimitError(throwable)) {
            return Optional.empty();
        }
        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay;
        }
        // initialBackoff * 2^attempt, capped, then jittered by +/- jitterFactor
        long baseDelaySeconds = initialBackoffSeconds * (1L << attemptNumber);
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
        Throwable cause = throwable;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
                if (matcher.find()) {
                    double seconds = Double.parseDouble(matcher.group(1));
                    return Optional.of(Duration.ofMillis(Math.max(0, (long) (seconds * 1000))));
                }
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return (newline < 0 ? text : text.substring(0, newline)).trim();
    }
}
