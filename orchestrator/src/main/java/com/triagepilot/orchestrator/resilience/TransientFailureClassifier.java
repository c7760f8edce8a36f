package com.triagepilot.orchestrator.resilience;

import com.triagepilot.orchestrator.claude.ClaudeClient.ClaudeApiException;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Default classifier for reasoning-collaborator failures.
 *
 * Transient:
 *   - ClaudeApiException with status 429 (rate limited), 503 (unavailable)
 *     or 529 (overloaded)
 *   - any exception in the cause chain whose message mentions one of the
 *     overload markers below; covers transport wrappers that lose the status
 *   - EmptyResultException
 *
 * Everything else is fatal.
 */
public class TransientFailureClassifier implements FailureClassifier {

    private static final Set<Integer> TRANSIENT_STATUS = Set.of(429, 503, 529);

    private static final List<String> MARKERS = List.of(
            "overloaded", "rate limit", "rate_limit", "429", "503", "529");

    @Override
    public boolean isTransient(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof EmptyResultException) {
                return true;
            }
            if (t instanceof ClaudeApiException api && TRANSIENT_STATUS.contains(api.statusCode())) {
                return true;
            }
            String msg = t.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                if (MARKERS.stream().anyMatch(lower::contains)) {
                    return true;
                }
            }
        }
        return false;
    }
}
