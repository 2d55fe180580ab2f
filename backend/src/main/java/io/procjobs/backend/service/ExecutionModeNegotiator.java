package io.procjobs.backend.service;

import io.procjobs.backend.model.execution.ExecutionControlOption;
import io.procjobs.backend.model.execution.ExecutionMode;
import io.procjobs.backend.model.execution.ExecutionModeDecision;
import io.procjobs.backend.service.exception.InvalidPreferenceException;
import io.procjobs.backend.util.SecurityUtils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides between synchronous and asynchronous handling of an execution request.
 *
 * Input is the set of job control options declared by the process and the {@code Prefer}
 * request headers. Only {@code respond-async} and {@code wait=<seconds>} are interpreted;
 * other preferences are ignored. A wait above the configured maximum cannot be honored and
 * the request is handled asynchronously when possible.
 */
@Slf4j
@Service
public class ExecutionModeNegotiator {

    static final String RESPOND_ASYNC = "respond-async";
    static final String WAIT = "wait";

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[,;]");
    private static final Pattern POSITIVE_INTEGER = Pattern.compile("\\d+");
    private static final Pattern NUMERIC = Pattern.compile("[-+]?\\d+(\\.\\d*)?");

    private final int maxWaitSeconds;

    @Autowired
    public ExecutionModeNegotiator(@Value("${app.execution.max-wait-seconds:10}") int maxWaitSeconds) {
        if (maxWaitSeconds <= 0) {
            throw new IllegalArgumentException("app.execution.max-wait-seconds must be positive");
        }
        this.maxWaitSeconds = maxWaitSeconds;
    }

    public int getMaxWaitSeconds() {
        return maxWaitSeconds;
    }

    /**
     * Computes the execution mode.
     *
     * @param declaredOptions job control options of the process, null when it declares none
     *                        and therefore accepts both modes
     * @param preferHeaders values of every {@code Prefer} header, possibly empty
     * @return the decision, with the {@code Preference-Applied} header to echo if any
     * @throws InvalidPreferenceException if a {@code wait} preference is malformed
     */
    public ExecutionModeDecision negotiate(Set<ExecutionControlOption> declaredOptions,
                                           Collection<String> preferHeaders) {
        Preferences preferences = parse(preferHeaders);

        boolean asyncSupported = declaredOptions == null || declaredOptions.contains(ExecutionControlOption.ASYNC_EXECUTE);
        boolean syncSupported = declaredOptions == null || declaredOptions.contains(ExecutionControlOption.SYNC_EXECUTE);

        ExecutionModeDecision decision;
        if (!asyncSupported && !syncSupported) {
            decision = ExecutionModeDecision.async();
        } else if (preferences == null) {
            decision = syncSupported ? ExecutionModeDecision.sync(maxWaitSeconds) : ExecutionModeDecision.async();
        } else if (preferences.wait != null && preferences.wait > maxWaitSeconds) {
            // a wait we cannot honor reverts to the default handling without echo
            decision = asyncSupported ? ExecutionModeDecision.async() : ExecutionModeDecision.sync(maxWaitSeconds);
        } else {
            ExecutionMode desired = preferences.respondAsync ? ExecutionMode.ASYNC : ExecutionMode.SYNC;
            if (asyncSupported && syncSupported) {
                decision = honor(desired, preferences);
            } else {
                ExecutionMode enforced = asyncSupported ? ExecutionMode.ASYNC : ExecutionMode.SYNC;
                if (enforced == desired) {
                    decision = honor(enforced, preferences);
                } else {
                    decision = enforced == ExecutionMode.ASYNC
                            ? ExecutionModeDecision.async()
                            : ExecutionModeDecision.sync(maxWaitSeconds);
                }
            }
        }

        log.debug("Negotiated {} execution (wait={}, applied={}) for options {} and preference {}",
                decision.getMode().getValue(), decision.getWaitSeconds(), decision.getAppliedPreferenceHeaders(),
                declaredOptions, preferences == null ? "none" : SecurityUtils.sanitizeForLogging(preferences.raw));
        return decision;
    }

    private ExecutionModeDecision honor(ExecutionMode mode, Preferences preferences) {
        if (mode == ExecutionMode.ASYNC) {
            return ExecutionModeDecision.asyncApplied();
        }
        if (preferences.wait != null) {
            return ExecutionModeDecision.syncApplied(preferences.wait);
        }
        return ExecutionModeDecision.sync(maxWaitSeconds);
    }

    /**
     * Parses the combined {@code Prefer} headers.
     *
     * @return parsed preferences, null when no header carries anything
     */
    static Preferences parse(Collection<String> preferHeaders) {
        if (preferHeaders == null) {
            return null;
        }
        List<String> values = preferHeaders.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toList());
        if (values.isEmpty()) {
            return null;
        }

        String raw = String.join(", ", values);
        Preferences preferences = new Preferences(raw);
        for (String token : TOKEN_SEPARATOR.split(raw)) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int equals = trimmed.indexOf('=');
            if (equals < 0) {
                if (RESPOND_ASYNC.equalsIgnoreCase(trimmed)) {
                    preferences.respondAsync = true;
                } else if (NUMERIC.matcher(trimmed).matches()) {
                    // a stray number means a list was given as wait value, e.g. "wait=1,2,3"
                    throw new InvalidPreferenceException("Invalid 'wait' preference, got multiple values", raw);
                }
                continue;
            }

            String key = trimmed.substring(0, equals).trim().toLowerCase(Locale.ROOT);
            String value = unquote(trimmed.substring(equals + 1).trim());
            if (!WAIT.equals(key)) {
                continue;
            }
            if (preferences.wait != null) {
                throw new InvalidPreferenceException("Invalid 'wait' preference, specified more than once", raw);
            }
            preferences.wait = parseWait(value, raw);
        }
        return preferences;
    }

    private static int parseWait(String value, String raw) {
        if (!POSITIVE_INTEGER.matcher(value).matches()) {
            throw new InvalidPreferenceException("Invalid 'wait' preference, expected positive integer seconds", raw);
        }
        long seconds;
        try {
            seconds = Long.parseLong(value);
        } catch (NumberFormatException e) {
            // digits only at this point, so the value is merely too large to represent
            log.debug("Oversized 'wait' preference {} treated as unbounded", SecurityUtils.sanitizeForLogging(value));
            seconds = Long.MAX_VALUE;
        }
        if (seconds <= 0) {
            throw new InvalidPreferenceException("Invalid 'wait' preference, expected positive integer seconds", raw);
        }
        // clamped to the int range, still above any configured maximum
        return (int) Math.min(seconds, Integer.MAX_VALUE);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).trim();
        }
        return value;
    }

    static final class Preferences {
        private final String raw;
        private boolean respondAsync;
        private Integer wait;

        private Preferences(String raw) {
            this.raw = raw;
        }

        boolean isRespondAsync() {
            return respondAsync;
        }

        Integer getWait() {
            return wait;
        }
    }
}
