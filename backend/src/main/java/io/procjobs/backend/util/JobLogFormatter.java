package io.procjobs.backend.util;

import io.procjobs.backend.model.entity.Job;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Formats job log lines and durations.
 *
 * A line looks like {@code [2024-05-01 10:00:03] INFO     [job] 00:00:03  40% running    Fetching inputs}.
 */
public final class JobLogFormatter {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private static final String LOGGER_NAME = "job";

    private JobLogFormatter() {
    }

    public static String formatLine(Job job, String message, String level, Instant timestamp) {
        Instant at = timestamp != null ? timestamp : Instant.now();
        String lvl = level == null || level.isBlank() ? "INFO" : level.trim().toUpperCase(Locale.ROOT);
        String body = String.format(Locale.ROOT, "%s %3d%% %-10s %s",
                formatDuration(job.getDuration(at)),
                (int) job.getProgress(),
                job.getStatus().getValue(),
                message == null ? "" : message);
        return String.format(Locale.ROOT, "[%s] %-8s [%s] %s", TIMESTAMP.format(at), lvl, LOGGER_NAME, body);
    }

    /**
     * Renders a duration as {@code HH:MM:SS}; hours keep counting past 24.
     */
    public static String formatDuration(Duration duration) {
        long seconds = duration == null || duration.isNegative() ? 0 : duration.getSeconds();
        return String.format(Locale.ROOT, "%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
