package io.procjobs.backend.service;

import io.procjobs.backend.model.entity.Access;
import io.procjobs.backend.model.entity.JobStatus;
import io.procjobs.backend.model.entity.StatusCategory;
import io.procjobs.backend.model.query.DatetimeInterval;
import io.procjobs.backend.model.query.GroupBy;
import io.procjobs.backend.model.query.JobGroupField;
import io.procjobs.backend.model.query.JobListContext;
import io.procjobs.backend.model.query.JobQuery;
import io.procjobs.backend.model.query.JobSortField;
import io.procjobs.backend.model.query.JobType;
import io.procjobs.backend.service.exception.InvalidJobQueryException;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns listing query parameters into a validated {@link JobQuery}.
 */
@Component
public class JobQueryParser {

    static final String PROCESS = "process";
    static final String SERVICE = "service";
    static final String PROVIDER = "provider";
    static final String TYPE = "type";
    static final String STATUS = "status";
    static final String TAGS = "tags";
    static final String ACCESS = "access";
    static final String NOTIFICATION = "notification";
    static final String DATETIME = "datetime";
    static final String MIN_DURATION = "minDuration";
    static final String MAX_DURATION = "maxDuration";
    static final String GROUPS = "groups";
    static final String DETAIL = "detail";
    static final String PAGE = "page";
    static final String LIMIT = "limit";
    static final String SORT = "sort";

    private static final List<String> KNOWN_PARAMETERS = List.of(
            PROCESS, SERVICE, PROVIDER, TYPE, STATUS, TAGS, ACCESS, NOTIFICATION, DATETIME,
            MIN_DURATION, MAX_DURATION, GROUPS, DETAIL, PAGE, LIMIT, SORT);

    private static final Set<String> TRUTHY = Set.of("true", "1", "yes");

    private static final String OPEN_END = "..";

    private final int defaultLimit;

    @Autowired
    public JobQueryParser(@Value("${app.jobs.default-limit:10}") int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    /**
     * Parses listing parameters requested on {@code context}.
     * Path identifiers of a scoped context take the place of the matching query parameters,
     * which must agree with them when also given.
     *
     * @param parameters raw query parameters, repeated keys allowed
     * @param context collection the listing was requested on
     * @throws InvalidJobQueryException naming the first rejected parameter
     */
    public JobQuery parse(Map<String, List<String>> parameters, JobListContext context) {
        JobQuery.JobQueryBuilder query = JobQuery.builder();

        String processParam = value(parameters, PROCESS);
        String serviceParam = resolveServiceAlias(parameters);
        String processId = scoped(PROCESS, processParam, context.getProcessId());
        String serviceId = scoped(PROVIDER, serviceParam, context.getProviderId());
        query.processId(processId).serviceId(serviceId);

        String typeParam = value(parameters, TYPE);
        if (typeParam != null) {
            JobType type = JobType.resolve(typeParam).orElseThrow(() -> InvalidJobQueryException.malformed(
                    TYPE, typeParam, "Job type must be one of " + List.of(JobType.PROCESS.getValue(), JobType.PROVIDER.getValue())));
            if (type == JobType.PROCESS && serviceId != null) {
                throw InvalidJobQueryException.malformed(TYPE, typeParam,
                        "Ambiguous job type requested, 'type=process' contradicts provider '" + serviceId + "'");
            }
            query.jobType(type);
        }

        String statusParam = value(parameters, STATUS);
        if (statusParam != null) {
            query.statuses(parseStatuses(statusParam));
        }

        String tagsParam = value(parameters, TAGS);
        if (tagsParam != null) {
            query.tags(parseTags(tagsParam));
        }

        String accessParam = value(parameters, ACCESS);
        if (accessParam != null) {
            query.access(Access.resolve(accessParam).orElseThrow(() -> InvalidJobQueryException.malformed(
                    ACCESS, accessParam, "Access must be one of [public, private]")));
        }

        query.notification(value(parameters, NOTIFICATION));

        String datetimeParam = value(parameters, DATETIME);
        if (datetimeParam != null) {
            query.datetime(parseDatetime(datetimeParam));
        }

        Long minDuration = parseSeconds(parameters, MIN_DURATION);
        Long maxDuration = parseSeconds(parameters, MAX_DURATION);
        if (minDuration != null && maxDuration != null && minDuration > maxDuration) {
            throw InvalidJobQueryException.unprocessable(MIN_DURATION, minDuration + ".." + maxDuration,
                    "Duration range is inverted, minDuration must not exceed maxDuration");
        }
        query.minDuration(minDuration).maxDuration(maxDuration);

        List<GroupBy> groups = parseGroups(value(parameters, GROUPS));
        query.groups(groups);

        String detailParam = value(parameters, DETAIL);
        query.detail(detailParam != null && TRUTHY.contains(detailParam.toLowerCase(Locale.ROOT)));

        String sortParam = value(parameters, SORT);
        if (sortParam != null) {
            query.sort(JobSortField.resolve(sortParam).orElseThrow(() -> InvalidJobQueryException.unprocessable(
                    SORT, sortParam, "Unknown sort key, expected one of " + sortKeys())));
        }

        // paging does not apply to grouped listings
        if (groups.isEmpty()) {
            query.page(parseInteger(parameters, PAGE, JobQuery.DEFAULT_PAGE, 0));
            query.limit(parseInteger(parameters, LIMIT, defaultLimit, 1));
        } else {
            query.limit(defaultLimit);
        }

        query.parameters(preservedParameters(parameters, context));
        return query.build();
    }

    private static String resolveServiceAlias(Map<String, List<String>> parameters) {
        String service = value(parameters, SERVICE);
        String provider = value(parameters, PROVIDER);
        if (service != null && provider != null && !service.equals(provider)) {
            throw InvalidJobQueryException.malformed(PROVIDER, provider,
                    "Parameters 'service' and 'provider' are aliases and must not differ");
        }
        return service != null ? service : provider;
    }

    private static String scoped(String field, String queryValue, String pathValue) {
        if (pathValue == null) {
            return queryValue;
        }
        if (queryValue != null && !queryValue.equals(pathValue)) {
            throw InvalidJobQueryException.malformed(field, queryValue,
                    "Parameter '" + field + "' contradicts the requested collection '" + pathValue + "'");
        }
        return pathValue;
    }

    static Set<JobStatus> parseStatuses(String raw) {
        List<String> tokens = split(raw);
        if (tokens.isEmpty()) {
            throw InvalidJobQueryException.unprocessable(STATUS, raw, "Status filter is empty");
        }
        if (tokens.size() == 1 && JobStatus.resolve(tokens.get(0)).isEmpty()) {
            Optional<Set<JobStatus>> category = StatusCategory.expand(tokens.get(0));
            if (category.isPresent()) {
                return category.get();
            }
        }
        Set<JobStatus> statuses = EnumSet.noneOf(JobStatus.class);
        for (String token : tokens) {
            statuses.add(JobStatus.resolve(token).orElseThrow(() -> InvalidJobQueryException.unprocessable(
                    STATUS, raw, "Unknown status '" + token + "'")));
        }
        return statuses;
    }

    private static Set<String> parseTags(String raw) {
        Set<String> tags = new LinkedHashSet<>(split(raw));
        for (String tag : tags) {
            if (Access.isAccessValue(tag)) {
                throw InvalidJobQueryException.malformed(TAGS, raw,
                        "Visibility '" + tag + "' cannot be used as tag, use 'access' instead");
            }
        }
        return tags;
    }

    /**
     * Parses {@code <instant>}, {@code ../<instant>}, {@code <instant>/..} or {@code <start>/<end>}.
     */
    static DatetimeInterval parseDatetime(String raw) {
        // '+' of an offset arrives as a space when the client did not encode it
        String value = raw.trim().replace(' ', '+');
        int slash = value.indexOf('/');
        if (slash < 0) {
            return DatetimeInterval.exactly(parseInstant(value, raw));
        }
        if (value.indexOf('/', slash + 1) >= 0) {
            throw InvalidJobQueryException.unprocessable(DATETIME, raw, "Datetime interval has more than two bounds");
        }
        String start = value.substring(0, slash).trim();
        String end = value.substring(slash + 1).trim();
        Instant after = isOpen(start) ? null : parseInstant(start, raw);
        Instant before = isOpen(end) ? null : parseInstant(end, raw);
        if (after == null && before == null) {
            throw InvalidJobQueryException.unprocessable(DATETIME, raw, "Datetime interval must have at least one bound");
        }
        if (after != null && before != null && after.isAfter(before)) {
            throw InvalidJobQueryException.unprocessable(DATETIME, raw,
                    "Datetime interval is inverted, start must not be after end");
        }
        return DatetimeInterval.between(after, before);
    }

    private static boolean isOpen(String bound) {
        return bound.isEmpty() || OPEN_END.equals(bound);
    }

    private static Instant parseInstant(String value, String raw) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw InvalidJobQueryException.unprocessable(DATETIME, raw, "Invalid ISO-8601 datetime '" + value + "'");
        }
    }

    private static Long parseSeconds(Map<String, List<String>> parameters, String name) {
        String raw = value(parameters, name);
        if (raw == null) {
            return null;
        }
        long seconds;
        try {
            seconds = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw InvalidJobQueryException.malformed(name, raw, "Expected a number of seconds");
        }
        if (seconds < 0) {
            throw InvalidJobQueryException.malformed(name, raw, "Duration must not be negative");
        }
        return seconds;
    }

    private static int parseInteger(Map<String, List<String>> parameters, String name, int defaultValue, int minimum) {
        String raw = value(parameters, name);
        if (raw == null) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw InvalidJobQueryException.malformed(name, raw, "Expected an integer");
        }
        if (parsed < minimum) {
            throw InvalidJobQueryException.malformed(name, raw, "Value must be at least " + minimum);
        }
        return parsed;
    }

    private static List<GroupBy> parseGroups(String raw) {
        if (raw == null) {
            return List.of();
        }
        List<GroupBy> groups = new ArrayList<>();
        Set<JobGroupField> seen = EnumSet.noneOf(JobGroupField.class);
        for (String token : split(raw)) {
            String label = token.toLowerCase(Locale.ROOT);
            JobGroupField field = JobGroupField.resolve(label).orElseThrow(() -> InvalidJobQueryException.malformed(
                    GROUPS, raw, "Cannot group jobs by '" + token + "'"));
            if (seen.add(field)) {
                groups.add(new GroupBy(field, label));
            }
        }
        return groups;
    }

    /**
     * Recognized parameters to replay in generated links: paging is re-added per link and
     * identifiers already carried by the collection path are dropped.
     */
    private static Map<String, String> preservedParameters(Map<String, List<String>> parameters, JobListContext context) {
        Map<String, String> preserved = new LinkedHashMap<>();
        for (String name : parameters.keySet()) {
            if (!KNOWN_PARAMETERS.contains(name) || PAGE.equals(name) || LIMIT.equals(name)) {
                continue;
            }
            if (context.getProcessId() != null && PROCESS.equals(name)) {
                continue;
            }
            if (context.getProviderId() != null && (SERVICE.equals(name) || PROVIDER.equals(name))) {
                continue;
            }
            String value = value(parameters, name);
            if (value != null) {
                preserved.put(name, value);
            }
        }
        return preserved;
    }

    private static String value(Map<String, List<String>> parameters, String name) {
        List<String> values = parameters.get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String joined = values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.joining(","));
        return joined.isEmpty() ? null : joined;
    }

    private static List<String> split(String raw) {
        List<String> tokens = new ArrayList<>();
        for (String token : raw.split(",")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                tokens.add(trimmed);
            }
        }
        return tokens;
    }

    private static List<String> sortKeys() {
        List<String> keys = new ArrayList<>();
        for (JobSortField field : JobSortField.values()) {
            keys.add(field.getValue());
        }
        return keys;
    }
}
