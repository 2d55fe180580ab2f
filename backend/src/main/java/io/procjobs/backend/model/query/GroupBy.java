package io.procjobs.backend.model.query;

import lombok.Value;

/**
 * A group-by field together with the name the client used for it.
 * Groups report their values under {@code label}.
 */
@Value
public class GroupBy {
    JobGroupField field;
    String label;
}
