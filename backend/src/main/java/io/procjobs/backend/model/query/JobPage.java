package io.procjobs.backend.model.query;

import io.procjobs.backend.model.entity.Job;
import lombok.Value;

import java.util.List;

/**
 * Window of a sorted search plus the full match count.
 */
@Value
public class JobPage {
    List<Job> jobs;
    long total;
}
