package io.procjobs.backend.model.query;

import io.procjobs.backend.model.entity.Job;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One partition of a grouped listing.
 */
@Value
public class JobGroup {

    /**
     * Group field label to the shared value; values may be null
     */
    Map<String, Object> category;

    List<Job> jobs;

    public int getCount() {
        return jobs.size();
    }
}
