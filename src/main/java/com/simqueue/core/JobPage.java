package com.simqueue.core;

import java.util.List;

/**
 * One page of a job listing plus the number of jobs matching the filter
 * regardless of pagination.
 */
public final class JobPage {
    private final List<SimulationJob> jobs;
    private final long total;

    public JobPage(List<SimulationJob> jobs, long total) {
        this.jobs = List.copyOf(jobs);
        this.total = total;
    }

    public List<SimulationJob> getJobs() {
        return jobs;
    }

    public long getTotal() {
        return total;
    }
}
