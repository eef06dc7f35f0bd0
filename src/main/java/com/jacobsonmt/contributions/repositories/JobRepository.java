package com.jacobsonmt.contributions.repositories;

import com.jacobsonmt.contributions.model.ContributionJob;
import com.jacobsonmt.contributions.model.JobStatus;

import java.util.stream.Stream;

public interface JobRepository {

    /**
     * @return The job or null if unknown.
     */
    ContributionJob getById( String id );

    /**
     * Insert the job or replace the stored job with the same id.
     */
    void save( ContributionJob job );

    void delete( String id );

    Stream<ContributionJob> allJobs();

    long countByStatus( JobStatus status );

}
