package com.jacobsonmt.contributions.model;

import com.jacobsonmt.contributions.repositories.JobRepository;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Removes finished jobs (completed or failed) once they have been terminal for longer than the configured age.
 * Queued and running jobs are never touched.
 */
@Log4j2
public class PurgeOldJobs implements Runnable {

    private final JobRepository jobRepository;
    private final long purgeAfterMillis;

    public PurgeOldJobs( JobRepository jobRepository, long purgeAfterMillis ) {
        this.jobRepository = jobRepository;
        this.purgeAfterMillis = purgeAfterMillis;
    }

    @Override
    public void run() {
        long now = System.currentTimeMillis();
        List<ContributionJob> expired = jobRepository.allJobs()
                .filter( ContributionJob::isTerminal )
                .filter( job -> now - job.getCompletedAt().getTime() >= purgeAfterMillis )
                .collect( Collectors.toList() );

        for ( ContributionJob job : expired ) {
            jobRepository.delete( job.getJobId() );
            log.debug( "Purged " + job.getJobId() );
        }
        log.info( "Purged " + expired.size() + " old jobs." );
    }

}
