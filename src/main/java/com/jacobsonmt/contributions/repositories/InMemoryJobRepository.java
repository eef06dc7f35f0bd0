package com.jacobsonmt.contributions.repositories;

import com.jacobsonmt.contributions.model.ContributionJob;
import com.jacobsonmt.contributions.model.JobStatus;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Process-lifetime job store. Starts empty, nothing survives a restart.
 */
@Log4j2
@Primary
@Component
public class InMemoryJobRepository implements JobRepository {

    private final Map<String, ContributionJob> savedJobs = new ConcurrentHashMap<>();

    @Override
    public ContributionJob getById( String id ) {
        if ( id == null ) {
            return null;
        }
        return savedJobs.get( id );
    }

    @Override
    public void save( ContributionJob job ) {
        savedJobs.put( job.getJobId(), job );
    }

    @Override
    public void delete( String id ) {
        if ( savedJobs.remove( id ) != null ) {
            log.debug( "Removed job (" + id + ")" );
        }
    }

    @Override
    public Stream<ContributionJob> allJobs() {
        return savedJobs.values().stream();
    }

    @Override
    public long countByStatus( JobStatus status ) {
        return savedJobs.values().stream().filter( j -> j.getStatus() == status ).count();
    }
}
