package com.jacobsonmt.contributions.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.jacobsonmt.contributions.model.ContributionJob;
import com.jacobsonmt.contributions.model.JobStatus;
import com.jacobsonmt.contributions.model.JobStatusView;
import com.jacobsonmt.contributions.repositories.JobRepository;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookups used by polling clients. Never waits on pipeline execution and has no side effects.
 */
@Log4j2
@Service
public class JobStatusService {

    private final JobRepository jobRepository;
    private final ObjectMapper objectMapper;

    @Autowired
    public JobStatusService( JobRepository jobRepository, ObjectMapper objectMapper ) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
    }

    public Optional<JobStatusView> getStatus( String jobId ) {
        return getStatus( jobId, false );
    }

    /**
     * @param jobId Job identity returned at submission.
     * @param inlineResults Include the content of each stage output for completed jobs.
     * @return View of the job, empty if the id is unknown.
     */
    public Optional<JobStatusView> getStatus( String jobId, boolean inlineResults ) {
        ContributionJob job = jobRepository.getById( jobId );
        if ( job == null ) {
            return Optional.empty();
        }
        return Optional.of( toView( job, inlineResults ) );
    }

    private JobStatusView toView( ContributionJob job, boolean inlineResults ) {
        JobStatusView.JobStatusViewBuilder view = JobStatusView.builder()
                .jobId( job.getJobId() )
                .status( job.getStatus() )
                .currentStage( job.getCurrentStage() )
                .metadata( job.getMetadata() )
                .createdAt( job.getCreatedAt() )
                .startedAt( job.getStartedAt() )
                .completedAt( job.getCompletedAt() );

        switch ( job.getStatus() ) {
            case QUEUED:
                view.position( queuePosition( job ) );
                break;
            case COMPLETED:
                Map<String, String> outputs = new LinkedHashMap<>();
                job.getStageOutputs().forEach( ( stage, path ) -> outputs.put( stage, path.toString() ) );
                view.outputs( outputs );
                view.elapsedSeconds( job.getElapsedMillis() / 1000.0 );
                if ( inlineResults ) {
                    view.results( readResults( job ) );
                }
                break;
            case ERROR:
                view.error( job.getError() );
                break;
            default:
                break;
        }

        return view.build();
    }

    /**
     * @return 1-based position among queued jobs in admission order.
     */
    private int queuePosition( ContributionJob job ) {
        return 1 + (int) jobRepository.allJobs()
                .filter( j -> j.getStatus() == JobStatus.QUEUED && j.getSequence() < job.getSequence() )
                .count();
    }

    private Map<String, JsonNode> readResults( ContributionJob job ) {
        Map<String, JsonNode> results = new LinkedHashMap<>();
        for ( Map.Entry<String, Path> entry : job.getStageOutputs().entrySet() ) {
            JsonNode content = readResult( entry.getValue() );
            if ( content != null ) {
                results.put( entry.getKey(), content );
            }
        }
        return results;
    }

    private JsonNode readResult( Path path ) {
        String content;
        try {
            content = new String( Files.readAllBytes( path ), StandardCharsets.UTF_8 );
        } catch ( IOException e ) {
            log.warn( "Could not read result file (" + path + "): " + e.getMessage() );
            return null;
        }

        try {
            JsonNode node = objectMapper.readTree( content );
            if ( node != null && !node.isMissingNode() ) {
                return node;
            }
        } catch ( JsonProcessingException e ) {
            log.debug( "Result file (" + path.getFileName() + ") is not JSON, returning raw text" );
        }
        return TextNode.valueOf( content );
    }
}
