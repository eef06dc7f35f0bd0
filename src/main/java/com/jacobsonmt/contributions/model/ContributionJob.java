package com.jacobsonmt.contributions.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One submitted audio clip and its progress through the pipeline.
 *
 * Instances are immutable; every state transition returns a new instance which replaces the previous one in the
 * {@link com.jacobsonmt.contributions.repositories.JobRepository}.
 *
 * Invariants:
 * <ul>
 *     <li>currentStage is non-null iff status is RUNNING</li>
 *     <li>stageOutputs only grows, in stage order, one entry per finished stage</li>
 *     <li>error is non-null iff status is ERROR</li>
 *     <li>COMPLETED and ERROR are terminal</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
@ToString(of = {"jobId", "status", "currentStage"})
@EqualsAndHashCode(of = {"jobId"})
public final class ContributionJob {

    private final String jobId;

    // Admission order, used to compute queue position
    private final long sequence;

    private final Path audioPath;
    private final Map<String, String> metadata;

    private final JobStatus status;
    private final String currentStage;
    private final Map<String, Path> stageOutputs;
    private final JobError error;

    private final Date createdAt;
    private final Date startedAt;
    private final Date completedAt;

    public static ContributionJob create( String jobId, long sequence, Path audioPath, Map<String, String> metadata ) {
        return ContributionJob.builder()
                .jobId( jobId )
                .sequence( sequence )
                .audioPath( audioPath )
                .metadata( metadata == null ? Collections.emptyMap() :
                        Collections.unmodifiableMap( new LinkedHashMap<>( metadata ) ) )
                .status( JobStatus.QUEUED )
                .stageOutputs( Collections.emptyMap() )
                .createdAt( new Date() )
                .build();
    }

    /**
     * A worker picked the job off the queue.
     */
    public ContributionJob start( String firstStage ) {
        requireStatus( JobStatus.QUEUED, "start" );
        requireStage( firstStage );
        return toBuilder()
                .status( JobStatus.RUNNING )
                .currentStage( firstStage )
                .startedAt( new Date() )
                .build();
    }

    /**
     * The current stage succeeded and another stage follows.
     */
    public ContributionJob advance( String finishedStage, Path output, String nextStage ) {
        requireStatus( JobStatus.RUNNING, "advance" );
        requireStage( nextStage );
        return toBuilder()
                .currentStage( nextStage )
                .stageOutputs( withOutput( finishedStage, output ) )
                .build();
    }

    /**
     * The last stage succeeded.
     */
    public ContributionJob complete( String finishedStage, Path output ) {
        requireStatus( JobStatus.RUNNING, "complete" );
        return toBuilder()
                .status( JobStatus.COMPLETED )
                .currentStage( null )
                .stageOutputs( withOutput( finishedStage, output ) )
                .completedAt( new Date() )
                .build();
    }

    /**
     * Allowed from any non-terminal state. A queued job can only fail if the worker pool refused it.
     */
    public ContributionJob fail( JobError error ) {
        if ( status.isTerminal() ) {
            throw new IllegalStateException( "Cannot fail job (" + jobId + ") in terminal state " + status );
        }
        if ( error == null ) {
            throw new IllegalArgumentException( "Error detail is required" );
        }
        return toBuilder()
                .status( JobStatus.ERROR )
                .currentStage( null )
                .error( error )
                .completedAt( new Date() )
                .build();
    }

    // Copies, Date is mutable

    public Date getCreatedAt() {
        return copy( createdAt );
    }

    public Date getStartedAt() {
        return copy( startedAt );
    }

    public Date getCompletedAt() {
        return copy( completedAt );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * @return Milliseconds from admission to reaching a terminal state, or null while still queued / running.
     */
    public Long getElapsedMillis() {
        if ( completedAt == null ) {
            return null;
        }
        return completedAt.getTime() - createdAt.getTime();
    }

    private Map<String, Path> withOutput( String finishedStage, Path output ) {
        if ( finishedStage == null || !finishedStage.equals( currentStage ) ) {
            throw new IllegalStateException( "Job (" + jobId + ") is running stage (" + currentStage +
                    "), cannot record output for (" + finishedStage + ")" );
        }
        if ( stageOutputs.containsKey( finishedStage ) ) {
            throw new IllegalStateException( "Job (" + jobId + ") already has output for stage (" + finishedStage + ")" );
        }
        if ( output == null ) {
            throw new IllegalArgumentException( "Output path is required" );
        }
        Map<String, Path> outputs = new LinkedHashMap<>( stageOutputs );
        outputs.put( finishedStage, output );
        return Collections.unmodifiableMap( outputs );
    }

    private static Date copy( Date date ) {
        return date == null ? null : new Date( date.getTime() );
    }

    private void requireStatus( JobStatus expected, String transition ) {
        if ( status != expected ) {
            throw new IllegalStateException( "Cannot " + transition + " job (" + jobId + ") in state " + status );
        }
    }

    private static void requireStage( String stage ) {
        if ( stage == null || stage.isEmpty() ) {
            throw new IllegalArgumentException( "Stage name is required" );
        }
    }

}
