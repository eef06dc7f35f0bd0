package com.jacobsonmt.contributions.model;

import com.jacobsonmt.contributions.exceptions.ProcessLaunchException;
import com.jacobsonmt.contributions.exceptions.ProcessTimeoutException;
import com.jacobsonmt.contributions.exceptions.StageFailureException;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

public class ContributionJobTest {

    private static final Path AUDIO = Paths.get( "/data/uploads/clip.webm" );
    private static final Path TRANSCRIPT = Paths.get( "/data/output_transcription/clip_with_speakers_complete.json" );
    private static final Path ANALYSIS = Paths.get( "/data/output_semantic/clip_with_speakers_love_analysis.json" );

    private ContributionJob queued;

    @Before
    public void setUp() {
        queued = ContributionJob.create( "job-1", 1, AUDIO, Collections.singletonMap( "source", "kiosk" ) );
    }

    @Test
    public void createdJobIsQueued() {
        assertThat( queued.getStatus() ).isEqualTo( JobStatus.QUEUED );
        assertThat( queued.getCurrentStage() ).isNull();
        assertThat( queued.getStageOutputs() ).isEmpty();
        assertThat( queued.getError() ).isNull();
        assertThat( queued.getCreatedAt() ).isNotNull();
        assertThat( queued.getStartedAt() ).isNull();
        assertThat( queued.getElapsedMillis() ).isNull();
        assertThat( queued.isTerminal() ).isFalse();
    }

    @Test
    public void metadataIsCopied() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put( "source", "kiosk" );
        ContributionJob job = ContributionJob.create( "job-2", 2, AUDIO, metadata );
        metadata.put( "source", "changed" );

        assertThat( job.getMetadata() ).containsEntry( "source", "kiosk" );
        assertThat( ContributionJob.create( "job-3", 3, AUDIO, null ).getMetadata() ).isEmpty();
    }

    @Test
    public void fullRunRecordsOutputsInStageOrder() {
        ContributionJob running = queued.start( "transcription" );
        assertThat( running.getStatus() ).isEqualTo( JobStatus.RUNNING );
        assertThat( running.getCurrentStage() ).isEqualTo( "transcription" );
        assertThat( running.getStartedAt() ).isNotNull();

        ContributionJob advanced = running.advance( "transcription", TRANSCRIPT, "semantic" );
        assertThat( advanced.getCurrentStage() ).isEqualTo( "semantic" );
        assertThat( advanced.getStageOutputs() ).containsOnlyKeys( "transcription" );

        ContributionJob completed = advanced.complete( "semantic", ANALYSIS );
        assertThat( completed.getStatus() ).isEqualTo( JobStatus.COMPLETED );
        assertThat( completed.getCurrentStage() ).isNull();
        assertThat( completed.getStageOutputs() ).containsExactly(
                entry( "transcription", TRANSCRIPT ), entry( "semantic", ANALYSIS ) );
        assertThat( completed.getCompletedAt() ).isNotNull();
        assertThat( completed.getElapsedMillis() ).isGreaterThanOrEqualTo( 0L );
        assertThat( completed.isTerminal() ).isTrue();

        // earlier snapshots are untouched
        assertThat( queued.getStatus() ).isEqualTo( JobStatus.QUEUED );
        assertThat( running.getStageOutputs() ).isEmpty();
    }

    @Test
    public void failureKeepsEarlierOutputs() {
        ContributionJob advanced = queued.start( "transcription" ).advance( "transcription", TRANSCRIPT, "semantic" );

        ContributionJob failed = advanced.fail( JobError.from( "semantic",
                new StageFailureException( "semantic", 1, "bad json" ) ) );

        assertThat( failed.getStatus() ).isEqualTo( JobStatus.ERROR );
        assertThat( failed.getCurrentStage() ).isNull();
        assertThat( failed.getStageOutputs() ).containsOnlyKeys( "transcription" );
        assertThat( failed.getError().getStage() ).isEqualTo( "semantic" );
        assertThat( failed.getError().getKind() ).isEqualTo( JobError.Kind.STAGE_FAILURE );
        assertThat( failed.getError().getExitCode() ).isEqualTo( 1 );
        assertThat( failed.getError().getStderr() ).isEqualTo( "bad json" );
        assertThat( failed.getCompletedAt() ).isNotNull();
    }

    @Test
    public void terminalStatesRejectTransitions() {
        ContributionJob completed = queued.start( "transcription" ).complete( "transcription", TRANSCRIPT );
        JobError error = new JobError( "transcription", JobError.Kind.UNEXPECTED, "boom", null, null );

        assertThatThrownBy( () -> completed.start( "transcription" ) ).isInstanceOf( IllegalStateException.class );
        assertThatThrownBy( () -> completed.fail( error ) ).isInstanceOf( IllegalStateException.class );

        ContributionJob failed = queued.fail( error );
        assertThatThrownBy( () -> failed.fail( error ) ).isInstanceOf( IllegalStateException.class );
        assertThatThrownBy( () -> failed.complete( "transcription", TRANSCRIPT ) ).isInstanceOf( IllegalStateException.class );
    }

    @Test
    public void queuedJobCannotAdvanceOrComplete() {
        assertThatThrownBy( () -> queued.advance( "transcription", TRANSCRIPT, "semantic" ) )
                .isInstanceOf( IllegalStateException.class );
        assertThatThrownBy( () -> queued.complete( "transcription", TRANSCRIPT ) )
                .isInstanceOf( IllegalStateException.class );
    }

    @Test
    public void runningJobCannotRestart() {
        ContributionJob running = queued.start( "transcription" );

        assertThatThrownBy( () -> running.start( "transcription" ) ).isInstanceOf( IllegalStateException.class );
    }

    @Test
    public void outputMustBelongToCurrentStage() {
        ContributionJob running = queued.start( "transcription" );

        assertThatThrownBy( () -> running.advance( "semantic", ANALYSIS, "semantic" ) )
                .isInstanceOf( IllegalStateException.class );
        assertThatThrownBy( () -> running.complete( "transcription", null ) )
                .isInstanceOf( IllegalArgumentException.class );
    }

    @Test
    public void failRequiresError() {
        assertThatThrownBy( () -> queued.fail( null ) ).isInstanceOf( IllegalArgumentException.class );
    }

    @Test
    public void errorKindFollowsCause() {
        assertThat( JobError.from( "transcription", new ProcessLaunchException( "no python" ) ).getKind() )
                .isEqualTo( JobError.Kind.LAUNCH_FAILURE );

        JobError timeout = JobError.from( "transcription", new ProcessTimeoutException( "too slow", 60, "loading model" ) );
        assertThat( timeout.getKind() ).isEqualTo( JobError.Kind.TIMEOUT );
        assertThat( timeout.getStderr() ).isEqualTo( "loading model" );

        JobError unexpected = JobError.from( "semantic", new NullPointerException() );
        assertThat( unexpected.getKind() ).isEqualTo( JobError.Kind.UNEXPECTED );
        assertThat( unexpected.getMessage() ).isEqualTo( "NullPointerException" );
    }

    @Test
    public void timestampsCannotBeChangedThroughGetters() {
        ContributionJob completed = queued.start( "transcription" ).complete( "transcription", TRANSCRIPT );
        long created = completed.getCreatedAt().getTime();
        long started = completed.getStartedAt().getTime();
        long finished = completed.getCompletedAt().getTime();

        completed.getCreatedAt().setTime( 0 );
        completed.getStartedAt().setTime( 0 );
        completed.getCompletedAt().setTime( 0 );

        assertThat( completed.getCreatedAt().getTime() ).isEqualTo( created );
        assertThat( completed.getStartedAt().getTime() ).isEqualTo( started );
        assertThat( completed.getCompletedAt().getTime() ).isEqualTo( finished );
        assertThat( completed.getElapsedMillis() ).isEqualTo( finished - created );
    }

    @Test
    public void equalityIsByJobId() {
        assertThat( queued.start( "transcription" ) ).isEqualTo( queued );
        assertThat( queued.toString() ).contains( "job-1" );
    }
}
