package com.jacobsonmt.contributions.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jacobsonmt.contributions.exceptions.PipelineInterruptedException;
import com.jacobsonmt.contributions.exceptions.ProcessLaunchException;
import com.jacobsonmt.contributions.exceptions.ProcessTimeoutException;
import com.jacobsonmt.contributions.exceptions.StageFailureException;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Failure detail of a job in the {@link JobStatus#ERROR} state, attributed to the stage that failed.
 *
 * Jobs normally fail while running, so stage is the stage that was executing. The one exception is a job the worker
 * pool refused at submission (only possible once the pool is shutting down): it goes straight from queued to error
 * with kind {@link Kind#UNEXPECTED} and a null stage, since no stage ever ran.
 */
@Getter
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class JobError {

    public enum Kind {
        LAUNCH_FAILURE,
        STAGE_FAILURE,
        TIMEOUT,
        UNEXPECTED
    }

    private final String stage;
    private final Kind kind;
    private final String message;
    private final Integer exitCode;
    private final String stderr;

    public static JobError from( String stage, Throwable e ) {
        if ( e instanceof StageFailureException ) {
            StageFailureException sfe = (StageFailureException) e;
            return new JobError( stage, Kind.STAGE_FAILURE, sfe.getMessage(), sfe.getExitCode(), sfe.getStderr() );
        } else if ( e instanceof ProcessLaunchException ) {
            return new JobError( stage, Kind.LAUNCH_FAILURE, e.getMessage(), null, null );
        } else if ( e instanceof ProcessTimeoutException ) {
            return new JobError( stage, Kind.TIMEOUT, e.getMessage(), null, ( (ProcessTimeoutException) e ).getStderr() );
        } else if ( e instanceof PipelineInterruptedException ) {
            return new JobError( stage, Kind.UNEXPECTED, e.getMessage(), null, null );
        }
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return new JobError( stage, Kind.UNEXPECTED, message, null, null );
    }
}
