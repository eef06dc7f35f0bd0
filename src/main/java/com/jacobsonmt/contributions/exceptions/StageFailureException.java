package com.jacobsonmt.contributions.exceptions;

import lombok.Getter;

/**
 * The external tool of a stage ran but did not succeed: it exited non-zero, or exited zero without writing its
 * output file.
 */
@Getter
public class StageFailureException extends RuntimeException {

    private final String stage;
    private final int exitCode;
    private final String stderr;

    public StageFailureException( String stage, int exitCode, String stderr ) {
        super( "Stage (" + stage + ") exited with code " + exitCode + ( stderr == null || stderr.isEmpty() ? "" : ": " + stderr ) );
        this.stage = stage;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public StageFailureException( String stage, String message ) {
        super( message );
        this.stage = stage;
        this.exitCode = 0;
        this.stderr = null;
    }
}
