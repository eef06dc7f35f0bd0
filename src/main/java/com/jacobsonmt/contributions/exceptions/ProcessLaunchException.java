package com.jacobsonmt.contributions.exceptions;

/**
 * The external tool could not be started at all (missing binary, permission denied, bad working directory).
 * Distinct from a tool that started and then exited non-zero.
 */
public class ProcessLaunchException extends RuntimeException {

    public ProcessLaunchException( String message ) {
        super( message );
    }

    public ProcessLaunchException( String message, Throwable cause ) {
        super( message, cause );
    }
}
