package com.jacobsonmt.contributions.exceptions;

public class PipelineInterruptedException extends RuntimeException {

    public PipelineInterruptedException( String message ) {
        super( message );
    }

    public PipelineInterruptedException( Throwable cause ) {
        super( cause );
    }

    public PipelineInterruptedException( String message, Throwable cause ) {
        super( message, cause );
    }
}
