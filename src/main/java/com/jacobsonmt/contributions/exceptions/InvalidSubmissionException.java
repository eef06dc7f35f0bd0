package com.jacobsonmt.contributions.exceptions;

public class InvalidSubmissionException extends RuntimeException {

    public InvalidSubmissionException( String message ) {
        super( message );
    }

    public InvalidSubmissionException( Throwable cause ) {
        super( cause );
    }

    public InvalidSubmissionException( String message, Throwable cause ) {
        super( message, cause );
    }
}
