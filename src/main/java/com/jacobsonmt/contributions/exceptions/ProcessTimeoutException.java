package com.jacobsonmt.contributions.exceptions;

import lombok.Getter;

@Getter
public class ProcessTimeoutException extends RuntimeException {

    private final long timeoutSeconds;
    private final String stderr;

    public ProcessTimeoutException( String message, long timeoutSeconds, String stderr ) {
        super( message );
        this.timeoutSeconds = timeoutSeconds;
        this.stderr = stderr;
    }
}
