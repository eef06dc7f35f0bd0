package com.jacobsonmt.contributions.pipeline;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString(of = {"exitCode", "durationMillis"})
public final class ProcessResult {

    private final int exitCode;
    private final String stdout;
    private final String stderr;
    private final long durationMillis;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
