package com.jacobsonmt.contributions.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class QueueSummary {

    private final long queued;
    private final long running;
    private final long completed;
    private final long failed;

    // Totals since startup, unaffected by purging
    private final int completedTotal;
    private final int failedTotal;

    private final int workers;

}
