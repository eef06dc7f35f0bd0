package com.jacobsonmt.contributions.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;

import java.util.Date;
import java.util.Map;

/**
 * Read-only client view of a job. Outputs and elapsed time are only present once completed, error only once failed,
 * position only while queued.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class JobStatusView {

    private final String jobId;
    private final JobStatus status;
    private final String currentStage;
    private final Integer position;
    private final Map<String, String> metadata;

    private final Date createdAt;
    private final Date startedAt;
    private final Date completedAt;

    private final Map<String, String> outputs;
    private final Map<String, JsonNode> results;
    private final Double elapsedSeconds;

    private final JobError error;

}
