package com.jacobsonmt.contributions.rest;

import com.jacobsonmt.contributions.model.QueueSummary;
import com.jacobsonmt.contributions.services.JobManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RequestMapping("/api/queue")
@RestController
public class QueueEndpoint {

    @Autowired
    private JobManager jobManager;

    @RequestMapping(method = RequestMethod.GET, produces = {MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<QueueSummary> getQueueSummary() {
        return ResponseEntity.ok( jobManager.getQueueSummary() );
    }

    /**
     * @return Number of jobs that have finished successfully since startup. Can be used to test when to update during polling.
     */
    @RequestMapping(value = "/complete", method = RequestMethod.GET, produces = {MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<Integer> getCompletionCount() {
        return ResponseEntity.ok( jobManager.getCompletedCount() );
    }

}
