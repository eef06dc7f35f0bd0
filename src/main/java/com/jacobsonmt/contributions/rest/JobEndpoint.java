package com.jacobsonmt.contributions.rest;

import com.jacobsonmt.contributions.exceptions.InvalidSubmissionException;
import com.jacobsonmt.contributions.model.JobStatusView;
import com.jacobsonmt.contributions.model.Message;
import com.jacobsonmt.contributions.services.JobManager;
import com.jacobsonmt.contributions.services.JobStatusService;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Endpoints to submit jobs and poll their progress.
 */
@Log4j2
@RequestMapping("/api/job")
@RestController
public class JobEndpoint {

    @Autowired
    private JobManager jobManager;

    @Autowired
    private JobStatusService jobStatusService;

    @RequestMapping(value = "/{jobId}", method = RequestMethod.GET, produces = {MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<JobStatusView> getJob( @PathVariable String jobId,
                                                 @RequestParam(value = "inline", defaultValue = "false") boolean inline ) {
        Optional<JobStatusView> view = jobStatusService.getStatus( jobId, inline );

        if ( !view.isPresent() ) {
            return ResponseEntity.notFound().build();
        }

        return ResponseEntity.ok( view.get() );
    }

    @RequestMapping(value = "/{jobId}/status", method = RequestMethod.GET, produces = {MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<String> getJobStatus( @PathVariable String jobId ) {
        Optional<JobStatusView> view = jobStatusService.getStatus( jobId );

        if ( !view.isPresent() ) {
            return ResponseEntity.status( HttpStatus.NOT_FOUND ).body( "Job Not Found" );
        }

        return ResponseEntity.ok( view.get().getStatus().getLabel() );
    }

    @RequestMapping(value = "/submit", method = RequestMethod.POST, produces = {MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<JobSubmissionResponse> submitJob( @Valid @RequestBody JobSubmissionContent jobSubmissionContent, BindingResult errors ) {
        // NOTE: You must declare an Errors, or BindingResult argument immediately after the validated method argument.
        JobSubmissionResponse result = new JobSubmissionResponse();

        if ( errors.hasErrors() ) {
            for ( ObjectError error : errors.getAllErrors() ) {
                result.addMessage( new Message( Message.MessageLevel.ERROR, error.getDefaultMessage() ) );
            }
        } else {
            try {
                String jobId = jobManager.submit( jobSubmissionContent.getAudioPath(), jobSubmissionContent.getMetadata() );
                result.setJobId( jobId );
                result.addMessage( new Message( Message.MessageLevel.INFO, "Contribution received, processing queued." ) );
            } catch ( InvalidSubmissionException e ) {
                log.info( "Rejected submission: " + e.getMessage() );
                result.addMessage( new Message( Message.MessageLevel.ERROR, e.getMessage() ) );
            }
        }

        HttpStatus status = result.getMessages().stream()
                .anyMatch( m -> m.getLevel().equals( Message.MessageLevel.ERROR ) ) ?
                HttpStatus.BAD_REQUEST :
                HttpStatus.OK;

        return ResponseEntity.status( status ).body( result );
    }

    @Getter
    @Setter
    @NoArgsConstructor
    static class JobSubmissionContent {
        @NotBlank(message = "Audio path missing!")
        private String audioPath;
        private Map<String, String> metadata = new HashMap<>();
    }

    @Getter
    @Setter
    @NoArgsConstructor
    static class JobSubmissionResponse {
        private String jobId;
        private List<Message> messages = new ArrayList<>();

        private void addMessage( Message message ) {
            messages.add( message );
        }
    }

}
