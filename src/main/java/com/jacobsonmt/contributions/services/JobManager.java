package com.jacobsonmt.contributions.services;

import com.jacobsonmt.contributions.exceptions.InvalidSubmissionException;
import com.jacobsonmt.contributions.model.ContributionJob;
import com.jacobsonmt.contributions.model.JobError;
import com.jacobsonmt.contributions.model.JobStatus;
import com.jacobsonmt.contributions.model.PurgeOldJobs;
import com.jacobsonmt.contributions.model.QueueSummary;
import com.jacobsonmt.contributions.pipeline.Pipeline;
import com.jacobsonmt.contributions.pipeline.PipelineStage;
import com.jacobsonmt.contributions.repositories.JobRepository;
import com.jacobsonmt.contributions.settings.ApplicationSettings;
import lombok.extern.log4j.Log4j2;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Admits jobs and runs them through the pipeline on a fixed pool of workers.
 *
 * Submissions never wait on execution: the job is stored as queued and its id handed to the pool, whose internal
 * queue holds everything beyond the pool size. Each worker takes one job at a time and runs its stages in order,
 * writing every transition back to the {@link JobRepository}.
 */
@Log4j2
@Service
public class JobManager {

    private final ApplicationSettings applicationSettings;
    private final JobRepository jobRepository;
    private final Pipeline pipeline;

    // Main executor to process jobs
    private ExecutorService executor;

    // Used to periodically purge the old saved jobs
    private ScheduledExecutorService scheduler;

    private final AtomicLong admissionCount = new AtomicLong();

    // Totals since startup, unaffected by purging
    private final AtomicInteger completedCount = new AtomicInteger();
    private final AtomicInteger failedCount = new AtomicInteger();

    @Autowired
    public JobManager( ApplicationSettings applicationSettings, JobRepository jobRepository, Pipeline pipeline ) {
        this.applicationSettings = applicationSettings;
        this.jobRepository = jobRepository;
        this.pipeline = pipeline;
    }

    /**
     * Initialize Job Manager:
     *
     * Create process queue executor.
     * Schedule purging of old finished jobs if enabled.
     */
    @PostConstruct
    public void initialize() {
        log.info( "Job Manager Initialize: " + applicationSettings.getConcurrentJobs() + " workers, stages " +
                pipeline.getStages().stream().map( PipelineStage::getName ).reduce( ( a, b ) -> a + " -> " + b ).orElse( "" ) );
        executor = Executors.newFixedThreadPool( applicationSettings.getConcurrentJobs(), namedThreadFactory( "pipeline-worker-" ) );

        if ( applicationSettings.isPurgeSavedJobs() ) {
            long period = applicationSettings.getPurgeSavedJobsTimeHours();
            scheduler = Executors.newSingleThreadScheduledExecutor( namedThreadFactory( "job-purge-" ) );
            scheduler.scheduleAtFixedRate(
                    new PurgeOldJobs( jobRepository, TimeUnit.HOURS.toMillis( applicationSettings.getPurgeAfterHours() ) ),
                    period, period, TimeUnit.HOURS );
        }
    }

    @PreDestroy
    public void destroy() {
        log.info( "JobManager destroyed" );
        if ( executor != null ) {
            executor.shutdownNow();
        }
        if ( scheduler != null ) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Admit an audio clip for processing.
     *
     * @param audioPath Path to an existing, readable audio file.
     * @param metadata Client metadata, passed through untouched.
     * @return Id used to poll for the job's status.
     * @throws InvalidSubmissionException if the audio file is missing or unreadable, no job is created
     */
    public String submit( String audioPath, Map<String, String> metadata ) {
        Path path = validateAudioPath( audioPath );

        ContributionJob job = ContributionJob.create( UUID.randomUUID().toString(), admissionCount.incrementAndGet(),
                path, metadata );
        jobRepository.save( job );

        log.info( "Submitting job (" + job.getJobId() + ") for audio (" + path.getFileName() + ") to process queue" );

        try {
            executor.execute( () -> process( job.getJobId() ) );
        } catch ( RejectedExecutionException e ) {
            log.error( "Process queue refused job (" + job.getJobId() + ")", e );
            jobRepository.save( job.fail( JobError.from( null, e ) ) );
            failedCount.incrementAndGet();
        }

        return job.getJobId();
    }

    private static Path validateAudioPath( String audioPath ) {
        if ( audioPath == null || audioPath.trim().isEmpty() ) {
            throw new InvalidSubmissionException( "Audio path missing" );
        }

        Path path;
        try {
            path = Paths.get( audioPath ).toAbsolutePath().normalize();
        } catch ( InvalidPathException e ) {
            throw new InvalidSubmissionException( "Invalid audio path: " + audioPath, e );
        }

        if ( !Files.isRegularFile( path ) ) {
            throw new InvalidSubmissionException( "Audio file not found: " + audioPath );
        }
        if ( !Files.isReadable( path ) ) {
            throw new InvalidSubmissionException( "Audio file not readable: " + audioPath );
        }
        return path;
    }

    /**
     * Worker body: run every stage of one job in order, halting at the first failure. Failures are recorded on the
     * job and never escape to the worker thread.
     */
    void process( String jobId ) {
        ContributionJob job = jobRepository.getById( jobId );
        if ( job == null ) {
            log.warn( "Job (" + jobId + ") no longer exists, skipping" );
            return;
        }
        if ( job.getStatus() != JobStatus.QUEUED ) {
            log.warn( "Job (" + jobId + ") is " + job.getStatus() + ", skipping" );
            return;
        }

        ThreadContext.put( "jobId", jobId );
        String stageName = null;
        try {
            List<PipelineStage> stages = pipeline.getStages();
            stageName = pipeline.firstStage().getName();
            job = update( job.start( stageName ) );
            log.info( "Starting job (" + jobId + ") for audio: (" + job.getAudioPath().getFileName() + ")" );

            Path input = job.getAudioPath();
            for ( int i = 0; i < pipeline.size(); i++ ) {
                PipelineStage stage = stages.get( i );
                stageName = stage.getName();
                ThreadContext.put( "stage", stageName );

                Path output = stage.execute( input );

                if ( i + 1 < pipeline.size() ) {
                    job = update( job.advance( stageName, output, stages.get( i + 1 ).getName() ) );
                } else {
                    job = update( job.complete( stageName, output ) );
                }
                input = output;
            }

            completedCount.incrementAndGet();
            log.info( String.format( "Finished job (%s) in %.1fs", jobId, job.getElapsedMillis() / 1000.0 ) );

        } catch ( RuntimeException e ) {
            JobError error = JobError.from( stageName, e );
            log.error( "Job (" + jobId + ") failed in stage (" + stageName + "): " + error.getKind() + " - " + error.getMessage() );
            log.debug( "Failure detail for job (" + jobId + ")", e );
            if ( !job.isTerminal() ) {
                update( job.fail( error ) );
            }
            failedCount.incrementAndGet();
        } finally {
            ThreadContext.remove( "jobId" );
            ThreadContext.remove( "stage" );
        }
    }

    private ContributionJob update( ContributionJob job ) {
        jobRepository.save( job );
        return job;
    }

    public ContributionJob getSavedJob( String jobId ) {
        return jobRepository.getById( jobId );
    }

    public int getCompletedCount() {
        return completedCount.get();
    }

    public int getFailedCount() {
        return failedCount.get();
    }

    public QueueSummary getQueueSummary() {
        return new QueueSummary(
                jobRepository.countByStatus( JobStatus.QUEUED ),
                jobRepository.countByStatus( JobStatus.RUNNING ),
                jobRepository.countByStatus( JobStatus.COMPLETED ),
                jobRepository.countByStatus( JobStatus.ERROR ),
                completedCount.get(),
                failedCount.get(),
                applicationSettings.getConcurrentJobs() );
    }

    private static ThreadFactory namedThreadFactory( String prefix ) {
        AtomicInteger threadCount = new AtomicInteger();
        return r -> {
            Thread thread = new Thread( r, prefix + threadCount.incrementAndGet() );
            thread.setDaemon( true );
            return thread;
        };
    }

}
