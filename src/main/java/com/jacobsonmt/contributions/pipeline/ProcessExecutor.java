package com.jacobsonmt.contributions.pipeline;

import com.jacobsonmt.contributions.exceptions.PipelineInterruptedException;
import com.jacobsonmt.contributions.exceptions.ProcessLaunchException;
import com.jacobsonmt.contributions.exceptions.ProcessTimeoutException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs a single external command to completion.
 *
 * Standard output and error are drained concurrently so a tool writing a lot to either stream cannot block on a full
 * pipe. A non-zero exit code is a normal result; only failing to start the process, hitting the deadline or being
 * interrupted raise exceptions.
 */
@Log4j2
@Component
public class ProcessExecutor {

    static final int STREAM_MAX_CHARS = 1024 * 1024;

    private static final long GOBBLER_FLUSH_MILLIS = 5000;
    private static final long GRACEFUL_SHUTDOWN_MILLIS = 500;
    private static final long FORCEFUL_SHUTDOWN_MILLIS = 1000;

    public ProcessResult run( String command, List<String> args, Path workingDir, Map<String, String> env ) {
        return run( command, args, workingDir, env, null );
    }

    /**
     * @param command Executable to launch.
     * @param args Arguments following the executable.
     * @param workingDir Working directory, null to inherit.
     * @param env Variables added to the inherited environment, may be null.
     * @param timeout Deadline for the process to exit, null or zero to wait indefinitely.
     * @return Exit code and captured streams.
     * @throws ProcessLaunchException if the process could not be started
     * @throws ProcessTimeoutException if the process was killed for exceeding the deadline
     * @throws PipelineInterruptedException if the waiting thread was interrupted, the process is killed
     */
    public ProcessResult run( String command, List<String> args, Path workingDir, Map<String, String> env,
                              Duration timeout ) {
        List<String> commands = new ArrayList<>();
        commands.add( command );
        if ( args != null ) {
            commands.addAll( args );
        }

        ProcessBuilder builder = new ProcessBuilder( commands );
        if ( workingDir != null ) {
            builder.directory( workingDir.toFile() );
        }
        if ( env != null ) {
            builder.environment().putAll( env );
        }
        builder.redirectErrorStream( false );

        log.debug( "Executing: " + String.join( " ", commands ) );

        long start = System.nanoTime();
        Process p;
        try {
            p = builder.start();
        } catch ( IOException e ) {
            throw new ProcessLaunchException( "Could not launch (" + command + "): " + e.getMessage(), e );
        }

        String name = threadName( command );
        StringBuffer stdout = new StringBuffer();
        StringBuffer stderr = new StringBuffer();
        Thread outGobbler = startGobbler( p.getInputStream(), stdout, name + "-out" );
        Thread errGobbler = startGobbler( p.getErrorStream(), stderr, name + "-err" );

        try {
            if ( timeout != null && !timeout.isZero() && !timeout.isNegative() ) {
                if ( !p.waitFor( timeout.toMillis(), TimeUnit.MILLISECONDS ) ) {
                    destroyProcess( p );
                    joinQuietly( outGobbler );
                    joinQuietly( errGobbler );
                    throw new ProcessTimeoutException( "Timed out after " + timeout.getSeconds() + "s (" + command + ")",
                            timeout.getSeconds(), stderr.toString().trim() );
                }
            } else {
                p.waitFor();
            }
        } catch ( InterruptedException e ) {
            destroyProcess( p );
            Thread.currentThread().interrupt();
            throw new PipelineInterruptedException( "Interrupted while waiting for (" + command + ")", e );
        }

        joinQuietly( outGobbler );
        joinQuietly( errGobbler );

        long durationMillis = TimeUnit.NANOSECONDS.toMillis( System.nanoTime() - start );
        ProcessResult result = new ProcessResult( p.exitValue(), stdout.toString(), stderr.toString(), durationMillis );
        log.debug( "Process (" + command + ") finished: " + result );
        return result;
    }

    private static String threadName( String command ) {
        try {
            Path fileName = Paths.get( command ).getFileName();
            return fileName == null ? command : fileName.toString();
        } catch ( RuntimeException e ) {
            return "process";
        }
    }

    private static Thread startGobbler( InputStream inputStream, StringBuffer sink, String name ) {
        Thread thread = new Thread( new StreamGobbler( inputStream, sink, name ), name );
        thread.setDaemon( true );
        thread.start();
        return thread;
    }

    private static void joinQuietly( Thread thread ) {
        try {
            thread.join( GOBBLER_FLUSH_MILLIS );
        } catch ( InterruptedException e ) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess( Process process ) {
        process.destroy();
        try {
            if ( !process.waitFor( GRACEFUL_SHUTDOWN_MILLIS, TimeUnit.MILLISECONDS ) ) {
                process.destroyForcibly();
                if ( !process.waitFor( FORCEFUL_SHUTDOWN_MILLIS, TimeUnit.MILLISECONDS ) ) {
                    log.warn( "Process still alive after destroyForcibly" );
                }
            }
        } catch ( InterruptedException e ) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Reads a stream line by line into a buffer, logging each line as it arrives. Past the cap the stream is still
     * drained so the process never blocks, but the lines are dropped.
     */
    private static final class StreamGobbler implements Runnable {

        private final InputStream inputStream;
        private final StringBuffer sink;
        private final String name;

        StreamGobbler( InputStream inputStream, StringBuffer sink, String name ) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
        }

        @Override
        public void run() {
            boolean capReached = false;
            try ( BufferedReader reader = new BufferedReader( new InputStreamReader( inputStream, StandardCharsets.UTF_8 ) ) ) {
                String line;
                while ( ( line = reader.readLine() ) != null ) {
                    log.debug( "[" + name + "] " + line );
                    if ( sink.length() + line.length() + 1 > STREAM_MAX_CHARS ) {
                        if ( !capReached ) {
                            log.warn( "Stream (" + name + ") reached " + STREAM_MAX_CHARS + " chars; discarding further output" );
                            capReached = true;
                        }
                        continue;
                    }
                    sink.append( line ).append( '\n' );
                }
            } catch ( IOException e ) {
                log.debug( "Stream (" + name + ") closed: " + e.getMessage() );
            }
        }
    }
}
