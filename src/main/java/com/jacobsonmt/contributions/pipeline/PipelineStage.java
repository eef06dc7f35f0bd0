package com.jacobsonmt.contributions.pipeline;

import com.jacobsonmt.contributions.exceptions.StageFailureException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One analysis phase backed by an external tool. Immutable and stateless, a single instance serves every job.
 *
 * The tool is invoked as:
 * <pre>
 *     command... inputFlag inputPath outputFlag outputPath parameters...
 * </pre>
 * and must exit 0 after writing its result. The result is a regular file at outputPath unless the stage has a
 * {@link ResultLocator} pointing elsewhere, e.g. inside a directory the tool created at outputPath.
 */
@Log4j2
@Getter
@ToString(of = {"name", "command", "parameters"})
public final class PipelineStage {

    private final String name;
    private final List<String> command;
    private final String inputFlag;
    private final String outputFlag;
    private final List<String> parameters;
    private final Path workingDirectory;
    private final Map<String, String> environment;
    private final Duration timeout;
    private final OutputPathRule outputPathRule;
    private final ResultLocator resultLocator;
    private final ProcessExecutor processExecutor;

    @Builder
    private PipelineStage( String name,
                           List<String> command,
                           String inputFlag,
                           String outputFlag,
                           List<String> parameters,
                           Path workingDirectory,
                           Map<String, String> environment,
                           Duration timeout,
                           OutputPathRule outputPathRule,
                           ResultLocator resultLocator,
                           ProcessExecutor processExecutor ) {
        if ( name == null || name.isEmpty() ) {
            throw new IllegalArgumentException( "Stage name is required" );
        }
        if ( command == null || command.isEmpty() ) {
            throw new IllegalArgumentException( "Stage (" + name + ") has no command" );
        }
        if ( processExecutor == null ) {
            throw new IllegalArgumentException( "Stage (" + name + ") has no process executor" );
        }
        this.name = name;
        this.command = Collections.unmodifiableList( new ArrayList<>( command ) );
        this.inputFlag = inputFlag == null ? "--input" : inputFlag;
        this.outputFlag = outputFlag == null ? "--output" : outputFlag;
        this.parameters = parameters == null ? Collections.emptyList() :
                Collections.unmodifiableList( new ArrayList<>( parameters ) );
        this.workingDirectory = workingDirectory;
        this.environment = environment == null ? Collections.emptyMap() :
                Collections.unmodifiableMap( new LinkedHashMap<>( environment ) );
        this.timeout = timeout;
        this.outputPathRule = outputPathRule == null ? new SuffixOutputPathRule( null, null, null, null ) : outputPathRule;
        this.resultLocator = resultLocator == null ? ResultLocator.AT_OUTPUT_PATH : resultLocator;
        this.processExecutor = processExecutor;
    }

    public Path deriveOutputPath( Path inputPath ) {
        return outputPathRule.derive( inputPath, name );
    }

    /**
     * Run the tool on the given input.
     *
     * @param inputPath Audio file for the first stage, previous stage output otherwise.
     * @return Path of the result file.
     * @throws StageFailureException if the tool exited non-zero or left no result file
     * @throws com.jacobsonmt.contributions.exceptions.ProcessLaunchException if the tool could not be started
     * @throws com.jacobsonmt.contributions.exceptions.ProcessTimeoutException if the tool exceeded its timeout
     */
    public Path execute( Path inputPath ) {
        Path outputPath = deriveOutputPath( inputPath );

        try {
            Files.createDirectories( outputPath.getParent() );
        } catch ( IOException e ) {
            throw new UncheckedIOException( "Could not create output directory for stage (" + name + ")", e );
        }

        log.info( "Starting stage (" + name + ") on " + inputPath.getFileName() );
        ProcessResult result = processExecutor.run( command.get( 0 ), buildArguments( inputPath, outputPath ),
                workingDirectory, environment, timeout );

        if ( !result.isSuccess() ) {
            throw new StageFailureException( name, result.getExitCode(), result.getStderr().trim() );
        }

        Path resultPath = resultLocator.locate( outputPath, inputPath, name );
        if ( !Files.isRegularFile( resultPath ) ) {
            String found = Files.isDirectory( resultPath ) ? "a directory" : "nothing";
            throw new StageFailureException( name, "Stage (" + name + ") exited successfully but wrote no output file to "
                    + resultPath + " (found " + found + ")" );
        }

        log.info( "Finished stage (" + name + ") in " + result.getDurationMillis() + "ms: " + resultPath.getFileName() );
        return resultPath;
    }

    List<String> buildArguments( Path inputPath, Path outputPath ) {
        List<String> args = new ArrayList<>( command.subList( 1, command.size() ) );
        args.add( inputFlag );
        args.add( inputPath.toAbsolutePath().toString() );
        args.add( outputFlag );
        args.add( outputPath.toString() );
        args.addAll( parameters );
        return args;
    }

}
