package com.jacobsonmt.contributions.settings;

import com.jacobsonmt.contributions.pipeline.DirectoryResultLocator;
import com.jacobsonmt.contributions.pipeline.Pipeline;
import com.jacobsonmt.contributions.pipeline.PipelineStage;
import com.jacobsonmt.contributions.pipeline.ProcessExecutor;
import com.jacobsonmt.contributions.pipeline.ResultLocator;
import com.jacobsonmt.contributions.pipeline.SuffixOutputPathRule;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;

/**
 * Builds the transcription and semantic analysis stages from {@link PipelineSettings}.
 */
@Log4j2
@Configuration
public class PipelineConfig {

    public static final String TRANSCRIPTION_STAGE = "transcription";
    public static final String SEMANTIC_STAGE = "semantic";

    @Bean
    public Pipeline pipeline( PipelineSettings pipelineSettings, ProcessExecutor processExecutor ) {
        Pipeline pipeline = new Pipeline( Arrays.asList(
                createStage( pipelineSettings.getTranscription(), TRANSCRIPTION_STAGE, processExecutor ),
                createStage( pipelineSettings.getSemantic(), SEMANTIC_STAGE, processExecutor ) ) );
        log.info( "Configured pipeline: " + pipeline );
        return pipeline;
    }

    static PipelineStage createStage( PipelineSettings.StageSettings settings, String defaultName,
                                      ProcessExecutor processExecutor ) {
        String name = settings.getName() == null || settings.getName().isEmpty() ? defaultName : settings.getName();

        return PipelineStage.builder()
                .name( name )
                .command( settings.getCommand() )
                .inputFlag( settings.getInputFlag() )
                .outputFlag( settings.getOutputFlag() )
                .parameters( settings.getParameters() )
                .workingDirectory( toPath( settings.getWorkingDirectory() ) )
                .environment( settings.getEnvironment() )
                .timeout( settings.getTimeoutSeconds() > 0 ? Duration.ofSeconds( settings.getTimeoutSeconds() ) : null )
                .outputPathRule( new SuffixOutputPathRule(
                        toPath( settings.getOutputDirectory() ),
                        settings.getOutputSuffix(),
                        settings.getStripSuffix(),
                        settings.getExtension() ) )
                .resultLocator( settings.isResultInDirectory() ?
                        new DirectoryResultLocator( settings.getResultSuffix(), settings.getResultStripSuffix(),
                                settings.getExtension() ) :
                        ResultLocator.AT_OUTPUT_PATH )
                .processExecutor( processExecutor )
                .build();
    }

    private static Path toPath( String path ) {
        return path == null || path.isEmpty() ? null : Paths.get( path );
    }
}
