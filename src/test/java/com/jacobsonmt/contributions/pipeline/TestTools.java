package com.jacobsonmt.contributions.pipeline;

import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Shell scripts standing in for the external analysis tools. They are invoked as
 * {@code sh script --input IN --output OUT [params...]}, so $2 is the input and $4 the output.
 */
public final class TestTools {

    public static final String SUCCEED = "printf '{\"input\": \"%s\"}' \"$2\" > \"$4\"";
    public static final String FAIL = "echo 'model exploded' >&2\nexit 3";
    public static final String SLOW = "sleep 0.3\nprintf '{}' > \"$4\"";
    public static final String NO_OUTPUT = "exit 0";
    // Treats the output path as a directory, like analyze_love.py
    public static final String DIRECTORY_OUTPUT = "base=$(basename \"$2\" .json)\nbase=${base%_complete}\nmkdir -p \"$4\"\n"
            + "printf '{\"input\": \"%s\"}' \"$2\" > \"$4/${base}_love_analysis_love_analysis.json\"";

    private TestTools() {
    }

    public static Path script( TemporaryFolder folder, String name, String body ) throws IOException {
        Path script = folder.getRoot().toPath().resolve( name + ".sh" );
        Files.write( script, ( "#!/bin/sh\n" + body + "\n" ).getBytes( StandardCharsets.UTF_8 ) );
        return script;
    }

    public static PipelineStage stage( String name, Path script, Path outputDirectory, ProcessExecutor executor ) {
        return PipelineStage.builder()
                .name( name )
                .command( Arrays.asList( "sh", script.toString() ) )
                .outputPathRule( new SuffixOutputPathRule( outputDirectory, null, null, ".json" ) )
                .processExecutor( executor )
                .build();
    }

    public static Path audio( TemporaryFolder folder, String name ) throws IOException {
        Path audio = folder.getRoot().toPath().resolve( name );
        Files.write( audio, new byte[]{0x1A, 0x45, (byte) 0xDF, (byte) 0xA3} );
        return audio;
    }
}
