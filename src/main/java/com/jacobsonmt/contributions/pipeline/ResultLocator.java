package com.jacobsonmt.contributions.pipeline;

import java.nio.file.Path;

/**
 * Finds the result file a tool produced, given the output path it was handed. Most tools write the file at that
 * path; others treat it as a directory and write one or more files inside it.
 */
@FunctionalInterface
public interface ResultLocator {

    ResultLocator AT_OUTPUT_PATH = ( outputPath, inputPath, stageName ) -> outputPath;

    Path locate( Path outputPath, Path inputPath, String stageName );

}
