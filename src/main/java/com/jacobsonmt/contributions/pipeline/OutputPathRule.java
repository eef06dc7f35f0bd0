package com.jacobsonmt.contributions.pipeline;

import java.nio.file.Path;

/**
 * Derives where a stage writes its result. Must be a pure function of its arguments so that re-running a stage on the
 * same input targets the same file.
 */
@FunctionalInterface
public interface OutputPathRule {

    Path derive( Path inputPath, String stageName );

}
