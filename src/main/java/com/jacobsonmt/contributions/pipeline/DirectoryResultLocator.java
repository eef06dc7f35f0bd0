package com.jacobsonmt.contributions.pipeline;

import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * For tools that create a directory at the output path and write their result inside it. The result file is named
 * from the stage input the same way {@link SuffixOutputPathRule} names outputs, e.g. with suffix
 * "_love_analysis_love_analysis" and strip suffix "_complete":
 * <pre>
 *     clip_with_speakers_complete.json -> outputPath/clip_with_speakers_love_analysis_love_analysis.json
 * </pre>
 */
@Getter
@ToString
public final class DirectoryResultLocator implements ResultLocator {

    private final SuffixOutputPathRule fileNameRule;

    public DirectoryResultLocator( String suffix, String stripSuffix, String extension ) {
        this.fileNameRule = new SuffixOutputPathRule( null, suffix, stripSuffix, extension );
    }

    @Override
    public Path locate( Path outputPath, Path inputPath, String stageName ) {
        return outputPath.resolve( fileNameRule.derive( inputPath, stageName ).getFileName() );
    }
}
