package com.jacobsonmt.contributions.pipeline;

import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * Output named after the input file: extension dropped, an optional trailing suffix stripped, then the stage suffix
 * and output extension appended. For example with suffix "_love_analysis" and strip suffix "_complete":
 * <pre>
 *     clip_with_speakers_complete.json -> clip_with_speakers_love_analysis.json
 * </pre>
 */
@Getter
@ToString
public final class SuffixOutputPathRule implements OutputPathRule {

    private final Path outputDirectory;
    private final String suffix;
    private final String stripSuffix;
    private final String extension;

    /**
     * @param outputDirectory Directory for outputs, null to write next to the input.
     * @param suffix Appended to the base name, null for "_" + stage name.
     * @param stripSuffix Removed from the end of the base name if present, may be null.
     * @param extension Output extension including the dot, null for ".json".
     */
    public SuffixOutputPathRule( Path outputDirectory, String suffix, String stripSuffix, String extension ) {
        this.outputDirectory = outputDirectory == null ? null : outputDirectory.toAbsolutePath().normalize();
        this.suffix = suffix;
        this.stripSuffix = stripSuffix;
        this.extension = extension == null ? ".json" : extension;
    }

    @Override
    public Path derive( Path inputPath, String stageName ) {
        Path absoluteInput = inputPath.toAbsolutePath().normalize();
        String baseName = absoluteInput.getFileName().toString();

        int dot = baseName.lastIndexOf( '.' );
        if ( dot > 0 ) {
            baseName = baseName.substring( 0, dot );
        }

        if ( stripSuffix != null && !stripSuffix.isEmpty() && baseName.endsWith( stripSuffix )
                && baseName.length() > stripSuffix.length() ) {
            baseName = baseName.substring( 0, baseName.length() - stripSuffix.length() );
        }

        String fileName = baseName + ( suffix == null ? "_" + stageName : suffix ) + extension;
        Path directory = outputDirectory == null ? absoluteInput.getParent() : outputDirectory;
        return directory.resolve( fileName );
    }
}
