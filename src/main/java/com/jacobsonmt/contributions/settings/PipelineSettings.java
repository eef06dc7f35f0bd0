package com.jacobsonmt.contributions.settings;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * External tool configuration for each analysis phase. Stages always run transcription first, then semantic.
 */
@Component
@ConfigurationProperties(prefix = "contributions.pipeline")
@Getter
@Setter
public class PipelineSettings {

    private StageSettings transcription = new StageSettings();
    private StageSettings semantic = new StageSettings();

    @Getter
    @Setter
    @ToString
    public static class StageSettings {

        private String name;

        // Executable followed by any leading arguments, e.g. [python, analyze.py]
        private List<String> command = new ArrayList<>();
        private String inputFlag = "--input";
        private String outputFlag = "--output";
        private List<String> parameters = new ArrayList<>();

        private String outputDirectory;
        private String outputSuffix;
        private String stripSuffix;
        private String extension = ".json";

        // For tools that treat the output path as a directory and write their result file inside it
        private boolean resultInDirectory = false;
        private String resultSuffix;
        private String resultStripSuffix;

        private String workingDirectory;
        private Map<String, String> environment = new HashMap<>();
        private long timeoutSeconds = 0;

    }
}
