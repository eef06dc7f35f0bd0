package com.jacobsonmt.contributions.pipeline;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered stages every job runs through. Each stage consumes the previous stage's output.
 */
@Getter
@ToString
public final class Pipeline {

    private final List<PipelineStage> stages;

    public Pipeline( List<PipelineStage> stages ) {
        if ( stages == null || stages.isEmpty() ) {
            throw new IllegalArgumentException( "A pipeline needs at least one stage" );
        }
        Set<String> names = new HashSet<>();
        for ( PipelineStage stage : stages ) {
            if ( !names.add( stage.getName() ) ) {
                throw new IllegalArgumentException( "Duplicate stage name: " + stage.getName() );
            }
        }
        this.stages = Collections.unmodifiableList( new ArrayList<>( stages ) );
    }

    public PipelineStage firstStage() {
        return stages.get( 0 );
    }

    public int size() {
        return stages.size();
    }
}
