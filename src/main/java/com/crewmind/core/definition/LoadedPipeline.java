package com.crewmind.core.definition;

import com.crewmind.core.model.PipelineDefinition;
import com.crewmind.core.model.RunConfig;

import java.nio.file.Path;

/**
 * A pipeline definition file after parsing: the pipeline plus its effective run settings.
 */
public record LoadedPipeline(Path source, PipelineDefinition definition, RunConfig runConfig) {
}
