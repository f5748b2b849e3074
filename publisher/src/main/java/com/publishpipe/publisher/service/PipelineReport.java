package com.publishpipe.publisher.service;

/**
 * Counts from one {@link PublishPipeline#publishAll()} run.
 *
 * @param accepted         units in accepted state when the run started
 * @param validated        checked units whose validation passed
 * @param failedValidation checked units whose validation returned false or threw
 * @param published        units whose publish hook completed
 * @param finalized        units whose finalize hook completed
 */
public record PipelineReport(
        int accepted,
        int validated,
        int failedValidation,
        int published,
        int finalized) {}
