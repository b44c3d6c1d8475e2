package com.ethixai.drift.service;

import com.ethixai.drift.dto.EvaluationSample;

import java.time.Instant;
import java.util.List;

/**
 * Read side of the evaluation pipeline: scored rows of one model within {@code [from, to)}, newest first,
 * at most {@code limit} of them.
 */
public interface EvaluationSource {

    List<EvaluationSample> fetchWindow(String modelId, Instant from, Instant to, int limit);
}
