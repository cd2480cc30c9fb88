package com.questrail.refraction.safety;

/**
 * One fatigue sample.
 *
 * @param accuracy       1.0 for a clear response, 0.0 otherwise
 * @param confidence     classifier confidence
 * @param latencySeconds time the patient took to answer
 */
public record TurnSample(double accuracy, double confidence, double latencySeconds)
{
}
