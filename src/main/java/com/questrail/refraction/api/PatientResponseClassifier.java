package com.questrail.refraction.api;

/**
 * PatientResponseClassifier
 * -----------------------------------------------------------------------------
 * Capability boundary to the language-understanding collaborator.
 *
 * <p>Keyword tables, red-flag matching and persona-override detection all live
 * behind this interface. The engine only consumes the resulting
 * {@link ClassifiedResponse}; it has no opinion on how it was produced.</p>
 *
 * <p>The current protocol step identifier is passed because classifiers
 * typically match against step-specific answer options.</p>
 */
@FunctionalInterface
public interface PatientResponseClassifier
{
    /**
     * Classifies one patient utterance.
     *
     * @param stepId    identifier of the protocol step the patient is answering
     * @param utterance raw patient text
     * @return the classification (never {@code null})
     */
    ClassifiedResponse classify(String stepId, String utterance);
}
