package io.netguard.domain.classify;

import java.time.Instant;

/**
 * Summary of the live classifier model.
 *
 * @param version model version, incremented on every successful retrain
 * @param vocabularySize number of distinct terms seen in training
 * @param gamblingExamples number of gambling training documents
 * @param benignExamples number of benign training documents
 * @param pendingFeedback feedback examples queued for the next retrain
 * @param trainedAt time the model was trained
 */
public record ModelInfo(
    long version,
    int vocabularySize,
    int gamblingExamples,
    int benignExamples,
    int pendingFeedback,
    Instant trainedAt) {}
