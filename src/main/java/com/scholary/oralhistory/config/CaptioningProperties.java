package com.scholary.oralhistory.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for alignment formatting and caption segmentation.
 *
 * <p>Lengths are in characters, durations in milliseconds.
 */
@ConfigurationProperties(prefix = "captioning")
@Validated
public record CaptioningProperties(
    @PositiveOrZero int maxUnalignedTrailingWordsAllowed,
    @Positive double speaker1ToSpeaker2CharRatio,
    @Positive int maxCueLength,
    @Positive int targetLength,
    @Positive int minCueDuration,
    @Positive int maxCueDuration,
    @Positive int targetDuration,
    @Positive int maxCueLineCount) {}
