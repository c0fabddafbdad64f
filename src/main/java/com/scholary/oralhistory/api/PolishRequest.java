package com.scholary.oralhistory.api;

import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Stanford NER and spaCy output for one story plus the transcript both were run on.
 *
 * @param tokenLines tagger output, one {@code token<TAB>label} per line
 * @param spacyLines spaCy CSV output, header row first; optional
 */
public record PolishRequest(
    @NotNull List<String> tokenLines, List<String> spacyLines, @NotNull String transcript) {}
