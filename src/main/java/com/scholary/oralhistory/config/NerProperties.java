package com.scholary.oralhistory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for rebuilding entity candidates from tagged NER output.
 *
 * @param squareBracketHinting fold a bracketed annotation into the candidate it starts or follows
 * @param paragraphBreaks end a candidate at a blank line in the transcript
 */
@ConfigurationProperties(prefix = "ner")
public record NerProperties(boolean squareBracketHinting, boolean paragraphBreaks) {}
