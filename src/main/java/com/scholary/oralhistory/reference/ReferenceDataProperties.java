package com.scholary.oralhistory.reference;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Locations of the reference tables used for entity resolution. File names are resolved against
 * {@code directory}.
 */
@ConfigurationProperties(prefix = "reference-data")
@Validated
public record ReferenceDataProperties(
    @NotBlank String directory,
    @NotBlank String placesFile,
    @NotBlank String cityHintsFile,
    @NotBlank String corporateNamesFile,
    @NotBlank String corporateSynonymsFile) {}
