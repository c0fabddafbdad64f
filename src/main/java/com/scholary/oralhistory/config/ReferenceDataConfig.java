package com.scholary.oralhistory.config;

import com.scholary.oralhistory.entity.location.LocationReferenceData;
import com.scholary.oralhistory.entity.location.UsState;
import com.scholary.oralhistory.entity.organization.CorporateNameAuthority;
import com.scholary.oralhistory.reference.ReferenceDataLoader;
import com.scholary.oralhistory.reference.ReferenceDataProperties;
import java.nio.file.Path;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the reference tables once at startup. A missing or empty table stops the application from
 * starting.
 */
@Configuration
@EnableConfigurationProperties(ReferenceDataProperties.class)
public class ReferenceDataConfig {

  @Bean
  public ReferenceDataLoader referenceDataLoader() {
    return new ReferenceDataLoader();
  }

  @Bean
  public LocationReferenceData locationReferenceData(
      ReferenceDataLoader loader, ReferenceDataProperties properties) {
    Path directory = Path.of(properties.directory());
    List<UsState> states = loader.loadStates();
    return new LocationReferenceData(
        states,
        loader.loadPlaces(directory.resolve(properties.placesFile()), states),
        loader.loadCityHints(directory.resolve(properties.cityHintsFile())));
  }

  @Bean
  public CorporateNameAuthority corporateNameAuthority(
      ReferenceDataLoader loader, ReferenceDataProperties properties) {
    Path directory = Path.of(properties.directory());
    return new CorporateNameAuthority(
        loader.loadCorporateNames(directory.resolve(properties.corporateNamesFile())),
        loader.loadCorporateSynonyms(directory.resolve(properties.corporateSynonymsFile())));
  }
}
