package com.scholary.oralhistory.reference;

import com.scholary.oralhistory.entity.location.CityHint;
import com.scholary.oralhistory.entity.location.UsState;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the tab-separated reference tables.
 *
 * <p>Every file starts with one header line. Malformed or repeated rows are logged and skipped. A
 * file that is missing or holds no data rows is fatal.
 */
public class ReferenceDataLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceDataLoader.class);

  public static final String STATES_RESOURCE = "reference/us-states.tsv";

  /** The bundled state table: state id, USGS id, postal code, '|'-separated names. */
  public List<UsState> loadStates() {
    InputStream stream = getClass().getClassLoader().getResourceAsStream(STATES_RESOURCE);
    if (stream == null) {
      throw new ReferenceDataException("State table not found on classpath: " + STATES_RESOURCE);
    }

    List<UsState> states = new ArrayList<>();
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      for (String[] row : readRows(reader, STATES_RESOURCE)) {
        if (row.length != 4) {
          LOGGER.warn("Ignoring malformed state row: {}", String.join("\t", row));
          continue;
        }
        states.add(
            new UsState(
                Integer.parseInt(row[0].trim()),
                Integer.parseInt(row[1].trim()),
                row[2].trim(),
                Arrays.asList(row[3].split("\\|"))));
      }
    } catch (IOException | NumberFormatException e) {
      throw new ReferenceDataException("Failed to read state table " + STATES_RESOURCE, e);
    }
    return states;
  }

  /**
   * Gazetteer rows: place id, name, state id. Rows for unknown states are skipped.
   *
   * @return place name to place id, per state id
   */
  public Map<Integer, Map<String, Integer>> loadPlaces(Path path, List<UsState> states) {
    Map<Integer, Map<String, Integer>> placesByState = new LinkedHashMap<>();
    for (UsState state : states) {
      placesByState.put(state.stateId(), new LinkedHashMap<>());
    }

    int loaded = 0;
    for (String[] row : readRows(path)) {
      Integer placeId = row.length == 3 ? parseInt(row[0]) : null;
      Integer stateId = row.length == 3 ? parseInt(row[2]) : null;
      if (placeId == null || stateId == null || !placesByState.containsKey(stateId)) {
        LOGGER.warn("Ignoring place with bad format: {}", String.join("\t", row));
        continue;
      }
      Map<String, Integer> places = placesByState.get(stateId);
      if (places.putIfAbsent(row[1], placeId) != null) {
        LOGGER.warn("Ignoring repeated place: {}", String.join("\t", row));
        continue;
      }
      loaded++;
    }

    LOGGER.info("Loaded {} places from {}", loaded, path);
    return placesByState;
  }

  /** City hint rows: name, state postal code, state id, place id. */
  public Map<String, CityHint> loadCityHints(Path path) {
    Map<String, CityHint> hints = new LinkedHashMap<>();
    for (String[] row : readRows(path)) {
      Integer stateId = row.length == 4 ? parseInt(row[2]) : null;
      Integer placeId = row.length == 4 ? parseInt(row[3]) : null;
      if (stateId == null || placeId == null) {
        LOGGER.warn("Ignoring malformed city hint: {}", String.join("\t", row));
        continue;
      }
      if (hints.putIfAbsent(row[0], new CityHint(row[0], row[1], stateId, placeId)) != null) {
        LOGGER.warn("Ignoring repeated city hint: {}", String.join("\t", row));
      }
    }

    LOGGER.info("Loaded {} city hints from {}", hints.size(), path);
    return hints;
  }

  /** Authority rows: corporate name, authority id. */
  public Map<String, String> loadCorporateNames(Path path) {
    Map<String, String> names = new LinkedHashMap<>();
    for (String[] row : readRows(path)) {
      if (row.length != 2) {
        LOGGER.warn("Ignoring organization with bad format: {}", String.join("\t", row));
        continue;
      }
      String name = row[0].trim();
      String authorityId = row[1].trim();
      if (name.isEmpty() || authorityId.isEmpty()) {
        LOGGER.warn("Ignoring organization with empty data: {}", String.join("\t", row));
      } else if (names.putIfAbsent(name, authorityId) != null) {
        LOGGER.warn("Ignoring repeated organization: {}", String.join("\t", row));
      }
    }

    LOGGER.info("Loaded {} organization names from {}", names.size(), path);
    return names;
  }

  /** Synonym rows: synonym, canonical name, authority id. Keyed by synonym. */
  public Map<String, String> loadCorporateSynonyms(Path path) {
    Map<String, String> synonyms = new LinkedHashMap<>();
    for (String[] row : readRows(path)) {
      if (row.length != 3 || row[0].isEmpty() || row[2].isEmpty()) {
        LOGGER.warn("Ignoring organization synonym with bad format: {}", String.join("\t", row));
        continue;
      }
      if (synonyms.putIfAbsent(row[0], row[2]) != null) {
        LOGGER.warn("Ignoring repeated organization synonym: {}", String.join("\t", row));
      }
    }

    LOGGER.info("Loaded {} organization synonyms from {}", synonyms.size(), path);
    return synonyms;
  }

  private List<String[]> readRows(Path path) {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return readRows(reader, path.toString());
    } catch (NoSuchFileException e) {
      throw new ReferenceDataException("Required reference file is missing: " + path, e);
    } catch (IOException e) {
      throw new ReferenceDataException("Failed to read reference file: " + path, e);
    }
  }

  private static List<String[]> readRows(BufferedReader reader, String source)
      throws IOException {
    if (reader.readLine() == null) {
      throw new ReferenceDataException("Required reference file is empty: " + source);
    }

    List<String[]> rows = new ArrayList<>();
    String line;
    while ((line = reader.readLine()) != null) {
      if (!line.isBlank()) {
        rows.add(line.split("\t", -1));
      }
    }
    if (rows.isEmpty()) {
      throw new ReferenceDataException("Reference file has no data rows: " + source);
    }
    return rows;
  }

  private static Integer parseInt(String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
