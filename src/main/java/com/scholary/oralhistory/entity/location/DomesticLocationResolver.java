package com.scholary.oralhistory.entity.location;

import com.scholary.oralhistory.entity.EntityConfidence;
import com.scholary.oralhistory.entity.EntityType;
import com.scholary.oralhistory.entity.LocationEntity;
import com.scholary.oralhistory.entity.NamedEntity;
import com.scholary.oralhistory.entity.ResolutionResult;
import com.scholary.oralhistory.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves US location mentions in one story to USGS state and place codes.
 *
 * <p>Each candidate is tried against a fixed order of heuristics, stopping at the first that
 * resolves it:
 *
 * <ol>
 *   <li>Street, avenue, lake and river names are left alone, so "Wyoming Avenue" never becomes
 *       Wyoming.
 *   <li>A "Place, State" or "Place [State]" mention is looked up in that state's gazetteer.
 *   <li>The contextual text is parsed the same way, including what follows the mention in it.
 *   <li>A following candidate that starts right after this one and names a state is used as the
 *       state ("Cairo" then "Illinois").
 *   <li>Well-known cities resolve from the hint table; otherwise the mention may itself name a
 *       state.
 * </ol>
 *
 * <p>Then unresolved mentions copy the resolution of another mention with the same text.
 * Resolutions are merged per place, keeping the best confidence.
 *
 * <p>A match on a place adds 2 to the confidence, a match on a state alone adds 1. "Washington" by
 * itself is only taken to be WA or DC when the context says which.
 */
@Component
public class DomesticLocationResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(DomesticLocationResolver.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final int DC = 11;
  static final int WA = 53;
  private static final int VIRGINIA = 51;
  private static final int WEST_VIRGINIA = 54;

  private static final String WASHINGTON = "Washington";

  // Punctuation may separate a place from its state by a few characters, e.g. "Buffalo -- NY".
  private static final int ADJACENCY_EPSILON = 4;

  private static final int MENTIONS_FOR_BOOST = 3;

  private static final Set<String> GENERAL_LOCATION_SUFFIXES =
      Set.of(
          "Avenue", "Ave", "Boulevard", "Blvd", "Street", "St", "Road", "Lane", "Lake", "River");

  private static final List<String> DC_MARKERS =
      List.of("d.c.", "district of columbia", "metro washington", "metro [washington");

  private static final List<String> WA_MARKERS =
      List.of(
          "king county",
          "seattle",
          "spokane",
          "yakima",
          "tacoma",
          "pasco",
          "fort lewis",
          "mcchord",
          "fairchild air force base",
          "kitsap",
          "state of washington",
          "washington state");

  private static final Map<String, String> PLACE_ALIASES =
      Map.ofEntries(
          Map.entry("Philly", "Philadelphia"),
          Map.entry("Phila.", "Philadelphia"),
          Map.entry("LA", "Los Angeles"),
          Map.entry("L.A.", "Los Angeles"),
          Map.entry("L.A. Los Angeles", "Los Angeles"),
          Map.entry("N.Y. City", "New York City"),
          Map.entry("NY City", "New York City"),
          Map.entry("NYC", "New York City"),
          Map.entry("Pearl Harbor", "Naval Station Pearl Harbor"),
          Map.entry("Vegas", "Las Vegas"));

  private final LocationReferenceData referenceData;

  public DomesticLocationResolver(LocationReferenceData referenceData) {
    this.referenceData = referenceData;
  }

  /**
   * Resolve the location candidates of one story. Candidates of other types are ignored.
   *
   * @param entities the story's candidates, any order
   * @return one entry per resolved place, plus every unresolved mention
   */
  public ResolutionResult<LocationEntity> resolve(List<NamedEntity> entities) {
    List<Candidate> candidates =
        entities.stream()
            .filter(entity -> entity.type() == EntityType.LOC)
            .sorted(Comparator.comparingInt(NamedEntity::startOffset))
            .map(Candidate::new)
            .collect(Collectors.toList());

    for (int i = 0; i < candidates.size(); i++) {
      if (candidates.get(i).stateCode == 0) {
        resolveCandidate(candidates, i);
      }
    }
    propagateRepeatedMentions(candidates);

    ResolutionResult<LocationEntity> result = aggregate(candidates);
    STRUCTURED_LOGGER.logStoryResolved(
        "locations", candidates.size(), result.resolved().size(), result.unresolved().size());
    return result;
  }

  private void resolveCandidate(List<Candidate> candidates, int index) {
    Candidate candidate = candidates.get(index);
    NamedEntity entity = candidate.entity;
    String text = entity.text();
    String context = entity.contextualizedText();
    Attempt attempt = new Attempt(candidate.confidence);

    if (!isGeneralLocation(text, context)) {
      if (text.indexOf(',') > 0) {
        resolveFromCommaForm(text, context, attempt);
      }
      if (attempt.placeId == 0) {
        if (entity.hasDistinctContext()) {
          resolveFromContext(text, context, attempt);
        }
        if (attempt.stateCode == 0) {
          resolveWithNextCandidate(candidates, index, attempt);
        }
        if (attempt.stateCode == 0) {
          resolveAsKnownCityOrState(text, context, attempt);
        }
      }
    }

    candidate.stateCode = attempt.stateCode;
    candidate.placeId = attempt.stateCode == 0 ? 0 : attempt.placeId;
    candidate.confidence = attempt.confidence;
    if (candidate.stateCode != 0) {
      LOGGER.debug(
          "Resolved '{}' to place {} in {}",
          text,
          candidate.placeId,
          referenceData.codeToAlpha(candidate.stateCode));
    }
  }

  // "Iowa City, Iowa]" or "Annapolis [U.S. Naval Academy, Maryland]"
  private void resolveFromCommaForm(String text, String context, Attempt attempt) {
    PlaceAndState parsed = parsePlaceAndState(text);
    if (parsed.stateId() == 0) {
      return;
    }

    OptionalInt placeId = referenceData.placeId(parsed.stateId(), parsed.placeName());
    int bracket = text.indexOf('[');
    if (placeId.isEmpty() && bracket > 0) {
      placeId =
          referenceData.placeId(
              parsed.stateId(), properPlaceName(text.substring(0, bracket).trim()));
    }

    if (placeId.isPresent()) {
      attempt.resolvePlace(parsed.stateId(), placeId.getAsInt());
    } else {
      attempt.resolveStateOnly(parsed.stateId(), context);
    }
  }

  // "Wrigley Field [Chicago, Illinois]" or "Hardeman County [Tennessee]"
  private void resolveFromContext(String text, String context, Attempt attempt) {
    String stateName;
    int at = context.indexOf(text);
    if (at >= 0 && at + text.length() < context.length() - 1) {
      stateName = context.substring(at + text.length()).trim();
    } else {
      stateName = context;
      int open = stateName.lastIndexOf('[');
      if (open >= 0) {
        stateName = stateName.substring(open + 1);
      }
      int close = stateName.lastIndexOf(']');
      if (close >= 0) {
        stateName = stateName.substring(0, close);
      }
    }

    int stateCode = lookUpState(stateName, false);
    if (stateCode != 0) {
      OptionalInt placeId = referenceData.placeId(stateCode, properPlaceName(text.trim()));
      if (placeId.isPresent()) {
        attempt.resolvePlace(stateCode, placeId.getAsInt());
        return;
      }
    }

    PlaceAndState parsed = parsePlaceAndState(context);
    if (parsed.stateId() == 0) {
      return;
    }
    OptionalInt placeId = referenceData.placeId(parsed.stateId(), parsed.placeName());
    if (placeId.isEmpty()) {
      placeId = referenceData.placeId(parsed.stateId(), properPlaceName(text.trim()));
    }
    if (placeId.isPresent()) {
      attempt.resolvePlace(parsed.stateId(), placeId.getAsInt());
    } else {
      attempt.resolveStateOnly(parsed.stateId(), context);
    }
  }

  private void resolveWithNextCandidate(List<Candidate> candidates, int index, Attempt attempt) {
    if (index >= candidates.size() - 1) {
      return;
    }
    NamedEntity entity = candidates.get(index).entity;
    Candidate next = candidates.get(index + 1);
    if (next.entity.startOffset() > ADJACENCY_EPSILON + entity.startOffset() + entity.length()) {
      return;
    }

    int stateCode = lookUpState(next.entity.text(), true);
    if (stateCode == 0) {
      return;
    }
    OptionalInt placeId = referenceData.placeId(stateCode, properPlaceName(entity.text().trim()));
    if (placeId.isPresent()) {
      attempt.resolvePlace(stateCode, placeId.getAsInt());
      next.stateCode = stateCode;
      next.placeId = placeId.getAsInt();
      next.confidence = EntityConfidence.boost(next.confidence, EntityConfidence.GOOD);
    }
  }

  private void resolveAsKnownCityOrState(String text, String context, Attempt attempt) {
    String name = properPlaceName(text.trim());
    Optional<CityHint> hint = referenceData.cityHint(name);
    if (hint.isPresent()) {
      attempt.resolvePlace(hint.get().stateId(), hint.get().placeId());
      return;
    }

    int stateCode = lookUpState(name, true);
    if (stateCode != 0) {
      attempt.resolveStateOnly(stateCode, context);
    }
  }

  private static void propagateRepeatedMentions(List<Candidate> candidates) {
    for (Candidate candidate : candidates) {
      if (candidate.stateCode != 0) {
        continue;
      }
      for (Candidate other : candidates) {
        if (other != candidate
            && other.stateCode != 0
            && other.entity.text().equals(candidate.entity.text())) {
          candidate.stateCode = other.stateCode;
          candidate.placeId = other.placeId;
          candidate.confidence = other.confidence;
          break;
        }
      }
    }
  }

  private static ResolutionResult<LocationEntity> aggregate(List<Candidate> candidates) {
    Map<Integer, LocationEntity> byPlace = new LinkedHashMap<>();
    List<LocationEntity> unresolved = new ArrayList<>();

    for (Candidate candidate : candidates) {
      if (candidate.stateCode == 0) {
        unresolved.add(
            new LocationEntity(candidate.entity, 0, 0, 0, candidate.confidence, 1));
        continue;
      }
      LocationEntity resolved =
          new LocationEntity(
              candidate.entity,
              LocationEntity.US,
              candidate.stateCode,
              candidate.placeId,
              candidate.confidence,
              1);
      byPlace.merge(
          candidate.placeId,
          resolved,
          (existing, added) ->
              new LocationEntity(
                  existing.entity(),
                  existing.countryCode(),
                  existing.stateCode(),
                  existing.placeId(),
                  Math.max(existing.confidence(), added.confidence()),
                  existing.count() + 1));
    }

    List<LocationEntity> resolved = new ArrayList<>();
    for (LocationEntity location : byPlace.values()) {
      if (location.count() > MENTIONS_FOR_BOOST) {
        location =
            new LocationEntity(
                location.entity(),
                location.countryCode(),
                location.stateCode(),
                location.placeId(),
                EntityConfidence.boost(location.confidence(), EntityConfidence.SOME),
                location.count());
      }
      resolved.add(location);
    }
    return ResolutionResult.of(resolved, unresolved);
  }

  /** True for streets and bodies of water named without a distinguishing qualifier. */
  static boolean isGeneralLocation(String text, String context) {
    String workContext = context == null || context.isBlank() ? text : context;
    String work = workContext.replace("]", "").stripTrailing();
    if (work.endsWith(".")) {
      work = work.substring(0, work.length() - 1);
    }

    int lastWordStart = Math.max(work.lastIndexOf('['), work.lastIndexOf(' ')) + 1;
    if (GENERAL_LOCATION_SUFFIXES.contains(work.substring(lastWordStart))) {
      return true;
    }
    if (text.startsWith("Lake ")) {
      String bare = workContext.replace("[", "").replace("]", "").trim();
      return bare.startsWith("Lake ") && bare.length() <= text.length();
    }
    return false;
  }

  /**
   * Decide whether an ambiguous "Washington" means DC or WA.
   *
   * @return {@link #WA}, {@link #DC}, or 0 when the text does not say
   */
  static int disambiguateWashington(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    int stateCode = 0;
    if (DC_MARKERS.stream().anyMatch(lower::contains)) {
      stateCode = DC;
    }
    if (WA_MARKERS.stream().anyMatch(lower::contains)) {
      stateCode = WA;
    }
    return stateCode;
  }

  /** Split "place, state" (or failing that "place [state]") at the last separator. */
  PlaceAndState parsePlaceAndState(String text) {
    String stateName = "";
    String placeName = "";

    int separator = text.lastIndexOf(',');
    if (separator < 2 || separator >= text.length() - 2) {
      separator = text.lastIndexOf('[');
    }
    if (separator >= 2 && separator < text.length() - 2) {
      stateName = text.substring(separator + 1).trim();
      if (stateName.endsWith("]")) {
        stateName = stateName.substring(0, stateName.length() - 1).trim();
      }
      placeName = trimPlaceName(text.substring(0, separator));
    }
    return new PlaceAndState(properPlaceName(placeName), lookUpState(stateName, false));
  }

  /** Keep only the last clause of a place phrase, after any "sic" marker. */
  static String trimPlaceName(String given) {
    String name = given.trim();
    int sic = name.lastIndexOf("[sic. ");
    if (sic >= 0) {
      name = name.substring(sic + 6);
    } else if ((sic = name.lastIndexOf("[sic ")) >= 0) {
      name = name.substring(sic + 5);
    } else if ((sic = name.lastIndexOf(" sic ")) >= 0) {
      name = name.substring(sic + 5);
    }

    for (char separator : new char[] {'[', ':', ';', ','}) {
      int at = name.lastIndexOf(separator);
      if (at >= 0) {
        name = name.substring(at + 1);
      }
    }
    return name.trim();
  }

  /** Rewrite a place name the way the USGS gazetteer spells it. */
  static String properPlaceName(String given) {
    String name =
        given.replace('[', ' ').replace(']', ' ').replace(" AFB", " Air Force Base").trim();
    String lower = name.toLowerCase(Locale.ROOT);
    if (lower.startsWith("the city of ")) {
      name = name.substring(12);
    } else if (lower.startsWith("city of ")) {
      name = name.substring(8);
    }

    if (name.contains("Ft.") && name.length() > 4) {
      name = name.replace("Ft.", "Fort");
    }

    if (name.endsWith(" St.") && name.length() > 4) {
      return name.substring(0, name.length() - 4) + " Street";
    }
    if (name.contains("St.")) {
      return name.replace("St.", "Saint");
    }
    return PLACE_ALIASES.getOrDefault(name, name);
  }

  /**
   * Find the state a name refers to. Postal codes must match exactly. When {@code exact} is false a
   * name containing a state's spelling also matches, except for bare "Washington".
   *
   * @return the state code, or 0
   */
  int lookUpState(String name, boolean exact) {
    if (name.length() <= 1) {
      return 0;
    }
    for (UsState state : referenceData.states()) {
      if (name.equals(state.alpha()) || state.names().contains(name)) {
        return state.stateId();
      }
    }
    if (exact) {
      return 0;
    }
    for (UsState state : referenceData.states()) {
      for (String variant : state.names()) {
        if (!variant.equals(WASHINGTON) && name.contains(variant)) {
          if (state.stateId() == VIRGINIA && name.contains("West Virginia")) {
            return WEST_VIRGINIA;
          }
          return state.stateId();
        }
      }
    }
    return 0;
  }

  private int stateUsgsId(int stateCode) {
    return referenceData.state(stateCode).map(UsState::usgsId).orElse(0);
  }

  record PlaceAndState(String placeName, int stateId) {}

  private static final class Candidate {
    private final NamedEntity entity;
    private int stateCode;
    private int placeId;
    private int confidence;

    private Candidate(NamedEntity entity) {
      this.entity = entity;
      this.confidence = entity.confidence();
    }
  }

  private final class Attempt {
    private int stateCode;
    private int placeId;
    private int confidence;

    private Attempt(int confidence) {
      this.confidence = confidence;
    }

    private void resolvePlace(int stateCode, int placeId) {
      this.stateCode = stateCode;
      this.placeId = placeId;
      this.confidence = EntityConfidence.boost(confidence, EntityConfidence.GOOD);
    }

    /** Settle for the state itself, after checking an ambiguous Washington against context. */
    private void resolveStateOnly(int stateCode, String context) {
      int resolved = stateCode == WA ? disambiguateWashington(context) : stateCode;
      if (resolved == 0) {
        this.stateCode = 0;
        this.placeId = 0;
        return;
      }
      this.stateCode = resolved;
      this.placeId = stateUsgsId(resolved);
      this.confidence = EntityConfidence.boost(confidence, EntityConfidence.SOME);
    }
  }
}
