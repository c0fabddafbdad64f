package com.scholary.oralhistory.entity.organization;

import com.scholary.oralhistory.entity.EntityConfidence;
import com.scholary.oralhistory.entity.EntityType;
import com.scholary.oralhistory.entity.NamedEntity;
import com.scholary.oralhistory.entity.OrganizationalEntity;
import com.scholary.oralhistory.entity.ResolutionResult;
import com.scholary.oralhistory.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves organization mentions in one story to Library of Congress name authority ids.
 *
 * <p>A mention is tried as given, then by its contextual text, then by what follows the mention in
 * that context. Each try cleans the name and checks the synonym table before the authority table,
 * then splits "A [B]" and "A (B)" forms and finally looks for college and university names.
 *
 * <p>If one mention text resolves to two different ids in the same story, nothing from the story is
 * kept.
 */
@Component
public class OrganizationResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(OrganizationResolver.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final int MENTIONS_FOR_BOOST = 2;

  // "Cubs baseball team": the team name and the sport need some length to be a team at all.
  private static final int MIN_TEAM_NAME_OFFSET = 3;
  private static final int MIN_SPORT_NAME_LENGTH = 6;

  private final CorporateNameAuthority authority;

  public OrganizationResolver(CorporateNameAuthority authority) {
    this.authority = authority;
  }

  /**
   * Resolve the organization candidates of one story. Candidates of other types are ignored.
   *
   * @return one entry per authority id plus every unresolved mention, or an abandoned result when
   *     the story contradicts itself
   */
  public ResolutionResult<OrganizationalEntity> resolve(List<NamedEntity> entities) {
    List<OrganizationalEntity> candidates =
        entities.stream()
            .filter(entity -> entity.type() == EntityType.ORG)
            .map(this::resolveCandidate)
            .collect(Collectors.toList());

    Map<String, String> idsByText = new LinkedHashMap<>();
    for (OrganizationalEntity candidate : candidates) {
      String text = candidate.entity().text();
      String known = idsByText.get(text);
      if (known == null || known.isEmpty()) {
        idsByText.put(text, candidate.authorityId());
      } else if (candidate.isResolved() && !known.equals(candidate.authorityId())) {
        STRUCTURED_LOGGER.logOrganizationConflict(text, known, candidate.authorityId());
        return ResolutionResult.abandoned();
      }
    }

    Map<String, OrganizationalEntity> byAuthorityId = new LinkedHashMap<>();
    List<OrganizationalEntity> unresolved = new ArrayList<>();
    for (OrganizationalEntity candidate : candidates) {
      String authorityId = idsByText.get(candidate.entity().text());
      if (authorityId.isEmpty()) {
        unresolved.add(candidate);
        continue;
      }
      OrganizationalEntity propagated =
          new OrganizationalEntity(candidate.entity(), authorityId, candidate.confidence(), 1);
      byAuthorityId.merge(
          authorityId,
          propagated,
          (existing, added) ->
              new OrganizationalEntity(
                  existing.entity(),
                  authorityId,
                  Math.max(existing.confidence(), added.confidence()),
                  existing.count() + 1));
    }

    List<OrganizationalEntity> resolved = new ArrayList<>();
    for (OrganizationalEntity organization : byAuthorityId.values()) {
      if (organization.count() >= MENTIONS_FOR_BOOST) {
        organization =
            new OrganizationalEntity(
                organization.entity(),
                organization.authorityId(),
                EntityConfidence.boost(organization.confidence(), EntityConfidence.SOME),
                organization.count());
      }
      resolved.add(organization);
    }

    STRUCTURED_LOGGER.logStoryResolved(
        "organizations", candidates.size(), resolved.size(), unresolved.size());
    return ResolutionResult.of(resolved, unresolved);
  }

  private OrganizationalEntity resolveCandidate(NamedEntity entity) {
    String text = entity.text();
    String context = entity.contextualizedText();

    Optional<String> authorityId = parseCandidate(text);
    if (authorityId.isEmpty() && entity.hasDistinctContext()) {
      authorityId = parseCandidate(context);
      int at = context.indexOf(text);
      if (authorityId.isEmpty() && at >= 0 && at + text.length() < context.length() - 1) {
        authorityId = parseCandidate(context.substring(at + text.length()).trim());
      }
    }

    if (authorityId.isEmpty()) {
      return OrganizationalEntity.unresolved(entity);
    }
    LOGGER.debug("Resolved organization '{}' to {}", text, authorityId.get());
    return new OrganizationalEntity(
        entity,
        authorityId.get(),
        EntityConfidence.boost(entity.confidence(), EntityConfidence.SOME),
        1);
  }

  /** Try "ORG", then "A [B]" and "A (B)" with either side as the name, then college parsing. */
  Optional<String> parseCandidate(String given) {
    Optional<String> found = lookUp(trimOrganizationName(given));
    if (found.isPresent()) {
      return found;
    }

    boolean bracketContext = false;
    int bracket = given.indexOf('[');
    if (bracket >= 2 && bracket < given.length() - 1) {
      bracketContext = true;
      found = lookUp(trimOrganizationName(given.substring(0, bracket)));
      if (found.isEmpty()) {
        found = lookUp(trimOrganizationName(given.substring(bracket + 1)));
      }
      if (found.isPresent()) {
        return found;
      }
    }

    boolean parenContext = false;
    int paren = given.indexOf('(');
    if (paren >= 2 && paren < given.length() - 1) {
      parenContext = true;
      found = lookUp(trimOrganizationName(given.substring(0, paren)));
      if (found.isEmpty()) {
        String suffix = trimOrganizationName(given.substring(paren + 1));
        if (suffix.endsWith(")")) {
          suffix = suffix.substring(0, suffix.length() - 1);
        }
        found = lookUp(suffix);
      }
      if (found.isPresent()) {
        return found;
      }
    }

    if (bracketContext) {
      found = parseCollegeMention(given, "[");
    }
    if (found.isEmpty() && parenContext) {
      found = parseCollegeMention(given, "(");
    }
    if (found.isEmpty()) {
      found = parseCollegeMention(given, "");
    }
    return found;
  }

  private Optional<String> lookUp(String name) {
    Optional<String> found = lookUpSynonym(name);
    return found.isPresent() ? found : lookUpAuthority(name);
  }

  /** Synonyms list U.S. agencies as "U.S." and newspapers without "The". */
  Optional<String> lookUpSynonym(String name) {
    Optional<String> found = authority.synonymId(name);
    if (found.isPresent()) {
      return found;
    }
    if (name.contains("United States")) {
      return authority.synonymId(name.replace("United States", "U.S."));
    }
    if (name.startsWith("The ") || name.startsWith("the ")) {
      return authority.synonymId(name.substring(4));
    }
    if (name.startsWith("later ")) {
      return authority.synonymId(name.substring(6));
    }
    return Optional.empty();
  }

  Optional<String> lookUpAuthority(String name) {
    Optional<String> found = authority.authorityId(name);
    if (found.isPresent()) {
      return found;
    }
    if (name.startsWith("The ") || name.startsWith("the ")) {
      return authority.authorityId(name.substring(4));
    }
    if (name.startsWith("later ")) {
      return authority.authorityId(name.substring(6));
    }
    if (name.startsWith("UC ")) {
      return authority.authorityId("University of California, " + name.substring(3));
    }
    String team = recastSportsTeam(name);
    return team.isEmpty() ? Optional.empty() : authority.authorityId(team);
  }

  /**
   * Rewrite "Buffalo Bills professional football team" the way the authority file names teams,
   * "Buffalo Bills (Football team)". Only baseball, football, basketball and hockey are recognized.
   *
   * @return the recast name, or empty when the text does not name a team
   */
  static String recastSportsTeam(String name) {
    int teamAt = -1;
    if (name.endsWith(" team")) {
      teamAt = name.length() - 5;
    } else if (name.endsWith(" team)")) {
      teamAt = name.length() - 6;
    }
    if (teamAt <= 0) {
      return "";
    }

    String work = name.substring(0, teamAt).trim();
    int sportAt = work.lastIndexOf(' ');
    if (sportAt <= MIN_TEAM_NAME_OFFSET || sportAt > work.length() - MIN_SPORT_NAME_LENGTH) {
      return "";
    }

    String sport = work.substring(sportAt + 1).toLowerCase(Locale.ROOT);
    if (sport.startsWith("(")) {
      sport = sport.substring(1).trim();
    }
    String team = work.substring(0, sportAt).trim();
    if (team.endsWith("(")) {
      team = team.substring(0, team.length() - 1).trim();
    }

    switch (sport) {
      case "basketball":
        return team + " (Basketball team)";
      case "hockey":
        return team + " (Hockey team)";
      case "football":
        team = stripSuffix(team, "American");
        team = stripSuffix(team, "professional");
        return team + " (Football team)";
      case "baseball":
        if (team.endsWith("American League") || team.endsWith("National League")) {
          team = team.substring(0, team.length() - 15).trim();
        } else {
          team = stripSuffix(team, "Negro League");
        }
        team = stripSuffix(team, "professional");
        return team + " (Baseball team)";
      default:
        return "";
    }
  }

  /**
   * Look for a college or university named around a context marker, as in "Princeton [University"
   * or "Georgia State College [Savannah State University, Savannah, Georgia]".
   *
   * @param marker "[" or "(" to split prefix and context, or empty to search the whole text
   */
  Optional<String> parseCollegeMention(String given, String marker) {
    String suffix = given;
    if (!marker.isEmpty()) {
      int at = given.indexOf(marker);
      if (at >= 2 && at < given.length() - 1) {
        String prefix = given.substring(0, at).trim();
        suffix = given.substring(at + 1);
        if (!prefix.contains("College") && !prefix.contains("University")) {
          Optional<String> found = lookUpJoinedCollegeName(prefix, suffix);
          if (found.isPresent()) {
            return found;
          }
        }
      }
    }

    String presumed = "";
    int universityOf = suffix.indexOf("University of");
    if (universityOf > 0 && universityOf + 13 < suffix.length()) {
      presumed = "University of " + nameAfter(suffix, universityOf + 13);
    }
    int university = suffix.indexOf(" University");
    if (university > 0) {
      presumed = nameBefore(suffix, university) + " University";
    } else {
      int college = suffix.indexOf(" College");
      if (college > 0) {
        presumed = nameBefore(suffix, college) + " College";
      }
    }
    return presumed.isEmpty() ? Optional.empty() : lookUp(presumed);
  }

  private Optional<String> lookUpJoinedCollegeName(String prefix, String suffix) {
    String presumed = "";
    if (suffix.startsWith("University")) {
      presumed = trimOrganizationName(prefix) + " University";
    } else if (suffix.startsWith("College")) {
      presumed = trimOrganizationName(prefix) + " College";
    }
    if (!presumed.isEmpty()) {
      Optional<String> found = lookUp(presumed);
      if (found.isPresent()) {
        return found;
      }
    }

    if (suffix.contains(prefix + " University")) {
      return lookUp(prefix + " University");
    } else if (suffix.contains("University of " + prefix)) {
      return lookUp("University of " + prefix);
    } else if (suffix.contains(prefix + " College")) {
      return lookUp(prefix + " College");
    }
    return Optional.empty();
  }

  /** Text from {@code start} up to the first '[', ',', ';' or '('. */
  static String nameAfter(String text, int start) {
    String rest = text.substring(start);
    int end = rest.length();
    for (char stop : new char[] {'[', ',', ';', '('}) {
      int at = rest.indexOf(stop);
      if (at >= 0 && at < end) {
        end = at;
      }
    }
    return rest.substring(0, end).trim();
  }

  /** Text before {@code end}, after the last '[', ',', ';', '(' or "sic" marker. */
  static String nameBefore(String text, int end) {
    String head = text.substring(0, end);
    int cut = head.lastIndexOf('[');
    cut = Math.max(cut, head.lastIndexOf(','));
    cut = Math.max(cut, head.lastIndexOf(';'));
    cut = Math.max(cut, head.lastIndexOf('('));
    int sic = head.lastIndexOf("sic. ");
    if (sic >= 0) {
      sic += 4;
    } else {
      sic = head.lastIndexOf("sic ");
      if (sic >= 0) {
        sic += 3;
      }
    }
    cut = Math.max(cut, sic);
    return (cut >= 0 ? head.substring(cut + 1) : head).trim();
  }

  /** Brackets become spaces, '&' gets spaces around it, and a leading "sic" is dropped. */
  static String trimOrganizationName(String given) {
    String name = given.replace("[", " ").replace("]", " ").replace("&", " & ");
    name = name.replace("  ", " ").trim();
    if (name.startsWith("sic. ")) {
      name = name.substring(5);
    } else if (name.startsWith("sic ")) {
      name = name.substring(4);
    }
    while (name.endsWith(":") || name.endsWith(";") || name.endsWith(",")) {
      name = name.substring(0, name.length() - 1).trim();
    }
    return name;
  }

  private static String stripSuffix(String text, String suffix) {
    return text.endsWith(suffix) ? text.substring(0, text.length() - suffix.length()).trim() : text;
  }
}
