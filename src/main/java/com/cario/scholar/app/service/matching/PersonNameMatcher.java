package com.cario.scholar.app.service.matching;

import com.cario.scholar.app.model.PersonProfile;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Strict person-name equality used to discard registry candidates before any institution matching.
 *
 * <p>Names are compared as lowercase alphanumeric token lists. A profile matches when its display
 * name, its given+family names, or any of its other names equals the target, in order or reversed.
 */
public final class PersonNameMatcher {

  private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9]+");

  private PersonNameMatcher() {}

  public static List<String> tokens(String name) {
    if (name == null) {
      return List.of();
    }
    return Arrays.stream(TOKEN_SPLIT.split(name.toLowerCase(Locale.ROOT)))
        .filter(t -> !t.isEmpty())
        .toList();
  }

  public static boolean sameName(String a, String b) {
    List<String> ta = tokens(a);
    List<String> tb = tokens(b);
    if (ta.isEmpty() || tb.isEmpty()) {
      return false;
    }
    if (ta.equals(tb)) {
      return true;
    }
    List<String> reversed = new ArrayList<>(tb);
    Collections.reverse(reversed);
    return ta.equals(reversed);
  }

  public static boolean matches(String targetName, PersonProfile profile) {
    if (profile == null) {
      return false;
    }
    if (sameName(targetName, profile.getCreditName())) {
      return true;
    }
    String given = profile.getGivenNames() == null ? "" : profile.getGivenNames();
    String family = profile.getFamilyName() == null ? "" : profile.getFamilyName();
    if (sameName(targetName, (given + " " + family).trim())) {
      return true;
    }
    for (String other : profile.getOtherNames()) {
      if (sameName(targetName, other)) {
        return true;
      }
    }
    return false;
  }
}
