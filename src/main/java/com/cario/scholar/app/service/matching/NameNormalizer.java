package com.cario.scholar.app.service.matching;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-text organization names into comparison keys.
 *
 * <p>Every key is a lowercase alphanumeric fold of one textual transform of the input (full name,
 * parenthesis stripped, comma segments, department prefix stripped, article stripped, abbreviations
 * expanded) plus a first-letter acronym. Keys derived from trailing comma segments are only kept
 * when the segment carries an organizational keyword, so a bare city or country never becomes a key.
 *
 * <p>All methods are pure and thread-safe.
 */
public final class NameNormalizer {

  private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]");
  private static final Pattern PARENTHETICAL = Pattern.compile("\\s*\\([^)]*\\)");
  private static final Pattern PARENTHETICAL_CONTENT = Pattern.compile("\\(([^)]*)\\)");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern ACRONYM_SPLIT = Pattern.compile("[^A-Za-z]+");

  private static final Pattern DEPT_PREFIX =
      Pattern.compile(
          "^(department|dept\\.?|school|faculty|college|laboratory|laboratories|lab|centre|center"
              + "|institute|institutes|academy|division|unit)\\s+of\\s+",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern LEADING_ARTICLE =
      Pattern.compile("^(\\s*(the|a|an)\\s+)", Pattern.CASE_INSENSITIVE);

  private static final Pattern ORG_KEYWORD =
      Pattern.compile(
          "\\b(university|institute|college|academy|polytechnic|universit[eé]|universidad|universita"
              + "|group|corp|corporation|company|ltd|limited|inc|incorporated|llc|co\\.|gmbh|sa|ag|bv"
              + "|pty|pte|technologies|tech|lab|labs|laboratory|laboratories|research|systems"
              + "|solutions|international|global)\\b",
          Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

  private static final Set<String> ACRONYM_STOPWORDS = Set.of("of", "and", "for", "at", "in", "on");

  // abbreviated token (lowercase, no dot) -> expansion
  private static final Map<String, String> ABBREVIATIONS =
      Map.of(
          "univ", "University",
          "inst", "Institute",
          "natl", "National",
          "intl", "International",
          "acad", "Academy",
          "sci", "Sciences",
          "tech", "Technology");

  private static final Pattern ABBREVIATED_TOKEN =
      Pattern.compile("\\b(univ|inst|natl|intl|acad|sci|tech)(\\.|\\b)", Pattern.CASE_INSENSITIVE);

  private NameNormalizer() {}

  /**
   * Comparison keys for {@code name}, deduplicated, in generation order.
   *
   * @param name free-text organization name, may be null
   * @return folded keys; empty when the input is blank
   */
  public static Set<String> variants(String name) {
    NameKeys keys = keys(name);
    Set<String> out = new LinkedHashSet<>(keys.variants());
    if (!keys.acronym().isEmpty()) {
      out.add(keys.acronym());
    }
    return out;
  }

  /** Same keys as {@link #variants(String)} with the acronym kept apart from the text variants. */
  public static NameKeys keys(String name) {
    Set<String> out = new LinkedHashSet<>();
    if (name == null || name.isBlank()) {
      return new NameKeys(out, "", "");
    }
    String s = WHITESPACE.matcher(name.trim()).replaceAll(" ");

    for (String form : surfaceForms(s)) {
      addFolded(out, form);
    }
    for (String alias : parentheticalAliases(s)) {
      addFolded(out, alias);
    }
    int comma = s.indexOf(',');
    String afterFirstComma = comma < 0 ? "" : fold(s.substring(comma + 1));
    return new NameKeys(out, acronym(s), afterFirstComma);
  }

  /**
   * Surface forms before folding. Exposed so callers can build keys for a segment of a name (for
   * example the text after the first comma) with the same transforms.
   */
  static List<String> surfaceForms(String s) {
    List<String> forms = new ArrayList<>();
    String noParens = stripParentheses(s);
    String[] parts = splitComma(s);
    String first = parts.length > 0 ? parts[0] : s;

    forms.add(s);
    forms.add(noParens);
    forms.add(first);
    forms.add(stripDeptPrefix(s));
    forms.add(stripDeptPrefix(first));
    forms.add(stripDeptPrefix(noParens));

    if (parts.length >= 2) {
      String tail1 = parts[parts.length - 1];
      String tail2 = parts[parts.length - 2] + ", " + tail1;
      addIfOrg(forms, tail1);
      addIfOrg(forms, stripDeptPrefix(tail1));
      addIfOrg(forms, tail2);
    }

    int base = forms.size();
    for (int i = 0; i < base; i++) {
      forms.add(stripLeadingArticle(forms.get(i)));
    }
    base = forms.size();
    for (int i = 0; i < base; i++) {
      String expanded = expandAbbreviations(forms.get(i));
      if (!expanded.equals(forms.get(i))) {
        forms.add(expanded);
      }
    }
    return forms;
  }

  /** Lowercases and drops every character outside {@code [a-z0-9]}. */
  public static String fold(String s) {
    if (s == null) {
      return "";
    }
    return NON_ALNUM.matcher(s.toLowerCase(Locale.ROOT)).replaceAll("");
  }

  /**
   * First letter of each alphabetic token, skipping {@code of/and/for/at/in/on}, lowercased.
   * "Massachusetts Institute of Technology" becomes "mit". Single-letter results are dropped.
   */
  public static String acronym(String s) {
    if (s == null || s.isBlank()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (String token : ACRONYM_SPLIT.split(stripParentheses(s))) {
      if (token.isEmpty() || ACRONYM_STOPWORDS.contains(token.toLowerCase(Locale.ROOT))) {
        continue;
      }
      sb.append(Character.toLowerCase(token.charAt(0)));
    }
    return sb.length() < 2 ? "" : sb.toString();
  }

  /** True when the text contains one of the organizational keywords. */
  public static boolean hasOrgKeyword(String s) {
    return s != null && ORG_KEYWORD.matcher(s).find();
  }

  public static String stripParentheses(String s) {
    return PARENTHETICAL.matcher(s).replaceAll("").trim();
  }

  public static String stripDeptPrefix(String s) {
    return DEPT_PREFIX.matcher(s.trim()).replaceFirst("").trim();
  }

  static String stripLeadingArticle(String s) {
    return LEADING_ARTICLE.matcher(s).replaceFirst("").trim();
  }

  static String expandAbbreviations(String s) {
    Matcher m = ABBREVIATED_TOKEN.matcher(s);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String expansion = ABBREVIATIONS.get(m.group(1).toLowerCase(Locale.ROOT));
      m.appendReplacement(sb, Matcher.quoteReplacement(expansion));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  /** Text inside parentheses that reads like an alias ("MIT", "ETH Zurich"). */
  static List<String> parentheticalAliases(String s) {
    List<String> out = new ArrayList<>();
    Matcher m = PARENTHETICAL_CONTENT.matcher(s);
    while (m.find()) {
      String inner = m.group(1).trim();
      if (!inner.isEmpty() && Character.isUpperCase(inner.charAt(0))) {
        out.add(inner);
      }
    }
    return out;
  }

  static String[] splitComma(String s) {
    String[] raw = s.split(",");
    List<String> parts = new ArrayList<>();
    for (String p : raw) {
      String t = p.trim();
      if (!t.isEmpty()) {
        parts.add(t);
      }
    }
    return parts.toArray(new String[0]);
  }

  // a bare keyword such as "Inc" is not an organization
  private static void addIfOrg(List<String> forms, String candidate) {
    if (hasOrgKeyword(candidate) && WHITESPACE.split(candidate.trim()).length >= 2) {
      forms.add(candidate);
    }
  }

  private static void addFolded(Set<String> out, String form) {
    String key = fold(form);
    if (!key.isEmpty()) {
      out.add(key);
    }
  }
}
