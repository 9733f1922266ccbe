package com.wagesearch.salary.util;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces free text to the form used for matching: ASCII punctuation removed, accents folded,
 * lower case, single spaces.
 */
public final class SearchText {
  private static final Pattern PUNCTUATION = Pattern.compile("\\p{Punct}");
  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern DIGITS_ONLY = Pattern.compile("\\d+");

  private SearchText() {}

  public static String simplify(String text) {
    if (text == null || text.isBlank()) {
      return "";
    }
    String withoutPunctuation = PUNCTUATION.matcher(text).replaceAll("");
    String folded =
        COMBINING_MARKS
            .matcher(Normalizer.normalize(withoutPunctuation, Normalizer.Form.NFD))
            .replaceAll("");
    return WHITESPACE.matcher(folded.replace('\u00A0', ' ')).replaceAll(" ").trim()
        .toLowerCase(Locale.ROOT);
  }

  /** Distinct words of the simplified text, in first-seen order. */
  public static List<String> words(String text) {
    String simplified = simplify(text);
    if (simplified.isEmpty()) {
      return List.of();
    }
    Set<String> distinct = new LinkedHashSet<>(List.of(simplified.split(" ")));
    return new ArrayList<>(distinct);
  }

  /**
   * Stored column form: the simplified text padded with one space on each side, so any word
   * can be found with {@code LIKE '% word %'}.
   */
  public static String indexForm(String... parts) {
    StringBuilder joined = new StringBuilder();
    for (String part : parts) {
      String simplified = simplify(part);
      if (!simplified.isEmpty()) {
        if (joined.length() > 0) {
          joined.append(' ');
        }
        joined.append(simplified);
      }
    }
    return " " + joined + " ";
  }

  /** True when the text has something searchable left after simplification. */
  public static boolean isSearchable(String text) {
    String simplified = simplify(text);
    return !simplified.isEmpty() && !DIGITS_ONLY.matcher(simplified).matches();
  }
}
