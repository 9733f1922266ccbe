package com.wagesearch.salary.util;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class UsStates {
  private static final Map<String, String> NAMES_BY_CODE = buildNamesByCode();
  private static final Map<String, String> NAMES_BY_LOWER_NAME = buildNamesByLowerName();

  private UsStates() {}

  /** Full name for a two-letter USPS code, case-insensitive; null when unknown. */
  public static String nameForCode(String code) {
    if (code == null) {
      return null;
    }
    return NAMES_BY_CODE.get(code.trim().toUpperCase(Locale.ROOT));
  }

  /**
   * Canonical state name for a code or a full name in any letter case. Values that are
   * neither pass through trimmed; blank input yields null.
   */
  public static String canonicalize(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String trimmed = value.trim().replaceAll("\\s+", " ");
    String byCode = nameForCode(trimmed);
    if (byCode != null) {
      return byCode;
    }
    String byName = NAMES_BY_LOWER_NAME.get(trimmed.toLowerCase(Locale.ROOT));
    return byName != null ? byName : trimmed;
  }

  private static Map<String, String> buildNamesByLowerName() {
    Map<String, String> byName = new LinkedHashMap<>();
    NAMES_BY_CODE.values().forEach(name -> byName.put(name.toLowerCase(Locale.ROOT), name));
    return Map.copyOf(byName);
  }

  private static Map<String, String> buildNamesByCode() {
    Map<String, String> names = new LinkedHashMap<>();
    names.put("AL", "Alabama");
    names.put("AK", "Alaska");
    names.put("AZ", "Arizona");
    names.put("AR", "Arkansas");
    names.put("CA", "California");
    names.put("CO", "Colorado");
    names.put("CT", "Connecticut");
    names.put("DE", "Delaware");
    names.put("DC", "District of Columbia");
    names.put("FL", "Florida");
    names.put("GA", "Georgia");
    names.put("HI", "Hawaii");
    names.put("ID", "Idaho");
    names.put("IL", "Illinois");
    names.put("IN", "Indiana");
    names.put("IA", "Iowa");
    names.put("KS", "Kansas");
    names.put("KY", "Kentucky");
    names.put("LA", "Louisiana");
    names.put("ME", "Maine");
    names.put("MD", "Maryland");
    names.put("MA", "Massachusetts");
    names.put("MI", "Michigan");
    names.put("MN", "Minnesota");
    names.put("MS", "Mississippi");
    names.put("MO", "Missouri");
    names.put("MT", "Montana");
    names.put("NE", "Nebraska");
    names.put("NV", "Nevada");
    names.put("NH", "New Hampshire");
    names.put("NJ", "New Jersey");
    names.put("NM", "New Mexico");
    names.put("NY", "New York");
    names.put("NC", "North Carolina");
    names.put("ND", "North Dakota");
    names.put("OH", "Ohio");
    names.put("OK", "Oklahoma");
    names.put("OR", "Oregon");
    names.put("PA", "Pennsylvania");
    names.put("RI", "Rhode Island");
    names.put("SC", "South Carolina");
    names.put("SD", "South Dakota");
    names.put("TN", "Tennessee");
    names.put("TX", "Texas");
    names.put("UT", "Utah");
    names.put("VT", "Vermont");
    names.put("VA", "Virginia");
    names.put("WA", "Washington");
    names.put("WV", "West Virginia");
    names.put("WI", "Wisconsin");
    names.put("WY", "Wyoming");
    names.put("AS", "American Samoa");
    names.put("GU", "Guam");
    names.put("MP", "Northern Mariana Islands");
    names.put("PR", "Puerto Rico");
    names.put("VI", "Virgin Islands");
    return Map.copyOf(names);
  }
}
