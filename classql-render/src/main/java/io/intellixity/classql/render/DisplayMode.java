package io.intellixity.classql.render;

import java.util.Locale;

/** Output shape selector for {@link ResultRenderer}. */
public enum DisplayMode {
  SPAN, DIV, UL, OL, TABLE, JSON, CODE;

  public String label() { return name().toLowerCase(Locale.ROOT); }

  /** Unknown, blank or null selectors fall back to {@link #SPAN}. */
  public static DisplayMode parse(String value) {
    if (value == null) return SPAN;
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "div": return DIV;
      case "ul": return UL;
      case "ol": return OL;
      case "table": return TABLE;
      case "json": return JSON;
      case "code": return CODE;
      default: return SPAN;
    }
  }

  boolean isJson() { return this == JSON || this == CODE; }
}
