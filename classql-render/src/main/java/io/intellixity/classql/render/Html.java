package io.intellixity.classql.render;

/** HTML text helpers. */
public final class Html {
  private Html() {}

  /** Escapes {@code & < > " '} for use in element content and quoted attributes. */
  public static String escape(String s) {
    if (s == null || s.isEmpty()) return "";
    StringBuilder out = null;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      String rep = switch (c) {
        case '&' -> "&amp;";
        case '<' -> "&lt;";
        case '>' -> "&gt;";
        case '"' -> "&quot;";
        case '\'' -> "&#x27;";
        default -> null;
      };
      if (rep == null) {
        if (out != null) out.append(c);
        continue;
      }
      if (out == null) {
        out = new StringBuilder(s.length() + 16);
        out.append(s, 0, i);
      }
      out.append(rep);
    }
    return out == null ? s : out.toString();
  }

  /** Drops every {@code <...>} run; entities are left as they are. */
  public static String stripTags(String html) {
    if (html == null) return "";
    StringBuilder out = new StringBuilder(html.length());
    boolean inTag = false;
    for (int i = 0; i < html.length(); i++) {
      char c = html.charAt(i);
      if (c == '<') {
        inTag = true;
      } else if (c == '>') {
        inTag = false;
      } else if (!inTag) {
        out.append(c);
      }
    }
    return out.toString();
  }
}
