package io.intellixity.classql.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.classql.result.ResultRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Formats fetched rows into an HTML fragment.
 *
 * Shape rules, in order:
 * <ul>
 *   <li>no rows: a fixed "No results" fragment</li>
 *   <li>one column and one row: the bare value, whatever the mode</li>
 *   <li>one column: a flat value list (ul/ol items, a JSON array, or comma-joined text)</li>
 *   <li>otherwise: a table, a JSON array of row objects, one list item per row, or one line per row</li>
 * </ul>
 * Every data-derived string is escaped exactly once; rows are rendered as received.
 *
 * Instances hold no mutable state and may be shared between threads.
 */
public final class ResultRenderer {
  public static final String NO_RESULTS = "<span class=\"text-gray-400 italic\">No results</span>";

  private static final String UL_CLASS = "list-disc list-inside";
  private static final String OL_CLASS = "list-decimal list-inside";
  private static final String CODE_LIST_CLASS =
      "font-mono text-xs sm:text-sm bg-black/40 text-green-400 p-2 sm:p-3 rounded block overflow-x-auto";
  private static final String CODE_BLOCK_CLASS =
      "font-mono text-xs sm:text-sm bg-black/40 text-green-400 p-2 sm:p-3 rounded block whitespace-pre overflow-x-auto";
  private static final String TABLE_WRAP_CLASS = "overflow-x-auto -mx-2 sm:mx-0";
  private static final String TABLE_CLASS = "border-collapse border border-white/10 text-xs sm:text-sm w-full min-w-[400px]";
  private static final String HEAD_ROW_CLASS = "bg-white/5";
  private static final String TH_CLASS =
      "border border-white/10 px-2 sm:px-3 py-1.5 sm:py-2 text-left font-semibold text-cyan-400 whitespace-nowrap";
  private static final String BODY_ROW_CLASS = "hover:bg-white/5 transition-colors";
  private static final String TD_CLASS =
      "border border-white/10 px-2 sm:px-3 py-1.5 sm:py-2 text-slate-300 break-words max-w-[150px] sm:max-w-none";

  private final RenderJson json;
  private final CellFormatter cells;

  public ResultRenderer() {
    this(RenderJson.defaultMapper());
  }

  public ResultRenderer(ObjectMapper mapper) {
    this.json = new RenderJson(Objects.requireNonNull(mapper, "mapper"));
    this.cells = new CellFormatter(json);
  }

  public String render(List<ResultRow> rows, List<String> displayColumns, DisplayMode mode) {
    if (rows == null || rows.isEmpty()) return NO_RESULTS;
    DisplayMode m = (mode == null) ? DisplayMode.SPAN : mode;

    List<String> columns = (displayColumns == null || displayColumns.isEmpty())
        ? rows.get(0).columns()
        : displayColumns;

    if (columns.size() == 1 && rows.size() == 1) {
      return "<span>" + cells.format(rows.get(0).get(columns.get(0))) + "</span>";
    }
    if (columns.size() == 1) {
      return renderSingleColumn(rows, columns.get(0), m);
    }

    switch (m) {
      case TABLE:
        return renderTable(rows, columns);
      case JSON:
      case CODE:
        return "<code class=\"" + CODE_BLOCK_CLASS + "\">" + Html.escape(json.pretty(rows)) + "</code>";
      case UL:
        return renderRowList(rows, "ul", UL_CLASS);
      case OL:
        return renderRowList(rows, "ol", OL_CLASS);
      default:
        return renderLines(rows, columns);
    }
  }

  /** Plain-text form of a rendered fragment, as used for inline headline values. */
  public String renderText(List<ResultRow> rows, List<String> displayColumns, DisplayMode mode) {
    return Html.stripTags(render(rows, displayColumns, mode));
  }

  private String renderSingleColumn(List<ResultRow> rows, String column, DisplayMode mode) {
    if (mode == DisplayMode.UL || mode == DisplayMode.OL) {
      List<String> items = new ArrayList<>(rows.size());
      for (ResultRow row : rows) items.add(cells.format(row.get(column)));
      return mode == DisplayMode.UL ? list("ul", UL_CLASS, items) : list("ol", OL_CLASS, items);
    }
    if (mode.isJson()) {
      List<Object> values = new ArrayList<>(rows.size());
      for (ResultRow row : rows) values.add(row.get(column));
      return "<code class=\"" + CODE_LIST_CLASS + "\">" + Html.escape(json.pretty(values)) + "</code>";
    }
    List<String> values = new ArrayList<>(rows.size());
    for (ResultRow row : rows) values.add(cells.format(row.get(column)));
    return "<span>" + String.join(", ", values) + "</span>";
  }

  private String renderTable(List<ResultRow> rows, List<String> columns) {
    StringBuilder html = new StringBuilder(256);
    html.append("<div class=\"").append(TABLE_WRAP_CLASS).append("\">")
        .append("<table class=\"").append(TABLE_CLASS).append("\">")
        .append("<thead><tr class=\"").append(HEAD_ROW_CLASS).append("\">");
    for (String header : columns) {
      html.append("<th class=\"").append(TH_CLASS).append("\">").append(Html.escape(header)).append("</th>");
    }
    html.append("</tr></thead><tbody>");
    for (ResultRow row : rows) {
      html.append("<tr class=\"").append(BODY_ROW_CLASS).append("\">");
      for (String header : columns) {
        html.append("<td class=\"").append(TD_CLASS).append("\">").append(cells.format(row.get(header))).append("</td>");
      }
      html.append("</tr>");
    }
    html.append("</tbody></table></div>");
    return html.toString();
  }

  private String renderRowList(List<ResultRow> rows, String tag, String cssClass) {
    List<String> items = new ArrayList<>(rows.size());
    for (ResultRow row : rows) items.add(Html.escape(json.compact(row)));
    return list(tag, cssClass, items);
  }

  private String renderLines(List<ResultRow> rows, List<String> columns) {
    StringBuilder html = new StringBuilder("<div>");
    for (ResultRow row : rows) {
      List<String> values = new ArrayList<>(columns.size());
      for (String column : columns) values.add(cells.format(row.get(column)));
      html.append("<div>").append(String.join(", ", values)).append("</div>");
    }
    return html.append("</div>").toString();
  }

  // Items must already be escaped.
  private static String list(String tag, String cssClass, List<String> items) {
    StringBuilder html = new StringBuilder();
    html.append('<').append(tag).append(" class=\"").append(cssClass).append("\">");
    for (String item : items) html.append("<li>").append(item).append("</li>");
    return html.append("</").append(tag).append('>').toString();
  }
}
