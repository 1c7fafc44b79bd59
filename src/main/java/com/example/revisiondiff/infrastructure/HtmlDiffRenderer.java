package com.example.revisiondiff.infrastructure;

import com.example.revisiondiff.application.DiffRenderer;
import com.example.revisiondiff.domain.DiffSegment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Inline HTML markup: unchanged text as is, removals struck through, additions highlighted.
 * A replacement is always the removal immediately followed by the addition.
 */
@Component
public class HtmlDiffRenderer implements DiffRenderer {
    static final String DELETE_OPEN =
            "<span class=\"diff-delete\" style=\"background:#ffcccc;text-decoration:line-through;\">";
    static final String INSERT_OPEN = "<span class=\"diff-insert\" style=\"background:#ccffcc;\">";
    static final String CLOSE = "</span>";

    @Override
    public String render(List<DiffSegment> segments) {
        StringBuilder html = new StringBuilder();
        for (DiffSegment segment : segments) {
            switch (segment.type()) {
                case EQUAL -> escape(segment.original(), html);
                case DELETE -> deleted(segment.original(), html);
                case INSERT -> inserted(segment.modified(), html);
                case REPLACE -> {
                    deleted(segment.original(), html);
                    inserted(segment.modified(), html);
                }
            }
        }
        return html.toString();
    }

    private void deleted(String text, StringBuilder html) {
        html.append(DELETE_OPEN);
        escape(text, html);
        html.append(CLOSE);
    }

    private void inserted(String text, StringBuilder html) {
        html.append(INSERT_OPEN);
        escape(text, html);
        html.append(CLOSE);
    }

    static void escape(String text, StringBuilder html) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> html.append("&amp;");
                case '<' -> html.append("&lt;");
                case '>' -> html.append("&gt;");
                case '"' -> html.append("&quot;");
                case '\'' -> html.append("&#39;");
                case '\n' -> html.append("<br>");
                default -> html.append(c);
            }
        }
    }
}
