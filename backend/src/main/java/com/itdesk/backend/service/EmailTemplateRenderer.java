package com.itdesk.backend.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitui placeholders {@code {campo}} pelos valores do chamado. Campos
 * desconhecidos ou vazios ficam como estão no texto.
 */
@Component
public class EmailTemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    public String render(String template, Map<String, String> values) {
        if (template == null) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            String replacement = value == null || value.isEmpty() ? matcher.group() : value;
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /** Parágrafos viram {@code <p>} e quebras simples viram {@code <br>}. */
    public String toHtml(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String html = text.replace("\r\n", "\n")
                .replace("\n\n", "</p><p>")
                .replace("\n", "<br>");
        return ("<p>" + html + "</p>").replace("<p></p>", "");
    }
}
