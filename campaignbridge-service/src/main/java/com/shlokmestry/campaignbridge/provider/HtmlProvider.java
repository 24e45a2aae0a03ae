package com.shlokmestry.campaignbridge.provider;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import com.shlokmestry.campaignbridge.settings.PluginSettings;

@Component
public final class HtmlProvider implements EmailProvider {

    private static final Logger log = LoggerFactory.getLogger(HtmlProvider.class);

    static final List<String> SECTION_KEYS = List.of("header", "body", "footer", "content", "sidebar");
    static final String DEFAULT_TITLE = "Email Campaign";

    @Override
    public ProviderKind kind() {
        return ProviderKind.HTML;
    }

    @Override
    public boolean isConfigured(PluginSettings settings) {
        return true;
    }

    @Override
    public Set<Capability> capabilities() {
        return EnumSet.of(Capability.EXPORT, Capability.PREVIEW, Capability.TEMPLATES);
    }

    @Override
    public List<String> sectionKeys(PluginSettings settings, boolean refresh) {
        return SECTION_KEYS;
    }

    // Section bodies are already HTML and are written as-is.
    public String export(String subject, Map<String, String> sections) {
        String title = (subject == null || subject.isBlank()) ? DEFAULT_TITLE : subject;

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n")
                .append("<html lang=\"en\">\n")
                .append("<head>\n")
                .append("<meta charset=\"UTF-8\">\n")
                .append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
                .append("<title>").append(HtmlUtils.htmlEscape(title)).append("</title>\n")
                .append("</head>\n")
                .append("<body>\n");

        sections.forEach((section, content) -> html
                .append("<!-- ").append(commentSafe(section)).append(" section -->\n")
                .append(content == null ? "" : content).append('\n'));

        html.append("</body>\n").append("</html>");

        log.debug("html export sections={} bytes={}", sections.keySet(), html.length());
        return html.toString();
    }

    private static String commentSafe(String section) {
        return section.replaceAll("[^A-Za-z0-9_-]", "").replace("--", "-");
    }
}
