package com.contentforge.augmentation.service.citation;

import com.contentforge.augmentation.dto.CitationEntry;
import lombok.RequiredArgsConstructor;
import org.apache.commons.text.WordUtils;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders bibliography entries.
 *
 * URL sources are labelled by host, label sources by the label itself. The styles differ only
 * in punctuation and in the order of label, access phrase and date.
 */
@Component
@RequiredArgsConstructor
public class CitationFormatter {

    private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter MLA_DATE = DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final String REFERENCES_HEADER = "\n\n## References\n\n";

    private final Clock clock;

    public CitationEntry format(String source, int id, CitationStyle style) {
        LocalDate today = LocalDate.now(clock);
        boolean web = isUrl(source);
        String label = web ? siteName(source) : source;

        String formatted = switch (style) {
            case APA -> web
                    ? String.format("%s. Retrieved %s, from %s", label, LONG_DATE.format(today), source)
                    : String.format("%s. (%d). Research data.", label, today.getYear());
            case MLA -> web
                    ? String.format("\"%s.\" Web. %s.", label, MLA_DATE.format(today))
                    : String.format("\"%s.\" Research Data, %d.", label, today.getYear());
            case CHICAGO -> web
                    ? String.format("%s, accessed %s, %s.", label, LONG_DATE.format(today), source)
                    : String.format("%s, Research Data (%d).", label, today.getYear());
        };

        return CitationEntry.builder()
                .id(id)
                .source(source)
                .formatted(formatted)
                .url(web ? source : null)
                .accessed(ISO_DATE.format(today))
                .style(style.getCode())
                .build();
    }

    /** "\n\n## References\n\n1. ...\n2. ...\n", or empty when nothing was cited. */
    public String referencesSection(List<CitationEntry> bibliography) {
        if (bibliography.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(REFERENCES_HEADER);
        bibliography.stream()
                .sorted((a, b) -> Integer.compare(a.getId(), b.getId()))
                .forEach(e -> sb.append(e.getId()).append(". ").append(e.getFormatted()).append('\n'));
        return sb.toString();
    }

    private boolean isUrl(String source) {
        return source != null && source.regionMatches(true, 0, "http", 0, 4);
    }

    // www.example.com -> Example.Com
    private String siteName(String url) {
        String host;
        try {
            host = new URI(url.strip()).getHost();
        } catch (URISyntaxException e) {
            host = null;
        }
        if (host == null || host.isBlank()) {
            return url;
        }
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        return WordUtils.capitalizeFully(host, '.', '-');
    }
}
