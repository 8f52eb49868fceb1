package com.contentforge.augmentation.service.citation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Inserts " [n]" markers into content.
 *
 * Insertion points are computed against the original text, then applied right to left on
 * successive copies, so no offset ever needs adjusting.
 */
@Component
public class CitationMarkerWriter {

    /**
     * @param claimEnd       offset just past the cited claim
     * @param citationNumber bibliography id
     */
    public record Marker(int claimEnd, int citationNumber) {}

    public String apply(String content, List<Marker> markers) {
        NavigableMap<Integer, Set<Integer>> byPoint = new TreeMap<>();
        for (Marker marker : markers) {
            int point = insertionPoint(content, marker.claimEnd());
            byPoint.computeIfAbsent(point, p -> new TreeSet<>()).add(marker.citationNumber());
        }

        String result = content;
        for (Map.Entry<Integer, Set<Integer>> entry : byPoint.descendingMap().entrySet()) {
            int point = entry.getKey();
            StringBuilder marker = new StringBuilder();
            entry.getValue().forEach(n -> marker.append(" [").append(n).append(']'));
            result = result.substring(0, point) + marker + result.substring(point);
        }
        return result;
    }

    /**
     * First sentence-terminating period (not followed by a digit) on the claim's line at or
     * after {@code claimEnd}; the claim end itself when the line has none.
     */
    int insertionPoint(String content, int claimEnd) {
        int end = Math.min(Math.max(claimEnd, 0), content.length());
        int lineEnd = content.indexOf('\n', end);
        if (lineEnd < 0) {
            lineEnd = content.length();
        }
        for (int i = end; i < lineEnd; i++) {
            if (content.charAt(i) == '.'
                    && (i + 1 >= content.length() || !Character.isDigit(content.charAt(i + 1)))) {
                return i;
            }
        }
        return end;
    }
}
