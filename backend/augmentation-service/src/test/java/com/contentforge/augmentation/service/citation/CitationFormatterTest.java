package com.contentforge.augmentation.service.citation;

import com.contentforge.augmentation.dto.CitationEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CitationFormatterTest {

    private static final String URL = "https://www.example.com/report";

    private final CitationFormatter formatter =
            new CitationFormatter(Clock.fixed(Instant.parse("2026-10-17T10:00:00Z"), ZoneOffset.UTC));

    @Nested
    @DisplayName("APA")
    class Apa {

        @Test
        @DisplayName("URL 출처")
        void url() {
            CitationEntry entry = formatter.format(URL, 1, CitationStyle.APA);

            assertThat(entry.getFormatted())
                    .isEqualTo("Example.Com. Retrieved October 17, 2026, from https://www.example.com/report");
            assertThat(entry.getId()).isEqualTo(1);
            assertThat(entry.getSource()).isEqualTo(URL);
            assertThat(entry.getUrl()).isEqualTo(URL);
            assertThat(entry.getAccessed()).isEqualTo("2026-10-17");
            assertThat(entry.getStyle()).isEqualTo("apa");
        }

        @Test
        @DisplayName("라벨 출처는 URL 없음")
        void label() {
            CitationEntry entry = formatter.format("Research Data", 2, CitationStyle.APA);

            assertThat(entry.getFormatted()).isEqualTo("Research Data. (2026). Research data.");
            assertThat(entry.getUrl()).isNull();
        }
    }

    @Test
    @DisplayName("MLA")
    void mla() {
        assertThat(formatter.format(URL, 1, CitationStyle.MLA).getFormatted())
                .isEqualTo("\"Example.Com.\" Web. 17 Oct 2026.");
        assertThat(formatter.format("Research Data", 1, CitationStyle.MLA).getFormatted())
                .isEqualTo("\"Research Data.\" Research Data, 2026.");
    }

    @Test
    @DisplayName("Chicago")
    void chicago() {
        assertThat(formatter.format(URL, 1, CitationStyle.CHICAGO).getFormatted())
                .isEqualTo("Example.Com, accessed October 17, 2026, https://www.example.com/report.");
        assertThat(formatter.format("Research Data", 1, CitationStyle.CHICAGO).getFormatted())
                .isEqualTo("Research Data, Research Data (2026).");
    }

    @Test
    @DisplayName("하이픈이 있는 호스트명도 단어별 대문자")
    void hyphenatedHost() {
        assertThat(formatter.format("https://data-portal.gov.uk/x", 1, CitationStyle.MLA).getFormatted())
                .isEqualTo("\"Data-Portal.Gov.Uk.\" Web. 17 Oct 2026.");
    }

    @Test
    @DisplayName("참고문헌 섹션은 번호 순으로 나열")
    void referencesSection() {
        List<CitationEntry> bibliography = List.of(
                CitationEntry.builder().id(2).formatted("Second").build(),
                CitationEntry.builder().id(1).formatted("First").build());

        assertThat(formatter.referencesSection(bibliography))
                .isEqualTo("\n\n## References\n\n1. First\n2. Second\n");
        assertThat(formatter.referencesSection(List.of())).isEmpty();
    }

    @Test
    @DisplayName("알 수 없는 스타일은 기본값")
    void styleFallback() {
        assertThat(CitationStyle.from("MLA", CitationStyle.APA)).isEqualTo(CitationStyle.MLA);
        assertThat(CitationStyle.from(" chicago ", CitationStyle.APA)).isEqualTo(CitationStyle.CHICAGO);
        assertThat(CitationStyle.from("harvard", CitationStyle.APA)).isEqualTo(CitationStyle.APA);
        assertThat(CitationStyle.from(null, CitationStyle.MLA)).isEqualTo(CitationStyle.MLA);
    }
}
