package com.contentforge.augmentation.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class TextFeaturesTest {

    @Nested
    @DisplayName("숫자 추출")
    class Numbers {

        @Test
        @DisplayName("백분율, 일반 숫자, 연도를 처음 등장 순서로 중복 없이 반환")
        void percentagesAndYears() {
            assertThat(TextFeatures.numbers("Sales grew by 25% in 2023"))
                    .containsExactly("25%", "25", "2023");
        }

        @Test
        @DisplayName("금액은 단위를 포함하여 추출")
        void moneyWithScale() {
            assertThat(TextFeatures.numbers("Revenue reached $1.5 billion"))
                    .containsExactly("$1.5 billion", "1.5 billion");
        }

        @Test
        @DisplayName("배수 표현 추출")
        void multipliers() {
            assertThat(TextFeatures.numbers("The new build is 3x faster"))
                    .containsExactly("3", "3x");
        }

        @Test
        @DisplayName("null 또는 빈 문자열은 빈 리스트")
        void blank() {
            assertThat(TextFeatures.numbers(null)).isEmpty();
            assertThat(TextFeatures.numbers("  ")).isEmpty();
        }
    }

    @ParameterizedTest
    @DisplayName("숫자 정규화")
    @CsvSource({
            "'$1,200 million', 1200",
            "25%, 25",
            "1.5x, 1.5",
            "2023., 2023",
            "abc, ''"
    })
    void normalizeNumber(String raw, String expected) {
        assertThat(TextFeatures.normalizeNumber(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("연도, 기간 구문, 월-연도 구문을 날짜로 추출")
    void dates() {
        assertThat(TextFeatures.dates("Launched in March 2024 and grew during 2023"))
                .containsExactly("2024", "2023", "during 2023", "March 2024");
    }

    @Nested
    @DisplayName("키워드 추출")
    class Keywords {

        @Test
        @DisplayName("불용어와 3자 미만 단어 제외, 소문자화")
        void stopwordsRemoved() {
            assertThat(TextFeatures.keywords("The Study found that sales grew", 10))
                    .containsExactly("study", "found", "sales", "grew");
        }

        @Test
        @DisplayName("최대 개수 제한")
        void limit() {
            assertThat(TextFeatures.keywords("The study found that sales grew", 2))
                    .containsExactly("study", "found");
        }

        @Test
        @DisplayName("중복 키워드는 한 번만")
        void distinct() {
            assertThat(TextFeatures.keywords("sales sales SALES growth", 10))
                    .containsExactly("sales", "growth");
        }
    }
}
