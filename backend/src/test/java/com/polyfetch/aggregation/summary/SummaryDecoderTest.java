package com.polyfetch.aggregation.summary;

import com.polyfetch.common.ErrorKind;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SummaryDecoderTest {

    private final SummaryDecoder decoder = new SummaryDecoder();

    @Test
    void decode_fullDocument() {
        Document raw = new Document("_id", 1996)
                .append("count", 2)
                .append("items", List.of("Fargo", "Scream"));

        Summary summary = decoder.decode(raw);

        assertThat(summary.key()).isEqualTo(1996L);
        assertThat(summary.numericKey()).isEqualTo(1996L);
        assertThat(summary.count()).isEqualTo(2L);
        assertThat(summary.items()).containsExactly("Fargo", "Scream");
    }

    @Nested
    @DisplayName("defaulted fields")
    class Defaults {

        @Test
        void missingCount_defaultsToZero() {
            Summary summary = decoder.decode(new Document("_id", 2001).append("items", List.of("Memento")));

            assertThat(summary.count()).isZero();
            assertThat(summary.items()).containsExactly("Memento");
        }

        @Test
        void missingItems_defaultsToEmpty() {
            Summary summary = decoder.decode(new Document("_id", 2001).append("count", 4L));

            assertThat(summary.count()).isEqualTo(4L);
            assertThat(summary.items()).isEmpty();
        }

        @Test
        void onlyKey_neverFails() {
            Summary summary = decoder.decode(new Document("_id", "unknown"));

            assertThat(summary.key()).isEqualTo("unknown");
            assertThat(summary.isNumericKey()).isFalse();
            assertThat(summary.count()).isZero();
            assertThat(summary.items()).isEmpty();
        }

        @Test
        void nullCountAndItems_treatedAsAbsent() {
            Document raw = new Document("_id", 1999).append("count", null).append("items", null);

            Summary summary = decoder.decode(raw);

            assertThat(summary.count()).isZero();
            assertThat(summary.items()).isEmpty();
        }
    }

    @Nested
    @DisplayName("group key")
    class Key {

        @Test
        void missingKey_malformed() {
            assertThatThrownBy(() -> decoder.decode(new Document("count", 3).append("items", List.of("a"))))
                    .isInstanceOf(MalformedSummaryException.class)
                    .extracting(e -> ((MalformedSummaryException) e).getErrorKind())
                    .isEqualTo(ErrorKind.MALFORMED_SUMMARY);
        }

        @Test
        void nullKey_malformed() {
            assertThatThrownBy(() -> decoder.decode(new Document("_id", null)))
                    .isInstanceOf(MalformedSummaryException.class);
        }

        @Test
        void fractionalKey_malformed() {
            assertThatThrownBy(() -> decoder.decode(new Document("_id", 1995.5)))
                    .isInstanceOf(MalformedSummaryException.class);
        }

        @Test
        void documentKey_malformed() {
            assertThatThrownBy(() -> decoder.decode(new Document("_id", new Document("year", 1995))))
                    .isInstanceOf(MalformedSummaryException.class);
        }

        @Test
        void integralNumericKinds_normalizedToLong() {
            assertThat(decoder.decode(new Document("_id", 2000L)).key()).isEqualTo(2000L);
            assertThat(decoder.decode(new Document("_id", 2000.0)).key()).isEqualTo(2000L);
            assertThat(decoder.decode(new Document("_id", new Decimal128(new BigDecimal("2000")))).key()).isEqualTo(2000L);
        }
    }

    @Nested
    @DisplayName("present but mistyped fields")
    class Mistyped {

        @Test
        void nonNumericCount_malformed() {
            assertThatThrownBy(() -> decoder.decode(new Document("_id", 1995).append("count", "three")))
                    .isInstanceOf(MalformedSummaryException.class)
                    .hasMessageContaining("count");
        }

        @Test
        void negativeCount_malformed() {
            assertThatThrownBy(() -> decoder.decode(new Document("_id", 1995).append("count", -1)))
                    .isInstanceOf(MalformedSummaryException.class);
        }

        @Test
        void scalarItems_malformed() {
            assertThatThrownBy(() -> decoder.decode(new Document("_id", 1995).append("items", "Heat")))
                    .isInstanceOf(MalformedSummaryException.class)
                    .hasMessageContaining("items");
        }
    }

    @Test
    @DisplayName("items keep store order; non-string values are stringified and nulls dropped")
    void items_preserveOrder() {
        Document raw = new Document("_id", 1995)
                .append("count", 4)
                .append("items", Arrays.asList("Heat", null, 1995, "Casino"));

        assertThat(decoder.decode(raw).items()).containsExactly("Heat", "1995", "Casino");
    }
}
