package com.eyelevel.bordereaux.model.converter;

import com.eyelevel.bordereaux.exception.json.JsonParsingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class JsonColumnConverterTest {

    @Nested
    @DisplayName("Map columns")
    class MapColumns {

        private final StringMapJsonConverter converter = new StringMapJsonConverter();

        @Test
        @DisplayName("column mappings keep their insertion order through the database column")
        void keepsOrder() {
            Map<String, String> mappings = new LinkedHashMap<>();
            mappings.put("Premium", "premium_amount");
            mappings.put("Policy No", "policy_number");
            mappings.put("Currency", "currency");

            String column = converter.convertToDatabaseColumn(mappings);

            assertThat(column).isEqualTo(
                    "{\"Premium\":\"premium_amount\",\"Policy No\":\"policy_number\",\"Currency\":\"currency\"}");
            assertThat(converter.convertToEntityAttribute(column)).containsExactly(
                    entry("Premium", "premium_amount"),
                    entry("Policy No", "policy_number"),
                    entry("Currency", "currency"));
        }

        @Test
        @DisplayName("null and blank columns read as an empty map")
        void emptyColumn() {
            assertThat(converter.convertToDatabaseColumn(null)).isNull();
            assertThat(converter.convertToEntityAttribute(null)).isEmpty();
            assertThat(converter.convertToEntityAttribute(" ")).isEmpty();
        }

        @Test
        @DisplayName("corrupt column content is a JSON parsing error")
        void corruptColumn() {
            assertThatThrownBy(() -> converter.convertToEntityAttribute("{not json"))
                    .isInstanceOf(JsonParsingException.class);
        }
    }

    @Nested
    @DisplayName("List columns")
    class ListColumns {

        private final StringListJsonConverter converter = new StringListJsonConverter();

        @Test
        @DisplayName("header lists are stored as a JSON array in order")
        void storesArray() {
            String column = converter.convertToDatabaseColumn(List.of("Pol Ref", "Gross", "Start"));

            assertThat(column).isEqualTo("[\"Pol Ref\",\"Gross\",\"Start\"]");
            assertThat(converter.convertToEntityAttribute(column)).containsExactly("Pol Ref", "Gross", "Start");
        }

        @Test
        @DisplayName("a blank column reads as a mutable empty list")
        void blankColumn() {
            List<String> headers = converter.convertToEntityAttribute("");

            assertThat(headers).isEmpty();
            headers.add("added");
            assertThat(headers).containsExactly("added");
        }
    }
}
