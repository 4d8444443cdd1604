package com.openparking.parking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonAttributesConverterTest {

    private final JsonAttributesConverter converter = new JsonAttributesConverter();

    @Test
    @DisplayName("empty bag is stored as NULL and NULL is read back as an empty bag")
    void emptyBag_storedAsNull() {
        assertThat(converter.convertToDatabaseColumn(Map.of())).isNull();
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
        assertThat(converter.convertToEntityAttribute(null)).isEmpty();
    }

    @Test
    @DisplayName("nested values survive storage")
    void nestedValues_preserved() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("color", "red");
        attributes.put("electric", true);
        attributes.put("dimensions", Map.of("length", 4));

        String json = converter.convertToDatabaseColumn(attributes);

        assertThat(json).isEqualTo("{\"color\":\"red\",\"electric\":true,\"dimensions\":{\"length\":4}}");
        assertThat(converter.convertToEntityAttribute(json))
                .containsEntry("color", "red")
                .containsEntry("electric", true)
                .containsEntry("dimensions", Map.of("length", 4));
    }
}
