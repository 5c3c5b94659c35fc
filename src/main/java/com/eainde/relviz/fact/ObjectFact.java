package com.eainde.relviz.fact;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Declares that {@code name} is an object of type {@code type}.
 *
 * @param type  type name, itself a first-class name
 * @param name  object name
 * @param attrs attribute block, shared by every name of the declaration
 */
public record ObjectFact(
        @JsonProperty("type")  String type,
        @JsonProperty("name")  String name,
        @JsonProperty("attrs") Map<String, String> attrs
) implements Fact {

    public ObjectFact {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        attrs = Attributes.copyOf(attrs);
    }

    public static ObjectFact of(String type, String name) {
        return new ObjectFact(type, name, Map.of());
    }
}
