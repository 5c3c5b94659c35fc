package com.eainde.relviz.fact;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Declares that {@code lhs} stands in relation {@code rel} to {@code rhs}.
 *
 * <p>The relation name is an ordinary name: other facts may talk about it,
 * which is how custom generalization names are introduced.</p>
 *
 * @param lhs      left-hand name
 * @param lhsLabel label at the left end, or null
 * @param rel      relation name
 * @param rhsLabel label at the right end, or null
 * @param rhs      right-hand name
 * @param attrs    attribute block
 */
public record RelationFact(
        @JsonProperty("lhs")                                            String lhs,
        @JsonProperty("lhs_label") @JsonInclude(JsonInclude.Include.NON_NULL) String lhsLabel,
        @JsonProperty("rel")                                            String rel,
        @JsonProperty("rhs_label") @JsonInclude(JsonInclude.Include.NON_NULL) String rhsLabel,
        @JsonProperty("rhs")                                            String rhs,
        @JsonProperty("attrs")                                          Map<String, String> attrs
) implements Fact {

    public RelationFact {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rel, "rel");
        Objects.requireNonNull(rhs, "rhs");
        attrs = Attributes.copyOf(attrs);
    }

    public static RelationFact of(String lhs, String rel, String rhs) {
        return new RelationFact(lhs, null, rel, null, rhs, Map.of());
    }

    public boolean hasLhsLabel() { return lhsLabel != null && !lhsLabel.isEmpty(); }
    public boolean hasRhsLabel() { return rhsLabel != null && !rhsLabel.isEmpty(); }
}
