package com.eainde.relviz.fact;

import java.util.Map;

/**
 * A single parsed record of the fact language.
 *
 * <p>Either an {@link ObjectFact} (a typed, named object) or a
 * {@link RelationFact} (a labeled relation between two names).</p>
 */
public interface Fact {

    /** Attributes declared in the fact's indented block, in declaration order. */
    Map<String, String> attrs();
}
