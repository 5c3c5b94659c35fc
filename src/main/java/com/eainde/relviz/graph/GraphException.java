package com.eainde.relviz.graph;

import com.eainde.relviz.RelvizException;

/**
 * The containment structure cannot be turned into nested clusters.
 */
public class GraphException extends RelvizException {

    public GraphException(String message) {
        super(message);
    }
}
