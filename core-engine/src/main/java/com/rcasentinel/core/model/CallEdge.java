package com.rcasentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Directed call relationship: {@code source} calls {@code target}.
 *
 * @since 1.0.0
 */
public final class CallEdge implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final String target;

    public CallEdge(String source, String target) {
        this.source = Objects.requireNonNull(source, "Edge source must not be null");
        this.target = Objects.requireNonNull(target, "Edge target must not be null");
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CallEdge that))
            return false;
        return source.equals(that.source) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
