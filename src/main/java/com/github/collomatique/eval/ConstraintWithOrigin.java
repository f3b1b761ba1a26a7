package com.github.collomatique.eval;

import java.util.Optional;

import com.github.collomatique.ilp.Constraint;

public record ConstraintWithOrigin(Constraint<IlpVar> constraint, Optional<Origin> origin) {

    public static ConstraintWithOrigin anonymous(Constraint<IlpVar> constraint) {
        return new ConstraintWithOrigin(constraint, Optional.empty());
    }

    public ConstraintWithOrigin withOriginIfAbsent(Origin origin) {
        return this.origin.isPresent() ? this : new ConstraintWithOrigin(constraint, Optional.of(origin));
    }

    @Override
    public String toString() {
        return constraint + origin.map(o -> " (from " + o + ")").orElse("");
    }
}
