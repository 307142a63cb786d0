package com.correlationsentinel.core.rule;

/**
 * Rule that fires on a single event satisfying its condition tree. Never
 * touches the window manager. SIGMA rules compile to this variant.
 *
 * @since 1.0.0
 */
public final class SingleEventRule extends Rule {

    private SingleEventRule(Builder b) {
        super(b);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public RuleType getType() {
        return RuleType.SINGLE;
    }

    /**
     * Builder for {@link SingleEventRule}.
     */
    public static final class Builder extends Rule.Builder<Builder> {

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public SingleEventRule build() {
            return new SingleEventRule(this);
        }
    }
}
