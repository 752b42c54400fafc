package com.tastream.window;

/** Which extremum a {@link MonotonicExtremumTracker} reports. */
public enum ExtremumOrder {
    MIN {
        @Override
        boolean dominates(double candidate, double existing) {
            return candidate <= existing;
        }
    },
    MAX {
        @Override
        boolean dominates(double candidate, double existing) {
            return candidate >= existing;
        }
    };

    /** True if {@code existing} can never again be the extremum once {@code candidate} is in the window. */
    abstract boolean dominates(double candidate, double existing);
}
