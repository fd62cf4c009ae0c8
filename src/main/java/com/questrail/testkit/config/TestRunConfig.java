package com.questrail.testkit.config;

import com.questrail.testkit.api.SuiteMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Options for one run of a suite.
 *
 * <ul>
 *   <li><b>mode</b>: {@link SuiteMode} for the run; defaults to
 *       {@link SuiteMode#CONTINUE}.</li>
 *   <li><b>selection</b>: 1-based indices of the tests to execute, in
 *       execution order. Empty means every registered test in registration
 *       order.</li>
 * </ul>
 */
public record TestRunConfig(
    SuiteMode mode,
    Optional<List<Integer>> selection
) {
    public TestRunConfig {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(selection, "selection");
        selection = selection.map(List::copyOf);
    }

    public static TestRunConfig defaults() {
        return new TestRunConfig(SuiteMode.CONTINUE, Optional.empty());
    }

    public boolean runsAllTests() {
        return selection.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SuiteMode mode = SuiteMode.CONTINUE;
        private List<Integer> selection;

        public Builder withMode(SuiteMode mode) {
            this.mode = mode;
            return this;
        }

        /**
         * Restricts the run to the given 1-based test indices.
         */
        public Builder withSelection(List<Integer> indices) {
            this.selection = new ArrayList<>(Objects.requireNonNull(indices, "indices"));
            return this;
        }

        public Builder withSelection(int... indices) {
            List<Integer> list = new ArrayList<>(indices.length);
            for (int index : indices) {
                list.add(index);
            }
            this.selection = list;
            return this;
        }

        /**
         * Clears any selection so that every registered test runs.
         */
        public Builder allTests() {
            this.selection = null;
            return this;
        }

        public TestRunConfig build() {
            return new TestRunConfig(mode, Optional.ofNullable(selection));
        }
    }
}
