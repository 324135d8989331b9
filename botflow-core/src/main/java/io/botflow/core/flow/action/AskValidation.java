package io.botflow.core.flow.action;

import java.util.ArrayList;
import java.util.List;

/// Answer validation rule of an ask node.
///
/// ### Supported rules
/// - {@link None} - any answer is accepted
/// - {@link Regex} - answer must match a pattern
/// - {@link Options} - answer must be one of a fixed list
public sealed interface AskValidation {

    /// Wire discriminator (`"none"`, `"regex"`, `"options"`).
    String type();

    /// Shared instance of the accept-everything rule.
    None NONE = new None();

    record None() implements AskValidation {
        @Override
        public String type() {
            return "none";
        }
    }

    record Regex(String pattern) implements AskValidation {
        public Regex {
            pattern = pattern == null ? "" : pattern;
        }

        @Override
        public String type() {
            return "regex";
        }
    }

    record Options(List<String> options) implements AskValidation {
        public Options {
            List<String> copy = new ArrayList<>();
            if (options != null) {
                for (String option : options) {
                    if (option != null) {
                        copy.add(option);
                    }
                }
            }
            options = List.copyOf(copy);
        }

        @Override
        public String type() {
            return "options";
        }
    }
}
