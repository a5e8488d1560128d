package com.pyformatter.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static com.pyformatter.api.Feature.*;

/**
 * Python grammar versions the output may be required to run on.
 */
public enum TargetVersion {
    PY33(3, 3),
    PY34(3, 4),
    PY35(3, 5, TRAILING_COMMA_IN_CALL),
    PY36(3, 6, F_STRINGS, NUMERIC_UNDERSCORES, TRAILING_COMMA_IN_CALL, TRAILING_COMMA_IN_DEF),
    PY37(3, 7, F_STRINGS, NUMERIC_UNDERSCORES, TRAILING_COMMA_IN_CALL, TRAILING_COMMA_IN_DEF,
            ASYNC_KEYWORDS),
    PY38(3, 8, F_STRINGS, DEBUG_F_STRINGS, NUMERIC_UNDERSCORES, TRAILING_COMMA_IN_CALL,
            TRAILING_COMMA_IN_DEF, ASYNC_KEYWORDS, ASSIGNMENT_EXPRESSIONS, POS_ONLY_ARGUMENTS,
            UNPACKING_ON_FLOW, ANN_ASSIGN_EXTENDED_RHS),
    PY39(3, 9, F_STRINGS, DEBUG_F_STRINGS, NUMERIC_UNDERSCORES, TRAILING_COMMA_IN_CALL,
            TRAILING_COMMA_IN_DEF, ASYNC_KEYWORDS, ASSIGNMENT_EXPRESSIONS, POS_ONLY_ARGUMENTS,
            UNPACKING_ON_FLOW, ANN_ASSIGN_EXTENDED_RHS, RELAXED_DECORATORS,
            PARENTHESIZED_CONTEXT_MANAGERS),
    PY310(3, 10, F_STRINGS, DEBUG_F_STRINGS, NUMERIC_UNDERSCORES, TRAILING_COMMA_IN_CALL,
            TRAILING_COMMA_IN_DEF, ASYNC_KEYWORDS, ASSIGNMENT_EXPRESSIONS, POS_ONLY_ARGUMENTS,
            UNPACKING_ON_FLOW, ANN_ASSIGN_EXTENDED_RHS, RELAXED_DECORATORS,
            PARENTHESIZED_CONTEXT_MANAGERS, PATTERN_MATCHING),
    PY311(3, 11, F_STRINGS, DEBUG_F_STRINGS, NUMERIC_UNDERSCORES, TRAILING_COMMA_IN_CALL,
            TRAILING_COMMA_IN_DEF, ASYNC_KEYWORDS, ASSIGNMENT_EXPRESSIONS, POS_ONLY_ARGUMENTS,
            UNPACKING_ON_FLOW, ANN_ASSIGN_EXTENDED_RHS, RELAXED_DECORATORS,
            PARENTHESIZED_CONTEXT_MANAGERS, PATTERN_MATCHING, EXCEPT_STAR, VARIADIC_GENERICS),
    PY312(3, 12, F_STRINGS, DEBUG_F_STRINGS, NUMERIC_UNDERSCORES, TRAILING_COMMA_IN_CALL,
            TRAILING_COMMA_IN_DEF, ASYNC_KEYWORDS, ASSIGNMENT_EXPRESSIONS, POS_ONLY_ARGUMENTS,
            UNPACKING_ON_FLOW, ANN_ASSIGN_EXTENDED_RHS, RELAXED_DECORATORS,
            PARENTHESIZED_CONTEXT_MANAGERS, PATTERN_MATCHING, EXCEPT_STAR, VARIADIC_GENERICS,
            TYPE_PARAMS);

    private final int major;
    private final int minor;
    private final Set<Feature> features;

    TargetVersion(int major, int minor, Feature... features) {
        this.major = major;
        this.minor = minor;
        EnumSet<Feature> set = EnumSet.noneOf(Feature.class);
        Collections.addAll(set, features);
        this.features = Collections.unmodifiableSet(set);
    }

    public Set<Feature> getFeatures() {
        return features;
    }

    public boolean supports(Feature feature) {
        return features.contains(feature);
    }

    /**
     * Parses {@code py38}, {@code PY38} or {@code 3.8}.
     *
     * @throws IllegalArgumentException when the text names no known version
     */
    public static TargetVersion parse(String text) {
        String value = text.trim().toUpperCase(Locale.ROOT);
        if (value.matches("\\d+\\.\\d+")) {
            value = "PY" + value.replace(".", "");
        }
        for (TargetVersion version : values()) {
            if (version.name().equals(value)) {
                return version;
            }
        }
        throw new IllegalArgumentException("Unknown target version: " + text);
    }

    /**
     * Features available in every one of the given versions.
     */
    public static Set<Feature> commonFeatures(Set<TargetVersion> versions) {
        EnumSet<Feature> common = EnumSet.allOf(Feature.class);
        common.remove(FORCE_OPTIONAL_PARENTHESES);
        for (TargetVersion version : versions) {
            common.retainAll(version.features);
        }
        return common;
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
