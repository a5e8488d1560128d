package com.pyformatter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pyformatter.api.error.FormatterError;

/**
 * Result of a formatting operation.
 */
public class FormatterResult {

    /**
     * What happened to the unit of source.
     */
    public enum Outcome {
        UNCHANGED,
        REFORMATTED,
        DIFF,
        FAILED
    }

    private final Outcome outcome;
    private final String formattedCode;
    private final String diff;
    private final List<FormatterError> errors;

    private FormatterResult(Builder builder) {
        this.outcome = builder.outcome;
        this.formattedCode = builder.formattedCode;
        this.diff = builder.diff;
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
    }

    public boolean isSuccessful() {
        return outcome != Outcome.FAILED;
    }

    public boolean isChanged() {
        return outcome == Outcome.REFORMATTED || outcome == Outcome.DIFF;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * The new text for REFORMATTED and DIFF results, the untouched input otherwise.
     */
    public String getFormattedCode() {
        return formattedCode;
    }

    /**
     * Unified diff between input and output, only present for DIFF results.
     */
    public String getDiff() {
        return diff;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Outcome outcome = Outcome.UNCHANGED;
        private String formattedCode;
        private String diff;
        private List<FormatterError> errors = new ArrayList<>();

        public Builder outcome(Outcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder diff(String diff) {
            this.diff = diff;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
