package com.pyformatter.api.error;

/**
 * A construct requires a newer grammar version than the requested target versions permit.
 */
public class UnsupportedConstructException extends FormatterException {
    private final String feature;

    public UnsupportedConstructException(String feature, String targets) {
        super("Source uses " + feature + " which is not supported by target versions " + targets, 0, 0);
        this.feature = feature;
    }

    public String getFeature() {
        return feature;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.UNSUPPORTED;
    }
}
