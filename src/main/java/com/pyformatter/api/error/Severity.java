package com.pyformatter.api.error;

public enum Severity {
    FATAL,   // The unit could not be formatted, input left untouched
    ERROR,   // Issues requiring manual intervention
    WARNING, // Recovered problems, output still produced
    INFO     // Informational messages about formatting
}
