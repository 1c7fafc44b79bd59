package com.example.revisiondiff.domain;

public record ComparisonRequest(String textA, String textB, Granularity granularity) {
    public ComparisonRequest {
        if (textA == null) {
            throw new ValidationException("Original text is required");
        }
        if (textB == null) {
            throw new ValidationException("Modified text is required");
        }
        if (granularity == null) {
            granularity = Granularity.CHAR;
        }
    }

    public static ComparisonRequest of(String textA, String textB, boolean charLevel) {
        return new ComparisonRequest(textA, textB, Granularity.of(charLevel));
    }
}
