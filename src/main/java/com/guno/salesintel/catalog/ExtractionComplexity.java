package com.guno.salesintel.catalog;

public enum ExtractionComplexity {
    SIMPLE,
    MODERATE,
    COMPLEX
}
