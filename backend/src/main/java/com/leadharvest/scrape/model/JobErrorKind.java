package com.leadharvest.scrape.model;

public enum JobErrorKind {
    TRANSIENT,
    FATAL,
    AREA_DATA,
    STORAGE,
    UNEXPECTED
}
