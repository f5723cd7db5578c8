package com.nextrows.client.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the remote service interprets the entries of
 * {@link ExtractRequest#data()}.
 */
public enum ExtractType {

    /** Entries are web page URLs to fetch. */
    URL("url"),

    /** Entries are raw text content. */
    TEXT("text");

    private final String wireValue;

    ExtractType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
