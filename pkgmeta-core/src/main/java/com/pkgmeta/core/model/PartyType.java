package com.pkgmeta.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of party credited in package metadata.
 */
public enum PartyType {
    PERSON("person"),
    ORGANIZATION("organization");

    private final String value;

    PartyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
