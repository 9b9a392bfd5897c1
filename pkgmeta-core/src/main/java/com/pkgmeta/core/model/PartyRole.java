package com.pkgmeta.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role a party plays for a package.
 */
public enum PartyRole {
    AUTHOR("author"),
    MAINTAINER("maintainer");

    private final String value;

    PartyRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
