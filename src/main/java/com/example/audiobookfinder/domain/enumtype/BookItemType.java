package com.example.audiobookfinder.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BookItemType {

    FOLDER("folder"),
    FILE("file");

    private final String value;

    BookItemType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
