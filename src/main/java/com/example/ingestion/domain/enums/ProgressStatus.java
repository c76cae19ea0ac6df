package com.example.ingestion.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status carried in a progress snapshot. Serialised in lower case.
 */
@Getter
@RequiredArgsConstructor
public enum ProgressStatus {
    PROCESSING("processing"),
    READY("ready"),
    ERROR("error");

    @JsonValue
    private final String code;

    @JsonCreator
    public static ProgressStatus fromCode(String code) {
        for (var status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown progress status: " + code);
    }
}
