package io.github.harrbca.x12delimiters.x12;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DelimiterError {
    INVALID_ISA_LENGTH("ISA segment must be at least " + Delimiters.ISA_MIN_LENGTH + " bytes long to extract delimiters");

    private final String message;
}
