package io.github.harrbca.x12delimiters.x12;

import lombok.Getter;

/**
 * Raised when delimiters cannot be read from an ISA header.
 */
@Getter
public class DelimiterException extends RuntimeException {

    private final DelimiterError error;

    public DelimiterException(DelimiterError error) {
        super(error.getMessage());
        this.error = error;
    }
}
