package io.github.harrbca.x12delimiters.x12;

import lombok.NonNull;
import lombok.Value;

/**
 * The three delimiters that control how an X12 interchange is split into
 * segments, elements and sub-elements.
 * <p>
 * Values are raw single-byte codes. Construction accepts any combination;
 * use {@link #areValid()} before handing a set to a tokenizer.
 */
@Value
public class Delimiters {

    public static final byte DEFAULT_SEGMENT_TERMINATOR = '~';
    public static final byte DEFAULT_ELEMENT_SEPARATOR = '*';
    public static final byte DEFAULT_SUB_ELEMENT_SEPARATOR = ':';

    public static final int ISA_MIN_LENGTH = 106;
    public static final int ELEMENT_SEPARATOR_INDEX = 3;
    public static final int SUB_ELEMENT_SEPARATOR_INDEX = 104;
    public static final int SEGMENT_TERMINATOR_INDEX = 105;

    byte segmentTerminator;
    byte elementSeparator;
    byte subElementSeparator;

    /**
     * Reads the delimiters out of a raw ISA header.
     * <ul>
     *   <li>offset 3: element separator</li>
     *   <li>offset 104: sub-element separator (ISA16)</li>
     *   <li>offset 105: segment terminator</li>
     * </ul>
     * Anything after offset 105 is ignored, and the extracted bytes are not checked.
     *
     * @param isaHeader bytes starting at the {@code ISA} tag
     * @throws DelimiterException with {@link DelimiterError#INVALID_ISA_LENGTH} if fewer than 106 bytes are given
     */
    public static Delimiters fromIsa(@NonNull byte[] isaHeader) {
        if (isaHeader.length < ISA_MIN_LENGTH) {
            throw new DelimiterException(DelimiterError.INVALID_ISA_LENGTH);
        }

        byte elementSeparator = isaHeader[ELEMENT_SEPARATOR_INDEX];
        byte subElementSeparator = isaHeader[SUB_ELEMENT_SEPARATOR_INDEX];
        byte segmentTerminator = isaHeader[SEGMENT_TERMINATOR_INDEX];

        return new Delimiters(segmentTerminator, elementSeparator, subElementSeparator);
    }

    /**
     * The conventional {@code ~ * :} set.
     */
    public static Delimiters defaults() {
        return new Delimiters(DEFAULT_SEGMENT_TERMINATOR, DEFAULT_ELEMENT_SEPARATOR, DEFAULT_SUB_ELEMENT_SEPARATOR);
    }

    /**
     * True when no two delimiters share a character.
     */
    public boolean areValid() {
        return segmentTerminator != elementSeparator
                && segmentTerminator != subElementSeparator
                && elementSeparator != subElementSeparator;
    }

    @Override
    public String toString() {
        return "Delimiters(segmentTerminator=" + display(segmentTerminator)
                + ", elementSeparator=" + display(elementSeparator)
                + ", subElementSeparator=" + display(subElementSeparator) + ")";
    }

    /**
     * Narrows a character to a delimiter code.
     *
     * @throws IllegalArgumentException if the character is above U+00FF
     */
    public static byte code(char c) {
        if (c > 0xFF) {
            throw new IllegalArgumentException(String.format("Delimiter U+%04X does not fit in a single byte", (int) c));
        }
        return (byte) c;
    }

    /**
     * Printable form of a delimiter code, e.g. {@code '~'}, {@code '\r'} or {@code 0x1D}.
     */
    public static String display(byte code) {
        int value = code & 0xFF;
        return switch (value) {
            case '\r' -> "'\\r'";
            case '\n' -> "'\\n'";
            case '\t' -> "'\\t'";
            default -> value > 0x20 && value < 0x7F
                    ? "'" + (char) value + "'"
                    : String.format("0x%02X", value);
        };
    }
}
