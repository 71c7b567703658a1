package com.spreadsheet.calc.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Spreadsheet-visible error values, e.g. #DIV/0! or #N/A.
 * Each carries its display text and the numeric code used for ordering.
 */
public enum CellError {
    NULL("#NULL!", 0x00),
    DIV0("#DIV/0!", 0x07),
    VALUE("#VALUE!", 0x0F),
    REF("#REF!", 0x17),
    NAME("#NAME?", 0x1D),
    NUM("#NUM!", 0x24),
    NA("#N/A", 0x2A),
    GETTING_DATA("#GETTING_DATA", 0x2B),
    SPILL("#SPILL!", 0x2C),
    CALC("#CALC!", 0x2D);

    private final String text;
    private final int code;

    CellError(String text, int code) {
        this.text = text;
        this.code = code;
    }

    @JsonValue
    public String getText() {
        return text;
    }

    public int getCode() {
        return code;
    }

    /**
     * Looks up an error by its display text, ignoring case.
     * Returns null when the text is not a known error literal.
     */
    public static CellError fromText(String text) {
        if (text == null) {
            return null;
        }
        for (CellError error : values()) {
            if (error.text.equalsIgnoreCase(text)) {
                return error;
            }
        }
        return null;
    }

    @JsonCreator
    public static CellError fromValue(String value) {
        CellError error = fromText(value);
        if (error == null) {
            throw new IllegalArgumentException("Unknown error literal: " + value);
        }
        return error;
    }

    @Override
    public String toString() {
        return text;
    }
}
