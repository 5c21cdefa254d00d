package com.secureapi.signing;

import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;

/**
 * ASCII-only string escaping with lower-case hex digits: "caf&eacute;" is written as
 * {@code caf\\u00e9}.
 * <p>
 * Everything outside printable ASCII becomes a six-character hex escape, one per UTF-16 unit, so
 * characters beyond the BMP become a surrogate pair. Backspace, form feed, newline,
 * carriage return and tab keep their short forms.
 */
final class LowercaseHexEscapes extends CharacterEscapes {

    private static final long serialVersionUID = 1L;

    private final int[] asciiEscapes;

    LowercaseHexEscapes() {
        int[] escapes = CharacterEscapes.standardAsciiEscapesForJSON();
        for (int ch = 0; ch < 0x20; ch++) {
            if (escapes[ch] == CharacterEscapes.ESCAPE_STANDARD) {
                escapes[ch] = CharacterEscapes.ESCAPE_CUSTOM;
            }
        }
        escapes[0x7F] = CharacterEscapes.ESCAPE_CUSTOM;
        this.asciiEscapes = escapes;
    }

    @Override
    public int[] getEscapeCodesForAscii() {
        return asciiEscapes;
    }

    @Override
    public SerializableString getEscapeSequence(int ch) {
        return new SerializedString(String.format("\\u%04x", ch));
    }
}
