package com.dbtide.backend.text;

import com.dbtide.backend.exception.InvalidDocumentEncodingException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 decoding of document bytes. Malformed input is rejected instead of being replaced, since
 * offsets into a repaired text would not match what the editor holds.
 */
public final class DocumentDecoder {

    private DocumentDecoder() {
    }

    public static String decode(byte[] bytes) throws InvalidDocumentEncodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new InvalidDocumentEncodingException("Document is not valid UTF-8: " + e.getMessage(), e);
        }
    }
}
