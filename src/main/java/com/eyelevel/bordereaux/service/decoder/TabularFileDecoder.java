package com.eyelevel.bordereaux.service.decoder;

/**
 * Turns stored bytes of one file format into a {@link DecodedTable}.
 */
public interface TabularFileDecoder {

    /**
     * @param extension lower-case extension without the dot, e.g. {@code "csv"}
     */
    boolean supports(String extension);

    /**
     * @throws com.eyelevel.bordereaux.exception.DecodeException on corrupt content or a missing header row
     */
    DecodedTable decode(byte[] content);
}
