package com.eyelevel.bordereaux.service.decoder;

import com.eyelevel.bordereaux.exception.DecodeException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the {@link TabularFileDecoder} for a file by its extension.
 */
@Service
@Slf4j
public class TabularFileDecoderFactory {

    private final List<TabularFileDecoder> decoders;

    public TabularFileDecoderFactory(List<TabularFileDecoder> decoders) {
        this.decoders = decoders;
        log.info("TabularFileDecoderFactory initialized with {} available decoders.", decoders.size());
    }

    public Optional<TabularFileDecoder> getDecoder(String extension) {
        final String normalized = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        Optional<TabularFileDecoder> decoder = decoders.stream().filter(d -> d.supports(normalized)).findFirst();
        log.debug("Searching for decoder for extension '{}'. Found: {}", normalized,
                  decoder.map(d -> d.getClass().getSimpleName()).orElse("None"));
        return decoder;
    }

    /**
     * Decodes content using the decoder registered for the filename's extension.
     *
     * @throws DecodeException if no decoder supports the extension or the content is unreadable
     */
    public DecodedTable decode(String filename, byte[] content) {
        final String extension = FilenameUtils.getExtension(filename);
        return getDecoder(extension)
                .orElseThrow(() -> new DecodeException("Unsupported file type '" + extension + "' for " + filename))
                .decode(content);
    }
}
