package com.eyelevel.bordereaux.service.file;

import com.eyelevel.bordereaux.exception.apiclient.BadRequestException;
import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.model.FileType;
import com.eyelevel.bordereaux.service.decoder.TabularFileDecoderFactory;
import com.eyelevel.bordereaux.service.storage.BlobStore;
import com.eyelevel.bordereaux.service.storage.StoredBlob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Registers incoming bordereaux. Content is addressed by its SHA-256 hash, so the same bytes received twice
 * resolve to one file record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileIntakeService {

    private final BlobStore blobStore;
    private final BordereauxFileAtomicService atomicService;
    private final TabularFileDecoderFactory decoderFactory;

    /**
     * Stores the content and creates a RECEIVED file, or returns the file already registered for the same
     * content.
     *
     * @param fileTypeHint the sender's declared type; when absent the type is inferred from subject and filename
     *
     * @throws BadRequestException if the content is empty or the file type cannot be decoded
     */
    public IntakeResult register(final String filename, final String sender, final String subject,
                                 final byte[] content, final Optional<FileType> fileTypeHint) {
        if (filename == null || filename.isBlank()) {
            throw new BadRequestException("A filename is required.");
        }
        if (content == null || content.length == 0) {
            throw new BadRequestException("File '" + filename + "' is empty.");
        }
        final String extension = FilenameUtils.getExtension(filename);
        if (decoderFactory.getDecoder(extension).isEmpty()) {
            throw new BadRequestException("Unsupported file type '" + extension + "' for " + filename
                                          + ". Expected csv, txt, xlsx or xls.");
        }

        final StoredBlob blob = blobStore.store(content);
        final Optional<BordereauxFile> existing = atomicService.findByContentHash(blob.contentHash());
        if (existing.isPresent()) {
            log.info("File '{}' duplicates file {} (hash {}); no new record created.", filename,
                     existing.get().getId(), blob.contentHash());
            return new IntakeResult(existing.get(), true);
        }

        final FileType fileType = fileTypeHint.filter(type -> type != FileType.UNKNOWN)
                                              .orElseGet(() -> FileType.infer(subject, filename));
        final BordereauxFile candidate = BordereauxFile.builder()
                                                      .filename(FilenameUtils.getName(filename))
                                                      .contentHash(blob.contentHash())
                                                      .fileSize(blob.size())
                                                      .sender(sender)
                                                      .subject(subject)
                                                      .fileType(fileType)
                                                      .status(FileStatus.RECEIVED)
                                                      .build();
        try {
            final BordereauxFile created = atomicService.attemptToCreate(candidate);
            log.info("Registered file {} '{}' from '{}' as {} ({} bytes).", created.getId(), created.getFilename(),
                     sender, fileType, blob.size());
            return new IntakeResult(created, false);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent registration of hash {} detected; returning the winning record.",
                     blob.contentHash());
            return atomicService.findByContentHash(blob.contentHash())
                                .map(winner -> new IntakeResult(winner, true))
                                .orElseThrow(() -> e);
        }
    }
}
