package com.eyelevel.bordereaux.service.template;

import com.eyelevel.bordereaux.dto.proposal.request.ApproveProposalRequest;
import com.eyelevel.bordereaux.dto.template.TemplateDocument;
import com.eyelevel.bordereaux.exception.TemplateDefinitionException;
import com.eyelevel.bordereaux.exception.apiclient.ConflictException;
import com.eyelevel.bordereaux.exception.apiclient.NotFoundException;
import com.eyelevel.bordereaux.model.FileType;
import com.eyelevel.bordereaux.model.MappingProposal;
import com.eyelevel.bordereaux.model.ReviewStatus;
import com.eyelevel.bordereaux.model.Template;
import com.eyelevel.bordereaux.model.canonical.CanonicalField;
import com.eyelevel.bordereaux.repository.MappingProposalRepository;
import com.eyelevel.bordereaux.repository.TemplateRepository;
import com.eyelevel.bordereaux.service.matching.HeaderNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The template catalog. Templates are only ever added: a changed layout or an approved proposal becomes a new
 * template with its own identifier.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateService {

    private final TemplateRepository templateRepository;
    private final MappingProposalRepository proposalRepository;

    @Transactional(readOnly = true)
    public List<Template> listActive(final Optional<FileType> fileType) {
        return fileType.map(templateRepository::findByActiveTrueAndFileTypeOrderByTemplateIdAsc)
                       .orElseGet(templateRepository::findByActiveTrueOrderByTemplateIdAsc);
    }

    @Transactional(readOnly = true)
    public boolean exists(final String templateId) {
        return templateRepository.existsById(templateId);
    }

    /**
     * Validates a template document and stores it as a new active template.
     *
     * @throws TemplateDefinitionException if the document is incomplete or its mappings are unusable
     * @throws ConflictException           if a template with the same identifier already exists
     */
    @Transactional
    public Template create(final TemplateDocument document) {
        final Template template = toTemplate(document);
        if (templateRepository.existsById(template.getTemplateId())) {
            throw new ConflictException("Template '" + template.getTemplateId() + "' already exists.");
        }
        final Template saved = templateRepository.saveAndFlush(template);
        log.info("Created template '{}' ({}, {} column mappings).", saved.getTemplateId(), saved.getFileType(),
                 saved.getColumnMappings().size());
        return saved;
    }

    /**
     * Creates a template from a pending proposal and marks the proposal APPROVED, in one transaction. The
     * request's column mappings are applied on top of the proposal's mapped columns.
     *
     * @throws NotFoundException   if the proposal does not exist
     * @throws ConflictException   if the proposal was already reviewed or the template identifier is taken
     */
    @Transactional
    public Template createFromProposal(final Long proposalId, final ApproveProposalRequest request) {
        final MappingProposal proposal = proposalRepository.findById(proposalId).orElseThrow(
                () -> new NotFoundException("Mapping proposal with ID " + proposalId + " not found."));
        if (proposal.getReviewStatus() != ReviewStatus.PENDING) {
            throw new ConflictException("Mapping proposal " + proposalId + " was already reviewed ("
                                        + proposal.getReviewStatus() + ").");
        }

        final LinkedHashMap<String, String> mappings = new LinkedHashMap<>(proposal.mappedColumns());
        if (request.getColumnMappings() != null) {
            request.getColumnMappings().forEach((header, field) -> {
                if (field == null || field.isBlank()) {
                    mappings.remove(header);
                } else {
                    mappings.put(header, field.trim());
                }
            });
        }

        final Template template = create(TemplateDocument.builder()
                                                         .templateId(request.getTemplateId())
                                                         .name(request.getName())
                                                         .carrier(request.getCarrier())
                                                         .fileType(request.getFileType())
                                                         .columnMappings(mappings)
                                                         .build());

        final int updated = proposalRepository.reviewIfPending(proposalId, ReviewStatus.APPROVED,
                                                               template.getTemplateId(), ReviewStatus.PENDING,
                                                               LocalDateTime.now());
        if (updated != 1) {
            throw new ConflictException("Mapping proposal " + proposalId + " was reviewed concurrently.");
        }
        log.info("Approved mapping proposal {} as template '{}'.", proposalId, template.getTemplateId());
        return template;
    }

    Template toTemplate(final TemplateDocument document) {
        if (document.getTemplateId() == null || document.getTemplateId().isBlank()) {
            throw new TemplateDefinitionException("Template identifier is required.");
        }
        final String templateId = document.getTemplateId().trim();
        if (document.getName() == null || document.getName().isBlank()) {
            throw new TemplateDefinitionException("Template '" + templateId + "' has no name.");
        }
        final FileType fileType = FileType.fromCode(document.getFileType());
        if (fileType == FileType.UNKNOWN) {
            throw new TemplateDefinitionException(String.format(
                    "Template '%s' has file type '%s'; expected claims, premium or exposure.", templateId,
                    document.getFileType()));
        }
        final Map<String, String> mappings = document.getColumnMappings();
        if (mappings == null || mappings.isEmpty()) {
            throw new TemplateDefinitionException("Template '" + templateId + "' has no column mappings.");
        }

        final Map<String, String> seenKeys = new HashMap<>();
        final LinkedHashMap<String, String> validated = new LinkedHashMap<>();
        mappings.forEach((rawHeader, fieldName) -> {
            final String key = HeaderNormalizer.normalize(rawHeader);
            if (key.isEmpty()) {
                throw new TemplateDefinitionException(
                        "Template '" + templateId + "' maps a blank header to '" + fieldName + "'.");
            }
            final String previous = seenKeys.putIfAbsent(key, rawHeader);
            if (previous != null) {
                throw new TemplateDefinitionException(String.format(
                        "Template '%s' maps both '%s' and '%s', which normalize to the same header '%s'.",
                        templateId, previous, rawHeader, key));
            }
            if (!CanonicalField.isKnown(fieldName)) {
                throw new TemplateDefinitionException(String.format(
                        "Template '%s' maps '%s' to unknown canonical field '%s'.", templateId, rawHeader,
                        fieldName));
            }
            validated.put(rawHeader, fieldName.trim());
        });
        if (!validated.containsValue(CanonicalField.POLICY_NUMBER.getFieldName())) {
            throw new TemplateDefinitionException(String.format(
                    "Template '%s' does not map any header to '%s'.", templateId,
                    CanonicalField.POLICY_NUMBER.getFieldName()));
        }

        return Template.builder()
                       .templateId(templateId)
                       .name(document.getName().trim())
                       .carrier(document.getCarrier())
                       .fileType(fileType)
                       .columnMappings(validated)
                       .version(document.getVersion() == null ? 1 : document.getVersion())
                       .active(document.getActive() == null || document.getActive())
                       .build();
    }
}
