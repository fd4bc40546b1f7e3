package com.eyelevel.bordereaux.service.template;

import com.eyelevel.bordereaux.common.json.JsonParser;
import com.eyelevel.bordereaux.config.BordereauxProcessingConfig;
import com.eyelevel.bordereaux.dto.template.TemplateDocument;
import com.eyelevel.bordereaux.exception.TemplateDefinitionException;
import com.eyelevel.bordereaux.exception.json.JsonParsingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Seeds the template catalog at startup from the JSON documents found at
 * {@code app.processing.templates.seed-location}. Templates whose identifier already exists are left alone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemplateCatalogLoader implements ApplicationRunner {

    private final TemplateService templateService;
    private final JsonParser jsonParser;
    private final ResourcePatternResolver resourcePatternResolver;
    private final BordereauxProcessingConfig processingConfig;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        final BordereauxProcessingConfig.Templates templates = processingConfig.getTemplates();
        if (!templates.isSeedOnStartup()) {
            log.info("Template seeding is disabled.");
            return;
        }
        final Resource[] resources = resourcePatternResolver.getResources(templates.getSeedLocation());
        Arrays.sort(resources, Comparator.comparing(resource -> String.valueOf(resource.getFilename())));

        int created = 0;
        int skipped = 0;
        for (final Resource resource : resources) {
            if (seed(resource)) {
                created++;
            } else {
                skipped++;
            }
        }
        log.info("Template catalog seeded from {}: {} created, {} already present.", templates.getSeedLocation(),
                 created, skipped);
    }

    /**
     * @return {@code true} if a new template was created.
     */
    boolean seed(final Resource resource) throws IOException {
        final TemplateDocument document;
        try {
            document = jsonParser.parseObject(resource.getContentAsByteArray(), TemplateDocument.class);
        } catch (JsonParsingException e) {
            throw new TemplateDefinitionException("Malformed template document " + resource.getDescription(), e);
        }
        if (document.getTemplateId() != null && templateService.exists(document.getTemplateId().trim())) {
            log.debug("Template '{}' already exists; {} skipped.", document.getTemplateId(),
                      resource.getFilename());
            return false;
        }
        templateService.create(document);
        return true;
    }
}
