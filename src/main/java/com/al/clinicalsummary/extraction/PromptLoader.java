package com.al.clinicalsummary.extraction;

import com.al.clinicalsummary.model.EntityKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads extraction prompts from the classpath.
 */
@Component
@Slf4j
public class PromptLoader {

    private static final String PROMPT_LOCATION = "prompts/%s.yml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ExtractionPrompt load(EntityKind kind) {
        String location = String.format(PROMPT_LOCATION, kind.getWireName());
        Resource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("No prompt found for " + kind.getWireName() + " at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            ExtractionPrompt prompt = yamlMapper.readValue(in, ExtractionPrompt.class);
            if (isBlank(prompt.getSystem()) || isBlank(prompt.getInstructions())) {
                throw new IllegalStateException("Prompt " + location + " must define 'system' and 'instructions'");
            }
            log.debug("Prompt loaded for {} from {}", kind.getWireName(), location);
            return prompt;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read prompt " + location, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
