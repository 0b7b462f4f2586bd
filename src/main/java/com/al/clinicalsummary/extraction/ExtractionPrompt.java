package com.al.clinicalsummary.extraction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * System and user instructions for one entity kind, loaded from {@code prompts/<kind>.yml}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionPrompt {
    private String system;
    private String instructions;
}
