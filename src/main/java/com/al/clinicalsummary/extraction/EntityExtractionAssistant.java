package com.al.clinicalsummary.extraction;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * LLM-backed extraction call shared by all entity kinds. The per-kind prompt is passed in,
 * the answer is the raw JSON text.
 */
public interface EntityExtractionAssistant {

    @SystemMessage("{{system}}")
    @UserMessage("""
            {{instructions}}

            ---
            CLINICAL DOCUMENT:
            {{document}}
            """)
    String extract(@V("system") String system,
            @V("instructions") String instructions,
            @V("document") String document);
}
