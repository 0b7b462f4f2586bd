package com.al.clinicalsummary.extraction;

import com.al.clinicalsummary.model.EntityKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PromptLoaderTest {

    private final PromptLoader loader = new PromptLoader();

    @Test
    public void testLoad_EveryKindHasAPrompt() {
        for (EntityKind kind : EntityKind.values()) {
            ExtractionPrompt prompt = loader.load(kind);

            assertFalse(prompt.getSystem().isBlank(), kind.getWireName());
            assertFalse(prompt.getInstructions().isBlank(), kind.getWireName());
        }
    }

    @Test
    public void testLoad_InstructionsNameTheFields() {
        assertTrue(loader.load(EntityKind.FACILITY_TIMING).getInstructions().contains("admission_date"));
        assertTrue(loader.load(EntityKind.MEDICATION_RISK).getInstructions().contains("is_medication_related"));
    }
}
