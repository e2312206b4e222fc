package dev.pekelund.medinterp.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FeedbackTemplatesTest {

    @Test
    void resolvesMessagesBySharedTemplateKey() {
        FeedbackTemplates templates = PipelineFixtures.FEEDBACK;

        assertThat(templates.messageFor(DiscardReason.VALIDATION_FAILURE))
            .isEqualTo(templates.messageFor(DiscardReason.LOW_EXTRACTION_CONFIDENCE))
            .startsWith("Only part of the report");
        assertThat(templates.messageFor(DiscardReason.LOW_NORMALIZATION_CONFIDENCE)).contains("missing units");
    }

    @Test
    void keepsItsOwnCopyOfTheMessages() {
        Map<String, String> source = new HashMap<>(PipelineFixtures.FEEDBACK.messages());
        FeedbackTemplates templates = new FeedbackTemplates(source);

        source.put("system_error", "changed");

        assertThat(templates.messageFor(DiscardReason.SYSTEM_ERROR)).isNotEqualTo("changed");
        assertThatThrownBy(() -> templates.messages().put("extra", "value"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsMissingOrBlankTemplates() {
        Map<String, String> incomplete = new HashMap<>(PipelineFixtures.FEEDBACK.messages());
        incomplete.remove("missing_units");
        incomplete.put("unsupported_type", "  ");

        assertThatThrownBy(() -> new FeedbackTemplates(incomplete))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing_units")
            .hasMessageContaining("unsupported_type");
        assertThatThrownBy(() -> new FeedbackTemplates(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
