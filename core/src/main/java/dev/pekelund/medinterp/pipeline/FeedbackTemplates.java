package dev.pekelund.medinterp.pipeline;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * User-facing discard messages keyed by template key. Every key used by {@link DiscardReason} must
 * be present.
 */
public record FeedbackTemplates(Map<String, String> messages) {

    public FeedbackTemplates {
        Map<String, String> copy = messages == null ? Map.of() : Map.copyOf(messages);
        List<String> missing = Arrays.stream(DiscardReason.values())
            .map(DiscardReason::templateKey)
            .distinct()
            .filter(key -> !StringUtils.hasText(copy.get(key)))
            .toList();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing feedback templates: " + missing);
        }
        messages = copy;
    }

    public String messageFor(DiscardReason reason) {
        return messages.get(reason.templateKey());
    }
}
