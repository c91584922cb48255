package com.deliverable.deliverable_parser.service;

import com.deliverable.deliverable_parser.model.domain.ChatMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Maps the chat mode sent by clients onto a canonical {@link ChatMode}.
 * Legacy names ("research", "calculate", "audit") are still accepted.
 * Blank or unknown values become STANDARD.
 */
@Slf4j
@Component
public class ChatModeNormalizer {

    private static final Map<String, ChatMode> ALIASES = Map.ofEntries(
        Map.entry("research",      ChatMode.DEEP_RESEARCH),
        Map.entry("calculate",     ChatMode.CALCULATION),
        Map.entry("audit",         ChatMode.AUDIT_PLAN),
        Map.entry("standard",      ChatMode.STANDARD),
        Map.entry("deep-research", ChatMode.DEEP_RESEARCH),
        Map.entry("checklist",     ChatMode.CHECKLIST),
        Map.entry("workflow",      ChatMode.WORKFLOW),
        Map.entry("audit-plan",    ChatMode.AUDIT_PLAN),
        Map.entry("calculation",   ChatMode.CALCULATION)
    );

    public ChatMode normalize(String chatMode) {
        if (chatMode == null || chatMode.isBlank()) return ChatMode.STANDARD;
        ChatMode mode = ALIASES.get(chatMode.trim().toLowerCase(Locale.ROOT));
        if (mode == null) {
            log.warn("Unknown chat mode '{}', defaulting to standard", chatMode);
            return ChatMode.STANDARD;
        }
        return mode;
    }
}
