package com.deliverable.deliverable_parser.model.dto;

import com.deliverable.deliverable_parser.model.domain.ChatMode;

public record ChatModeResponse(
    String requested,
    ChatMode mode,
    boolean professional,
    boolean chainOfThought
) {}
