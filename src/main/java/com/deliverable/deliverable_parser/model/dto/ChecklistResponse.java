package com.deliverable.deliverable_parser.model.dto;

import com.deliverable.deliverable_parser.model.domain.ChecklistProgress;
import com.deliverable.deliverable_parser.model.domain.ChecklistSection;

import java.util.List;

public record ChecklistResponse(
    List<ChecklistSection> sections,
    ChecklistProgress progress
) {}
