package com.deliverable.deliverable_parser.controller;

import com.deliverable.deliverable_parser.model.domain.ChatMode;
import com.deliverable.deliverable_parser.model.domain.ParsedWorkflow;
import com.deliverable.deliverable_parser.model.dto.ChatModeResponse;
import com.deliverable.deliverable_parser.model.dto.ChecklistResponse;
import com.deliverable.deliverable_parser.model.dto.DeliverableRequest;
import com.deliverable.deliverable_parser.model.dto.VisualizationData;
import com.deliverable.deliverable_parser.service.ChatModeNormalizer;
import com.deliverable.deliverable_parser.service.DeliverableService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/deliverables")
@RequiredArgsConstructor
public class DeliverableController {

    private final DeliverableService deliverableService;
    private final ChatModeNormalizer chatModeNormalizer;

    @PostMapping("/workflow")
    public ParsedWorkflow parseWorkflow(@RequestBody DeliverableRequest request) {
        return deliverableService.parseWorkflow(request.text(), request.format());
    }

    // 204 when the chat mode is not "workflow"
    @PostMapping("/visualization")
    public ResponseEntity<VisualizationData> visualize(@RequestBody DeliverableRequest request) {
        return deliverableService.generateWorkflowVisualization(request.text(), request.chatMode(), request.format())
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/checklist")
    public ChecklistResponse parseChecklist(@RequestBody DeliverableRequest request) {
        return deliverableService.parseChecklist(request.text());
    }

    @PostMapping("/chat-mode/normalize")
    public ChatModeResponse normalizeChatMode(@RequestBody Map<String, String> body) {
        String requested = body != null ? body.get("chatMode") : null;
        ChatMode mode = chatModeNormalizer.normalize(requested);
        return new ChatModeResponse(
                requested,
                mode,
                mode.isProfessional(),
                mode.usesChainOfThought());
    }
}
