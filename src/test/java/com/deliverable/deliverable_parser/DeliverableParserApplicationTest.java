package com.deliverable.deliverable_parser;

import com.deliverable.deliverable_parser.config.ParserProperties;
import com.deliverable.deliverable_parser.model.domain.WorkflowFormat;
import com.deliverable.deliverable_parser.service.DeliverableService;
import com.deliverable.deliverable_parser.synthesizer.EdgeStrategyRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.web.filter.CorsFilter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = "app.parser.max-parallel-branches=2")
public class DeliverableParserApplicationTest {

    @Autowired
    private ParserProperties properties;

    @Autowired
    private EdgeStrategyRegistry registry;

    @Autowired
    private DeliverableService deliverableService;

    @Autowired
    private CorsFilter corsFilter;

    @Test
    public void shouldWireEveryStrategyAndBindProperties() {
        for (WorkflowFormat format : WorkflowFormat.values()) {
            assertTrue(registry.isSupported(format));
        }
        assertEquals(2, properties.getMaxParallelBranches());
        assertEquals(50, properties.getLabelMaxLength());
        assertNotNull(corsFilter);
    }

    @Test
    public void shouldParseThroughWiredService() {
        long fanOut = deliverableService.parseWorkflow("1. a\n2. b\n3. c", "parallel").edges().stream()
                .filter(e -> e.source().equals("start"))
                .count();

        assertEquals(2, fanOut);
    }
}
