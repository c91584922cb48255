package com.deliverable.deliverable_parser.synthesizer;

import com.deliverable.deliverable_parser.model.domain.WorkflowFormat;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class EdgeStrategyRegistry {

    private final Map<WorkflowFormat, EdgeStrategy> registry = new EnumMap<>(WorkflowFormat.class);

    public EdgeStrategyRegistry(List<EdgeStrategy> strategies) {
        strategies.forEach(strategy -> registry.put(strategy.supportedFormat(), strategy));
    }

    public EdgeStrategy get(WorkflowFormat format) {
        EdgeStrategy strategy = registry.get(format);
        if (strategy == null) {
            throw new IllegalArgumentException("No edge strategy registered for format: " + format);
        }
        return strategy;
    }

    public boolean isSupported(WorkflowFormat format) {
        return registry.containsKey(format);
    }
}
