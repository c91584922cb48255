package com.deliverable.deliverable_parser.model.parse;

/**
 * Where a workflow graph comes from: JSON the model emitted directly, or free text
 * that has to go through step extraction. Implementations are validated before use.
 */
public interface WorkflowSource {
}
