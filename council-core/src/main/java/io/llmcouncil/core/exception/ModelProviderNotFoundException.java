package io.llmcouncil.core.exception;

import java.io.Serial;

/// Thrown when no registered model provider supports a requested model id.
///
/// The model gateway converts this into a failed call result; it never reaches the
/// council stages.
public class ModelProviderNotFoundException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3119276518650402851L;

    private final String modelId;

    public ModelProviderNotFoundException(String modelId) {
        super("No model provider supports model: " + modelId);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
