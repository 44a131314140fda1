package io.llmcouncil.core.council;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Bijective mapping between anonymous labels and model ids for one ranking round.
///
/// `Response A` is assigned to the first answer, `Response B` to the second, and so on,
/// in Stage 1 result order.
public final class LabelMap {

    private final Map<String, String> labelToModel;
    private final Map<String, String> modelToLabel;

    private LabelMap(Map<String, String> labelToModel) {
        this.labelToModel = Collections.unmodifiableMap(labelToModel);
        Map<String, String> inverse = new LinkedHashMap<>();
        labelToModel.forEach((label, model) -> inverse.put(model, label));
        this.modelToLabel = Collections.unmodifiableMap(inverse);
    }

    /// Assigns labels to answers in the given order.
    ///
    /// @param answers Stage 1 answers with distinct model ids, not null
    /// @return the mapping, never null
    /// @throws IllegalArgumentException if model ids repeat or there are more than 26 answers
    public static LabelMap assign(List<ModelAnswer> answers) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (int i = 0; i < answers.size(); i++) {
            String modelId = answers.get(i).modelId();
            if (mapping.containsValue(modelId)) {
                throw new IllegalArgumentException("Duplicate model in round: " + modelId);
            }
            mapping.put(label(i), modelId);
        }
        return new LabelMap(mapping);
    }

    /// Returns the label for a zero-based position, e.g. `label(2)` is `"Response C"`.
    ///
    /// @throws IllegalArgumentException if the index is outside `0..25`
    public static String label(int index) {
        if (index < 0 || index >= 26) {
            throw new IllegalArgumentException("Label index out of range: " + index);
        }
        return "Response " + (char) ('A' + index);
    }

    /// Labels in assignment order.
    public List<String> labels() {
        return new ArrayList<>(labelToModel.keySet());
    }

    public Optional<String> modelFor(String label) {
        return Optional.ofNullable(labelToModel.get(label));
    }

    public Optional<String> labelFor(String modelId) {
        return Optional.ofNullable(modelToLabel.get(modelId));
    }

    /// Label to model id, in label order.
    public Map<String, String> asMap() {
        return labelToModel;
    }

    public int size() {
        return labelToModel.size();
    }
}
