package com.workflow.core;

import com.workflow.core.model.LinearRegressionSpec;
import com.workflow.core.model.ModelSpec;
import com.workflow.core.recipe.RecipeStep;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name lookup for model types and recipe steps used by declarative workflow definitions.
 * {@code linear_reg} is registered by default.
 */
public final class WorkflowRegistry {
    private final Map<String, ModelFactory> models = new ConcurrentHashMap<>();
    private final Map<String, StepFactory> steps = new ConcurrentHashMap<>();

    public WorkflowRegistry() {
        registerModel(LinearRegressionSpec.TYPE, WorkflowRegistry::linearReg);
    }

    public void registerModel(String type, ModelFactory factory) {
        models.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(factory, "factory"));
    }

    public void registerStep(String name, StepFactory factory) {
        steps.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(factory, "factory"));
    }

    public boolean hasModel(String type) { return models.containsKey(type); }

    public boolean hasStep(String name) { return steps.containsKey(name); }

    public ModelSpec createModel(String type, String engine, String mode) {
        ModelFactory factory = models.get(type);
        if (factory == null) throw new IllegalArgumentException("Unknown model type: " + type);
        return Objects.requireNonNull(factory.create(engine, mode), "factory returned null for model type " + type);
    }

    public RecipeStep createStep(String name, List<String> columns) {
        StepFactory factory = steps.get(name);
        if (factory == null) throw new IllegalArgumentException("Unknown recipe step: " + name);
        return Objects.requireNonNull(factory.create(List.copyOf(columns)), "factory returned null for step " + name);
    }

    private static ModelSpec linearReg(String engine, String mode) {
        if (mode != null && !LinearRegressionSpec.MODE.equals(mode)) {
            throw new IllegalArgumentException("Mode '" + mode + "' is not available for " + LinearRegressionSpec.TYPE);
        }
        LinearRegressionSpec spec = LinearRegressionSpec.create();
        return engine == null ? spec : spec.withEngine(engine);
    }
}
