package com.workflow.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.core.DuplicatePolicy;
import com.workflow.core.ModelAction;
import com.workflow.core.Workflow;
import com.workflow.core.WorkflowRegistry;
import com.workflow.core.mold.FormulaBlueprint;
import com.workflow.core.mold.RecipeBlueprint;
import com.workflow.core.model.ModelSpec;
import com.workflow.core.recipe.Recipe;
import com.workflow.core.recipe.RecipeStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Builds an unfitted {@link Workflow} from a JSON definition:
 * <pre>{@code
 * {
 *   "workflow": "mpg_by_cyl",
 *   "duplicatePolicy": "replace_same_kind",
 *   "formula": "mpg ~ cyl",
 *   "blueprint": { "indicators": false },
 *   "model": { "type": "linear_reg", "engine": "lm", "mode": "regression" }
 * }
 * }</pre>
 * A recipe replaces {@code formula}/{@code blueprint} with
 * {@code "recipe": { "formula": "...", "steps": [ { "step": "name", "columns": [...] } ], "blueprint": {...} }}.
 * A blueprint that appears in the definition counts as caller-supplied and is never adjusted.
 */
public final class WorkflowJsonLoader {
    private static final Logger log = LoggerFactory.getLogger(WorkflowJsonLoader.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final Set<String> TOP_LEVEL_FIELDS = Set.of("workflow", "duplicatePolicy", "formula", "blueprint", "recipe", "model");
    private static final Set<String> FORMULA_BLUEPRINT_FIELDS = Set.of("intercept", "indicators", "allowNovelLevels");
    private static final Set<String> RECIPE_BLUEPRINT_FIELDS = Set.of("intercept", "allowNovelLevels");

    private WorkflowJsonLoader() {}

    public static Workflow load(InputStream in) throws IOException {
        return load(in, new WorkflowRegistry());
    }

    public static Workflow load(Path filePath, WorkflowRegistry registry) throws IOException {
        Objects.requireNonNull(filePath, "filePath");
        try (InputStream in = Files.newInputStream(filePath)) {
            return load(in, registry);
        }
    }

    public static Workflow load(InputStream in, WorkflowRegistry registry) throws IOException {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(registry, "registry");
        JsonNode root = OBJECT_MAPPER.readTree(in);
        if (root == null || !root.isObject()) throw new IOException("Workflow definition must be a JSON object");
        checkFields(root, TOP_LEVEL_FIELDS, "workflow definition");

        String name = root.path("workflow").asText(Workflow.DEFAULT_NAME);
        Workflow workflow;
        try {
            workflow = Workflow.named(name).withDuplicatePolicy(parsePolicy(root.get("duplicatePolicy")));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid workflow name: '" + name + "'", e);
        }

        boolean hasFormula = root.has("formula");
        boolean hasRecipe = root.has("recipe");
        if (hasFormula && hasRecipe) {
            throw new IOException("A workflow definition may declare 'formula' or 'recipe', not both");
        }
        if (hasRecipe && root.has("blueprint")) {
            throw new IOException("Top-level 'blueprint' applies to 'formula'; put recipe blueprints under 'recipe.blueprint'");
        }

        if (hasFormula) workflow = addFormula(workflow, root);
        if (hasRecipe) workflow = addRecipe(workflow, root.get("recipe"), registry);
        if (root.has("model")) workflow = addModel(workflow, root.get("model"), registry);

        log.debug("loaded {}", workflow);
        return workflow;
    }

    private static Workflow addFormula(Workflow workflow, JsonNode root) throws IOException {
        String formula = text(root.get("formula"), "formula");
        try {
            JsonNode blueprintNode = root.get("blueprint");
            if (blueprintNode == null || blueprintNode.isNull()) return workflow.addFormula(formula);
            return workflow.addFormula(formula, parseFormulaBlueprint(blueprintNode));
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private static Workflow addRecipe(Workflow workflow, JsonNode recipeNode, WorkflowRegistry registry) throws IOException {
        if (!recipeNode.isObject()) throw new IOException("'recipe' must be an object");
        checkFields(recipeNode, Set.of("formula", "steps", "blueprint"), "recipe");
        Recipe recipe;
        try {
            recipe = Recipe.of(text(recipeNode.get("formula"), "recipe.formula"));
            JsonNode stepsNode = recipeNode.get("steps");
            if (stepsNode != null && !stepsNode.isNull()) {
                if (!stepsNode.isArray()) throw new IOException("'recipe.steps' must be an array");
                for (JsonNode stepNode : stepsNode) {
                    recipe = recipe.addStep(parseStep(stepNode, registry));
                }
            }
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }

        JsonNode blueprintNode = recipeNode.get("blueprint");
        if (blueprintNode == null || blueprintNode.isNull()) return workflow.addRecipe(recipe);
        return workflow.addRecipe(recipe, parseRecipeBlueprint(blueprintNode));
    }

    private static RecipeStep parseStep(JsonNode stepNode, WorkflowRegistry registry) throws IOException {
        if (stepNode.isTextual()) return registry.createStep(stepNode.asText(), List.of());
        if (!stepNode.isObject()) throw new IOException("Each recipe step must be a string or an object");
        checkFields(stepNode, Set.of("step", "columns"), "recipe step");
        String stepName = text(stepNode.get("step"), "recipe.steps[].step");

        List<String> columns = new ArrayList<>();
        JsonNode columnsNode = stepNode.get("columns");
        if (columnsNode != null && !columnsNode.isNull()) {
            if (!columnsNode.isArray()) throw new IOException("'columns' of step '" + stepName + "' must be an array");
            for (JsonNode column : columnsNode) columns.add(text(column, "columns[]"));
        }
        return registry.createStep(stepName, columns);
    }

    private static Workflow addModel(Workflow workflow, JsonNode modelNode, WorkflowRegistry registry) throws IOException {
        if (!modelNode.isObject()) throw new IOException("'model' must be an object");
        checkFields(modelNode, Set.of("type", "engine", "mode", "role"), "model");
        String type = text(modelNode.get("type"), "model.type");
        String engine = optionalText(modelNode.get("engine"), "model.engine");
        String mode = optionalText(modelNode.get("mode"), "model.mode");
        String role = optionalText(modelNode.get("role"), "model.role");
        try {
            ModelSpec spec = registry.createModel(type, engine, mode);
            return workflow.addModel(spec, role == null ? ModelAction.DEFAULT_ROLE : role);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private static FormulaBlueprint parseFormulaBlueprint(JsonNode node) throws IOException {
        if (!node.isObject()) throw new IOException("'blueprint' must be an object");
        checkFields(node, FORMULA_BLUEPRINT_FIELDS, "formula blueprint");
        FormulaBlueprint defaults = FormulaBlueprint.defaults();
        return new FormulaBlueprint(
            bool(node, "intercept", defaults.intercept()),
            bool(node, "indicators", defaults.indicators()),
            bool(node, "allowNovelLevels", defaults.allowNovelLevels()));
    }

    private static RecipeBlueprint parseRecipeBlueprint(JsonNode node) throws IOException {
        if (!node.isObject()) throw new IOException("'recipe.blueprint' must be an object");
        checkFields(node, RECIPE_BLUEPRINT_FIELDS, "recipe blueprint");
        RecipeBlueprint defaults = RecipeBlueprint.defaults();
        return new RecipeBlueprint(
            bool(node, "intercept", defaults.intercept()),
            bool(node, "allowNovelLevels", defaults.allowNovelLevels()));
    }

    private static DuplicatePolicy parsePolicy(JsonNode node) throws IOException {
        if (node == null || node.isNull()) return DuplicatePolicy.REPLACE_SAME_KIND;
        String value = text(node, "duplicatePolicy");
        try {
            return DuplicatePolicy.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown duplicatePolicy: " + value, e);
        }
    }

    private static boolean bool(JsonNode node, String field, boolean fallback) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        if (!value.isBoolean()) throw new IOException("'" + field + "' must be a boolean");
        return value.booleanValue();
    }

    private static String text(JsonNode node, String field) throws IOException {
        if (node == null || node.isNull()) throw new IOException("'" + field + "' is required");
        if (!node.isTextual()) throw new IOException("'" + field + "' must be a string");
        return node.asText();
    }

    private static String optionalText(JsonNode node, String field) throws IOException {
        if (node == null || node.isNull()) return null;
        return text(node, field);
    }

    private static void checkFields(JsonNode node, Set<String> allowed, String where) throws IOException {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String field = names.next();
            if (!allowed.contains(field)) throw new IOException("Unknown field '" + field + "' in " + where);
        }
    }
}
