package io.idlequeue.engine;

import io.idlequeue.model.CombatData;
import io.idlequeue.model.CraftingData;
import io.idlequeue.model.Equipment;
import io.idlequeue.model.HarvestingData;
import io.idlequeue.model.PlayerCharacter;
import io.idlequeue.model.Prerequisite;
import io.idlequeue.model.ResourceRequirement;
import io.idlequeue.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public final class TaskValidator {
    private static final Logger log = LoggerFactory.getLogger(TaskValidator.class);
    static final int COMBAT_LEVEL_GRACE = 5;

    /**
     * True when the task may complete for this character. Never throws; unexpected errors count as invalid.
     */
    public boolean validate(Task task, PlayerCharacter character) {
        return check(task, character).valid();
    }

    public ValidationResult check(Task task, PlayerCharacter character) {
        try {
            if (task == null) {
                return ValidationResult.failed(List.of("Task is missing"));
            }
            if (character == null) {
                return ValidationResult.failed(List.of("Character not found for task " + task.id()));
            }
            List<String> errors = new ArrayList<>();
            for (Prerequisite prerequisite : task.prerequisites()) {
                if (!prerequisite.met()) {
                    errors.add("Prerequisite not met: " + prerequisite.description());
                }
            }
            switch (task.type()) {
                case HARVESTING -> checkHarvesting(task.activityData(HarvestingData.class), errors);
                case CRAFTING -> checkCrafting(task, task.activityData(CraftingData.class), errors);
                case COMBAT -> checkCombat(task.activityData(CombatData.class), character, errors);
            }
            if (!errors.isEmpty()) {
                log.warn("Task {} failed validation: {}", task.id(), errors);
                return ValidationResult.failed(errors);
            }
            return ValidationResult.ok();
        } catch (RuntimeException e) {
            log.warn("Validation of task {} failed unexpectedly", task == null ? null : task.id(), e);
            return ValidationResult.failed(List.of("Validation error: " + e.getMessage()));
        }
    }

    private void checkHarvesting(HarvestingData data, List<String> errors) {
        if (data.tools().isEmpty()) {
            errors.add("No tools available for harvesting");
        }
        if (data.location() != null) {
            for (Prerequisite requirement : data.location().requirements()) {
                if (!requirement.met()) {
                    errors.add("Location requirement not met: " + requirement.description());
                }
            }
        }
    }

    private void checkCrafting(Task task, CraftingData data, List<String> errors) {
        // Material shortfalls are reported but do not block completion.
        for (ResourceRequirement material : data.materials()) {
            if (!material.sufficient()) {
                log.info("Task {} short on {}: {}/{}", task.id(), material.resourceId(),
                        material.quantityAvailable(), material.quantityRequired());
            }
        }
        if (data.craftingStation() != null) {
            for (Prerequisite requirement : data.craftingStation().requirements()) {
                if (!requirement.met()) {
                    errors.add("Crafting station requirement not met: " + requirement.description());
                }
            }
        }
    }

    private void checkCombat(CombatData data, PlayerCharacter character, List<String> errors) {
        int minimumLevel = data.enemy().level() - COMBAT_LEVEL_GRACE;
        if (character.level() < minimumLevel) {
            errors.add("Character level " + character.level() + " is below " + minimumLevel + " for " + data.enemy().name());
        }
        for (Equipment piece : data.equipment()) {
            if (piece.broken()) {
                errors.add("Equipment broken: " + piece.itemId());
            }
        }
    }
}
