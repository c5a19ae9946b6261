package io.idlequeue.model;

import java.util.List;
import java.util.Objects;

public record CraftingData(
        Recipe recipe,
        List<ResourceRequirement> materials,
        CraftingStation craftingStation,
        int playerSkillLevel,
        List<ItemStack> expectedOutputs
) implements ActivityData {
    public CraftingData {
        Objects.requireNonNull(recipe, "recipe");
        materials = materials == null ? List.of() : List.copyOf(materials);
        expectedOutputs = expectedOutputs == null ? List.of() : List.copyOf(expectedOutputs);
    }

    @Override
    public TaskType taskType() {
        return TaskType.CRAFTING;
    }
}
