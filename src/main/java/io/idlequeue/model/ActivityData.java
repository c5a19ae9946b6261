package io.idlequeue.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Activity-specific payload of a {@link Task}. Exactly one implementation exists per {@link TaskType}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = HarvestingData.class, name = "harvesting"),
        @JsonSubTypes.Type(value = CraftingData.class, name = "crafting"),
        @JsonSubTypes.Type(value = CombatData.class, name = "combat")
})
public interface ActivityData {
    @JsonIgnore
    TaskType taskType();
}
