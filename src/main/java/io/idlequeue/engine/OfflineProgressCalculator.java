package io.idlequeue.engine;

import io.idlequeue.config.EngineSettings;
import io.idlequeue.model.CharacterStats;
import io.idlequeue.model.CurrentActivity;
import io.idlequeue.model.ItemStack;
import io.idlequeue.model.PlayerCharacter;
import io.idlequeue.model.Specialization;
import io.idlequeue.model.TaskType;
import io.idlequeue.observability.AuditLogger;
import io.idlequeue.storage.CharacterDelta;
import io.idlequeue.storage.CharacterDelta.SkillCategory;
import io.idlequeue.storage.CharacterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Credits a returning player for the time spent away, based on the activity the character was doing when it left.
 * Uses its own per-minute rates; the reward engine's per-task formulas are not involved.
 */
public final class OfflineProgressCalculator {
    private static final Logger log = LoggerFactory.getLogger(OfflineProgressCalculator.class);
    private static final long MS_PER_MINUTE = 60_000L;

    private static final Set<String> HARVESTING_SKILLS = Set.of("mining", "herbalism", "scavenging");
    private static final Set<String> CRAFTING_SKILLS = Set.of("clockmaking", "engineering", "alchemy");
    private static final Set<String> COMBAT_SKILLS = Set.of("melee", "ranged", "defense");

    static final List<FoundItem> CRAFTING_FINDS = List.of(new FoundItem("clockwork_trinket", "Clockwork Trinket"));
    static final List<FoundItem> HARVESTING_FINDS = List.of(
            new FoundItem("steam_crystals", "Steam Crystals"),
            new FoundItem("copper_gears", "Copper Gears"),
            new FoundItem("iron_pipes", "Iron Pipes")
    );
    static final List<FoundItem> COMBAT_FINDS = List.of(
            new FoundItem("mechanical_sword", "Mechanical Sword"),
            new FoundItem("steam_powered_shield", "Steam-Powered Shield"),
            new FoundItem("brass_knuckles", "Brass Knuckles")
    );

    private final CharacterStore characters;
    private final EngineSettings settings;
    private final Clock clock;
    private final DoubleSupplier random;
    private final AuditLogger audit;

    public OfflineProgressCalculator(CharacterStore characters, EngineSettings settings, Clock clock, AuditLogger audit) {
        this(characters, settings, clock, () -> ThreadLocalRandom.current().nextDouble(), audit);
    }

    public OfflineProgressCalculator(
            CharacterStore characters,
            EngineSettings settings,
            Clock clock,
            DoubleSupplier random,
            AuditLogger audit
    ) {
        this.characters = characters;
        this.settings = settings;
        this.clock = clock;
        this.random = random;
        this.audit = audit;
    }

    /**
     * Computes and applies offline progress for {@code userId}. Nothing is written when less than a full minute
     * has passed or the character had no activity.
     *
     * @throws IllegalArgumentException when the character does not exist
     */
    public OfflineResult calculate(String userId) {
        PlayerCharacter character = characters.get(userId)
                .orElseThrow(() -> new IllegalArgumentException("Character not found: " + userId));
        long now = clock.millis();
        long elapsedMinutes = Math.max(0L, now - character.lastActiveAt()) / MS_PER_MINUTE;
        if (elapsedMinutes < 1) {
            return OfflineResult.none(0, "No offline progress: away for less than a minute");
        }
        CurrentActivity activity = character.currentActivity();
        if (activity == null || activity.type() == null) {
            return OfflineResult.none(0, "No offline progress: no activity in progress");
        }
        int minutes = (int) Math.min(elapsedMinutes, settings.offlineCapMinutes());
        OfflineProgress progress = compute(character, activity, minutes);

        List<ItemStack> items = new ArrayList<>();
        for (FoundItem found : progress.foundItems()) {
            items.add(new ItemStack(found.itemId(), 1));
        }
        List<CharacterDelta.SkillGain> skills = new ArrayList<>();
        for (Map.Entry<String, Integer> gain : progress.skillsGained().entrySet()) {
            skills.add(new CharacterDelta.SkillGain(skillCategory(gain.getKey(), activity.type()), gain.getKey(), gain.getValue()));
        }
        CharacterDelta delta = new CharacterDelta(progress.experienceGained(), progress.currencyGained(), skills,
                progress.specializationProgress(), items, now);
        if (!characters.apply(userId, delta, now)) {
            throw new IllegalArgumentException("Character not found: " + userId);
        }
        audit(userId, minutes, progress);
        log.info("Applied {} offline minutes of {} for {}: +{} xp, +{} currency, {} items", minutes,
                activity.type().wireName(), userId, progress.experienceGained(), progress.currencyGained(),
                progress.foundItems().size());
        return new OfflineResult(minutes, progress, "Offline progress applied");
    }

    OfflineProgress compute(PlayerCharacter character, CurrentActivity activity, int minutes) {
        CharacterStats stats = character.stats();
        double rate = 1.0 + character.level() * 0.1;
        TaskType type = activity.type();
        String subType = activity.subType() == null || activity.subType().isBlank() ? null : activity.subType();

        long experience;
        long currency;
        String skill;
        int skillGain;
        Specialization specialization;
        double findChance;
        List<FoundItem> table;
        switch (type) {
            case CRAFTING -> {
                experience = (long) Math.floor(minutes * rate * 1.2);
                currency = (long) Math.floor(minutes * rate * 0.8);
                skill = subType == null ? "clockmaking" : subType;
                skillGain = (int) Math.floor(minutes * rate * 0.5);
                int dps = (int) Math.floor(minutes * (stats.intelligence() / 100.0) * 0.3);
                specialization = new Specialization(0, 0, dps);
                findChance = Math.min(0.8, minutes * 0.01);
                table = CRAFTING_FINDS;
            }
            case HARVESTING -> {
                experience = (long) Math.floor(minutes * rate);
                currency = (long) Math.floor(minutes * rate * 0.6);
                skill = subType == null ? "mining" : subType;
                skillGain = (int) Math.floor(minutes * rate * 0.6);
                int healer = (int) Math.floor(minutes * (stats.dexterity() / 100.0) * 0.2);
                specialization = new Specialization(0, healer, 0);
                findChance = Math.min(0.9, minutes * 0.02);
                table = HARVESTING_FINDS;
            }
            case COMBAT -> {
                experience = (long) Math.floor(minutes * rate * 1.5);
                currency = (long) Math.floor(minutes * rate);
                skill = subType == null ? "melee" : subType;
                skillGain = (int) Math.floor(minutes * rate * 0.4);
                int tank = (int) Math.floor(minutes * ((stats.strength() + stats.vitality()) / 200.0) * 0.4);
                int dps = (int) Math.floor(minutes * ((stats.strength() + stats.dexterity()) / 200.0) * 0.3);
                specialization = new Specialization(tank, 0, dps);
                findChance = Math.min(0.7, minutes * 0.015);
                table = COMBAT_FINDS;
            }
            default -> throw new IllegalArgumentException("Unsupported activity type: " + type);
        }

        List<FoundItem> found = new ArrayList<>();
        if (random.getAsDouble() < findChance) {
            int index = Math.min(table.size() - 1, (int) Math.floor(random.getAsDouble() * table.size()));
            found.add(table.get(index));
        }
        Map<String, Integer> skills = new LinkedHashMap<>();
        if (skillGain > 0) {
            skills.put(skill, skillGain);
        }
        int newLevel = Math.max(character.level(), PlayerCharacter.levelForExperience(character.experience() + experience));
        List<String> messages = messages(minutes, type, experience, currency, skills, specialization, found,
                newLevel > character.level() ? newLevel : 0);
        return new OfflineProgress(experience, currency, skills, specialization, found, messages, newLevel);
    }

    static SkillCategory skillCategory(String skill, TaskType activity) {
        if (HARVESTING_SKILLS.contains(skill)) {
            return SkillCategory.HARVESTING;
        }
        if (CRAFTING_SKILLS.contains(skill)) {
            return SkillCategory.CRAFTING;
        }
        if (COMBAT_SKILLS.contains(skill)) {
            return SkillCategory.COMBAT;
        }
        return switch (activity) {
            case HARVESTING -> SkillCategory.HARVESTING;
            case CRAFTING -> SkillCategory.CRAFTING;
            case COMBAT -> SkillCategory.COMBAT;
        };
    }

    private static List<String> messages(
            int minutes,
            TaskType type,
            long experience,
            long currency,
            Map<String, Integer> skills,
            Specialization specialization,
            List<FoundItem> found,
            int levelReached
    ) {
        List<String> out = new ArrayList<>();
        out.add("While you were away for " + describe(minutes) + ", your character kept " + verb(type) + ".");
        if (experience > 0) {
            out.add("Gained " + experience + " experience.");
        }
        if (currency > 0) {
            out.add("Earned " + currency + " currency.");
        }
        for (Map.Entry<String, Integer> skill : skills.entrySet()) {
            out.add(capitalize(skill.getKey()) + " skill improved by " + skill.getValue() + ".");
        }
        if (specialization.tankProgress() > 0) {
            out.add("Tank specialization +" + specialization.tankProgress() + ".");
        }
        if (specialization.healerProgress() > 0) {
            out.add("Healer specialization +" + specialization.healerProgress() + ".");
        }
        if (specialization.dpsProgress() > 0) {
            out.add("DPS specialization +" + specialization.dpsProgress() + ".");
        }
        for (FoundItem item : found) {
            out.add("Found " + item.name() + "!");
        }
        if (levelReached > 0) {
            out.add("Reached level " + levelReached + "!");
        }
        return out;
    }

    private static String describe(int minutes) {
        if (minutes < 60) {
            return minutes + (minutes == 1 ? " minute" : " minutes");
        }
        int hours = minutes / 60;
        int rest = minutes % 60;
        String h = hours + (hours == 1 ? " hour" : " hours");
        return rest == 0 ? h : h + " " + rest + (rest == 1 ? " minute" : " minutes");
    }

    private static String verb(TaskType type) {
        return switch (type) {
            case HARVESTING -> "harvesting";
            case CRAFTING -> "crafting";
            case COMBAT -> "fighting";
        };
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private void audit(String userId, int minutes, OfflineProgress progress) {
        if (audit == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("minutes", minutes);
        details.put("experience", progress.experienceGained());
        details.put("currency", progress.currencyGained());
        details.put("items", progress.itemsFound());
        try {
            audit.log(AuditLogger.AuditEvent.of("offline.apply", userId, null, "applied", details));
        } catch (RuntimeException e) {
            log.warn("Failed to write offline audit row for {}", userId, e);
        }
    }

    public record FoundItem(String itemId, String name) {
    }

    public record OfflineProgress(
            long experienceGained,
            long currencyGained,
            Map<String, Integer> skillsGained,
            Specialization specializationProgress,
            List<FoundItem> foundItems,
            List<String> notifications,
            int newLevel
    ) {
        public OfflineProgress {
            skillsGained = Map.copyOf(skillsGained);
            foundItems = List.copyOf(foundItems);
            notifications = List.copyOf(notifications);
        }

        public List<String> itemsFound() {
            List<String> names = new ArrayList<>();
            for (FoundItem item : foundItems) {
                names.add(item.name());
            }
            return names;
        }
    }

    /**
     * Outcome of a catch-up. {@code progress} is null when nothing was credited.
     */
    public record OfflineResult(int offlineMinutes, OfflineProgress progress, String message) {
        static OfflineResult none(int minutes, String message) {
            return new OfflineResult(minutes, null, message);
        }

        public boolean hasProgress() {
            return progress != null;
        }
    }
}
