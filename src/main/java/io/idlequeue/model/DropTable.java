package io.idlequeue.model;

import java.util.List;

public record DropTable(
        List<DropEntry> guaranteed,
        List<DropEntry> common,
        List<DropEntry> uncommon,
        List<DropEntry> rare
) {
    public DropTable {
        guaranteed = guaranteed == null ? List.of() : List.copyOf(guaranteed);
        common = common == null ? List.of() : List.copyOf(common);
        uncommon = uncommon == null ? List.of() : List.copyOf(uncommon);
        rare = rare == null ? List.of() : List.copyOf(rare);
    }

    public static DropTable empty() {
        return new DropTable(List.of(), List.of(), List.of(), List.of());
    }
}
