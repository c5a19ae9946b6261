package io.idlequeue.model;

public record HarvestingActivity(String activityId, String name, String category, DropTable dropTable) {
    public HarvestingActivity {
        dropTable = dropTable == null ? DropTable.empty() : dropTable;
    }
}
