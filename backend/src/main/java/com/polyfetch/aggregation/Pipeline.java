package com.polyfetch.aggregation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered, non-empty, immutable sequence of {@link Stage}s. Execution order is declaration order.
 * <p>
 * Only structural checks happen here. Whether the referenced fields exist is decided by the store at execution
 * time, since documents carry no schema.
 */
public final class Pipeline {

    private final List<Stage> stages;

    private Pipeline(List<Stage> stages) {
        this.stages = List.copyOf(stages);
    }

    public static Pipeline of(Stage first, Stage... rest) {
        List<Stage> all = new ArrayList<>(1 + rest.length);
        all.add(Objects.requireNonNull(first, "first stage"));
        for (Stage s : rest) {
            all.add(Objects.requireNonNull(s, "stage"));
        }
        return new Pipeline(all);
    }

    /**
     * New pipeline with {@code stage} appended; this instance is unchanged.
     */
    public Pipeline append(Stage stage) {
        Objects.requireNonNull(stage, "stage");
        List<Stage> next = new ArrayList<>(stages);
        next.add(stage);
        return new Pipeline(next);
    }

    public List<Stage> stages() {
        return stages;
    }

    public int size() {
        return stages.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pipeline other)) return false;
        return stages.equals(other.stages);
    }

    @Override
    public int hashCode() {
        return stages.hashCode();
    }

    @Override
    public String toString() {
        return stages.stream().map(Stage::name).collect(Collectors.joining(" -> ", "Pipeline[", "]"));
    }
}
