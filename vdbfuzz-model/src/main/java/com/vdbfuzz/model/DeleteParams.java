package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Parameters for delete: the ids to remove, which may include ids that were never inserted. */
public final class DeleteParams implements OperationParams {

    private final List<String> ids;

    @JsonCreator
    public DeleteParams(@JsonProperty("ids") List<String> ids) {
        this.ids = ids != null ? Collections.unmodifiableList(new ArrayList<>(ids)) : List.of();
    }

    public List<String> getIds() {
        return ids;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return ids.equals(((DeleteParams) o).ids);
    }

    @Override
    public int hashCode() {
        return ids.hashCode();
    }

    @Override
    public String toString() {
        return "DeleteParams{ids=" + ids.size() + "}";
    }
}
