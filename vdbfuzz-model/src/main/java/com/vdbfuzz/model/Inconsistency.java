package com.vdbfuzz.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A classified disagreement between services on one test case. Severity follows the kind. */
@JsonPropertyOrder({"kind", "rule", "severity", "servicesInvolved", "description"})
@JsonIgnoreProperties(value = {"severity"}, allowGetters = true)
public final class Inconsistency {

    private final InconsistencyKind kind;
    private final DivergenceRule rule;
    private final List<String> servicesInvolved;
    private final String description;

    @JsonCreator
    public Inconsistency(
            @JsonProperty("kind") InconsistencyKind kind,
            @JsonProperty("rule") DivergenceRule rule,
            @JsonProperty("servicesInvolved") List<String> servicesInvolved,
            @JsonProperty("description") String description) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.rule = Objects.requireNonNull(rule, "rule");
        this.servicesInvolved = servicesInvolved != null ? List.copyOf(servicesInvolved) : List.of();
        this.description = description != null ? description : "";
    }

    public InconsistencyKind getKind() {
        return kind;
    }

    public DivergenceRule getRule() {
        return rule;
    }

    public Severity getSeverity() {
        return kind.getSeverity();
    }

    public List<String> getServicesInvolved() {
        return servicesInvolved;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Inconsistency that = (Inconsistency) o;
        return kind == that.kind && rule == that.rule
                && servicesInvolved.equals(that.servicesInvolved) && description.equals(that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, rule, servicesInvolved, description);
    }

    @Override
    public String toString() {
        return kind.getWireName() + "/" + rule.getWireName() + " " + servicesInvolved + ": " + description;
    }
}
