package io.routedoc.core.model;

import io.routedoc.core.schema.TypeId;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of a conformance run: one section per payload type, in the order the types are first
 * reached in the route tree.
 */
public record ConformanceReport(List<ConformanceSection> sections) {

    public ConformanceReport {
        sections = List.copyOf(sections);
    }

    public boolean passed() {
        return sections.stream().allMatch(ConformanceSection::passed);
    }

    public List<ConformanceSection> failures() {
        return sections.stream().filter(section -> !section.passed()).collect(Collectors.toList());
    }

    public Optional<ConformanceSection> section(TypeId type) {
        return sections.stream().filter(section -> section.type().equals(type)).findFirst();
    }
}
