package com.github.collomatique.colloscope;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/** A solved colloscope: group members and, for every week, the group interrogated in each slot. */
public record Colloscope(Map<Group, List<Student>> members, Map<Week, Map<Slot, Group>> schedule) {

    public Colloscope {
        members = Map.copyOf(members);
        schedule = Map.copyOf(schedule);
    }

    public Optional<Group> groupOf(Student student, String subjectId) {
        return members.entrySet().stream()
                .filter(e -> e.getKey().subjectId().equals(subjectId) && e.getValue().contains(student))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public Optional<Group> groupIn(Slot slot, Week week) {
        return Optional.ofNullable(schedule.getOrDefault(week, Map.of()).get(slot));
    }

    /** One line per week, slots in the order of {@code data}. */
    public String render(ColloscopeData data) {
        var sb = new StringBuilder();
        for (var group : data.groups()) {
            var students = members.getOrDefault(group, List.of());
            if (!students.isEmpty()) {
                sb.append(group).append(": ")
                        .append(students.stream().map(Student::name).collect(Collectors.joining(", ")))
                        .append('\n');
            }
        }
        for (var week : data.weeks()) {
            sb.append(week).append(':');
            for (var slot : data.slots()) {
                sb.append(' ').append(slot).append('=').append(groupIn(slot, week).map(Group::toString).orElse("-"));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
