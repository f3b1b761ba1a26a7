package com.github.collomatique.colloscope;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import com.github.collomatique.eval.EvalObject;
import com.github.collomatique.eval.ObjectEnv;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Snapshot of a colloscope to build: subjects with their slots, students and the weeks to
 * schedule. Groups are derived from the subjects.
 */
@Getter
@Accessors(fluent = true)
@ToString
public final class ColloscopeData implements ObjectEnv {

    private final List<Subject> subjects;
    private final List<Slot> slots;
    private final List<Student> students;
    private final List<Week> weeks;
    @ToString.Exclude
    private final List<Group> groups;

    public ColloscopeData(List<Subject> subjects, List<Slot> slots, List<Student> students, int weekCount) {
        this.subjects = List.copyOf(subjects);
        this.slots = List.copyOf(slots);
        this.students = List.copyOf(students);
        List<Week> weeks = new ArrayList<>();
        for (int i = 1; i <= weekCount; i++) {
            weeks.add(new Week(i));
        }
        this.weeks = List.copyOf(weeks);
        List<Group> groups = new ArrayList<>();
        for (var subject : subjects) {
            for (int i = 1; i <= subject.groupCount(); i++) {
                groups.add(new Group(subject.id(), i));
            }
        }
        this.groups = List.copyOf(groups);
        validate();
    }

    private void validate() {
        var ids = new HashSet<String>();
        for (var subject : subjects) {
            if (!ids.add(subject.id())) {
                throw new IllegalArgumentException("duplicate subject " + subject.id());
            }
        }
        var slotIds = new HashSet<String>();
        for (var slot : slots) {
            if (!ids.contains(slot.subjectId())) {
                throw new IllegalArgumentException("slot " + slot.id() + " refers to unknown subject " + slot.subjectId());
            }
            if (!slotIds.add(slot.id())) {
                throw new IllegalArgumentException("duplicate slot " + slot.id());
            }
        }
        var studentIds = new HashSet<String>();
        for (var student : students) {
            if (!studentIds.add(student.id())) {
                throw new IllegalArgumentException("duplicate student " + student.id());
            }
            if (!ids.containsAll(student.subjectIds())) {
                throw new IllegalArgumentException("student " + student.id() + " follows an unknown subject");
            }
            student.fixedGroups().forEach((subjectId, number) -> {
                if (number < 1 || number > subject(subjectId).get().groupCount()) {
                    throw new IllegalArgumentException("student " + student.id() + " is placed in missing group "
                            + subjectId + "#" + number);
                }
            });
        }
    }

    public Optional<Subject> subject(String id) {
        return subjects.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    @Override
    public List<? extends EvalObject> objectsWithType(String typeName) {
        return switch (typeName) {
            case "Student" -> students;
            case "Subject" -> subjects;
            case "Group" -> groups;
            case "Slot" -> slots;
            case "Week" -> weeks;
            default -> List.of();
        };
    }
}
