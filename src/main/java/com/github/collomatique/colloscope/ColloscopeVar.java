package com.github.collomatique.colloscope;

/** Boolean decisions of a colloscope. */
public sealed interface ColloscopeVar {

    /** {@code $StudentInGroup(student, group)}. */
    record StudentInGroup(Student student, Group group) implements ColloscopeVar {
        @Override
        public String toString() {
            return "StudentInGroup(" + student + ", " + group + ")";
        }
    }

    /** {@code $GroupInSlot(group, slot, week)}. */
    record GroupInSlot(Group group, Slot slot, Week week) implements ColloscopeVar {
        @Override
        public String toString() {
            return "GroupInSlot(" + group + ", " + slot + ", " + week + ")";
        }
    }
}
