package com.example.pharmacyrota.rota;

/**
 * Kind of duty an assignment row covers. The priority decides which work items get
 * scarce staff first when difficulty is tied: wards (including the acute
 * assessment unit) first, then dispensary, then clinics and ad hoc roles, then
 * management time.
 */
public enum AssignmentType {
    WARD(0),
    DISPENSARY(1),
    CLINIC(2),
    ROLE(2),
    MANAGEMENT(3);

    private final int priority;

    AssignmentType(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }
}
