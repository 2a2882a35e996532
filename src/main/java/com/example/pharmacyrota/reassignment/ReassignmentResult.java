package com.example.pharmacyrota.reassignment;

import com.example.pharmacyrota.rota.AssignmentDto;

import java.util.List;

/**
 * @param updatedAssignments the stored rows of every document touched, after the change;
 *                           callers should replace any local copy with these
 */
public record ReassignmentResult(boolean success, List<DateOutcome> outcomes, List<AssignmentDto> updatedAssignments) {
}
