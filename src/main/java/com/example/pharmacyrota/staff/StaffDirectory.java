package com.example.pharmacyrota.staff;

import com.example.pharmacyrota.exception.RotaNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only access to staff records as immutable snapshots.
 */
@Service
@Transactional(readOnly = true)
public class StaffDirectory {

    private final StaffMemberRepository staffMemberRepository;

    public StaffDirectory(StaffMemberRepository staffMemberRepository) {
        this.staffMemberRepository = staffMemberRepository;
    }

    /**
     * Snapshots for exactly the given ids, with working-day overrides applied.
     *
     * @throws RotaNotFoundException if any id is unknown
     */
    public List<StaffSnapshot> roster(Collection<Long> staffIds, Map<Long, Set<DayOfWeek>> workingDaysOverride) {
        Set<Long> wanted = new LinkedHashSet<>(staffIds);
        Map<Long, StaffMember> found = new HashMap<>();
        staffMemberRepository.findByIdIn(wanted).forEach(s -> found.put(s.getId(), s));
        for (Long id : wanted) {
            if (!found.containsKey(id)) {
                throw new RotaNotFoundException("Staff member", id);
            }
        }
        return wanted.stream()
                .map(id -> StaffSnapshot.of(found.get(id), workingDaysOverride.get(id)))
                .toList();
    }

    /** Whatever of the given ids exists, keyed by id. Unknown ids are left out. */
    public Map<Long, StaffSnapshot> snapshots(Collection<Long> staffIds) {
        Map<Long, StaffSnapshot> result = new HashMap<>();
        if (staffIds.isEmpty()) {
            return result;
        }
        staffMemberRepository.findByIdIn(staffIds).forEach(s -> result.put(s.getId(), StaffSnapshot.of(s)));
        return result;
    }

    public StaffSnapshot require(Long staffId) {
        return staffMemberRepository.findById(staffId)
                .map(StaffSnapshot::of)
                .orElseThrow(() -> new RotaNotFoundException("Staff member", staffId));
    }
}
