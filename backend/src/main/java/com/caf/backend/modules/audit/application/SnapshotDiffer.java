package com.caf.backend.modules.audit.application;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.caf.backend.modules.audit.domain.EntitySnapshot;

import org.springframework.stereotype.Component;

/**
 * Computes the keys whose values differ between two snapshots, in field order (before first, then
 * keys that only exist after). A missing key is treated as null; null and the empty string differ.
 */
@Component
public class SnapshotDiffer {

    public List<String> diff(EntitySnapshot before, EntitySnapshot after) {
        Map<String, Object> oldFields = before != null ? before.fields() : Map.of();
        Map<String, Object> newFields = after != null ? after.fields() : Map.of();

        Set<String> keys = new LinkedHashSet<>(oldFields.keySet());
        keys.addAll(newFields.keySet());

        List<String> changed = new ArrayList<>();
        for (String key : keys) {
            if (!Objects.deepEquals(oldFields.get(key), newFields.get(key))) {
                changed.add(key);
            }
        }
        return changed;
    }
}
