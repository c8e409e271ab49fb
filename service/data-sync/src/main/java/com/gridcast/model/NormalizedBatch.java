package com.gridcast.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
public class NormalizedBatch {

    CandidateRange candidate;
    List<Observation> rows;
    int droppedRows;
    PayloadFingerprint fingerprint;

    /**
     * 按实体分组，保持行的原始顺序
     */
    public Map<String, List<Observation>> byEntity() {
        Map<String, List<Observation>> grouped = new LinkedHashMap<>();
        for (Observation o : rows) {
            grouped.computeIfAbsent(o.getEntityId(), k -> new ArrayList<>()).add(o);
        }
        return grouped;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
