package com.goormthonuniv.derigo.reference;

import com.goormthonuniv.derigo.domain.Axis;
import com.goormthonuniv.derigo.domain.KeywordEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 축별로 묶인 키워드 표. 불변.
 */
public final class KeywordTable {

    public static final KeywordTable EMPTY = new KeywordTable(List.of());

    private final List<KeywordEntry> entries;
    private final Map<Axis, List<KeywordEntry>> byAxis = new EnumMap<>(Axis.class);

    public KeywordTable(List<KeywordEntry> entries) {
        this.entries = List.copyOf(entries);
        Map<Axis, List<KeywordEntry>> grouped = new EnumMap<>(Axis.class);
        for (Axis a : Axis.values()) grouped.put(a, new ArrayList<>());
        for (KeywordEntry e : this.entries) grouped.get(e.axis()).add(e);
        grouped.forEach((a, list) -> byAxis.put(a, Collections.unmodifiableList(list)));
    }

    public List<KeywordEntry> forAxis(Axis axis) {
        return byAxis.get(axis);
    }

    public int size() {
        return entries.size();
    }
}
