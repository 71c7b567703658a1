package com.spreadsheet.calc.models;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Names keyed case-insensitively per scope.
 * Lookup prefers a name scoped to the current sheet over a workbook-wide one.
 */
public class NamedRangeCollection {

    // Key format: "<lowercase name>" or "<lowercase name>:sheet:<index>"
    private final Map<String, NamedRange> names = new ConcurrentHashMap<>();

    private static String key(String name, Integer sheetIndex) {
        String lower = name.toLowerCase(Locale.ROOT);
        return sheetIndex == null ? lower : lower + ":sheet:" + sheetIndex;
    }

    /**
     * Adds or replaces a name in its scope.
     */
    public void define(NamedRange range) {
        names.put(key(range.getName(), range.getSheetIndex()), range);
    }

    public NamedRange get(String name, int currentSheet) {
        NamedRange local = names.get(key(name, currentSheet));
        if (local != null) {
            return local;
        }
        return names.get(key(name, null));
    }

    public NamedRange remove(String name, Integer sheetIndex) {
        return names.remove(key(name, sheetIndex));
    }

    public Collection<NamedRange> all() {
        return new ArrayList<>(names.values());
    }

    public int size() {
        return names.size();
    }
}
