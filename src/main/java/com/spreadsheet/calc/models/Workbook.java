package com.spreadsheet.calc.models;

import com.spreadsheet.calc.exceptions.SheetNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire workbook:
 * - Has a unique ID
 * - An ordered list of worksheets (a new workbook starts with "Sheet1")
 * - Workbook settings (date system)
 * - Defined names
 * - A read/write lock; a calculation pass holds the write lock for its whole duration
 */
public class Workbook {

    // Generates unique IDs for newly created workbooks
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final List<Worksheet> worksheets = new ArrayList<>();
    private final WorkbookSettings settings = new WorkbookSettings();
    private final NamedRangeCollection names = new NamedRangeCollection();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Workbook() {
        this.id = ID_GENERATOR.getAndIncrement();
        worksheets.add(new Worksheet("Sheet1"));
    }

    /**
     * A workbook with the given sheets instead of the default "Sheet1".
     */
    public Workbook(List<String> sheetNames) {
        this.id = ID_GENERATOR.getAndIncrement();
        if (sheetNames == null || sheetNames.isEmpty()) {
            worksheets.add(new Worksheet("Sheet1"));
        } else {
            for (String sheetName : sheetNames) {
                addWorksheet(sheetName);
            }
        }
    }

    public long getId() {
        return id;
    }

    public int sheetCount() {
        return worksheets.size();
    }

    /**
     * Worksheet at an index, or null when out of range.
     */
    public Worksheet getWorksheet(int index) {
        if (index < 0 || index >= worksheets.size()) {
            return null;
        }
        return worksheets.get(index);
    }

    /**
     * Worksheet by name (case-insensitive). Throws if there is none.
     */
    public Worksheet getWorksheet(String name) {
        Integer index = sheetIndex(name);
        if (index == null) {
            throw new SheetNotFoundException("Sheet not found: " + name);
        }
        return worksheets.get(index);
    }

    /**
     * Index of a sheet by name (case-insensitive), or null when unknown.
     */
    public Integer sheetIndex(String name) {
        if (name == null) {
            return null;
        }
        for (int i = 0; i < worksheets.size(); i++) {
            if (worksheets.get(i).getName().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return null;
    }

    public List<Worksheet> getWorksheets() {
        return Collections.unmodifiableList(worksheets);
    }

    /**
     * Appends a sheet and returns its index. Names must be unique ignoring case.
     */
    public int addWorksheet(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sheet name must not be blank");
        }
        if (sheetIndex(name) != null) {
            throw new IllegalArgumentException("Sheet already exists: " + name);
        }
        worksheets.add(new Worksheet(name));
        return worksheets.size() - 1;
    }

    public WorkbookSettings getSettings() {
        return settings;
    }

    // ------------------------
    // Defined names
    // ------------------------

    public void defineName(String name, String refersTo) {
        names.define(new NamedRange(name, refersTo, null));
    }

    public void defineNameForSheet(String name, String refersTo, int sheetIndex) {
        names.define(new NamedRange(name, refersTo, sheetIndex));
    }

    /**
     * Resolves a name as seen from a sheet: sheet-scoped first, then workbook-scoped.
     */
    public NamedRange getNamedRange(String name, int currentSheet) {
        return names.get(name, currentSheet);
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
