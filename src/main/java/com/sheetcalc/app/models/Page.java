package com.sheetcalc.app.models;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A stored page that owns one sheet:
 * - a unique id (used in "@[Title](id)" mentions)
 * - a title (matched case-insensitively by label-only mentions)
 * - its creation sequence number, which breaks ties between equal titles
 * - the sheet of raw inputs
 * - a read/write lock guarding the sheet against concurrent edits
 */
public class Page {

    private final String id;
    private final String title;
    private final long sequence;
    private Sheet sheet;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Page(String id, String title, long sequence, Sheet sheet) {
        this.id = id;
        this.title = title;
        this.sequence = sequence;
        this.sheet = sheet;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * The live sheet. Callers must hold the lock.
     */
    public Sheet getSheet() {
        return sheet;
    }

    public void setSheet(Sheet sheet) {
        this.sheet = sheet;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    /**
     * Copy of the sheet taken under the read lock.
     */
    public Sheet snapshot() {
        lock.readLock().lock();
        try {
            return sheet.copy();
        } finally {
            lock.readLock().unlock();
        }
    }
}
