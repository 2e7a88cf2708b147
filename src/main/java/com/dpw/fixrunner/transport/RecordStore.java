package com.dpw.fixrunner.transport;

import java.util.List;

/**
 * Append-only sequence of wire records written by the counterparty. Read only.
 */
public interface RecordStore {

    /**
     * @return every record currently in the store, oldest first
     */
    List<String> readRecords();
}
