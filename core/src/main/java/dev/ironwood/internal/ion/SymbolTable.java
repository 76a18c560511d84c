/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.ion;

import java.util.ArrayList;
import java.util.List;

/**
 * Symbol table of one Ion stream: maps symbol ids to their text. Starts out with the Ion 1.0
 * system symbols; local symbol tables read from the stream either append to it or replace all
 * local symbols.
 */
public final class SymbolTable {

    static final int ION_SYMBOL_TABLE_SID = 3;
    static final int IMPORTS_SID = 6;
    static final int SYMBOLS_SID = 7;

    private static final String[] SYSTEM_SYMBOLS = {
            "$ion",
            "$ion_1_0",
            "$ion_symbol_table",
            "name",
            "version",
            "imports",
            "symbols",
            "max_id",
            "$ion_shared_symbol_table"
    };

    // Index 0 holds symbol id 1; symbol id 0 never has text
    private final List<String> symbols = new ArrayList<>();

    SymbolTable() {
        reset();
    }

    /**
     * Drop all local symbols, keeping the system symbols.
     */
    void reset() {
        symbols.clear();
        for (String symbol : SYSTEM_SYMBOLS) {
            symbols.add(symbol);
        }
    }

    /**
     * Append local symbols. Null entries reserve an id without text.
     */
    void addAll(List<String> localSymbols) {
        symbols.addAll(localSymbols);
    }

    /**
     * Returns the text of the given symbol id, or null if the id is unknown or has no text.
     */
    public String lookup(long sid) {
        if (sid < 1 || sid > symbols.size()) {
            return null;
        }
        return symbols.get((int) (sid - 1));
    }

    /**
     * Highest symbol id currently defined.
     */
    public int maxId() {
        return symbols.size();
    }
}
