package com.cgekernel.runtime.solver;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Maps variable names to the dense column numbers of an {@link ExpressionModel}.
 */
final class VariableDictionary {

    private final Object2IntMap<String> nameToColumn = new Object2IntOpenHashMap<>();

    VariableDictionary() {
        nameToColumn.defaultReturnValue(-1);
    }

    /**
     * Assigns the next column to {@code name}.
     *
     * @throws IllegalArgumentException if the name already has a column
     */
    int add(String name) {
        if (nameToColumn.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate variable name: " + name);
        }
        int column = nameToColumn.size();
        nameToColumn.put(name, column);
        return column;
    }

    /**
     * @return the column of {@code name}, or -1 if unknown
     */
    int column(String name) {
        return nameToColumn.getInt(name);
    }
}
