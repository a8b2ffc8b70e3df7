package com.cymonides.grid.operators;

import java.util.List;
import java.util.Optional;

/**
 * Read-only list of operator descriptors, loaded once.
 */
public final class OperatorRegistry {

    private static final OperatorRegistry EMPTY = new OperatorRegistry(List.of());

    private final List<OperatorDescriptor> operators;

    public OperatorRegistry(List<OperatorDescriptor> operators) {
        this.operators = List.copyOf(operators);
    }

    public static OperatorRegistry empty() {
        return EMPTY;
    }

    /**
     * Lists operators, optionally narrowed by category and status. Both filters compare
     * case-insensitively; a null or blank filter matches everything.
     */
    public List<OperatorDescriptor> list(String category, String status) {
        return operators.stream()
                .filter(op -> matches(op.category(), category))
                .filter(op -> matches(op.status(), status))
                .toList();
    }

    public List<OperatorDescriptor> list() {
        return operators;
    }

    public Optional<OperatorDescriptor> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return operators.stream().filter(op -> id.equals(op.id())).findFirst();
    }

    public int total() {
        return operators.size();
    }

    private static boolean matches(String value, String filter) {
        if (filter == null || filter.isBlank()) {
            return true;
        }
        return value != null && value.equalsIgnoreCase(filter);
    }
}
