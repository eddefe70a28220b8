package com.diagramforge.core.convert;

import com.diagramforge.core.model.Connector;
import com.diagramforge.core.model.DiagramComponent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks cross-references within a component list before it is converted.
 *
 * <p>Reports duplicate ids, connectors whose source or target is not in the list, and
 * parents that are not in the list. The default layer {@code "1"} is always a valid parent.
 * Conversion itself never rejects input; callers decide what to do with the findings.
 */
public final class ComponentValidator {

    private ComponentValidator() {
    }

    /**
     * Validates a component list.
     *
     * @param components components to check
     * @return problems in input order; empty when valid
     */
    public static List<String> validateComponents(List<? extends DiagramComponent> components) {
        List<String> errors = new ArrayList<>();
        Set<String> allIds = components.stream().map(DiagramComponent::id).collect(Collectors.toSet());
        Set<String> seen = new HashSet<>();

        for (DiagramComponent component : components) {
            if (!seen.add(component.id())) {
                errors.add("Duplicate component ID: " + component.id());
            }

            if (component instanceof Connector connector) {
                if (!allIds.contains(connector.source())) {
                    errors.add("Connector \"" + connector.id() + "\" references non-existent source: "
                        + connector.source());
                }
                if (!allIds.contains(connector.target())) {
                    errors.add("Connector \"" + connector.id() + "\" references non-existent target: "
                        + connector.target());
                }
            }

            String parent = component.effectiveParent();
            if (!DiagramComponent.DEFAULT_LAYER_ID.equals(parent) && !allIds.contains(parent)) {
                errors.add("Component \"" + component.id() + "\" references non-existent parent: " + parent);
            }
        }
        return errors;
    }

    /**
     * Returns whether a component list has no cross-reference problems.
     *
     * @param components components to check
     * @return {@code true} when {@link #validateComponents(List)} finds nothing
     */
    public static boolean isValid(List<? extends DiagramComponent> components) {
        return validateComponents(components).isEmpty();
    }
}
