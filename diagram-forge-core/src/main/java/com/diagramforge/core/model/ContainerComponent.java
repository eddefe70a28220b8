package com.diagramforge.core.model;

import java.util.List;

/**
 * A vertex that can hold other cells.
 *
 * <p>The {@link #children()} list is derived: it is recomputed from the {@code parent}
 * references of the other cells and never maintained by hand.
 */
public sealed interface ContainerComponent extends VertexComponent
    permits SwimlaneComponent, GroupComponent, UmlPackageComponent {

    List<String> children();

    /**
     * Returns a copy of this container with the given derived children.
     *
     * @param children ids of direct children, in document order
     * @return new container instance
     */
    ContainerComponent withChildren(List<String> children);
}
