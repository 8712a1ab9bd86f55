package org.includer.merger.frontend.order;

import java.util.List;

/**
 * A total order over all fragments in which every fragment comes after the fragments it includes.
 *
 * @param root  The single fragment no other fragment includes. It is always the last entry.
 * @param order All fragment names, dependencies before dependents.
 */
public record ProcessingOrder(String root, List<String> order) {

    public ProcessingOrder {
        order = List.copyOf(order);
    }
}
