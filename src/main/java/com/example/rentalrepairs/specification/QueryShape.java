package com.example.rentalrepairs.specification;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ordering and includes carried alongside a predicate. Merging keeps the left side's entries
 * first and drops later duplicates, which keeps composition associative.
 */
record QueryShape(List<SortOrder> ordering, List<String> includes) {

    static final QueryShape EMPTY = new QueryShape(List.of(), List.of());

    QueryShape {
        ordering = List.copyOf(ordering);
        includes = List.copyOf(includes);
    }

    QueryShape withOrder(SortOrder order) {
        return merge(new QueryShape(List.of(order), List.of()));
    }

    QueryShape withInclude(String association) {
        return merge(new QueryShape(List.of(), List.of(association)));
    }

    QueryShape merge(QueryShape other) {
        List<SortOrder> mergedOrdering = new ArrayList<>(ordering);
        for (SortOrder order : other.ordering) {
            boolean present = mergedOrdering.stream().anyMatch(o -> o.attribute().equals(order.attribute()));
            if (!present) {
                mergedOrdering.add(order);
            }
        }
        LinkedHashSet<String> mergedIncludes = new LinkedHashSet<>(includes);
        mergedIncludes.addAll(other.includes);
        return new QueryShape(mergedOrdering, new ArrayList<>(mergedIncludes));
    }
}
