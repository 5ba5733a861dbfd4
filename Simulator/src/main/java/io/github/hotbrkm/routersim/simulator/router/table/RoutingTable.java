package io.github.hotbrkm.routersim.simulator.router.table;

import io.github.hotbrkm.routersim.simulator.router.model.Ipv4Prefix;
import io.github.hotbrkm.routersim.simulator.router.model.RouteEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Static routing table kept in insertion order.
 * <p>
 * Duplicate networks are allowed. Lookup uses longest-prefix match; among candidates with the same
 * prefix length the one inserted first wins. All operations share the table monitor, so a lookup
 * never sees a half-applied removal.
 */
public class RoutingTable {

    private static final Comparator<RouteEntry> BY_METRIC = Comparator.comparingInt(RouteEntry::metric);

    private final List<RouteEntry> entries = new ArrayList<>();

    /**
     * Appends a route. No uniqueness or overlap check is made.
     *
     * @param entry route to add
     */
    public synchronized void insert(RouteEntry entry) {
        entries.add(Objects.requireNonNull(entry, "entry must not be null"));
    }

    /**
     * Removes every route whose network equals the given one (same address and same prefix length).
     *
     * @param network network to remove
     * @return number of removed routes
     */
    public synchronized int remove(Ipv4Prefix network) {
        int before = entries.size();
        entries.removeIf(entry -> entry.network().equals(network));
        return before - entries.size();
    }

    /**
     * Finds the most specific route covering the destination.
     * <p>
     * The current best is only replaced by a candidate with a strictly longer prefix,
     * so the first route at the winning prefix length is kept. The metric is not consulted.
     *
     * @param destination destination address
     * @return best matching route, or empty if nothing covers the destination
     */
    public synchronized Optional<RouteEntry> findBestMatch(Ipv4Prefix destination) {
        RouteEntry best = null;
        for (RouteEntry entry : entries) {
            if (entry.matches(destination) && (best == null || entry.prefixLength() > best.prefixLength())) {
                best = entry;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Returns a display snapshot sorted by ascending metric.
     * Routes with equal metrics keep their insertion order.
     *
     * @return sorted copy of the table, empty if there are no routes
     */
    public synchronized List<RouteEntry> sortedByMetric() {
        List<RouteEntry> sorted = new ArrayList<>(entries);
        sorted.sort(BY_METRIC);
        return sorted;
    }

    public synchronized List<RouteEntry> getEntries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }
}
