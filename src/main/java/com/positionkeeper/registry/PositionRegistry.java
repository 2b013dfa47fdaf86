package com.positionkeeper.registry;

import com.positionkeeper.domain.model.Position;
import com.positionkeeper.exception.RegistryInvariantException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authoritative internal set of tracked positions, keyed by position id.
 *
 * <p>The cycle thread is the only writer. Readers on other threads (REST) use the snapshot
 * accessors, which return copies. Positions that reach a terminal state move to the archive
 * and are never re-entered. The archive keeps the most recent {@value #ARCHIVE_CAPACITY}
 * snapshots (older history belongs to the external store), but every terminal id is remembered
 * for the life of the process so reconciliation never treats it as new.
 */
@Component
public class PositionRegistry {

    private static final Logger log = LoggerFactory.getLogger(PositionRegistry.class);

    static final int ARCHIVE_CAPACITY = 10_000;

    private final Map<String, Position> active = new ConcurrentHashMap<>();

    private final Map<String, Position> archive;

    private final Set<String> terminalIds = ConcurrentHashMap.newKeySet();

    public PositionRegistry() {
        this(ARCHIVE_CAPACITY);
    }

    public PositionRegistry(int archiveCapacity) {
        this.archive = Collections.synchronizedMap(new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Position> eldest) {
                return size() > archiveCapacity;
            }
        });
    }

    // ========================
    // WRITES (cycle thread)
    // ========================

    public void insert(Position position) {
        String positionId = position.getPositionId();
        if (positionId == null) {
            throw new RegistryInvariantException(null, "Position id is required");
        }
        if (active.containsKey(positionId) || terminalIds.contains(positionId)) {
            throw new RegistryInvariantException(positionId, "Duplicate position id " + positionId);
        }
        if (position.getSize() == null || position.getSize().signum() < 0) {
            throw new RegistryInvariantException(positionId, "Negative or missing size for " + positionId);
        }
        active.put(positionId, position);
        log.debug("Position {} registered in state {}", positionId, position.getState());
    }

    /**
     * Replaces the provisional id of an OPENING position with the venue-assigned id.
     */
    public void rekey(String provisionalId, String venueId) {
        if (provisionalId.equals(venueId)) {
            return;
        }
        if (active.containsKey(venueId) || terminalIds.contains(venueId)) {
            throw new RegistryInvariantException(venueId, "Venue id already tracked: " + venueId);
        }
        Position position = active.remove(provisionalId);
        if (position == null) {
            throw new RegistryInvariantException(provisionalId, "No position with provisional id " + provisionalId);
        }
        position.setPositionId(venueId);
        active.put(venueId, position);
    }

    /** Moves a terminal position to the archive. */
    public void archive(String positionId) {
        Position position = active.remove(positionId);
        if (position == null) {
            return;
        }
        if (!position.getState().isTerminal()) {
            active.put(positionId, position);
            throw new RegistryInvariantException(
                    positionId, "Cannot archive non-terminal position in state " + position.getState());
        }
        terminalIds.add(positionId);
        archive.put(positionId, position);
        log.debug("Position {} archived in state {}", positionId, position.getState());
    }

    public void freeze(String positionId, String reason) {
        Position position = active.get(positionId);
        if (position != null && !position.isFrozen()) {
            position.setFrozen(true);
            position.setFrozenReason(reason);
            log.error("Position {} frozen: {}", positionId, reason);
        }
    }

    // ========================
    // READS
    // ========================

    public Optional<Position> get(String positionId) {
        return Optional.ofNullable(active.get(positionId));
    }

    /** Live instances; cycle thread only. */
    public Collection<Position> active() {
        return active.values();
    }

    public Set<String> activeIds() {
        return Set.copyOf(active.keySet());
    }

    /** True for every id that reached a terminal state, including ones whose snapshot was trimmed. */
    public boolean isArchived(String positionId) {
        return terminalIds.contains(positionId);
    }

    public Set<String> archivedIds() {
        return Set.copyOf(terminalIds);
    }

    public List<Position> activeSnapshot() {
        return active.values().stream().map(Position::snapshot).collect(Collectors.toList());
    }

    public Optional<Position> snapshot(String positionId) {
        Position position = active.get(positionId);
        if (position == null) {
            position = archive.get(positionId);
        }
        return Optional.ofNullable(position).map(Position::snapshot);
    }

    public List<Position> archivedSnapshot() {
        synchronized (archive) {
            List<Position> result = new ArrayList<>(archive.size());
            archive.values().forEach(position -> result.add(position.snapshot()));
            return result;
        }
    }

    public int activeCount() {
        return active.size();
    }

    public long countBySymbol(String symbol) {
        return active.values().stream()
                .filter(position -> position.getSymbol().equals(symbol))
                .count();
    }

    public BigDecimal totalSize() {
        return active.values().stream().map(Position::getSize).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalSizeBySymbol(String symbol) {
        return active.values().stream()
                .filter(position -> position.getSymbol().equals(symbol))
                .map(Position::getSize)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
