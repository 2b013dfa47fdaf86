package com.positionkeeper.api.controller;

import com.positionkeeper.domain.model.Position;
import com.positionkeeper.exception.ResourceNotFoundException;
import com.positionkeeper.registry.PositionRegistry;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views of the position registry.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/positions -- active positions</li>
 *   <li>GET /api/positions/archive -- closed and failed positions</li>
 *   <li>GET /api/positions/{id} -- one position, active or archived</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final PositionRegistry positionRegistry;

    public PositionController(PositionRegistry positionRegistry) {
        this.positionRegistry = positionRegistry;
    }

    @GetMapping
    public ResponseEntity<List<Position>> listPositions() {
        return ResponseEntity.ok(positionRegistry.activeSnapshot());
    }

    @GetMapping("/archive")
    public ResponseEntity<List<Position>> listArchived() {
        return ResponseEntity.ok(positionRegistry.archivedSnapshot());
    }

    @GetMapping("/{positionId}")
    public ResponseEntity<Position> getPosition(@PathVariable String positionId) {
        return positionRegistry
                .snapshot(positionId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Position", positionId));
    }
}
