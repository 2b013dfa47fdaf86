package com.positionkeeper.api.controller;

import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.oms.MutationCoordinator;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/mutations/pending -- active and queued mutations, active ones first per position.
 */
@RestController
@RequestMapping("/api/mutations")
public class MutationController {

    private final MutationCoordinator mutationCoordinator;

    public MutationController(MutationCoordinator mutationCoordinator) {
        this.mutationCoordinator = mutationCoordinator;
    }

    @GetMapping("/pending")
    public ResponseEntity<List<PendingMutation>> listPending() {
        return ResponseEntity.ok(mutationCoordinator.pending());
    }
}
