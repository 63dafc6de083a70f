package com.copytrading.engine.api;

import com.copytrading.domain.positions.PositionStatus;
import com.copytrading.engine.position.PositionQueryService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/v1/positions")
@PreAuthorize("hasRole('TRADER')")
public class PositionController {
  private final PositionQueryService positionQueryService;

  public PositionController(PositionQueryService positionQueryService) {
    this.positionQueryService = positionQueryService;
  }

  @GetMapping
  public ResponseEntity<PositionsPageResponse> listPositions(
      @RequestParam(name = "status", defaultValue = "OPEN") PositionStatus status,
      @RequestParam(name = "page", defaultValue = "0") int page,
      @RequestParam(name = "size", defaultValue = "50") int size) {
    int clampedSize = Math.min(Math.max(size, 1), 200);
    List<PositionResponse> positions =
        positionQueryService.byStatus(status, page * clampedSize, clampedSize).stream()
            .map(PositionResponse::from)
            .toList();
    return ResponseEntity.ok(new PositionsPageResponse(positions, page, clampedSize));
  }

  @GetMapping("/{id}")
  public ResponseEntity<PositionResponse> getPosition(@PathVariable("id") UUID id) {
    return positionQueryService
        .find(id)
        .map(PositionResponse::from)
        .map(ResponseEntity::ok)
        .orElseThrow(
            () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Position not found: " + id));
  }

  @GetMapping("/{id}/updates")
  public ResponseEntity<List<PositionUpdateResponse>> positionUpdates(@PathVariable("id") UUID id) {
    return ResponseEntity.ok(
        positionQueryService.history(id).stream().map(PositionUpdateResponse::from).toList());
  }

  @GetMapping("/counts")
  public ResponseEntity<Map<String, Long>> countsByStatus() {
    Map<String, Long> counts = new LinkedHashMap<>();
    positionQueryService.countsByStatus().forEach((status, count) -> counts.put(status.name(), count));
    return ResponseEntity.ok(counts);
  }

  @GetMapping("/performance")
  public ResponseEntity<PerformanceResponse> performance() {
    return ResponseEntity.ok(PerformanceResponse.from(positionQueryService.performance()));
  }

  @GetMapping("/performance/whales")
  public ResponseEntity<List<PerformanceResponse>> performanceByWhale() {
    return ResponseEntity.ok(
        positionQueryService.performanceByWhale().stream().map(PerformanceResponse::from).toList());
  }

  @GetMapping("/requiring-action")
  public ResponseEntity<List<ExitCandidateResponse>> requiringAction() {
    return ResponseEntity.ok(
        positionQueryService.requiringAction().stream().map(ExitCandidateResponse::from).toList());
  }

  @GetMapping("/whales/{address}")
  public ResponseEntity<PositionsPageResponse> whalePositions(
      @PathVariable("address") String address,
      @RequestParam(name = "page", defaultValue = "0") int page,
      @RequestParam(name = "size", defaultValue = "50") int size) {
    int clampedSize = Math.min(Math.max(size, 1), 200);
    List<PositionResponse> positions =
        positionQueryService.byWhale(address, page * clampedSize, clampedSize).stream()
            .map(PositionResponse::from)
            .toList();
    return ResponseEntity.ok(new PositionsPageResponse(positions, page, clampedSize));
  }
}
