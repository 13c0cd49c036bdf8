package com.flamingo.ai.docingest.service.splitting;

import java.util.List;

/**
 * Outcome of recursively ingesting a unit.
 *
 * @param unitId the unit the split started from
 * @param success whether every part of the unit is stored
 * @param failedLeaves ids of the finest-grained units that could not be stored, in text order
 * @param segmentsCreated number of segments cut along the way
 */
public record SplitResult(
    String unitId, boolean success, List<String> failedLeaves, int segmentsCreated) {

  public SplitResult {
    failedLeaves = List.copyOf(failedLeaves);
  }

  public static SplitResult succeeded(String unitId, int segmentsCreated) {
    return new SplitResult(unitId, true, List.of(), segmentsCreated);
  }

  public static SplitResult failed(String unitId, List<String> failedLeaves, int segmentsCreated) {
    return new SplitResult(unitId, false, failedLeaves, segmentsCreated);
  }
}
