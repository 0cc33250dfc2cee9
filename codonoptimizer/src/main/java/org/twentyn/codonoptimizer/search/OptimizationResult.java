/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package org.twentyn.codonoptimizer.search;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one optimization: either the optimized DNA with its score, or the reason no sequence was produced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OptimizationResult {

  @JsonProperty("success")
  private final boolean success;

  @JsonProperty("dna_sequence")
  private final String dnaSequence;

  @JsonProperty("score")
  private final Double score;

  @JsonProperty("elapsed_ms")
  private final long elapsedMs;

  @JsonProperty("rejected_candidates")
  private final long rejectedCandidates;

  @JsonProperty("failure_reason")
  private final FailureReason failureReason;

  @JsonProperty("error")
  private final String error;

  @JsonProperty("failed_position")
  private final Integer failedPosition;

  private OptimizationResult(boolean success, String dnaSequence, Double score, long elapsedMs,
                             long rejectedCandidates, FailureReason failureReason, String error,
                             Integer failedPosition) {
    this.success = success;
    this.dnaSequence = dnaSequence;
    this.score = score;
    this.elapsedMs = elapsedMs;
    this.rejectedCandidates = rejectedCandidates;
    this.failureReason = failureReason;
    this.error = error;
    this.failedPosition = failedPosition;
  }

  public static OptimizationResult success(String dnaSequence, double score, long elapsedMs, long rejectedCandidates) {
    return new OptimizationResult(true, dnaSequence, score, elapsedMs, rejectedCandidates, null, null, null);
  }

  /**
   * @param failedPosition The 1-based protein position the search stopped at, or null if it ran to the end.
   */
  public static OptimizationResult failure(FailureReason reason, String error, Integer failedPosition,
                                           long elapsedMs, long rejectedCandidates) {
    return new OptimizationResult(false, null, null, elapsedMs, rejectedCandidates, reason, error, failedPosition);
  }

  public boolean isSuccess() {
    return success;
  }

  /**
   * @return The optimized DNA, or null on failure.
   */
  public String getDnaSequence() {
    return dnaSequence;
  }

  /**
   * @return The total context score, or null on failure.
   */
  public Double getScore() {
    return score;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  public long getRejectedCandidates() {
    return rejectedCandidates;
  }

  public FailureReason getFailureReason() {
    return failureReason;
  }

  public String getError() {
    return error;
  }

  public Integer getFailedPosition() {
    return failedPosition;
  }

  @JsonIgnore
  public boolean isFailure() {
    return !success;
  }

  @Override
  public String toString() {
    if (success) {
      return String.format("OptimizationResult[success, %d nt, score %.4f, %d ms]",
          dnaSequence.length(), score, elapsedMs);
    }
    return String.format("OptimizationResult[%s: %s]", failureReason, error);
  }
}
