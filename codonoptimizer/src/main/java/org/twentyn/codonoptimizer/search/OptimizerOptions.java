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

import org.twentyn.codonoptimizer.constraint.ExclusionSet;
import org.twentyn.codonoptimizer.constraint.HomopolymerConstraint;
import org.twentyn.codonoptimizer.scoring.ContextScorer;

/**
 * Immutable optimizer configuration.  Use {@link #builder()}; every setting has a default.
 */
public final class OptimizerOptions {

  public static final int DEFAULT_BEAM_WIDTH = 100;
  public static final int DEFAULT_PATHS_PER_STATE = 8;

  private final int beamWidth;
  private final boolean enforceUniqueSixmers;
  private final boolean enforceHomopolymerDiversity;
  private final int maxHomopolymerRun;
  private final boolean enforceCodonRunDiversity;
  private final ExclusionSet exclusions;
  private final double boundaryPrior;
  private final int pathsPerState;
  private final boolean parallel;
  private final boolean verifyResult;

  private OptimizerOptions(Builder b) {
    this.beamWidth = b.beamWidth;
    this.enforceUniqueSixmers = b.enforceUniqueSixmers;
    this.enforceHomopolymerDiversity = b.enforceHomopolymerDiversity;
    this.maxHomopolymerRun = b.maxHomopolymerRun;
    this.enforceCodonRunDiversity = b.enforceCodonRunDiversity;
    this.exclusions = b.exclusions;
    this.boundaryPrior = b.boundaryPrior;
    this.pathsPerState = b.pathsPerState;
    this.parallel = b.parallel;
    this.verifyResult = b.verifyResult;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static OptimizerOptions defaults() {
    return builder().build();
  }

  public Builder toBuilder() {
    return new Builder()
        .beamWidth(beamWidth)
        .enforceUniqueSixmers(enforceUniqueSixmers)
        .enforceHomopolymerDiversity(enforceHomopolymerDiversity)
        .maxHomopolymerRun(maxHomopolymerRun)
        .enforceCodonRunDiversity(enforceCodonRunDiversity)
        .exclusions(exclusions)
        .boundaryPrior(boundaryPrior)
        .pathsPerState(pathsPerState)
        .parallel(parallel)
        .verifyResult(verifyResult);
  }

  public int getBeamWidth() {
    return beamWidth;
  }

  public boolean isEnforceUniqueSixmers() {
    return enforceUniqueSixmers;
  }

  public boolean isEnforceHomopolymerDiversity() {
    return enforceHomopolymerDiversity;
  }

  public int getMaxHomopolymerRun() {
    return maxHomopolymerRun;
  }

  public boolean isEnforceCodonRunDiversity() {
    return enforceCodonRunDiversity;
  }

  public ExclusionSet getExclusions() {
    return exclusions;
  }

  public double getBoundaryPrior() {
    return boundaryPrior;
  }

  public int getPathsPerState() {
    return pathsPerState;
  }

  public boolean isParallel() {
    return parallel;
  }

  public boolean isVerifyResult() {
    return verifyResult;
  }

  @Override
  public String toString() {
    return String.format("OptimizerOptions[beamWidth=%d, uniqueSixmers=%s, homopolymer=%s (max %d), codonRuns=%s, " +
            "exclusions=%d, pathsPerState=%d, parallel=%s]",
        beamWidth, enforceUniqueSixmers, enforceHomopolymerDiversity, maxHomopolymerRun, enforceCodonRunDiversity,
        exclusions.size(), pathsPerState, parallel);
  }

  public static class Builder {
    private int beamWidth = DEFAULT_BEAM_WIDTH;
    private boolean enforceUniqueSixmers = true;
    private boolean enforceHomopolymerDiversity = true;
    private int maxHomopolymerRun = HomopolymerConstraint.DEFAULT_MAX_RUN;
    private boolean enforceCodonRunDiversity = false;
    private ExclusionSet exclusions = ExclusionSet.empty();
    private double boundaryPrior = ContextScorer.DEFAULT_BOUNDARY_PRIOR;
    private int pathsPerState = DEFAULT_PATHS_PER_STATE;
    private boolean parallel = false;
    private boolean verifyResult = true;

    public Builder beamWidth(int beamWidth) {
      this.beamWidth = beamWidth;
      return this;
    }

    public Builder enforceUniqueSixmers(boolean enforce) {
      this.enforceUniqueSixmers = enforce;
      return this;
    }

    public Builder enforceHomopolymerDiversity(boolean enforce) {
      this.enforceHomopolymerDiversity = enforce;
      return this;
    }

    public Builder maxHomopolymerRun(int maxRun) {
      this.maxHomopolymerRun = maxRun;
      return this;
    }

    public Builder enforceCodonRunDiversity(boolean enforce) {
      this.enforceCodonRunDiversity = enforce;
      return this;
    }

    public Builder exclusions(ExclusionSet exclusions) {
      this.exclusions = exclusions == null ? ExclusionSet.empty() : exclusions;
      return this;
    }

    public Builder boundaryPrior(double prior) {
      this.boundaryPrior = prior;
      return this;
    }

    public Builder pathsPerState(int paths) {
      this.pathsPerState = paths;
      return this;
    }

    public Builder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    /**
     * Whether to re-check finished sequences with a full scan before returning them.
     */
    public Builder verifyResult(boolean verify) {
      this.verifyResult = verify;
      return this;
    }

    /**
     * @throws IllegalArgumentException If the beam width, the maximum run or the paths per state is not positive.
     */
    public OptimizerOptions build() {
      if (beamWidth <= 0) {
        throw new IllegalArgumentException(String.format("Beam width must be positive, got %d", beamWidth));
      }
      if (maxHomopolymerRun < 1) {
        throw new IllegalArgumentException(
            String.format("Maximum homopolymer run must be at least 1, got %d", maxHomopolymerRun));
      }
      if (pathsPerState <= 0) {
        throw new IllegalArgumentException(String.format("Paths per state must be positive, got %d", pathsPerState));
      }
      return new OptimizerOptions(this);
    }
  }
}
