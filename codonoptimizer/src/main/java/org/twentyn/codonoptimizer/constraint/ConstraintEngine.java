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

package org.twentyn.codonoptimizer.constraint;

import org.twentyn.codonoptimizer.search.Candidate;
import org.twentyn.codonoptimizer.search.OptimizerOptions;
import org.twentyn.codonoptimizer.sequence.CodonTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs every enabled rule against a candidate extension.  A disabled rule is simply not installed.  Rejection is
 * ordinary search pruning, so nothing here throws.
 */
public class ConstraintEngine {

  private final List<Constraint> constraints;

  public ConstraintEngine(List<Constraint> constraints) {
    this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
  }

  public static ConstraintEngine forOptions(OptimizerOptions options, CodonTable codonTable) {
    List<Constraint> constraints = new ArrayList<>();
    if (!options.getExclusions().isEmpty()) {
      constraints.add(new ExclusionConstraint(options.getExclusions()));
    }
    if (options.isEnforceHomopolymerDiversity()) {
      constraints.add(new HomopolymerConstraint(options.getMaxHomopolymerRun()));
    }
    if (options.isEnforceUniqueSixmers()) {
      constraints.add(new UniqueSixmerConstraint());
    }
    if (options.isEnforceCodonRunDiversity()) {
      constraints.add(new CodonRunConstraint(codonTable));
    }
    return new ConstraintEngine(constraints);
  }

  public boolean permits(Candidate parent, String codon, char aminoAcid) {
    return firstViolation(parent, codon, aminoAcid) == null;
  }

  /**
   * @return The first rule that rejects the extension, or null if all of them accept it.
   */
  public Constraint firstViolation(Candidate parent, String codon, char aminoAcid) {
    for (Constraint constraint : constraints) {
      if (!constraint.permits(parent, codon, aminoAcid)) {
        return constraint;
      }
    }
    return null;
  }

  public boolean requiresSixmerTracking() {
    for (Constraint constraint : constraints) {
      if (constraint instanceof UniqueSixmerConstraint) {
        return true;
      }
    }
    return false;
  }

  public List<Constraint> getConstraints() {
    return constraints;
  }
}
