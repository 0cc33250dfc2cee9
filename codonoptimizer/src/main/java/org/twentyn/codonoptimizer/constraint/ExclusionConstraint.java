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

/**
 * Rejects an extension when a forbidden motif now occurs with at least one base inside the new codon.  Fixed-span
 * motifs only need the parent's last <code>lookback - 1</code> bases; a regex match has no length bound, so regex
 * motifs are run over the whole prefix.
 */
public class ExclusionConstraint implements Constraint {

  private final ExclusionSet exclusions;

  public ExclusionConstraint(ExclusionSet exclusions) {
    this.exclusions = exclusions;
  }

  @Override
  public String getName() {
    return "exclusion";
  }

  @Override
  public boolean permits(Candidate parent, String codon, char aminoAcid) {
    String tail = parent.suffix(Math.max(0, exclusions.getLookback() - 1));
    String window = tail + codon;
    int offset = parent.getDnaLength() - tail.length();
    String prefix = null;
    for (ExclusionMotif motif : exclusions.getMotifs()) {
      if (motif.getSpan() == ExclusionMotif.VARIABLE_SPAN) {
        if (prefix == null) {
          prefix = parent.toDna() + codon;
        }
        if (motif.matchesNewBases(prefix, 0, codon.length())) {
          return false;
        }
      } else if (motif.matchesNewBases(window, offset, codon.length())) {
        return false;
      }
    }
    return true;
  }

  public ExclusionSet getExclusions() {
    return exclusions;
  }
}
