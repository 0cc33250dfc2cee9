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
 * Bounds runs of a single nucleotide.  Only the join between the parent's trailing run and the new codon can create
 * a longer run, so the parent's trailing base and run length are all that is needed.
 */
public class HomopolymerConstraint implements Constraint {

  public static final int DEFAULT_MAX_RUN = 4;

  private final int maxRun;

  public HomopolymerConstraint(int maxRun) {
    if (maxRun < 1) {
      throw new IllegalArgumentException("Maximum homopolymer run must be at least 1");
    }
    this.maxRun = maxRun;
  }

  @Override
  public String getName() {
    return "homopolymer";
  }

  @Override
  public boolean permits(Candidate parent, String codon, char aminoAcid) {
    char last = parent.getLastBase();
    int run = parent.getRunLength();
    for (int i = 0; i < codon.length(); i++) {
      char base = codon.charAt(i);
      if (base == last) {
        run++;
      } else {
        last = base;
        run = 1;
      }
      if (run > maxRun) {
        return false;
      }
    }
    return true;
  }

  public int getMaxRun() {
    return maxRun;
  }
}
