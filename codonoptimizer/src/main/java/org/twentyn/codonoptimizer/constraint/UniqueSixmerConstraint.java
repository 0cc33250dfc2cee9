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
import org.twentyn.codonoptimizer.sequence.SequenceUtils;

/**
 * Forbids any 6 nucleotide window from occurring twice in a sequence.  Each new codon closes up to three new windows
 * (those ending on one of its bases); each must be absent from the parent's window set and distinct from the others.
 *
 * The parent has to be built with six-mer tracking on, see {@link Candidate#root(boolean)}.
 */
public class UniqueSixmerConstraint implements Constraint {

  public static final int WINDOW = 6;

  @Override
  public String getName() {
    return "unique-sixmer";
  }

  @Override
  public boolean permits(Candidate parent, String codon, char aminoAcid) {
    String tail = parent.suffix(WINDOW - 1) + codon;
    int first = -1;
    int second = -1;
    for (int start = 0; start + WINDOW <= tail.length(); start++) {
      int code = SequenceUtils.encodeSixmer(tail, start);
      if (parent.hasSixmer(code) || code == first || code == second) {
        return false;
      }
      if (first < 0) {
        first = code;
      } else {
        second = code;
      }
    }
    return true;
  }
}
