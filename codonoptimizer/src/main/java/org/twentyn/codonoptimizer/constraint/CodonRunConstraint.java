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
import org.twentyn.codonoptimizer.sequence.CodonTable;

/**
 * Keeps runs of a repeated amino acid from being encoded by a long run of the same codon, e.g. a poly-glutamine
 * stretch as CAGCAGCAGCAG.  Amino acids with a single codon (M, W) have no choice and are exempt.
 */
public class CodonRunConstraint implements Constraint {

  public static final int DEFAULT_MAX_IDENTICAL_CODONS = 3;

  private final CodonTable codonTable;
  private final int maxIdenticalCodons;

  public CodonRunConstraint(CodonTable codonTable) {
    this(codonTable, DEFAULT_MAX_IDENTICAL_CODONS);
  }

  public CodonRunConstraint(CodonTable codonTable, int maxIdenticalCodons) {
    if (maxIdenticalCodons < 1) {
      throw new IllegalArgumentException("Maximum identical codon run must be at least 1");
    }
    this.codonTable = codonTable;
    this.maxIdenticalCodons = maxIdenticalCodons;
  }

  @Override
  public String getName() {
    return "codon-run";
  }

  @Override
  public boolean permits(Candidate parent, String codon, char aminoAcid) {
    if (!codon.equals(parent.getCodon())) {
      return true;
    }
    if (codonTable.synonyms(aminoAcid).size() == 1) {
      return true;
    }
    return parent.getCodonRunLength() + 1 <= maxIdenticalCodons;
  }
}
