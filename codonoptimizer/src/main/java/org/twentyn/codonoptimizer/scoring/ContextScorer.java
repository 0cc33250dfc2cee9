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

package org.twentyn.codonoptimizer.scoring;

import java.util.OptionalDouble;

/**
 * Scores the placement of one codon against the two codons preceding it.
 *
 * The window is the 9 nucleotides made of the two preceding codons plus the candidate codon, and the context is the
 * three amino acids they encode.  Where fewer than two codons precede the candidate (the first two positions of a
 * sequence) there is no full window, and the scorer returns the fixed boundary prior instead.  A window or context
 * missing from the table scores 0.
 */
public class ContextScorer {

  public static final double DEFAULT_BOUNDARY_PRIOR = 0.0;
  public static final double MISSING_CONTEXT_SCORE = 0.0;

  private final ScoreTable table;
  private final double boundaryPrior;

  public ContextScorer(ScoreTable table) {
    this(table, DEFAULT_BOUNDARY_PRIOR);
  }

  public ContextScorer(ScoreTable table, double boundaryPrior) {
    this.table = table;
    this.boundaryPrior = boundaryPrior;
  }

  /**
   * @param precedingTwoCodons Up to 6 nucleotides immediately before the candidate codon; shorter at the sequence start.
   * @param candidateCodon The codon being placed.
   * @param aminoAcidContext The amino acids of the window, ending with the candidate codon's amino acid.
   * @return The score contribution of placing the candidate codon.
   */
  public double score(String precedingTwoCodons, String candidateCodon, String aminoAcidContext) {
    if (precedingTwoCodons.length() < 6 || aminoAcidContext.length() < ScoreTable.CONTEXT_LENGTH) {
      return boundaryPrior;
    }
    OptionalDouble score = table.lookup(aminoAcidContext, precedingTwoCodons + candidateCodon);
    return score.isPresent() ? score.getAsDouble() : MISSING_CONTEXT_SCORE;
  }

  public double getBoundaryPrior() {
    return boundaryPrior;
  }

  public ScoreTable getTable() {
    return table;
  }
}
