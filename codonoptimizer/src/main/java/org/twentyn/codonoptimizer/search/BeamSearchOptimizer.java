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

import org.twentyn.codonoptimizer.scoring.ContextScorer;
import org.twentyn.codonoptimizer.scoring.ScoreTable;
import org.twentyn.codonoptimizer.sequence.CodonTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Beam search over codon choices, scored on 9-mer windows.
 *
 * After each position only the best beamWidth candidates by cumulative score survive, so a step costs at most
 * beamWidth x (codons per residue) extensions and the whole search is linear in protein length.  If the constraints
 * eliminate every candidate the search fails with {@link FailureReason#NO_VALID_SEQUENCE}; there is no backtracking
 * or relaxation, that is left to the caller.
 */
public class BeamSearchOptimizer extends AbstractCodonOptimizer {

  public BeamSearchOptimizer(ScoreTable scores, OptimizerOptions options) {
    this(CodonTable.standard(), scores, options);
  }

  public BeamSearchOptimizer(CodonTable codonTable, ScoreTable scores, OptimizerOptions options) {
    this(codonTable, new ContextScorer(scores, options.getBoundaryPrior()), options);
  }

  public BeamSearchOptimizer(CodonTable codonTable, ContextScorer scorer, OptimizerOptions options) {
    super(codonTable, scorer, options);
  }

  @Override
  protected List<Candidate> prune(List<Candidate> survivors) {
    List<Candidate> sorted = new ArrayList<>(survivors);
    sorted.sort(BY_SCORE_DESCENDING);
    int keep = Math.min(options.getBeamWidth(), sorted.size());
    return new ArrayList<>(sorted.subList(0, keep));
  }
}
