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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A dynamic-programming flavoured variant of {@link BeamSearchOptimizer}.
 *
 * Candidates ending in the same two codons will be scored identically from here on, so they are grouped into one
 * state.  Each state keeps its best pathsPerState candidates, then the best beamWidth states (ranked by their best
 * candidate) survive.  This keeps more distinct codon contexts alive than a plain beam of the same width.
 */
public class StatePrunedOptimizer extends AbstractCodonOptimizer {

  private static final int STATE_LENGTH = 6;

  public StatePrunedOptimizer(ScoreTable scores, OptimizerOptions options) {
    this(CodonTable.standard(), scores, options);
  }

  public StatePrunedOptimizer(CodonTable codonTable, ScoreTable scores, OptimizerOptions options) {
    this(codonTable, new ContextScorer(scores, options.getBoundaryPrior()), options);
  }

  public StatePrunedOptimizer(CodonTable codonTable, ContextScorer scorer, OptimizerOptions options) {
    super(codonTable, scorer, options);
  }

  @Override
  protected List<Candidate> prune(List<Candidate> survivors) {
    // Insertion order keeps group ranking ties in generation order.
    Map<String, List<Candidate>> states = new LinkedHashMap<>();
    for (Candidate candidate : survivors) {
      states.computeIfAbsent(candidate.suffix(STATE_LENGTH), k -> new ArrayList<>()).add(candidate);
    }

    List<List<Candidate>> groups = new ArrayList<>(states.size());
    for (List<Candidate> group : states.values()) {
      group.sort(BY_SCORE_DESCENDING);
      groups.add(group.size() > options.getPathsPerState() ?
          new ArrayList<>(group.subList(0, options.getPathsPerState())) : group);
    }

    groups.sort((a, b) -> Double.compare(b.get(0).getScore(), a.get(0).getScore()));

    List<Candidate> kept = new ArrayList<>();
    for (List<Candidate> group : groups.subList(0, Math.min(options.getBeamWidth(), groups.size()))) {
      kept.addAll(group);
    }
    kept.sort(BY_SCORE_DESCENDING);
    return kept;
  }
}
