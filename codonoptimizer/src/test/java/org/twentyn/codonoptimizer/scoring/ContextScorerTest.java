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

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class ContextScorerTest {

  private ScoreTable table;

  @Before
  public void setup() throws Exception {
    table = new ScoreTable.Builder()
        .put("MKT", "ATGAAGACC", 3.0)
        .put("MKT", "ATGAAAACC", -1.0)
        .build();
  }

  @Test
  public void testScoresFullWindow() throws Exception {
    ContextScorer scorer = new ContextScorer(table);
    assertEquals(3.0, scorer.score("ATGAAG", "ACC", "MKT"), 1e-9);
    assertEquals(-1.0, scorer.score("ATGAAA", "ACC", "MKT"), 1e-9);
  }

  @Test
  public void testMissingWindowScoresZero() throws Exception {
    ContextScorer scorer = new ContextScorer(table);
    assertEquals(ContextScorer.MISSING_CONTEXT_SCORE, scorer.score("ATGAAG", "ACT", "MKT"), 1e-9);
    assertEquals("Unknown context should fail soft", ContextScorer.MISSING_CONTEXT_SCORE,
        scorer.score("GCTGCT", "GCT", "AAA"), 1e-9);
  }

  @Test
  public void testBoundaryPositionsUsePrior() throws Exception {
    ContextScorer scorer = new ContextScorer(table, 0.25);
    assertEquals(0.25, scorer.score("", "ATG", "M"), 1e-9);
    assertEquals(0.25, scorer.score("ATG", "AAG", "MK"), 1e-9);
    assertEquals(3.0, scorer.score("ATGAAG", "ACC", "MKT"), 1e-9);
  }

  @Test
  public void testDefaultPrior() throws Exception {
    assertEquals(ContextScorer.DEFAULT_BOUNDARY_PRIOR, new ContextScorer(table).score("", "ATG", "M"), 1e-9);
  }
}
