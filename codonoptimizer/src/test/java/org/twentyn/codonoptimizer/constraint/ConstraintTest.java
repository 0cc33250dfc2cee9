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

import org.junit.Test;
import org.twentyn.codonoptimizer.search.Candidate;
import org.twentyn.codonoptimizer.search.OptimizerOptions;
import org.twentyn.codonoptimizer.sequence.CodonTable;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ConstraintTest {

  private static Candidate build(boolean trackSixmers, String... codons) {
    Candidate candidate = Candidate.root(trackSixmers);
    for (String codon : codons) {
      candidate = candidate.extend(codon, 0.0);
    }
    return candidate;
  }

  @Test
  public void testExclusionWithinCodonBoundary() throws Exception {
    ExclusionConstraint constraint = new ExclusionConstraint(
        new ExclusionSet(Collections.singletonList(ExclusionMotif.literal("GAATTC", "EcoRI", false))));
    Candidate parent = build(false, "ATG", "GAA");

    assertFalse("GAA + TTC creates the site", constraint.permits(parent, "TTC", 'F'));
    assertTrue(constraint.permits(parent, "TTT", 'F'));
  }

  @Test
  public void testExclusionSpanningSeveralCodons() throws Exception {
    ExclusionConstraint constraint = new ExclusionConstraint(ExclusionSet.forEnzymes(
        Collections.singletonList(RestrictionEnzyme.AleI)));
    Candidate parent = build(false, "ATG", "CAC", "GAT", "CGT");

    assertFalse(constraint.permits(parent, "GAA", 'E'));
    assertTrue(constraint.permits(parent, "AAA", 'K'));
  }

  @Test
  public void testExclusionCodonAligned() throws Exception {
    ExclusionConstraint constraint = new ExclusionConstraint(
        new ExclusionSet(Collections.singletonList(ExclusionMotif.literal("TAG", "", true))));

    assertFalse(constraint.permits(build(false, "ATG"), "TAG", '*'));
    assertTrue("Out of frame TAG is allowed", constraint.permits(build(false, "ATG", "CTA"), "GCT", 'A'));
  }

  @Test
  public void testExclusionRegex() throws Exception {
    ExclusionConstraint constraint = new ExclusionConstraint(
        new ExclusionSet(Collections.singletonList(ExclusionMotif.regex("CC[AT]GG", "", false))));
    Candidate parent = build(false, "GCC");

    assertFalse(constraint.permits(parent, "AGG", 'R'));
    assertTrue(constraint.permits(parent, "CGG", 'R'));
  }

  @Test
  public void testExclusionRegexLongerThanFixedLookback() throws Exception {
    ExclusionConstraint constraint = new ExclusionConstraint(
        new ExclusionSet(Collections.singletonList(ExclusionMotif.regex("GCA.{100,}GCT", "", false))));
    String[] codons = new String[41];
    Arrays.fill(codons, "AGC");
    codons[0] = "GCA";
    Candidate parent = build(false, codons);

    assertFalse("Match opens 120 bases back", constraint.permits(parent, "GCT", 'A'));
    assertTrue(constraint.permits(parent, "GCC", 'A'));
  }

  @Test
  public void testHomopolymer() throws Exception {
    HomopolymerConstraint constraint = new HomopolymerConstraint(HomopolymerConstraint.DEFAULT_MAX_RUN);
    Candidate parent = build(false, "GCA", "AAA");

    assertFalse("Run of five A", constraint.permits(parent, "AAG", 'K'));
    assertTrue("C breaks the run", constraint.permits(parent, "CCA", 'P'));
    assertTrue(constraint.permits(build(false), "AAA", 'K'));
    assertFalse(new HomopolymerConstraint(2).permits(build(false), "AAA", 'K'));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testHomopolymerNeedsPositiveRun() throws Exception {
    new HomopolymerConstraint(0);
  }

  @Test
  public void testUniqueSixmers() throws Exception {
    UniqueSixmerConstraint constraint = new UniqueSixmerConstraint();
    Candidate parent = build(true, "ATG", "AAA", "ATG");

    assertFalse("ATGAAA would appear twice", constraint.permits(parent, "AAA", 'K'));
    assertTrue(constraint.permits(parent, "AAG", 'K'));
    assertTrue("Fewer than six bases cannot repeat", constraint.permits(build(true), "ATG", 'M'));
  }

  @Test
  public void testUniqueSixmersWithinNewCodon() throws Exception {
    UniqueSixmerConstraint constraint = new UniqueSixmerConstraint();
    // ACACA + CAC closes ACACAC twice.
    Candidate parent = build(true, "GAC", "ACA");
    assertFalse(constraint.permits(parent, "CAC", 'H'));
    assertTrue(constraint.permits(parent, "CAT", 'H'));
  }

  @Test
  public void testCodonRuns() throws Exception {
    CodonTable table = CodonTable.standard();
    CodonRunConstraint constraint = new CodonRunConstraint(table);
    Candidate threeGln = build(false, "CAG", "CAG", "CAG");

    assertFalse(constraint.permits(threeGln, "CAG", 'Q'));
    assertTrue(constraint.permits(threeGln, "CAA", 'Q'));
    assertTrue("Single codon amino acids are exempt",
        constraint.permits(build(false, "ATG", "ATG", "ATG"), "ATG", 'M'));
    assertTrue(new CodonRunConstraint(table, 4).permits(threeGln, "CAG", 'Q'));
  }

  @Test
  public void testEngineForOptions() throws Exception {
    CodonTable table = CodonTable.standard();
    ConstraintEngine defaults = ConstraintEngine.forOptions(OptimizerOptions.defaults(), table);
    assertEquals(2, defaults.getConstraints().size());
    assertTrue(defaults.requiresSixmerTracking());

    ConstraintEngine none = ConstraintEngine.forOptions(OptimizerOptions.builder()
        .enforceUniqueSixmers(false)
        .enforceHomopolymerDiversity(false)
        .build(), table);
    assertTrue(none.getConstraints().isEmpty());
    assertFalse(none.requiresSixmerTracking());
    assertTrue(none.permits(build(false, "AAA", "AAA"), "AAA", 'K'));

    ConstraintEngine all = ConstraintEngine.forOptions(OptimizerOptions.builder()
        .enforceCodonRunDiversity(true)
        .exclusions(ExclusionSet.forEnzymes(Collections.singletonList(RestrictionEnzyme.EcoRI)))
        .build(), table);
    assertEquals(4, all.getConstraints().size());
  }

  @Test
  public void testEngineReportsFirstViolation() throws Exception {
    HomopolymerConstraint homopolymer = new HomopolymerConstraint(3);
    ExclusionConstraint exclusion = new ExclusionConstraint(
        new ExclusionSet(Collections.singletonList(ExclusionMotif.literal("AAAA", "", false))));
    ConstraintEngine engine = new ConstraintEngine(Arrays.asList(exclusion, homopolymer));

    Candidate parent = build(false, "GAA");
    assertSame(exclusion, engine.firstViolation(parent, "AAG", 'K'));
    assertNull(engine.firstViolation(parent, "GAG", 'E'));
  }
}
