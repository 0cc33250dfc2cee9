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
import org.twentyn.codonoptimizer.search.OptimizerOptions;
import org.twentyn.codonoptimizer.sequence.CodonTable;

import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SequenceCheckerTest {

  private final ExclusionSet ecoRI = ExclusionSet.forEnzymes(Collections.singletonList(RestrictionEnzyme.EcoRI));

  @Test
  public void testCleanSequencePasses() throws Exception {
    SequenceChecker checker = new SequenceChecker(ecoRI, 4, true, CodonTable.standard());
    assertTrue(checker.check("ATGAAGACC"));
  }

  @Test
  public void testExcludedMotif() throws Exception {
    SequenceChecker checker = new SequenceChecker(ecoRI, 0, false, null);
    List<String> violations = checker.violations("ATGGAATTCAAG");
    assertEquals(1, violations.size());
    assertTrue(violations.get(0).contains("GAATTC"));
  }

  @Test
  public void testHomopolymer() throws Exception {
    SequenceChecker checker = new SequenceChecker(ExclusionSet.empty(), 4, false, null);
    assertFalse(checker.check("ATGAAAAAG"));
    assertTrue(checker.check("ATGAAAAGG"));
    assertTrue("0 turns the homopolymer check off",
        new SequenceChecker(ExclusionSet.empty(), 0, false, null).check("AAAAAAAAA"));
  }

  @Test
  public void testRepeatedSixmer() throws Exception {
    SequenceChecker checker = new SequenceChecker(ExclusionSet.empty(), 0, true, null);
    assertFalse(checker.check("ATGAAGATGAAG"));
    assertTrue(checker.check("ATGAAGACC"));
  }

  @Test
  public void testCodonRun() throws Exception {
    SequenceChecker checker = new SequenceChecker(ExclusionSet.empty(), 0, false, CodonTable.standard());
    assertFalse(checker.check("CAGCAGCAGCAG"));
    assertTrue(checker.check("CAGCAGCAGCAA"));
    assertTrue("Methionine has no alternative", checker.check("ATGATGATGATG"));
  }

  @Test
  public void testForOptions() throws Exception {
    SequenceChecker relaxed = SequenceChecker.forOptions(OptimizerOptions.builder()
        .enforceHomopolymerDiversity(false)
        .enforceUniqueSixmers(false)
        .build(), CodonTable.standard());
    assertTrue(relaxed.check("AAAAAAAAAAAAAAAAAA"));

    SequenceChecker strict = SequenceChecker.forOptions(OptimizerOptions.builder().exclusions(ecoRI).build(),
        CodonTable.standard());
    assertEquals(3, strict.violations("GAATTCAAAAAGAATTC").size());
  }
}
