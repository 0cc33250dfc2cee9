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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.twentyn.codonoptimizer.search.OptimizerOptions;
import org.twentyn.codonoptimizer.sequence.CodonTable;
import org.twentyn.codonoptimizer.sequence.SequenceUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * This class checks a complete DNA sequence against the same rules the optimizers enforce, scanning it from scratch
 * rather than incrementally.  The optimizers use it to double check their output.
 */
public class SequenceChecker {

  private static final Logger LOGGER = LogManager.getFormatterLogger(SequenceChecker.class);

  private final ExclusionSet exclusions;
  private final int maxHomopolymerRun;
  private final boolean checkSixmers;
  private final CodonTable codonTable;
  private final int maxIdenticalCodons;

  /**
   * @param maxHomopolymerRun The longest allowed single nucleotide run, or 0 to skip that check.
   * @param codonTable Table used for the codon-run check, or null to skip it.
   */
  public SequenceChecker(ExclusionSet exclusions, int maxHomopolymerRun, boolean checkSixmers, CodonTable codonTable) {
    this.exclusions = exclusions;
    this.maxHomopolymerRun = maxHomopolymerRun;
    this.checkSixmers = checkSixmers;
    this.codonTable = codonTable;
    this.maxIdenticalCodons = CodonRunConstraint.DEFAULT_MAX_IDENTICAL_CODONS;
  }

  public static SequenceChecker forOptions(OptimizerOptions options, CodonTable codonTable) {
    return new SequenceChecker(
        options.getExclusions(),
        options.isEnforceHomopolymerDiversity() ? options.getMaxHomopolymerRun() : 0,
        options.isEnforceUniqueSixmers(),
        options.isEnforceCodonRunDiversity() ? codonTable : null);
  }

  public boolean check(String dnaseq) {
    return violations(dnaseq).isEmpty();
  }

  /**
   * @return A human readable description of every violated rule; empty if the sequence passes.
   */
  public List<String> violations(String dnaseq) {
    String seq = dnaseq.toUpperCase();
    List<String> out = new ArrayList<>();

    for (ExclusionMotif motif : exclusions.findAllIn(seq)) {
      out.add(String.format("Sequence has excluded motif %s", motif));
    }

    if (maxHomopolymerRun > 0) {
      int run = SequenceUtils.longestHomopolymerRun(seq);
      if (run > maxHomopolymerRun) {
        out.add(String.format("Sequence has a homopolymer run of %d (max %d)", run, maxHomopolymerRun));
      }
    }

    if (checkSixmers) {
      Map<String, Integer> seen = new HashMap<>();
      for (int i = 0; i + UniqueSixmerConstraint.WINDOW <= seq.length(); i++) {
        String sixmer = seq.substring(i, i + UniqueSixmerConstraint.WINDOW);
        Integer previous = seen.putIfAbsent(sixmer, i);
        if (previous != null) {
          out.add(String.format("Sequence repeats 6-mer %s at %d and %d", sixmer, previous, i));
          break;
        }
      }
    }

    if (codonTable != null && seq.length() % 3 == 0) {
      int run = 1;
      for (int i = 3; i + 3 <= seq.length(); i += 3) {
        String codon = seq.substring(i, i + 3);
        run = codon.equals(seq.substring(i - 3, i)) ? run + 1 : 1;
        if (run > maxIdenticalCodons && codonTable.synonyms(codonTable.aminoAcidOf(codon)).size() > 1) {
          out.add(String.format("Sequence repeats codon %s %d times ending at %d", codon, run, i));
          break;
        }
      }
    }

    for (String violation : out) {
      LOGGER.debug(violation);
    }
    return out;
  }
}
