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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.twentyn.codonoptimizer.constraint.ConstraintEngine;
import org.twentyn.codonoptimizer.constraint.SequenceChecker;
import org.twentyn.codonoptimizer.scoring.ContextScorer;
import org.twentyn.codonoptimizer.sequence.AminoAcidSequence;
import org.twentyn.codonoptimizer.sequence.CodonTable;
import org.twentyn.codonoptimizer.sequence.UnknownResidueException;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * The position-by-position search loop shared by the optimizers.
 *
 * The DNA is built one codon at a time.  At each protein position every live candidate is extended by every synonymous
 * codon, each extension is scored and filtered through the constraints, and the survivors are pruned by
 * {@link #prune(List)}.  Extensions are generated in (parent rank, codon order) order and all sorting is stable, so
 * ties are always broken the same way; with {@link OptimizerOptions#isParallel()} the extensions are computed on a
 * parallel stream but collected in that same order.
 */
public abstract class AbstractCodonOptimizer implements CodonOptimizer {

  private static final Logger LOGGER = LogManager.getFormatterLogger(AbstractCodonOptimizer.class);

  protected static final Comparator<Candidate> BY_SCORE_DESCENDING =
      Comparator.comparingDouble(Candidate::getScore).reversed();

  protected final CodonTable codonTable;
  protected final ContextScorer scorer;
  protected final ConstraintEngine constraints;
  protected final SequenceChecker checker;
  protected final OptimizerOptions options;

  protected AbstractCodonOptimizer(CodonTable codonTable, ContextScorer scorer, OptimizerOptions options) {
    this.codonTable = codonTable;
    this.scorer = scorer;
    this.options = options;
    this.constraints = ConstraintEngine.forOptions(options, codonTable);
    this.checker = SequenceChecker.forOptions(options, codonTable);
  }

  /**
   * Reduces one step's surviving extensions to the candidates carried into the next step.
   * @param survivors Extensions that passed the constraints, in generation order.
   * @return The kept candidates, best first, ties in generation order.
   */
  protected abstract List<Candidate> prune(List<Candidate> survivors);

  @Override
  public OptimizationResult optimize(String proteinSequence) {
    return optimize(AminoAcidSequence.of(proteinSequence));
  }

  @Override
  public OptimizationResult optimize(AminoAcidSequence protein) {
    for (int i = 0; i < protein.length(); i++) {
      if (!codonTable.isResidue(protein.charAt(i))) {
        throw new UnknownResidueException(protein.charAt(i), i);
      }
    }

    long start = System.currentTimeMillis();
    int n = protein.length();
    long rejected = 0;

    List<Candidate> beam = Collections.singletonList(Candidate.root(constraints.requiresSixmerTracking()));

    for (int pos = 0; pos < n; pos++) {
      List<Candidate> survivors = expand(beam, protein, pos);
      rejected += (long) beam.size() * codonTable.synonyms(protein.charAt(pos)).size() - survivors.size();
      beam = prune(survivors);

      if (beam.isEmpty()) {
        String error = String.format(
            "All candidates excluded at position %d/%d. Exclusion patterns may be too restrictive.", pos + 1, n);
        LOGGER.info("Search failed for a %d residue protein: %s", n, error);
        return OptimizationResult.failure(FailureReason.NO_VALID_SEQUENCE, error, pos + 1,
            System.currentTimeMillis() - start, rejected);
      }
      LOGGER.debug("Position %d/%d: kept %d candidates, best score %.4f", pos + 1, n, beam.size(),
          beam.get(0).getScore());
    }

    Candidate best = beam.get(0);
    String dna = best.toDna();
    long elapsed = System.currentTimeMillis() - start;

    AminoAcidSequence translated = codonTable.translate(dna);
    if (!translated.equals(protein)) {
      String error = String.format("Translation verification failed. Expected %d AA, got %d",
          protein.length(), translated.length());
      LOGGER.error(error);
      return OptimizationResult.failure(FailureReason.TRANSLATION_MISMATCH, error, null, elapsed, rejected);
    }

    if (options.isVerifyResult()) {
      List<String> violations = checker.violations(dna);
      if (!violations.isEmpty()) {
        LOGGER.error("Optimized sequence failed the full constraint check: %s", violations);
        return OptimizationResult.failure(FailureReason.CONSTRAINT_VIOLATION, String.join("; ", violations), null,
            elapsed, rejected);
      }
    }

    LOGGER.info("Optimized %d residues in %d ms, score %.4f (%d candidates rejected)", n, elapsed, best.getScore(),
        rejected);
    return OptimizationResult.success(dna, best.getScore(), elapsed, rejected);
  }

  /**
   * Extends every candidate by every codon for the residue at pos, dropping the extensions a constraint rejects.
   */
  protected List<Candidate> expand(List<Candidate> beam, AminoAcidSequence protein, int pos) {
    char aa = protein.charAt(pos);
    List<String> codons = codonTable.synonyms(aa);
    String context = protein.subSequence(Math.max(0, pos - 2), pos + 1).toString();
    int width = codons.size();

    IntStream indices = IntStream.range(0, beam.size() * width);
    if (options.isParallel()) {
      indices = indices.parallel();
    }
    return indices
        .mapToObj(i -> extend(beam.get(i / width), codons.get(i % width), aa, context))
        .filter(Objects::nonNull)
        .collect(Collectors.toList());
  }

  private Candidate extend(Candidate parent, String codon, char aa, String context) {
    if (!constraints.permits(parent, codon, aa)) {
      return null;
    }
    double delta = scorer.score(parent.suffix(6), codon, context);
    return parent.extend(codon, delta);
  }

  public OptimizerOptions getOptions() {
    return options;
  }

  public CodonTable getCodonTable() {
    return codonTable;
  }
}
