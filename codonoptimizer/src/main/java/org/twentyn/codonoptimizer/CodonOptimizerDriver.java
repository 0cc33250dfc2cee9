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

package org.twentyn.codonoptimizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.twentyn.codonoptimizer.constraint.ExclusionSet;
import org.twentyn.codonoptimizer.constraint.ExclusionSetParser;
import org.twentyn.codonoptimizer.constraint.HomopolymerConstraint;
import org.twentyn.codonoptimizer.constraint.RestrictionEnzyme;
import org.twentyn.codonoptimizer.scoring.ScoreTable;
import org.twentyn.codonoptimizer.scoring.ScoreTableLoader;
import org.twentyn.codonoptimizer.search.BeamSearchOptimizer;
import org.twentyn.codonoptimizer.search.CodonOptimizer;
import org.twentyn.codonoptimizer.search.OptimizationResult;
import org.twentyn.codonoptimizer.search.OptimizerOptions;
import org.twentyn.codonoptimizer.search.StatePrunedOptimizer;
import org.twentyn.codonoptimizer.sequence.AminoAcidSequence;
import org.twentyn.codonoptimizer.sequence.CodonTable;
import org.twentyn.codonoptimizer.sequence.FastaReader;
import org.twentyn.codonoptimizer.sequence.FastaRecord;
import org.twentyn.codonoptimizer.sequence.FastaWriter;
import org.twentyn.codonoptimizer.sequence.SequenceFormatException;
import org.twentyn.codonoptimizer.sequence.SequenceUtils;
import org.twentyn.codonoptimizer.utils.CLIUtil;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class CodonOptimizerDriver {

  private static final Logger LOGGER = LogManager.getFormatterLogger(CodonOptimizerDriver.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String ALGORITHM_BEAM = "beam";
  public static final String ALGORITHM_DP = "dp";

  private static final String OPTION_INPUT_FASTA = "i";
  private static final String OPTION_OUTPUT_FASTA = "o";
  private static final String OPTION_SCORE_TABLE = "s";
  private static final String OPTION_EXCLUSIONS = "x";
  private static final String OPTION_ENZYMES = "e";
  private static final String OPTION_GOLDEN_GATE = "g";
  private static final String OPTION_PROMOTER = "P";
  private static final String OPTION_BEAM_WIDTH = "b";
  private static final String OPTION_ALGORITHM = "a";
  private static final String OPTION_PATHS_PER_STATE = "k";
  private static final String OPTION_NO_UNIQUE_SIXMERS = "U";
  private static final String OPTION_NO_HOMOPOLYMER = "H";
  private static final String OPTION_MAX_HOMOPOLYMER = "m";
  private static final String OPTION_CODON_RUNS = "c";
  private static final String OPTION_PARALLEL = "t";
  private static final String OPTION_REPORT = "r";

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT_FASTA)
        .argName("fasta")
        .desc("A FASTA file of protein sequences to optimize")
        .hasArg().required()
        .longOpt("input-fasta")
    );
    add(Option.builder(OPTION_OUTPUT_FASTA)
        .argName("fasta")
        .desc("Where to write the optimized DNA sequences, as FASTA")
        .hasArg().required()
        .longOpt("output-fasta")
    );
    add(Option.builder(OPTION_SCORE_TABLE)
        .argName("json")
        .desc("A JSON table of 9-mer scores keyed by amino-acid triplet (default: all windows score 0)")
        .hasArg()
        .longOpt("score-table")
    );
    add(Option.builder(OPTION_EXCLUSIONS)
        .argName("file")
        .desc("A newline-delimited file of forbidden motifs: literal, IUPAC or regex, '# comment', '@codon' suffix")
        .hasArg()
        .longOpt("exclusions")
    );
    add(Option.builder(OPTION_ENZYMES)
        .argName("names")
        .desc("Comma separated restriction enzymes whose sites (both strands) must be excluded")
        .hasArgs().valueSeparator(',')
        .longOpt("enzymes")
    );
    add(Option.builder(OPTION_GOLDEN_GATE)
        .desc("Exclude the Golden Gate assembly enzymes (BsaI, BbsI, BsmBI, SapI)")
        .longOpt("golden-gate")
    );
    add(Option.builder(OPTION_PROMOTER)
        .argName("name")
        .desc("Exclude the enzyme sites present in this expression promoter (AOX1, GAP, PGK1, FLD1, TEF1)")
        .hasArg()
        .longOpt("promoter")
    );
    add(Option.builder(OPTION_BEAM_WIDTH)
        .argName("width")
        .desc(String.format("Number of candidates kept at each position (default: %d)",
            OptimizerOptions.DEFAULT_BEAM_WIDTH))
        .hasArg()
        .longOpt("beam-width")
    );
    add(Option.builder(OPTION_ALGORITHM)
        .argName("algorithm")
        .desc(String.format("Search algorithm, %s or %s (default: %s)", ALGORITHM_BEAM, ALGORITHM_DP, ALGORITHM_BEAM))
        .hasArg()
        .longOpt("algorithm")
    );
    add(Option.builder(OPTION_PATHS_PER_STATE)
        .argName("paths")
        .desc(String.format("Paths kept per codon state by the %s algorithm (default: %d)", ALGORITHM_DP,
            OptimizerOptions.DEFAULT_PATHS_PER_STATE))
        .hasArg()
        .longOpt("paths-per-state")
    );
    add(Option.builder(OPTION_NO_UNIQUE_SIXMERS)
        .desc("Allow 6-nt windows to repeat")
        .longOpt("no-unique-sixmers")
    );
    add(Option.builder(OPTION_NO_HOMOPOLYMER)
        .desc("Do not bound single nucleotide runs")
        .longOpt("no-homopolymer")
    );
    add(Option.builder(OPTION_MAX_HOMOPOLYMER)
        .argName("length")
        .desc(String.format("Longest allowed single nucleotide run (default: %d)", HomopolymerConstraint.DEFAULT_MAX_RUN))
        .hasArg()
        .longOpt("max-homopolymer")
    );
    add(Option.builder(OPTION_CODON_RUNS)
        .desc("Forbid long runs of an identical codon within repeated amino acids")
        .longOpt("codon-runs")
    );
    add(Option.builder(OPTION_PARALLEL)
        .desc("Expand candidates in parallel within each position")
        .longOpt("parallel")
    );
    add(Option.builder(OPTION_REPORT)
        .argName("json")
        .desc("Write a JSON report of every optimization to this file")
        .hasArg()
        .longOpt("report")
    );
  }};

  public static final String HELP_MESSAGE =
      "This class reverse-translates the proteins in a FASTA file into DNA, choosing codons by 9-mer context score " +
          "while avoiding forbidden motifs, long homopolymers and repeated 6-mers.";

  private static final CLIUtil CLI_UTIL = new CLIUtil(CodonOptimizerDriver.class, HELP_MESSAGE, OPTION_BUILDERS);

  private final CodonOptimizer optimizer;

  static CommandLine parseArgs(String[] args) throws ParseException {
    return CLI_UTIL.parse(args);
  }

  public CodonOptimizerDriver(CodonOptimizer optimizer) {
    this.optimizer = optimizer;
  }

  /**
   * Optimizes every record.  A record with a malformed sequence or a failed search is logged and reported, and does
   * not stop the batch.
   * @param proteins The protein records to optimize.
   * @param optimized Receives one DNA record per successfully optimized protein.
   * @return One report per input record, in input order.
   */
  public List<OptimizationReport> optimizeAll(List<FastaRecord> proteins, List<FastaRecord> optimized) {
    List<OptimizationReport> reports = new ArrayList<>();
    int count = 0;
    for (FastaRecord record : proteins) {
      count++;
      AminoAcidSequence protein;
      try {
        protein = AminoAcidSequence.clean(record.getSequence());
      } catch (SequenceFormatException e) {
        LOGGER.error("Skipping %s: %s", record.getName(), e.getMessage());
        reports.add(OptimizationReport.inputError(record.getName(), record.getSequence().length(), e.getMessage()));
        continue;
      }

      OptimizationResult result = optimizer.optimize(protein);
      if (result.isSuccess()) {
        String dna = result.getDnaSequence();
        double gc = SequenceUtils.calcGC(dna);
        optimized.add(new FastaRecord(record.getName(),
            String.format("score=%.4f gc=%.3f", result.getScore(), gc), dna));
        reports.add(new OptimizationReport(record.getName(), protein, result, gc));
      } else {
        LOGGER.error("Could not optimize %s: %s", record.getName(), result.getError());
        reports.add(new OptimizationReport(record.getName(), protein, result, null));
      }

      if (count % 20 == 0) {
        LOGGER.info("Processed %d/%d proteins", count, proteins.size());
      }
    }
    return reports;
  }

  static ExclusionSet buildExclusions(CommandLine cl) throws IOException {
    ExclusionSet exclusions = ExclusionSet.empty();
    if (cl.hasOption(OPTION_EXCLUSIONS)) {
      exclusions = new ExclusionSetParser().parse(new File(cl.getOptionValue(OPTION_EXCLUSIONS)));
    }

    Set<RestrictionEnzyme> enzymes = new LinkedHashSet<>();
    if (cl.hasOption(OPTION_ENZYMES)) {
      for (String name : cl.getOptionValues(OPTION_ENZYMES)) {
        if (!name.trim().isEmpty()) {
          enzymes.add(RestrictionEnzyme.byName(name));
        }
      }
    }
    if (cl.hasOption(OPTION_GOLDEN_GATE)) {
      enzymes.addAll(RestrictionEnzyme.GOLDEN_GATE);
    }
    if (cl.hasOption(OPTION_PROMOTER)) {
      String promoter = cl.getOptionValue(OPTION_PROMOTER);
      List<RestrictionEnzyme> promoterEnzymes = RestrictionEnzyme.forPromoter(promoter);
      if (promoterEnzymes.isEmpty()) {
        LOGGER.warn("No restriction sites known for promoter %s", promoter);
      }
      enzymes.addAll(promoterEnzymes);
    }
    if (!enzymes.isEmpty()) {
      LOGGER.info("Excluding sites for %s", enzymes);
      exclusions = exclusions.union(ExclusionSet.forEnzymes(enzymes));
    }
    return exclusions;
  }

  static OptimizerOptions buildOptions(CommandLine cl, ExclusionSet exclusions) {
    OptimizerOptions.Builder builder = OptimizerOptions.builder()
        .exclusions(exclusions)
        .enforceUniqueSixmers(!cl.hasOption(OPTION_NO_UNIQUE_SIXMERS))
        .enforceHomopolymerDiversity(!cl.hasOption(OPTION_NO_HOMOPOLYMER))
        .enforceCodonRunDiversity(cl.hasOption(OPTION_CODON_RUNS))
        .parallel(cl.hasOption(OPTION_PARALLEL));
    if (cl.hasOption(OPTION_BEAM_WIDTH)) {
      builder.beamWidth(Integer.parseInt(cl.getOptionValue(OPTION_BEAM_WIDTH)));
    }
    if (cl.hasOption(OPTION_MAX_HOMOPOLYMER)) {
      builder.maxHomopolymerRun(Integer.parseInt(cl.getOptionValue(OPTION_MAX_HOMOPOLYMER)));
    }
    if (cl.hasOption(OPTION_PATHS_PER_STATE)) {
      builder.pathsPerState(Integer.parseInt(cl.getOptionValue(OPTION_PATHS_PER_STATE)));
    }
    return builder.build();
  }

  static CodonOptimizer buildOptimizer(String algorithm, ScoreTable scores, OptimizerOptions options) {
    if (ALGORITHM_BEAM.equals(algorithm)) {
      return new BeamSearchOptimizer(CodonTable.standard(), scores, options);
    } else if (ALGORITHM_DP.equals(algorithm)) {
      return new StatePrunedOptimizer(CodonTable.standard(), scores, options);
    }
    throw new IllegalArgumentException(String.format("Unknown algorithm: %s", algorithm));
  }

  public static void main(String[] args) throws Exception {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);

    ScoreTable scores = ScoreTable.empty();
    if (cl.hasOption(OPTION_SCORE_TABLE)) {
      scores = new ScoreTableLoader().load(new File(cl.getOptionValue(OPTION_SCORE_TABLE)));
    } else {
      LOGGER.warn("No score table given, every codon choice will score 0");
    }

    OptimizerOptions options;
    CodonOptimizer optimizer;
    try {
      options = buildOptions(cl, buildExclusions(cl));
      optimizer = buildOptimizer(cl.getOptionValue(OPTION_ALGORITHM, ALGORITHM_BEAM), scores, options);
    } catch (IllegalArgumentException e) {
      CLI_UTIL.failWithMessage(e.getMessage());
      return;
    }
    LOGGER.info("Running with %s", options);

    List<FastaRecord> proteins = new FastaReader().read(new File(cl.getOptionValue(OPTION_INPUT_FASTA)));
    LOGGER.info("Loaded %d proteins", proteins.size());

    List<FastaRecord> optimized = new ArrayList<>();
    List<OptimizationReport> reports = new CodonOptimizerDriver(optimizer).optimizeAll(proteins, optimized);

    new FastaWriter().write(new File(cl.getOptionValue(OPTION_OUTPUT_FASTA)), optimized);
    LOGGER.info("Wrote %d of %d optimized sequences", optimized.size(), proteins.size());

    if (cl.hasOption(OPTION_REPORT)) {
      MAPPER.writerWithDefaultPrettyPrinter().writeValue(new File(cl.getOptionValue(OPTION_REPORT)), reports);
    }
  }
}
