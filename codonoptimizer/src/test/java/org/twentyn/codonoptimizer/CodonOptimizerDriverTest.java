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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.cli.CommandLine;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mockito;
import org.twentyn.codonoptimizer.constraint.ExclusionSet;
import org.twentyn.codonoptimizer.scoring.ScoreTable;
import org.twentyn.codonoptimizer.search.BeamSearchOptimizer;
import org.twentyn.codonoptimizer.search.CodonOptimizer;
import org.twentyn.codonoptimizer.search.FailureReason;
import org.twentyn.codonoptimizer.search.OptimizationResult;
import org.twentyn.codonoptimizer.search.OptimizerOptions;
import org.twentyn.codonoptimizer.search.StatePrunedOptimizer;
import org.twentyn.codonoptimizer.sequence.AminoAcidSequence;
import org.twentyn.codonoptimizer.sequence.FastaReader;
import org.twentyn.codonoptimizer.sequence.FastaRecord;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;

public class CodonOptimizerDriverTest {

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();

  private String resource(String name) {
    return new File(getClass().getResource(name).getFile()).getAbsolutePath();
  }

  @Test
  public void testOptimizeAllKeepsGoingAfterFailures() throws Exception {
    CodonOptimizer optimizer = Mockito.mock(CodonOptimizer.class);
    Mockito.when(optimizer.optimize(any(AminoAcidSequence.class)))
        .thenReturn(OptimizationResult.success("ATGAAGACC", 3.0, 1L, 0L))
        .thenReturn(OptimizationResult.failure(FailureReason.NO_VALID_SEQUENCE, "All candidates excluded", 1, 1L, 2L));

    List<FastaRecord> proteins = Arrays.asList(
        new FastaRecord("good", "", "mkt"),
        new FastaRecord("bad", "", "MKJT"),
        new FastaRecord("starved", "", "MW"));
    List<FastaRecord> optimized = new ArrayList<>();

    List<OptimizationReport> reports = new CodonOptimizerDriver(optimizer).optimizeAll(proteins, optimized);

    assertEquals(3, reports.size());
    assertTrue(reports.get(0).isSuccess());
    assertEquals(4.0 / 9.0, reports.get(0).getGcContent(), 1e-9);
    assertTrue(reports.get(0).getStartsWithMethionine());
    assertFalse(reports.get(0).getEndsWithStop());
    assertEquals(Integer.valueOf(330), reports.get(0).getEstimatedMolecularWeight());
    assertEquals(Integer.valueOf(1), reports.get(0).getComposition().get('K'));
    assertNotNull("Malformed input is reported, not thrown", reports.get(1).getInputError());
    assertNull(reports.get(1).getResult());
    assertNull(reports.get(1).getEstimatedMolecularWeight());
    assertEquals(Integer.valueOf(220), reports.get(2).getEstimatedMolecularWeight());
    assertNull(reports.get(2).getGcContent());
    assertFalse(reports.get(2).isSuccess());

    assertEquals(1, optimized.size());
    assertEquals("good", optimized.get(0).getName());
    assertEquals("ATGAAGACC", optimized.get(0).getSequence());
    Mockito.verify(optimizer, Mockito.times(2)).optimize(any(AminoAcidSequence.class));
  }

  @Test
  public void testBuildExclusions() throws Exception {
    CommandLine cl = CodonOptimizerDriver.parseArgs(new String[]{
        "-i", "in.fasta", "-o", "out.fasta", "-e", "EcoRI,BsaI", "-g", "-P", "AOX1"});
    ExclusionSet exclusions = CodonOptimizerDriver.buildExclusions(cl);

    // EcoRI, PmeI and SwaI are palindromes; the four Golden Gate sites are not.
    assertEquals(11, exclusions.size());
    assertNotNull(exclusions.findIn("CCGTTTAAACC"));
    assertNotNull(exclusions.findIn("CCGAGACCCC"));
  }

  @Test
  public void testBuildExclusionsFromFile() throws Exception {
    CommandLine cl = CodonOptimizerDriver.parseArgs(new String[]{
        "-i", "in.fasta", "-o", "out.fasta", "-x", resource("/exclusions.txt"), "-e", "EcoRI"});
    ExclusionSet exclusions = CodonOptimizerDriver.buildExclusions(cl);

    assertEquals("The EcoRI site is already in the file", 5, exclusions.size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownEnzyme() throws Exception {
    CommandLine cl = CodonOptimizerDriver.parseArgs(new String[]{"-i", "a", "-o", "b", "-e", "NoSuchI"});
    CodonOptimizerDriver.buildExclusions(cl);
  }

  @Test
  public void testBuildOptions() throws Exception {
    CommandLine cl = CodonOptimizerDriver.parseArgs(new String[]{
        "-i", "in.fasta", "-o", "out.fasta", "-b", "5", "--no-unique-sixmers", "-m", "3", "--codon-runs",
        "--parallel", "-k", "2"});
    OptimizerOptions options = CodonOptimizerDriver.buildOptions(cl, ExclusionSet.empty());

    assertEquals(5, options.getBeamWidth());
    assertFalse(options.isEnforceUniqueSixmers());
    assertTrue(options.isEnforceHomopolymerDiversity());
    assertEquals(3, options.getMaxHomopolymerRun());
    assertTrue(options.isEnforceCodonRunDiversity());
    assertTrue(options.isParallel());
    assertEquals(2, options.getPathsPerState());

    CommandLine defaults = CodonOptimizerDriver.parseArgs(new String[]{"-i", "a", "-o", "b", "--no-homopolymer"});
    OptimizerOptions fromDefaults = CodonOptimizerDriver.buildOptions(defaults, ExclusionSet.empty());
    assertEquals(OptimizerOptions.DEFAULT_BEAM_WIDTH, fromDefaults.getBeamWidth());
    assertFalse(fromDefaults.isEnforceHomopolymerDiversity());
  }

  @Test
  public void testBuildOptimizer() throws Exception {
    OptimizerOptions options = OptimizerOptions.defaults();
    assertTrue(CodonOptimizerDriver.buildOptimizer(CodonOptimizerDriver.ALGORITHM_BEAM, ScoreTable.empty(), options)
        instanceof BeamSearchOptimizer);
    assertTrue(CodonOptimizerDriver.buildOptimizer(CodonOptimizerDriver.ALGORITHM_DP, ScoreTable.empty(), options)
        instanceof StatePrunedOptimizer);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownAlgorithm() throws Exception {
    CodonOptimizerDriver.buildOptimizer("anneal", ScoreTable.empty(), OptimizerOptions.defaults());
  }

  @Test
  public void testMainEndToEnd() throws Exception {
    File output = new File(temp.getRoot(), "optimized.fasta");
    File report = new File(temp.getRoot(), "report.json");

    CodonOptimizerDriver.main(new String[]{
        "-i", resource("/proteins.fasta"),
        "-o", output.getAbsolutePath(),
        "-s", resource("/ninemer_scores.json"),
        "-x", resource("/exclusions.txt"),
        "-b", "10",
        "-r", report.getAbsolutePath()});

    List<FastaRecord> optimized = new FastaReader().read(output);
    assertEquals(2, optimized.size());
    assertEquals("mkt", optimized.get(0).getName());
    assertEquals("ATGAAGACC", optimized.get(0).getSequence());
    assertEquals("ef", optimized.get(1).getName());
    assertEquals("GAATTT", optimized.get(1).getSequence());

    JsonNode json = new ObjectMapper().readTree(report);
    assertEquals(4, json.size());
    assertEquals("ATGAAGACC", json.get(0).get("result").get("dna_sequence").asText());
    assertEquals(330, json.get(0).get("estimated_molecular_weight").asInt());
    assertTrue(json.get(0).get("starts_with_methionine").asBoolean());
    assertEquals(1, json.get(0).get("composition").get("T").asInt());
    assertFalse(json.get(1).get("starts_with_methionine").asBoolean());
    assertEquals("NO_VALID_SEQUENCE", json.get(2).get("result").get("failure_reason").asText());
    assertEquals(2, json.get(2).get("result").get("failed_position").asInt());
    assertTrue(json.get(3).has("input_error"));
    assertFalse(json.get(3).has("result"));
    assertFalse(json.get(3).has("composition"));
  }
}
