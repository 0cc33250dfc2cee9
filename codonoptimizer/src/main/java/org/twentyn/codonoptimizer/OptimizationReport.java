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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.twentyn.codonoptimizer.search.OptimizationResult;
import org.twentyn.codonoptimizer.sequence.AminoAcidSequence;

import java.util.Map;

/**
 * One line of the driver's JSON report: which protein, and what came of optimizing it.  The protein stats are only
 * filled in once the input has parsed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OptimizationReport {

  @JsonProperty("name")
  private String name;

  @JsonProperty("protein_length")
  private int proteinLength;

  @JsonProperty("starts_with_methionine")
  private Boolean startsWithMethionine;

  @JsonProperty("ends_with_stop")
  private Boolean endsWithStop;

  @JsonProperty("estimated_molecular_weight")
  private Integer estimatedMolecularWeight;

  @JsonProperty("composition")
  private Map<Character, Integer> composition;

  @JsonProperty("gc_content")
  private Double gcContent;

  @JsonProperty("input_error")
  private String inputError;

  @JsonProperty("result")
  private OptimizationResult result;

  private OptimizationReport(String name, int proteinLength) {
    this.name = name;
    this.proteinLength = proteinLength;
  }

  public OptimizationReport(String name, AminoAcidSequence protein, OptimizationResult result, Double gcContent) {
    this(name, protein.length());
    this.startsWithMethionine = protein.startsWithMethionine();
    this.endsWithStop = protein.endsWithStop();
    this.estimatedMolecularWeight = protein.estimatedMolecularWeight();
    this.composition = protein.composition();
    this.result = result;
    this.gcContent = gcContent;
  }

  public static OptimizationReport inputError(String name, int proteinLength, String error) {
    OptimizationReport report = new OptimizationReport(name, proteinLength);
    report.inputError = error;
    return report;
  }

  public String getName() {
    return name;
  }

  public int getProteinLength() {
    return proteinLength;
  }

  public Boolean getStartsWithMethionine() {
    return startsWithMethionine;
  }

  public Boolean getEndsWithStop() {
    return endsWithStop;
  }

  public Integer getEstimatedMolecularWeight() {
    return estimatedMolecularWeight;
  }

  public Map<Character, Integer> getComposition() {
    return composition;
  }

  public Double getGcContent() {
    return gcContent;
  }

  public String getInputError() {
    return inputError;
  }

  public OptimizationResult getResult() {
    return result;
  }

  @JsonIgnore
  public boolean isSuccess() {
    return result != null && result.isSuccess();
  }
}
