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

import org.twentyn.codonoptimizer.sequence.SequenceUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Context scores keyed by amino-acid triplet, then by the 9 nucleotide window that realizes the triplet.
 *
 * Tables are immutable once built and are meant to be loaded once and shared by every search.
 */
public class ScoreTable {

  public static final int CONTEXT_LENGTH = 3;
  public static final int WINDOW_LENGTH = 9;

  private final Map<String, Map<String, Double>> scores;
  private final int windowCount;

  private ScoreTable(Map<String, Map<String, Double>> scores, int windowCount) {
    this.scores = scores;
    this.windowCount = windowCount;
  }

  public static ScoreTable empty() {
    return new ScoreTable(Collections.emptyMap(), 0);
  }

  /**
   * Copies and validates a raw triplet -> window -> score map.
   * @throws IllegalArgumentException If a triplet key is not 3 characters, a window is not 9 nucleotides, or a score
   * is missing.
   */
  public static ScoreTable of(Map<String, ? extends Map<String, ? extends Number>> raw) {
    Builder builder = new Builder();
    for (Map.Entry<String, ? extends Map<String, ? extends Number>> context : raw.entrySet()) {
      for (Map.Entry<String, ? extends Number> window : context.getValue().entrySet()) {
        if (window.getValue() == null) {
          throw new IllegalArgumentException(
              String.format("Missing score for %s / %s", context.getKey(), window.getKey()));
        }
        builder.put(context.getKey(), window.getKey(), window.getValue().doubleValue());
      }
    }
    return builder.build();
  }

  /**
   * Looks up one window.  Absence is an expected outcome for sparse tables, so it is reported as an empty optional
   * rather than an exception.
   */
  public OptionalDouble lookup(String aminoAcidContext, String window) {
    Map<String, Double> windows = scores.get(aminoAcidContext);
    if (windows == null) {
      return OptionalDouble.empty();
    }
    Double score = windows.get(window);
    return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
  }

  public boolean hasContext(String aminoAcidContext) {
    return scores.containsKey(aminoAcidContext);
  }

  public int contextCount() {
    return scores.size();
  }

  public int windowCount() {
    return windowCount;
  }

  public static class Builder {
    private final Map<String, Map<String, Double>> scores = new HashMap<>();
    private int windowCount = 0;

    public Builder put(String aminoAcidContext, String window, double score) {
      String context = aminoAcidContext.toUpperCase();
      String dna = window.toUpperCase();
      if (context.length() != CONTEXT_LENGTH) {
        throw new IllegalArgumentException(String.format("Context key %s is not an amino-acid triplet", aminoAcidContext));
      }
      if (dna.length() != WINDOW_LENGTH || !SequenceUtils.isDna(dna)) {
        throw new IllegalArgumentException(String.format("Window %s (context %s) is not a 9-nt DNA window",
            window, aminoAcidContext));
      }
      if (scores.computeIfAbsent(context, k -> new HashMap<>()).put(dna, score) == null) {
        windowCount++;
      }
      return this;
    }

    public ScoreTable build() {
      Map<String, Map<String, Double>> copy = new HashMap<>();
      for (Map.Entry<String, Map<String, Double>> entry : scores.entrySet()) {
        copy.put(entry.getKey(), Collections.unmodifiableMap(new HashMap<>(entry.getValue())));
      }
      return new ScoreTable(Collections.unmodifiableMap(copy), windowCount);
    }
  }
}
