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

import org.twentyn.codonoptimizer.sequence.SequenceUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered, read-only collection of forbidden motifs.  Duplicates are dropped, keeping the first occurrence.
 */
public final class ExclusionSet {

  private static final ExclusionSet EMPTY = new ExclusionSet(Collections.emptyList());

  private final List<ExclusionMotif> motifs;
  private final int lookback;
  private final boolean variableSpan;

  public ExclusionSet(Collection<ExclusionMotif> motifs) {
    this.motifs = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(motifs)));
    int max = 0;
    boolean anyRegex = false;
    for (ExclusionMotif motif : this.motifs) {
      if (motif.getSpan() == ExclusionMotif.VARIABLE_SPAN) {
        anyRegex = true;
      } else {
        max = Math.max(max, motif.getSpan());
      }
    }
    this.lookback = max;
    this.variableSpan = anyRegex;
  }

  public static ExclusionSet empty() {
    return EMPTY;
  }

  /**
   * Builds the exclusions for a set of restriction enzymes: each recognition site and, when it differs, its reverse
   * complement, since the enzyme cuts on either strand.
   */
  public static ExclusionSet forEnzymes(Collection<RestrictionEnzyme> enzymes) {
    List<ExclusionMotif> motifs = new ArrayList<>();
    for (RestrictionEnzyme enzyme : enzymes) {
      String site = enzyme.getRecognitionSequence();
      String rc = SequenceUtils.reverseComplement(site);
      motifs.add(ExclusionMotif.iupac(site, enzyme.name(), false));
      if (!rc.equals(site)) {
        motifs.add(ExclusionMotif.iupac(rc, enzyme.name() + " (reverse complement)", false));
      }
    }
    return new ExclusionSet(motifs);
  }

  public ExclusionSet union(ExclusionSet other) {
    if (other.isEmpty()) {
      return this;
    }
    List<ExclusionMotif> all = new ArrayList<>(motifs);
    all.addAll(other.motifs);
    return new ExclusionSet(all);
  }

  /**
   * @return The first motif found anywhere in the sequence, or null if it is clean.
   */
  public ExclusionMotif findIn(CharSequence sequence) {
    for (ExclusionMotif motif : motifs) {
      if (motif.firstMatch(sequence) >= 0) {
        return motif;
      }
    }
    return null;
  }

  public Set<ExclusionMotif> findAllIn(CharSequence sequence) {
    Set<ExclusionMotif> found = new LinkedHashSet<>();
    for (ExclusionMotif motif : motifs) {
      if (motif.firstMatch(sequence) >= 0) {
        found.add(motif);
      }
    }
    return found;
  }

  /**
   * @return The longest span among the fixed-length (literal and IUPAC) motifs.  Regex motifs are not counted.
   */
  public int getLookback() {
    return lookback;
  }

  /**
   * @return True if some motif is a regular expression, whose matches can be arbitrarily long.
   */
  public boolean hasVariableSpan() {
    return variableSpan;
  }

  public List<ExclusionMotif> getMotifs() {
    return motifs;
  }

  public boolean isEmpty() {
    return motifs.isEmpty();
  }

  public int size() {
    return motifs.size();
  }

  @Override
  public String toString() {
    return "ExclusionSet" + motifs;
  }
}
