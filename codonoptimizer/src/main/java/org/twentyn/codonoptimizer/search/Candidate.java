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

import org.twentyn.codonoptimizer.sequence.SequenceUtils;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

/**
 * A partial DNA sequence during search.
 *
 * Candidates are persistent: each one holds its last codon and a pointer to the candidate it extends, so siblings
 * share their common prefix and extending a candidate never changes it.  Besides the prefix, a candidate carries the
 * bookkeeping the incremental constraints need: the trailing homopolymer, the trailing run of identical codons, and
 * the set of 6-mers seen so far.  The 6-mer set is a 4096 bit set that is copied on write, so its cost per candidate
 * does not grow with sequence length.
 */
public final class Candidate {

  private static final int SIXMER_SPACE = 1 << 12;

  private final Candidate parent;
  private final String codon;
  private final int codonCount;
  private final double score;
  private final char lastBase;
  private final int runLength;
  private final int codonRunLength;
  private final BitSet sixmers;

  private Candidate(Candidate parent, String codon, int codonCount, double score, char lastBase, int runLength,
                    int codonRunLength, BitSet sixmers) {
    this.parent = parent;
    this.codon = codon;
    this.codonCount = codonCount;
    this.score = score;
    this.lastBase = lastBase;
    this.runLength = runLength;
    this.codonRunLength = codonRunLength;
    this.sixmers = sixmers;
  }

  /**
   * @param trackSixmers Whether this candidate and its descendants record their 6-mers.
   * @return The empty candidate every search starts from, with score 0.
   */
  public static Candidate root(boolean trackSixmers) {
    return new Candidate(null, null, 0, 0.0, '\0', 0, 0, trackSixmers ? new BitSet(SIXMER_SPACE) : null);
  }

  /**
   * @return A new candidate with the codon appended and the score increased by scoreDelta.
   */
  public Candidate extend(String nextCodon, double scoreDelta) {
    char last = lastBase;
    int run = runLength;
    for (int i = 0; i < nextCodon.length(); i++) {
      char base = nextCodon.charAt(i);
      if (base == last) {
        run++;
      } else {
        last = base;
        run = 1;
      }
    }

    int codonRun = nextCodon.equals(codon) ? codonRunLength + 1 : 1;

    BitSet nextSixmers = sixmers;
    if (sixmers != null) {
      String tail = suffix(5) + nextCodon;
      if (tail.length() >= 6) {
        nextSixmers = (BitSet) sixmers.clone();
        for (int start = 0; start + 6 <= tail.length(); start++) {
          int code = SequenceUtils.encodeSixmer(tail, start);
          if (code >= 0) {
            nextSixmers.set(code);
          }
        }
      }
    }

    return new Candidate(this, nextCodon, codonCount + 1, score + scoreDelta, last, run, codonRun, nextSixmers);
  }

  /**
   * @return The last n nucleotides of this candidate, or all of them if it is shorter.
   */
  public String suffix(int n) {
    if (n <= 0 || codonCount == 0) {
      return "";
    }
    Deque<String> codons = new ArrayDeque<>();
    int collected = 0;
    for (Candidate c = this; c.codon != null && collected < n; c = c.parent) {
      codons.push(c.codon);
      collected += c.codon.length();
    }
    StringBuilder sb = new StringBuilder(collected);
    for (String c : codons) {
      sb.append(c);
    }
    return collected > n ? sb.substring(collected - n) : sb.toString();
  }

  public String toDna() {
    return suffix(getDnaLength());
  }

  public boolean hasSixmer(int code) {
    return sixmers != null && code >= 0 && sixmers.get(code);
  }

  public boolean isTrackingSixmers() {
    return sixmers != null;
  }

  public Candidate getParent() {
    return parent;
  }

  /**
   * @return The last codon, or null for the empty root candidate.
   */
  public String getCodon() {
    return codon;
  }

  public int getCodonCount() {
    return codonCount;
  }

  public int getDnaLength() {
    return codonCount * 3;
  }

  public double getScore() {
    return score;
  }

  /**
   * @return The last nucleotide, or '\0' for the root.
   */
  public char getLastBase() {
    return lastBase;
  }

  public int getRunLength() {
    return runLength;
  }

  public int getCodonRunLength() {
    return codonRunLength;
  }

  @Override
  public String toString() {
    return String.format("Candidate[%d codons, score %.4f]", codonCount, score);
  }
}
