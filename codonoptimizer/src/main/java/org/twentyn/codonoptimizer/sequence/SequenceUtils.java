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

package org.twentyn.codonoptimizer.sequence;

/**
 * Utility methods for common molecular biology operations
 */
public class SequenceUtils {

  public static final String NUCLEOTIDES = "ACGT";

  // Degenerate bases and their complements, position for position.
  private static final String IUPAC = "ACGTNRYMKSWBVDH";
  private static final String IUPAC_COMPLEMENT = "TGCANYRKMSWVBHD";

  private SequenceUtils() {
  }

  public static boolean isDna(CharSequence seq) {
    for (int i = 0; i < seq.length(); i++) {
      if (NUCLEOTIDES.indexOf(seq.charAt(i)) < 0) {
        return false;
      }
    }
    return true;
  }

  public static boolean isIupac(CharSequence seq) {
    for (int i = 0; i < seq.length(); i++) {
      if (IUPAC.indexOf(Character.toUpperCase(seq.charAt(i))) < 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Complements a single base, keeping its case.  Degenerate IUPAC codes are supported; anything else is returned
   * unchanged.
   */
  public static char complement(char base) {
    int idx = IUPAC.indexOf(Character.toUpperCase(base));
    if (idx < 0) {
      return base;
    }
    char comp = IUPAC_COMPLEMENT.charAt(idx);
    return Character.isLowerCase(base) ? Character.toLowerCase(comp) : comp;
  }

  public static String complement(String seq) {
    StringBuilder sb = new StringBuilder(seq.length());
    for (int i = 0; i < seq.length(); i++) {
      sb.append(complement(seq.charAt(i)));
    }
    return sb.toString();
  }

  public static String reverseComplement(String seq) {
    StringBuilder sb = new StringBuilder(seq.length());
    for (int i = seq.length() - 1; i >= 0; i--) {
      sb.append(complement(seq.charAt(i)));
    }
    return sb.toString();
  }

  public static double calcGC(String inseq) {
    if (inseq.isEmpty()) {
      return 0.0;
    }
    String seq = inseq.toUpperCase();
    int gc = 0;
    for (int i = 0; i < seq.length(); i++) {
      char achar = seq.charAt(i);
      if (achar == 'C' || achar == 'G') {
        gc++;
      }
    }
    return gc / (double) seq.length();
  }

  /**
   * @return The length of the longest stretch of a single repeated character, 0 for an empty sequence.
   */
  public static int longestHomopolymerRun(CharSequence seq) {
    int best = 0;
    int run = 0;
    for (int i = 0; i < seq.length(); i++) {
      if (i > 0 && seq.charAt(i) == seq.charAt(i - 1)) {
        run++;
      } else {
        run = 1;
      }
      best = Math.max(best, run);
    }
    return best;
  }

  /**
   * Packs a run of 6 nucleotides into a 12 bit integer, 2 bits per base in ACGT order.
   * @return The packed value in [0, 4096), or -1 if a character is not a nucleotide.
   */
  public static int encodeSixmer(CharSequence seq, int start) {
    int code = 0;
    for (int i = start; i < start + 6; i++) {
      int b = NUCLEOTIDES.indexOf(seq.charAt(i));
      if (b < 0) {
        return -1;
      }
      code = (code << 2) | b;
    }
    return code;
  }
}
