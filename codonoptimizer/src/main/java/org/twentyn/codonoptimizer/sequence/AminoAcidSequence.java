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

import java.util.Map;
import java.util.TreeMap;

/**
 * An immutable protein sequence over the 20 standard one-letter amino acid codes plus '*' for stop.
 */
public final class AminoAcidSequence implements CharSequence {

  public static final String ALPHABET = "ACDEFGHIKLMNPQRSTVWY*";

  // Average residue mass, used for the rough molecular weight estimate.
  private static final int AVERAGE_AA_WEIGHT_DA = 110;

  private final String residues;

  private AminoAcidSequence(String residues) {
    this.residues = residues;
  }

  /**
   * Strict constructor: the input must already be upper-case residues with nothing else in it.
   * @throws EmptySequenceException If the input is null or empty.
   * @throws UnknownResidueException On the first character outside of {@link #ALPHABET}.
   */
  public static AminoAcidSequence of(String residues) {
    if (residues == null || residues.isEmpty()) {
      throw new EmptySequenceException();
    }
    for (int i = 0; i < residues.length(); i++) {
      char c = residues.charAt(i);
      if (ALPHABET.indexOf(c) < 0) {
        throw new UnknownResidueException(c, i);
      }
    }
    return new AminoAcidSequence(residues);
  }

  /**
   * Lenient constructor for user-supplied text: upper-cases it, drops every character other than a letter or '*',
   * then validates the rest like {@link #of(String)}.
   */
  public static AminoAcidSequence clean(String text) {
    if (text == null) {
      throw new EmptySequenceException();
    }
    String cleaned = text.toUpperCase().replaceAll("[^A-Z*]", "");
    if (cleaned.isEmpty()) {
      throw new EmptySequenceException("Sequence is empty after cleaning");
    }
    return of(cleaned);
  }

  public boolean startsWithMethionine() {
    return residues.charAt(0) == 'M';
  }

  public boolean endsWithStop() {
    return residues.charAt(residues.length() - 1) == CodonTable.STOP;
  }

  public int estimatedMolecularWeight() {
    return residues.length() * AVERAGE_AA_WEIGHT_DA;
  }

  /**
   * @return Residue counts, keyed in alphabetical order.
   */
  public Map<Character, Integer> composition() {
    Map<Character, Integer> counts = new TreeMap<>();
    for (int i = 0; i < residues.length(); i++) {
      counts.merge(residues.charAt(i), 1, Integer::sum);
    }
    return counts;
  }

  @Override
  public int length() {
    return residues.length();
  }

  @Override
  public char charAt(int index) {
    return residues.charAt(index);
  }

  @Override
  public CharSequence subSequence(int start, int end) {
    return residues.subSequence(start, end);
  }

  @Override
  public String toString() {
    return residues;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return residues.equals(((AminoAcidSequence) o).residues);
  }

  @Override
  public int hashCode() {
    return residues.hashCode();
  }
}
