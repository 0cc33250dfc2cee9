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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The genetic code in both directions: amino acid to its synonymous codons, and codon to amino acid.
 *
 * Synonym lists are sorted lexicographically and never change once the table is built, so that every search that
 * iterates over them breaks ties the same way.  Tables are plain values: build one with {@link #standard()} or
 * {@link #CodonTable(Map)} and hand it to whatever needs it.
 */
public class CodonTable {

  public static final char STOP = '*';

  private final Map<String, Character> codonToAminoAcid;
  private final Map<Character, List<String>> aminoAcidToCodons;

  /**
   * @param geneticCode A map from every 3-nucleotide codon to the one-letter amino acid (or '*') it encodes.
   */
  public CodonTable(Map<String, Character> geneticCode) {
    Map<String, Character> codons = new HashMap<>();
    Map<Character, List<String>> synonyms = new TreeMap<>();
    for (Map.Entry<String, Character> entry : geneticCode.entrySet()) {
      String codon = entry.getKey().toUpperCase();
      if (!SequenceUtils.isDna(codon) || codon.length() != 3) {
        throw new IllegalArgumentException(String.format("Not a codon: %s", entry.getKey()));
      }
      codons.put(codon, entry.getValue());
      synonyms.computeIfAbsent(entry.getValue(), k -> new ArrayList<>()).add(codon);
    }

    Map<Character, List<String>> sorted = new HashMap<>();
    for (Map.Entry<Character, List<String>> entry : synonyms.entrySet()) {
      List<String> list = entry.getValue();
      Collections.sort(list);
      sorted.put(entry.getKey(), Collections.unmodifiableList(list));
    }

    this.codonToAminoAcid = Collections.unmodifiableMap(codons);
    this.aminoAcidToCodons = Collections.unmodifiableMap(sorted);
  }

  /**
   * @return A new table holding the standard genetic code.
   */
  public static CodonTable standard() {
    Map<String, Character> geneticCode = new HashMap<>();

    geneticCode.put("TCA", 'S');
    geneticCode.put("TCC", 'S');
    geneticCode.put("TCG", 'S');
    geneticCode.put("TCT", 'S');
    geneticCode.put("TTC", 'F');
    geneticCode.put("TTT", 'F');
    geneticCode.put("TTA", 'L');
    geneticCode.put("TTG", 'L');
    geneticCode.put("TAC", 'Y');
    geneticCode.put("TAT", 'Y');
    geneticCode.put("TAA", STOP);
    geneticCode.put("TAG", STOP);
    geneticCode.put("TGC", 'C');
    geneticCode.put("TGT", 'C');
    geneticCode.put("TGA", STOP);
    geneticCode.put("TGG", 'W');
    geneticCode.put("CTA", 'L');
    geneticCode.put("CTC", 'L');
    geneticCode.put("CTG", 'L');
    geneticCode.put("CTT", 'L');
    geneticCode.put("CCA", 'P');
    geneticCode.put("CCC", 'P');
    geneticCode.put("CCG", 'P');
    geneticCode.put("CCT", 'P');
    geneticCode.put("CAC", 'H');
    geneticCode.put("CAT", 'H');
    geneticCode.put("CAA", 'Q');
    geneticCode.put("CAG", 'Q');
    geneticCode.put("CGA", 'R');
    geneticCode.put("CGC", 'R');
    geneticCode.put("CGG", 'R');
    geneticCode.put("CGT", 'R');
    geneticCode.put("ATA", 'I');
    geneticCode.put("ATC", 'I');
    geneticCode.put("ATT", 'I');
    geneticCode.put("ATG", 'M');
    geneticCode.put("ACA", 'T');
    geneticCode.put("ACC", 'T');
    geneticCode.put("ACG", 'T');
    geneticCode.put("ACT", 'T');
    geneticCode.put("AAC", 'N');
    geneticCode.put("AAT", 'N');
    geneticCode.put("AAA", 'K');
    geneticCode.put("AAG", 'K');
    geneticCode.put("AGC", 'S');
    geneticCode.put("AGT", 'S');
    geneticCode.put("AGA", 'R');
    geneticCode.put("AGG", 'R');
    geneticCode.put("GTA", 'V');
    geneticCode.put("GTC", 'V');
    geneticCode.put("GTG", 'V');
    geneticCode.put("GTT", 'V');
    geneticCode.put("GCA", 'A');
    geneticCode.put("GCC", 'A');
    geneticCode.put("GCG", 'A');
    geneticCode.put("GCT", 'A');
    geneticCode.put("GAC", 'D');
    geneticCode.put("GAT", 'D');
    geneticCode.put("GAA", 'E');
    geneticCode.put("GAG", 'E');
    geneticCode.put("GGA", 'G');
    geneticCode.put("GGC", 'G');
    geneticCode.put("GGG", 'G');
    geneticCode.put("GGT", 'G');

    return new CodonTable(geneticCode);
  }

  /**
   * Returns the codons encoding an amino acid, in lexicographic order.  The same list is returned on every call.
   * @param aminoAcid A one-letter amino acid code, or '*' for stop.
   * @return An unmodifiable, non-empty list of codons.
   * @throws UnknownResidueException If the amino acid is not encoded by this table.
   */
  public List<String> synonyms(char aminoAcid) {
    List<String> codons = aminoAcidToCodons.get(aminoAcid);
    if (codons == null) {
      throw new UnknownResidueException(aminoAcid);
    }
    return codons;
  }

  public boolean isResidue(char aminoAcid) {
    return aminoAcidToCodons.containsKey(aminoAcid);
  }

  public Set<Character> residues() {
    return aminoAcidToCodons.keySet();
  }

  public char aminoAcidOf(String codon) {
    Character aa = codonToAminoAcid.get(codon.toUpperCase());
    if (aa == null) {
      throw new UnknownCodonException(codon);
    }
    return aa;
  }

  /**
   * Translates a DNA sequence codon by codon.  Stop codons become '*' and translation carries on past them.
   * @param dna A DNA sequence whose length is a positive multiple of 3.
   * @return The encoded amino-acid sequence.
   * @throws InvalidLengthException If the length is zero or not a multiple of 3.
   * @throws UnknownCodonException If any triplet is not in the table.
   */
  public AminoAcidSequence translate(String dna) {
    if (dna.isEmpty() || dna.length() % 3 != 0) {
      throw new InvalidLengthException(dna.length());
    }
    String dnaseq = dna.toUpperCase();
    StringBuilder out = new StringBuilder(dnaseq.length() / 3);
    for (int i = 0; i < dnaseq.length(); i += 3) {
      out.append(aminoAcidOf(dnaseq.substring(i, i + 3)));
    }
    return AminoAcidSequence.of(out.toString());
  }
}
