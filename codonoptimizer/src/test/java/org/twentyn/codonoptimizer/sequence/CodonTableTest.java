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

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CodonTableTest {

  private final CodonTable table = CodonTable.standard();

  @Test
  public void testStandardTableCoversAllCodons() throws Exception {
    int total = 0;
    for (Character residue : table.residues()) {
      total += table.synonyms(residue).size();
    }
    assertEquals("Every one of the 64 codons should be assigned", 64, total);
    assertEquals("20 amino acids plus stop", 21, table.residues().size());
  }

  @Test
  public void testSynonymsAreSorted() throws Exception {
    assertEquals(Arrays.asList("CTA", "CTC", "CTG", "CTT", "TTA", "TTG"), table.synonyms('L'));
    assertEquals(Arrays.asList("TAA", "TAG", "TGA"), table.synonyms(CodonTable.STOP));
    assertEquals(Collections.singletonList("ATG"), table.synonyms('M'));
    assertEquals(Collections.singletonList("TGG"), table.synonyms('W'));
  }

  @Test
  public void testSynonymsReturnsSameList() throws Exception {
    assertTrue("Repeated calls should hand back the same list", table.synonyms('S') == table.synonyms('S'));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testSynonymsAreUnmodifiable() throws Exception {
    table.synonyms('A').add("AAA");
  }

  @Test(expected = UnknownResidueException.class)
  public void testUnknownResidue() throws Exception {
    table.synonyms('X');
  }

  @Test
  public void testIsResidue() throws Exception {
    assertTrue(table.isResidue('K'));
    assertTrue(table.isResidue('*'));
    assertFalse(table.isResidue('B'));
    assertFalse(table.isResidue('k'));
  }

  @Test
  public void testAminoAcidOf() throws Exception {
    assertEquals('K', table.aminoAcidOf("AAA"));
    assertEquals('K', table.aminoAcidOf("aag"));
    assertEquals('*', table.aminoAcidOf("TGA"));
  }

  @Test
  public void testTranslate() throws Exception {
    assertEquals("MKT", table.translate("ATGAAAACC").toString());
    assertEquals("Lower case DNA should translate", "MKT", table.translate("atgaagacg").toString());
  }

  @Test
  public void testTranslateContinuesPastStop() throws Exception {
    assertEquals("M*K", table.translate("ATGTAAAAA").toString());
  }

  @Test(expected = InvalidLengthException.class)
  public void testTranslateRejectsPartialCodon() throws Exception {
    table.translate("ATGA");
  }

  @Test(expected = InvalidLengthException.class)
  public void testTranslateRejectsEmpty() throws Exception {
    table.translate("");
  }

  @Test(expected = UnknownCodonException.class)
  public void testTranslateRejectsNonNucleotides() throws Exception {
    table.translate("ATGNNN");
  }

  @Test
  public void testCustomTable() throws Exception {
    CodonTable tiny = new CodonTable(new java.util.HashMap<String, Character>() {{
      put("GCT", 'A');
      put("GCC", 'A');
      put("TAA", '*');
    }});
    List<String> alanine = tiny.synonyms('A');
    assertEquals(Arrays.asList("GCC", "GCT"), alanine);
    assertFalse("Custom table should only know its own residues", tiny.isResidue('M'));
    assertEquals("A*", tiny.translate("GCTTAA").toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCustomTableRejectsBadCodon() throws Exception {
    new CodonTable(Collections.singletonMap("GCTA", 'A'));
  }
}
