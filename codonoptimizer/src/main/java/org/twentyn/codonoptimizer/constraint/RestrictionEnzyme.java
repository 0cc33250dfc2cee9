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

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Arrays.asList;

/**
 * Restriction enzymes whose sites commonly have to be kept out of a synthesized insert.
 */
public enum RestrictionEnzyme {
  PmeI("GTTTAAAC", Type.TYPE_II),
  SwaI("ATTTAAAT", Type.TYPE_II),
  EcoRI("GAATTC", Type.TYPE_II),
  BamHI("GGATCC", Type.TYPE_II),
  NotI("GCGGCCGC", Type.TYPE_II),
  XhoI("CTCGAG", Type.TYPE_II),
  XbaI("TCTAGA", Type.TYPE_II),
  SacII("CCGCGG", Type.TYPE_II),
  KpnI("GGTACC", Type.TYPE_II),
  AvrII("CCTAGG", Type.TYPE_II),
  EcoRV("GATATC", Type.TYPE_II),
  AleI("CACNNNNGTG", Type.TYPE_II),
  // Golden Gate enzymes
  BsaI("GGTCTC", Type.TYPE_IIS),
  BbsI("GAAGAC", Type.TYPE_IIS),
  BsmBI("CGTCTC", Type.TYPE_IIS),
  SapI("GCTCTTC", Type.TYPE_IIS),
  ;

  public enum Type {
    TYPE_II,
    TYPE_IIS,
  }

  public static final Set<RestrictionEnzyme> GOLDEN_GATE =
      Collections.unmodifiableSet(EnumSet.of(BsaI, BbsI, BsmBI, SapI));

  // Sites present in each expression promoter, which therefore must not also appear in the insert.
  private static final Map<String, List<RestrictionEnzyme>> PROMOTER_SITES = new HashMap<String, List<RestrictionEnzyme>>() {{
    put("AOX1", asList(PmeI, SwaI));
    put("GAP", asList(PmeI));
    put("PGK1", asList(PmeI));
    put("FLD1", asList(PmeI));
    put("TEF1", asList(PmeI));
  }};

  private final String recognitionSequence;
  private final Type type;

  RestrictionEnzyme(String recognitionSequence, Type type) {
    this.recognitionSequence = recognitionSequence;
    this.type = type;
  }

  public String getRecognitionSequence() {
    return recognitionSequence;
  }

  public Type getType() {
    return type;
  }

  /**
   * Case-insensitive lookup by enzyme name.
   * @throws IllegalArgumentException If there is no such enzyme.
   */
  public static RestrictionEnzyme byName(String name) {
    for (RestrictionEnzyme enzyme : values()) {
      if (enzyme.name().equalsIgnoreCase(name.trim())) {
        return enzyme;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown restriction enzyme: %s", name));
  }

  /**
   * @return The enzymes with sites in the named promoter; empty for an unknown promoter.
   */
  public static List<RestrictionEnzyme> forPromoter(String promoter) {
    return PROMOTER_SITES.getOrDefault(promoter.toUpperCase(), Collections.emptyList());
  }
}
