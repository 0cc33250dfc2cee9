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

import org.twentyn.codonoptimizer.sequence.AminoAcidSequence;

/**
 * Reverse-translates a protein into DNA, picking synonymous codons to maximize context score under the configured
 * design constraints.  Implementations hold only read-only state, so one instance can serve concurrent calls.
 */
public interface CodonOptimizer {

  /**
   * @throws org.twentyn.codonoptimizer.sequence.SequenceFormatException If the sequence is empty or holds an unknown
   * residue.
   */
  OptimizationResult optimize(String proteinSequence);

  OptimizationResult optimize(AminoAcidSequence protein);
}
