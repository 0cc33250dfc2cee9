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
 * A residue outside of the 20 standard amino acids and the stop symbol.
 */
public class UnknownResidueException extends SequenceFormatException {

  private final char residue;
  private final int index;

  public UnknownResidueException(char residue) {
    this(residue, -1);
  }

  public UnknownResidueException(char residue, int index) {
    super(index < 0 ?
        String.format("Invalid amino acid: %s", residue) :
        String.format("Invalid amino acid '%s' at position %d", residue, index + 1));
    this.residue = residue;
    this.index = index;
  }

  public char getResidue() {
    return residue;
  }

  /**
   * @return The 0-based index of the residue in the offending sequence, or -1 if it was looked up on its own.
   */
  public int getIndex() {
    return index;
  }
}
