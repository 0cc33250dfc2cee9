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

import java.util.Objects;

public class FastaRecord {

  private final String name;
  private final String description;
  private final String sequence;

  public FastaRecord(String name, String description, String sequence) {
    this.name = name;
    this.description = description == null ? "" : description;
    this.sequence = sequence;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public String getSequence() {
    return sequence;
  }

  public String getHeader() {
    return description.isEmpty() ? name : name + " " + description;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    FastaRecord that = (FastaRecord) o;
    return name.equals(that.name) && description.equals(that.description) && sequence.equals(that.sequence);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, sequence);
  }

  @Override
  public String toString() {
    return ">" + getHeader() + " (" + sequence.length() + ")";
  }
}
