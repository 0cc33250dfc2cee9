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

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

public class FastaWriter {

  public static final int DEFAULT_LINE_WIDTH = 80;

  private final int lineWidth;

  public FastaWriter() {
    this(DEFAULT_LINE_WIDTH);
  }

  public FastaWriter(int lineWidth) {
    if (lineWidth <= 0) {
      throw new IllegalArgumentException("Line width must be positive");
    }
    this.lineWidth = lineWidth;
  }

  public void write(File file, List<FastaRecord> records) throws IOException {
    try (BufferedWriter fastaFile = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
      write(fastaFile, records);
    }
  }

  public void write(Writer out, List<FastaRecord> records) throws IOException {
    for (FastaRecord record : records) {
      out.write(">");
      out.write(record.getHeader());
      out.write("\n");
      String seq = record.getSequence();
      for (int i = 0; i < seq.length(); i += lineWidth) {
        out.write(seq, i, Math.min(lineWidth, seq.length() - i));
        out.write("\n");
      }
    }
    out.flush();
  }
}
