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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads multi-record FASTA text.  The first word after '>' is the record name, the rest of the header line its
 * description.  Sequence lines are concatenated with whitespace removed; records without any sequence are skipped.
 */
public class FastaReader {

  private static final Logger LOGGER = LogManager.getFormatterLogger(FastaReader.class);

  private static final String HEADER_PREFIX = ">";
  private static final String COMMENT_PREFIX = ";";

  public List<FastaRecord> read(File file) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return read(reader);
    }
  }

  public List<FastaRecord> read(String content) throws IOException {
    try (BufferedReader reader = new BufferedReader(new StringReader(content))) {
      return read(reader);
    }
  }

  public List<FastaRecord> read(Reader in) throws IOException {
    BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
    List<FastaRecord> records = new ArrayList<>();

    String name = null;
    String description = null;
    StringBuilder sequence = new StringBuilder();
    int unnamed = 0;

    String line;
    while ((line = reader.readLine()) != null) {
      line = line.trim();
      if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
        continue;
      }

      if (line.startsWith(HEADER_PREFIX)) {
        addRecord(records, name, description, sequence);
        String header = line.substring(1).trim();
        int split = header.indexOf(' ');
        if (header.isEmpty()) {
          unnamed++;
          name = "sequence_" + unnamed;
          description = "";
        } else if (split < 0) {
          name = header;
          description = "";
        } else {
          name = header.substring(0, split);
          description = header.substring(split + 1).trim();
        }
        sequence = new StringBuilder();
      } else {
        if (name == null) {
          // Sequence text before any header: treat the whole block as one anonymous record.
          unnamed++;
          name = "sequence_" + unnamed;
          description = "";
        }
        sequence.append(line.replaceAll("\\s+", ""));
      }
    }
    addRecord(records, name, description, sequence);

    LOGGER.debug("Read %d FASTA records", records.size());
    return records;
  }

  private void addRecord(List<FastaRecord> records, String name, String description, StringBuilder sequence) {
    if (name == null) {
      return;
    }
    if (sequence.length() == 0) {
      LOGGER.warn("FASTA record %s has no sequence, skipping it", name);
      return;
    }
    records.add(new FastaRecord(name, description, sequence.toString()));
  }
}
