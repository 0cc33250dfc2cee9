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

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.twentyn.codonoptimizer.sequence.SequenceUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Parses newline-delimited exclusion motifs.
 *
 * <pre>
 *   GAATTC            # EcoRI
 *   CACNNNNGTG        # AleI, degenerate bases become character classes
 *   ATG(A{5,})        # anything else is a regular expression
 *   TAG @codon        # only when it starts on a codon boundary
 * </pre>
 *
 * Text after '#' is a comment and becomes the motif's label.  FASTA headers ('>' lines) are ignored so that a file of
 * disallowed sequences can be used as-is.  A regular expression that does not compile is logged and skipped.
 */
public class ExclusionSetParser {

  private static final Logger LOGGER = LogManager.getFormatterLogger(ExclusionSetParser.class);

  public static final String COMMENT = "#";
  public static final String CODON_ALIGNED_SUFFIX = "@codon";

  public ExclusionSet parse(File file) throws IOException {
    ExclusionSet set = parse(new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8));
    LOGGER.info("Read %d exclusion motifs from %s", set.size(), file.getAbsolutePath());
    return set;
  }

  public ExclusionSet parse(String content) {
    List<ExclusionMotif> motifs = new ArrayList<>();
    String[] lines = content.split("\\r?\\n|\\r");
    for (int i = 0; i < lines.length; i++) {
      ExclusionMotif motif = parseLine(lines[i], i + 1);
      if (motif != null) {
        motifs.add(motif);
      }
    }
    return new ExclusionSet(motifs);
  }

  ExclusionMotif parseLine(String line, int lineNumber) {
    String label = "";
    String body = line;
    int comment = line.indexOf(COMMENT);
    if (comment >= 0) {
      label = line.substring(comment + 1).trim();
      body = line.substring(0, comment);
    }
    body = body.trim();
    if (body.isEmpty() || body.startsWith(">")) {
      return null;
    }

    boolean codonAligned = false;
    if (body.endsWith(CODON_ALIGNED_SUFFIX)) {
      codonAligned = true;
      body = StringUtils.removeEnd(body, CODON_ALIGNED_SUFFIX).trim();
    }

    if (SequenceUtils.isDna(body.toUpperCase())) {
      return ExclusionMotif.literal(body, label, codonAligned);
    }
    if (SequenceUtils.isIupac(body)) {
      return ExclusionMotif.iupac(body, label, codonAligned);
    }
    try {
      return ExclusionMotif.regex(body, label, codonAligned);
    } catch (PatternSyntaxException e) {
      LOGGER.warn("Invalid exclusion pattern on line %d, skipping it: %s (%s)", lineNumber, body, e.getDescription());
      return null;
    }
  }
}
