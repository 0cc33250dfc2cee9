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

package org.twentyn.codonoptimizer.scoring;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Reads a {@link ScoreTable} from JSON.  Two layouts are accepted: a bare object of
 * <code>{"AAA": {"GCTGCTGCT": 1.5, ...}, ...}</code>, or the same object wrapped under a top level
 * <code>"ninemer_scores"</code> field.
 */
public class ScoreTableLoader {

  private static final Logger LOGGER = LogManager.getFormatterLogger(ScoreTableLoader.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String WRAPPER_FIELD = "ninemer_scores";

  private static final TypeReference<Map<String, Map<String, Double>>> SCORES_TYPE =
      new TypeReference<Map<String, Map<String, Double>>>() {};

  public ScoreTable load(File file) throws IOException {
    ScoreTable table = fromTree(MAPPER.readTree(file));
    LOGGER.info("Loaded %d contexts (%d windows) from %s", table.contextCount(), table.windowCount(),
        file.getAbsolutePath());
    return table;
  }

  public ScoreTable load(InputStream in) throws IOException {
    ScoreTable table = fromTree(MAPPER.readTree(in));
    LOGGER.info("Loaded %d contexts (%d windows)", table.contextCount(), table.windowCount());
    return table;
  }

  private ScoreTable fromTree(JsonNode root) throws IOException {
    if (root == null || !root.isObject()) {
      throw new IOException("Score table JSON must be an object");
    }
    JsonNode scores = root.has(WRAPPER_FIELD) ? root.get(WRAPPER_FIELD) : root;
    Map<String, Map<String, Double>> raw = MAPPER.convertValue(scores, SCORES_TYPE);
    return ScoreTable.of(raw);
  }
}
