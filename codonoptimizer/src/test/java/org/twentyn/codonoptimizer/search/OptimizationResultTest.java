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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class OptimizationResultTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  public void testSuccessJson() throws Exception {
    JsonNode json = mapper.valueToTree(OptimizationResult.success("ATGAAGACC", 3.0, 12L, 4L));

    assertTrue(json.get("success").asBoolean());
    assertEquals("ATGAAGACC", json.get("dna_sequence").asText());
    assertEquals(3.0, json.get("score").asDouble(), 1e-9);
    assertEquals(4L, json.get("rejected_candidates").asLong());
    assertFalse("Absent fields are left out", json.has("failure_reason"));
    assertFalse(json.has("failed_position"));
    assertFalse(json.has("failure"));
  }

  @Test
  public void testFailureJson() throws Exception {
    OptimizationResult result =
        OptimizationResult.failure(FailureReason.NO_VALID_SEQUENCE, "All candidates excluded", 2, 1L, 9L);
    JsonNode json = mapper.valueToTree(result);

    assertFalse(json.get("success").asBoolean());
    assertEquals("NO_VALID_SEQUENCE", json.get("failure_reason").asText());
    assertEquals(2, json.get("failed_position").asInt());
    assertFalse(json.has("dna_sequence"));
    assertFalse(json.has("score"));
  }
}
