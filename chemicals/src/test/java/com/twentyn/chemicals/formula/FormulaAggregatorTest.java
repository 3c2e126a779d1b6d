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

package com.twentyn.chemicals.formula;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FormulaAggregatorTest {

  private FormulaAggregator aggregator = new FormulaAggregator();

  @Test
  public void testOccurrencesAtDifferentDepthsAreSummed() throws Exception {
    List<AtomOccurrence> occurrences = Arrays.asList(
        new AtomOccurrence(ElementSymbol.CHLORINE, 0, 1),
        new AtomOccurrence(ElementSymbol.SODIUM, 2, 6),
        new AtomOccurrence(ElementSymbol.CHLORINE, 2, 6),
        new AtomOccurrence(ElementSymbol.SODIUM, 0, 1)
    );
    Map<String, Integer> totals = aggregator.aggregate(occurrences);

    assertEquals(2, totals.size());
    assertEquals(Integer.valueOf(7), totals.get("Cl"));
    assertEquals(Integer.valueOf(7), totals.get("Na"));
    // First appearance order is kept, Hill ordering is the formatter's job.
    assertEquals(Arrays.asList("Cl", "Na"), new ArrayList<>(totals.keySet()));
  }

  @Test
  public void testNoOccurrences() throws Exception {
    assertTrue(aggregator.aggregate(Collections.emptyList()).isEmpty());
  }

  @Test
  public void testTotalOverflow() {
    List<AtomOccurrence> occurrences = Arrays.asList(
        new AtomOccurrence(ElementSymbol.CARBON, 0, Integer.MAX_VALUE),
        new AtomOccurrence(ElementSymbol.CARBON, 1, 1)
    );
    try {
      aggregator.aggregate(occurrences);
      fail("Expected the total to overflow");
    } catch (FormulaParseException e) {
      assertEquals(FormulaParseException.Reason.COUNT_OVERFLOW, e.getReason());
      assertEquals("C", e.getToken());
    }
  }

  @Test
  public void testOccurrenceWithoutElementIsAnInternalFault() {
    try {
      aggregator.aggregate(Collections.singletonList(new AtomOccurrence(null, 0, 1)));
      fail("Expected an internal fault");
    } catch (FormulaParseException e) {
      assertEquals(FormulaParseException.Reason.INTERNAL_AGGREGATION_FAULT, e.getReason());
      assertNull(e.getToken());
      assertEquals(-1, e.getPosition());
    }
  }
}
