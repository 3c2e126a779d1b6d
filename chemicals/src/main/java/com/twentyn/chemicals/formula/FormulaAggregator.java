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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sums the counts of atom occurrences per element symbol.  The same element may occur several times at different
 * depths ("CH3CH2OH" has three H occurrences), all of them roll into a single total.
 */
public class FormulaAggregator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FormulaAggregator.class);

  /**
   * @param occurrences occurrences produced by a {@link FormulaScanner}
   * @return a map {symbol -> total count}, in order of first appearance
   * @throws FormulaParseException if an occurrence does not carry a known element or a total overflows
   */
  public Map<String, Integer> aggregate(List<AtomOccurrence> occurrences) throws FormulaParseException {
    Map<String, Integer> totals = new LinkedHashMap<>();

    for (AtomOccurrence occurrence : occurrences) {
      if (occurrence.getElement() == null) {
        // The scanner only ever creates occurrences from the symbol table.
        throw new FormulaParseException(FormulaParseException.Reason.INTERNAL_AGGREGATION_FAULT, null, -1);
      }

      String symbol = occurrence.getSymbol();
      Integer runningTotal = totals.getOrDefault(symbol, 0);
      try {
        totals.put(symbol, Math.addExact(runningTotal, occurrence.getCount()));
      } catch (ArithmeticException e) {
        throw new FormulaParseException(FormulaParseException.Reason.COUNT_OVERFLOW, symbol, -1, e);
      }
    }

    LOGGER.debug("atom totals: %s", totals);
    return totals;
  }
}
