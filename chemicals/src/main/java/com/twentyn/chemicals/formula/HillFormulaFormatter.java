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

import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders element totals following the Hill Order system:
 * Carbon first, Hydrogen second, and all remaining elements in alphabetical order.
 * Hydrogen stays second even when there is no Carbon, so water is "H2O" and sulfuric acid "H2O4S".
 * The count is written after each symbol, except when it is 1.
 */
public class HillFormulaFormatter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(HillFormulaFormatter.class);

  private static final String CARBON = ElementSymbol.CARBON.getSymbol();
  private static final String HYDROGEN = ElementSymbol.HYDROGEN.getSymbol();

  public static final Comparator<String> HILL_ORDER = (String s1, String s2) -> {
    if (s1.equals(s2)) {
      return 0;
    } else if (s1.equals(CARBON)) {
      return -1;
    } else if (s2.equals(CARBON)) {
      return 1;
    } else if (s1.equals(HYDROGEN)) {
      return -1;
    } else if (s2.equals(HYDROGEN)) {
      return 1;
    } else {
      return s1.compareTo(s2);
    }
  };

  /**
   * Sorts element totals in Hill order.
   * @param totals a map {symbol -> count}
   * @return a new sorted map holding the same entries
   */
  public static TreeMap<String, Integer> sortByHillOrder(Map<String, Integer> totals) {
    TreeMap<String, Integer> sorted = new TreeMap<>(HILL_ORDER);
    sorted.putAll(totals);
    return sorted;
  }

  /**
   * For example, the totals (O -> 2, H -> 4, C -> 1) are formatted as "CH4O2".
   * @param totals a map {symbol -> count}
   * @return the canonical formula string, empty if there are no elements
   */
  public String format(Map<String, Integer> totals) {
    StringBuilder builder = new StringBuilder();
    for (Map.Entry<String, Integer> entry : sortByHillOrder(totals).entrySet()) {
      builder.append(entry.getKey());
      Integer count = entry.getValue();
      if (count != 1) {
        builder.append(count.toString());
      }
    }
    String formula = builder.toString();
    LOGGER.debug("final formula: %s", formula);
    return formula;
  }
}
