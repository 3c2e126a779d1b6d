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

import java.util.Collections;
import java.util.Map;

/**
 * An empirical formula: the total number of atoms of each element, regardless of how the formula was written.
 * "CH3CH2OH" and "C2H6O" describe the same empirical formula.
 * Instances are immutable and their string form is the canonical, Hill ordered formula.
 */
public class EmpiricalFormula {

  private Map<String, Integer> elementCounts;
  private String canonicalString;

  EmpiricalFormula(Map<String, Integer> elementCounts, String canonicalString) {
    this.elementCounts = Collections.unmodifiableMap(HillFormulaFormatter.sortByHillOrder(elementCounts));
    this.canonicalString = canonicalString;
  }

  /**
   * Get the element counts, iterated in Hill order
   */
  public Map<String, Integer> getElementCounts() {
    return elementCounts;
  }

  /**
   * Get the number of atoms of a given element, 0 if the element is absent
   */
  public Integer getElementCount(String symbol) {
    return elementCounts.getOrDefault(symbol, 0);
  }

  public Integer getElementCount(ElementSymbol element) {
    return getElementCount(element.getSymbol());
  }

  public boolean isEmpty() {
    return elementCounts.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return (o instanceof EmpiricalFormula) && elementCounts.equals(((EmpiricalFormula) o).getElementCounts());
  }

  @Override
  public int hashCode() {
    return elementCounts.hashCode();
  }

  @Override
  public String toString() {
    return canonicalString;
  }
}
