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

/**
 * One atom token found while scanning a formula, tagged with the bracket depth it was read at.
 * The count starts at 1 and is rewritten by the scanner when a count or a group multiplier follows.
 */
public class AtomOccurrence {
  private ElementSymbol element;
  private int depth;
  private int count;

  public AtomOccurrence(ElementSymbol element, int depth) {
    this(element, depth, 1);
  }

  public AtomOccurrence(ElementSymbol element, int depth, int count) {
    this.element = element;
    this.depth = depth;
    this.count = count;
  }

  public ElementSymbol getElement() {
    return element;
  }

  public String getSymbol() {
    return element.getSymbol();
  }

  public int getDepth() {
    return depth;
  }

  public int getCount() {
    return count;
  }

  void setCount(int count) {
    this.count = count;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    AtomOccurrence that = (AtomOccurrence) o;

    if (depth != that.depth) return false;
    if (count != that.count) return false;
    return element == that.element;
  }

  @Override
  public int hashCode() {
    int result = element.hashCode();
    result = 31 * result + depth;
    result = 31 * result + count;
    return result;
  }

  @Override
  public String toString() {
    return String.format("%s c=%d d=%d", getSymbol(), count, depth);
  }
}
