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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads a formula string left to right and records every atom it finds along with the bracket depth it was read at.
 * Counts are resolved while scanning, so the returned occurrences already carry their final counts.
 *
 * Walking through "Cl(CaC2(NaCl)3)2.Na=P":
 * <pre>
 *   Cl                     Cl c=1 d=0
 *     (                    depth=1
 *      Ca C 2              Ca c=1 d=1, C c=2 d=1
 *            (             depth=2
 *             Na Cl        Na c=1 d=2, Cl c=1 d=2
 *                  )3      depth=1, every atom with d > 1 is multiplied by 3 (Na c=3, Cl c=3)
 *                    )2    depth=0, every atom with d > 0 is multiplied by 2 (Ca c=2, C c=4, Na c=6, Cl c=6)
 *                      .   ignored
 *                       Na Na c=1 d=0
 *                         =P ignored, P c=1 d=0
 * </pre>
 *
 * A scanner holds no state between calls and can be shared between threads.
 */
public class FormulaScanner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FormulaScanner.class);

  // Counts are assumed to be below 100.
  private static final int MAX_COUNT_DIGITS = 2;

  private UnattachedCountPolicy unattachedCountPolicy;

  public FormulaScanner() {
    this(UnattachedCountPolicy.REJECT);
  }

  public FormulaScanner(UnattachedCountPolicy unattachedCountPolicy) {
    this.unattachedCountPolicy = unattachedCountPolicy;
  }

  public UnattachedCountPolicy getUnattachedCountPolicy() {
    return unattachedCountPolicy;
  }

  /**
   * Scans a formula into its atom occurrences.
   * @param formula the formula string, for example "Cl(CaC2(NaCl)3)2"
   * @return the occurrences in the order they appear in the input
   * @throws FormulaParseException on an unbalanced closing bracket, an unknown atom or a count that can't be attached
   */
  public List<AtomOccurrence> scan(String formula) throws FormulaParseException {
    List<AtomOccurrence> occurrences = new ArrayList<>();

    int cursor = 0;
    int depth = 0;
    TokenClass previous = TokenClass.NONE;

    while (cursor < formula.length()) {
      char current = formula.charAt(cursor);
      LOGGER.debug("current char: %c, depth: %d, previous token: %s", current, depth, previous);

      if (current == '(' || current == '[') {
        depth++;
        cursor++;
        previous = TokenClass.OTHER;
        LOGGER.debug("opening group, depth: %d", depth);

      } else if (current == ')' || current == ']') {
        depth--;
        if (depth < 0) {
          throw new FormulaParseException(
              FormulaParseException.Reason.UNBALANCED_GROUP, String.valueOf(current), cursor);
        }
        cursor++;
        previous = TokenClass.GROUP_CLOSE;
        LOGGER.debug("closing group, depth: %d", depth);

      } else if (isUpperCase(current)) {
        ElementSymbol element = readElement(formula, cursor);
        occurrences.add(new AtomOccurrence(element, depth));
        LOGGER.debug("found atom: %s", element.getSymbol());
        cursor += element.getSymbol().length();
        previous = TokenClass.ATOM;

      } else if (isDigit(current)) {
        int end = cursor + 1;
        while (end < formula.length() && end - cursor < MAX_COUNT_DIGITS && isDigit(formula.charAt(end))) {
          end++;
        }
        String countString = formula.substring(cursor, end);
        applyCount(occurrences, countString, previous, depth, cursor);
        cursor = end;
        // A count never gives context to the digits that may follow it.
        previous = TokenClass.OTHER;

      } else {
        LOGGER.debug("leaving char: %c", current);
        cursor++;
        previous = TokenClass.OTHER;
      }
    }

    LOGGER.debug("scanned %d atom occurrences from %s: %s", occurrences.size(), formula, occurrences);
    return occurrences;
  }

  /**
   * Resolves the element starting at the cursor.  A two letter symbol (uppercase followed by lowercase) wins over the
   * single uppercase letter when both exist; "Co" is cobalt, never carbon followed by a stray "o".
   */
  private ElementSymbol readElement(String formula, int cursor) throws FormulaParseException {
    String single = formula.substring(cursor, cursor + 1);
    String candidate = single;

    if (cursor + 1 < formula.length() && isLowerCase(formula.charAt(cursor + 1))) {
      candidate = formula.substring(cursor, cursor + 2);
      Optional<ElementSymbol> twoLetterElement = ElementSymbol.fromSymbol(candidate);
      if (twoLetterElement.isPresent()) {
        return twoLetterElement.get();
      }
    }

    Optional<ElementSymbol> oneLetterElement = ElementSymbol.fromSymbol(single);
    if (oneLetterElement.isPresent()) {
      return oneLetterElement.get();
    }

    // Report the longest token we tried, "Xx2" fails on "Xx" rather than "X".
    throw new FormulaParseException(FormulaParseException.Reason.UNKNOWN_ATOM, candidate, cursor);
  }

  private void applyCount(List<AtomOccurrence> occurrences, String countString, TokenClass previous,
                          int depth, int cursor) throws FormulaParseException {
    int count;
    try {
      count = Integer.parseUnsignedInt(countString);
    } catch (NumberFormatException e) {
      throw new FormulaParseException(FormulaParseException.Reason.NUMBER_PARSE_FAULT, countString, cursor, e);
    }
    LOGGER.debug("count: %d", count);

    switch (previous) {
      case GROUP_CLOSE:
        // The count multiplies every atom read inside the group that just closed.
        for (AtomOccurrence occurrence : occurrences) {
          if (occurrence.getDepth() > depth) {
            occurrence.setCount(multiply(occurrence.getCount(), count, countString, cursor));
            LOGGER.debug("updating atom count for %s: %d", occurrence.getSymbol(), occurrence.getCount());
          }
        }
        break;
      case ATOM:
        AtomOccurrence last = occurrences.get(occurrences.size() - 1);
        last.setCount(count);
        LOGGER.debug("setting atom count for %s: %d", last.getSymbol(), count);
        break;
      case NONE:
      case OTHER:
      default:
        if (unattachedCountPolicy == UnattachedCountPolicy.IGNORE) {
          LOGGER.debug("ignoring count %s with nothing to attach to", countString);
        } else {
          throw new FormulaParseException(FormulaParseException.Reason.NUMBER_WITHOUT_CONTEXT, countString, cursor);
        }
    }
  }

  private static int multiply(int atomCount, int multiplier, String countString, int cursor)
      throws FormulaParseException {
    try {
      return Math.multiplyExact(atomCount, multiplier);
    } catch (ArithmeticException e) {
      throw new FormulaParseException(FormulaParseException.Reason.COUNT_OVERFLOW, countString, cursor, e);
    }
  }

  // Only ASCII letters and digits are part of the grammar, everything else is skipped.
  private static boolean isUpperCase(char c) {
    return c >= 'A' && c <= 'Z';
  }

  private static boolean isLowerCase(char c) {
    return c >= 'a' && c <= 'z';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
