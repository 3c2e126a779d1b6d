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

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FormulaScannerTest {

  private FormulaScanner scanner;

  @Before
  public void setUp() {
    scanner = new FormulaScanner();
  }

  @Test
  public void testNestedGroupMultipliers() throws Exception {
    List<AtomOccurrence> occurrences = scanner.scan("Cl(CaC2(NaCl)3)2.Na=P");

    // Inner group is multiplied by 3 then by 2, the outer group by 2 only, atoms at depth 0 are never touched.
    List<AtomOccurrence> expected = Arrays.asList(
        new AtomOccurrence(ElementSymbol.CHLORINE, 0, 1),
        new AtomOccurrence(ElementSymbol.CALCIUM, 1, 2),
        new AtomOccurrence(ElementSymbol.CARBON, 1, 4),
        new AtomOccurrence(ElementSymbol.SODIUM, 2, 6),
        new AtomOccurrence(ElementSymbol.CHLORINE, 2, 6),
        new AtomOccurrence(ElementSymbol.SODIUM, 0, 1),
        new AtomOccurrence(ElementSymbol.PHOSPHORUS, 0, 1)
    );
    assertEquals(expected, occurrences);
  }

  @Test
  public void testCountOverridesLastAtom() throws Exception {
    List<AtomOccurrence> occurrences = scanner.scan("C12H22O11");
    assertEquals(3, occurrences.size());
    assertEquals(12, occurrences.get(0).getCount());
    assertEquals(22, occurrences.get(1).getCount());
    assertEquals(11, occurrences.get(2).getCount());
  }

  @Test
  public void testSquareBracketsAndParenthesesNest() throws Exception {
    List<AtomOccurrence> occurrences = scanner.scan("[Cu(NH3)4]SO4");
    List<AtomOccurrence> expected = Arrays.asList(
        new AtomOccurrence(ElementSymbol.COPPER, 1, 1),
        new AtomOccurrence(ElementSymbol.NITROGEN, 2, 4),
        new AtomOccurrence(ElementSymbol.HYDROGEN, 2, 12),
        new AtomOccurrence(ElementSymbol.SULFUR, 0, 1),
        new AtomOccurrence(ElementSymbol.OXYGEN, 0, 4)
    );
    assertEquals(expected, occurrences);
  }

  @Test
  public void testGroupWithoutMultiplierKeepsCounts() throws Exception {
    List<AtomOccurrence> occurrences = scanner.scan("(H2O)");
    assertEquals(Arrays.asList(
        new AtomOccurrence(ElementSymbol.HYDROGEN, 1, 2),
        new AtomOccurrence(ElementSymbol.OXYGEN, 1, 1)
    ), occurrences);
  }

  @Test
  public void testMultipliersOnlyReachTheClosedGroup() throws Exception {
    // The second group sits at the same depth as the first one but was read after the multiplier.
    List<AtomOccurrence> occurrences = scanner.scan("(OH)2(H2O)");
    assertEquals(Arrays.asList(
        new AtomOccurrence(ElementSymbol.OXYGEN, 1, 2),
        new AtomOccurrence(ElementSymbol.HYDROGEN, 1, 2),
        new AtomOccurrence(ElementSymbol.HYDROGEN, 1, 2),
        new AtomOccurrence(ElementSymbol.OXYGEN, 1, 1)
    ), occurrences);
  }

  @Test
  public void testTwoLetterSymbolsWin() throws Exception {
    assertEquals(Collections.singletonList(new AtomOccurrence(ElementSymbol.COBALT, 0)), scanner.scan("Co"));
    assertEquals(Arrays.asList(
        new AtomOccurrence(ElementSymbol.CARBON, 0),
        new AtomOccurrence(ElementSymbol.OXYGEN, 0)
    ), scanner.scan("CO"));
  }

  @Test
  public void testFallsBackToSingleLetterSymbol() throws Exception {
    // "Cx" is not an element, the scanner keeps "C" and skips the stray lowercase letter.
    assertEquals(Collections.singletonList(new AtomOccurrence(ElementSymbol.CARBON, 0)), scanner.scan("Cx"));
  }

  @Test
  public void testOtherCharactersAreIgnored() throws Exception {
    List<AtomOccurrence> occurrences = scanner.scan(" Na+ . Cl- ");
    assertEquals(Arrays.asList(
        new AtomOccurrence(ElementSymbol.SODIUM, 0),
        new AtomOccurrence(ElementSymbol.CHLORINE, 0)
    ), occurrences);
  }

  @Test
  public void testEmptyFormula() throws Exception {
    assertTrue(scanner.scan("").isEmpty());
  }

  @Test
  public void testUnbalancedClosingBracket() {
    assertFailure(")H2O", FormulaParseException.Reason.UNBALANCED_GROUP, ")", 0);
    assertFailure("H2O)", FormulaParseException.Reason.UNBALANCED_GROUP, ")", 3);
    assertFailure("(H2O)]", FormulaParseException.Reason.UNBALANCED_GROUP, "]", 5);
  }

  @Test
  public void testUnknownAtoms() {
    assertFailure("Xx2", FormulaParseException.Reason.UNKNOWN_ATOM, "Xx", 0);
    assertFailure("Q", FormulaParseException.Reason.UNKNOWN_ATOM, "Q", 0);
    assertFailure("H2Qa", FormulaParseException.Reason.UNKNOWN_ATOM, "Qa", 2);
  }

  @Test
  public void testCountsWithoutContextAreRejected() {
    assertFailure("2H2O", FormulaParseException.Reason.NUMBER_WITHOUT_CONTEXT, "2", 0);
    assertFailure("CuSO4.5H2O", FormulaParseException.Reason.NUMBER_WITHOUT_CONTEXT, "5", 6);
    assertFailure("(2H)", FormulaParseException.Reason.NUMBER_WITHOUT_CONTEXT, "2", 1);
    // Counts are at most two digits long, the third digit has nothing to attach to.
    assertFailure("C123", FormulaParseException.Reason.NUMBER_WITHOUT_CONTEXT, "3", 3);
  }

  @Test
  public void testCountsWithoutContextCanBeIgnored() throws Exception {
    FormulaScanner lenientScanner = new FormulaScanner(UnattachedCountPolicy.IGNORE);
    assertEquals(UnattachedCountPolicy.IGNORE, lenientScanner.getUnattachedCountPolicy());
    assertEquals(Arrays.asList(
        new AtomOccurrence(ElementSymbol.HYDROGEN, 0, 2),
        new AtomOccurrence(ElementSymbol.OXYGEN, 0, 1)
    ), lenientScanner.scan("2H2O"));
  }

  @Test
  public void testMultiplierOverflow() {
    assertFailure("(((((H99)99)99)99)99)99", FormulaParseException.Reason.COUNT_OVERFLOW, "99", -1);
  }

  private void assertFailure(String formula, FormulaParseException.Reason reason, String token, int position) {
    try {
      scanner.scan(formula);
      fail("Expected a parse failure for " + formula);
    } catch (FormulaParseException e) {
      assertEquals(reason, e.getReason());
      assertEquals(token, e.getToken());
      if (position >= 0) {
        assertEquals(position, e.getPosition());
      }
    }
  }
}
