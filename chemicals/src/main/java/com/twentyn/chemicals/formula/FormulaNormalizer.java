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

import java.util.List;
import java.util.Map;

/**
 * Converts formula strings, possibly containing nested groups and multipliers, into empirical formulae.
 * For example "Cl(CaC2(NaCl)3)2" becomes "C4Ca2Cl7Na6" and "CH3CH2CH2Br" becomes "C3H7Br".
 *
 * A normalizer keeps no per-call state: a single instance can serve concurrent callers.
 */
public class FormulaNormalizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FormulaNormalizer.class);

  private FormulaScanner scanner;
  private FormulaAggregator aggregator;
  private HillFormulaFormatter formatter;

  public FormulaNormalizer() {
    this(UnattachedCountPolicy.REJECT);
  }

  public FormulaNormalizer(UnattachedCountPolicy unattachedCountPolicy) {
    this.scanner = new FormulaScanner(unattachedCountPolicy);
    this.aggregator = new FormulaAggregator();
    this.formatter = new HillFormulaFormatter();
  }

  /**
   * Parses a formula string into its empirical formula.
   * @param formula the formula as written, for example "C6H5CH=CHCHO"
   * @return the empirical formula
   * @throws FormulaParseException if the formula can't be parsed; no partial result is produced
   */
  public EmpiricalFormula parse(String formula) throws FormulaParseException {
    List<AtomOccurrence> occurrences = scanner.scan(formula);
    Map<String, Integer> totals = aggregator.aggregate(occurrences);
    EmpiricalFormula empiricalFormula = new EmpiricalFormula(totals, formatter.format(totals));
    LOGGER.debug("normalized %s to %s", formula, empiricalFormula);
    return empiricalFormula;
  }

  /**
   * Parses a formula string and returns its canonical, Hill ordered representation.
   * @param formula the formula as written
   * @return the canonical formula string
   * @throws FormulaParseException if the formula can't be parsed
   */
  public String normalize(String formula) throws FormulaParseException {
    return parse(formula).toString();
  }

  /**
   * Checks whether two formula strings describe the same compound composition, e.g. "CH3COOH" and "C2H4O2".
   * @throws FormulaParseException if either formula can't be parsed
   */
  public boolean isSameFormula(String formula1, String formula2) throws FormulaParseException {
    return parse(formula1).equals(parse(formula2));
  }
}
