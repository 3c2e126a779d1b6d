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
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Enumerates the element symbols recognized when parsing a formula string.
 * Deuterium is listed as its own symbol since it commonly appears as "D" in supplier catalogs.
 */
public enum ElementSymbol {
  ACTINIUM("Ac", "actinium"),
  SILVER("Ag", "silver"),
  ALUMINIUM("Al", "aluminium"),
  AMERICIUM("Am", "americium"),
  ARGON("Ar", "argon"),
  ARSENIC("As", "arsenic"),
  ASTATINE("At", "astatine"),
  GOLD("Au", "gold"),
  BORON("B", "boron"),
  BARIUM("Ba", "barium"),
  BERYLLIUM("Be", "beryllium"),
  BOHRIUM("Bh", "bohrium"),
  BISMUTH("Bi", "bismuth"),
  BERKELIUM("Bk", "berkelium"),
  BROMINE("Br", "bromine"),
  CARBON("C", "carbon"),
  CALCIUM("Ca", "calcium"),
  CADMIUM("Cd", "cadmium"),
  CERIUM("Ce", "cerium"),
  CALIFORNIUM("Cf", "californium"),
  CHLORINE("Cl", "chlorine"),
  CURIUM("Cm", "curium"),
  COPERNICIUM("Cn", "copernicium"),
  COBALT("Co", "cobalt"),
  CHROMIUM("Cr", "chromium"),
  CAESIUM("Cs", "caesium"),
  COPPER("Cu", "copper"),
  DEUTERIUM("D", "deuterium"),
  DUBNIUM("Db", "dubnium"),
  DARMSTADTIUM("Ds", "darmstadtium"),
  DYSPROSIUM("Dy", "dysprosium"),
  ERBIUM("Er", "erbium"),
  EINSTEINIUM("Es", "einsteinium"),
  EUROPIUM("Eu", "europium"),
  FLUORINE("F", "fluorine"),
  IRON("Fe", "iron"),
  FERMIUM("Fm", "fermium"),
  FRANCIUM("Fr", "francium"),
  GALLIUM("Ga", "gallium"),
  GADOLINIUM("Gd", "gadolinium"),
  GERMANIUM("Ge", "germanium"),
  HYDROGEN("H", "hydrogen"),
  HELIUM("He", "helium"),
  HAFNIUM("Hf", "hafnium"),
  MERCURY("Hg", "mercury"),
  HOLMIUM("Ho", "holmium"),
  HASSIUM("Hs", "hassium"),
  IODINE("I", "iodine"),
  INDIUM("In", "indium"),
  IRIDIUM("Ir", "iridium"),
  POTASSIUM("K", "potassium"),
  KRYPTON("Kr", "krypton"),
  LANTHANUM("La", "lanthanum"),
  LITHIUM("Li", "lithium"),
  LAWRENCIUM("Lr", "lawrencium"),
  LUTETIUM("Lu", "lutetium"),
  MENDELEVIUM("Md", "mendelevium"),
  MAGNESIUM("Mg", "magnesium"),
  MANGANESE("Mn", "manganese"),
  MOLYBDENUM("Mo", "molybdenum"),
  MEITNERIUM("Mt", "meitnerium"),
  NITROGEN("N", "nitrogen"),
  SODIUM("Na", "sodium"),
  NIOBIUM("Nb", "niobium"),
  NEODYMIUM("Nd", "neodymium"),
  NEON("Ne", "neon"),
  NICKEL("Ni", "nickel"),
  NOBELIUM("No", "nobelium"),
  NEPTUNIUM("Np", "neptunium"),
  OXYGEN("O", "oxygen"),
  OSMIUM("Os", "osmium"),
  PHOSPHORUS("P", "phosphorus"),
  PROTACTINIUM("Pa", "protactinium"),
  LEAD("Pb", "lead"),
  PALLADIUM("Pd", "palladium"),
  PROMETHIUM("Pm", "promethium"),
  POLONIUM("Po", "polonium"),
  PRASEODYMIUM("Pr", "praseodymium"),
  PLATINUM("Pt", "platinum"),
  PLUTONIUM("Pu", "plutonium"),
  RADIUM("Ra", "radium"),
  RUBIDIUM("Rb", "rubidium"),
  RHENIUM("Re", "rhenium"),
  RUTHERFORDIUM("Rf", "rutherfordium"),
  ROENTGENIUM("Rg", "roentgenium"),
  RHODIUM("Rh", "rhodium"),
  RADON("Rn", "radon"),
  RUTHENIUM("Ru", "ruthenium"),
  SULFUR("S", "sulfur"),
  ANTIMONY("Sb", "antimony"),
  SCANDIUM("Sc", "scandium"),
  SELENIUM("Se", "selenium"),
  SEABORGIUM("Sg", "seaborgium"),
  SILICON("Si", "silicon"),
  SAMARIUM("Sm", "samarium"),
  TIN("Sn", "tin"),
  STRONTIUM("Sr", "strontium"),
  TANTALUM("Ta", "tantalum"),
  TERBIUM("Tb", "terbium"),
  TECHNETIUM("Tc", "technetium"),
  TELLURIUM("Te", "tellurium"),
  THORIUM("Th", "thorium"),
  TITANIUM("Ti", "titanium"),
  THALLIUM("Tl", "thallium"),
  THULIUM("Tm", "thulium"),
  URANIUM("U", "uranium"),
  VANADIUM("V", "vanadium"),
  TUNGSTEN("W", "tungsten"),
  XENON("Xe", "xenon"),
  YTTRIUM("Y", "yttrium"),
  YTTERBIUM("Yb", "ytterbium"),
  ZINC("Zn", "zinc"),
  ZIRCONIUM("Zr", "zirconium"),
  ;

  // Filled once when the enum class is initialized, read-only afterwards.
  private static final Map<String, ElementSymbol> BY_SYMBOL;
  static {
    Map<String, ElementSymbol> bySymbol = new HashMap<>(values().length * 2);
    for (ElementSymbol element : values()) {
      bySymbol.put(element.getSymbol(), element);
    }
    BY_SYMBOL = Collections.unmodifiableMap(bySymbol);
  }

  private String symbol;
  private String elementName;

  ElementSymbol(String symbol, String elementName) {
    this.symbol = symbol;
    this.elementName = elementName;
  }

  public String getSymbol() {
    return this.symbol;
  }

  public String getElementName() {
    return this.elementName;
  }

  public static boolean isKnownSymbol(String symbol) {
    return BY_SYMBOL.containsKey(symbol);
  }

  /**
   * Looks up an element by its case-sensitive symbol ("Co" is cobalt, "CO" is not a symbol).
   * @param symbol a one or two letter symbol
   * @return the matching element, or empty if the symbol is not in the table
   */
  public static Optional<ElementSymbol> fromSymbol(String symbol) {
    return Optional.ofNullable(BY_SYMBOL.get(symbol));
  }
}
