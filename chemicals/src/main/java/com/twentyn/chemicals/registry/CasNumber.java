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

package com.twentyn.chemicals.registry;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates CAS Registry Numbers, see https://en.wikipedia.org/wiki/CAS_Registry_Number.
 * A CAS number is made of three digit groups, for example 10028-18-9: 2 to 7 digits, then 2 digits, then the check
 * digit.  Starting from the rightmost digit before the check digit, each digit is weighted by its position (1, 2, 3...)
 * and the sum modulo 10 must equal the check digit.
 */
public class CasNumber {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CasNumber.class);

  private static final Pattern CAS_NUMBER_PATTERN =
      Pattern.compile("^(?<group1>[0-9]{2,7})-(?<group2>[0-9]{2})-(?<checkdigit>[0-9])$");

  private CasNumber() {
  }

  /**
   * Check if a string is a valid CAS number.
   * @param number the candidate, surrounding whitespace is ignored
   * @return true if the check digit matches, false otherwise
   * @throws RegistryNumberException if the string is not made of the expected digit groups
   */
  public static boolean isValid(String number) throws RegistryNumberException {
    String cleaned = StringUtils.normalizeSpace(number);
    Matcher matcher = cleaned == null ? null : CAS_NUMBER_PATTERN.matcher(cleaned);
    if (matcher == null || !matcher.matches()) {
      throw new RegistryNumberException(RegistryNumberException.Reason.DIGIT_GROUPS_NOT_FOUND,
          String.format("can not capture digit groups in CAS number %s", number));
    }

    String group1 = matcher.group("group1");
    String group2 = matcher.group("group2");
    int checkDigit = Character.digit(matcher.group("checkdigit").charAt(0), 10);
    LOGGER.debug("group1: %s - group2: %s - check digit: %d", group1, group2, checkDigit);

    // The weights grow from right to left, group 2 first.
    String digits = StringUtils.reverse(group1 + group2);
    int total = 0;
    for (int i = 0; i < digits.length(); i++) {
      total += (i + 1) * Character.digit(digits.charAt(i), 10);
    }

    int modulo = total % 10;
    LOGGER.debug("modulo: %d", modulo);
    return modulo == checkDigit;
  }
}
