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
 * Validates European Community (EC) numbers, see https://en.wikipedia.org/wiki/European_Community_number.
 * An EC number looks like 214-480-6.  The six leading digits are weighted 1 to 6 from left to right and the sum
 * modulo 11 must equal the check digit.
 */
public class EcNumber {
  private static final Logger LOGGER = LogManager.getFormatterLogger(EcNumber.class);

  private static final Pattern EC_NUMBER_PATTERN =
      Pattern.compile("^(?<group1>[0-9]{3})-(?<group2>[0-9]{3})-(?<checkdigit>[0-9])$");

  private EcNumber() {
  }

  /**
   * Check if a string is a valid EC number.
   * @param number the candidate, surrounding whitespace is ignored
   * @return true if the check digit matches, false otherwise
   * @throws RegistryNumberException if the string is not made of the expected digit groups
   */
  public static boolean isValid(String number) throws RegistryNumberException {
    String cleaned = StringUtils.normalizeSpace(number);
    Matcher matcher = cleaned == null ? null : EC_NUMBER_PATTERN.matcher(cleaned);
    if (matcher == null || !matcher.matches()) {
      throw new RegistryNumberException(RegistryNumberException.Reason.DIGIT_GROUPS_NOT_FOUND,
          String.format("can not capture digit groups in EC number %s", number));
    }

    String digits = matcher.group("group1") + matcher.group("group2");
    int checkDigit = Character.digit(matcher.group("checkdigit").charAt(0), 10);

    int total = 0;
    for (int i = 0; i < digits.length(); i++) {
      total += (i + 1) * Character.digit(digits.charAt(i), 10);
    }

    // A remainder of 10 can't match a single check digit, such numbers are never valid.
    int modulo = total % 11;
    LOGGER.debug("digits: %s - check digit: %d - modulo: %d", digits, checkDigit, modulo);
    return modulo == checkDigit;
  }
}
