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
 * Thrown when a formula string cannot be turned into an empirical formula.  No partial result is ever returned.
 */
public class FormulaParseException extends Exception {

  public enum Reason {
    UNBALANCED_GROUP("unbalanced parenthesis"),
    UNKNOWN_ATOM("unknown atom"),
    NUMBER_WITHOUT_CONTEXT("found a number with no atom or group before it"),
    NUMBER_PARSE_FAULT("can not convert count"),
    COUNT_OVERFLOW("atom count is too large"),
    INTERNAL_AGGREGATION_FAULT("unexpected state while summing atom counts"),
    ;

    private String description;

    Reason(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

  private Reason reason;
  private String token;
  private int position;

  public FormulaParseException(Reason reason, String token, int position) {
    super(buildMessage(reason, token, position));
    this.reason = reason;
    this.token = token;
    this.position = position;
  }

  public FormulaParseException(Reason reason, String token, int position, Throwable cause) {
    super(buildMessage(reason, token, position), cause);
    this.reason = reason;
    this.token = token;
    this.position = position;
  }

  public Reason getReason() {
    return reason;
  }

  /**
   * @return the offending token, or null when the failure is not tied to one
   */
  public String getToken() {
    return token;
  }

  /**
   * @return the cursor position in the input, or -1 when the failure happened after scanning
   */
  public int getPosition() {
    return position;
  }

  private static String buildMessage(Reason reason, String token, int position) {
    StringBuilder builder = new StringBuilder(reason.getDescription());
    if (token != null) {
      builder.append(": ").append(token);
    }
    if (position >= 0) {
      builder.append(" at position ").append(position);
    }
    return builder.toString();
  }
}
