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

package com.twentyn.chemicals.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The outcome of normalizing one input formula: either an empirical formula or the reason it could not be parsed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NormalizationResult {
  @JsonProperty("formula")
  private String formula;

  @JsonProperty("empirical_formula")
  private String empiricalFormula;

  @JsonProperty("error")
  private String error;

  // Required by Jackson.
  private NormalizationResult() {
  }

  public NormalizationResult(String formula, String empiricalFormula, String error) {
    this.formula = formula;
    this.empiricalFormula = empiricalFormula;
    this.error = error;
  }

  public static NormalizationResult success(String formula, String empiricalFormula) {
    return new NormalizationResult(formula, empiricalFormula, null);
  }

  public static NormalizationResult failure(String formula, String error) {
    return new NormalizationResult(formula, null, error);
  }

  public String getFormula() {
    return formula;
  }

  public String getEmpiricalFormula() {
    return empiricalFormula;
  }

  public String getError() {
    return error;
  }

  @JsonIgnore
  public boolean isSuccess() {
    return error == null;
  }
}
