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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.twentyn.chemicals.formula.FormulaNormalizer;
import com.twentyn.chemicals.formula.FormulaParseException;
import com.twentyn.chemicals.formula.UnattachedCountPolicy;
import com.twentyn.chemicals.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes a column of formulae in a TSV file, so catalog entries written as structural formulae
 * (like "CH3CH2CH2Br") can be matched against entries written as empirical formulae (like "C3H7Br").
 * Rows that can't be parsed are kept in the output along with the parse error.
 */
public class FormulaTableNormalizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FormulaTableNormalizer.class);

  public static final String DEFAULT_FORMULA_HEADER = "formula";
  public static final String EMPIRICAL_FORMULA_HEADER = "empirical_formula";
  public static final String ERROR_HEADER = "error";

  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true).withHeader();

  private static final String OPTION_INPUT_FILE = "i";
  private static final String OPTION_OUTPUT_FILE = "o";
  private static final String OPTION_FORMULA_COLUMN = "c";
  private static final String OPTION_JSON_OUTPUT = "j";
  private static final String OPTION_LENIENT = "l";

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT_FILE)
        .argName("input file")
        .desc("A TSV file with a header row and a column of formulae to normalize")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT_FILE)
        .argName("output file")
        .desc("The file where normalized formulae are written")
        .hasArg().required()
        .longOpt("output")
    );
    add(Option.builder(OPTION_FORMULA_COLUMN)
        .argName("column name")
        .desc(String.format("The header of the column holding formulae, defaults to '%s'", DEFAULT_FORMULA_HEADER))
        .hasArg()
        .longOpt("column")
    );
    add(Option.builder(OPTION_JSON_OUTPUT)
        .argName("json")
        .desc("Write the results as a JSON array instead of a TSV")
        .longOpt("json")
    );
    add(Option.builder(OPTION_LENIENT)
        .argName("lenient")
        .desc("Skip counts that follow neither an atom nor a closing bracket instead of rejecting the formula")
        .longOpt("lenient")
    );
  }};

  private static final String HELP_MESSAGE = StringUtils.join(new String[] {
      "This class reads formulae from a TSV file, converts each of them to its empirical formula in Hill order ",
      "and writes the original formula, the empirical formula and any parse error to the output file."
  }, "");

  private FormulaNormalizer normalizer;
  private String formulaHeader;

  public FormulaTableNormalizer(FormulaNormalizer normalizer, String formulaHeader) {
    this.normalizer = normalizer;
    this.formulaHeader = formulaHeader;
  }

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(FormulaTableNormalizer.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    File inputFile = new File(cl.getOptionValue(OPTION_INPUT_FILE));
    if (!inputFile.isFile()) {
      cliUtil.failWithMessage("Input file %s does not exist or is not a regular file", inputFile.getPath());
    }
    File outputFile = new File(cl.getOptionValue(OPTION_OUTPUT_FILE));

    UnattachedCountPolicy policy =
        cl.hasOption(OPTION_LENIENT) ? UnattachedCountPolicy.IGNORE : UnattachedCountPolicy.REJECT;
    FormulaTableNormalizer tableNormalizer = new FormulaTableNormalizer(
        new FormulaNormalizer(policy), cl.getOptionValue(OPTION_FORMULA_COLUMN, DEFAULT_FORMULA_HEADER));

    LOGGER.info("Reading formulae from %s (column '%s', policy %s)",
        inputFile.getPath(), tableNormalizer.formulaHeader, policy);
    List<NormalizationResult> results;
    try (Reader reader = new FileReader(inputFile)) {
      results = tableNormalizer.normalizeTable(reader);
    }

    try (Writer writer = new FileWriter(outputFile)) {
      if (cl.hasOption(OPTION_JSON_OUTPUT)) {
        writeJson(results, writer);
      } else {
        writeTsv(results, writer);
      }
    }

    long failures = results.stream().filter(r -> !r.isSuccess()).count();
    LOGGER.info("Wrote %d results to %s, %d formulae could not be parsed", results.size(), outputFile.getPath(), failures);
  }

  /**
   * Normalizes a single raw value.  Whitespace is trimmed and collapsed before parsing.
   * @param rawFormula the value as found in the input, may be null
   * @return the result, never null
   */
  public NormalizationResult normalizeValue(String rawFormula) {
    String formula = StringUtils.normalizeSpace(rawFormula);
    if (StringUtils.isEmpty(formula)) {
      return NormalizationResult.failure(rawFormula, "empty formula");
    }

    try {
      return NormalizationResult.success(formula, normalizer.normalize(formula));
    } catch (FormulaParseException e) {
      LOGGER.warn("Could not parse formula %s: %s", formula, e.getMessage());
      return NormalizationResult.failure(formula, e.getMessage());
    }
  }

  /**
   * Reads a TSV with a header row and normalizes the formula column of every row.
   * @param reader the TSV contents
   * @return one result per data row, in input order
   * @throws IOException if the input can't be read
   * @throws IllegalArgumentException if the formula column is missing from the header
   */
  public List<NormalizationResult> normalizeTable(Reader reader) throws IOException {
    List<NormalizationResult> results = new ArrayList<>();
    try (CSVParser parser = new CSVParser(reader, TSV_FORMAT)) {
      if (!parser.getHeaderMap().containsKey(formulaHeader)) {
        String msg = String.format("Input did not contain the expected formula header: %s", formulaHeader);
        LOGGER.error(msg);
        throw new IllegalArgumentException(msg);
      }

      for (CSVRecord record : parser) {
        String value = record.isSet(formulaHeader) ? record.get(formulaHeader) : null;
        results.add(normalizeValue(value));

        if (results.size() % 100000 == 0) {
          LOGGER.info("Formulae processed so far: %d", results.size());
        }
      }
    }
    return results;
  }

  public static void writeTsv(List<NormalizationResult> results, Writer writer) throws IOException {
    CSVPrinter printer = new CSVPrinter(writer,
        TSV_FORMAT.withHeader(DEFAULT_FORMULA_HEADER, EMPIRICAL_FORMULA_HEADER, ERROR_HEADER));
    for (NormalizationResult result : results) {
      printer.printRecord(
          StringUtils.defaultString(result.getFormula()),
          StringUtils.defaultString(result.getEmpiricalFormula()),
          StringUtils.defaultString(result.getError()));
    }
    printer.flush();
  }

  public static void writeJson(List<NormalizationResult> results, Writer writer) throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.writeValue(writer, results);
  }
}
