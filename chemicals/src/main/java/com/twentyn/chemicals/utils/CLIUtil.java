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

package com.twentyn.chemicals.utils;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Shared command line handling for the tools in this project: builds the options, adds a help flag, prints usage
 * and exits when arguments are wrong.
 */
public class CLIUtil {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CLIUtil.class);

  public static final String OPTION_HELP = "h";

  public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();
  static {
    HELP_FORMATTER.setWidth(100);
  }

  private Class<?> callingClass;
  private String helpMessage;
  private Options opts;
  private CommandLine commandLine;

  public CLIUtil(Class<?> callingClass, String helpMessage, List<Option.Builder> optionBuilders) {
    this.callingClass = callingClass;
    this.helpMessage = helpMessage;

    opts = new Options();
    for (Option.Builder b : optionBuilders) {
      opts.addOption(b.build());
    }
    opts.addOption(Option.builder(OPTION_HELP)
        .argName("help")
        .desc("Prints this help message")
        .longOpt("help")
        .build()
    );
  }

  public Options getOptions() {
    return opts;
  }

  /**
   * Parses arguments without exiting, so callers (and tests) can decide what to do on failure.
   */
  public CommandLine tryParseCommandLine(String[] args) throws ParseException {
    CommandLineParser parser = new DefaultParser();
    commandLine = parser.parse(opts, args);
    return commandLine;
  }

  public CommandLine parseCommandLine(String[] args) {
    // Look for --help first so it works even when required options are missing.
    for (String arg : args) {
      if (arg.equals("-" + OPTION_HELP) || arg.equals("--help")) {
        printHelp();
        System.exit(0);
      }
    }

    try {
      return tryParseCommandLine(args);
    } catch (ParseException e) {
      LOGGER.error("Argument parsing failed: %s", e.getMessage());
      printHelp();
      System.exit(1);
      return null;
    }
  }

  public CommandLine getCommandLine() {
    return this.commandLine;
  }

  public void printHelp() {
    HELP_FORMATTER.printHelp(callingClass.getCanonicalName(), helpMessage, opts, null, true);
  }

  public void failWithMessage(String formatStr, Object... args) {
    LOGGER.error(formatStr, args);
    printHelp();
    System.exit(1);
  }
}
