/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.crossword.tools;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.logging.Level.SEVERE;
import static java.util.logging.Level.WARNING;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Result;
import us.blanshard.crossword.core.Solver;
import us.blanshard.crossword.output.CrosswordJson;
import us.blanshard.crossword.output.LetterGrid;

import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Fills in a crossword from a structure file and a words file, prints the
 * result, and optionally saves it as text or json.
 *
 * @author Luke Blanshard
 */
public class Generate {
  private static final Logger logger = Logger.getLogger(Generate.class.getName());

  static final int EXIT_USAGE = 1;
  static final int EXIT_IO = 2;

  public static void main(String[] args) {
    configureLogging();
    int status = run(args, System.out, System.err);
    if (status != 0) System.exit(status);
  }

  /**
   * Does the work of {@link #main}, returning the process exit status.
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length < 2 || args.length > 3) {
      err.println("Usage: Generate <structure> <words> [<output>]");
      return EXIT_USAGE;
    }
    File structureFile = new File(args[0]);
    File wordsFile = new File(args[1]);
    File outputFile = args.length > 2 ? new File(args[2]) : null;

    Crossword crossword;
    try {
      crossword = Crossword.load(structureFile, wordsFile);
    } catch (IOException e) {
      logger.log(SEVERE, "Unable to read puzzle input", e);
      err.println("Unable to read input: " + e.getMessage());
      return EXIT_IO;
    } catch (IllegalArgumentException e) {
      err.println("Bad crossword structure: " + e.getMessage());
      return EXIT_USAGE;
    }

    Result result = Solver.solve(crossword);
    if (!result.isSolved()) {
      out.println("No solution.");
      return 0;
    }

    LetterGrid grid = LetterGrid.of(crossword, result.getSolution());
    out.print(grid);

    if (outputFile != null) {
      String contents = outputFile.getName().endsWith(".json")
          ? CrosswordJson.toJson(crossword, result.getSolution())
          : grid.toString();
      try {
        Files.asCharSink(outputFile, UTF_8).write(contents);
      } catch (IOException e) {
        logger.log(SEVERE, "Unable to write " + outputFile, e);
        err.println("Unable to write output: " + e.getMessage());
        return EXIT_IO;
      }
    }
    return 0;
  }

  private static void configureLogging() {
    InputStream in = Generate.class.getResourceAsStream("/logging.properties");
    if (in == null) return;
    try {
      try {
        LogManager.getLogManager().readConfiguration(in);
      } finally {
        in.close();
      }
    } catch (IOException e) {
      logger.log(WARNING, "Unable to read logging configuration", e);
    }
  }
}
