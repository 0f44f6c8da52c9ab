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
package us.blanshard.refine.stats;

import static java.nio.charset.StandardCharsets.UTF_8;

import us.blanshard.refine.core.Puzzle;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import com.google.common.io.Resources;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads puzzle files: a json array of objects, each with a "name" and nine
 * "rows" of nine digits, 0 for unknown.  Solution files use the same format.
 */
public class PuzzleFile {
  private static final Logger logger = Logger.getLogger(PuzzleFile.class.getName());

  private static final Gson GSON = new Gson();
  private static final Type ENTRIES_TYPE = new TypeToken<List<Entry>>(){}.getType();

  private static class Entry {
    String name;
    int[][] rows;
  }

  /** Reads puzzles from the given file. */
  public static ImmutableList<Puzzle> read(File file) throws IOException {
    logger.info("Reading puzzles from " + file);
    try (Reader reader = Files.newReader(file, UTF_8)) {
      return read(reader);
    }
  }

  /** Reads puzzles from a resource bundled next to this class. */
  public static ImmutableList<Puzzle> readResource(String name) throws IOException {
    logger.info("Reading puzzles from resource " + name);
    try (Reader reader =
             Resources.asCharSource(Resources.getResource(PuzzleFile.class, name), UTF_8)
                 .openStream()) {
      return read(reader);
    }
  }

  /**
   * Reads puzzles from the given json source.
   *
   * @throws JsonParseException if the json is malformed or an entry lacks a
   *     name or rows
   */
  public static ImmutableList<Puzzle> read(Reader reader) {
    List<Entry> entries = GSON.fromJson(reader, ENTRIES_TYPE);
    if (entries == null) throw new JsonParseException("No puzzles found");
    ImmutableList.Builder<Puzzle> builder = ImmutableList.builder();
    for (Entry entry : entries) {
      if (entry == null || entry.name == null || entry.rows == null)
        throw new JsonParseException("Each puzzle needs a name and rows");
      builder.add(Puzzle.of(entry.name, entry.rows));
    }
    return builder.build();
  }
}
