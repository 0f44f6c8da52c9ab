package us.blanshard.refine.stats;

import static org.junit.Assert.assertEquals;

import us.blanshard.refine.core.Puzzle;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonParseException;

import org.junit.Test;

import java.io.StringReader;
import java.util.List;

public class PuzzleFileTest {

  private static String rows(String flat) {
    StringBuilder sb = new StringBuilder("[");
    for (int r = 0; r < 9; ++r) {
      if (r > 0) sb.append(',');
      sb.append('[');
      sb.append(Joiner.on(',').join(flat.substring(r * 9, r * 9 + 9).split("")));
      sb.append(']');
    }
    return sb.append(']').toString();
  }

  private static final String FLAT =
      "020000000000600003074080000000003002080040010600500000000010780500009000000000040";

  @Test public void readsNamesAndDigits() {
    String json = "[{\"name\": \"wildcat\", \"rows\": " + rows(FLAT) + "}]";
    List<Puzzle> puzzles = PuzzleFile.read(new StringReader(json));
    assertEquals(ImmutableList.of(Puzzle.fromString("wildcat", FLAT)), puzzles);
    assertEquals("wildcat", puzzles.get(0).name);
    assertEquals(2, puzzles.get(0).get(0, 1));
    assertEquals(0, puzzles.get(0).get(0, 0));
  }

  @Test public void emptyArray() {
    assertEquals(ImmutableList.of(), PuzzleFile.read(new StringReader("[]")));
  }

  @Test(expected = JsonParseException.class)
  public void missingName() {
    PuzzleFile.read(new StringReader("[{\"rows\": " + rows(FLAT) + "}]"));
  }

  @Test(expected = JsonParseException.class)
  public void missingRows() {
    PuzzleFile.read(new StringReader("[{\"name\": \"x\"}]"));
  }

  @Test(expected = JsonParseException.class)
  public void malformedJson() {
    PuzzleFile.read(new StringReader("[{\"name\": "));
  }

  @Test(expected = JsonParseException.class)
  public void emptyInput() {
    PuzzleFile.read(new StringReader(""));
  }

  @Test(expected = IllegalArgumentException.class)
  public void shortRow() {
    PuzzleFile.read(new StringReader("[{\"name\": \"x\", \"rows\": [[1, 2, 3]]}]"));
  }

  @Test public void bundledPuzzlesMatchSolutions() throws Exception {
    List<Puzzle> puzzles = PuzzleFile.readResource(Benchmarks.PUZZLES_RESOURCE);
    List<Puzzle> solutions = PuzzleFile.readResource(Benchmarks.SOLUTIONS_RESOURCE);
    assertEquals(5, puzzles.size());
    assertEquals(puzzles.size(), solutions.size());
    for (int i = 0; i < puzzles.size(); ++i) {
      assertEquals(puzzles.get(i).name, solutions.get(i).name);
      assertEquals(81, solutions.get(i).clueCount());
    }
    assertEquals(Puzzle.fromString("wildcat", FLAT), puzzles.get(0));
  }
}
