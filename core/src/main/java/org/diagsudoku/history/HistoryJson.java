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
package org.diagsudoku.history;

import com.google.common.collect.Lists;
import com.google.common.reflect.TypeToken;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import org.diagsudoku.core.Board;
import org.diagsudoku.core.Candidates;
import org.diagsudoku.core.Cell;
import org.diagsudoku.core.Step;

import java.io.IOException;
import java.io.Writer;
import java.lang.reflect.Type;
import java.util.List;

/**
 * Static methods that convert assignment histories to and from json, for
 * step-by-step viewers living outside this program.
 *
 * <p> A history is an array of steps.  Each step is an object with the name of
 * the cell, its new candidates as a string of digits, and the board at that
 * moment as an array of 81 such strings in row-major order:
 *
 * <pre>
 *   [{"cell":"A1","candidates":"2","board":["2","123456789",...]}, ...]
 * </pre>
 */
public class HistoryJson {

  // Declared ahead of HISTORY_GSON, which registers them.
  private static final TypeAdapter<Cell> CELL_ADAPTER = new TypeAdapter<Cell>() {
    @Override public void write(JsonWriter out, Cell value) throws IOException {
      out.value(value.name);
    }
    @Override public Cell read(JsonReader in) throws IOException {
      String name = in.nextString();
      try {
        return Cell.of(name);
      } catch (IllegalArgumentException e) {
        throw new JsonParseException(e.getMessage(), e);
      }
    }
  };

  private static final TypeAdapter<Candidates> CANDIDATES_ADAPTER = new TypeAdapter<Candidates>() {
    @Override public void write(JsonWriter out, Candidates value) throws IOException {
      out.value(value.toDigits());
    }
    @Override public Candidates read(JsonReader in) throws IOException {
      String digits = in.nextString();
      try {
        return Candidates.fromDigits(digits);
      } catch (IllegalArgumentException e) {
        throw new JsonParseException(e.getMessage(), e);
      }
    }
  };

  private static final TypeAdapter<Board> BOARD_ADAPTER = new TypeAdapter<Board>() {
    @Override public void write(JsonWriter out, Board value) throws IOException {
      out.beginArray();
      for (Cell cell : Cell.all())
        CANDIDATES_ADAPTER.write(out, value.get(cell));
      out.endArray();
    }
    @Override public Board read(JsonReader in) throws IOException {
      Board.Builder builder = Board.builder();
      int index = 0;
      in.beginArray();
      while (in.hasNext()) {
        Candidates candidates = CANDIDATES_ADAPTER.read(in);
        if (index >= Cell.COUNT)
          throw new JsonParseException("Too many cells in board at " + in.getPath());
        builder.set(Cell.of(index++), candidates);
      }
      in.endArray();
      if (index != Cell.COUNT)
        throw new JsonParseException("Expected " + Cell.COUNT + " cells in board, got " + index);
      return builder.build();
    }
  };

  private static final TypeAdapter<Step> STEP_ADAPTER = new TypeAdapter<Step>() {
    @Override public void write(JsonWriter out, Step value) throws IOException {
      out.beginObject();
      out.name("cell");
      CELL_ADAPTER.write(out, value.cell);
      out.name("candidates");
      CANDIDATES_ADAPTER.write(out, value.candidates);
      out.name("board");
      BOARD_ADAPTER.write(out, value.board);
      out.endObject();
    }
    @Override public Step read(JsonReader in) throws IOException {
      Cell cell = null;
      Candidates candidates = null;
      Board board = null;
      in.beginObject();
      while (in.hasNext()) {
        String name = in.nextName();
        if (name.equals("cell")) cell = CELL_ADAPTER.read(in);
        else if (name.equals("candidates")) candidates = CANDIDATES_ADAPTER.read(in);
        else if (name.equals("board")) board = BOARD_ADAPTER.read(in);
        else in.skipValue();
      }
      in.endObject();
      if (cell == null || candidates == null || board == null)
        throw new JsonParseException("Incomplete step at " + in.getPath());
      return new Step(cell, candidates, board);
    }
  };

  /** A Type to use with {@link Gson} for lists of steps. */
  @SuppressWarnings("serial")
  public static final Type STEPS_TYPE = new TypeToken<List<Step>>(){}.getType();

  /** A convenience for reading/writing histories. */
  public static final Gson HISTORY_GSON = register(new GsonBuilder()).create();

  /**
   * Registers type adapters in the given builder so that cells, candidates,
   * boards and steps can be serialized and deserialized.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    builder.registerTypeAdapter(Cell.class, CELL_ADAPTER);
    builder.registerTypeAdapter(Candidates.class, CANDIDATES_ADAPTER);
    builder.registerTypeAdapter(Board.class, BOARD_ADAPTER);
    builder.registerTypeAdapter(Step.class, STEP_ADAPTER);
    return builder;
  }

  /** Converts the given history to json. */
  public static String toJson(AssignmentLog log) {
    return HISTORY_GSON.toJson(log.getSteps(), STEPS_TYPE);
  }

  /** Writes the given history as json to the given writer, and flushes it. */
  public static void write(AssignmentLog log, Writer writer) throws IOException {
    JsonWriter out = new JsonWriter(writer);
    out.beginArray();
    for (Step step : log.getSteps())
      STEP_ADAPTER.write(out, step);
    out.endArray();
    out.flush();
  }

  /**
   * Reads a history back from json.
   *
   * @throws JsonParseException if the json isn't a well-formed history
   */
  public static AssignmentLog fromJson(String json) {
    List<Step> steps = HISTORY_GSON.fromJson(json, STEPS_TYPE);
    if (steps == null)
      throw new JsonParseException("No history in " + json);
    return new AssignmentLog(Lists.newArrayList(steps));
  }
}
