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
package us.blanshard.crossword.output;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Variable;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.Map;

/**
 * Static methods that convert filled-in crosswords to and from json.
 *
 * @author Luke Blanshard
 */
public class CrosswordJson {

  /** A Gson that knows how to read and write {@link Variable}s. */
  public static final Gson GSON = register(new GsonBuilder()).setPrettyPrinting().create();

  /**
   * Registers type adapters in the given builder so that variables can be
   * serialized and deserialized.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    builder.registerTypeAdapter(Variable.class, new TypeAdapter<Variable>() {
      @Override public void write(JsonWriter out, Variable value) throws IOException {
        out.beginObject();
        out.name("row").value(value.row);
        out.name("column").value(value.column);
        out.name("direction").value(value.direction.name());
        out.name("length").value(value.length);
        out.endObject();
      }
      @Override public Variable read(JsonReader in) throws IOException {
        int row = -1, column = -1, length = -1;
        Variable.Direction direction = null;
        in.beginObject();
        while (in.hasNext()) {
          String name = in.nextName();
          if (name.equals("row")) {
            row = in.nextInt();
          } else if (name.equals("column")) {
            column = in.nextInt();
          } else if (name.equals("direction")) {
            direction = Variable.Direction.valueOf(in.nextString());
          } else if (name.equals("length")) {
            length = in.nextInt();
          } else {
            in.skipValue();
          }
        }
        in.endObject();
        return Variable.of(row, column, direction, length);
      }
    });
    return builder;
  }

  /**
   * Produces the json form of a solution: the grid's dimensions plus one
   * entry per variable, in variable order, each giving the variable and its
   * word.
   */
  public static String toJson(Crossword crossword, Map<Variable, String> solution) {
    return GSON.toJson(toJsonTree(crossword, solution));
  }

  public static JsonObject toJsonTree(Crossword crossword, Map<Variable, String> solution) {
    JsonObject object = new JsonObject();
    object.addProperty("height", crossword.height);
    object.addProperty("width", crossword.width);
    JsonArray entries = new JsonArray();
    for (Variable var : ImmutableSortedSet.copyOf(solution.keySet())) {
      JsonObject entry = GSON.toJsonTree(var, Variable.class).getAsJsonObject();
      entry.addProperty("word", solution.get(var));
      entries.add(entry);
    }
    object.add("entries", entries);
    return object;
  }

  /**
   * Reads back the variable-to-word mapping from the output of
   * {@link #toJson}.
   */
  public static ImmutableMap<Variable, String> fromJson(String json) {
    JsonObject object = JsonParser.parseString(json).getAsJsonObject();
    ImmutableMap.Builder<Variable, String> builder = ImmutableMap.builder();
    for (JsonElement element : object.getAsJsonArray("entries")) {
      JsonObject entry = element.getAsJsonObject();
      builder.put(GSON.fromJson(entry, Variable.class), entry.get("word").getAsString());
    }
    return builder.build();
  }

  // Static methods only.
  private CrosswordJson() {}
}
